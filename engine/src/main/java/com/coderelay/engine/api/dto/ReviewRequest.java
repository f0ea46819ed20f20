package com.coderelay.engine.api.dto;

/** Request body for approve / reject / comment. */
public record ReviewRequest(String reviewer, String body) {

    public ReviewRequest {
        if (reviewer == null || reviewer.isBlank()) reviewer = "reviewer";
    }
}
