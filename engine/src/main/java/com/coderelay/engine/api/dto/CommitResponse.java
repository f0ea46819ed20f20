package com.coderelay.engine.api.dto;

public record CommitResponse(String branch, String commitId) {
}
