package com.coderelay.engine.api.dto;

/** Request body naming the calling worker (claim, release, lease renewal, registration). */
public record WorkerRequest(String workerId) {
}
