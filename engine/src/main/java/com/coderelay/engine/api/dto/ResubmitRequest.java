package com.coderelay.engine.api.dto;

public record ResubmitRequest(String note) {
}
