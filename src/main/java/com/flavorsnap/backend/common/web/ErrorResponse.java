package com.flavorsnap.backend.common.web;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String errorCode,      // 穩定代碼，client 用這個判斷
        String kind,           // VALIDATION_ERROR / NOT_FOUND / VOTING_CLOSED / INVALID_TRANSITION / STORAGE_UNAVAILABLE
        String message,
        String requestId,
        Integer retryAfterSec
) {
    public ErrorResponse(String errorCode, String kind, String message, String requestId) {
        this(errorCode, kind, message, requestId, null);
    }
}
