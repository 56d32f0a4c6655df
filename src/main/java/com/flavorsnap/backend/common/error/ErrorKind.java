package com.flavorsnap.backend.common.error;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    VOTING_CLOSED(HttpStatus.CONFLICT),
    INVALID_TRANSITION(HttpStatus.CONFLICT),
    STORAGE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus httpStatus;

    ErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus httpStatus() { return httpStatus; }

    /** 只有基礎設施錯誤值得 caller 退避重試 */
    public boolean retryable() { return this == STORAGE_UNAVAILABLE; }
}
