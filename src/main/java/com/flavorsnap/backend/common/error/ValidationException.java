package com.flavorsnap.backend.common.error;

public class ValidationException extends PipelineException {

    public ValidationException(String code, String message) {
        super(ErrorKind.VALIDATION_ERROR, code, message);
    }

    public ValidationException(String code) {
        this(code, code);
    }
}
