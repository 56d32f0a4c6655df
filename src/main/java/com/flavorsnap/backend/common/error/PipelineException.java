package com.flavorsnap.backend.common.error;

/**
 * Base of every error the pipeline reports to callers.
 * <p>
 * {@code code} is a stable machine-readable identifier (e.g. {@code CATEGORY_NOT_FOUND});
 * {@code kind} decides the HTTP status and whether a retry makes sense.
 */
public abstract class PipelineException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;

    protected PipelineException(ErrorKind kind, String code, String message) {
        super(message == null || message.isBlank() ? code : message);
        this.kind = kind;
        this.code = code;
    }

    protected PipelineException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message == null || message.isBlank() ? code : message, cause);
        this.kind = kind;
        this.code = code;
    }

    public ErrorKind kind() { return kind; }
    public String code() { return code; }
}
