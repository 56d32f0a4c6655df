package com.flavorsnap.backend.common.error;

/**
 * Infrastructure failure of a record store. Callers always see {@link #MESSAGE};
 * engine-specific text stays in the cause (logs only).
 */
public class StorageUnavailableException extends PipelineException {

    public static final String MESSAGE = "Storage temporarily unavailable, retry later";

    private final int retryAfterSec;

    public StorageUnavailableException(String code, Throwable cause) {
        super(ErrorKind.STORAGE_UNAVAILABLE, code, MESSAGE, cause);
        this.retryAfterSec = 1;
    }

    public StorageUnavailableException(String code) {
        this(code, null);
    }

    public int retryAfterSec() { return retryAfterSec; }
}
