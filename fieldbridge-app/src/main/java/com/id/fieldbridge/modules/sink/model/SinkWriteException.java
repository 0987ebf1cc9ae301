package com.id.fieldbridge.modules.sink.model;

import lombok.Getter;

/**
 * Failure of a single sink write attempt. Retryable failures are attempted again with backoff, permanent
 * ones abandon the write for that sink.
 */
@Getter
public class SinkWriteException extends Exception {

    private final boolean retryable;

    public SinkWriteException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static SinkWriteException retryable(String message, Throwable cause) {
        return new SinkWriteException(message, true, cause);
    }

    public static SinkWriteException permanent(String message, Throwable cause) {
        return new SinkWriteException(message, false, cause);
    }
}
