package com.id.fieldbridge.modules.sink.model;

import java.time.Duration;

/**
 * Outcome of writing one commit record to one sink, after all retries.
 *
 * @param error message of the last failure, null when written
 */
public record SinkWriteResult(String sink, SinkWriteStatus status, int attempts, String error, Duration duration) {

    public static SinkWriteResult written(String sink, int attempts, Duration duration) {
        return new SinkWriteResult(sink, SinkWriteStatus.WRITTEN, attempts, null, duration);
    }

    public static SinkWriteResult failed(String sink, int attempts, String error, Duration duration) {
        return new SinkWriteResult(sink, SinkWriteStatus.FAILED, attempts, error, duration);
    }

    public static SinkWriteResult timedOut(String sink, int attempts, Duration duration) {
        return new SinkWriteResult(sink, SinkWriteStatus.TIMED_OUT, attempts, "Write timeout exceeded", duration);
    }

    public boolean isWritten() {
        return status == SinkWriteStatus.WRITTEN;
    }
}
