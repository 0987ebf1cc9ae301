package com.id.fieldbridge.modules.sink.model;

import java.util.List;
import java.util.Optional;

/**
 * Per-sink outcome of one commit. Sinks are written independently: any combination of written and failed
 * sinks is possible.
 */
public record CommitResult(String idempotencyKey, List<SinkWriteResult> results) {

    public CommitResult {
        results = List.copyOf(results);
    }

    public boolean isFullyWritten() {
        return results.stream().allMatch(SinkWriteResult::isWritten);
    }

    public boolean isAnyWritten() {
        return results.stream().anyMatch(SinkWriteResult::isWritten);
    }

    public Optional<SinkWriteResult> result(String sink) {
        return results.stream().filter(r -> r.sink().equals(sink)).findFirst();
    }
}
