package com.id.fieldbridge.modules.sink.model;

public enum SinkWriteStatus {
    WRITTEN,
    FAILED,
    TIMED_OUT
}
