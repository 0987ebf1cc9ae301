package com.id.fieldbridge.modules.decoder.model;

public enum DecodeErrorKind {
    UNKNOWN_TOPIC,
    MALFORMED_PAYLOAD
}
