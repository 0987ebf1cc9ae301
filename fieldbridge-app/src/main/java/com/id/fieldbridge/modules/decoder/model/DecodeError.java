package com.id.fieldbridge.modules.decoder.model;

public record DecodeError(DecodeErrorKind kind, String topic, String detail) {

    public static DecodeError unknownTopic(String topic) {
        return new DecodeError(DecodeErrorKind.UNKNOWN_TOPIC, topic, "No variant mapped to topic '%s'".formatted(topic));
    }

    public static DecodeError malformed(String topic, String detail) {
        return new DecodeError(DecodeErrorKind.MALFORMED_PAYLOAD, topic, detail);
    }
}
