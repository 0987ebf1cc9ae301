package com.id.fieldbridge.modules.subscription.model;

/**
 * A message as delivered by the transport, before decoding.
 *
 * @param id        transport message id, used to acknowledge it
 * @param duplicate true when the transport flags a redelivery
 */
public record InboundMessage(String topic, byte[] payload, int id, int qos, boolean duplicate) {
}
