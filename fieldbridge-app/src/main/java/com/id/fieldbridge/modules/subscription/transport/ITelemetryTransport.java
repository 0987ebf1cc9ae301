package com.id.fieldbridge.modules.subscription.transport;

import com.id.fieldbridge.modules.subscription.model.InboundMessage;

import java.util.List;
import java.util.function.Consumer;

/**
 * Publish/subscribe client the bridge reads sensor messages from.
 * <p>
 * Messages are delivered to the handler on transport threads and stay unacknowledged until
 * {@link #acknowledge(InboundMessage)} is called for them.
 */
public interface ITelemetryTransport {

    void connect() throws TransportException;

    void subscribe(List<String> topicFilters, Consumer<InboundMessage> handler) throws TransportException;

    void acknowledge(InboundMessage message) throws TransportException;

    void unsubscribe(List<String> topicFilters) throws TransportException;

    void disconnect() throws TransportException;

    boolean isConnected();

    /**
     * Handler invoked once per unexpected connection loss.
     */
    void onConnectionLost(Consumer<Throwable> handler);
}
