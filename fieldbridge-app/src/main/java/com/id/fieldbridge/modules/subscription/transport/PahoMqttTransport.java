package com.id.fieldbridge.modules.subscription.transport;

import com.id.fieldbridge.modules.subscription.model.InboundMessage;
import com.id.fieldbridge.modules.subscription.model.TransportSettings;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * MQTT v3 transport on Eclipse Paho, with manual acknowledgement of QoS 1/2 deliveries.
 */
@Component
@Slf4j
public class PahoMqttTransport implements ITelemetryTransport {

    private final TransportSettings settings;

    private volatile MqttClient client;
    private volatile Consumer<InboundMessage> handler = message -> log.warn("Message on '{}' before subscription", message.topic());
    private volatile Consumer<Throwable> connectionLostHandler = cause -> log.warn("Connection lost: {}", cause.getMessage());

    public PahoMqttTransport(TransportSettings settings) {
        this.settings = settings;
    }

    @Override
    public synchronized void connect() throws TransportException {
        try {
            if (client == null) {
                client = new MqttClient(settings.getBrokerUrl(), settings.getClientId(), new MemoryPersistence());
                client.setManualAcks(true);
                client.setCallback(new Callback());
            }
            if (client.isConnected()) {
                return;
            }
            log.debug("Connecting to MQTT broker at {} as {}", settings.getBrokerUrl(), settings.getClientId());
            client.connect(connectOptions());
            log.info("Connected to MQTT broker at {}", settings.getBrokerUrl());
        } catch (MqttException | IllegalArgumentException e) {
            throw new TransportException("Failed to connect to %s".formatted(settings.getBrokerUrl()), e);
        }
    }

    @Override
    public synchronized void subscribe(List<String> topicFilters, Consumer<InboundMessage> handler) throws TransportException {
        var current = requireClient();
        this.handler = handler;
        String[] filters = topicFilters.toArray(String[]::new);
        int[] qos = new int[filters.length];
        Arrays.fill(qos, settings.getQos());
        try {
            current.subscribe(filters, qos);
            log.info("Subscribed to {} with QoS {}", topicFilters, settings.getQos());
        } catch (MqttException e) {
            throw new TransportException("Failed to subscribe to %s".formatted(topicFilters), e);
        }
    }

    @Override
    public void acknowledge(InboundMessage message) throws TransportException {
        if (message.qos() == 0) {
            return;
        }
        try {
            requireClient().messageArrivedComplete(message.id(), message.qos());
        } catch (MqttException e) {
            throw new TransportException("Failed to acknowledge message %d on '%s'".formatted(message.id(), message.topic()), e);
        }
    }

    @Override
    public synchronized void unsubscribe(List<String> topicFilters) throws TransportException {
        if (!isConnected()) {
            return;
        }
        try {
            client.unsubscribe(topicFilters.toArray(String[]::new));
            log.info("Unsubscribed from {}", topicFilters);
        } catch (MqttException e) {
            throw new TransportException("Failed to unsubscribe from %s".formatted(topicFilters), e);
        }
    }

    @Override
    public synchronized void disconnect() throws TransportException {
        if (client == null) {
            return;
        }
        try {
            if (client.isConnected()) {
                client.disconnect();
                log.info("Disconnected from MQTT broker at {}", settings.getBrokerUrl());
            }
        } catch (MqttException e) {
            throw new TransportException("Failed to disconnect from %s".formatted(settings.getBrokerUrl()), e);
        }
    }

    @Override
    public boolean isConnected() {
        var current = client;
        return current != null && current.isConnected();
    }

    @Override
    public void onConnectionLost(Consumer<Throwable> handler) {
        this.connectionLostHandler = handler;
    }

    private MqttConnectOptions connectOptions() {
        var options = new MqttConnectOptions();
        options.setCleanSession(true);
        options.setAutomaticReconnect(false);
        options.setKeepAliveInterval(settings.getKeepAliveSeconds());
        options.setConnectionTimeout(settings.getConnectTimeoutSeconds());
        if (settings.getUsername() != null) {
            options.setUserName(settings.getUsername());
        }
        if (settings.getPassword() != null) {
            options.setPassword(settings.getPassword().toCharArray());
        }
        return options;
    }

    private MqttClient requireClient() throws TransportException {
        var current = client;
        if (current == null || !current.isConnected()) {
            throw new TransportException("Not connected to %s".formatted(settings.getBrokerUrl()));
        }
        return current;
    }

    private class Callback implements MqttCallback {

        @Override
        public void connectionLost(Throwable cause) {
            connectionLostHandler.accept(cause);
        }

        @Override
        public void messageArrived(String topic, MqttMessage message) {
            // Paho drops the connection if this callback throws
            try {
                handler.accept(new InboundMessage(topic, message.getPayload(), message.getId(), message.getQos(), message.isDuplicate()));
            } catch (RuntimeException e) {
                log.error("Message handler failed for '{}'", topic, e);
            }
        }

        @Override
        public void deliveryComplete(IMqttDeliveryToken token) {
            // Subscribe only, nothing is published
        }
    }
}
