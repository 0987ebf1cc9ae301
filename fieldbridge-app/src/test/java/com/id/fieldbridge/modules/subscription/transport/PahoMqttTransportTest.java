package com.id.fieldbridge.modules.subscription.transport;

import com.id.fieldbridge.modules.subscription.model.InboundMessage;
import com.id.fieldbridge.modules.subscription.model.TransportSettings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PahoMqttTransportTest {

    private final PahoMqttTransport transport = new PahoMqttTransport(TransportSettings.builder().build());

    @Test
    void qosZeroMessagesNeedNoAcknowledgement() {
        assertDoesNotThrow(() -> transport.acknowledge(new InboundMessage("fieldbridge/gps", new byte[0], 0, 0, false)));
    }

    @Test
    void operationsBeforeConnectShouldFail() {
        assertFalse(transport.isConnected());
        assertThrows(TransportException.class, () -> transport.subscribe(List.of("fieldbridge/#"), m -> { }));
        assertThrows(TransportException.class, () -> transport.acknowledge(new InboundMessage("fieldbridge/gps", new byte[0], 3, 1, false)));
    }

    @Test
    void closingBeforeConnectShouldBeNoop() {
        assertDoesNotThrow(() -> transport.unsubscribe(List.of("fieldbridge/#")));
        assertDoesNotThrow(transport::disconnect);
    }

    @Test
    void invalidBrokerUrlShouldFailConnect() {
        var invalid = new PahoMqttTransport(TransportSettings.builder().brokerUrl("not a broker").build());

        var e = assertThrows(TransportException.class, invalid::connect);
        assertTrue(e.getMessage().contains("not a broker"));
    }
}
