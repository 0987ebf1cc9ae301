package com.id.fieldbridge.modules.subscription.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class TransportSettings {

    @Builder.Default
    boolean enabled = true;

    @Builder.Default
    String brokerUrl = "tcp://localhost:1883";

    @Builder.Default
    String clientId = "fieldbridge-server";

    String username;

    @ToString.Exclude
    String password;

    @Builder.Default
    int qos = 1;

    @Builder.Default
    int keepAliveSeconds = 120;

    @Builder.Default
    int connectTimeoutSeconds = 10;

    @Builder.Default
    Duration reconnectInitialBackoff = Duration.ofSeconds(1);

    @Builder.Default
    Duration reconnectMaxBackoff = Duration.ofSeconds(30);

}
