package com.id.fieldbridge.modules.subscription.model;

public enum SubscriptionState {
    DISCONNECTED,
    CONNECTING,
    SUBSCRIBED,
    STOPPED
}
