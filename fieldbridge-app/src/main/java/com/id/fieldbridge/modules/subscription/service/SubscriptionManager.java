package com.id.fieldbridge.modules.subscription.service;

import com.id.fieldbridge.config.LaunchGuard;
import com.id.fieldbridge.modules.executor.RetryBackoff;
import com.id.fieldbridge.modules.metrics.PipelineMetrics;
import com.id.fieldbridge.modules.subscription.model.InboundMessage;
import com.id.fieldbridge.modules.subscription.model.SubscriptionState;
import com.id.fieldbridge.modules.subscription.model.TransportSettings;
import com.id.fieldbridge.modules.subscription.transport.ITelemetryTransport;
import com.id.fieldbridge.modules.subscription.transport.TransportException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the transport subscription and keeps it alive.
 * <p>
 * DISCONNECTED, CONNECTING, SUBSCRIBED and back to DISCONNECTED on a transport loss, then CONNECTING again
 * after a bounded exponential backoff. STOPPED is final. All connection attempts run on one scheduler thread.
 */
@Service
@Slf4j
public class SubscriptionManager {

    private final ITelemetryTransport transport;
    private final ReadingPipeline pipeline;
    private final LaunchGuard launchGuard;
    private final PipelineMetrics metrics;
    private final boolean enabled;
    private final RetryBackoff reconnectBackoff;

    private final AtomicReference<SubscriptionState> state = new AtomicReference<>(SubscriptionState.DISCONNECTED);
    private final AtomicInteger failedAttempts = new AtomicInteger();
    private final ScheduledExecutorService scheduler = new ScheduledThreadPoolExecutor(1, new CustomizableThreadFactory("subscription-"));

    public SubscriptionManager(ITelemetryTransport transport,
                               ReadingPipeline pipeline,
                               LaunchGuard launchGuard,
                               TransportSettings settings,
                               PipelineMetrics metrics) {
        this.transport = transport;
        this.pipeline = pipeline;
        this.launchGuard = launchGuard;
        this.metrics = metrics;
        this.enabled = settings.isEnabled();
        this.reconnectBackoff = new RetryBackoff(Integer.MAX_VALUE, settings.getReconnectInitialBackoff(), settings.getReconnectMaxBackoff());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!enabled) {
            log.info("Transport disabled, not subscribing");
            return;
        }
        start();
    }

    public void start() {
        // Never open a subscription on an unsanctioned launch
        launchGuard.verify();

        if (!state.compareAndSet(SubscriptionState.DISCONNECTED, SubscriptionState.CONNECTING)) {
            log.debug("Subscription already started ({})", state.get());
            return;
        }
        transport.onConnectionLost(this::onConnectionLost);
        schedule(this::attemptConnect, Duration.ZERO);
    }

    public SubscriptionState getState() {
        return state.get();
    }

    @PreDestroy
    public void stop() {
        var previous = state.getAndSet(SubscriptionState.STOPPED);
        scheduler.shutdownNow();
        if (previous == SubscriptionState.STOPPED) {
            return;
        }
        try {
            if (previous == SubscriptionState.SUBSCRIBED) {
                transport.unsubscribe(pipeline.subscriptionFilters());
            }
            transport.disconnect();
        } catch (TransportException e) {
            log.warn("Transport did not close cleanly: {}", e.getMessage());
        }
        log.info("Subscription stopped");
    }

    void attemptConnect() {
        if (!transitionTo(SubscriptionState.CONNECTING)) {
            return;
        }
        List<String> filters = pipeline.subscriptionFilters();
        try {
            transport.connect();
            transport.subscribe(filters, this::deliver);
        } catch (TransportException e) {
            log.warn("Subscription attempt failed: {}", e.getMessage());
            closeQuietly();
            scheduleReconnect();
            return;
        }

        // A stop() racing with this attempt wins
        if (!state.compareAndSet(SubscriptionState.CONNECTING, SubscriptionState.SUBSCRIBED)) {
            closeQuietly();
            return;
        }
        failedAttempts.set(0);
        log.info("Subscribed to {}", filters);
    }

    void onConnectionLost(Throwable cause) {
        if (!state.compareAndSet(SubscriptionState.SUBSCRIBED, SubscriptionState.DISCONNECTED)) {
            return;
        }
        log.warn("Transport connection lost: {}", cause == null ? "unknown cause" : cause.getMessage());
        scheduleReconnect();
    }

    private void deliver(InboundMessage message) {
        try {
            pipeline.handle(message, () -> acknowledge(message));
        } catch (RuntimeException e) {
            log.error("Delivery of message on '{}' failed", message.topic(), e);
            metrics.stageFailure("delivery");
        }
    }

    private void acknowledge(InboundMessage message) {
        try {
            transport.acknowledge(message);
        } catch (TransportException e) {
            log.warn(e.getMessage());
            metrics.stageFailure("ack");
        }
    }

    private void scheduleReconnect() {
        if (!transitionTo(SubscriptionState.DISCONNECTED)) {
            return;
        }
        int attempt = failedAttempts.incrementAndGet();
        Duration delay = reconnectBackoff.delayAfter(attempt);
        metrics.reconnectAttempt();
        log.info("Reconnecting in {} ms (attempt {})", delay.toMillis(), attempt);
        schedule(this::attemptConnect, delay);
    }

    /**
     * Moves to the given state unless stopped, atomically with respect to {@link #stop()}.
     *
     * @return false if the manager is stopped
     */
    boolean transitionTo(SubscriptionState next) {
        return state.updateAndGet(current -> current == SubscriptionState.STOPPED ? current : next) != SubscriptionState.STOPPED;
    }

    private void schedule(Runnable task, Duration delay) {
        try {
            scheduler.schedule(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Subscription task failed", e);
                    scheduleReconnect();
                }
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler stopped, not scheduling subscription task");
        }
    }

    private void closeQuietly() {
        try {
            transport.disconnect();
        } catch (TransportException e) {
            log.debug("Ignoring disconnect failure after failed attempt: {}", e.getMessage());
        }
    }
}
