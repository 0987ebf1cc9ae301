package com.id.fieldbridge.modules.subscription.service;

import com.id.fieldbridge.config.LaunchGuard;
import com.id.fieldbridge.modules.metrics.PipelineMetrics;
import com.id.fieldbridge.modules.subscription.model.InboundMessage;
import com.id.fieldbridge.modules.subscription.model.SubscriptionState;
import com.id.fieldbridge.modules.subscription.model.TransportSettings;
import com.id.fieldbridge.modules.subscription.transport.ITelemetryTransport;
import com.id.fieldbridge.modules.subscription.transport.TransportException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SubscriptionManagerTest {

    private static final List<String> FILTERS = List.of("fieldbridge/#", "mqtt/global");

    /**
     * In-memory transport whose first connects can be made to fail.
     */
    static class FakeTransport implements ITelemetryTransport {

        final AtomicInteger failingConnects = new AtomicInteger();
        final AtomicInteger connects = new AtomicInteger();
        final AtomicInteger disconnects = new AtomicInteger();
        final List<List<String>> subscriptions = new CopyOnWriteArrayList<>();
        final List<List<String>> unsubscriptions = new CopyOnWriteArrayList<>();
        final List<InboundMessage> acknowledged = new CopyOnWriteArrayList<>();
        volatile Consumer<InboundMessage> handler;
        volatile Consumer<Throwable> lostHandler;
        volatile boolean connected;
        volatile Runnable duringConnect = () -> { };

        @Override
        public void connect() throws TransportException {
            connects.incrementAndGet();
            duringConnect.run();
            if (failingConnects.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new TransportException("broker unreachable");
            }
            connected = true;
        }

        @Override
        public void subscribe(List<String> topicFilters, Consumer<InboundMessage> handler) {
            subscriptions.add(topicFilters);
            this.handler = handler;
        }

        @Override
        public void acknowledge(InboundMessage message) {
            acknowledged.add(message);
        }

        @Override
        public void unsubscribe(List<String> topicFilters) {
            unsubscriptions.add(topicFilters);
        }

        @Override
        public void disconnect() {
            disconnects.incrementAndGet();
            connected = false;
        }

        @Override
        public boolean isConnected() {
            return connected;
        }

        @Override
        public void onConnectionLost(Consumer<Throwable> handler) {
            this.lostHandler = handler;
        }

        void dropConnection() {
            connected = false;
            lostHandler.accept(new IllegalStateException("keepalive timeout"));
        }
    }

    private FakeTransport transport;
    private ReadingPipeline pipeline;
    private LaunchGuard launchGuard;
    private SimpleMeterRegistry registry;
    private SubscriptionManager manager;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
        pipeline = mock(ReadingPipeline.class);
        when(pipeline.subscriptionFilters()).thenReturn(FILTERS);
        launchGuard = mock(LaunchGuard.class);
        registry = new SimpleMeterRegistry();
        var settings = TransportSettings.builder()
                .reconnectInitialBackoff(Duration.ofMillis(10))
                .reconnectMaxBackoff(Duration.ofMillis(50))
                .build();
        manager = new SubscriptionManager(transport, pipeline, launchGuard, settings, new PipelineMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        manager.stop();
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 5s");
            }
            Thread.sleep(5);
        }
    }

    @Test
    void startShouldSubscribeToDecoderFilters() throws InterruptedException {
        manager.start();

        await(() -> manager.getState() == SubscriptionState.SUBSCRIBED);
        verify(launchGuard).verify();
        assertEquals(List.of(FILTERS), transport.subscriptions);
    }

    @Test
    void failedConnectShouldBeRetriedWithBackoff() throws InterruptedException {
        transport.failingConnects.set(3);

        manager.start();

        await(() -> manager.getState() == SubscriptionState.SUBSCRIBED);
        assertEquals(4, transport.connects.get());
        assertEquals(1, transport.subscriptions.size());
        assertEquals(3.0, registry.counter("fieldbridge.transport.reconnects").count());
    }

    @Test
    void connectionLossShouldResubscribe() throws InterruptedException {
        manager.start();
        await(() -> manager.getState() == SubscriptionState.SUBSCRIBED);

        transport.dropConnection();

        await(() -> transport.subscriptions.size() == 2 && manager.getState() == SubscriptionState.SUBSCRIBED);
        assertEquals(List.of(FILTERS, FILTERS), transport.subscriptions);
    }

    @Test
    void deliveredMessagesShouldReachPipelineWithAcknowledgement() throws InterruptedException {
        doAnswer(invocation -> {
            Runnable ack = invocation.getArgument(1);
            ack.run();
            return null;
        }).when(pipeline).handle(any(InboundMessage.class), any(Runnable.class));
        manager.start();
        await(() -> manager.getState() == SubscriptionState.SUBSCRIBED);

        var message = new InboundMessage("fieldbridge/gps", "{}".getBytes(StandardCharsets.UTF_8), 7, 1, false);
        transport.handler.accept(message);

        verify(pipeline).handle(eq(message), any(Runnable.class));
        assertEquals(List.of(message), transport.acknowledged);
    }

    @Test
    void stopShouldUnsubscribeAndDisconnect() throws InterruptedException {
        manager.start();
        await(() -> manager.getState() == SubscriptionState.SUBSCRIBED);

        manager.stop();

        assertEquals(SubscriptionState.STOPPED, manager.getState());
        assertEquals(List.of(FILTERS), transport.unsubscriptions);
        assertFalse(transport.isConnected());

        // A loss after stop never reconnects
        transport.lostHandler.accept(new IllegalStateException("late"));
        assertEquals(SubscriptionState.STOPPED, manager.getState());
    }

    @Test
    void stoppedManagerShouldNeverLeaveStopped() {
        manager.stop();

        assertFalse(manager.transitionTo(SubscriptionState.CONNECTING));
        assertFalse(manager.transitionTo(SubscriptionState.DISCONNECTED));
        manager.attemptConnect();

        assertEquals(SubscriptionState.STOPPED, manager.getState());
        assertEquals(0, transport.connects.get());
    }

    @Test
    void stopDuringFailingConnectShouldNotScheduleReconnect() throws InterruptedException {
        transport.failingConnects.set(1);
        transport.duringConnect = () -> manager.stop();

        manager.start();

        await(() -> transport.connects.get() == 1 && manager.getState() == SubscriptionState.STOPPED);
        Thread.sleep(100);
        assertEquals(SubscriptionState.STOPPED, manager.getState());
        assertEquals(1, transport.connects.get());
        assertEquals(0.0, registry.counter("fieldbridge.transport.reconnects").count());
    }

    @Test
    void stopDuringSuccessfulConnectShouldWin() throws InterruptedException {
        transport.duringConnect = () -> manager.stop();

        manager.start();

        await(() -> transport.connects.get() == 1 && manager.getState() == SubscriptionState.STOPPED);
        Thread.sleep(100);
        assertEquals(SubscriptionState.STOPPED, manager.getState());
        assertFalse(transport.isConnected());
    }

    @Test
    void unsanctionedLaunchShouldNeverConnect() {
        doThrow(new IllegalStateException("PROTECTED EXECUTION")).when(launchGuard).verify();

        assertThrows(IllegalStateException.class, () -> manager.start());
        assertEquals(0, transport.connects.get());
        assertEquals(SubscriptionState.DISCONNECTED, manager.getState());
    }
}
