package com.id.fieldbridge.modules.executor;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Task queue that logs a warning, at most once per interval, while it holds more than the threshold.
 */
@Slf4j
public class WarningLinkedBlockingQueue<E> extends LinkedBlockingQueue<E> {

    private final String name;
    private final int warningThreshold;
    private final long warningIntervalMillis;
    private final AtomicLong lastWarningTime = new AtomicLong(0);

    public WarningLinkedBlockingQueue(String name, int capacity, int warningThreshold, long warningIntervalMillis) {
        super(capacity);
        this.name = name;
        this.warningThreshold = warningThreshold;
        this.warningIntervalMillis = warningIntervalMillis;
    }

    @Override
    public boolean offer(E e) {
        int currentSize = size();
        long now = System.currentTimeMillis();
        long last = lastWarningTime.get();
        if (currentSize >= warningThreshold && now - last >= warningIntervalMillis && lastWarningTime.compareAndSet(last, now)) {
            log.warn("%s queue size is %d (>= %d)".formatted(name, currentSize, warningThreshold));
        }
        return super.offer(e);
    }
}
