package com.deepansh.inbox.trigger;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** Counters for the subscription, plus the ids of events whose processing failed. */
@Component
public class TriggerStats {

    private static final int MAX_FAILED_IDS = 100;

    private final AtomicLong received = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong filtered = new AtomicLong();
    private final AtomicLong dispatched = new AtomicLong();
    private final AtomicLong processingFailed = new AtomicLong();
    private final AtomicLong reconnects = new AtomicLong();
    private final Deque<String> failedEventIds = new ArrayDeque<>();

    void recordReceived() { received.incrementAndGet(); }

    void recordRejected() { rejected.incrementAndGet(); }

    void recordDuplicate() { duplicates.incrementAndGet(); }

    void recordFiltered() { filtered.incrementAndGet(); }

    void recordDispatched() { dispatched.incrementAndGet(); }

    void recordReconnect() { reconnects.incrementAndGet(); }

    void recordProcessingFailed(String eventId) {
        processingFailed.incrementAndGet();
        synchronized (failedEventIds) {
            failedEventIds.addLast(eventId);
            if (failedEventIds.size() > MAX_FAILED_IDS) {
                failedEventIds.removeFirst();
            }
        }
    }

    public long received() { return received.get(); }

    public long rejected() { return rejected.get(); }

    public long duplicates() { return duplicates.get(); }

    public long filtered() { return filtered.get(); }

    public long dispatched() { return dispatched.get(); }

    public long processingFailed() { return processingFailed.get(); }

    public long reconnects() { return reconnects.get(); }

    public List<String> failedEventIds() {
        synchronized (failedEventIds) {
            return List.copyOf(failedEventIds);
        }
    }

    @Override
    public String toString() {
        return "received=" + received() + ", rejected=" + rejected() + ", duplicates=" + duplicates()
                + ", filtered=" + filtered() + ", dispatched=" + dispatched()
                + ", processingFailed=" + processingFailed() + ", reconnects=" + reconnects();
    }
}
