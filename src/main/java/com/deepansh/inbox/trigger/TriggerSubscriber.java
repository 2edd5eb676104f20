package com.deepansh.inbox.trigger;

import com.deepansh.inbox.config.AgentProperties;
import com.deepansh.inbox.core.AgentRunService;
import com.deepansh.inbox.exception.MalformedEventException;
import com.deepansh.inbox.exception.SubscriptionConnectionException;
import com.deepansh.inbox.model.RunResult;
import com.deepansh.inbox.model.TriggerEvent;
import io.github.resilience4j.core.IntervalFunction;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Long-lived consumer of the trigger stream.
 *
 * One thread (the caller of {@link #start()}) owns the connection. Each event
 * is parsed, filtered, deduplicated and handed to the run executor, so runs
 * for different users proceed in parallel. A dropped connection is reopened
 * with capped, jittered exponential backoff for as long as the process lives.
 *
 * {@link #stop()} closes the connection and makes every in-flight run abort
 * at its next step boundary.
 */
@Component
@Slf4j
public class TriggerSubscriber {

    private final TriggerSource source;
    private final TriggerEventParser parser;
    private final RecentEventCache recentEvents;
    private final AgentRunService agentRunService;
    private final TaskExecutor runExecutor;
    private final TriggerStats stats;
    private final AgentProperties.Trigger config;
    private final IntervalFunction reconnectBackoff;
    private final IntervalFunction dispatchBackoff;

    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicReference<TriggerConnection> current = new AtomicReference<>();

    public TriggerSubscriber(TriggerSource source,
                             TriggerEventParser parser,
                             RecentEventCache recentEvents,
                             AgentRunService agentRunService,
                             @Qualifier("agentRunExecutor") TaskExecutor runExecutor,
                             TriggerStats stats,
                             AgentProperties properties) {
        this.source = source;
        this.parser = parser;
        this.recentEvents = recentEvents;
        this.agentRunService = agentRunService;
        this.runExecutor = runExecutor;
        this.stats = stats;
        this.config = properties.getTrigger();
        this.reconnectBackoff = IntervalFunction.ofExponentialRandomBackoff(
                config.getReconnectBase(), 2.0, config.getReconnectJitter(), config.getReconnectMax());
        this.dispatchBackoff = IntervalFunction.ofExponentialBackoff(config.getDispatchBackoff(), 2.0);
    }

    /** Blocks until {@link #stop()} is called. */
    public void start() {
        log.info("Trigger subscriber starting [triggerId={}, dedupCapacity={}]",
                config.getTriggerId().isBlank() ? "*" : config.getTriggerId(), config.getDedupCapacity());

        // Consecutive attempts that never reached the source; drives the reconnect delay.
        int failures = 0;
        while (!stopping.get()) {
            TriggerConnection connection = null;
            boolean connected = false;
            try {
                connection = source.open();
                current.set(connection);
                if (stopping.get()) {
                    break;
                }
                connection.forEachEvent(this::onRawEvent);
                connected = connection.isConnected();
                if (!stopping.get()) {
                    log.warn("Trigger stream closed, reconnecting");
                }
            } catch (SubscriptionConnectionException e) {
                if (stopping.get()) {
                    break;
                }
                connected = connection != null && connection.isConnected();
                log.warn("Trigger stream connection failed, will retry: {}", e.getMessage());
            } finally {
                current.set(null);
                if (connection != null) {
                    connection.close();
                }
            }

            if (stopping.get()) {
                break;
            }
            failures = connected ? 1 : failures + 1;
            stats.recordReconnect();
            long waitMs = reconnectBackoff.apply(failures);
            log.info("Reconnecting to trigger stream in {}ms (attempt {})", waitMs, failures);
            if (awaitStop(waitMs)) {
                break;
            }
        }
        log.info("Trigger subscriber stopped [{}]", stats);
    }

    @PreDestroy
    public void stop() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        log.info("Trigger subscriber stopping");
        stopSignal.countDown();
        TriggerConnection connection = current.get();
        if (connection != null) {
            connection.close();
        }
    }

    public boolean isStopping() {
        return stopping.get();
    }

    void onRawEvent(String raw) {
        stats.recordReceived();

        TriggerEvent event;
        try {
            event = parser.parse(raw);
        } catch (MalformedEventException e) {
            stats.recordRejected();
            log.warn("Rejected malformed event: {}", e.getMessage());
            return;
        }

        if (!config.getTriggerId().isBlank() && event.triggerId() != null
                && !config.getTriggerId().equals(event.triggerId())) {
            stats.recordFiltered();
            log.debug("Ignoring event for another trigger [eventId={}, triggerId={}]", event.id(), event.triggerId());
            return;
        }

        if (!config.getInboxOwner().isBlank()
                && config.getInboxOwner().equalsIgnoreCase(event.payload().sender())) {
            stats.recordFiltered();
            log.info("Ignoring event sent by the inbox owner [eventId={}]", event.id());
            return;
        }

        if (!recentEvents.markIfAbsent(event.id())) {
            stats.recordDuplicate();
            log.info("Duplicate event ignored [eventId={}]", event.id());
            return;
        }

        dispatch(event);
    }

    private void dispatch(TriggerEvent event) {
        int maxAttempts = Math.max(1, config.getDispatchMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                runExecutor.execute(() -> runSafely(event));
                stats.recordDispatched();
                log.debug("Event dispatched [eventId={}, attempt={}]", event.id(), attempt);
                return;
            } catch (RejectedExecutionException e) {
                if (attempt == maxAttempts || stopping.get()) {
                    break;
                }
                long waitMs = dispatchBackoff.apply(attempt);
                log.warn("Run executor saturated, requeueing event in {}ms [eventId={}, attempt={}/{}]",
                        waitMs, event.id(), attempt, maxAttempts);
                if (awaitStop(waitMs)) {
                    break;
                }
            }
        }

        // A redelivery of this id may be processed later.
        recentEvents.forget(event.id());
        stats.recordProcessingFailed(event.id());
        log.error("Processing failed: could not dispatch event [eventId={}]", event.id());
    }

    private void runSafely(TriggerEvent event) {
        try {
            RunResult result = agentRunService.process(event, this::isStopping);
            if (!result.isDone()) {
                log.warn("Run for event failed [eventId={}, condition={}, reason={}]",
                        event.id(), result.getCondition(), result.getFailureReason());
            }
        } catch (RuntimeException e) {
            stats.recordProcessingFailed(event.id());
            log.error("Processing failed [eventId={}]", event.id(), e);
        }
    }

    /** @return true when stop was requested during the wait */
    private boolean awaitStop(long millis) {
        try {
            return stopSignal.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            return true;
        }
    }
}
