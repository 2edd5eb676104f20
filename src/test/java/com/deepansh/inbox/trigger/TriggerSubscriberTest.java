package com.deepansh.inbox.trigger;

import com.deepansh.inbox.config.AgentProperties;
import com.deepansh.inbox.core.AgentRunService;
import com.deepansh.inbox.exception.SubscriptionConnectionException;
import com.deepansh.inbox.model.RunResult;
import com.deepansh.inbox.model.TriggerEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TriggerSubscriberTest {

    @Mock TriggerSource source;
    @Mock AgentRunService agentRunService;

    AgentProperties properties;
    RecentEventCache recentEvents;
    TriggerStats stats;
    TriggerEventParser parser;

    static final RunResult DONE = RunResult.builder()
            .runId("e1").outcome(RunResult.Outcome.DONE).condition(RunResult.Condition.COMPLETED).build();

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        properties.getTrigger().setReconnectBase(Duration.ofMillis(1));
        properties.getTrigger().setReconnectMax(Duration.ofMillis(5));
        properties.getTrigger().setDispatchBackoff(Duration.ofMillis(1));
        recentEvents = new RecentEventCache(100);
        stats = new TriggerStats();
        parser = new TriggerEventParser(new ObjectMapper(),
                Validation.buildDefaultValidatorFactory().getValidator());
    }

    private TriggerSubscriber subscriber(TaskExecutor executor) {
        return new TriggerSubscriber(source, parser, recentEvents, agentRunService, executor, stats, properties);
    }

    private static String event(String id, String sender, String triggerId) {
        return "{\"id\":\"" + id + "\",\"payload\":{\"sender\":\"" + sender + "\",\"subject\":\"Task\","
                + "\"body\":\"Create a GitHub issue titled X\",\"threadId\":\"t-" + id + "\"},"
                + "\"metadata\":{\"trigger_id\":\"" + triggerId + "\"}}";
    }

    @Test
    void onRawEvent_validEvent_dispatchedToRunService() {
        when(agentRunService.process(any(), any())).thenReturn(DONE);
        TriggerSubscriber subscriber = subscriber(new SyncTaskExecutor());

        subscriber.onRawEvent(event("e1", "jane@example.com", "ti_1"));

        ArgumentCaptor<TriggerEvent> captor = ArgumentCaptor.forClass(TriggerEvent.class);
        verify(agentRunService).process(captor.capture(), any());
        assertThat(captor.getValue().userId()).isEqualTo("jane@example.com");
        assertThat(stats.dispatched()).isEqualTo(1);
    }

    @Test
    void onRawEvent_sameIdTwice_processedOnce() {
        when(agentRunService.process(any(), any())).thenReturn(DONE);
        TriggerSubscriber subscriber = subscriber(new SyncTaskExecutor());

        subscriber.onRawEvent(event("e1", "jane@example.com", "ti_1"));
        subscriber.onRawEvent(event("e1", "jane@example.com", "ti_1"));

        verify(agentRunService, times(1)).process(any(), any());
        assertThat(stats.duplicates()).isEqualTo(1);
    }

    @Test
    void onRawEvent_malformedEvent_rejectedWithoutRun() {
        TriggerSubscriber subscriber = subscriber(new SyncTaskExecutor());

        subscriber.onRawEvent("{\"id\":\"e1\",\"userId\":\"u1\",\"payload\":{\"subject\":\"no body\"}}");
        subscriber.onRawEvent("garbage");

        verify(agentRunService, never()).process(any(), any());
        assertThat(stats.rejected()).isEqualTo(2);
        assertThat(stats.received()).isEqualTo(2);
    }

    @Test
    void onRawEvent_otherTrigger_filtered() {
        properties.getTrigger().setTriggerId("ti_mine");
        TriggerSubscriber subscriber = subscriber(new SyncTaskExecutor());

        subscriber.onRawEvent(event("e1", "jane@example.com", "ti_other"));

        verify(agentRunService, never()).process(any(), any());
        assertThat(stats.filtered()).isEqualTo(1);
        assertThat(recentEvents.contains("e1")).isFalse();
    }

    @Test
    void onRawEvent_sentByInboxOwner_filtered() {
        properties.getTrigger().setInboxOwner("Assistant@Example.com");
        TriggerSubscriber subscriber = subscriber(new SyncTaskExecutor());

        subscriber.onRawEvent(event("e1", "assistant@example.com", "ti_1"));

        verify(agentRunService, never()).process(any(), any());
        assertThat(stats.filtered()).isEqualTo(1);
    }

    @Test
    void onRawEvent_executorAlwaysSaturated_recordsProcessingFailure() {
        TaskExecutor saturated = mock(TaskExecutor.class);
        doThrow(new TaskRejectedException("queue full")).when(saturated).execute(any(Runnable.class));
        TriggerSubscriber subscriber = subscriber(saturated);

        subscriber.onRawEvent(event("e1", "jane@example.com", "ti_1"));

        verify(saturated, times(3)).execute(any(Runnable.class));
        assertThat(stats.processingFailed()).isEqualTo(1);
        assertThat(stats.failedEventIds()).containsExactly("e1");
        assertThat(recentEvents.contains("e1")).isFalse();
        verify(agentRunService, never()).process(any(), any());
    }

    @Test
    void onRawEvent_executorSaturatedOnce_requeuedAndRun() {
        TaskExecutor flaky = mock(TaskExecutor.class);
        AtomicBoolean rejectedOnce = new AtomicBoolean(false);
        doThrow(new TaskRejectedException("queue full"))
                .doAnswer(inv -> {
                    rejectedOnce.set(true);
                    return null;
                })
                .when(flaky).execute(any(Runnable.class));
        TriggerSubscriber subscriber = subscriber(flaky);

        subscriber.onRawEvent(event("e1", "jane@example.com", "ti_1"));

        assertThat(rejectedOnce).isTrue();
        assertThat(stats.dispatched()).isEqualTo(1);
        assertThat(stats.processingFailed()).isZero();
    }

    @Test
    void onRawEvent_runThrows_countedAsProcessingFailure() {
        when(agentRunService.process(any(), any())).thenThrow(new IllegalStateException("boom"));
        TriggerSubscriber subscriber = subscriber(new SyncTaskExecutor());

        subscriber.onRawEvent(event("e1", "jane@example.com", "ti_1"));

        assertThat(stats.processingFailed()).isEqualTo(1);
    }

    @Test
    void start_connectionDropsAndRedelivers_seenIdNotReprocessed() {
        when(agentRunService.process(any(), any())).thenReturn(DONE);
        TriggerSubscriber subscriber = subscriber(new SyncTaskExecutor());
        when(source.open())
                .thenReturn(new ScriptedConnection(handler -> {
                    handler.accept(event("e1", "jane@example.com", "ti_1"));
                    throw new SubscriptionConnectionException("connection reset");
                }))
                .thenReturn(new ScriptedConnection(handler -> {
                    handler.accept(event("e1", "jane@example.com", "ti_1"));
                    handler.accept(event("e2", "jane@example.com", "ti_1"));
                    subscriber.stop();
                }));

        subscriber.start();

        ArgumentCaptor<TriggerEvent> captor = ArgumentCaptor.forClass(TriggerEvent.class);
        verify(agentRunService, times(2)).process(captor.capture(), any());
        assertThat(captor.getAllValues()).extracting(TriggerEvent::id).containsExactly("e1", "e2");
        assertThat(stats.duplicates()).isEqualTo(1);
        assertThat(stats.reconnects()).isEqualTo(1);
        assertThat(subscriber.isStopping()).isTrue();
    }

    @Test
    void start_consecutiveConnectFailures_waitGrowsExponentially() {
        properties.getTrigger().setReconnectBase(Duration.ofMillis(40));
        properties.getTrigger().setReconnectMax(Duration.ofSeconds(10));
        properties.getTrigger().setReconnectJitter(0);
        TriggerSubscriber subscriber = subscriber(new SyncTaskExecutor());
        List<Long> openedAt = new ArrayList<>();
        AtomicInteger attempts = new AtomicInteger();
        when(source.open()).thenAnswer(inv -> {
            openedAt.add(System.nanoTime());
            if (attempts.incrementAndGet() <= 4) {
                throw new SubscriptionConnectionException("connection refused");
            }
            return new ScriptedConnection(handler -> subscriber.stop());
        });

        subscriber.start();

        List<Long> gaps = gapsMillis(openedAt);
        assertThat(gaps).hasSize(4);
        assertThat(gaps.get(0)).isGreaterThanOrEqualTo(40L).isLessThan(320L);
        assertThat(gaps.get(2)).isGreaterThanOrEqualTo(160L);
        assertThat(gaps.get(3)).isGreaterThanOrEqualTo(320L);
        assertThat(stats.reconnects()).isEqualTo(4);
    }

    @Test
    void start_dropAfterSuccessfulConnect_waitResetsToBase() {
        properties.getTrigger().setReconnectBase(Duration.ofMillis(100));
        properties.getTrigger().setReconnectMax(Duration.ofSeconds(10));
        properties.getTrigger().setReconnectJitter(0);
        TriggerSubscriber subscriber = subscriber(new SyncTaskExecutor());
        List<Long> openedAt = new ArrayList<>();
        AtomicInteger attempts = new AtomicInteger();
        when(source.open()).thenAnswer(inv -> {
            openedAt.add(System.nanoTime());
            int attempt = attempts.incrementAndGet();
            if (attempt <= 3) {
                throw new SubscriptionConnectionException("connection refused");
            }
            if (attempt == 4) {
                return new ScriptedConnection(handler -> {
                    throw new SubscriptionConnectionException("connection reset");
                });
            }
            return new ScriptedConnection(handler -> subscriber.stop());
        });

        subscriber.start();

        List<Long> gaps = gapsMillis(openedAt);
        assertThat(gaps).hasSize(4);
        assertThat(gaps.get(2)).isGreaterThanOrEqualTo(400L);
        // Without the reset this wait would be 800ms.
        assertThat(gaps.get(3)).isGreaterThanOrEqualTo(100L).isLessThan(600L);
    }

    private static List<Long> gapsMillis(List<Long> nanoTimes) {
        List<Long> gaps = new ArrayList<>();
        for (int i = 1; i < nanoTimes.size(); i++) {
            gaps.add(TimeUnit.NANOSECONDS.toMillis(nanoTimes.get(i) - nanoTimes.get(i - 1)));
        }
        return gaps;
    }

    @Test
    void start_streamEndsNormally_reopened() {
        when(agentRunService.process(any(), any())).thenReturn(DONE);
        TriggerSubscriber subscriber = subscriber(new SyncTaskExecutor());
        when(source.open())
                .thenReturn(new ScriptedConnection(handler -> handler.accept(event("e1", "jane@example.com", "ti_1"))))
                .thenReturn(new ScriptedConnection(handler -> {
                    handler.accept(event("e2", "jane@example.com", "ti_1"));
                    subscriber.stop();
                }));

        subscriber.start();

        verify(source, times(2)).open();
        verify(agentRunService, times(2)).process(any(), any());
    }

    @Test
    void stop_calledTwice_isIdempotent() {
        TriggerSubscriber subscriber = subscriber(new SyncTaskExecutor());

        subscriber.stop();
        subscriber.stop();
        subscriber.start();

        assertThat(subscriber.isStopping()).isTrue();
        verify(source, never()).open();
    }

    /** Connection that accepts immediately and plays a fixed script on the calling thread. */
    static final class ScriptedConnection implements TriggerConnection {
        private final Consumer<Consumer<String>> script;
        private boolean closed;
        private boolean connected;

        ScriptedConnection(Consumer<Consumer<String>> script) {
            this.script = script;
        }

        @Override
        public void forEachEvent(Consumer<String> handler) {
            if (!closed) {
                connected = true;
                script.accept(handler);
            }
        }

        @Override
        public boolean isConnected() {
            return connected;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
