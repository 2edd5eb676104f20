package com.deepansh.inbox.session;

import com.deepansh.inbox.config.AgentProperties;
import com.deepansh.inbox.config.CatalogProperties;
import com.deepansh.inbox.exception.SessionCreationException;
import com.deepansh.inbox.exception.ToolExecutionException;
import com.deepansh.inbox.model.ErrorKind;
import com.deepansh.inbox.model.Session;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionManagerTest {

    @Mock SessionApiClient sessionApi;

    MutableClock clock;
    SessionManager sessionManager;
    ExecutorService pool;

    static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");

    @BeforeEach
    void setUp() {
        AgentProperties agentProperties = new AgentProperties();
        agentProperties.getSession().setCreateBackoff(Duration.ofMillis(1));
        CatalogProperties catalogProperties = new CatalogProperties();
        catalogProperties.setApiKey("test-key");

        clock = new MutableClock(T0);
        sessionManager = new SessionManager(sessionApi, agentProperties, catalogProperties, clock);
        pool = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static SessionGrant grant(String id, Instant expiresAt) {
        return new SessionGrant(id, "https://mcp.example.com/" + id, expiresAt);
    }

    @Test
    void getOrCreate_liveSession_reusedWithoutNewCreation() {
        when(sessionApi.create("u1")).thenReturn(grant("s1", T0.plus(Duration.ofHours(1))));

        Session first = sessionManager.getOrCreate("u1");
        Session second = sessionManager.getOrCreate("u1");

        assertThat(second).isSameAs(first);
        assertThat(first.getHandle()).isEqualTo("https://mcp.example.com/s1");
        verify(sessionApi, times(1)).create("u1");
    }

    @Test
    void getOrCreate_afterExpiry_createsNewSession() {
        when(sessionApi.create("u1")).thenReturn(
                grant("s1", T0.plus(Duration.ofMinutes(10))),
                grant("s2", T0.plus(Duration.ofHours(2))));

        Session first = sessionManager.getOrCreate("u1");
        clock.advance(Duration.ofMinutes(11));
        Session second = sessionManager.getOrCreate("u1");

        assertThat(first.getSessionId()).isEqualTo("s1");
        assertThat(second.getSessionId()).isEqualTo("s2");
    }

    @Test
    void getOrCreate_withinExpirySkew_treatedAsExpired() {
        when(sessionApi.create("u1")).thenReturn(
                grant("s1", T0.plus(Duration.ofSeconds(20))),
                grant("s2", T0.plus(Duration.ofHours(1))));

        sessionManager.getOrCreate("u1");
        Session second = sessionManager.getOrCreate("u1");

        assertThat(second.getSessionId()).isEqualTo("s2");
        verify(sessionApi, times(2)).create("u1");
    }

    @Test
    void getOrCreate_noExpiryReported_usesDefaultTtl() {
        when(sessionApi.create("u1")).thenReturn(grant("s1", null));

        Session session = sessionManager.getOrCreate("u1");

        assertThat(session.getExpiresAt()).isEqualTo(T0.plus(Duration.ofMinutes(30)));
    }

    @Test
    void getOrCreate_concurrentCallers_shareSingleCreation() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(sessionApi.create("u1")).thenAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return grant("s1", T0.plus(Duration.ofHours(1)));
        });

        List<Future<Session>> results = new ArrayList<>();
        results.add(pool.submit(() -> sessionManager.getOrCreate("u1")));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        for (int i = 0; i < 7; i++) {
            results.add(pool.submit(() -> sessionManager.getOrCreate("u1")));
        }
        Thread.sleep(100);
        release.countDown();

        Session first = results.get(0).get(5, TimeUnit.SECONDS);
        for (Future<Session> result : results) {
            assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(first);
        }
        verify(sessionApi, times(1)).create("u1");
    }

    @Test
    void getOrCreate_concurrentCallersDuringFailure_allSeeCreationError() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(sessionApi.create("u1")).thenAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            throw new ToolExecutionException(ErrorKind.INVALID_INPUT, "HTTP 400");
        });

        List<Future<Session>> results = new ArrayList<>();
        results.add(pool.submit(() -> sessionManager.getOrCreate("u1")));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        for (int i = 0; i < 3; i++) {
            results.add(pool.submit(() -> sessionManager.getOrCreate("u1")));
        }
        Thread.sleep(100);
        release.countDown();

        for (Future<Session> result : results) {
            assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                    .hasCauseInstanceOf(SessionCreationException.class);
        }
    }

    @Test
    void getOrCreate_afterFailure_nextCallTriesAgain() {
        when(sessionApi.create("u1"))
                .thenThrow(new ToolExecutionException(ErrorKind.PERMISSION_DENIED, "HTTP 401"))
                .thenReturn(grant("s1", T0.plus(Duration.ofHours(1))));

        assertThatThrownBy(() -> sessionManager.getOrCreate("u1"))
                .isInstanceOf(SessionCreationException.class)
                .hasMessageContaining("u1");
        Session session = sessionManager.getOrCreate("u1");

        assertThat(session.getSessionId()).isEqualTo("s1");
        verify(sessionApi, times(2)).create("u1");
    }

    @Test
    void getOrCreate_transientFailures_retriedUntilSuccess() {
        when(sessionApi.create("u1"))
                .thenThrow(new ToolExecutionException(ErrorKind.TRANSIENT, "HTTP 503"))
                .thenThrow(new ToolExecutionException(ErrorKind.TIMEOUT, "timed out"))
                .thenReturn(grant("s1", T0.plus(Duration.ofHours(1))));

        Session session = sessionManager.getOrCreate("u1");

        assertThat(session.getSessionId()).isEqualTo("s1");
        verify(sessionApi, times(3)).create("u1");
    }

    @Test
    void getOrCreate_transientFailuresExhausted_throwsSessionCreationException() {
        when(sessionApi.create(anyString()))
                .thenThrow(new ToolExecutionException(ErrorKind.TRANSIENT, "HTTP 503"));

        assertThatThrownBy(() -> sessionManager.getOrCreate("u1"))
                .isInstanceOf(SessionCreationException.class)
                .hasRootCauseInstanceOf(ToolExecutionException.class);
        verify(sessionApi, times(3)).create("u1");
    }

    @Test
    void invalidate_dropsCachedSession() {
        when(sessionApi.create("u1")).thenReturn(
                grant("s1", T0.plus(Duration.ofHours(1))),
                grant("s2", T0.plus(Duration.ofHours(1))));

        sessionManager.getOrCreate("u1");
        sessionManager.invalidate("u1");
        Session session = sessionManager.getOrCreate("u1");

        assertThat(session.getSessionId()).isEqualTo("s2");
    }

    @Test
    void getOrCreate_differentUsers_getDifferentSessions() {
        when(sessionApi.create("u1")).thenReturn(grant("s1", T0.plus(Duration.ofHours(1))));
        when(sessionApi.create("u2")).thenReturn(grant("s2", T0.plus(Duration.ofHours(1))));

        assertThat(sessionManager.getOrCreate("u1").getSessionId()).isEqualTo("s1");
        assertThat(sessionManager.getOrCreate("u2").getSessionId()).isEqualTo("s2");
    }

    static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
