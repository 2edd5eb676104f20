package com.deepansh.inbox.session;

import com.deepansh.inbox.config.AgentProperties;
import com.deepansh.inbox.config.CatalogProperties;
import com.deepansh.inbox.exception.SessionCreationException;
import com.deepansh.inbox.exception.ToolExecutionException;
import com.deepansh.inbox.model.Session;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user session cache with single-flight creation.
 *
 * The map holds a future per user. Whoever installs the future creates the
 * session; everyone arriving while it is pending waits on the same future and
 * sees the same session or the same error. A failed future is removed so the
 * next caller starts a fresh attempt. Expiry is checked lazily on access,
 * {@code agent.session.expiry-skew} ahead of the real deadline.
 */
@Component
@Slf4j
public class SessionManager {

    private final SessionApiClient sessionApi;
    private final Duration expirySkew;
    private final Duration defaultTtl;
    private final Clock clock;
    private final Retry createRetry;
    private final ConcurrentHashMap<String, CompletableFuture<Session>> sessions = new ConcurrentHashMap<>();

    @Autowired
    public SessionManager(SessionApiClient sessionApi,
                          AgentProperties agentProperties,
                          CatalogProperties catalogProperties) {
        this(sessionApi, agentProperties, catalogProperties, Clock.systemUTC());
    }

    SessionManager(SessionApiClient sessionApi,
                   AgentProperties agentProperties,
                   CatalogProperties catalogProperties,
                   Clock clock) {
        AgentProperties.Session config = agentProperties.getSession();
        this.sessionApi = sessionApi;
        this.expirySkew = config.getExpirySkew();
        this.defaultTtl = catalogProperties.getDefaultSessionTtl();
        this.clock = clock;
        this.createRetry = Retry.of("session-create", RetryConfig.custom()
                .maxAttempts(config.getCreateMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(config.getCreateBackoff(), 2.0))
                .retryOnException(e -> !(e instanceof ToolExecutionException t) || t.isRetryable())
                .build());
        this.createRetry.getEventPublisher().onRetry(event ->
                log.warn("Session creation attempt {} failed, retrying in {}: {}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : ""));
    }

    /**
     * Returns the user's live session, creating one if there is none or the
     * cached one has expired.
     *
     * @throws SessionCreationException when creation failed after all attempts
     */
    public Session getOrCreate(String userId) {
        while (true) {
            CompletableFuture<Session> created = new CompletableFuture<>();
            CompletableFuture<Session> existing = sessions.putIfAbsent(userId, created);

            if (existing == null) {
                create(userId, created);
                return await(userId, created);
            }
            if (!existing.isDone()) {
                log.debug("Joining in-flight session creation [userId={}]", userId);
                return await(userId, existing);
            }
            if (existing.isCompletedExceptionally()) {
                sessions.remove(userId, existing);
                continue;
            }

            Session session = existing.join();
            if (session.isExpired(clock.instant().plus(expirySkew))) {
                log.info("Session expired, recreating [userId={}, expiresAt={}]", userId, session.getExpiresAt());
                sessions.remove(userId, existing);
                continue;
            }
            return session;
        }
    }

    /** Drops the cached session; the next access creates a new one. */
    public void invalidate(String userId) {
        CompletableFuture<Session> removed = sessions.remove(userId);
        if (removed != null) {
            log.info("Session invalidated [userId={}]", userId);
        }
    }

    private void create(String userId, CompletableFuture<Session> target) {
        log.info("Creating session [userId={}]", userId);
        try {
            SessionGrant grant = Retry.decorateSupplier(createRetry, () -> sessionApi.create(userId)).get();
            Instant now = clock.instant();
            Instant expiresAt = grant.expiresAt() != null ? grant.expiresAt() : now.plus(defaultTtl);
            Session session = new Session(userId, grant.sessionId(), grant.handle(), now, expiresAt);
            log.info("Session created [userId={}, sessionId={}, expiresAt={}]",
                    userId, session.getSessionId(), expiresAt);
            target.complete(session);
        } catch (RuntimeException e) {
            log.error("Session creation failed [userId={}]: {}", userId, e.getMessage());
            sessions.remove(userId, target);
            target.completeExceptionally(new SessionCreationException(userId,
                    "Could not create a tool session for " + userId + ": " + e.getMessage(), e));
        }
    }

    private Session await(String userId, CompletableFuture<Session> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof SessionCreationException sce) {
                throw sce;
            }
            throw new SessionCreationException(userId, "Session creation failed", e.getCause());
        }
    }
}
