package com.deepansh.inbox.model;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A scoped, time-bounded handle authorizing tool discovery and execution for one user.
 *
 * Owned by SessionManager. The handle is the catalog endpoint for this user's
 * tool-router session. {@code authorizedConnections} is a record of what this
 * session has seen authorized; it is never consulted as the source of truth,
 * connection state is always read through the catalog.
 */
@Getter
public class Session {

    private final String userId;
    private final String sessionId;
    private final String handle;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final Set<String> authorizedConnections = ConcurrentHashMap.newKeySet();

    public Session(String userId, String sessionId, String handle, Instant createdAt, Instant expiresAt) {
        this.userId = userId;
        this.sessionId = sessionId;
        this.handle = handle;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public void recordAuthorized(String connectionId) {
        authorizedConnections.add(connectionId);
    }

    public Set<String> getAuthorizedConnections() {
        return Collections.unmodifiableSet(authorizedConnections);
    }

    @Override
    public String toString() {
        return "Session[userId=" + userId + ", sessionId=" + sessionId + ", expiresAt=" + expiresAt + "]";
    }
}
