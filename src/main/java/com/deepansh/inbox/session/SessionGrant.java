package com.deepansh.inbox.session;

import java.time.Instant;

/**
 * What the session API hands back for a user.
 *
 * @param expiresAt null when the API does not report an expiry
 */
public record SessionGrant(String sessionId, String handle, Instant expiresAt) {
}
