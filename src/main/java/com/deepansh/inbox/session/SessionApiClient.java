package com.deepansh.inbox.session;

/** Creates tool-router sessions. One call, one new session; no caching here. */
public interface SessionApiClient {

    /**
     * @throws com.deepansh.inbox.exception.ToolExecutionException on failure;
     *         its kind tells the caller whether another attempt may succeed
     */
    SessionGrant create(String userId);
}
