package com.deepansh.inbox.model;

/**
 * Authorization relationship between a user's session and one external app.
 * Only ever produced by the catalog; the agent loop never writes authState.
 *
 * @param redirectUrl link the user must follow to finish authorization, set while PENDING
 */
public record Connection(String connectionId, String app, AuthState authState, String redirectUrl) {

    public enum AuthState { NONE, PENDING, AUTHORIZED }

    public boolean isAuthorized() {
        return authState == AuthState.AUTHORIZED;
    }
}
