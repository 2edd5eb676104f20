package com.deepansh.inbox.exception;

import com.deepansh.inbox.model.Connection;

/**
 * Not a failure: the user has to finish authorizing an app outside this run.
 * The loop turns it into an "authorization needed" reply and stops.
 */
public class AuthenticationPendingException extends AgentException {

    private final Connection connection;

    public AuthenticationPendingException(Connection connection) {
        super("Authorization pending for app '" + connection.app() + "'");
        this.connection = connection;
    }

    public Connection getConnection() {
        return connection;
    }
}
