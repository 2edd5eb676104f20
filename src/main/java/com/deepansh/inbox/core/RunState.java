package com.deepansh.inbox.core;

/**
 * States of one agent run. PLANNING fans out to the action states and every
 * action returns to PLANNING; DONE and FAILED are terminal.
 */
public enum RunState {
    PLANNING,
    SEARCHING,
    AUTHENTICATING,
    EXECUTING,
    RESPONDING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
