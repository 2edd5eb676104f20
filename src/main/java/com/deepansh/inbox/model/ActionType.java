package com.deepansh.inbox.model;

public enum ActionType {
    SEARCH, AUTH, EXECUTE, RESPOND, STOP
}
