package com.deepansh.inbox.model;

/** The thread a reply goes to and the address it is meant for. */
public record ReplyTarget(String threadId, String recipient) {
}
