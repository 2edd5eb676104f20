package com.deepansh.inbox.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * An inbound notification that something happened at the trigger source.
 * Immutable once received; identity (and deduplication) is by {@link #id()}.
 */
public record TriggerEvent(
        @NotBlank String id,
        @NotNull Source source,
        @NotBlank String userId,
        Instant occurredAt,
        @NotNull @Valid EmailPayload payload,
        String triggerId
) {

    public enum Source { EMAIL, OTHER }

    /**
     * The instruction handed to the agent loop: the message framed with its
     * subject and sender so the reasoning step sees the whole e-mail.
     */
    public String instruction() {
        return "Process this email and execute the instructions:\n\n"
                + "Subject: " + (payload.subject() != null ? payload.subject() : "No Subject") + "\n\n"
                + "From: " + payload.sender() + "\n\n"
                + payload.body();
    }
}
