package com.deepansh.inbox.model;

import jakarta.validation.constraints.NotBlank;

public record EmailPayload(
        String sender,
        String subject,
        @NotBlank String body,
        String threadId
) {
}
