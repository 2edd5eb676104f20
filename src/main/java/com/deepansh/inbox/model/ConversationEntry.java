package com.deepansh.inbox.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationEntry {

    public enum Role {
        user, assistant
    }

    private Role role;
    private String content;
    private Instant timestamp;
}
