package com.deepansh.inbox.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

@Data
@Builder
public class AgentRunRequest {

    /** Correlates logs and the persisted trace; the event id for triggered runs */
    private String runId;

    private String userId;
    private String instruction;

    /**
     * Where RESPOND sends its reply. Null for interactive runs: the reply
     * message is returned to the caller instead of being sent.
     */
    private ReplyTarget replyTarget;

    /** Earlier exchanges on the same thread, oldest first */
    @Builder.Default
    private List<ConversationEntry> conversation = new ArrayList<>();

    /** Checked at every step boundary; true aborts the run with CANCELLED */
    @Builder.Default
    private BooleanSupplier cancellation = () -> false;
}
