package com.deepansh.inbox.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunResult {

    public enum Outcome { DONE, FAILED }

    /**
     * Why the run ended. DONE runs end COMPLETED, STOPPED or AUTHORIZATION_PENDING;
     * every other value accompanies FAILED.
     */
    public enum Condition {
        COMPLETED,
        STOPPED,
        AUTHORIZATION_PENDING,
        STEP_LIMIT_EXCEEDED,
        SESSION_CREATION_FAILED,
        PLANNING_FAILED,
        CATALOG_ERROR,
        CANCELLED,
        INTERNAL_ERROR
    }

    private String runId;
    private Outcome outcome;
    private Condition condition;

    /** The message produced by RESPOND, or the failure notice, if any */
    private String replyMessage;

    /** True when a reply was attempted and the reply tool failed */
    private boolean responseFailed;

    /** Plain-language reason when outcome = FAILED */
    private String failureReason;

    @Builder.Default
    private List<AgentTurn> turns = new ArrayList<>();

    public boolean isDone() {
        return outcome == Outcome.DONE;
    }
}
