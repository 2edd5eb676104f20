package com.deepansh.inbox.observability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Trace of one finished agent run, whatever its outcome.
 *
 * Captures the instruction and reply, outcome and condition, step count and
 * latency, and the turn history in execution order. Turns are stored as plain
 * maps with previews of their inputs and outputs.
 */
@Document("agent_run_traces")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRunTrace {

    @Id
    private String id;

    @Indexed
    private String runId;

    @Indexed
    private String userId;

    private String threadId;
    private String instruction;
    private String replyMessage;

    /** RunResult.Outcome name */
    private String outcome;

    /** RunResult.Condition name */
    private String condition;

    private boolean responseFailed;
    private String failureReason;

    private int stepsUsed;
    private long totalLatencyMs;

    /** [{"step":1,"action":"SEARCH","latencyMs":340,"error":null,"outputPreview":"..."}] */
    private List<Map<String, Object>> turns;

    @CreatedDate
    private Instant createdAt;
}
