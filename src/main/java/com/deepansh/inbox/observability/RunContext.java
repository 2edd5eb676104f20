package com.deepansh.inbox.observability;

import com.deepansh.inbox.model.ActionType;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-run context for collecting observability data.
 * Created at the start of each agent run, populated throughout,
 * then flushed to AgentRunTrace at the end.
 */
@Data
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<StepRecord> stepRecords = new ArrayList<>();

    public void recordStep(int stepIndex, ActionType action, long latencyMs) {
        stepRecords.add(new StepRecord(stepIndex, action, latencyMs));
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public long latencyOf(int stepIndex) {
        return stepRecords.stream()
                .filter(r -> r.stepIndex() == stepIndex)
                .mapToLong(StepRecord::latencyMs)
                .sum();
    }

    public record StepRecord(int stepIndex, ActionType action, long latencyMs) {}
}
