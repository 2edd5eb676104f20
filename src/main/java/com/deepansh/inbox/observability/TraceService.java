package com.deepansh.inbox.observability;

import com.deepansh.inbox.model.AgentRunRequest;
import com.deepansh.inbox.model.AgentTurn;
import com.deepansh.inbox.model.RunResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persists run traces.
 *
 * Persistence is @Async on its own pool and never throws: a trace store
 * outage costs the trace, never the run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    private final AgentRunTraceRepository traceRepository;
    private final ObjectMapper objectMapper;

    @Async("traceTaskExecutor")
    public void persistTrace(AgentRunRequest request, RunResult result, RunContext runCtx) {
        try {
            AgentRunTrace trace = AgentRunTrace.builder()
                    .runId(result.getRunId())
                    .userId(request.getUserId())
                    .threadId(request.getReplyTarget() != null ? request.getReplyTarget().threadId() : null)
                    .instruction(truncate(request.getInstruction(), 4000))
                    .replyMessage(truncate(result.getReplyMessage(), 8000))
                    .outcome(result.getOutcome().name())
                    .condition(result.getCondition().name())
                    .responseFailed(result.isResponseFailed())
                    .failureReason(truncate(result.getFailureReason(), 2000))
                    .stepsUsed(result.getTurns().size())
                    .totalLatencyMs(runCtx.elapsedMs())
                    .turns(summarize(result.getTurns(), runCtx))
                    .build();

            traceRepository.save(trace);

            log.info("Trace persisted [runId={}, outcome={}, condition={}, latency={}ms]",
                    result.getRunId(), result.getOutcome(), result.getCondition(), runCtx.elapsedMs());

        } catch (Exception e) {
            log.error("Failed to persist run trace for runId={}", result.getRunId(), e);
        }
    }

    private List<Map<String, Object>> summarize(List<AgentTurn> turns, RunContext runCtx) {
        return turns.stream()
                .map(turn -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("step", turn.stepIndex());
                    entry.put("action", turn.action().name());
                    entry.put("latencyMs", runCtx.latencyOf(turn.stepIndex()));
                    entry.put("inputPreview", truncate(toJson(turn.input()), 500));
                    entry.put("outputPreview", truncate(toJson(turn.output()), 500));
                    entry.put("error", turn.error());
                    return entry;
                })
                .toList();
    }

    private String toJson(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}
