package com.deepansh.inbox.core;

import com.deepansh.inbox.exception.SessionCreationException;
import com.deepansh.inbox.memory.ConversationStore;
import com.deepansh.inbox.model.AgentRunRequest;
import com.deepansh.inbox.model.ConversationEntry;
import com.deepansh.inbox.model.ReplyTarget;
import com.deepansh.inbox.model.RunResult;
import com.deepansh.inbox.model.Session;
import com.deepansh.inbox.model.TriggerEvent;
import com.deepansh.inbox.observability.RunContext;
import com.deepansh.inbox.observability.TraceService;
import com.deepansh.inbox.session.SessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Entry point for one unit of agent work.
 *
 * Per run:
 * 1. Load the thread's conversation history (Redis)
 * 2. Get or create the user's session
 * 3. Run the agent loop
 * 4. Append the instruction and the reply to the thread history
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AgentRunService {

    private final SessionManager sessionManager;
    private final AgentLoop agentLoop;
    private final ConversationStore conversationStore;
    private final TraceService traceService;

    /** Handles an accepted trigger event; the reply goes back on the event's thread. */
    public RunResult process(TriggerEvent event, BooleanSupplier cancellation) {
        String userId = event.userId();
        String threadId = event.payload().threadId();

        log.info("Processing event [eventId={}, userId={}, threadId={}, subject='{}']",
                event.id(), userId, threadId, event.payload().subject());

        List<ConversationEntry> history = threadId != null
                ? conversationStore.load(userId, threadId)
                : new ArrayList<>();

        AgentRunRequest request = AgentRunRequest.builder()
                .runId(event.id())
                .userId(userId)
                .instruction(event.instruction())
                .replyTarget(threadId != null ? new ReplyTarget(threadId, event.payload().sender()) : null)
                .conversation(history)
                .cancellation(cancellation)
                .build();

        RunResult result = execute(request);

        if (threadId != null) {
            List<ConversationEntry> entries = new ArrayList<>();
            entries.add(entry(ConversationEntry.Role.user, request.getInstruction()));
            if (result.getReplyMessage() != null) {
                entries.add(entry(ConversationEntry.Role.assistant, result.getReplyMessage()));
            }
            conversationStore.append(userId, threadId, entries);
        }
        return result;
    }

    /** One synchronous run with no thread: the reply is returned, not sent. */
    public RunResult runInstruction(String userId, String instruction) {
        AgentRunRequest request = AgentRunRequest.builder()
                .runId(UUID.randomUUID().toString())
                .userId(userId)
                .instruction(instruction)
                .build();
        return execute(request);
    }

    private RunResult execute(AgentRunRequest request) {
        Session session;
        try {
            session = sessionManager.getOrCreate(request.getUserId());
        } catch (SessionCreationException e) {
            log.error("Run failed before start [runId={}, userId={}]: {}",
                    request.getRunId(), request.getUserId(), e.getMessage());
            RunResult result = RunResult.builder()
                    .runId(request.getRunId())
                    .outcome(RunResult.Outcome.FAILED)
                    .condition(RunResult.Condition.SESSION_CREATION_FAILED)
                    .failureReason("Could not open a tool session: " + e.getMessage())
                    .build();
            traceService.persistTrace(request, result, new RunContext());
            return result;
        }

        RunResult result = agentLoop.run(session, request);

        if (result.getCondition() == RunResult.Condition.CATALOG_ERROR) {
            // The session may be the cause; the next run starts with a fresh one.
            sessionManager.invalidate(request.getUserId());
        }
        return result;
    }

    private ConversationEntry entry(ConversationEntry.Role role, String content) {
        return ConversationEntry.builder()
                .role(role)
                .content(content)
                .timestamp(Instant.now())
                .build();
    }
}
