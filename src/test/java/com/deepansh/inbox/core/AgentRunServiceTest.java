package com.deepansh.inbox.core;

import com.deepansh.inbox.exception.SessionCreationException;
import com.deepansh.inbox.memory.ConversationStore;
import com.deepansh.inbox.model.AgentRunRequest;
import com.deepansh.inbox.model.ConversationEntry;
import com.deepansh.inbox.model.EmailPayload;
import com.deepansh.inbox.model.RunResult;
import com.deepansh.inbox.model.Session;
import com.deepansh.inbox.model.TriggerEvent;
import com.deepansh.inbox.observability.TraceService;
import com.deepansh.inbox.session.SessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentRunServiceTest {

    @Mock SessionManager sessionManager;
    @Mock AgentLoop agentLoop;
    @Mock ConversationStore conversationStore;
    @Mock TraceService traceService;

    AgentRunService service;
    Session session;

    @BeforeEach
    void setUp() {
        service = new AgentRunService(sessionManager, agentLoop, conversationStore, traceService);
        session = new Session("jane@example.com", "s1", "https://mcp.example.com/s1",
                Instant.now(), Instant.now().plus(Duration.ofHours(1)));
    }

    private static TriggerEvent event(String threadId) {
        return new TriggerEvent("e1", TriggerEvent.Source.EMAIL, "jane@example.com", Instant.now(),
                new EmailPayload("jane@example.com", "Issue", "Create a GitHub issue titled X", threadId), "ti_1");
    }

    private static RunResult done(String reply) {
        return RunResult.builder()
                .runId("e1").outcome(RunResult.Outcome.DONE).condition(RunResult.Condition.COMPLETED)
                .replyMessage(reply).build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void process_threadedEvent_runsWithHistoryAndSavesExchange() {
        List<ConversationEntry> history = new ArrayList<>(List.of(ConversationEntry.builder()
                .role(ConversationEntry.Role.user).content("earlier").build()));
        when(conversationStore.load("jane@example.com", "t-1")).thenReturn(history);
        when(sessionManager.getOrCreate("jane@example.com")).thenReturn(session);
        when(agentLoop.run(eq(session), any())).thenReturn(done("<p>Created</p>"));

        RunResult result = service.process(event("t-1"), () -> false);

        ArgumentCaptor<AgentRunRequest> request = ArgumentCaptor.forClass(AgentRunRequest.class);
        verify(agentLoop).run(eq(session), request.capture());
        assertThat(request.getValue().getRunId()).isEqualTo("e1");
        assertThat(request.getValue().getConversation()).isSameAs(history);
        assertThat(request.getValue().getReplyTarget().threadId()).isEqualTo("t-1");
        assertThat(request.getValue().getReplyTarget().recipient()).isEqualTo("jane@example.com");
        assertThat(request.getValue().getInstruction()).startsWith("Process this email");

        ArgumentCaptor<List<ConversationEntry>> saved = ArgumentCaptor.forClass(List.class);
        verify(conversationStore).append(eq("jane@example.com"), eq("t-1"), saved.capture());
        assertThat(saved.getValue()).extracting(ConversationEntry::getRole)
                .containsExactly(ConversationEntry.Role.user, ConversationEntry.Role.assistant);
        assertThat(result.isDone()).isTrue();
    }

    @Test
    void process_noThread_noHistoryAndNoReplyTarget() {
        when(sessionManager.getOrCreate("jane@example.com")).thenReturn(session);
        when(agentLoop.run(eq(session), any())).thenReturn(done(null));

        service.process(event(null), () -> false);

        ArgumentCaptor<AgentRunRequest> request = ArgumentCaptor.forClass(AgentRunRequest.class);
        verify(agentLoop).run(eq(session), request.capture());
        assertThat(request.getValue().getReplyTarget()).isNull();
        verifyNoInteractions(conversationStore);
    }

    @Test
    void process_sessionCreationFails_failedResultAndTracePersisted() {
        when(conversationStore.load(anyString(), anyString())).thenReturn(new ArrayList<>());
        when(sessionManager.getOrCreate("jane@example.com"))
                .thenThrow(new SessionCreationException("jane@example.com", "catalog down", null));

        RunResult result = service.process(event("t-1"), () -> false);

        assertThat(result.getOutcome()).isEqualTo(RunResult.Outcome.FAILED);
        assertThat(result.getCondition()).isEqualTo(RunResult.Condition.SESSION_CREATION_FAILED);
        verify(agentLoop, never()).run(any(), any());
        verify(traceService).persistTrace(any(), eq(result), any());
    }

    @Test
    void runInstruction_catalogError_invalidatesSession() {
        when(sessionManager.getOrCreate("jane@example.com")).thenReturn(session);
        when(agentLoop.run(eq(session), any())).thenReturn(RunResult.builder()
                .runId("r1").outcome(RunResult.Outcome.FAILED).condition(RunResult.Condition.CATALOG_ERROR).build());

        RunResult result = service.runInstruction("jane@example.com", "List my repos");

        assertThat(result.getCondition()).isEqualTo(RunResult.Condition.CATALOG_ERROR);
        verify(sessionManager).invalidate("jane@example.com");
        verify(conversationStore, never()).append(anyString(), anyString(), anyList());
    }
}
