package com.deepansh.inbox.core;

import com.deepansh.inbox.config.AgentProperties;
import com.deepansh.inbox.exception.AgentException;
import com.deepansh.inbox.exception.AuthenticationPendingException;
import com.deepansh.inbox.exception.ReasoningUnavailableException;
import com.deepansh.inbox.exception.StepLimitExceededException;
import com.deepansh.inbox.exception.ToolExecutionException;
import com.deepansh.inbox.exception.UnresolvableActionException;
import com.deepansh.inbox.llm.ReasoningEngine;
import com.deepansh.inbox.model.ActionType;
import com.deepansh.inbox.model.AgentAction;
import com.deepansh.inbox.model.AgentRunRequest;
import com.deepansh.inbox.model.AgentTurn;
import com.deepansh.inbox.model.Connection;
import com.deepansh.inbox.model.ErrorKind;
import com.deepansh.inbox.model.ExecutionResult;
import com.deepansh.inbox.model.ReplyTarget;
import com.deepansh.inbox.model.RunResult;
import com.deepansh.inbox.model.Session;
import com.deepansh.inbox.model.ToolDescriptor;
import com.deepansh.inbox.model.ToolInvocation;
import com.deepansh.inbox.observability.RunContext;
import com.deepansh.inbox.observability.TraceService;
import com.deepansh.inbox.reply.ResponseDispatcher;
import com.deepansh.inbox.tool.ToolRegistryClient;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plan-act-observe loop for one instruction.
 *
 * Per step:
 * 1. Check for cancellation
 * 2. Ask the reasoning engine for exactly one action (one re-plan on an unusable answer)
 * 3. Run it against the catalog and append the outcome as an AgentTurn
 * 4. Back to planning, until RESPOND or STOP, or the step limit
 *
 * Per-run errors never escape {@link #run}: every path ends in a RunResult,
 * and the trace is persisted in all cases.
 */
@Service
@Slf4j
public class AgentLoop {

    private final ReasoningEngine reasoningEngine;
    private final ToolRegistryClient toolRegistryClient;
    private final ResponseDispatcher responseDispatcher;
    private final TraceService traceService;
    private final AgentProperties.Loop config;
    private final IntervalFunction executeBackoff;

    public AgentLoop(ReasoningEngine reasoningEngine,
                     ToolRegistryClient toolRegistryClient,
                     ResponseDispatcher responseDispatcher,
                     TraceService traceService,
                     AgentProperties properties) {
        this.reasoningEngine = reasoningEngine;
        this.toolRegistryClient = toolRegistryClient;
        this.responseDispatcher = responseDispatcher;
        this.traceService = traceService;
        this.config = properties.getLoop();
        this.executeBackoff = IntervalFunction.ofExponentialBackoff(config.getExecuteBackoff(), 2.0);
    }

    public RunResult run(Session session, AgentRunRequest request) {
        AgentContext context = AgentContext.builder()
                .runId(request.getRunId())
                .session(session)
                .request(request)
                .state(RunState.PLANNING)
                .turns(new ArrayList<>())
                .discoveredTools(new LinkedHashMap<>())
                .build();
        RunContext runCtx = new RunContext();

        log.info("Agent run started [runId={}, userId={}, maxSteps={}]",
                context.getRunId(), request.getUserId(), config.getMaxSteps());

        RunResult result;
        try {
            result = executeLoop(context, runCtx);
        } catch (StepLimitExceededException e) {
            log.warn("Agent hit step limit ({}) [runId={}]", e.getStepLimit(), context.getRunId());
            result = fail(context, RunResult.Condition.STEP_LIMIT_EXCEEDED,
                    "I could not finish this request within " + e.getStepLimit() + " steps.");
        } catch (UnresolvableActionException | ReasoningUnavailableException e) {
            log.error("Planning failed [runId={}]: {}", context.getRunId(), e.getMessage());
            result = fail(context, RunResult.Condition.PLANNING_FAILED,
                    "I could not work out how to carry out this request.");
        } catch (ToolExecutionException e) {
            log.error("Unrecoverable catalog error [runId={}, kind={}]: {}",
                    context.getRunId(), e.getKind(), e.getMessage());
            result = fail(context, RunResult.Condition.CATALOG_ERROR,
                    "The tool service rejected the request (" + e.getKind() + ").");
        } catch (AgentException e) {
            log.error("Agent run failed [runId={}]: {}", context.getRunId(), e.getMessage());
            result = fail(context, RunResult.Condition.PLANNING_FAILED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Agent run failed unexpectedly [runId={}]", context.getRunId(), e);
            result = fail(context, RunResult.Condition.INTERNAL_ERROR, "An internal error occurred.");
        }

        if (!result.isDone() && result.getCondition() != RunResult.Condition.CANCELLED) {
            sendFailureReply(context, result);
        }

        traceService.persistTrace(request, result, runCtx);

        log.info("Agent run complete [runId={}, outcome={}, condition={}, steps={}, latency={}ms]",
                context.getRunId(), result.getOutcome(), result.getCondition(),
                result.getTurns().size(), runCtx.elapsedMs());
        return result;
    }

    private RunResult executeLoop(AgentContext context, RunContext runCtx) {
        while (true) {
            if (isCancelled(context)) {
                return cancelled(context);
            }
            ensureStepAvailable(context);
            transition(context, RunState.PLANNING);

            AgentAction action = plan(context);
            log.info("Step {}/{} chose {} [runId={}]",
                    context.nextStepIndex(), config.getMaxSteps(), action.type(), context.getRunId());

            long start = System.currentTimeMillis();
            int firstStep = context.nextStepIndex();
            RunResult terminal;
            try {
                terminal = switch (action.type()) {
                    case SEARCH -> search(context, (AgentAction.Search) action);
                    case AUTH -> authenticate(context, (AgentAction.Authenticate) action);
                    case EXECUTE -> execute(context, (AgentAction.Execute) action);
                    case RESPOND -> respond(context, ((AgentAction.Respond) action).message(),
                            RunResult.Condition.COMPLETED);
                    case STOP -> stop(context, (AgentAction.Stop) action);
                };
            } catch (AuthenticationPendingException e) {
                terminal = respond(context, pendingMessage(e.getConnection()),
                        RunResult.Condition.AUTHORIZATION_PENDING);
            }
            runCtx.recordStep(firstStep, action.type(), System.currentTimeMillis() - start);

            if (terminal != null) {
                return terminal;
            }
        }
    }

    private AgentAction plan(AgentContext context) {
        AgentRunRequest request = context.getRequest();
        int attempts = 1 + Math.max(0, config.getPlanningRetries());
        UnresolvableActionException last = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return reasoningEngine.nextAction(request.getInstruction(),
                        request.getConversation(), List.copyOf(context.getTurns()));
            } catch (UnresolvableActionException e) {
                last = e;
                log.warn("Planning attempt {}/{} gave no usable action [runId={}]: {}",
                        attempt, attempts, context.getRunId(), e.getMessage());
            }
        }
        throw last;
    }

    // SEARCH

    private RunResult search(AgentContext context, AgentAction.Search action) {
        transition(context, RunState.SEARCHING);
        Map<String, Object> input = Map.of("intent", action.intent());
        try {
            List<ToolDescriptor> tools = toolRegistryClient.searchTools(context.getSession(), action.intent());
            tools.forEach(tool -> context.getDiscoveredTools().put(tool.toolId(), tool));
            append(context, AgentTurn.ok(context.nextStepIndex(), ActionType.SEARCH, input, tools));
        } catch (ToolExecutionException e) {
            if (!e.isRetryable()) {
                throw e;
            }
            log.warn("Tool search failed, reporting to planner [runId={}]: {}", context.getRunId(), e.getMessage());
            append(context, AgentTurn.failed(context.nextStepIndex(), ActionType.SEARCH, input, null, e.getMessage()));
        }
        return null;
    }

    // AUTH

    private RunResult authenticate(AgentContext context, AgentAction.Authenticate action) {
        Connection connection = requestConnection(context, action.app());
        if (connection != null && connection.authState() == Connection.AuthState.PENDING) {
            throw new AuthenticationPendingException(connection);
        }
        return null;
    }

    /**
     * Asks the catalog for the app's connection and records an AUTH turn.
     * Returns null when the request failed retryably (the failure is recorded).
     */
    private Connection requestConnection(AgentContext context, String app) {
        ensureStepAvailable(context);
        transition(context, RunState.AUTHENTICATING);
        Map<String, Object> input = Map.of("app", app);
        try {
            Connection connection = toolRegistryClient.requestConnection(context.getSession(), app);
            append(context, AgentTurn.ok(context.nextStepIndex(), ActionType.AUTH, input, connection));
            return connection;
        } catch (ToolExecutionException e) {
            if (!e.isRetryable()) {
                throw e;
            }
            log.warn("Connection request failed, reporting to planner [runId={}, app={}]: {}",
                    context.getRunId(), app, e.getMessage());
            append(context, AgentTurn.failed(context.nextStepIndex(), ActionType.AUTH, input, null, e.getMessage()));
            return null;
        }
    }

    // EXECUTE

    private RunResult execute(AgentContext context, AgentAction.Execute action) {
        List<AgentAction.Execute.Call> calls = action.calls();
        ExecutionResult[] results = new ExecutionResult[calls.size()];

        // Resolve ids against what this run has discovered
        Map<Integer, ToolDescriptor> resolved = new LinkedHashMap<>();
        for (int i = 0; i < calls.size(); i++) {
            String toolId = calls.get(i).toolId();
            ToolDescriptor tool = context.getDiscoveredTools().get(toolId);
            if (tool == null) {
                results[i] = ExecutionResult.failure(toolId, ErrorKind.NOT_FOUND,
                        "Tool " + toolId + " was not returned by any search in this run");
            } else {
                resolved.put(i, tool);
            }
        }

        // Gate on connections: nothing runs against an unauthorized app
        Set<String> apps = new LinkedHashSet<>();
        resolved.values().forEach(tool -> tool.connection().ifPresent(apps::add));
        for (String app : apps) {
            Connection connection = requestConnection(context, app);
            if (connection != null && connection.authState() == Connection.AuthState.PENDING) {
                throw new AuthenticationPendingException(connection);
            }
            if (connection == null || !connection.isAuthorized()) {
                String reason = connection == null
                        ? "Connection check for " + app + " failed"
                        : "No authorized connection for " + app;
                ErrorKind kind = connection == null ? ErrorKind.TRANSIENT : ErrorKind.PERMISSION_DENIED;
                resolved.entrySet().removeIf(entry -> {
                    if (app.equals(entry.getValue().requiredConnection())) {
                        results[entry.getKey()] = ExecutionResult.failure(entry.getValue().toolId(), kind, reason);
                        return true;
                    }
                    return false;
                });
            }
        }

        ensureStepAvailable(context);
        transition(context, RunState.EXECUTING);
        if (!resolved.isEmpty()) {
            executeWithRetry(context, calls, resolved, results);
        }

        List<ExecutionResult> outcome = List.of(results);
        List<Map<String, Object>> input = calls.stream()
                .map(call -> Map.<String, Object>of("tool_id", call.toolId(),
                        "input", call.input() != null ? call.input() : Map.of()))
                .toList();
        long failed = outcome.stream().filter(r -> !r.success()).count();
        AgentTurn turn = failed == 0
                ? AgentTurn.ok(context.nextStepIndex(), ActionType.EXECUTE, Map.of("calls", input), outcome)
                : AgentTurn.failed(context.nextStepIndex(), ActionType.EXECUTE, Map.of("calls", input), outcome,
                        failed + " of " + outcome.size() + " tool call(s) failed");
        append(context, turn);
        return null;
    }

    /** Runs the resolved calls, then re-runs only the retryable failures until attempts run out. */
    private void executeWithRetry(AgentContext context,
                                  List<AgentAction.Execute.Call> calls,
                                  Map<Integer, ToolDescriptor> resolved,
                                  ExecutionResult[] results) {
        List<Integer> pending = new ArrayList<>(resolved.keySet());
        int maxAttempts = Math.max(1, config.getExecuteMaxAttempts());

        for (int attempt = 1; attempt <= maxAttempts && !pending.isEmpty(); attempt++) {
            if (attempt > 1) {
                long waitMs = executeBackoff.apply(attempt - 1);
                log.warn("Retrying {} tool call(s) in {}ms (attempt {}/{}) [runId={}]",
                        pending.size(), waitMs, attempt, maxAttempts, context.getRunId());
                if (!pause(waitMs) || isCancelled(context)) {
                    break;
                }
            }

            List<ToolInvocation> invocations = pending.stream()
                    .map(index -> new ToolInvocation(resolved.get(index), calls.get(index).input()))
                    .toList();
            List<ExecutionResult> attemptResults = toolRegistryClient.executeTools(context.getSession(), invocations);

            List<Integer> retry = new ArrayList<>();
            for (int i = 0; i < pending.size(); i++) {
                int index = pending.get(i);
                ExecutionResult result = i < attemptResults.size()
                        ? attemptResults.get(i)
                        : ExecutionResult.failure(calls.get(index).toolId(), ErrorKind.UNKNOWN, "No result returned");
                results[index] = result;
                if (result.isRetryableFailure()) {
                    retry.add(index);
                }
            }
            pending = retry;
        }
    }

    // RESPOND / STOP

    private RunResult respond(AgentContext context, String message, RunResult.Condition condition) {
        if (context.isResponded()) {
            throw new IllegalStateException("Run " + context.getRunId() + " already responded");
        }
        ensureStepAvailable(context);
        transition(context, RunState.RESPONDING);
        context.setResponded(true);

        Map<String, Object> input = Map.of("message", message);
        boolean responseFailed = false;
        ReplyTarget target = context.getRequest().getReplyTarget();

        if (target == null) {
            append(context, AgentTurn.ok(context.nextStepIndex(), ActionType.RESPOND, input, null));
        } else {
            ExecutionResult sent = dispatchReply(context, message);
            responseFailed = !sent.success();
            append(context, responseFailed
                    ? AgentTurn.failed(context.nextStepIndex(), ActionType.RESPOND, input, sent, sent.errorMessage())
                    : AgentTurn.ok(context.nextStepIndex(), ActionType.RESPOND, input, sent));
        }

        transition(context, RunState.DONE);
        return RunResult.builder()
                .runId(context.getRunId())
                .outcome(RunResult.Outcome.DONE)
                .condition(condition)
                .replyMessage(message)
                .responseFailed(responseFailed)
                .turns(List.copyOf(context.getTurns()))
                .build();
    }

    private RunResult stop(AgentContext context, AgentAction.Stop action) {
        append(context, AgentTurn.ok(context.nextStepIndex(), ActionType.STOP, Map.of("reason", action.reason()), null));
        transition(context, RunState.DONE);
        log.info("Run stopped by planner [runId={}, reason='{}']", context.getRunId(), action.reason());
        return RunResult.builder()
                .runId(context.getRunId())
                .outcome(RunResult.Outcome.DONE)
                .condition(RunResult.Condition.STOPPED)
                .turns(List.copyOf(context.getTurns()))
                .build();
    }

    private ExecutionResult dispatchReply(AgentContext context, String message) {
        try {
            return responseDispatcher.reply(context.getSession(), context.getRequest().getReplyTarget(), message);
        } catch (RuntimeException e) {
            log.error("Reply dispatch threw [runId={}]: {}", context.getRunId(), e.getMessage());
            ErrorKind kind = e instanceof ToolExecutionException t ? t.getKind() : ErrorKind.UNKNOWN;
            return ExecutionResult.failure("reply", kind, e.getMessage());
        }
    }

    // Failure paths

    private RunResult fail(AgentContext context, RunResult.Condition condition, String reason) {
        context.setState(RunState.FAILED);
        return RunResult.builder()
                .runId(context.getRunId())
                .outcome(RunResult.Outcome.FAILED)
                .condition(condition)
                .failureReason(reason)
                .turns(List.copyOf(context.getTurns()))
                .build();
    }

    private RunResult cancelled(AgentContext context) {
        log.warn("Run cancelled at step boundary [runId={}, steps={}]",
                context.getRunId(), context.getTurns().size());
        return fail(context, RunResult.Condition.CANCELLED, "The run was cancelled before it finished.");
    }

    /** One plain-language notice for a failed run, when there is a thread to answer on. */
    private void sendFailureReply(AgentContext context, RunResult result) {
        if (context.getRequest().getReplyTarget() == null || context.isResponded()) {
            return;
        }
        context.setResponded(true);
        String message = "<p>Sorry, I couldn't complete your request.</p><p>" + result.getFailureReason() + "</p>";
        ExecutionResult sent = dispatchReply(context, message);
        result.setReplyMessage(message);
        result.setResponseFailed(!sent.success());
    }

    private String pendingMessage(Connection connection) {
        String app = connection.app();
        if (connection.redirectUrl() == null) {
            return "<p>I need access to your " + app + " account to finish this request, "
                    + "but the authorization has not been completed yet.</p>"
                    + "<p>Please authorize " + app + " and send your request again.</p>";
        }
        return "<p>I need access to your " + app + " account to finish this request.</p>"
                + "<p>Please connect it here: <a href=\"" + connection.redirectUrl() + "\">"
                + connection.redirectUrl() + "</a></p>"
                + "<p>Once connected, send your request again.</p>";
    }

    // Bookkeeping

    private void ensureStepAvailable(AgentContext context) {
        if (context.getTurns().size() >= config.getMaxSteps()) {
            throw new StepLimitExceededException(config.getMaxSteps(), context.getTurns());
        }
    }

    private void append(AgentContext context, AgentTurn turn) {
        context.getTurns().add(turn);
        if (turn.error() != null) {
            log.debug("Step {} {} failed [runId={}]: {}", turn.stepIndex(), turn.action(), context.getRunId(), turn.error());
        } else {
            log.debug("Step {} {} ok [runId={}]", turn.stepIndex(), turn.action(), context.getRunId());
        }
    }

    private void transition(AgentContext context, RunState next) {
        if (context.getState().isTerminal()) {
            throw new IllegalStateException("Run " + context.getRunId() + " is already " + context.getState());
        }
        context.setState(next);
    }

    private boolean isCancelled(AgentContext context) {
        return Thread.currentThread().isInterrupted()
                || context.getRequest().getCancellation().getAsBoolean();
    }

    private boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
