package com.deepansh.inbox.llm;

import com.deepansh.inbox.exception.UnresolvableActionException;
import com.deepansh.inbox.model.ActionType;
import com.deepansh.inbox.model.AgentAction;
import com.deepansh.inbox.model.AgentTurn;
import com.deepansh.inbox.model.ConversationEntry;
import com.deepansh.inbox.model.LlmResponse;
import com.deepansh.inbox.model.Message;
import com.deepansh.inbox.model.ToolCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reasoning engine backed by a function-calling LLM.
 *
 * The five loop actions are offered as functions; whichever one the model
 * calls becomes the next {@link AgentAction}. Earlier turns are replayed as
 * assistant call / tool result pairs so the model sees every observation.
 */
@Service
@Slf4j
public class LlmReasoningEngine implements ReasoningEngine {

    static final String SEARCH_TOOLS = "search_tools";
    static final String AUTHENTICATE = "authenticate";
    static final String EXECUTE_TOOLS = "execute_tools";
    static final String RESPOND = "respond";
    static final String STOP = "stop";

    private static final int MAX_OBSERVATION_CHARS = 6000;

    private static final String SYSTEM_PROMPT = """
            You are an e-mail assistant. Each request is an e-mail whose sender wants something done.

            Work one step at a time by calling exactly one function:
            - search_tools: find catalog tools for what needs doing. Tools can only be executed after a search returned them.
            - authenticate: connect the sender's account for an app when a tool needs it.
            - execute_tools: run one or more found tools with inputs that match their input schema.
            - respond: finish with the reply to the sender, describing what you did. Include links as plain URLs.
            - stop: finish without replying, when no reply is warranted.

            Rules:
            - Never use e-mail sending or replying tools yourself; respond is delivered as the reply.
            - If a tool returns an error, do not repeat the identical call. Try another approach or explain the limitation.
            - Format the respond message in HTML (<p>, <ul>, <li>, <a>, <strong>), not markdown.
            - You have the earlier messages of this thread; refer to them when relevant.
            """;

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;
    private final List<FunctionDefinition> functions = buildFunctions();

    public LlmReasoningEngine(LlmClient llmClient, ObjectMapper objectMapper) {
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public AgentAction nextAction(String instruction, List<ConversationEntry> conversation, List<AgentTurn> history) {
        List<Message> messages = buildMessages(instruction, conversation, history);
        LlmResponse response = llmClient.chat(messages, functions);

        if (!response.isToolCallRequired()) {
            String content = response.getContent();
            if (content == null || content.isBlank()) {
                throw new UnresolvableActionException("Reasoning engine returned neither an action nor text");
            }
            log.debug("Reasoning engine answered in text; treating it as the reply");
            return new AgentAction.Respond(content);
        }

        return toAction(response.getToolCall());
    }

    List<Message> buildMessages(String instruction, List<ConversationEntry> conversation, List<AgentTurn> history) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.builder().role(Message.Role.system).content(SYSTEM_PROMPT).build());

        for (ConversationEntry entry : conversation) {
            messages.add(Message.builder()
                    .role(entry.getRole() == ConversationEntry.Role.assistant
                            ? Message.Role.assistant : Message.Role.user)
                    .content(entry.getContent())
                    .build());
        }

        messages.add(Message.builder().role(Message.Role.user).content(instruction).build());

        for (AgentTurn turn : history) {
            String callId = "step-" + turn.stepIndex();
            messages.add(Message.builder()
                    .role(Message.Role.assistant)
                    .toolCalls(List.of(ToolCall.builder()
                            .id(callId)
                            .toolName(functionName(turn.action()))
                            .arguments(argumentsOf(turn))
                            .build()))
                    .build());
            messages.add(Message.builder()
                    .role(Message.Role.tool)
                    .toolCallId(callId)
                    .content(observationOf(turn))
                    .build());
        }
        return messages;
    }

    private AgentAction toAction(ToolCall call) {
        String name = call.getToolName();
        Map<String, Object> args = call.getArguments() != null ? call.getArguments() : Map.of();

        if (name == null) {
            throw new UnresolvableActionException("Function call without a name");
        }

        return switch (name) {
            case SEARCH_TOOLS -> new AgentAction.Search(requireText(args, "intent", name));
            case AUTHENTICATE -> new AgentAction.Authenticate(requireText(args, "app", name));
            case EXECUTE_TOOLS -> new AgentAction.Execute(parseCalls(args));
            case RESPOND -> new AgentAction.Respond(requireText(args, "message", name));
            case STOP -> new AgentAction.Stop(args.get("reason") != null ? args.get("reason").toString() : "");
            default -> throw new UnresolvableActionException("Unknown action '" + name + "'");
        };
    }

    @SuppressWarnings("unchecked")
    private List<AgentAction.Execute.Call> parseCalls(Map<String, Object> args) {
        if (!(args.get("calls") instanceof List<?> rawCalls) || rawCalls.isEmpty()) {
            throw new UnresolvableActionException("execute_tools needs a non-empty 'calls' array");
        }
        List<AgentAction.Execute.Call> calls = new ArrayList<>();
        for (Object raw : rawCalls) {
            if (!(raw instanceof Map<?, ?> callMap)) {
                throw new UnresolvableActionException("execute_tools call is not an object: " + raw);
            }
            Object toolId = callMap.get("tool_id");
            if (toolId == null || toolId.toString().isBlank()) {
                throw new UnresolvableActionException("execute_tools call is missing 'tool_id'");
            }
            Object input = callMap.get("input");
            calls.add(new AgentAction.Execute.Call(toolId.toString(),
                    input instanceof Map<?, ?> ? (Map<String, Object>) input : Map.of()));
        }
        return calls;
    }

    private String requireText(Map<String, Object> args, String key, String function) {
        Object value = args.get(key);
        if (value == null || value.toString().isBlank()) {
            throw new UnresolvableActionException(function + " is missing '" + key + "'");
        }
        return value.toString();
    }

    private String functionName(ActionType type) {
        return switch (type) {
            case SEARCH -> SEARCH_TOOLS;
            case AUTH -> AUTHENTICATE;
            case EXECUTE -> EXECUTE_TOOLS;
            case RESPOND -> RESPOND;
            case STOP -> STOP;
        };
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> argumentsOf(AgentTurn turn) {
        if (turn.input() instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("value", turn.input());
        return args;
    }

    private String observationOf(AgentTurn turn) {
        Map<String, Object> observation = new LinkedHashMap<>();
        observation.put("ok", turn.error() == null);
        if (turn.output() != null) {
            observation.put("result", turn.output());
        }
        turn.errorMessage().ifPresent(error -> observation.put("error", error));

        String json;
        try {
            json = objectMapper.writeValueAsString(observation);
        } catch (JsonProcessingException e) {
            json = String.valueOf(observation);
        }
        return json.length() <= MAX_OBSERVATION_CHARS
                ? json
                : json.substring(0, MAX_OBSERVATION_CHARS) + "...[truncated]";
    }

    private static List<FunctionDefinition> buildFunctions() {
        return List.of(
                FunctionDefinition.builder()
                        .name(SEARCH_TOOLS)
                        .description("Search the tool catalog for tools that can perform a task. Returns tool ids, their app and input schema.")
                        .parameters(Map.of(
                                "type", "object",
                                "properties", Map.of(
                                        "intent", Map.of("type", "string",
                                                "description", "What needs to be done, e.g. 'create a GitHub issue'")),
                                "required", List.of("intent")))
                        .build(),
                FunctionDefinition.builder()
                        .name(AUTHENTICATE)
                        .description("Connect the sender's account for an app, e.g. 'github'. Returns the connection state.")
                        .parameters(Map.of(
                                "type", "object",
                                "properties", Map.of(
                                        "app", Map.of("type", "string", "description", "App / toolkit name")),
                                "required", List.of("app")))
                        .build(),
                FunctionDefinition.builder()
                        .name(EXECUTE_TOOLS)
                        .description("Run one or more tools returned by search_tools. Each call is reported separately.")
                        .parameters(Map.of(
                                "type", "object",
                                "properties", Map.of(
                                        "calls", Map.of(
                                                "type", "array",
                                                "items", Map.of(
                                                        "type", "object",
                                                        "properties", Map.of(
                                                                "tool_id", Map.of("type", "string"),
                                                                "input", Map.of("type", "object")),
                                                        "required", List.of("tool_id", "input")))),
                                "required", List.of("calls")))
                        .build(),
                FunctionDefinition.builder()
                        .name(RESPOND)
                        .description("Finish the task and reply to the sender with an HTML message.")
                        .parameters(Map.of(
                                "type", "object",
                                "properties", Map.of(
                                        "message", Map.of("type", "string", "description", "HTML reply body")),
                                "required", List.of("message")))
                        .build(),
                FunctionDefinition.builder()
                        .name(STOP)
                        .description("Finish without replying.")
                        .parameters(Map.of(
                                "type", "object",
                                "properties", Map.of(
                                        "reason", Map.of("type", "string")),
                                "required", List.of()))
                        .build()
        );
    }
}
