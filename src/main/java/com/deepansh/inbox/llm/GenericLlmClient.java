package com.deepansh.inbox.llm;

import com.deepansh.inbox.exception.AgentException;
import com.deepansh.inbox.exception.UnresolvableActionException;
import com.deepansh.inbox.model.LlmResponse;
import com.deepansh.inbox.model.Message;
import com.deepansh.inbox.model.ToolCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completions client. Works with OpenAI, Groq and Gemini.
 *
 * Error handling strategy:
 *
 * | Error                  | Action                                        |
 * |------------------------|-----------------------------------------------|
 * | 401 invalid_api_key    | AgentException (not retried, not CB failure)  |
 * | 429 rate limit         | RuntimeException (retried, counts as failure) |
 * | 400 / other 4xx        | AgentException (not retried, not CB failure)  |
 * | 5xx server error       | RuntimeException (retried, counts as failure) |
 * | network error, timeout | ResourceAccessException (retried)             |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props,
                            ObjectMapper objectMapper,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse chat(List<Message> messages, List<FunctionDefinition> functions) {
        Map<String, Object> requestBody = buildRequestBody(messages, functions);

        log.debug("Sending {} messages and {} functions to {} [model={}]",
                messages.size(), functions.size(), props.getProvider(), props.getModel());

        Map<String, Object> response = restClient.post()
                .uri("/chat/completions")
                .body(requestBody)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 4xx [{}]: {}", props.getProvider(), res.getStatusCode(), body);
                    handle4xxError(body, res.getStatusCode().value());
                })
                .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 5xx [{}]: {}", props.getProvider(), res.getStatusCode(), body);
                    throw new RuntimeException(
                            props.getProvider() + " server error [" + res.getStatusCode() + "]: " + body);
                })
                .body(new ParameterizedTypeReference<>() {});

        if (response == null) {
            throw new AgentException(props.getProvider() + " returned an empty body");
        }
        return parseResponse(response);
    }

    private void handle4xxError(String body, int statusCode) {
        if (statusCode == 401) {
            throw new AgentException(
                    props.getProvider() + " API key is invalid. Check reasoning.api-key.");
        }
        if (statusCode == 429) {
            throw new RuntimeException(props.getProvider() + " rate limit exceeded. Will retry.");
        }
        throw new AgentException(props.getProvider() + " client error [" + statusCode + "]: " + body);
    }

    private Map<String, Object> buildRequestBody(List<Message> messages, List<FunctionDefinition> functions) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", messages.stream().map(this::formatMessage).toList());

        if (!functions.isEmpty()) {
            body.put("tools", functions.stream().map(FunctionDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", props.getToolChoice());
            body.put("parallel_tool_calls", false);
        }
        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());

        if (msg.getRole() == Message.Role.tool) {
            m.put("tool_call_id", msg.getToolCallId());
            m.put("content", msg.getContent());
        } else if (msg.getRole() == Message.Role.assistant) {
            // An assistant message that made a call must carry tool_calls, or the
            // following tool message cannot be correlated.
            m.put("content", msg.getContent());
            if (msg.getToolCalls() != null && !msg.getToolCalls().isEmpty()) {
                m.put("tool_calls", msg.getToolCalls().stream().map(this::formatToolCall).toList());
            }
        } else {
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        }
        return m;
    }

    private Map<String, Object> formatToolCall(ToolCall tc) {
        Map<String, Object> fn = new HashMap<>();
        fn.put("name", tc.getToolName());
        try {
            fn.put("arguments", objectMapper.writeValueAsString(tc.getArguments()));
        } catch (JsonProcessingException e) {
            fn.put("arguments", "{}");
        }
        Map<String, Object> tcMap = new HashMap<>();
        tcMap.put("id", tc.getId());
        tcMap.put("type", "function");
        tcMap.put("function", fn);
        return tcMap;
    }

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new AgentException(props.getProvider() + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage [prompt={} completion={}]", promptTokens, completionTokens);
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        List<Map<String, Object>> toolCalls = message != null
                ? (List<Map<String, Object>>) message.get("tool_calls")
                : null;

        // finish_reason differs between providers when tool_choice=required, so
        // the presence of tool_calls decides.
        if (toolCalls != null && !toolCalls.isEmpty()) {
            Map<String, Object> first    = toolCalls.get(0);
            Map<String, Object> function = (Map<String, Object>) first.get("function");

            Map<String, Object> args;
            try {
                Object rawArgs = function.get("arguments");
                args = rawArgs == null || rawArgs.toString().isBlank()
                        ? Map.of()
                        : objectMapper.readValue(rawArgs.toString(), new TypeReference<>() {});
            } catch (JsonProcessingException e) {
                throw new UnresolvableActionException("Function arguments are not valid JSON", e);
            }

            return LlmResponse.builder()
                    .toolCallRequired(true)
                    .promptTokens(promptTokens)
                    .completionTokens(completionTokens)
                    .toolCall(ToolCall.builder()
                            .id((String) first.get("id"))
                            .toolName((String) function.get("name"))
                            .arguments(args)
                            .build())
                    .build();
        }

        return LlmResponse.builder()
                .toolCallRequired(false)
                .content(message != null ? (String) message.get("content") : null)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }
}
