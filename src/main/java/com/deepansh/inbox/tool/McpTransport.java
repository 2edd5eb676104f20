package com.deepansh.inbox.tool;

import com.deepansh.inbox.exception.ToolExecutionException;
import com.deepansh.inbox.model.ErrorKind;
import com.deepansh.inbox.model.Session;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 over MCP streamable HTTP.
 *
 * Every request is a POST to the session handle URL. The server may answer
 * with plain JSON or with a short SSE stream carrying the response; both are
 * accepted. The protocol session id returned by {@code initialize} is kept per
 * handle and sent back on every later request. A 404 for a known protocol
 * session means the server dropped it, and the handshake is redone once.
 *
 * Handshakes are single-flight per handle: concurrent first calls share one
 * {@code initialize}. Entries live as long as the owning {@link Session} and
 * are pruned once it has expired.
 */
@Slf4j
class McpTransport {

    static final String SESSION_HEADER = "Mcp-Session-Id";
    private static final String JSONRPC_VERSION = "2.0";
    private static final String PROTOCOL_VERSION = "2025-03-26";
    private static final String NO_SESSION = "";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AtomicLong requestIds = new AtomicLong(1);
    private final Clock clock;
    private final ConcurrentHashMap<String, Handshake> handshakes = new ConcurrentHashMap<>();

    McpTransport(RestClient restClient, ObjectMapper objectMapper) {
        this(restClient, objectMapper, Clock.systemUTC());
    }

    McpTransport(RestClient restClient, ObjectMapper objectMapper, Clock clock) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    private record Handshake(CompletableFuture<String> protocolSession, Instant expiresAt) {
    }

    /** Result of a tools/call: the first text content, parsed as JSON when it is JSON. */
    record ToolResult(boolean error, JsonNode payload, String text) {
    }

    ToolResult callTool(Session session, String toolName, Map<String, Object> arguments) {
        String handle = session.getHandle();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", toolName);
        params.put("arguments", arguments);

        pruneExpired(handle);
        String protocolSession = ensureInitialized(handle, session.getExpiresAt());
        JsonNode result;
        try {
            result = request(handle, protocolSession, "tools/call", params);
        } catch (ToolExecutionException e) {
            if (e.getKind() != ErrorKind.NOT_FOUND || NO_SESSION.equals(protocolSession)) {
                throw e;
            }
            log.info("MCP session expired, re-initializing [handle={}]", abbreviate(handle));
            forget(handle);
            result = request(handle, ensureInitialized(handle, session.getExpiresAt()), "tools/call", params);
        }
        return toToolResult(toolName, result);
    }

    /** Drops the protocol session kept for a handle. */
    void forget(String handle) {
        handshakes.remove(handle);
    }

    int handshakeCount() {
        return handshakes.size();
    }

    private void pruneExpired(String currentHandle) {
        Instant now = clock.instant();
        handshakes.entrySet().removeIf(entry -> !entry.getKey().equals(currentHandle)
                && entry.getValue().expiresAt() != null
                && !now.isBefore(entry.getValue().expiresAt()));
    }

    private String ensureInitialized(String handle, Instant expiresAt) {
        while (true) {
            Handshake fresh = new Handshake(new CompletableFuture<>(), expiresAt);
            Handshake existing = handshakes.putIfAbsent(handle, fresh);
            if (existing == null) {
                try {
                    fresh.protocolSession().complete(initialize(handle));
                } catch (RuntimeException e) {
                    handshakes.remove(handle, fresh);
                    fresh.protocolSession().completeExceptionally(e);
                    throw e;
                }
                return fresh.protocolSession().join();
            }
            if (existing.protocolSession().isCompletedExceptionally()) {
                handshakes.remove(handle, existing);
                continue;
            }
            try {
                return existing.protocolSession().join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof ToolExecutionException tee) {
                    throw tee;
                }
                throw new ToolExecutionException(ErrorKind.UNKNOWN, "MCP handshake failed: " + e.getMessage(), e);
            }
        }
    }

    private String initialize(String handle) {
        Map<String, Object> params = Map.of(
                "protocolVersion", PROTOCOL_VERSION,
                "capabilities", Map.of(),
                "clientInfo", Map.of("name", "inbox-agent", "version", "0.1.0"));

        Exchange init = post(handle, null, envelope("initialize", params, true));
        String protocolSession = init.sessionId() != null ? init.sessionId() : NO_SESSION;
        unwrap("initialize", init.message());

        post(handle, protocolSession, envelope("notifications/initialized", Map.of(), false));
        log.debug("MCP handshake complete [handle={}, stateful={}]",
                abbreviate(handle), !protocolSession.isEmpty());
        return protocolSession;
    }

    private JsonNode request(String handle, String protocolSession, String method, Map<String, Object> params) {
        Exchange exchange = post(handle, protocolSession, envelope(method, params, true));
        return unwrap(method, exchange.message());
    }

    private Map<String, Object> envelope(String method, Map<String, Object> params, boolean expectsResponse) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("jsonrpc", JSONRPC_VERSION);
        if (expectsResponse) {
            message.put("id", requestIds.getAndIncrement());
        }
        message.put("method", method);
        message.put("params", params);
        return message;
    }

    private record Exchange(String sessionId, JsonNode message) {
    }

    private Exchange post(String handle, String protocolSession, Map<String, Object> message) {
        try {
            return restClient.post()
                    .uri(handle)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.ACCEPT, "application/json, text/event-stream")
                    .headers(h -> {
                        if (protocolSession != null && !protocolSession.isEmpty()) {
                            h.set(SESSION_HEADER, protocolSession);
                        }
                    })
                    .body(message)
                    .exchange((request, response) -> {
                        int status = response.getStatusCode().value();
                        String body = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        if (response.getStatusCode().isError()) {
                            log.warn("Catalog returned HTTP {} for {}: {}", status, message.get("method"), abbreviate(body));
                            throw new ToolExecutionException(ErrorClassifier.fromStatus(status),
                                    "Catalog returned HTTP " + status + " for " + message.get("method"));
                        }
                        MediaType contentType = response.getHeaders().getContentType();
                        return new Exchange(response.getHeaders().getFirst(SESSION_HEADER), parseBody(body, contentType));
                    });
        } catch (ResourceAccessException e) {
            ErrorKind kind = ErrorClassifier.fromTransport(e);
            log.warn("Catalog unreachable [method={}, kind={}]: {}", message.get("method"), kind, e.getMessage());
            throw new ToolExecutionException(kind, "Catalog unreachable: " + e.getMessage(), e);
        }
    }

    private JsonNode parseBody(String body, MediaType contentType) throws IOException {
        if (body == null || body.isBlank()) {
            return null;
        }
        if (contentType != null && contentType.isCompatibleWith(MediaType.TEXT_EVENT_STREAM)) {
            return lastResponseEvent(body);
        }
        return objectMapper.readTree(body);
    }

    /** Picks the JSON-RPC response out of an SSE body; server notifications are skipped. */
    private JsonNode lastResponseEvent(String body) throws IOException {
        JsonNode response = null;
        StringBuilder data = new StringBuilder();
        for (String line : (body + "\n\n").split("\r?\n", -1)) {
            if (line.startsWith("data:")) {
                if (!data.isEmpty()) {
                    data.append('\n');
                }
                data.append(line.substring(5).stripLeading());
            } else if (line.isEmpty() && !data.isEmpty()) {
                JsonNode event = objectMapper.readTree(data.toString());
                if (event.has("result") || event.has("error")) {
                    response = event;
                }
                data.setLength(0);
            }
        }
        return response;
    }

    private JsonNode unwrap(String method, JsonNode message) {
        if (message == null) {
            throw new ToolExecutionException(ErrorKind.TRANSIENT, "Catalog sent no response to " + method);
        }
        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            String text = error.path("message").asText("Unknown MCP error");
            int code = error.path("code").asInt(-1);
            ErrorKind kind = code == -32602 ? ErrorKind.INVALID_INPUT : ErrorClassifier.fromMessage(text);
            throw new ToolExecutionException(kind, "MCP error " + code + " on " + method + ": " + text);
        }
        return message.get("result");
    }

    private ToolResult toToolResult(String toolName, JsonNode result) {
        if (result == null || result.isNull()) {
            throw new ToolExecutionException(ErrorKind.UNKNOWN, "No result from catalog tool " + toolName);
        }
        boolean isError = result.path("isError").asBoolean(false);

        String text = null;
        for (JsonNode item : result.path("content")) {
            if ("text".equals(item.path("type").asText()) && item.has("text")) {
                text = item.get("text").asText();
                break;
            }
        }
        if (text == null) {
            JsonNode structured = result.get("structuredContent");
            return new ToolResult(isError, structured, structured != null ? structured.toString() : "");
        }
        return new ToolResult(isError, parseLenient(text), text);
    }

    private JsonNode parseLenient(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(text);
        }
    }

    private static String abbreviate(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= 80 ? s : s.substring(0, 80) + "...";
    }
}
