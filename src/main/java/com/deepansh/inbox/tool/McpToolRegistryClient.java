package com.deepansh.inbox.tool;

import com.deepansh.inbox.config.CatalogProperties;
import com.deepansh.inbox.exception.ToolExecutionException;
import com.deepansh.inbox.model.Connection;
import com.deepansh.inbox.model.ErrorKind;
import com.deepansh.inbox.model.ExecutionResult;
import com.deepansh.inbox.model.Session;
import com.deepansh.inbox.model.ToolDescriptor;
import com.deepansh.inbox.model.ToolInvocation;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Catalog client speaking MCP to the session's tool-router endpoint.
 *
 * Search, connect and execute are each backed by one catalog meta-tool
 * (names in {@code catalog.meta-tools}). Those meta-tools are plumbing: they
 * are never offered to the planner and cannot be executed through
 * {@link #executeTools}.
 *
 * Catalog responses are read leniently. Results may sit at the top level or
 * under {@code data}, and field names vary between catalog versions.
 */
@Component
@Slf4j
public class McpToolRegistryClient implements ToolRegistryClient {

    private final McpTransport transport;
    private final CatalogProperties.MetaTools metaTools;
    private final ObjectMapper objectMapper;

    public McpToolRegistryClient(RestClient.Builder restClientBuilder,
                                 CatalogProperties catalogProperties,
                                 ObjectMapper objectMapper) {
        this.transport = new McpTransport(restClientBuilder.clone().build(), objectMapper);
        this.metaTools = catalogProperties.getMetaTools();
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ToolDescriptor> searchTools(Session session, String intent) {
        McpTransport.ToolResult result = transport.callTool(session, metaTools.getSearch(),
                Map.of("use_case", intent));
        if (result.error()) {
            throw new ToolExecutionException(ErrorClassifier.fromMessage(result.text()),
                    "Tool search failed: " + result.text());
        }

        JsonNode data = dataOf(result.payload());
        JsonNode entries = firstArray(data, "results", "tools", "main_tools", "items");
        List<ToolDescriptor> descriptors = new ArrayList<>();
        for (JsonNode entry : entries) {
            ToolDescriptor descriptor = toDescriptor(entry);
            if (descriptor != null) {
                descriptors.add(descriptor);
            }
        }

        log.info("Tool search [userId={}, intent='{}'] -> {} tool(s)",
                session.getUserId(), intent, descriptors.size());
        return descriptors;
    }

    @Override
    public Connection requestConnection(Session session, String app) {
        String toolkit = app.toLowerCase(Locale.ROOT);
        McpTransport.ToolResult result = transport.callTool(session, metaTools.getConnect(),
                Map.of("toolkits", List.of(toolkit)));
        if (result.error()) {
            throw new ToolExecutionException(ErrorClassifier.fromMessage(result.text()),
                    "Connection request failed for '" + app + "': " + result.text());
        }

        JsonNode entry = connectionEntry(dataOf(result.payload()), toolkit);
        String status = text(entry, "status", "connection_status", "state");
        Connection.AuthState state = toAuthState(status);
        Connection connection = new Connection(
                text(entry, "connected_account_id", "connection_id", "id"),
                toolkit,
                state,
                text(entry, "redirect_url", "redirectUrl", "auth_url"));

        if (connection.isAuthorized() && connection.connectionId() != null) {
            session.recordAuthorized(connection.connectionId());
        }
        log.info("Connection [userId={}, app={}] -> {}", session.getUserId(), toolkit, state);
        return connection;
    }

    @Override
    public List<ExecutionResult> executeTools(Session session, List<ToolInvocation> invocations) {
        if (invocations.isEmpty()) {
            return List.of();
        }

        // Meta-tools are rejected per element; the rest still go out in one batch.
        ExecutionResult[] results = new ExecutionResult[invocations.size()];
        List<Integer> sentIndexes = new ArrayList<>();
        List<Map<String, Object>> batch = new ArrayList<>();
        for (int i = 0; i < invocations.size(); i++) {
            ToolInvocation invocation = invocations.get(i);
            String toolId = invocation.tool().toolId();
            if (metaTools.isMetaTool(toolId)) {
                results[i] = ExecutionResult.failure(toolId, ErrorKind.INVALID_INPUT,
                        "Catalog meta-tool " + toolId + " cannot be executed directly");
                continue;
            }
            Map<String, Object> call = new LinkedHashMap<>();
            call.put("tool_slug", toolId);
            call.put("arguments", invocation.input() != null ? invocation.input() : Map.of());
            batch.add(call);
            sentIndexes.add(i);
        }

        if (!batch.isEmpty()) {
            fillBatchResults(session, invocations, batch, sentIndexes, results);
        }

        List<ExecutionResult> ordered = List.of(results);
        long failed = ordered.stream().filter(r -> !r.success()).count();
        log.info("Executed {} tool(s) [userId={}, failed={}]", ordered.size(), session.getUserId(), failed);
        return ordered;
    }

    private void fillBatchResults(Session session,
                                  List<ToolInvocation> invocations,
                                  List<Map<String, Object>> batch,
                                  List<Integer> sentIndexes,
                                  ExecutionResult[] results) {
        McpTransport.ToolResult result;
        try {
            result = transport.callTool(session, metaTools.getExecute(),
                    Map.of("tools", batch, "sync_response_to_workbench", false));
        } catch (ToolExecutionException e) {
            for (int index : sentIndexes) {
                results[index] = ExecutionResult.failure(
                        invocations.get(index).tool().toolId(), e.getKind(), e.getMessage());
            }
            return;
        }

        JsonNode data = dataOf(result.payload());
        JsonNode entries = firstArray(data, "results", "responses", "data");
        if (result.error() && entries.isEmpty()) {
            ErrorKind kind = ErrorClassifier.fromMessage(result.text());
            for (int index : sentIndexes) {
                results[index] = ExecutionResult.failure(
                        invocations.get(index).tool().toolId(), kind, result.text());
            }
            return;
        }

        for (int position = 0; position < sentIndexes.size(); position++) {
            int index = sentIndexes.get(position);
            String toolId = invocations.get(index).tool().toolId();
            JsonNode entry = position < entries.size() ? entries.get(position) : null;
            results[index] = entry == null
                    ? ExecutionResult.failure(toolId, ErrorKind.UNKNOWN, "Catalog returned no result for " + toolId)
                    : toResult(toolId, entry);
        }
    }

    private ExecutionResult toResult(String toolId, JsonNode entry) {
        JsonNode response = entry.has("response") ? entry.get("response") : entry;

        String error = text(response, "error");
        if (error == null) {
            error = text(entry, "error");
        }
        boolean successful = response.path("successful").asBoolean(error == null);

        if (successful) {
            JsonNode data = response.has("data") ? response.get("data") : response;
            return ExecutionResult.success(toolId, objectMapper.convertValue(data, new TypeReference<Object>() {}));
        }
        String message = error != null ? error : "Tool " + toolId + " reported failure";
        return ExecutionResult.failure(toolId, ErrorClassifier.fromMessage(message), message);
    }

    private ToolDescriptor toDescriptor(JsonNode entry) {
        if (entry.isTextual()) {
            return new ToolDescriptor(entry.asText(), null, null, null, Map.of());
        }
        String toolId = text(entry, "tool_slug", "slug", "name", "tool_id");
        if (toolId == null) {
            return null;
        }
        String app = text(entry, "toolkit", "toolkit_slug", "app");
        if (app == null && entry.path("toolkit").isObject()) {
            app = text(entry.get("toolkit"), "slug", "name");
        }
        boolean noAuth = entry.path("no_auth").asBoolean(false)
                || !entry.path("requires_auth").asBoolean(true);
        JsonNode schemaNode = firstPresent(entry, "input_schema", "input_parameters", "parameters", "inputSchema");
        Map<String, Object> schema = schemaNode != null && schemaNode.isObject()
                ? objectMapper.convertValue(schemaNode, new TypeReference<Map<String, Object>>() {})
                : Map.of();

        return new ToolDescriptor(
                toolId,
                app != null ? app.toLowerCase(Locale.ROOT) : null,
                text(entry, "description", "tool_description"),
                noAuth || app == null ? null : app.toLowerCase(Locale.ROOT),
                schema);
    }

    private JsonNode connectionEntry(JsonNode data, String toolkit) {
        JsonNode results = firstPresent(data, "results", "connections", "toolkits");
        if (results == null) {
            return data;
        }
        if (results.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = results.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getKey().equalsIgnoreCase(toolkit)) {
                    return field.getValue();
                }
            }
            return results;
        }
        for (JsonNode entry : results) {
            String name = text(entry, "toolkit", "app", "name");
            if (toolkit.equalsIgnoreCase(name)) {
                return entry;
            }
        }
        return results.isEmpty() ? data : results.get(0);
    }

    static Connection.AuthState toAuthState(String status) {
        if (status == null) {
            return Connection.AuthState.NONE;
        }
        return switch (status.toLowerCase(Locale.ROOT)) {
            case "active", "connected", "authorized", "enabled" -> Connection.AuthState.AUTHORIZED;
            case "initiated", "initializing", "pending", "redirect_required" -> Connection.AuthState.PENDING;
            default -> Connection.AuthState.NONE;
        };
    }

    private static JsonNode dataOf(JsonNode payload) {
        if (payload == null) {
            return MissingNode.getInstance();
        }
        JsonNode data = payload.get("data");
        return data != null && (data.isObject() || data.isArray()) ? data : payload;
    }

    private static JsonNode firstArray(JsonNode node, String... fields) {
        if (node.isArray()) {
            return node;
        }
        for (String field : fields) {
            JsonNode candidate = node.get(field);
            if (candidate != null && candidate.isArray()) {
                return candidate;
            }
        }
        return JsonNodeFactory.instance.arrayNode();
    }

    private static JsonNode firstPresent(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode candidate = node.get(field);
            if (candidate != null && !candidate.isNull()) {
                return candidate;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String... fields) {
        if (node == null) {
            return null;
        }
        JsonNode value = firstPresent(node, fields);
        return value != null && value.isValueNode() && !value.asText().isBlank() ? value.asText() : null;
    }
}
