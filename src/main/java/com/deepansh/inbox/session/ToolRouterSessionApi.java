package com.deepansh.inbox.session;

import com.deepansh.inbox.config.CatalogProperties;
import com.deepansh.inbox.exception.ToolExecutionException;
import com.deepansh.inbox.model.ErrorKind;
import com.deepansh.inbox.tool.ErrorClassifier;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session API of the tool router.
 *
 * Sessions are created with manually managed connections, so authorization
 * only ever happens when the loop asks for it.
 */
@Component
@Slf4j
public class ToolRouterSessionApi implements SessionApiClient {

    private final CatalogProperties props;
    private final RestClient restClient;

    public ToolRouterSessionApi(CatalogProperties props, RestClient.Builder restClientBuilder) {
        this.props = props;
        this.restClient = restClientBuilder.clone()
                .baseUrl(props.getBaseUrl())
                .defaultHeader("x-api-key", props.getApiKey())
                .build();
    }

    @Override
    public SessionGrant create(String userId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", userId);
        body.put("manually_manage_connections", true);
        if (!props.getToolkits().isEmpty()) {
            List<Map<String, Object>> toolkits = props.getToolkits().stream()
                    .map(this::toolkitEntry)
                    .toList();
            body.put("toolkits", toolkits);
        }

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(props.getSessionPath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        String text = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        int status = res.getStatusCode().value();
                        log.warn("Session API returned HTTP {} [userId={}]: {}", status, userId, text);
                        throw new ToolExecutionException(ErrorClassifier.fromStatus(status),
                                "Session API returned HTTP " + status);
                    })
                    .body(JsonNode.class);
        } catch (ResourceAccessException e) {
            throw new ToolExecutionException(ErrorClassifier.fromTransport(e),
                    "Session API unreachable: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ToolExecutionException(ErrorKind.TRANSIENT, "Session API returned an empty body");
        }

        String handle = firstText(response, "url", "mcp_url");
        if (handle == null) {
            handle = firstText(response.path("mcp"), "url");
        }
        if (handle == null) {
            throw new ToolExecutionException(ErrorKind.UNKNOWN, "Session API response has no session URL");
        }

        String sessionId = firstText(response, "session_id", "id");
        return new SessionGrant(sessionId, handle, parseInstant(firstText(response, "expires_at", "expiresAt")));
    }

    private Map<String, Object> toolkitEntry(CatalogProperties.Toolkit toolkit) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("toolkit", toolkit.getToolkit());
        if (toolkit.getAuthConfig() != null && !toolkit.getAuthConfig().isBlank()) {
            entry.put("auth_config", toolkit.getAuthConfig());
        }
        return entry;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable session expiry '{}'", value);
            return null;
        }
    }
}
