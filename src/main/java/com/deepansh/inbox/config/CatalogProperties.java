package com.deepansh.inbox.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tool catalog settings, bound from application.yml under "catalog".
 * The API key is required: startup fails without it.
 */
@ConfigurationProperties(prefix = "catalog")
@Validated
@Data
public class CatalogProperties {

    @NotBlank(message = "catalog.api-key is required (set COMPOSIO_API_KEY)")
    private String apiKey;

    private String baseUrl = "https://backend.composio.dev";
    private String sessionPath = "/api/v3/labs/tool_router/session";

    /** Session lifetime assumed when the session API does not report one */
    private Duration defaultSessionTtl = Duration.ofMinutes(30);

    private List<Toolkit> toolkits = new ArrayList<>();

    private MetaTools metaTools = new MetaTools();
    private Reply reply = new Reply();

    @Data
    public static class Toolkit {
        private String toolkit;
        private String authConfig;
    }

    /** Catalog-provided tools backing search / connect / execute */
    @Data
    public static class MetaTools {
        private String search = "COMPOSIO_SEARCH_TOOLS";
        private String connect = "COMPOSIO_MANAGE_CONNECTIONS";
        private String execute = "COMPOSIO_MULTI_EXECUTE_TOOL";

        public boolean isMetaTool(String toolId) {
            return search.equals(toolId) || connect.equals(toolId) || execute.equals(toolId);
        }
    }

    @Data
    public static class Reply {
        private String toolId = "GMAIL_REPLY_TO_THREAD";
        private String app = "gmail";
        private boolean html = true;
    }
}
