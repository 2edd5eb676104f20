package com.deepansh.inbox.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Strongly-typed configuration for the loop, sessions, the trigger
 * subscription and the worker pool. Bound from application.yml under "agent".
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private Loop loop = new Loop();
    private Session session = new Session();
    private Trigger trigger = new Trigger();
    private Workers workers = new Workers();
    private Http http = new Http();
    private Conversation conversation = new Conversation();

    @Data
    public static class Loop {
        /** Hard cap on turns per run */
        private int maxSteps = 12;
        /** Extra planning attempts when the reasoning step returns no usable action */
        private int planningRetries = 1;
        /** Total attempts for a retryable tool failure, first try included */
        private int executeMaxAttempts = 3;
        private Duration executeBackoff = Duration.ofMillis(500);
    }

    @Data
    public static class Session {
        private int createMaxAttempts = 3;
        private Duration createBackoff = Duration.ofSeconds(1);
        /** Sessions are treated as expired this long before their real expiry */
        private Duration expirySkew = Duration.ofSeconds(30);
    }

    @Data
    public static class Trigger {
        /** Server-sent event stream delivering trigger events */
        private String streamUrl = "https://backend.composio.dev/api/v3/trigger_instances/stream";
        /** Only events delivered for this trigger are handled; empty accepts all */
        private String triggerId = "";
        /** Address of the monitored inbox; mail from it is ignored */
        private String inboxOwner = "";
        private int dedupCapacity = 1000;
        private Duration reconnectBase = Duration.ofSeconds(1);
        private Duration reconnectMax = Duration.ofSeconds(60);
        private double reconnectJitter = 0.5;
        private int dispatchMaxAttempts = 3;
        private Duration dispatchBackoff = Duration.ofMillis(200);
    }

    @Data
    public static class Workers {
        private int corePoolSize = 4;
        private int maxPoolSize = 8;
        private int queueCapacity = 50;
        private int shutdownGraceSeconds = 30;
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration responseTimeout = Duration.ofSeconds(60);
        /** Read timeout on the trigger stream; a silent stream past this is reconnected */
        private Duration streamIdleTimeout = Duration.ofMinutes(5);
    }

    @Data
    public static class Conversation {
        private int windowSize = 10;
        private Duration retention = Duration.ofDays(7);
    }
}
