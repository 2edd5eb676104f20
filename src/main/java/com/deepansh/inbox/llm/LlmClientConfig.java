package com.deepansh.inbox.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the raw reasoning client from "reasoning.*".
 * Wrapped by ResilientLlmClient with retry + circuit breaker.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class LlmClientConfig {

    private final LlmProviderProperties props;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Reasoning provider : {}", props.getProvider().toUpperCase());
        log.info("  Model              : {}", props.getModel());
        log.info("  Key                : {}", maskKey(props.getApiKey()));
        log.info("================================================================");
    }

    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(ObjectMapper objectMapper, RestClient.Builder builder) {
        return new GenericLlmClient(props, objectMapper, builder.clone());
    }

    private String maskKey(String key) {
        if (key == null || key.length() <= 12) {
            return "****";
        }
        return key.substring(0, 8) + "..." + key.substring(key.length() - 4);
    }
}
