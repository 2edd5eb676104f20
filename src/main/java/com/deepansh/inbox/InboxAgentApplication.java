package com.deepansh.inbox;

import com.deepansh.inbox.config.AgentProperties;
import com.deepansh.inbox.config.CatalogProperties;
import com.deepansh.inbox.llm.LlmProviderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
@EnableConfigurationProperties({AgentProperties.class, CatalogProperties.class, LlmProviderProperties.class})
public class InboxAgentApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(InboxAgentApplication.class, args)));
    }
}
