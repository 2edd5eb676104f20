package com.deepansh.inbox.config;

import com.deepansh.inbox.llm.LlmProviderProperties;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PropertiesValidationTest {

    Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    @Test
    void catalogProperties_missingApiKey_rejected() {
        Set<ConstraintViolation<CatalogProperties>> violations = validator.validate(new CatalogProperties());

        assertThat(violations).singleElement()
                .satisfies(v -> assertThat(v.getMessage()).contains("COMPOSIO_API_KEY"));
    }

    @Test
    void reasoningProperties_missingApiKey_rejected() {
        Set<ConstraintViolation<LlmProviderProperties>> violations = validator.validate(new LlmProviderProperties());

        assertThat(violations).singleElement()
                .satisfies(v -> assertThat(v.getPropertyPath().toString()).isEqualTo("apiKey"));
    }

    @Test
    void catalogProperties_defaults_matchGmailReplyTool() {
        CatalogProperties properties = new CatalogProperties();
        properties.setApiKey("key");

        assertThat(validator.validate(properties)).isEmpty();
        assertThat(properties.getReply().getToolId()).isEqualTo("GMAIL_REPLY_TO_THREAD");
        assertThat(properties.getMetaTools().isMetaTool("COMPOSIO_SEARCH_TOOLS")).isTrue();
        assertThat(properties.getMetaTools().isMetaTool("GITHUB_CREATE_AN_ISSUE")).isFalse();
    }
}
