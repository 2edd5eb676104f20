package com.deepansh.inbox.llm;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Reasoning engine settings, bound from application.yml under "reasoning".
 * Any OpenAI-compatible chat completions endpoint works (OpenAI, Groq, Gemini).
 */
@ConfigurationProperties(prefix = "reasoning")
@Validated
@Data
public class LlmProviderProperties {

    private String provider = "openai";

    @NotBlank(message = "reasoning.api-key is required (set OPENAI_API_KEY)")
    private String apiKey;

    private String baseUrl = "https://api.openai.com/v1";
    private String model = "gpt-4o";
    private int maxTokens = 2048;
    private double temperature = 0.2;

    /** "required" forces one function per turn; "auto" lets the engine answer in text */
    private String toolChoice = "required";
}
