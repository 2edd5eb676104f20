package com.deepansh.inbox.resilience;

import com.deepansh.inbox.exception.AgentException;
import com.deepansh.inbox.exception.ReasoningUnavailableException;
import com.deepansh.inbox.llm.FunctionDefinition;
import com.deepansh.inbox.llm.LlmClient;
import com.deepansh.inbox.model.LlmResponse;
import com.deepansh.inbox.model.Message;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the active LLM client that adds retry + circuit breaker.
 *
 * Retry config (resilience4j.retry.instances.reasoning in application.yml):
 * - 3 attempts, exponential backoff 2s then 4s
 * - timeouts, network errors, 429 and 5xx are retried; AgentException is not
 *
 * Circuit breaker config:
 * - opens after 50% failures over a window of 10 calls
 * - half-opens after 30s
 *
 * Unlike a chat front end, a run cannot carry on with an apology as the
 * "answer": exhausted retries become ReasoningUnavailableException and the run fails.
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "reasoning", fallbackMethod = "retryFallback")
    @CircuitBreaker(name = "reasoning", fallbackMethod = "circuitBreakerFallback")
    public LlmResponse chat(List<Message> messages, List<FunctionDefinition> functions) {
        return delegate.chat(messages, functions);
    }

    public LlmResponse retryFallback(List<Message> messages,
                                     List<FunctionDefinition> functions,
                                     Exception ex) {
        if (ex instanceof AgentException agentException) {
            throw agentException;
        }
        log.error("Reasoning call failed after all retries: {}", ex.getMessage());
        throw new ReasoningUnavailableException("Reasoning engine unavailable: " + ex.getMessage(), ex);
    }

    public LlmResponse circuitBreakerFallback(List<Message> messages,
                                              List<FunctionDefinition> functions,
                                              Exception ex) {
        if (ex instanceof AgentException agentException) {
            throw agentException;
        }
        log.error("Reasoning circuit breaker is OPEN, rejecting call: {}", ex.getMessage());
        throw new ReasoningUnavailableException("Reasoning engine circuit is open", ex);
    }
}
