package com.deepansh.inbox.memory;

import com.deepansh.inbox.config.AgentProperties;
import com.deepansh.inbox.model.ConversationEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Redis-backed conversation history for one e-mail thread.
 *
 * - Key pattern: agent:conversation:{userId}:{threadId}
 * - Stored as a single JSON array, rewritten on every append
 * - Sliding window of the last {@code agent.conversation.window-size} entries
 * - TTL reset on every write, so quiet threads expire after the retention period
 *
 * History is context for the reasoning step, not state the run depends on:
 * Redis being unavailable degrades to an empty history and a skipped save.
 */
@Component
@Slf4j
public class ConversationStore {

    private static final String KEY_PREFIX = "agent:conversation:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final AgentProperties.Conversation config;

    public ConversationStore(StringRedisTemplate redisTemplate,
                             ObjectMapper objectMapper,
                             AgentProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.config = properties.getConversation();
    }

    public List<ConversationEntry> load(String userId, String threadId) {
        String key = buildKey(userId, threadId);
        String json;
        try {
            json = redisTemplate.opsForValue().get(key);
        } catch (DataAccessException e) {
            log.warn("Conversation history unavailable [key={}]: {}", key, e.getMessage());
            return new ArrayList<>();
        }

        if (json == null) {
            log.debug("No conversation history [key={}]", key);
            return new ArrayList<>();
        }

        try {
            List<ConversationEntry> entries = objectMapper.readValue(json, new TypeReference<>() {});
            log.debug("Loaded {} conversation entries [key={}]", entries.size(), key);
            return entries;
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize conversation [key={}]. Returning empty.", key, e);
            return new ArrayList<>();
        }
    }

    /** Appends to the stored history, applies the window and resets the TTL. */
    public void append(String userId, String threadId, List<ConversationEntry> newEntries) {
        if (newEntries.isEmpty()) {
            return;
        }
        List<ConversationEntry> entries = load(userId, threadId);
        entries.addAll(newEntries);
        List<ConversationEntry> windowed = applyWindow(entries);
        String key = buildKey(userId, threadId);

        try {
            String json = objectMapper.writeValueAsString(windowed);
            redisTemplate.opsForValue().set(key, json, config.getRetention());
            log.debug("Saved {} conversation entries [key={}, ttl={}]", windowed.size(), key, config.getRetention());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize conversation [key={}]", key, e);
        } catch (DataAccessException e) {
            log.warn("Conversation history not saved [key={}]: {}", key, e.getMessage());
        }
    }

    private List<ConversationEntry> applyWindow(List<ConversationEntry> entries) {
        int windowSize = config.getWindowSize();
        if (entries.size() <= windowSize) {
            return entries;
        }
        return new ArrayList<>(entries.subList(entries.size() - windowSize, entries.size()));
    }

    private String buildKey(String userId, String threadId) {
        return KEY_PREFIX + userId + ":" + threadId;
    }
}
