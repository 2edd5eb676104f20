package com.deepansh.inbox.trigger;

import com.deepansh.inbox.exception.MalformedEventException;
import com.deepansh.inbox.model.EmailPayload;
import com.deepansh.inbox.model.TriggerEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns a raw event into a validated {@link TriggerEvent}.
 *
 * Two shapes are read:
 * - the normalized one: {@code {id, userId, source, occurredAt, payload:{sender, subject, body, threadId}}}
 * - the native e-mail trigger: {@code payload.message_text}, {@code payload.thread_id},
 *   {@code payload.message_id}, sender as {@code Name <addr>}, {@code metadata.trigger_id}
 *
 * Without an explicit userId the sender's address is the user. The sender is
 * always reduced to its bare address.
 */
@Component
@RequiredArgsConstructor
public class TriggerEventParser {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public TriggerEvent parse(String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Event is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEventException("Event is not a JSON object", List.of());
        }

        JsonNode payloadNode = root.path("payload");
        String sender = senderAddress(text(payloadNode, "sender", "from"));
        EmailPayload payload = payloadNode.isObject()
                ? new EmailPayload(
                        sender,
                        text(payloadNode, "subject"),
                        text(payloadNode, "body", "message_text"),
                        text(payloadNode, "threadId", "thread_id"))
                : null;

        String id = text(root, "id");
        if (id == null) {
            id = text(payloadNode, "message_id", "messageId");
        }
        if (id == null) {
            id = text(root.path("metadata"), "id");
        }

        String userId = text(root, "userId", "user_id");
        if (userId == null) {
            userId = sender;
        }

        String triggerId = text(root, "triggerId", "trigger_id");
        if (triggerId == null) {
            triggerId = text(root.path("metadata"), "trigger_id", "triggerId");
        }

        TriggerEvent event = new TriggerEvent(
                id,
                source(text(root, "source")),
                userId,
                instant(text(root, "occurredAt", "occurred_at")),
                payload,
                triggerId);

        Set<ConstraintViolation<TriggerEvent>> violations = validator.validate(event);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted(Comparator.naturalOrder())
                    .toList();
            throw new MalformedEventException("Event " + (id != null ? id : "<no id>") + " rejected", messages);
        }
        return event;
    }

    /** "Jane Doe <jane@example.com>" becomes "jane@example.com". */
    static String senderAddress(String sender) {
        if (sender == null) {
            return null;
        }
        int open = sender.indexOf('<');
        int close = sender.indexOf('>', open + 1);
        if (open >= 0 && close > open) {
            return sender.substring(open + 1, close).trim();
        }
        return sender.trim();
    }

    private static TriggerEvent.Source source(String value) {
        if (value == null) {
            return TriggerEvent.Source.EMAIL;
        }
        try {
            return TriggerEvent.Source.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return TriggerEvent.Source.OTHER;
        }
    }

    private static Instant instant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.isNull()) {
                String text = value.asText();
                if (!text.isBlank()) {
                    return text;
                }
            }
        }
        return null;
    }
}
