package io.agentlink.agent;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable unit of agent communication.
 *
 * <p>{@code content} is any JSON-serializable value (string, number, boolean, list, map or
 * null). {@code metadata} may hold null values, so it is copied into an unmodifiable
 * {@link LinkedHashMap} rather than {@link Map#copyOf(Map)}.
 *
 * <p>Numbers cross the wire as plain JSON numbers and come back in Jackson's natural form:
 * integral values as {@code Integer} when they fit, otherwise {@code Long} or
 * {@code BigInteger}, and fractional values as {@code Double}. A message built with a
 * {@code 7L} or {@code 1.5f} therefore decodes to {@code 7} and {@code 1.5d}; messages
 * that already use those forms decode to an equal message.
 */
public record Message(
        String role,
        Object content,
        Map<String, Object> metadata,
        Instant timestamp
) {
    public static final String ROLE_USER = "user";
    public static final String ROLE_AGENT = "agent";
    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_TOOL = "tool";

    public Message {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("Message role cannot be empty");
        }
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static Message of(String role, Object content) {
        return new Message(role, content, Map.of(), Instant.now());
    }

    public static Message of(String role, Object content, Map<String, Object> metadata) {
        return new Message(role, content, metadata, Instant.now());
    }

    public Message withMetadata(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new Message(role, content, merged, timestamp);
    }

    public String contentAsText() {
        return content == null ? "" : String.valueOf(content);
    }
}
