package io.agentlink.protocol;

import io.agentlink.error.ErrorCode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Protocol-level wrapper around every frame on the wire.
 *
 * <p>A request carries a fresh caller-generated {@code id}; the matching response or error
 * reuses it verbatim. A {@code stream} request is answered by zero or more
 * {@code stream_chunk} envelopes and one {@code stream_end} or {@code error}, all with the
 * request's id.
 */
public record Envelope(
        String version,
        EnvelopeType type,
        String id,
        Instant timestamp,
        Map<String, Object> payload
) {
    public static final String PROTOCOL_VERSION = "1.0";

    public static final String METHOD_PROCESS = "process";
    public static final String METHOD_STREAM = "stream";
    public static final String METHOD_LOOKUP = "lookup";
    public static final String METHOD_LIST = "list";

    public static final String KEY_METHOD = "method";
    public static final String KEY_AGENT_NAME = "agent_name";
    public static final String KEY_MESSAGE = "message";
    public static final String KEY_ERROR_CODE = "error_code";
    public static final String KEY_ERROR_MESSAGE = "error_message";
    public static final String KEY_ERROR_DETAILS = "error_details";
    public static final String KEY_REGISTRATION = "registration";
    public static final String KEY_REGISTRATIONS = "registrations";
    public static final String KEY_STATUS = "status";

    public Envelope {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(type, "type");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("envelope id cannot be empty");
        }
        timestamp = timestamp == null ? Instant.now() : timestamp;
        payload = payload == null || payload.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public static Envelope of(EnvelopeType type, String id, Map<String, Object> payload) {
        return new Envelope(PROTOCOL_VERSION, type, id, Instant.now(), payload);
    }

    public static Envelope request(String method, String agentName, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(KEY_METHOD, method);
        if (agentName != null && !agentName.isBlank()) {
            payload.put(KEY_AGENT_NAME, agentName);
        }
        if (extra != null) {
            payload.putAll(extra);
        }
        return of(EnvelopeType.REQUEST, newId(), payload);
    }

    public static Envelope response(String requestId, Map<String, Object> payload) {
        return of(EnvelopeType.RESPONSE, requestId, payload);
    }

    public static Envelope streamChunk(String requestId, Map<String, Object> message) {
        return of(EnvelopeType.STREAM_CHUNK, requestId, Map.of(KEY_MESSAGE, message));
    }

    public static Envelope streamEnd(String requestId) {
        return of(EnvelopeType.STREAM_END, requestId, Map.of());
    }

    public static Envelope error(String requestId, ErrorCode code, String message, Map<String, Object> details) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(KEY_ERROR_CODE, code.wireName());
        payload.put(KEY_ERROR_MESSAGE, message == null ? "" : message);
        payload.put(KEY_ERROR_DETAILS, details == null ? Map.of() : details);
        return of(EnvelopeType.ERROR, requestId, payload);
    }

    public boolean isType(EnvelopeType expected) {
        return type == expected;
    }

    public String payloadString(String key) {
        Object value = payload.get(key);
        return value == null ? null : String.valueOf(value);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> payloadMap(String key) {
        Object value = payload.get(key);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }
}
