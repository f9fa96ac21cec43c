package io.agentlink.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.agentlink.agent.Message;
import io.agentlink.agent.ToolResult;
import io.agentlink.error.InvalidMessageException;
import io.agentlink.error.MalformedPayloadException;
import io.agentlink.error.UnsupportedVersionException;
import io.agentlink.util.Jsons;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON encoding of envelopes and the values they carry.
 *
 * <p>Encoding is compact UTF-8 JSON. Decoding validates the envelope shape and fails with
 * {@link InvalidMessageException}, {@link UnsupportedVersionException} or
 * {@link MalformedPayloadException}; it never substitutes defaults for missing fields
 * other than the optional timestamps. Numeric values are not type-tagged; see
 * {@link Message} for the form they decode to.
 */
public final class ProtocolCodec {
    public static final String UNKNOWN_ID = "unknown";

    private ProtocolCodec() {
    }

    public static byte[] encode(Envelope envelope) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("version", envelope.version());
        root.put("type", envelope.type().wireName());
        root.put("id", envelope.id());
        root.put("timestamp", formatTimestamp(envelope.timestamp()));
        root.put("payload", envelope.payload());
        return writeBytes(root);
    }

    public static Envelope decode(byte[] data) {
        JsonNode root = readTree(data);
        if (!root.isObject()) {
            throw new InvalidMessageException("Envelope must be a JSON object");
        }
        JsonNode version = root.get("version");
        if (version == null || version.isNull()) {
            throw new InvalidMessageException("Missing 'version' field in envelope");
        }
        if (!Envelope.PROTOCOL_VERSION.equals(version.asText())) {
            throw new UnsupportedVersionException(
                    "Unsupported protocol version: " + version.asText(),
                    Map.of("version", version.asText())
            );
        }
        JsonNode typeNode = root.get("type");
        if (typeNode == null || typeNode.isNull()) {
            throw new InvalidMessageException("Missing 'type' field in envelope");
        }
        EnvelopeType type = EnvelopeType.fromWire(typeNode.asText())
                .orElseThrow(() -> new InvalidMessageException(
                        "Invalid message type: " + typeNode.asText(),
                        Map.of("type", typeNode.asText())
                ));
        JsonNode idNode = root.get("id");
        if (idNode == null || !idNode.isValueNode() || idNode.isNull() || idNode.asText().isBlank()) {
            throw new InvalidMessageException("Missing 'id' field in envelope");
        }
        JsonNode payloadNode = root.get("payload");
        if (payloadNode == null || payloadNode.isNull()) {
            throw new InvalidMessageException("Missing 'payload' field in envelope");
        }
        if (!payloadNode.isObject()) {
            throw new InvalidMessageException("Envelope 'payload' must be a JSON object");
        }
        Instant timestamp;
        try {
            timestamp = parseTimestamp(textOrNull(root.get("timestamp")));
        } catch (DateTimeParseException e) {
            throw new InvalidMessageException("Invalid envelope timestamp: " + e.getParsedString(), null, e);
        }
        return new Envelope(
                Envelope.PROTOCOL_VERSION,
                type,
                idNode.asText(),
                timestamp,
                Jsons.toMap(payloadNode)
        );
    }

    /**
     * Best-effort correlation id of a frame that may have failed validation.
     */
    public static String peekId(byte[] data) {
        if (data == null || data.length == 0) {
            return UNKNOWN_ID;
        }
        try {
            JsonNode root = Jsons.compact().readTree(data);
            JsonNode id = root == null ? null : root.get("id");
            if (id != null && id.isValueNode() && !id.isNull() && !id.asText().isBlank()) {
                return id.asText();
            }
        } catch (IOException ignored) {
            // falls through to the placeholder id
        }
        return UNKNOWN_ID;
    }

    public static byte[] encodeMessage(Message message) {
        return writeBytes(messageToMap(message));
    }

    public static Message decodeMessage(byte[] data) {
        JsonNode root;
        try {
            root = Jsons.compact().readTree(data);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Failed to decode message JSON: " + e.getOriginalMessage(), null, e);
        } catch (IOException e) {
            throw new MalformedPayloadException("Failed to decode message: " + e.getMessage(), null, e);
        }
        return messageFromMap(Jsons.toValue(root));
    }

    public static Map<String, Object> messageToMap(Message message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("role", message.role());
        out.put("content", message.content());
        out.put("metadata", message.metadata());
        out.put("timestamp", formatTimestamp(message.timestamp()));
        return out;
    }

    public static Message messageFromMap(Object raw) {
        Map<String, Object> data = asMap(raw, "message");
        if (!data.containsKey("role")) {
            throw new MalformedPayloadException("Failed to decode message: missing 'role'", Map.of("data", data));
        }
        if (!data.containsKey("content")) {
            throw new MalformedPayloadException("Failed to decode message: missing 'content'", Map.of("data", data));
        }
        if (!(data.get("role") instanceof String role)) {
            throw new MalformedPayloadException("Failed to decode message: 'role' must be a string", Map.of("data", data));
        }
        Object metadata = data.get("metadata");
        if (metadata != null && !(metadata instanceof Map<?, ?>)) {
            throw new MalformedPayloadException("Failed to decode message: 'metadata' must be an object", Map.of("data", data));
        }
        try {
            Instant timestamp = parseTimestamp(data.get("timestamp") == null ? null : String.valueOf(data.get("timestamp")));
            return new Message(role, data.get("content"), asMap(metadata, "metadata"), timestamp);
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new MalformedPayloadException("Failed to decode message: " + e.getMessage(), Map.of("data", data), e);
        }
    }

    public static Map<String, Object> toolResultToMap(ToolResult result) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", result.success());
        out.put("data", result.data());
        out.put("error", result.error());
        out.put("metadata", result.metadata());
        return out;
    }

    public static ToolResult toolResultFromMap(Object raw) {
        Map<String, Object> data = asMap(raw, "tool result");
        if (!(data.get("success") instanceof Boolean success)) {
            throw new MalformedPayloadException("Failed to decode tool result: missing boolean 'success'", Map.of("data", data));
        }
        Object error = data.get("error");
        try {
            return new ToolResult(
                    success,
                    data.get("data"),
                    error == null ? null : String.valueOf(error),
                    asMap(data.get("metadata"), "metadata")
            );
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("Failed to decode tool result: " + e.getMessage(), Map.of("data", data), e);
        }
    }

    public static String formatTimestamp(Instant timestamp) {
        return timestamp.toString();
    }

    /**
     * Parses ISO-8601 instants. Offsets other than {@code Z} are accepted, and a local
     * date-time without an offset is read as UTC. A null or blank value yields now.
     */
    public static Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return Instant.now();
        }
        String value = raw.trim();
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ignored) {
            // not offset-qualified, try a bare local date-time
        }
        return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object raw, String what) {
        if (raw == null) {
            return new LinkedHashMap<>();
        }
        if (raw instanceof Map<?, ?> map) {
            return new LinkedHashMap<>((Map<String, Object>) map);
        }
        throw new MalformedPayloadException(
                "Failed to decode " + what + ": expected object but got " + raw.getClass().getSimpleName()
        );
    }

    private static JsonNode readTree(byte[] data) {
        if (data == null || data.length == 0) {
            throw new InvalidMessageException("Empty frame");
        }
        try {
            JsonNode root = Jsons.compact().readTree(data);
            if (root == null || root.isMissingNode()) {
                throw new InvalidMessageException("Empty frame");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new InvalidMessageException("Failed to decode JSON: " + e.getOriginalMessage(), null, e);
        } catch (IOException e) {
            throw new InvalidMessageException("Failed to decode frame: " + e.getMessage(), null, e);
        }
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static byte[] writeBytes(Object value) {
        try {
            return Jsons.compact().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Failed to encode JSON: " + e.getOriginalMessage(), null, e);
        }
    }
}
