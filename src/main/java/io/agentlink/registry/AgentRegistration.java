package io.agentlink.registry;

import io.agentlink.error.MalformedPayloadException;
import io.agentlink.protocol.ProtocolCodec;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Directory entry for one agent. Records are immutable; the registry swaps them whole.
 */
public record AgentRegistration(
        String name,
        String endpoint,
        List<String> capabilities,
        Map<String, Object> metadata,
        Instant registeredAt,
        Instant lastHeartbeat
) {
    public AgentRegistration {
        name = name == null ? "" : name.trim();
        endpoint = endpoint == null ? "" : endpoint.trim();
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        Instant now = Instant.now();
        registeredAt = registeredAt == null ? now : registeredAt;
        lastHeartbeat = lastHeartbeat == null ? registeredAt : lastHeartbeat;
    }

    public static AgentRegistration of(String name, String endpoint) {
        return new AgentRegistration(name, endpoint, List.of(), Map.of(), null, null);
    }

    public static AgentRegistration of(
            String name,
            String endpoint,
            List<String> capabilities,
            Map<String, Object> metadata
    ) {
        return new AgentRegistration(name, endpoint, capabilities, metadata, null, null);
    }

    public AgentRegistration withTimestamps(Instant registeredAt, Instant lastHeartbeat) {
        return new AgentRegistration(name, endpoint, capabilities, metadata, registeredAt, lastHeartbeat);
    }

    public AgentRegistration withLastHeartbeat(Instant lastHeartbeat) {
        return new AgentRegistration(name, endpoint, capabilities, metadata, registeredAt, lastHeartbeat);
    }

    public Duration heartbeatAge(Instant now) {
        return Duration.between(lastHeartbeat, now);
    }

    public boolean isStale(Instant now, Duration heartbeatTimeout) {
        return heartbeatAge(now).compareTo(heartbeatTimeout) > 0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", name);
        out.put("endpoint", endpoint);
        out.put("capabilities", capabilities);
        out.put("metadata", metadata);
        out.put("registered_at", ProtocolCodec.formatTimestamp(registeredAt));
        out.put("last_heartbeat", ProtocolCodec.formatTimestamp(lastHeartbeat));
        return out;
    }

    public static AgentRegistration fromMap(Object raw) {
        Map<String, Object> data = ProtocolCodec.asMap(raw, "registration");
        if (!(data.get("name") instanceof String name)) {
            throw new MalformedPayloadException("Failed to decode registration: missing 'name'", Map.of("data", data));
        }
        if (!(data.get("endpoint") instanceof String endpoint)) {
            throw new MalformedPayloadException("Failed to decode registration: missing 'endpoint'", Map.of("data", data));
        }
        List<String> capabilities = new ArrayList<>();
        Object rawCapabilities = data.get("capabilities");
        if (rawCapabilities instanceof List<?> list) {
            for (Object item : list) {
                capabilities.add(String.valueOf(item));
            }
        } else if (rawCapabilities != null) {
            throw new MalformedPayloadException(
                    "Failed to decode registration: 'capabilities' must be a list",
                    Map.of("data", data)
            );
        }
        try {
            return new AgentRegistration(
                    name,
                    endpoint,
                    capabilities,
                    ProtocolCodec.asMap(data.get("metadata"), "metadata"),
                    optionalTimestamp(data.get("registered_at")),
                    optionalTimestamp(data.get("last_heartbeat"))
            );
        } catch (DateTimeParseException e) {
            throw new MalformedPayloadException("Failed to decode registration: " + e.getMessage(), Map.of("data", data), e);
        }
    }

    private static Instant optionalTimestamp(Object raw) {
        if (raw == null || String.valueOf(raw).isBlank()) {
            return null;
        }
        return ProtocolCodec.parseTimestamp(String.valueOf(raw));
    }
}
