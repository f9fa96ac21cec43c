package io.agentlink.server;

import io.agentlink.protocol.Frames;
import io.agentlink.registry.Registry;
import io.agentlink.registry.RegistryOptions;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Optional wiring for a {@link LocalAgent}. Without a registry the agent is only reachable
 * by endpoint; with one it registers on start, heartbeats, and unregisters on stop.
 * Empty capabilities fall back to the wrapped agent's own.
 */
public record LocalAgentOptions(
        Registry registry,
        Duration heartbeatInterval,
        List<String> capabilities,
        Map<String, Object> metadata,
        int maxFrameBytes
) {
    public LocalAgentOptions {
        if (heartbeatInterval == null || heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeatInterval must be > 0");
        }
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be > 0");
        }
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static LocalAgentOptions defaults() {
        return new LocalAgentOptions(
                null,
                RegistryOptions.DEFAULT_HEARTBEAT_INTERVAL,
                List.of(),
                Map.of(),
                Frames.DEFAULT_MAX_FRAME_BYTES
        );
    }

    public LocalAgentOptions withRegistry(Registry registry) {
        return new LocalAgentOptions(registry, heartbeatInterval, capabilities, metadata, maxFrameBytes);
    }

    public LocalAgentOptions withHeartbeatInterval(Duration interval) {
        return new LocalAgentOptions(registry, interval, capabilities, metadata, maxFrameBytes);
    }

    public LocalAgentOptions withCapabilities(List<String> capabilities) {
        return new LocalAgentOptions(registry, heartbeatInterval, capabilities, metadata, maxFrameBytes);
    }

    public LocalAgentOptions withMetadata(Map<String, Object> metadata) {
        return new LocalAgentOptions(registry, heartbeatInterval, capabilities, metadata, maxFrameBytes);
    }

    public LocalAgentOptions withMaxFrameBytes(int maxFrameBytes) {
        return new LocalAgentOptions(registry, heartbeatInterval, capabilities, metadata, maxFrameBytes);
    }
}
