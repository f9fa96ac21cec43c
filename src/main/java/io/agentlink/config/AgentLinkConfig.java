package io.agentlink.config;

import io.agentlink.protocol.Frames;
import io.agentlink.registry.RegistryOptions;
import io.agentlink.server.LocalAgentOptions;
import io.agentlink.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Process-wide tuning. Every value has a {@code DEFAULT_*} constant; an optional
 * {@value #SETTINGS_FILE_NAME} file overrides individual fields.
 *
 * <pre>
 * {
 *   "maxFrameBytes": 1048576,
 *   "requestTimeoutMs": 5000,
 *   "heartbeatIntervalMs": 10000,
 *   "heartbeatTimeoutMs": 30000,
 *   "pruneIntervalMs": 15000
 * }
 * </pre>
 */
public final class AgentLinkConfig {
    public static final String SETTINGS_FILE_NAME = "agentlink-settings.json";

    public static final int DEFAULT_MAX_FRAME_BYTES = Frames.DEFAULT_MAX_FRAME_BYTES;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = RegistryOptions.DEFAULT_HEARTBEAT_INTERVAL.toMillis();
    public static final long DEFAULT_HEARTBEAT_TIMEOUT_MS = RegistryOptions.DEFAULT_HEARTBEAT_TIMEOUT.toMillis();
    public static final long DEFAULT_PRUNE_INTERVAL_MS = RegistryOptions.DEFAULT_PRUNE_INTERVAL.toMillis();

    private final int maxFrameBytes;
    private final long requestTimeoutMs;
    private final long heartbeatIntervalMs;
    private final long heartbeatTimeoutMs;
    private final long pruneIntervalMs;
    private final Path source;

    public AgentLinkConfig(
            int maxFrameBytes,
            long requestTimeoutMs,
            long heartbeatIntervalMs,
            long heartbeatTimeoutMs,
            long pruneIntervalMs,
            Path source
    ) {
        this.maxFrameBytes = requireAtLeast("maxFrameBytes", maxFrameBytes, Frames.HEADER_BYTES);
        this.requestTimeoutMs = requireAtLeast("requestTimeoutMs", requestTimeoutMs, 1L);
        this.heartbeatIntervalMs = requireAtLeast("heartbeatIntervalMs", heartbeatIntervalMs, 1L);
        this.heartbeatTimeoutMs = requireAtLeast("heartbeatTimeoutMs", heartbeatTimeoutMs, 1L);
        this.pruneIntervalMs = requireAtLeast("pruneIntervalMs", pruneIntervalMs, 1L);
        if (heartbeatTimeoutMs <= heartbeatIntervalMs) {
            throw new IllegalArgumentException(
                    "heartbeatTimeoutMs (" + heartbeatTimeoutMs + ") must exceed heartbeatIntervalMs (" + heartbeatIntervalMs + ")"
            );
        }
        this.source = source;
    }

    public static AgentLinkConfig defaults() {
        return new AgentLinkConfig(
                DEFAULT_MAX_FRAME_BYTES,
                DEFAULT_REQUEST_TIMEOUT_MS,
                DEFAULT_HEARTBEAT_INTERVAL_MS,
                DEFAULT_HEARTBEAT_TIMEOUT_MS,
                DEFAULT_PRUNE_INTERVAL_MS,
                null
        );
    }

    /**
     * Reads {@value #SETTINGS_FILE_NAME} from {@code dir}, or returns the defaults when the
     * directory has none.
     */
    public static AgentLinkConfig fromDirectory(Path dir) {
        Path file = dir.resolve(SETTINGS_FILE_NAME);
        return Files.exists(file) ? load(file) : defaults();
    }

    /**
     * Loads overrides from a JSON settings file. Missing fields keep their defaults; a
     * missing file or unknown field is an error.
     */
    public static AgentLinkConfig load(Path file) {
        SettingsFile settings;
        try {
            settings = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load settings: " + file, e);
        }
        if (settings == null) {
            return defaults();
        }
        return new AgentLinkConfig(
                settings.maxFrameBytes() == null ? DEFAULT_MAX_FRAME_BYTES : settings.maxFrameBytes(),
                orDefault(settings.requestTimeoutMs(), DEFAULT_REQUEST_TIMEOUT_MS),
                orDefault(settings.heartbeatIntervalMs(), DEFAULT_HEARTBEAT_INTERVAL_MS),
                orDefault(settings.heartbeatTimeoutMs(), DEFAULT_HEARTBEAT_TIMEOUT_MS),
                orDefault(settings.pruneIntervalMs(), DEFAULT_PRUNE_INTERVAL_MS),
                file.toAbsolutePath().normalize()
        );
    }

    public int maxFrameBytes() {
        return maxFrameBytes;
    }

    public Duration requestTimeout() {
        return Duration.ofMillis(requestTimeoutMs);
    }

    public Duration heartbeatInterval() {
        return Duration.ofMillis(heartbeatIntervalMs);
    }

    public Duration heartbeatTimeout() {
        return Duration.ofMillis(heartbeatTimeoutMs);
    }

    public Duration pruneInterval() {
        return Duration.ofMillis(pruneIntervalMs);
    }

    /**
     * Settings file this config came from, or {@code null} for built-in defaults.
     */
    public Path source() {
        return source;
    }

    public RegistryOptions registryOptions() {
        return new RegistryOptions(heartbeatInterval(), heartbeatTimeout(), pruneInterval());
    }

    public LocalAgentOptions localAgentOptions() {
        return LocalAgentOptions.defaults()
                .withHeartbeatInterval(heartbeatInterval())
                .withMaxFrameBytes(maxFrameBytes);
    }

    public SettingsView toView() {
        return new SettingsView(
                maxFrameBytes,
                requestTimeoutMs,
                heartbeatIntervalMs,
                heartbeatTimeoutMs,
                pruneIntervalMs,
                source == null ? "defaults" : source.toString()
        );
    }

    private static long orDefault(Long value, long fallback) {
        return value == null ? fallback : value;
    }

    private static int requireAtLeast(String field, int value, int min) {
        if (value < min) {
            throw new IllegalArgumentException(field + " must be >= " + min + " (got " + value + ")");
        }
        return value;
    }

    private static long requireAtLeast(String field, long value, long min) {
        if (value < min) {
            throw new IllegalArgumentException(field + " must be >= " + min + " (got " + value + ")");
        }
        return value;
    }

    public record SettingsView(
            int maxFrameBytes,
            long requestTimeoutMs,
            long heartbeatIntervalMs,
            long heartbeatTimeoutMs,
            long pruneIntervalMs,
            String source
    ) {
    }

    private record SettingsFile(
            Integer maxFrameBytes,
            Long requestTimeoutMs,
            Long heartbeatIntervalMs,
            Long heartbeatTimeoutMs,
            Long pruneIntervalMs
    ) {
    }
}
