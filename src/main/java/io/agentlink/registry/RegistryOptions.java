package io.agentlink.registry;

import java.time.Duration;

/**
 * Liveness timing for an {@link AgentRegistry}. The heartbeat timeout must exceed the
 * interval agents heartbeat at, otherwise healthy agents would be pruned between beats.
 */
public record RegistryOptions(
        Duration heartbeatInterval,
        Duration heartbeatTimeout,
        Duration pruneInterval
) {
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_HEARTBEAT_TIMEOUT = Duration.ofSeconds(90);
    public static final Duration DEFAULT_PRUNE_INTERVAL = Duration.ofSeconds(60);

    public RegistryOptions {
        requirePositive(heartbeatInterval, "heartbeatInterval");
        requirePositive(heartbeatTimeout, "heartbeatTimeout");
        requirePositive(pruneInterval, "pruneInterval");
        if (heartbeatTimeout.compareTo(heartbeatInterval) <= 0) {
            throw new IllegalArgumentException(
                    "heartbeatTimeout (" + heartbeatTimeout + ") must exceed heartbeatInterval (" + heartbeatInterval + ")"
            );
        }
    }

    public static RegistryOptions defaults() {
        return new RegistryOptions(DEFAULT_HEARTBEAT_INTERVAL, DEFAULT_HEARTBEAT_TIMEOUT, DEFAULT_PRUNE_INTERVAL);
    }

    public RegistryOptions withHeartbeatTimeout(Duration timeout) {
        return new RegistryOptions(heartbeatInterval, timeout, pruneInterval);
    }

    public RegistryOptions withPruneInterval(Duration interval) {
        return new RegistryOptions(heartbeatInterval, heartbeatTimeout, interval);
    }

    private static void requirePositive(Duration value, String field) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(field + " must be > 0");
        }
    }
}
