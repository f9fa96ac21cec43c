package io.agentlink.registry;

import io.agentlink.error.AgentLinkException;
import io.agentlink.error.AgentNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Renews one agent's registry entry at a fixed interval.
 *
 * <p>The emitter stops itself once the registry no longer knows the agent. Any other
 * failure is logged and retried on the next tick.
 */
public final class HeartbeatEmitter {
    private static final Logger LOGGER = LoggerFactory.getLogger(HeartbeatEmitter.class);

    private final Registry registry;
    private final String agentName;
    private final Duration interval;
    private final AtomicLong beats = new AtomicLong();

    private ScheduledExecutorService executor;

    public HeartbeatEmitter(Registry registry, String agentName, Duration interval) {
        if (registry == null) {
            throw new IllegalArgumentException("registry is required");
        }
        if (agentName == null || agentName.isBlank()) {
            throw new IllegalArgumentException("agentName cannot be empty");
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.registry = registry;
        this.agentName = agentName;
        this.interval = interval;
    }

    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("Heartbeat for '" + agentName + "' already running");
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentlink-heartbeat-" + agentName);
            t.setDaemon(true);
            return t;
        });
        long intervalMs = interval.toMillis();
        executor.scheduleAtFixedRate(this::beat, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        executor = null;
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    public long beats() {
        return beats.get();
    }

    private void beat() {
        try {
            registry.heartbeat(agentName);
            beats.incrementAndGet();
        } catch (AgentNotFoundException e) {
            LOGGER.warn("Agent '{}' is no longer registered, stopping heartbeat", agentName);
            stopFromTask();
        } catch (AgentLinkException e) {
            LOGGER.warn("Heartbeat for '{}' failed: {}", agentName, e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.warn("Heartbeat for '{}' failed unexpectedly", agentName, e);
        }
    }

    private synchronized void stopFromTask() {
        if (executor != null) {
            executor.shutdown();
            executor = null;
        }
    }
}
