package io.agentlink.registry;

import io.agentlink.error.AgentNotFoundException;
import io.agentlink.error.DuplicateAgentException;
import io.agentlink.error.RegistrationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process registry.
 *
 * <p>All entries live in one map guarded by a read/write lock: {@link #lookup} and
 * {@link #list} share the read lock, everything else takes the write lock. Entries whose
 * last heartbeat is older than {@link RegistryOptions#heartbeatTimeout()} are removed by
 * {@link #pruneStaleAgents()}, which {@link #start()} runs periodically.
 *
 * <p>Registering a name that is already taken replaces the entry when the existing one is
 * stale or points at the same endpoint (an agent restarting in place). A live entry at a
 * different endpoint is rejected with {@link DuplicateAgentException}.
 */
public final class AgentRegistry implements Registry {
    private static final Logger LOGGER = LoggerFactory.getLogger(AgentRegistry.class);

    private final RegistryOptions options;
    private final Clock clock;
    private final Map<String, AgentRegistration> agents = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private ScheduledExecutorService pruneExecutor;
    private ScheduledFuture<?> pruneTask;

    public AgentRegistry() {
        this(RegistryOptions.defaults());
    }

    public AgentRegistry(RegistryOptions options) {
        this(options, Clock.systemUTC());
    }

    public AgentRegistry(RegistryOptions options, Clock clock) {
        if (options == null) {
            throw new IllegalArgumentException("options are required");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock is required");
        }
        this.options = options;
        this.clock = clock;
    }

    public RegistryOptions options() {
        return options;
    }

    /**
     * Starts periodic pruning on a daemon thread.
     */
    public synchronized void start() {
        if (pruneExecutor != null) {
            throw new IllegalStateException("Registry already started");
        }
        pruneExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentlink-registry-prune");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = options.pruneInterval().toMillis();
        pruneTask = pruneExecutor.scheduleAtFixedRate(this::pruneQuietly, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        LOGGER.info("Agent registry started (heartbeat timeout {}s, prune every {}s)",
                options.heartbeatTimeout().toSeconds(), options.pruneInterval().toSeconds());
    }

    public synchronized void stop() {
        if (pruneExecutor == null) {
            return;
        }
        pruneTask.cancel(false);
        pruneExecutor.shutdownNow();
        try {
            pruneExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        pruneExecutor = null;
        pruneTask = null;
        LOGGER.info("Agent registry stopped");
    }

    public synchronized boolean isRunning() {
        return pruneExecutor != null;
    }

    @Override
    public AgentRegistration register(AgentRegistration registration) {
        if (registration == null || registration.name().isEmpty()) {
            throw new RegistrationFailedException("Agent name cannot be empty");
        }
        if (registration.endpoint().isEmpty()) {
            throw new RegistrationFailedException(
                    "Agent endpoint cannot be empty",
                    Map.of("agent_name", registration.name())
            );
        }
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            AgentRegistration existing = agents.get(registration.name());
            if (existing != null
                    && !existing.endpoint().equals(registration.endpoint())
                    && !existing.isStale(now, options.heartbeatTimeout())) {
                throw new DuplicateAgentException(
                        registration.name(),
                        Map.of("agent_name", registration.name(), "endpoint", existing.endpoint())
                );
            }
            AgentRegistration stored = registration.withTimestamps(now, now);
            agents.put(stored.name(), stored);
            LOGGER.info("Registered agent '{}' at {}{}", stored.name(), stored.endpoint(),
                    existing == null ? "" : " (replaced previous entry)");
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void unregister(String name) {
        lock.writeLock().lock();
        try {
            if (agents.remove(name) != null) {
                LOGGER.info("Unregistered agent '{}'", name);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public AgentRegistration lookup(String name) {
        lock.readLock().lock();
        try {
            AgentRegistration registration = agents.get(name);
            if (registration == null) {
                throw new AgentNotFoundException(name);
            }
            return registration;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<AgentRegistration> list() {
        lock.readLock().lock();
        try {
            List<AgentRegistration> out = new ArrayList<>(agents.values());
            out.sort(Comparator.comparing(AgentRegistration::name));
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public AgentRegistration heartbeat(String name) {
        lock.writeLock().lock();
        try {
            AgentRegistration existing = agents.get(name);
            if (existing == null) {
                throw new AgentNotFoundException(name);
            }
            Instant now = clock.instant();
            if (!now.isAfter(existing.lastHeartbeat())) {
                now = existing.lastHeartbeat().plusNanos(1);
            }
            AgentRegistration renewed = existing.withLastHeartbeat(now);
            agents.put(name, renewed);
            return renewed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every entry whose heartbeat age exceeds the timeout.
     *
     * @return number of entries removed
     */
    public int pruneStaleAgents() {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            int removed = 0;
            Iterator<AgentRegistration> it = agents.values().iterator();
            while (it.hasNext()) {
                AgentRegistration registration = it.next();
                if (registration.isStale(now, options.heartbeatTimeout())) {
                    it.remove();
                    removed++;
                    LOGGER.warn("Pruned agent '{}' (last heartbeat {}s ago)",
                            registration.name(), registration.heartbeatAge(now).toSeconds());
                }
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return agents.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void pruneQuietly() {
        try {
            pruneStaleAgents();
        } catch (RuntimeException e) {
            LOGGER.error("Registry prune pass failed", e);
        }
    }
}
