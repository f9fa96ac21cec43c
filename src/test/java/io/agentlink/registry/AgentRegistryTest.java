package io.agentlink.registry;

import io.agentlink.error.AgentNotFoundException;
import io.agentlink.error.DuplicateAgentException;
import io.agentlink.error.ErrorCode;
import io.agentlink.error.RegistrationFailedException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class AgentRegistryTest {
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void registerThenLookupShouldReturnSameRecordWithRegistryTimestamps() {
        MutableClock clock = new MutableClock(T0);
        AgentRegistry registry = new AgentRegistry(RegistryOptions.defaults(), clock);
        AgentRegistration input = AgentRegistration.of(
                "echo", "unix:///tmp/echo.sock", List.of("echo"), Map.of("team", "core"));

        registry.register(input);
        AgentRegistration found = registry.lookup("echo");

        assertEquals("echo", found.name());
        assertEquals("unix:///tmp/echo.sock", found.endpoint());
        assertEquals(List.of("echo"), found.capabilities());
        assertEquals(Map.of("team", "core"), found.metadata());
        assertEquals(T0, found.registeredAt());
        assertEquals(T0, found.lastHeartbeat());
    }

    @Test
    void registerShouldRejectEmptyName() {
        AgentRegistry registry = new AgentRegistry();

        RegistrationFailedException e = assertThrows(RegistrationFailedException.class,
                () -> registry.register(AgentRegistration.of("  ", "tcp://localhost:1")));
        assertEquals(ErrorCode.REGISTRATION_FAILED, e.code());
    }

    @Test
    void lookupAndHeartbeatOfUnknownAgentShouldFail() {
        AgentRegistry registry = new AgentRegistry();

        AgentNotFoundException lookup = assertThrows(AgentNotFoundException.class, () -> registry.lookup("ghost"));
        assertThrows(AgentNotFoundException.class, () -> registry.heartbeat("ghost"));
        assertEquals("ghost", lookup.agentName());
    }

    @Test
    void heartbeatShouldStrictlyIncreaseAndKeepRegisteredAt() {
        MutableClock clock = new MutableClock(T0);
        AgentRegistry registry = new AgentRegistry(RegistryOptions.defaults(), clock);
        registry.register(AgentRegistration.of("echo", "tcp://localhost:1"));

        AgentRegistration sameInstant = registry.heartbeat("echo");
        clock.advance(Duration.ofSeconds(5));
        AgentRegistration later = registry.heartbeat("echo");

        assertTrue(sameInstant.lastHeartbeat().isAfter(T0));
        assertTrue(later.lastHeartbeat().isAfter(sameInstant.lastHeartbeat()));
        assertEquals(T0.plusSeconds(5), later.lastHeartbeat());
        assertEquals(T0, later.registeredAt());
    }

    @Test
    void unregisterShouldRemoveAndIgnoreUnknownNames() {
        AgentRegistry registry = new AgentRegistry();
        registry.register(AgentRegistration.of("echo", "tcp://localhost:1"));

        registry.unregister("echo");
        registry.unregister("echo");

        assertEquals(0, registry.size());
        assertThrows(AgentNotFoundException.class, () -> registry.lookup("echo"));
    }

    @Test
    void listShouldBeSortedSnapshot() {
        AgentRegistry registry = new AgentRegistry();
        registry.register(AgentRegistration.of("zeta", "tcp://localhost:3"));
        registry.register(AgentRegistration.of("alpha", "tcp://localhost:1"));
        registry.register(AgentRegistration.of("mid", "tcp://localhost:2"));

        List<AgentRegistration> snapshot = registry.list();
        registry.unregister("mid");

        assertEquals(List.of("alpha", "mid", "zeta"), snapshot.stream().map(AgentRegistration::name).toList());
        assertEquals(2, registry.list().size());
    }

    @Test
    void liveAgentAtDifferentEndpointShouldBeRejected() {
        MutableClock clock = new MutableClock(T0);
        AgentRegistry registry = new AgentRegistry(RegistryOptions.defaults(), clock);
        registry.register(AgentRegistration.of("echo", "tcp://localhost:1"));

        DuplicateAgentException e = assertThrows(DuplicateAgentException.class,
                () -> registry.register(AgentRegistration.of("echo", "tcp://localhost:2")));

        assertEquals(ErrorCode.DUPLICATE_AGENT, e.code());
        assertEquals("tcp://localhost:1", registry.lookup("echo").endpoint());
    }

    @Test
    void sameEndpointOrStaleEntryShouldBeReplaced() {
        MutableClock clock = new MutableClock(T0);
        AgentRegistry registry = new AgentRegistry(RegistryOptions.defaults(), clock);
        registry.register(AgentRegistration.of("echo", "tcp://localhost:1", List.of("v1"), Map.of()));

        clock.advance(Duration.ofSeconds(1));
        registry.register(AgentRegistration.of("echo", "tcp://localhost:1", List.of("v2"), Map.of()));
        assertEquals(List.of("v2"), registry.lookup("echo").capabilities());
        assertEquals(T0.plusSeconds(1), registry.lookup("echo").registeredAt());

        clock.advance(Duration.ofSeconds(91));
        registry.register(AgentRegistration.of("echo", "tcp://localhost:2"));
        assertEquals("tcp://localhost:2", registry.lookup("echo").endpoint());
    }

    @Test
    void pruneShouldRetainWithinTimeoutAndRemoveBeyondIt() {
        MutableClock clock = new MutableClock(T0);
        AgentRegistry registry = new AgentRegistry(RegistryOptions.defaults(), clock);
        registry.register(AgentRegistration.of("echo", "unix:///tmp/echo.sock"));
        clock.set(T0.plusSeconds(10));
        registry.heartbeat("echo");

        clock.set(T0.plusSeconds(95));
        assertEquals(0, registry.pruneStaleAgents());
        assertEquals("echo", registry.lookup("echo").name());

        clock.set(T0.plusSeconds(120));
        assertEquals(1, registry.pruneStaleAgents());
        assertThrows(AgentNotFoundException.class, () -> registry.lookup("echo"));
    }

    @Test
    void pruneShouldOnlyRemoveStaleEntries() {
        MutableClock clock = new MutableClock(T0);
        AgentRegistry registry = new AgentRegistry(RegistryOptions.defaults(), clock);
        registry.register(AgentRegistration.of("old", "tcp://localhost:1"));
        clock.advance(Duration.ofSeconds(60));
        registry.register(AgentRegistration.of("fresh", "tcp://localhost:2"));
        clock.advance(Duration.ofSeconds(40));

        assertEquals(1, registry.pruneStaleAgents());
        assertEquals(List.of("fresh"), registry.list().stream().map(AgentRegistration::name).toList());
    }

    @Test
    void scheduledPruningShouldRunUntilStopped() throws Exception {
        MutableClock clock = new MutableClock(T0);
        RegistryOptions options = new RegistryOptions(
                Duration.ofMillis(20), Duration.ofMillis(50), Duration.ofMillis(20));
        AgentRegistry registry = new AgentRegistry(options, clock);
        registry.register(AgentRegistration.of("echo", "tcp://localhost:1"));
        registry.start();
        try {
            assertTrue(registry.isRunning());
            assertThrows(IllegalStateException.class, registry::start);
            clock.advance(Duration.ofSeconds(1));
            long deadline = System.currentTimeMillis() + 5_000L;
            while (registry.size() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(0, registry.size());
        } finally {
            registry.stop();
        }
        assertFalse(registry.isRunning());
        registry.stop();
    }

    @Test
    void optionsShouldRequireTimeoutAboveInterval() {
        assertThrows(IllegalArgumentException.class, () -> new RegistryOptions(
                Duration.ofSeconds(30), Duration.ofSeconds(30), Duration.ofSeconds(60)));
        assertThrows(IllegalArgumentException.class, () -> new RegistryOptions(
                Duration.ZERO, Duration.ofSeconds(30), Duration.ofSeconds(60)));
    }

    @Test
    void concurrentHeartbeatsAndListsShouldNotCorruptState() throws Exception {
        AgentRegistry registry = new AgentRegistry();
        for (int i = 0; i < 10; i++) {
            registry.register(AgentRegistration.of("agent-" + i, "tcp://localhost:" + (1000 + i)));
        }
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 8; t++) {
                int worker = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int n = 0; n < 200; n++) {
                        registry.heartbeat("agent-" + ((worker + n) % 10));
                        assertEquals(10, registry.list().size());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(10, registry.size());
    }
}
