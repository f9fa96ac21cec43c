package io.agentlink.registry;

import java.util.List;

/**
 * Name to endpoint directory with heartbeat-based liveness.
 *
 * <p>{@link AgentRegistry} keeps entries in process; {@link RemoteRegistry} talks to an
 * {@link AgentRegistry} exported by a {@link RegistryServer}. Failures surface as
 * {@link io.agentlink.error.RegistrationFailedException},
 * {@link io.agentlink.error.DuplicateAgentException} and
 * {@link io.agentlink.error.AgentNotFoundException}.
 */
public interface Registry {
    /**
     * Stores {@code registration} with fresh timestamps and returns the stored record.
     */
    AgentRegistration register(AgentRegistration registration);

    /**
     * Removes the named entry. Unknown names are ignored.
     */
    void unregister(String name);

    AgentRegistration lookup(String name);

    /**
     * Snapshot of every entry, sorted by name.
     */
    List<AgentRegistration> list();

    /**
     * Renews the named entry and returns the updated record.
     */
    AgentRegistration heartbeat(String name);
}
