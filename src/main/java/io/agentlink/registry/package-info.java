/**
 * Agent discovery and liveness.
 *
 * <p>{@link io.agentlink.registry.AgentRegistry} is the in-process directory with heartbeat
 * pruning. {@link io.agentlink.registry.RegistryServer} and
 * {@link io.agentlink.registry.RemoteRegistry} carry the same {@link io.agentlink.registry.Registry}
 * operations over any transport, and {@link io.agentlink.registry.HeartbeatEmitter} keeps an
 * exported agent's entry fresh.
 */
package io.agentlink.registry;
