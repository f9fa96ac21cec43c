/**
 * Typed failures of the protocol adapter.
 *
 * <p>Every exception extends {@link io.agentlink.error.AgentLinkException} and maps to one
 * {@link io.agentlink.error.ErrorCode}. The layer never retries: it classifies a failure as
 * connection, protocol, agent, tool or registry class and rethrows it for the caller to decide.
 */
package io.agentlink.error;
