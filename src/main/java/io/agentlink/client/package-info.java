/**
 * Client side: {@link io.agentlink.client.RemoteAgent} forwards {@code process} and
 * {@code stream} calls to an exported agent.
 */
package io.agentlink.client;
