/**
 * AgentLink source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentlink.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentlink.server.LocalAgent} exports an agent on an endpoint.</li>
 *   <li>{@code io.agentlink.client.RemoteAgent} calls an exported agent.</li>
 *   <li>{@code io.agentlink.registry.AgentRegistry} tracks where agents live and whether they are alive.</li>
 *   <li>{@code io.agentlink.protocol.ProtocolCodec} defines the wire format.</li>
 * </ul>
 */
package io.agentlink;
