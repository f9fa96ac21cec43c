/**
 * Byte-stream transports and their listeners.
 *
 * <p>{@link io.agentlink.transport.UnixSocketTransport} and
 * {@link io.agentlink.transport.TcpTransport} share the blocking channel code in
 * {@link io.agentlink.transport.ChannelTransport}; the in-memory pair exists for tests and
 * satisfies the same contract. {@link io.agentlink.transport.Endpoints} maps endpoint URIs
 * to the right implementation.
 */
package io.agentlink.transport;
