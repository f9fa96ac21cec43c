/**
 * Wire protocol: the versioned {@link io.agentlink.protocol.Envelope}, its JSON encoding in
 * {@link io.agentlink.protocol.ProtocolCodec}, and length-prefixed {@link io.agentlink.protocol.Frames}.
 *
 * <p>Frame layout is a 4-byte big-endian unsigned length followed by a UTF-8 JSON body of
 * at most 10 MiB unless configured otherwise.
 */
package io.agentlink.protocol;
