package io.agentlink.rpc;

import io.agentlink.protocol.Envelope;

/**
 * Turns one decoded inbound envelope into the reply written back on the same connection.
 * Throwing an {@link io.agentlink.error.AgentLinkException} produces an error envelope
 * with that exception's code and the request's id.
 */
@FunctionalInterface
public interface EnvelopeHandler {
    Envelope handle(Envelope request);

    /**
     * Writes every reply to {@code request}. Streaming handlers override this to send
     * {@code stream_chunk} envelopes before one terminal reply. A throw after some chunks
     * went out still ends the exchange with an error envelope.
     */
    default void handle(Envelope request, ReplySink replies) {
        replies.send(handle(request));
    }
}
