package io.agentlink.rpc;

import io.agentlink.protocol.Envelope;

/**
 * Writes replies for one request back on its connection.
 */
@FunctionalInterface
public interface ReplySink {
    void send(Envelope reply);
}
