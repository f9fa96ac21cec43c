package io.agentlink.transport;

import java.io.Closeable;

/**
 * Server side of a transport: binds an endpoint and hands out one {@link Transport} per
 * accepted connection. {@link #close()} unblocks a pending {@link #accept()}, which then
 * fails with {@link io.agentlink.error.ConnectionClosedException}.
 */
public interface TransportListener extends Closeable {
    void bind();

    Transport accept();

    boolean isBound();

    /**
     * Endpoint URI clients dial. For TCP port {@code 0} this reports the bound port.
     */
    String endpoint();

    @Override
    void close();
}
