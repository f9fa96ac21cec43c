package io.agentlink.transport;

import io.agentlink.error.ConnectionClosedException;
import io.agentlink.error.ConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.channels.UnresolvedAddressException;
import java.util.Map;

public abstract class ChannelListener implements TransportListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChannelListener.class);

    private volatile ServerSocketChannel server;

    protected abstract ServerSocketChannel openBound() throws IOException;

    protected abstract Transport wrapAccepted(SocketChannel accepted) throws IOException;

    protected void afterClose() {
    }

    @Override
    public synchronized void bind() {
        if (server != null) {
            throw new IllegalStateException("Listener already bound: " + endpoint());
        }
        try {
            server = openBound();
        } catch (IOException | UnresolvedAddressException e) {
            throw new ConnectionException(
                    "Failed to bind " + endpoint() + ": " + ChannelTransport.describe(e),
                    Map.of("endpoint", endpoint()),
                    e
            );
        }
    }

    @Override
    public Transport accept() {
        ServerSocketChannel s = server;
        if (s == null || !s.isOpen()) {
            throw new ConnectionClosedException("Listener is not bound: " + endpoint());
        }
        try {
            SocketChannel accepted = s.accept();
            return wrapAccepted(accepted);
        } catch (ClosedChannelException e) {
            throw new ConnectionClosedException("Listener closed: " + endpoint(), null, e);
        } catch (IOException e) {
            throw new ConnectionException("Accept failed on " + endpoint() + ": " + ChannelTransport.describe(e), null, e);
        }
    }

    @Override
    public boolean isBound() {
        ServerSocketChannel s = server;
        return s != null && s.isOpen();
    }

    protected ServerSocketChannel serverChannel() {
        return server;
    }

    @Override
    public synchronized void close() {
        ServerSocketChannel s = server;
        if (s == null) {
            return;
        }
        try {
            s.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing listener {}: {}", endpoint(), e.getMessage());
        } finally {
            afterClose();
        }
    }
}
