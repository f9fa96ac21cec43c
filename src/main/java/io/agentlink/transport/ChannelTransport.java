package io.agentlink.transport;

import io.agentlink.error.ConnectionClosedException;
import io.agentlink.error.ConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousCloseException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SocketChannel;
import java.nio.channels.UnresolvedAddressException;
import java.util.Map;

/**
 * Blocking {@link SocketChannel} transport shared by the Unix-domain and TCP variants.
 * Subclasses only know how to open and dial their channel.
 */
public abstract class ChannelTransport implements Transport {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChannelTransport.class);

    private final String endpoint;
    private volatile SocketChannel channel;

    protected ChannelTransport(String endpoint) {
        this.endpoint = endpoint;
    }

    protected ChannelTransport(String endpoint, SocketChannel accepted) {
        this.endpoint = endpoint;
        this.channel = accepted;
    }

    /**
     * Opens an unconnected channel with any options the variant needs.
     */
    protected abstract SocketChannel openChannel() throws IOException;

    protected abstract SocketAddress remoteAddress();

    /**
     * Dials the peer. The channel is published before the blocking connect, so a
     * concurrent {@link #close()} aborts a dial that is stuck on a full accept backlog.
     */
    @Override
    public void connect() {
        if (isConnected()) {
            return;
        }
        SocketChannel ch;
        try {
            ch = openChannel();
        } catch (IOException e) {
            throw new ConnectionException(
                    "Failed to open channel to " + endpoint + ": " + describe(e),
                    Map.of("endpoint", endpoint),
                    e
            );
        }
        channel = ch;
        try {
            ch.connect(remoteAddress());
        } catch (AsynchronousCloseException e) {
            closeQuietly(ch);
            throw new ConnectionClosedException("Transport closed while connecting to " + endpoint, Map.of("endpoint", endpoint), e);
        } catch (IOException | UnresolvedAddressException e) {
            closeQuietly(ch);
            if (channel == ch) {
                channel = null;
            }
            throw new ConnectionException(
                    "Failed to connect to " + endpoint + ": " + describe(e),
                    Map.of("endpoint", endpoint),
                    e
            );
        }
    }

    @Override
    public void send(byte[] data) {
        SocketChannel ch = requireChannel();
        ByteBuffer buffer = ByteBuffer.wrap(data);
        try {
            while (buffer.hasRemaining()) {
                ch.write(buffer);
            }
        } catch (ClosedChannelException e) {
            throw new ConnectionClosedException("Transport closed during send to " + endpoint, null, e);
        } catch (IOException e) {
            throw new ConnectionException("Failed to send data to " + endpoint + ": " + describe(e), null, e);
        }
    }

    @Override
    public byte[] receiveExactly(int length) {
        SocketChannel ch = requireChannel();
        ByteBuffer buffer = ByteBuffer.allocate(length);
        try {
            while (buffer.hasRemaining()) {
                if (ch.read(buffer) < 0) {
                    throw new ConnectionClosedException(
                            "Connection closed while expecting " + buffer.remaining() + " more bytes"
                    );
                }
            }
        } catch (AsynchronousCloseException e) {
            throw new ConnectionClosedException("Transport closed while receiving from " + endpoint, null, e);
        } catch (ClosedChannelException e) {
            throw new ConnectionClosedException("Transport closed: " + endpoint, null, e);
        } catch (IOException e) {
            throw new ConnectionException("Failed to receive data from " + endpoint + ": " + describe(e), null, e);
        }
        return buffer.array();
    }

    @Override
    public void close() {
        SocketChannel ch = channel;
        channel = null;
        if (ch != null) {
            closeQuietly(ch);
        }
    }

    private void closeQuietly(SocketChannel ch) {
        try {
            ch.close();
        } catch (IOException e) {
            LOGGER.debug("Error closing channel to {}: {}", endpoint, e.getMessage());
        }
    }

    @Override
    public boolean isConnected() {
        SocketChannel ch = channel;
        return ch != null && ch.isOpen() && ch.isConnected();
    }

    @Override
    public String endpoint() {
        return endpoint;
    }

    private SocketChannel requireChannel() {
        SocketChannel ch = channel;
        if (ch == null || !ch.isOpen()) {
            throw new ConnectionException("Not connected", Map.of("endpoint", endpoint));
        }
        return ch;
    }

    static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
