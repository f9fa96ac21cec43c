package io.agentlink.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;

public final class TcpListener extends ChannelListener {
    private final String host;
    private final int requestedPort;

    public TcpListener(String host, int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid TCP port: " + port);
        }
        this.host = host;
        this.requestedPort = port;
    }

    public String host() {
        return host;
    }

    /**
     * Bound port once {@link #bind()} returned, otherwise the requested one.
     */
    public int port() {
        ServerSocketChannel ch = serverChannel();
        if (ch != null && ch.isOpen()) {
            try {
                if (ch.getLocalAddress() instanceof InetSocketAddress address) {
                    return address.getPort();
                }
            } catch (IOException ignored) {
                // closed concurrently, report the requested port
            }
        }
        return requestedPort;
    }

    @Override
    public String endpoint() {
        return Endpoints.tcp(host, port());
    }

    @Override
    protected ServerSocketChannel openBound() throws IOException {
        ServerSocketChannel ch = ServerSocketChannel.open();
        try {
            ch.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            ch.bind(new InetSocketAddress(host, requestedPort));
            return ch;
        } catch (IOException | RuntimeException e) {
            ch.close();
            throw e;
        }
    }

    @Override
    protected Transport wrapAccepted(SocketChannel accepted) throws IOException {
        accepted.setOption(StandardSocketOptions.TCP_NODELAY, true);
        return new TcpTransport(host, port(), accepted);
    }
}
