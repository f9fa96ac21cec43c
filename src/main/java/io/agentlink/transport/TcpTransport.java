package io.agentlink.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.SocketChannel;

/**
 * Cross-host transport over plain TCP. Encryption, if needed, belongs to a layer above.
 */
public final class TcpTransport extends ChannelTransport {
    private final String host;
    private final int port;

    public TcpTransport(String host, int port) {
        super(Endpoints.tcp(host, port));
        this.host = host;
        this.port = port;
    }

    TcpTransport(String host, int port, SocketChannel accepted) {
        super(Endpoints.tcp(host, port), accepted);
        this.host = host;
        this.port = port;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    @Override
    protected SocketChannel openChannel() throws IOException {
        SocketChannel ch = SocketChannel.open();
        try {
            ch.setOption(StandardSocketOptions.TCP_NODELAY, true);
            return ch;
        } catch (IOException | RuntimeException e) {
            ch.close();
            throw e;
        }
    }

    @Override
    protected SocketAddress remoteAddress() {
        return new InetSocketAddress(host, port);
    }
}
