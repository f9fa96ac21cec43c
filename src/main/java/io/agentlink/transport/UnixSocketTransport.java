package io.agentlink.transport;

import java.io.IOException;
import java.net.SocketAddress;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;

/**
 * Same-host transport over a Unix domain socket.
 */
public final class UnixSocketTransport extends ChannelTransport {
    private final Path socketPath;

    public UnixSocketTransport(Path socketPath) {
        super(Endpoints.unix(socketPath));
        this.socketPath = socketPath;
    }

    UnixSocketTransport(Path socketPath, SocketChannel accepted) {
        super(Endpoints.unix(socketPath), accepted);
        this.socketPath = socketPath;
    }

    public Path socketPath() {
        return socketPath;
    }

    @Override
    protected SocketChannel openChannel() throws IOException {
        return SocketChannel.open(StandardProtocolFamily.UNIX);
    }

    @Override
    protected SocketAddress remoteAddress() {
        return UnixDomainSocketAddress.of(socketPath);
    }
}
