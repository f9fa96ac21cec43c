package io.agentlink.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Unix domain socket listener.
 *
 * <p>Missing parent directories are created owner-only ({@code rwx------}); directories that
 * already exist keep their permissions. A stale socket file is removed before binding, the
 * bound socket file is restricted to {@code rw-------}, and it is deleted again on close.
 */
public final class UnixSocketListener extends ChannelListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(UnixSocketListener.class);
    private static final Set<PosixFilePermission> OWNER_DIR = PosixFilePermissions.fromString("rwx------");
    private static final Set<PosixFilePermission> OWNER_SOCKET = PosixFilePermissions.fromString("rw-------");

    private final Path socketPath;

    public UnixSocketListener(Path socketPath) {
        this.socketPath = socketPath.toAbsolutePath().normalize();
    }

    public Path socketPath() {
        return socketPath;
    }

    @Override
    public String endpoint() {
        return Endpoints.unix(socketPath);
    }

    @Override
    protected ServerSocketChannel openBound() throws IOException {
        createOwnerOnlyParents(socketPath.getParent());
        Files.deleteIfExists(socketPath);
        ServerSocketChannel ch = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            ch.bind(UnixDomainSocketAddress.of(socketPath));
        } catch (IOException | RuntimeException e) {
            ch.close();
            throw e;
        }
        if (posix()) {
            Files.setPosixFilePermissions(socketPath, OWNER_SOCKET);
        }
        return ch;
    }

    @Override
    protected Transport wrapAccepted(SocketChannel accepted) {
        return new UnixSocketTransport(socketPath, accepted);
    }

    @Override
    protected void afterClose() {
        try {
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            LOGGER.warn("Failed to remove socket file {}: {}", socketPath, e.getMessage());
        }
    }

    private static void createOwnerOnlyParents(Path dir) throws IOException {
        if (dir == null || Files.isDirectory(dir)) {
            return;
        }
        createOwnerOnlyParents(dir.getParent());
        if (posix()) {
            Files.createDirectory(dir, PosixFilePermissions.asFileAttribute(OWNER_DIR));
            // umask may strip bits from the creation attribute
            Files.setPosixFilePermissions(dir, OWNER_DIR);
        } else {
            Files.createDirectory(dir);
        }
    }

    private static boolean posix() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    }
}
