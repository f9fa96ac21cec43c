package io.agentlink.transport;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Endpoint URIs: {@code unix:///path/to.sock} and {@code tcp://host:port}
 * (IPv6 hosts in brackets, {@code tcp://[::1]:7000}).
 */
public final class Endpoints {
    public static final String UNIX_PREFIX = "unix://";
    public static final String TCP_PREFIX = "tcp://";

    public enum Scheme {
        UNIX,
        TCP
    }

    public record Endpoint(Scheme scheme, Path path, String host, int port) {
        public String uri() {
            return scheme == Scheme.UNIX ? unix(path) : tcp(host, port);
        }
    }

    private Endpoints() {
    }

    public static Endpoint parse(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint cannot be empty");
        }
        String raw = endpoint.trim();
        String lower = raw.toLowerCase(Locale.ROOT);
        if (lower.startsWith(UNIX_PREFIX)) {
            String path = raw.substring(UNIX_PREFIX.length());
            if (path.isBlank()) {
                throw new IllegalArgumentException("Invalid Unix endpoint, missing socket path: " + endpoint);
            }
            return new Endpoint(Scheme.UNIX, Path.of(path), null, -1);
        }
        if (lower.startsWith(TCP_PREFIX)) {
            String hostPort = raw.substring(TCP_PREFIX.length());
            int colon = hostPort.lastIndexOf(':');
            if (colon <= 0) {
                throw new IllegalArgumentException("Invalid TCP endpoint format: " + endpoint);
            }
            String host = hostPort.substring(0, colon);
            if (host.startsWith("[") && host.endsWith("]")) {
                host = host.substring(1, host.length() - 1);
            }
            if (host.isBlank()) {
                throw new IllegalArgumentException("Invalid TCP endpoint, missing host: " + endpoint);
            }
            int port;
            try {
                port = Integer.parseInt(hostPort.substring(colon + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port in TCP endpoint: " + endpoint, e);
            }
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Invalid port in endpoint: " + endpoint);
            }
            return new Endpoint(Scheme.TCP, null, host, port);
        }
        throw new IllegalArgumentException("Unsupported endpoint format: " + endpoint);
    }

    /**
     * Client transport for an endpoint. Port {@code 0} is only meaningful for listeners.
     */
    public static Transport newTransport(String endpoint) {
        Endpoint parsed = parse(endpoint);
        if (parsed.scheme() == Scheme.UNIX) {
            return new UnixSocketTransport(parsed.path());
        }
        if (parsed.port() == 0) {
            throw new IllegalArgumentException("Cannot dial port 0: " + endpoint);
        }
        return new TcpTransport(parsed.host(), parsed.port());
    }

    public static TransportListener newListener(String endpoint) {
        Endpoint parsed = parse(endpoint);
        if (parsed.scheme() == Scheme.UNIX) {
            return new UnixSocketListener(parsed.path());
        }
        return new TcpListener(parsed.host(), parsed.port());
    }

    public static String unix(Path socketPath) {
        return UNIX_PREFIX + socketPath.toString();
    }

    public static String tcp(String host, int port) {
        String h = host.contains(":") && !host.startsWith("[") ? "[" + host + "]" : host;
        return TCP_PREFIX + h + ":" + port;
    }
}
