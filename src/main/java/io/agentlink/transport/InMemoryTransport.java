package io.agentlink.transport;

import io.agentlink.error.ConnectionException;

import java.util.Map;

/**
 * Loop-back transport for tests. It honors the full {@link Transport} contract, so code
 * under test cannot tell it from a socket: partial reads, close propagation to the peer,
 * and reconnection when obtained from {@link InMemoryListener#dial()}.
 */
public final class InMemoryTransport implements Transport {
    @FunctionalInterface
    interface Connector {
        Pipes open();
    }

    record Pipes(InMemoryPipe inbound, InMemoryPipe outbound) {
    }

    public record Pair(InMemoryTransport server, InMemoryTransport client) {
    }

    private final String endpoint;
    private final Connector connector;
    private volatile Pipes pipes;

    InMemoryTransport(String endpoint, Connector connector) {
        this.endpoint = endpoint;
        this.connector = connector;
    }

    static InMemoryTransport connected(String endpoint, Pipes pipes) {
        InMemoryTransport transport = new InMemoryTransport(endpoint, () -> {
            throw new ConnectionException("In-memory peer connection cannot be reopened", Map.of("endpoint", endpoint));
        });
        transport.pipes = pipes;
        return transport;
    }

    /**
     * Two already-connected ends of one stream. Once either side closes, neither can reconnect.
     */
    public static Pair pair() {
        return pair("memory://pair");
    }

    public static Pair pair(String endpoint) {
        InMemoryPipe toClient = new InMemoryPipe();
        InMemoryPipe toServer = new InMemoryPipe();
        InMemoryTransport server = connected(endpoint, new Pipes(toServer, toClient));
        InMemoryTransport client = connected(endpoint, new Pipes(toClient, toServer));
        return new Pair(server, client);
    }

    @Override
    public synchronized void connect() {
        if (pipes == null) {
            pipes = connector.open();
        }
    }

    @Override
    public void send(byte[] data) {
        requirePipes().outbound().write(data);
    }

    @Override
    public byte[] receiveExactly(int length) {
        return requirePipes().inbound().readExactly(length);
    }

    @Override
    public synchronized void close() {
        Pipes p = pipes;
        pipes = null;
        if (p != null) {
            p.outbound().close();
            p.inbound().close();
        }
    }

    @Override
    public boolean isConnected() {
        Pipes p = pipes;
        return p != null && !p.inbound().isClosed();
    }

    @Override
    public String endpoint() {
        return endpoint;
    }

    private Pipes requirePipes() {
        Pipes p = pipes;
        if (p == null) {
            throw new ConnectionException("Not connected", Map.of("endpoint", endpoint));
        }
        return p;
    }
}
