package io.agentlink.transport;

import io.agentlink.error.ConnectionClosedException;
import io.agentlink.error.ConnectionException;

import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * In-process listener. {@link #dial()} hands out client transports that connect lazily;
 * each connect enqueues a fresh server end for {@link #accept()}.
 */
public final class InMemoryListener implements TransportListener {
    private static final InMemoryTransport CLOSED = new InMemoryTransport("memory://closed", () -> null);

    private final String endpoint;
    private final BlockingQueue<InMemoryTransport> pending = new LinkedBlockingQueue<>();
    private volatile boolean bound;
    private volatile boolean closed;

    public InMemoryListener(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("in-memory listener name cannot be empty");
        }
        this.endpoint = "memory://" + name;
    }

    @Override
    public synchronized void bind() {
        if (closed) {
            throw new IllegalStateException("Listener closed: " + endpoint);
        }
        if (bound) {
            throw new IllegalStateException("Listener already bound: " + endpoint);
        }
        bound = true;
    }

    public Transport dial() {
        return new InMemoryTransport(endpoint, this::open);
    }

    @Override
    public Transport accept() {
        InMemoryTransport next;
        try {
            next = pending.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while accepting on " + endpoint, null, e);
        }
        if (next == CLOSED) {
            pending.add(CLOSED);
            throw new ConnectionClosedException("Listener closed: " + endpoint);
        }
        return next;
    }

    @Override
    public boolean isBound() {
        return bound && !closed;
    }

    @Override
    public String endpoint() {
        return endpoint;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        InMemoryTransport orphan;
        while ((orphan = pending.poll()) != null) {
            orphan.close();
        }
        pending.add(CLOSED);
    }

    private synchronized InMemoryTransport.Pipes open() {
        if (!bound || closed) {
            throw new ConnectionException("Connection refused: " + endpoint, Map.of("endpoint", endpoint));
        }
        InMemoryPipe toClient = new InMemoryPipe();
        InMemoryPipe toServer = new InMemoryPipe();
        pending.add(InMemoryTransport.connected(endpoint, new InMemoryTransport.Pipes(toServer, toClient)));
        return new InMemoryTransport.Pipes(toClient, toServer);
    }
}
