package io.agentlink.rpc;

import io.agentlink.error.AgentLinkException;
import io.agentlink.error.ConnectionClosedException;
import io.agentlink.error.ConnectionException;
import io.agentlink.error.ErrorCode;
import io.agentlink.error.ProtocolException;
import io.agentlink.protocol.Envelope;
import io.agentlink.protocol.EnvelopeType;
import io.agentlink.protocol.Frames;
import io.agentlink.protocol.ProtocolCodec;
import io.agentlink.transport.Transport;
import io.agentlink.transport.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accept loop plus one handler thread per connection.
 *
 * <p>Each connection reads one frame, decodes it, hands it to the {@link EnvelopeHandler},
 * and writes every reply before reading the next frame. A frame that fails to decode gets a
 * best-effort error reply and the connection is closed. {@link #stop()} closes the listener
 * and every live connection, then waits for the handler threads to exit.
 */
public final class EnvelopeServer {
    private static final Logger LOGGER = LoggerFactory.getLogger(EnvelopeServer.class);
    private static final long SHUTDOWN_GRACE_MS = 5_000L;

    private final String name;
    private final TransportListener listener;
    private final EnvelopeHandler handler;
    private final int maxFrameBytes;
    private final AtomicBoolean running = new AtomicBoolean();
    private final Set<Transport> connections = ConcurrentHashMap.newKeySet();
    private final AtomicLong connectionSeq = new AtomicLong();
    private final AtomicLong framesHandled = new AtomicLong();

    private boolean started;
    private ExecutorService connectionPool;
    private Thread acceptThread;

    public EnvelopeServer(String name, TransportListener listener, EnvelopeHandler handler) {
        this(name, listener, handler, Frames.DEFAULT_MAX_FRAME_BYTES);
    }

    public EnvelopeServer(String name, TransportListener listener, EnvelopeHandler handler, int maxFrameBytes) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("server name cannot be empty");
        }
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be > 0");
        }
        this.name = name;
        this.listener = listener;
        this.handler = handler;
        this.maxFrameBytes = maxFrameBytes;
    }

    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Server '" + name + "' was already started");
        }
        started = true;
        listener.bind();
        connectionPool = Executors.newCachedThreadPool(daemonThreads("agentlink-" + name + "-conn-"));
        running.set(true);
        acceptThread = new Thread(this::acceptLoop, "agentlink-" + name + "-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
    }

    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        listener.close();
        for (Transport connection : connections) {
            connection.close();
        }
        connectionPool.shutdown();
        try {
            if (!connectionPool.awaitTermination(SHUTDOWN_GRACE_MS, TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Server '{}' handlers did not exit within {}ms, interrupting", name, SHUTDOWN_GRACE_MS);
                connectionPool.shutdownNow();
            }
            acceptThread.join(SHUTDOWN_GRACE_MS);
        } catch (InterruptedException e) {
            connectionPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public String endpoint() {
        return listener.endpoint();
    }

    public int activeConnections() {
        return connections.size();
    }

    public long framesHandled() {
        return framesHandled.get();
    }

    private void acceptLoop() {
        while (running.get()) {
            Transport connection;
            try {
                connection = listener.accept();
            } catch (ConnectionClosedException e) {
                if (running.get()) {
                    LOGGER.warn("Listener for '{}' closed unexpectedly: {}", name, e.getMessage());
                }
                break;
            } catch (ConnectionException e) {
                if (!running.get()) {
                    break;
                }
                LOGGER.warn("Accept failed for '{}': {}", name, e.getMessage());
                continue;
            }
            if (!running.get()) {
                connection.close();
                break;
            }
            connections.add(connection);
            try {
                connectionPool.execute(() -> serve(connection));
            } catch (RejectedExecutionException e) {
                connections.remove(connection);
                connection.close();
            }
        }
    }

    private void serve(Transport connection) {
        long connectionId = connectionSeq.incrementAndGet();
        LOGGER.debug("Connection {} opened on {}", connectionId, listener.endpoint());
        try {
            while (running.get()) {
                byte[] frame;
                try {
                    frame = connection.receiveFrame(maxFrameBytes);
                } catch (ConnectionClosedException e) {
                    break;
                } catch (ProtocolException e) {
                    LOGGER.warn("Dropping connection {} on '{}': {}", connectionId, name, e.getMessage());
                    replyQuietly(connection, Envelope.error(ProtocolCodec.UNKNOWN_ID, e.code(), e.getMessage(), e.details()));
                    break;
                }
                Envelope request;
                try {
                    request = ProtocolCodec.decode(frame);
                } catch (ProtocolException e) {
                    LOGGER.warn("Dropping connection {} on '{}': {}", connectionId, name, e.getMessage());
                    replyQuietly(connection, Envelope.error(ProtocolCodec.peekId(frame), e.code(), e.getMessage(), e.details()));
                    break;
                }
                dispatch(request, new Replies(connection, request.id()));
                framesHandled.incrementAndGet();
            }
        } catch (AgentLinkException e) {
            if (running.get()) {
                LOGGER.debug("Connection {} on '{}' failed: {}", connectionId, name, e.getMessage());
            }
        } finally {
            connections.remove(connection);
            connection.close();
            LOGGER.debug("Connection {} closed", connectionId);
        }
    }

    private void dispatch(Envelope request, Replies replies) {
        try {
            handler.handle(request, replies);
        } catch (DeliveryFailure e) {
            throw e.failure;
        } catch (ReplyAbandoned e) {
            LOGGER.debug("Dropped remaining replies to {} on '{}'", request.id(), name);
            return;
        } catch (AgentLinkException e) {
            replies.fail(Envelope.error(request.id(), e.code(), e.getMessage(), e.details()));
            return;
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected failure on '{}' handling {} {}", name, request.type().wireName(), request.id(), e);
            replies.fail(Envelope.error(request.id(), ErrorCode.INTERNAL_ERROR, "Internal server error: " + e.getMessage(), Map.of()));
            return;
        }
        if (!replies.complete) {
            replies.fail(Envelope.error(request.id(), ErrorCode.INTERNAL_ERROR, "Handler finished without a final reply", Map.of()));
        }
    }

    private void replyQuietly(Transport connection, Envelope reply) {
        try {
            connection.sendFrame(ProtocolCodec.encode(reply), maxFrameBytes);
        } catch (AgentLinkException e) {
            LOGGER.debug("Could not deliver error reply {}: {}", reply.id(), e.getMessage());
        }
    }

    /**
     * Replies to one request. Anything other than a {@code stream_chunk} completes the
     * exchange. A reply that cannot be encoded within the frame limit is replaced by an
     * error, which also completes it.
     */
    private final class Replies implements ReplySink {
        private final Transport connection;
        private final String requestId;
        private boolean complete;

        Replies(Transport connection, String requestId) {
            this.connection = connection;
            this.requestId = requestId;
        }

        @Override
        public void send(Envelope reply) {
            if (complete) {
                throw new ReplyAbandoned();
            }
            boolean chunk = reply.isType(EnvelopeType.STREAM_CHUNK);
            byte[] body;
            boolean replaced = false;
            try {
                body = ProtocolCodec.encode(reply);
            } catch (AgentLinkException e) {
                body = ProtocolCodec.encode(Envelope.error(requestId, e.code(), e.getMessage(), Map.of()));
                replaced = true;
            }
            if (body.length > maxFrameBytes) {
                body = ProtocolCodec.encode(Envelope.error(
                        requestId,
                        ErrorCode.MALFORMED_PAYLOAD,
                        "Reply size " + body.length + " exceeds maximum " + maxFrameBytes,
                        Map.of("length", body.length, "max_frame_bytes", maxFrameBytes)
                ));
                replaced = true;
            }
            complete = !chunk || replaced;
            try {
                connection.sendFrame(body, maxFrameBytes);
            } catch (AgentLinkException e) {
                complete = true;
                throw new DeliveryFailure(e);
            }
            if (chunk && replaced) {
                throw new ReplyAbandoned();
            }
        }

        void fail(Envelope error) {
            if (complete) {
                LOGGER.debug("Reply to {} already complete, dropping {}", requestId, error.payloadString(Envelope.KEY_ERROR_CODE));
                return;
            }
            try {
                send(error);
            } catch (DeliveryFailure e) {
                throw e.failure;
            }
        }
    }

    // Writing to the connection failed; the connection is finished.
    private static final class DeliveryFailure extends RuntimeException {
        private final AgentLinkException failure;

        DeliveryFailure(AgentLinkException failure) {
            super(failure.getMessage(), failure, false, false);
            this.failure = failure;
        }
    }

    // The exchange already ended; the handler should stop producing replies.
    private static final class ReplyAbandoned extends RuntimeException {
        ReplyAbandoned() {
            super("reply already complete", null, false, false);
        }
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicLong seq = new AtomicLong();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
