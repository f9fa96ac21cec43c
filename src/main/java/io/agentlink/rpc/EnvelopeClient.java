package io.agentlink.rpc;

import io.agentlink.error.AgentLinkException;
import io.agentlink.error.ConnectionException;
import io.agentlink.error.ConnectionTimeoutException;
import io.agentlink.error.InvalidMessageException;
import io.agentlink.error.ProtocolException;
import io.agentlink.protocol.Envelope;
import io.agentlink.protocol.EnvelopeType;
import io.agentlink.protocol.Frames;
import io.agentlink.protocol.ProtocolCodec;
import io.agentlink.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * One request in flight at a time over a lazily connected {@link Transport}.
 *
 * <p>The deadline covers waiting for the connection, dialing, sending and reading the
 * reply. When it passes, a watchdog closes the transport so the blocked dial or read
 * returns, and the call fails with {@link ConnectionTimeoutException}. Any connection or
 * protocol failure drops the connection; the next call dials again.
 *
 * <p>{@link #stream(Envelope)} holds the connection until the peer sends a terminal reply or
 * the returned {@link Replies} is closed. Each read of a stream gets the full timeout.
 */
public final class EnvelopeClient implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(EnvelopeClient.class);
    private static final ScheduledThreadPoolExecutor WATCHDOG = newWatchdog();

    private final String peerName;
    private final Transport transport;
    private final Duration timeout;
    private final int maxFrameBytes;
    // A semaphore rather than a lock: a stream may be finished on another thread.
    private final Semaphore permit = new Semaphore(1, true);

    public EnvelopeClient(String peerName, Transport transport, Duration timeout) {
        this(peerName, transport, timeout, Frames.DEFAULT_MAX_FRAME_BYTES);
    }

    public EnvelopeClient(String peerName, Transport transport, Duration timeout, int maxFrameBytes) {
        if (transport == null) {
            throw new IllegalArgumentException("transport is required");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be > 0");
        }
        this.peerName = peerName;
        this.transport = transport;
        this.timeout = timeout;
        this.maxFrameBytes = maxFrameBytes;
    }

    public Duration timeout() {
        return timeout;
    }

    public String endpoint() {
        return transport.endpoint();
    }

    public boolean isConnected() {
        return transport.isConnected();
    }

    /**
     * Sends {@code request} and returns the peer's reply, which may be an {@code error}
     * envelope. A reply whose id does not match the request is rejected, except an error the
     * peer could not correlate because it failed to read the request at all.
     */
    public Envelope call(Envelope request) {
        long deadline = System.nanoTime() + timeout.toNanos();
        byte[] body = encode(request);
        acquire();
        try {
            return guarded(request, deadline, () -> {
                send(body);
                return receive(request);
            });
        } finally {
            permit.release();
        }
    }

    /**
     * Sends {@code request} and returns a cursor over its replies: any number of
     * {@code stream_chunk} envelopes, then one terminal envelope.
     */
    public Replies stream(Envelope request) {
        long deadline = System.nanoTime() + timeout.toNanos();
        byte[] body = encode(request);
        acquire();
        try {
            guarded(request, deadline, () -> {
                send(body);
                return null;
            });
        } catch (RuntimeException e) {
            permit.release();
            throw e;
        }
        return new Replies(request);
    }

    private byte[] encode(Envelope request) {
        byte[] body = ProtocolCodec.encode(request);
        Frames.checkSize(body.length, maxFrameBytes);
        return body;
    }

    private void send(byte[] body) {
        if (!transport.isConnected()) {
            transport.connect();
            LOGGER.debug("Connected to {} at {}", peerName, transport.endpoint());
        }
        transport.sendFrame(body, maxFrameBytes);
    }

    private Envelope receive(Envelope request) {
        Envelope reply = ProtocolCodec.decode(transport.receiveFrame(maxFrameBytes));
        if (!request.id().equals(reply.id())) {
            if (reply.isType(EnvelopeType.ERROR) && ProtocolCodec.UNKNOWN_ID.equals(reply.id())) {
                // The peer rejected the frame before reading its id and hangs up after replying.
                LOGGER.debug("Uncorrelated error from {} for {}: {}", peerName, request.id(), reply.payloadString(Envelope.KEY_ERROR_CODE));
                transport.close();
                return reply;
            }
            throw new InvalidMessageException(
                    "Response id mismatch: expected " + request.id() + ", got " + reply.id(),
                    Map.of("expected", request.id(), "actual", reply.id())
            );
        }
        if (reply.isType(EnvelopeType.ERROR)) {
            LOGGER.debug("Error reply from {} for {}: {}", peerName, request.id(), reply.payloadString(Envelope.KEY_ERROR_CODE));
        }
        return reply;
    }

    private <T> T guarded(Envelope request, long deadline, Supplier<T> exchange) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            throw timedOut(request);
        }
        AtomicBoolean expired = new AtomicBoolean();
        ScheduledFuture<?> watchdog = WATCHDOG.schedule(() -> {
            expired.set(true);
            transport.close();
        }, remaining, TimeUnit.NANOSECONDS);
        try {
            return exchange.get();
        } catch (ConnectionException e) {
            transport.close();
            if (expired.get()) {
                throw timedOut(request);
            }
            throw e;
        } catch (ProtocolException e) {
            transport.close();
            throw e;
        } finally {
            watchdog.cancel(false);
        }
    }

    private void acquire() {
        try {
            if (!permit.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new ConnectionTimeoutException(
                        "Timed out waiting for connection to " + transport.endpoint(),
                        Map.of("endpoint", transport.endpoint(), "timeout_ms", timeout.toMillis())
                );
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while waiting for connection to " + transport.endpoint(), null, e);
        }
    }

    private AgentLinkException timedOut(Envelope request) {
        LOGGER.debug("Request {} to {} timed out after {}ms", request.id(), peerName, timeout.toMillis());
        return new ConnectionTimeoutException(
                "Request to " + peerName + " timed out after " + timeout.toMillis() + "ms",
                Map.of("endpoint", transport.endpoint(), "timeout_ms", timeout.toMillis(), "request_id", request.id())
        );
    }

    @Override
    public void close() {
        transport.close();
    }

    private static ScheduledThreadPoolExecutor newWatchdog() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                1,
                EnvelopeServer.daemonThreads("agentlink-watchdog-")
        );
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * Replies to one streamed request. The connection is released when a terminal reply is
     * read, when a read fails, or on {@link #close()}; closing early drops the connection
     * because unread replies may still be in flight.
     */
    public final class Replies implements Closeable {
        private final Envelope request;
        private final AtomicBoolean finished = new AtomicBoolean();

        private Replies(Envelope request) {
            this.request = request;
        }

        public String requestId() {
            return request.id();
        }

        public boolean isFinished() {
            return finished.get();
        }

        public Envelope next() {
            if (finished.get()) {
                throw new IllegalStateException("Stream " + request.id() + " already finished");
            }
            Envelope reply;
            try {
                reply = guarded(request, System.nanoTime() + timeout.toNanos(), () -> receive(request));
            } catch (RuntimeException e) {
                finish();
                throw e;
            }
            if (!reply.isType(EnvelopeType.STREAM_CHUNK)) {
                finish();
            }
            return reply;
        }

        @Override
        public void close() {
            if (!finished.get()) {
                transport.close();
                finish();
            }
        }

        private void finish() {
            if (finished.compareAndSet(false, true)) {
                permit.release();
            }
        }
    }
}
