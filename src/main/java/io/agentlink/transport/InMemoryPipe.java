package io.agentlink.transport;

import io.agentlink.error.ConnectionClosedException;
import io.agentlink.error.ConnectionException;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * One direction of an in-memory byte stream. Writes enqueue chunks; reads reassemble
 * exactly the requested number of bytes across chunk boundaries, so partial reads behave
 * as they do on a socket.
 */
final class InMemoryPipe {
    private static final byte[] EOF = new byte[0];

    private final BlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();
    private final Object readLock = new Object();
    private volatile boolean closed;
    private byte[] current;
    private int offset;

    void write(byte[] data) {
        if (closed) {
            throw new ConnectionClosedException("In-memory pipe closed");
        }
        if (data.length > 0) {
            chunks.add(data.clone());
        }
    }

    byte[] readExactly(int length) {
        byte[] out = new byte[length];
        int filled = 0;
        synchronized (readLock) {
            while (filled < length) {
                if (current == null || offset == current.length) {
                    byte[] next = take();
                    if (next == EOF) {
                        // keep the marker so every later read also observes the close
                        chunks.add(EOF);
                        throw new ConnectionClosedException(
                                "Connection closed while expecting " + (length - filled) + " more bytes"
                        );
                    }
                    current = next;
                    offset = 0;
                }
                int n = Math.min(length - filled, current.length - offset);
                System.arraycopy(current, offset, out, filled, n);
                offset += n;
                filled += n;
            }
        }
        return out;
    }

    void close() {
        if (!closed) {
            closed = true;
            chunks.add(EOF);
        }
    }

    boolean isClosed() {
        return closed;
    }

    private byte[] take() {
        try {
            return chunks.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while receiving", null, e);
        }
    }
}
