package io.agentlink.transport;

import io.agentlink.protocol.Frames;

import java.io.Closeable;

/**
 * Bidirectional byte stream owned by exactly one logical connection.
 *
 * <p>Every operation may block the calling thread. Failures surface as
 * {@link io.agentlink.error.ConnectionException} or, when the stream ends,
 * {@link io.agentlink.error.ConnectionClosedException}. Closing a transport from another
 * thread unblocks a pending {@link #receiveExactly(int)}.
 */
public interface Transport extends Closeable {
    void connect();

    void send(byte[] data);

    /**
     * Blocks until exactly {@code length} bytes arrived, reassembling partial reads.
     */
    byte[] receiveExactly(int length);

    @Override
    void close();

    boolean isConnected();

    String endpoint();

    default void sendFrame(byte[] body, int maxFrameBytes) {
        send(Frames.frame(body, maxFrameBytes));
    }

    /**
     * Reads one frame. The declared length is checked against {@code maxFrameBytes}
     * before any body byte is read or allocated.
     */
    default byte[] receiveFrame(int maxFrameBytes) {
        byte[] header = receiveExactly(Frames.HEADER_BYTES);
        int length = Frames.checkedLength(header, maxFrameBytes);
        if (length == 0) {
            return new byte[0];
        }
        return receiveExactly(length);
    }
}
