package io.agentlink.protocol;

import io.agentlink.error.MalformedPayloadException;

import java.util.Map;

/**
 * Length-prefixed framing: a 4-byte big-endian unsigned length followed by exactly that
 * many body bytes.
 */
public final class Frames {
    public static final int HEADER_BYTES = 4;
    public static final int DEFAULT_MAX_FRAME_BYTES = 10 * 1024 * 1024;

    private Frames() {
    }

    public static byte[] encodeHeader(int length) {
        return new byte[]{
                (byte) (length >>> 24),
                (byte) (length >>> 16),
                (byte) (length >>> 8),
                (byte) length
        };
    }

    // Unsigned read: lengths above Integer.MAX_VALUE are still rejected by the size check, never wrapped negative.
    public static long decodeUnsignedLength(byte[] header) {
        if (header == null || header.length != HEADER_BYTES) {
            throw new MalformedPayloadException("Frame header must be " + HEADER_BYTES + " bytes");
        }
        return ((header[0] & 0xFFL) << 24)
                | ((header[1] & 0xFFL) << 16)
                | ((header[2] & 0xFFL) << 8)
                | (header[3] & 0xFFL);
    }

    public static int checkedLength(byte[] header, int maxFrameBytes) {
        long length = decodeUnsignedLength(header);
        checkSize(length, maxFrameBytes);
        return (int) length;
    }

    public static void checkSize(long length, int maxFrameBytes) {
        if (length > maxFrameBytes) {
            throw new MalformedPayloadException(
                    "Message size " + length + " exceeds maximum " + maxFrameBytes,
                    Map.of("length", length, "max_frame_bytes", maxFrameBytes)
            );
        }
    }

    public static byte[] frame(byte[] body, int maxFrameBytes) {
        checkSize(body.length, maxFrameBytes);
        byte[] out = new byte[HEADER_BYTES + body.length];
        System.arraycopy(encodeHeader(body.length), 0, out, 0, HEADER_BYTES);
        System.arraycopy(body, 0, out, HEADER_BYTES, body.length);
        return out;
    }
}
