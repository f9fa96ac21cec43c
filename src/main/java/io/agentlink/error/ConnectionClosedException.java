package io.agentlink.error;

import java.util.Map;

/**
 * The peer closed the stream, or the local side closed it while a call was blocked on it.
 */
public class ConnectionClosedException extends ConnectionException {
    public ConnectionClosedException(String message) {
        this(message, null);
    }

    public ConnectionClosedException(String message, Map<String, Object> details) {
        super(ErrorCode.CONNECTION_CLOSED, message, details, null);
    }

    public ConnectionClosedException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.CONNECTION_CLOSED, message, details, cause);
    }
}
