package io.agentlink.error;

import java.util.Map;

public class ConnectionTimeoutException extends ConnectionException {
    public ConnectionTimeoutException(String message) {
        this(message, null);
    }

    public ConnectionTimeoutException(String message, Map<String, Object> details) {
        super(ErrorCode.CONNECTION_TIMEOUT, message, details, null);
    }

    public ConnectionTimeoutException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.CONNECTION_TIMEOUT, message, details, cause);
    }
}
