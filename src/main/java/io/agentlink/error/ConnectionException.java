package io.agentlink.error;

import java.util.Map;

/**
 * Transport-level failure: dial refused, socket error, or a call on a transport
 * that is not connected.
 */
public class ConnectionException extends AgentLinkException {
    public ConnectionException(String message) {
        this(message, null);
    }

    public ConnectionException(String message, Map<String, Object> details) {
        super(ErrorCode.CONNECTION_FAILED, message, details);
    }

    public ConnectionException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.CONNECTION_FAILED, message, details, cause);
    }

    protected ConnectionException(ErrorCode code, String message, Map<String, Object> details, Throwable cause) {
        super(code, message, details, cause);
    }
}
