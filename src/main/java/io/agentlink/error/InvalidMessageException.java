package io.agentlink.error;

import java.util.Map;

public class InvalidMessageException extends ProtocolException {
    public InvalidMessageException(String message) {
        this(message, null);
    }

    public InvalidMessageException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_MESSAGE, message, details, null);
    }

    public InvalidMessageException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.INVALID_MESSAGE, message, details, cause);
    }
}
