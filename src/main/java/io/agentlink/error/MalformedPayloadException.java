package io.agentlink.error;

import java.util.Map;

public class MalformedPayloadException extends ProtocolException {
    public MalformedPayloadException(String message) {
        this(message, null);
    }

    public MalformedPayloadException(String message, Map<String, Object> details) {
        super(ErrorCode.MALFORMED_PAYLOAD, message, details, null);
    }

    public MalformedPayloadException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.MALFORMED_PAYLOAD, message, details, cause);
    }
}
