package io.agentlink.error;

import java.util.Map;

public class UnsupportedVersionException extends ProtocolException {
    public UnsupportedVersionException(String message) {
        this(message, null);
    }

    public UnsupportedVersionException(String message, Map<String, Object> details) {
        super(ErrorCode.UNSUPPORTED_VERSION, message, details, null);
    }

    public UnsupportedVersionException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.UNSUPPORTED_VERSION, message, details, cause);
    }
}
