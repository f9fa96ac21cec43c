package io.agentlink.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of every failure raised by the protocol adapter. Each instance carries the
 * wire {@link ErrorCode} it maps to and a free-form details map that is sent as
 * {@code error_details} when the failure crosses the wire.
 */
public class AgentLinkException extends RuntimeException {
    private final ErrorCode code;
    private final Map<String, Object> details;

    public AgentLinkException(ErrorCode code, String message, Map<String, Object> details) {
        this(code, message, details, null);
    }

    public AgentLinkException(ErrorCode code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorCode code() {
        return code;
    }

    public Map<String, Object> details() {
        return details;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }
}
