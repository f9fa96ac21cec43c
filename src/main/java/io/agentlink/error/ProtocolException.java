package io.agentlink.error;

import java.util.Map;

/**
 * A frame or envelope that does not follow the wire protocol. Raised before any
 * agent logic runs.
 */
public class ProtocolException extends AgentLinkException {
    protected ProtocolException(ErrorCode code, String message, Map<String, Object> details, Throwable cause) {
        super(code, message, details, cause);
    }
}
