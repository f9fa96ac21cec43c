package io.agentlink.error;

import java.util.Locale;
import java.util.Map;

/**
 * Wire-level error codes carried in the {@code error_code} field of an error envelope.
 */
public enum ErrorCode {
    CONNECTION_FAILED,
    CONNECTION_TIMEOUT,
    CONNECTION_CLOSED,

    INVALID_MESSAGE,
    UNSUPPORTED_VERSION,
    MALFORMED_PAYLOAD,

    AGENT_NOT_FOUND,
    AGENT_UNAVAILABLE,
    AGENT_TIMEOUT,
    AGENT_ERROR,

    TOOL_NOT_FOUND,
    TOOL_EXECUTION_FAILED,

    REGISTRATION_FAILED,
    DUPLICATE_AGENT,

    INTERNAL_ERROR;

    public String wireName() {
        return name();
    }

    public boolean isConnectionError() {
        return this == CONNECTION_FAILED || this == CONNECTION_TIMEOUT || this == CONNECTION_CLOSED;
    }

    public boolean isProtocolError() {
        return this == INVALID_MESSAGE || this == UNSUPPORTED_VERSION || this == MALFORMED_PAYLOAD;
    }

    /**
     * Resolves a wire code. Unknown or blank codes map to {@link #INTERNAL_ERROR} so
     * that a newer peer never turns an error reply into a decode failure.
     */
    public static ErrorCode fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return INTERNAL_ERROR;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return INTERNAL_ERROR;
        }
    }

    /**
     * Rebuilds the typed exception for an error received from a peer.
     *
     * @param agentName name of the remote agent the call targeted, used for agent-class errors
     * @param message   the peer's {@code error_message}
     * @param details   the peer's {@code error_details}
     */
    public AgentLinkException toException(String agentName, String message, Map<String, Object> details) {
        return switch (this) {
            case CONNECTION_FAILED -> new ConnectionException(message, details);
            case CONNECTION_TIMEOUT -> new ConnectionTimeoutException(message, details);
            case CONNECTION_CLOSED -> new ConnectionClosedException(message, details);
            case INVALID_MESSAGE -> new InvalidMessageException(message, details);
            case UNSUPPORTED_VERSION -> new UnsupportedVersionException(message, details);
            case MALFORMED_PAYLOAD -> new MalformedPayloadException(message, details);
            case AGENT_NOT_FOUND -> new AgentNotFoundException(agentName, message, details);
            case AGENT_UNAVAILABLE -> new AgentUnavailableException(agentName, message, details);
            case AGENT_TIMEOUT -> new AgentTimeoutException(agentName, message, details);
            case TOOL_NOT_FOUND -> new ToolNotFoundException(agentName, message, details);
            case TOOL_EXECUTION_FAILED -> new ToolExecutionFailedException(agentName, message, details);
            case REGISTRATION_FAILED -> new RegistrationFailedException(message, details);
            case DUPLICATE_AGENT -> new DuplicateAgentException(agentName, message, details);
            default -> new RemoteExecutionException(agentName, this, message, details);
        };
    }
}
