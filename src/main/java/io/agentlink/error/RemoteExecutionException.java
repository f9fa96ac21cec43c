package io.agentlink.error;

import java.util.Map;

/**
 * The remote side accepted the call but the agent behind it failed. Carries the
 * agent name and the original error text reported by the peer.
 */
public class RemoteExecutionException extends AgentLinkException {
    private final String agentName;
    private final String originalError;

    public RemoteExecutionException(String agentName, String originalError) {
        this(agentName, ErrorCode.AGENT_ERROR, originalError, null);
    }

    public RemoteExecutionException(String agentName, ErrorCode code, String originalError, Map<String, Object> details) {
        this(agentName, code, originalError, details, null);
    }

    public RemoteExecutionException(
            String agentName,
            ErrorCode code,
            String originalError,
            Map<String, Object> details,
            Throwable cause
    ) {
        super(code, "Remote execution failed on agent '" + agentName + "': " + originalError, details, cause);
        this.agentName = agentName;
        this.originalError = originalError;
    }

    public String agentName() {
        return agentName;
    }

    public String originalError() {
        return originalError;
    }
}
