package io.agentlink.error;

import java.util.Map;

public class AgentUnavailableException extends RemoteExecutionException {
    public AgentUnavailableException(String agentName) {
        this(agentName, "Agent '" + agentName + "' is unavailable", null);
    }

    public AgentUnavailableException(String agentName, String message, Map<String, Object> details) {
        super(agentName, ErrorCode.AGENT_UNAVAILABLE, message, details);
    }
}
