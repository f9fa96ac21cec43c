package io.agentlink.error;

import java.util.Map;

public class AgentNotFoundException extends AgentLinkException {
    private final String agentName;

    public AgentNotFoundException(String agentName) {
        this(agentName, "Agent '" + agentName + "' not found in registry", null);
    }

    public AgentNotFoundException(String agentName, String message, Map<String, Object> details) {
        super(ErrorCode.AGENT_NOT_FOUND, message, details);
        this.agentName = agentName;
    }

    public String agentName() {
        return agentName;
    }
}
