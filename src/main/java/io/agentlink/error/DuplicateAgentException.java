package io.agentlink.error;

import java.util.Map;

/**
 * A registration collided with a live entry of the same name bound to another endpoint.
 */
public class DuplicateAgentException extends AgentLinkException {
    private final String agentName;

    public DuplicateAgentException(String agentName, Map<String, Object> details) {
        this(agentName, "Agent '" + agentName + "' is already registered", details);
    }

    public DuplicateAgentException(String agentName, String message, Map<String, Object> details) {
        super(ErrorCode.DUPLICATE_AGENT, message, details);
        this.agentName = agentName;
    }

    public String agentName() {
        return agentName;
    }
}
