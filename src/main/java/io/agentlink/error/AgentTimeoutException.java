package io.agentlink.error;

import java.time.Duration;
import java.util.Map;

public class AgentTimeoutException extends RemoteExecutionException {
    public AgentTimeoutException(String agentName, Duration timeout) {
        this(agentName, "Agent '" + agentName + "' timed out after " + timeout, Map.of("timeout_ms", timeout.toMillis()));
    }

    public AgentTimeoutException(String agentName, String message, Map<String, Object> details) {
        super(agentName, ErrorCode.AGENT_TIMEOUT, message, details);
    }
}
