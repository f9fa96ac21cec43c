package io.agentlink.error;

import java.util.Map;

public class ToolExecutionFailedException extends RemoteExecutionException {
    public ToolExecutionFailedException(String agentName, String toolName, String reason) {
        this(agentName, "Tool '" + toolName + "' execution failed: " + reason, Map.of("tool_name", toolName));
    }

    public ToolExecutionFailedException(String agentName, String message, Map<String, Object> details) {
        super(agentName, ErrorCode.TOOL_EXECUTION_FAILED, message, details);
    }
}
