package io.agentlink.error;

import java.util.Map;

public class ToolNotFoundException extends RemoteExecutionException {
    public ToolNotFoundException(String agentName, String toolName) {
        this(agentName, "Tool '" + toolName + "' not found", Map.of("tool_name", toolName));
    }

    public ToolNotFoundException(String agentName, String message, Map<String, Object> details) {
        super(agentName, ErrorCode.TOOL_NOT_FOUND, message, details);
    }
}
