package io.agentlink.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ToolResult(
        boolean success,
        Object data,
        String error,
        Map<String, Object> metadata
) {
    public ToolResult {
        if (!success && error == null) {
            throw new IllegalArgumentException("Failed ToolResult must have error message");
        }
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ToolResult ok(Object data) {
        return new ToolResult(true, data, null, Map.of());
    }

    public static ToolResult fail(String error) {
        return new ToolResult(false, null, error, Map.of());
    }
}
