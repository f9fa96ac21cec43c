package io.agentlink.error;

import java.util.Map;

public class RegistrationFailedException extends AgentLinkException {
    public RegistrationFailedException(String message) {
        this(message, null);
    }

    public RegistrationFailedException(String message, Map<String, Object> details) {
        super(ErrorCode.REGISTRATION_FAILED, message, details);
    }
}
