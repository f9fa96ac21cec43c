package io.agentlink.protocol;

import java.util.Locale;
import java.util.Optional;

public enum EnvelopeType {
    REQUEST,
    RESPONSE,
    ERROR,
    HEARTBEAT,
    REGISTER,
    UNREGISTER,
    STREAM_CHUNK,
    STREAM_END;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<EnvelopeType> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (EnvelopeType type : values()) {
            if (type.wireName().equals(raw)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
