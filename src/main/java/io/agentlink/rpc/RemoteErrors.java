package io.agentlink.rpc;

import io.agentlink.error.AgentLinkException;
import io.agentlink.error.ErrorCode;
import io.agentlink.protocol.Envelope;

public final class RemoteErrors {
    private RemoteErrors() {
    }

    /**
     * Typed exception for an {@code error} envelope received from a peer.
     */
    public static AgentLinkException fromEnvelope(Envelope reply, String agentName) {
        ErrorCode code = ErrorCode.fromWire(reply.payloadString(Envelope.KEY_ERROR_CODE));
        String message = reply.payloadString(Envelope.KEY_ERROR_MESSAGE);
        return code.toException(
                agentName,
                message == null ? "remote error without message" : message,
                reply.payloadMap(Envelope.KEY_ERROR_DETAILS)
        );
    }
}
