package io.agentlink.client;

import io.agentlink.agent.Agent;
import io.agentlink.agent.Message;
import io.agentlink.error.InvalidMessageException;
import io.agentlink.error.MalformedPayloadException;
import io.agentlink.protocol.Envelope;
import io.agentlink.protocol.EnvelopeType;
import io.agentlink.protocol.Frames;
import io.agentlink.protocol.ProtocolCodec;
import io.agentlink.rpc.EnvelopeClient;
import io.agentlink.rpc.RemoteErrors;
import io.agentlink.transport.Endpoints;
import io.agentlink.transport.Transport;

import java.io.Closeable;
import java.time.Duration;
import java.util.Map;

/**
 * {@link Agent} proxy for an agent exported by a {@code LocalAgent}.
 *
 * <p>The connection is opened on first use and reused; calls on one instance are
 * serialized. An error reply is rethrown as the typed exception for its code, so callers
 * see the same failures they would from the agent in process, plus connection-class
 * failures when the peer cannot be reached or the call exceeds its timeout.
 */
public final class RemoteAgent implements Agent, Closeable {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String name;
    private final EnvelopeClient client;

    public RemoteAgent(String name, String endpoint) {
        this(name, endpoint, DEFAULT_TIMEOUT);
    }

    public RemoteAgent(String name, String endpoint, Duration timeout) {
        this(name, Endpoints.newTransport(endpoint), timeout);
    }

    public RemoteAgent(String name, Transport transport, Duration timeout) {
        this(name, transport, timeout, Frames.DEFAULT_MAX_FRAME_BYTES);
    }

    public RemoteAgent(String name, Transport transport, Duration timeout, int maxFrameBytes) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("agent name cannot be empty");
        }
        this.name = name;
        this.client = new EnvelopeClient(name, transport, timeout, maxFrameBytes);
    }

    @Override
    public String name() {
        return name;
    }

    public String endpoint() {
        return client.endpoint();
    }

    public Duration timeout() {
        return client.timeout();
    }

    @Override
    public Message process(Message message) {
        Envelope request = Envelope.request(
                Envelope.METHOD_PROCESS,
                name,
                Map.of(Envelope.KEY_MESSAGE, ProtocolCodec.messageToMap(message))
        );
        Envelope reply = client.call(request);
        if (reply.isType(EnvelopeType.ERROR)) {
            throw RemoteErrors.fromEnvelope(reply, name);
        }
        if (!reply.isType(EnvelopeType.RESPONSE)) {
            throw new InvalidMessageException(
                    "Unexpected reply type: " + reply.type().wireName(),
                    Map.of("type", reply.type().wireName())
            );
        }
        Object rawMessage = reply.payload().get(Envelope.KEY_MESSAGE);
        if (rawMessage == null) {
            throw new MalformedPayloadException("Response is missing 'message'", Map.of("id", reply.id()));
        }
        return ProtocolCodec.messageFromMap(rawMessage);
    }

    /**
     * Asks the remote agent to stream its reply. Close the result when abandoning it early.
     */
    @Override
    public RemoteStream stream(Message message) {
        Envelope request = Envelope.request(
                Envelope.METHOD_STREAM,
                name,
                Map.of(Envelope.KEY_MESSAGE, ProtocolCodec.messageToMap(message))
        );
        return new RemoteStream(name, client.stream(request));
    }

    /**
     * Round trip of a {@code heartbeat} envelope, including connecting when needed.
     */
    public Duration ping() {
        long started = System.nanoTime();
        Envelope reply = client.call(Envelope.of(
                EnvelopeType.HEARTBEAT,
                Envelope.newId(),
                Map.of(Envelope.KEY_AGENT_NAME, name)
        ));
        if (reply.isType(EnvelopeType.ERROR)) {
            throw RemoteErrors.fromEnvelope(reply, name);
        }
        if (!reply.isType(EnvelopeType.HEARTBEAT)) {
            throw new InvalidMessageException(
                    "Unexpected ping reply type: " + reply.type().wireName(),
                    Map.of("type", reply.type().wireName())
            );
        }
        return Duration.ofNanos(System.nanoTime() - started);
    }

    @Override
    public void close() {
        client.close();
    }
}
