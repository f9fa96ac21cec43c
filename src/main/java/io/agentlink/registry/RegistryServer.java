package io.agentlink.registry;

import io.agentlink.error.InvalidMessageException;
import io.agentlink.error.MalformedPayloadException;
import io.agentlink.protocol.Envelope;
import io.agentlink.protocol.Frames;
import io.agentlink.rpc.EnvelopeServer;
import io.agentlink.transport.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Exports a {@link Registry} over a transport so agents in other processes can register.
 *
 * <p>{@code register}, {@code unregister} and {@code heartbeat} envelopes map to the
 * matching registry calls; {@code request} envelopes carry {@code lookup} or {@code list}.
 * Every success is answered with a {@code response} envelope. The registry's own lifecycle
 * (pruning) is not owned by this server.
 */
public final class RegistryServer {
    private static final Logger LOGGER = LoggerFactory.getLogger(RegistryServer.class);

    private final Registry registry;
    private final EnvelopeServer server;

    public RegistryServer(Registry registry, TransportListener listener) {
        this(registry, listener, Frames.DEFAULT_MAX_FRAME_BYTES);
    }

    public RegistryServer(Registry registry, TransportListener listener, int maxFrameBytes) {
        if (registry == null) {
            throw new IllegalArgumentException("registry is required");
        }
        this.registry = registry;
        this.server = new EnvelopeServer("registry", listener, this::handle, maxFrameBytes);
    }

    public void start() {
        server.start();
        LOGGER.info("Registry listening on {}", server.endpoint());
    }

    public void stop() {
        if (server.isRunning()) {
            server.stop();
            LOGGER.info("Registry on {} stopped", server.endpoint());
        }
    }

    public boolean isRunning() {
        return server.isRunning();
    }

    public String endpoint() {
        return server.endpoint();
    }

    Envelope handle(Envelope request) {
        switch (request.type()) {
            case REGISTER: {
                Object raw = request.payload().get(Envelope.KEY_REGISTRATION);
                if (raw == null) {
                    throw new MalformedPayloadException("Missing 'registration' in register payload");
                }
                AgentRegistration stored = registry.register(AgentRegistration.fromMap(raw));
                return Envelope.response(request.id(), Map.of(Envelope.KEY_REGISTRATION, stored.toMap()));
            }
            case UNREGISTER: {
                registry.unregister(requireAgentName(request));
                return Envelope.response(request.id(), Map.of(Envelope.KEY_STATUS, "ok"));
            }
            case HEARTBEAT: {
                AgentRegistration renewed = registry.heartbeat(requireAgentName(request));
                return Envelope.response(request.id(), Map.of(Envelope.KEY_REGISTRATION, renewed.toMap()));
            }
            case REQUEST:
                return handleQuery(request);
            default:
                throw new InvalidMessageException(
                        "Registry does not accept '" + request.type().wireName() + "' envelopes",
                        Map.of("type", request.type().wireName())
                );
        }
    }

    private Envelope handleQuery(Envelope request) {
        String method = request.payloadString(Envelope.KEY_METHOD);
        if (Envelope.METHOD_LOOKUP.equals(method)) {
            AgentRegistration found = registry.lookup(requireAgentName(request));
            return Envelope.response(request.id(), Map.of(Envelope.KEY_REGISTRATION, found.toMap()));
        }
        if (Envelope.METHOD_LIST.equals(method)) {
            List<Map<String, Object>> out = new ArrayList<>();
            for (AgentRegistration registration : registry.list()) {
                out.add(registration.toMap());
            }
            return Envelope.response(request.id(), Map.of(Envelope.KEY_REGISTRATIONS, out));
        }
        throw new InvalidMessageException(
                "Unknown registry method: " + method,
                method == null ? Map.of() : Map.of("method", method)
        );
    }

    private static String requireAgentName(Envelope request) {
        String name = request.payloadString(Envelope.KEY_AGENT_NAME);
        if (name == null || name.isBlank()) {
            throw new MalformedPayloadException("Missing 'agent_name' in " + request.type().wireName() + " payload");
        }
        return name;
    }
}
