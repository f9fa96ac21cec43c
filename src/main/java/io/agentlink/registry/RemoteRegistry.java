package io.agentlink.registry;

import io.agentlink.error.InvalidMessageException;
import io.agentlink.error.MalformedPayloadException;
import io.agentlink.protocol.Envelope;
import io.agentlink.protocol.EnvelopeType;
import io.agentlink.rpc.EnvelopeClient;
import io.agentlink.rpc.RemoteErrors;
import io.agentlink.transport.Endpoints;
import io.agentlink.transport.Transport;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link Registry} client for a {@link RegistryServer}. Registry errors reported by the
 * server are rethrown as the same typed exceptions.
 */
public final class RemoteRegistry implements Registry, Closeable {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final EnvelopeClient client;

    public RemoteRegistry(String endpoint) {
        this(endpoint, DEFAULT_TIMEOUT);
    }

    public RemoteRegistry(String endpoint, Duration timeout) {
        this(Endpoints.newTransport(endpoint), timeout);
    }

    public RemoteRegistry(Transport transport, Duration timeout) {
        this.client = new EnvelopeClient("registry", transport, timeout);
    }

    public String endpoint() {
        return client.endpoint();
    }

    @Override
    public AgentRegistration register(AgentRegistration registration) {
        Map<String, Object> payload = Map.of(Envelope.KEY_REGISTRATION, registration.toMap());
        Envelope reply = call(Envelope.of(EnvelopeType.REGISTER, Envelope.newId(), payload), registration.name());
        return AgentRegistration.fromMap(requireField(reply, Envelope.KEY_REGISTRATION));
    }

    @Override
    public void unregister(String name) {
        call(Envelope.of(EnvelopeType.UNREGISTER, Envelope.newId(), Map.of(Envelope.KEY_AGENT_NAME, name)), name);
    }

    @Override
    public AgentRegistration lookup(String name) {
        Envelope reply = call(Envelope.request(Envelope.METHOD_LOOKUP, name, null), name);
        return AgentRegistration.fromMap(requireField(reply, Envelope.KEY_REGISTRATION));
    }

    @Override
    public List<AgentRegistration> list() {
        Envelope reply = call(Envelope.request(Envelope.METHOD_LIST, null, null), null);
        Object raw = requireField(reply, Envelope.KEY_REGISTRATIONS);
        if (!(raw instanceof List<?> items)) {
            throw new MalformedPayloadException("'registrations' must be a list");
        }
        List<AgentRegistration> out = new ArrayList<>(items.size());
        for (Object item : items) {
            out.add(AgentRegistration.fromMap(item));
        }
        return out;
    }

    @Override
    public AgentRegistration heartbeat(String name) {
        Envelope reply = call(
                Envelope.of(EnvelopeType.HEARTBEAT, Envelope.newId(), Map.of(Envelope.KEY_AGENT_NAME, name)),
                name
        );
        return AgentRegistration.fromMap(requireField(reply, Envelope.KEY_REGISTRATION));
    }

    @Override
    public void close() {
        client.close();
    }

    private Envelope call(Envelope request, String agentName) {
        Envelope reply = client.call(request);
        if (reply.isType(EnvelopeType.ERROR)) {
            throw RemoteErrors.fromEnvelope(reply, agentName);
        }
        if (!reply.isType(EnvelopeType.RESPONSE)) {
            throw new InvalidMessageException(
                    "Unexpected reply type from registry: " + reply.type().wireName(),
                    Map.of("type", reply.type().wireName())
            );
        }
        return reply;
    }

    private static Object requireField(Envelope reply, String key) {
        Object value = reply.payload().get(key);
        if (value == null) {
            throw new MalformedPayloadException("Registry reply is missing '" + key + "'");
        }
        return value;
    }
}
