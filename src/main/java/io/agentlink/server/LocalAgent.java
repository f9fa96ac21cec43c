package io.agentlink.server;

import io.agentlink.agent.Agent;
import io.agentlink.agent.Message;
import io.agentlink.error.AgentLinkException;
import io.agentlink.error.AgentNotFoundException;
import io.agentlink.error.ErrorCode;
import io.agentlink.error.InvalidMessageException;
import io.agentlink.error.MalformedPayloadException;
import io.agentlink.protocol.Envelope;
import io.agentlink.protocol.EnvelopeType;
import io.agentlink.protocol.ProtocolCodec;
import io.agentlink.registry.AgentRegistration;
import io.agentlink.registry.HeartbeatEmitter;
import io.agentlink.rpc.EnvelopeHandler;
import io.agentlink.rpc.EnvelopeServer;
import io.agentlink.rpc.ReplySink;
import io.agentlink.security.SensitiveDataMasker;
import io.agentlink.transport.Endpoints;
import io.agentlink.transport.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Exports one {@link Agent} on a transport endpoint.
 *
 * <p>Each connection is served on its own thread and answers requests in order. A
 * {@code process} request is dispatched to the wrapped agent; a {@code heartbeat} envelope is
 * answered as a liveness ping. A {@code stream} request gets one {@code stream_chunk} per
 * element of {@link Agent#stream(Message)}, then {@code stream_end}. When the agent throws,
 * the caller receives an {@code AGENT_ERROR} reply carrying the exception text, or the
 * agent's own code when it threw an {@link AgentLinkException}.
 */
public final class LocalAgent implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalAgent.class);

    private final Agent agent;
    private final LocalAgentOptions options;
    private final EnvelopeServer server;

    private HeartbeatEmitter heartbeat;
    private boolean registered;

    public LocalAgent(Agent agent, String endpoint) {
        this(agent, Endpoints.newListener(endpoint), LocalAgentOptions.defaults());
    }

    public LocalAgent(Agent agent, TransportListener listener) {
        this(agent, listener, LocalAgentOptions.defaults());
    }

    public LocalAgent(Agent agent, TransportListener listener, LocalAgentOptions options) {
        if (agent == null) {
            throw new IllegalArgumentException("agent is required");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener is required");
        }
        this.agent = agent;
        this.options = options == null ? LocalAgentOptions.defaults() : options;
        this.server = new EnvelopeServer(agent.name(), listener, new Handler(), this.options.maxFrameBytes());
    }

    public String name() {
        return agent.name();
    }

    public String endpoint() {
        return server.endpoint();
    }

    public boolean isRunning() {
        return server.isRunning();
    }

    public List<String> capabilities() {
        return options.capabilities().isEmpty() ? agent.capabilities() : options.capabilities();
    }

    /**
     * Binds the endpoint, starts accepting, and registers with the configured registry.
     * A failed registration stops the server again before the error propagates.
     */
    public synchronized void start() {
        server.start();
        LOGGER.info("Agent '{}' listening on {}", agent.name(), server.endpoint());
        if (options.registry() == null) {
            return;
        }
        try {
            options.registry().register(AgentRegistration.of(
                    agent.name(),
                    server.endpoint(),
                    capabilities(),
                    options.metadata()
            ));
        } catch (RuntimeException e) {
            server.stop();
            throw e;
        }
        registered = true;
        heartbeat = new HeartbeatEmitter(options.registry(), agent.name(), options.heartbeatInterval());
        heartbeat.start();
    }

    public synchronized void stop() {
        if (heartbeat != null) {
            heartbeat.stop();
            heartbeat = null;
        }
        server.stop();
        if (registered) {
            registered = false;
            try {
                options.registry().unregister(agent.name());
            } catch (AgentLinkException e) {
                LOGGER.warn("Failed to unregister agent '{}': {}", agent.name(), e.getMessage());
            }
        }
        LOGGER.info("Agent '{}' stopped", agent.name());
    }

    @Override
    public void close() {
        stop();
    }

    Envelope handle(Envelope request) {
        if (request.isType(EnvelopeType.REQUEST)) {
            return handleRequest(request);
        }
        if (request.isType(EnvelopeType.HEARTBEAT)) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(Envelope.KEY_AGENT_NAME, agent.name());
            payload.put(Envelope.KEY_STATUS, "ok");
            return Envelope.of(EnvelopeType.HEARTBEAT, request.id(), payload);
        }
        throw new InvalidMessageException(
                "Unexpected envelope type: " + request.type().wireName(),
                Map.of("type", request.type().wireName())
        );
    }

    /**
     * Streams when asked to, otherwise sends the single reply from {@link #handle(Envelope)}.
     */
    void handle(Envelope request, ReplySink replies) {
        if (request.isType(EnvelopeType.REQUEST)
                && Envelope.METHOD_STREAM.equals(request.payloadString(Envelope.KEY_METHOD))) {
            stream(request, replies);
            return;
        }
        replies.send(handle(request));
    }

    private Envelope handleRequest(Envelope request) {
        String method = request.payloadString(Envelope.KEY_METHOD);
        if (!Envelope.METHOD_PROCESS.equals(method)) {
            throw new InvalidMessageException(
                    "Unknown method: " + method,
                    method == null ? Map.of() : Map.of("method", method)
            );
        }
        Message input = inputMessage(request);
        Message output = invoke(() -> agent.process(input));
        if (output == null) {
            return agentError(request, "agent returned no message", "NullPointerException");
        }
        return Envelope.response(request.id(), Map.of(Envelope.KEY_MESSAGE, ProtocolCodec.messageToMap(output)));
    }

    private void stream(Envelope request, ReplySink replies) {
        Message input = inputMessage(request);
        Iterator<Message> chunks = invoke(() -> agent.stream(input));
        int sent = 0;
        while (chunks != null && invoke(chunks::hasNext)) {
            Message chunk = invoke(chunks::next);
            if (chunk == null) {
                replies.send(agentError(request, "agent streamed no message", "NullPointerException"));
                return;
            }
            replies.send(Envelope.streamChunk(request.id(), ProtocolCodec.messageToMap(chunk)));
            sent++;
        }
        LOGGER.debug("Agent '{}' streamed {} chunks for {}", agent.name(), sent, request.id());
        replies.send(Envelope.streamEnd(request.id()));
    }

    private Message inputMessage(Envelope request) {
        String target = request.payloadString(Envelope.KEY_AGENT_NAME);
        if (target != null && !target.equals(agent.name())) {
            throw new AgentNotFoundException(
                    target,
                    "Agent '" + target + "' is not served here (serving '" + agent.name() + "')",
                    Map.of("agent_name", target)
            );
        }
        Object rawMessage = request.payload().get(Envelope.KEY_MESSAGE);
        if (rawMessage == null) {
            throw new MalformedPayloadException("Missing 'message' in " + request.payloadString(Envelope.KEY_METHOD) + " request");
        }
        Message input = ProtocolCodec.messageFromMap(rawMessage);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Agent '{}' handling {} {} (role={}, metadata={})",
                    agent.name(), request.payloadString(Envelope.KEY_METHOD), request.id(), input.role(),
                    SensitiveDataMasker.masked(input.metadata()));
        }
        return input;
    }

    private <T> T invoke(Callable<T> call) {
        try {
            return call.call();
        } catch (AgentLinkException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(e);
        } catch (Exception e) {
            throw failure(e);
        }
    }

    private AgentFailure failure(Exception e) {
        LOGGER.warn("Agent '{}' failed: {}", agent.name(), e.toString());
        return new AgentFailure(agent.name(), e);
    }

    private Envelope agentError(Envelope request, String message, String exception) {
        return Envelope.error(
                request.id(),
                ErrorCode.AGENT_ERROR,
                message,
                Map.of("agent_name", agent.name(), "exception", exception)
        );
    }

    private final class Handler implements EnvelopeHandler {
        @Override
        public Envelope handle(Envelope request) {
            return LocalAgent.this.handle(request);
        }

        @Override
        public void handle(Envelope request, ReplySink replies) {
            LocalAgent.this.handle(request, replies);
        }
    }

    /**
     * Wrapped agent threw something outside the protocol hierarchy.
     */
    static final class AgentFailure extends AgentLinkException {
        AgentFailure(String agentName, Exception cause) {
            super(
                    ErrorCode.AGENT_ERROR,
                    cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage(),
                    Map.of("agent_name", agentName, "exception", cause.getClass().getSimpleName()),
                    cause
            );
        }
    }
}
