package io.agentlink.server;

import io.agentlink.agent.Agent;
import io.agentlink.agent.EchoAgent;
import io.agentlink.agent.FailAgent;
import io.agentlink.agent.Message;
import io.agentlink.error.AgentNotFoundException;
import io.agentlink.error.ConnectionClosedException;
import io.agentlink.error.DuplicateAgentException;
import io.agentlink.error.ErrorCode;
import io.agentlink.error.InvalidMessageException;
import io.agentlink.error.ToolNotFoundException;
import io.agentlink.protocol.Envelope;
import io.agentlink.protocol.EnvelopeType;
import io.agentlink.protocol.Frames;
import io.agentlink.protocol.ProtocolCodec;
import io.agentlink.registry.AgentRegistry;
import io.agentlink.registry.AgentRegistration;
import io.agentlink.transport.InMemoryListener;
import io.agentlink.transport.Transport;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class LocalAgentTest {
    @Test
    void processRequestShouldReplyWithAgentMessageAndSameId() {
        LocalAgent local = new LocalAgent(new EchoAgent(), new InMemoryListener("unit-echo"));
        Envelope request = processRequest("echo", "hi");

        Envelope reply = local.handle(request);

        assertEquals(EnvelopeType.RESPONSE, reply.type());
        assertEquals(request.id(), reply.id());
        Message message = ProtocolCodec.messageFromMap(reply.payload().get(Envelope.KEY_MESSAGE));
        assertEquals("agent", message.role());
        assertEquals("Echo: hi", message.content());
    }

    @Test
    void requestForAnotherAgentShouldBeAgentNotFound() {
        LocalAgent local = new LocalAgent(new EchoAgent(), new InMemoryListener("unit-other"));

        AgentNotFoundException e = assertThrows(AgentNotFoundException.class,
                () -> local.handle(processRequest("summarizer", "hi")));

        assertEquals(ErrorCode.AGENT_NOT_FOUND, e.code());
        assertEquals("summarizer", e.agentName());
    }

    @Test
    void unknownMethodAndUnexpectedTypesShouldBeInvalidMessage() {
        LocalAgent local = new LocalAgent(new EchoAgent(), new InMemoryListener("unit-invalid"));

        InvalidMessageException method = assertThrows(InvalidMessageException.class,
                () -> local.handle(Envelope.request("explode", "echo", null)));
        InvalidMessageException type = assertThrows(InvalidMessageException.class,
                () -> local.handle(Envelope.response("x", Map.of())));

        assertEquals("explode", method.details().get("method"));
        assertEquals("response", type.details().get("type"));
    }

    @Test
    void heartbeatShouldBeAnsweredAsPing() {
        LocalAgent local = new LocalAgent(new EchoAgent(), new InMemoryListener("unit-ping"));
        Envelope ping = Envelope.of(EnvelopeType.HEARTBEAT, "ping-1", Map.of("agent_name", "echo"));

        Envelope reply = local.handle(ping);

        assertEquals(EnvelopeType.HEARTBEAT, reply.type());
        assertEquals("ping-1", reply.id());
        assertEquals("ok", reply.payloadString(Envelope.KEY_STATUS));
    }

    @Test
    void agentFailureShouldBecomeAgentErrorWithExceptionDetails() {
        LocalAgent local = new LocalAgent(new FailAgent(), new InMemoryListener("unit-fail"));

        LocalAgent.AgentFailure failure = assertThrows(LocalAgent.AgentFailure.class,
                () -> local.handle(processRequest("fail", "x")));

        assertEquals(ErrorCode.AGENT_ERROR, failure.code());
        assertEquals("intentional failure from fail agent", failure.getMessage());
        assertEquals("IllegalStateException", failure.details().get("exception"));
        assertEquals("fail", failure.details().get("agent_name"));
    }

    @Test
    void protocolExceptionsFromAgentKeepTheirCode() {
        Agent tools = new Agent() {
            @Override
            public String name() {
                return "tools";
            }

            @Override
            public Message process(Message message) {
                throw new ToolNotFoundException("tools", "search");
            }
        };
        LocalAgent local = new LocalAgent(tools, new InMemoryListener("unit-tools"));

        ToolNotFoundException e = assertThrows(ToolNotFoundException.class,
                () -> local.handle(processRequest("tools", "x")));
        assertEquals(ErrorCode.TOOL_NOT_FOUND, e.code());
    }

    @Test
    void malformedFrameShouldGetCorrelatedErrorAndCloseConnection() {
        InMemoryListener listener = new InMemoryListener("unit-malformed");
        LocalAgent local = new LocalAgent(new EchoAgent(), listener);
        local.start();
        Transport client = listener.dial();
        try {
            client.connect();
            byte[] body = "{\"version\":\"7.0\",\"type\":\"request\",\"id\":\"bad-1\",\"payload\":{}}"
                    .getBytes(StandardCharsets.UTF_8);
            client.sendFrame(body, Frames.DEFAULT_MAX_FRAME_BYTES);

            Envelope reply = ProtocolCodec.decode(client.receiveFrame(Frames.DEFAULT_MAX_FRAME_BYTES));

            assertEquals(EnvelopeType.ERROR, reply.type());
            assertEquals("bad-1", reply.id());
            assertEquals("UNSUPPORTED_VERSION", reply.payloadString(Envelope.KEY_ERROR_CODE));
            assertThrows(ConnectionClosedException.class,
                    () -> client.receiveFrame(Frames.DEFAULT_MAX_FRAME_BYTES));
        } finally {
            client.close();
            local.stop();
        }
    }

    @Test
    void oversizedFrameShouldBeRejectedWithMalformedPayload() {
        InMemoryListener listener = new InMemoryListener("unit-oversized");
        LocalAgent local = new LocalAgent(new EchoAgent(), listener,
                LocalAgentOptions.defaults().withMaxFrameBytes(512));
        local.start();
        Transport client = listener.dial();
        try {
            client.connect();
            client.send(Frames.encodeHeader(1_000_000));

            Envelope reply = ProtocolCodec.decode(client.receiveFrame(Frames.DEFAULT_MAX_FRAME_BYTES));

            assertEquals(ProtocolCodec.UNKNOWN_ID, reply.id());
            assertEquals("MALFORMED_PAYLOAD", reply.payloadString(Envelope.KEY_ERROR_CODE));
        } finally {
            client.close();
            local.stop();
        }
    }

    @Test
    void lifecycleShouldRejectDoubleStartAndTolerateDoubleStop() {
        LocalAgent local = new LocalAgent(new EchoAgent(), new InMemoryListener("unit-lifecycle"));
        local.start();
        assertTrue(local.isRunning());
        assertThrows(IllegalStateException.class, local::start);

        local.stop();
        local.stop();
        assertFalse(local.isRunning());
    }

    @Test
    void registryShouldSeeAgentWhileRunningAndLoseItAfterStop() throws Exception {
        AgentRegistry registry = new AgentRegistry();
        InMemoryListener listener = new InMemoryListener("unit-registered");
        LocalAgentOptions options = LocalAgentOptions.defaults()
                .withRegistry(registry)
                .withHeartbeatInterval(Duration.ofMillis(20))
                .withMetadata(Map.of("zone", "test"));
        LocalAgent local = new LocalAgent(new EchoAgent(), listener, options);
        local.start();
        try {
            AgentRegistration registered = registry.lookup("echo");
            assertEquals("memory://unit-registered", registered.endpoint());
            assertEquals(List.of("echo", "stream"), registered.capabilities());
            assertEquals(Map.of("zone", "test"), registered.metadata());

            long deadline = System.currentTimeMillis() + 5_000L;
            while (!registry.lookup("echo").lastHeartbeat().isAfter(registered.lastHeartbeat())
                    && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertTrue(registry.lookup("echo").lastHeartbeat().isAfter(registered.lastHeartbeat()));
        } finally {
            local.stop();
        }
        assertEquals(0, registry.size());
    }

    @Test
    void failedRegistrationShouldLeaveServerStopped() {
        AgentRegistry registry = new AgentRegistry();
        registry.register(AgentRegistration.of("echo", "tcp://elsewhere:1"));
        LocalAgent local = new LocalAgent(new EchoAgent(), new InMemoryListener("unit-dup"),
                LocalAgentOptions.defaults().withRegistry(registry));

        assertThrows(DuplicateAgentException.class, local::start);
        assertFalse(local.isRunning());
        assertEquals("tcp://elsewhere:1", registry.lookup("echo").endpoint());
    }

    @Test
    void streamRequestShouldSendChunksThenEndWithRequestId() {
        LocalAgent local = new LocalAgent(new EchoAgent(), new InMemoryListener("unit-stream"));
        Envelope request = streamRequest("echo", "one two");
        List<Envelope> replies = new ArrayList<>();

        local.handle(request, replies::add);

        assertEquals(4, replies.size());
        for (Envelope reply : replies) {
            assertEquals(request.id(), reply.id());
        }
        List<Object> tokens = new ArrayList<>();
        for (Envelope chunk : replies.subList(0, 3)) {
            assertEquals(EnvelopeType.STREAM_CHUNK, chunk.type());
            tokens.add(ProtocolCodec.messageFromMap(chunk.payload().get(Envelope.KEY_MESSAGE)).content());
        }
        assertEquals(List.of("Echo:", "one", "two"), tokens);
        assertEquals(EnvelopeType.STREAM_END, replies.get(3).type());
    }

    @Test
    void agentFailingMidStreamShouldStopAfterSentChunks() {
        Agent flaky = new Agent() {
            @Override
            public String name() {
                return "flaky";
            }

            @Override
            public Message process(Message message) {
                return message;
            }

            @Override
            public Iterator<Message> stream(Message message) {
                return new Iterator<>() {
                    private int produced;

                    @Override
                    public boolean hasNext() {
                        return true;
                    }

                    @Override
                    public Message next() {
                        if (produced == 2) {
                            throw new IllegalStateException("upstream dropped");
                        }
                        produced++;
                        return Message.of("agent", "part-" + produced);
                    }
                };
            }
        };
        LocalAgent local = new LocalAgent(flaky, new InMemoryListener("unit-flaky"));
        List<Envelope> replies = new ArrayList<>();

        LocalAgent.AgentFailure failure = assertThrows(LocalAgent.AgentFailure.class,
                () -> local.handle(streamRequest("flaky", "x"), replies::add));

        assertEquals(2, replies.size());
        assertEquals("upstream dropped", failure.getMessage());
    }

    @Test
    void streamingFromAgentWithoutSupportShouldBeAgentError() {
        LocalAgent local = new LocalAgent(new FailAgent(), new InMemoryListener("unit-nostream"));

        LocalAgent.AgentFailure failure = assertThrows(LocalAgent.AgentFailure.class,
                () -> local.handle(streamRequest("fail", "x"), reply -> { }));

        assertEquals("UnsupportedOperationException", failure.details().get("exception"));
    }

    private static Envelope streamRequest(String agentName, String content) {
        return Envelope.request(
                Envelope.METHOD_STREAM,
                agentName,
                Map.of(Envelope.KEY_MESSAGE, ProtocolCodec.messageToMap(Message.of("user", content)))
        );
    }

    private static Envelope processRequest(String agentName, String content) {
        return Envelope.request(
                Envelope.METHOD_PROCESS,
                agentName,
                Map.of(Envelope.KEY_MESSAGE, ProtocolCodec.messageToMap(Message.of("user", content)))
        );
    }
}
