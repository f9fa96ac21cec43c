package io.agentlink.rpc;

import io.agentlink.error.AgentTimeoutException;
import io.agentlink.error.ConnectionException;
import io.agentlink.error.ConnectionTimeoutException;
import io.agentlink.error.ErrorCode;
import io.agentlink.error.InvalidMessageException;
import io.agentlink.error.MalformedPayloadException;
import io.agentlink.protocol.Envelope;
import io.agentlink.protocol.EnvelopeType;
import io.agentlink.protocol.Frames;
import io.agentlink.protocol.ProtocolCodec;
import io.agentlink.transport.InMemoryTransport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvelopeClientTest {
    @Test
    void replyWithForeignIdShouldBeRejectedAndDropConnection() throws Exception {
        InMemoryTransport.Pair pair = InMemoryTransport.pair();
        CompletableFuture<Void> peer = CompletableFuture.runAsync(() -> {
            Envelope request = ProtocolCodec.decode(pair.server().receiveFrame(Frames.DEFAULT_MAX_FRAME_BYTES));
            Envelope wrong = Envelope.response("not-" + request.id(), Map.of());
            pair.server().sendFrame(ProtocolCodec.encode(wrong), Frames.DEFAULT_MAX_FRAME_BYTES);
        });
        EnvelopeClient client = new EnvelopeClient("peer", pair.client(), Duration.ofSeconds(5));

        InvalidMessageException e = assertThrows(InvalidMessageException.class,
                () -> client.call(Envelope.request("process", "peer", null)));

        peer.get(5, TimeUnit.SECONDS);
        assertTrue(e.getMessage().contains("id mismatch"));
        assertFalse(client.isConnected());
    }

    @Test
    void silentPeerShouldTimeOut() {
        InMemoryTransport.Pair pair = InMemoryTransport.pair();
        EnvelopeClient client = new EnvelopeClient("silent", pair.client(), Duration.ofMillis(100));

        ConnectionTimeoutException e = assertThrows(ConnectionTimeoutException.class,
                () -> client.call(Envelope.request("process", "silent", null)));

        assertEquals(100L, e.details().get("timeout_ms"));
        assertFalse(client.isConnected());
    }

    @Test
    void errorReplyShouldBeReturnedForCallerToInterpret() throws Exception {
        InMemoryTransport.Pair pair = InMemoryTransport.pair();
        CompletableFuture<Void> peer = CompletableFuture.runAsync(() -> {
            Envelope request = ProtocolCodec.decode(pair.server().receiveFrame(Frames.DEFAULT_MAX_FRAME_BYTES));
            Envelope error = Envelope.error(request.id(), ErrorCode.AGENT_TIMEOUT, "slow", Map.of());
            pair.server().sendFrame(ProtocolCodec.encode(error), Frames.DEFAULT_MAX_FRAME_BYTES);
        });
        EnvelopeClient client = new EnvelopeClient("peer", pair.client(), Duration.ofSeconds(5));

        Envelope reply = client.call(Envelope.request("process", "peer", null));

        peer.get(5, TimeUnit.SECONDS);
        assertEquals(EnvelopeType.ERROR, reply.type());
        assertEquals("AGENT_TIMEOUT", reply.payloadString(Envelope.KEY_ERROR_CODE));
        assertTrue(client.isConnected());
        assertEquals(AgentTimeoutException.class, RemoteErrors.fromEnvelope(reply, "peer").getClass());
    }

    @Test
    void uncorrelatedErrorReplyShouldBeReturnedAndDropConnection() throws Exception {
        InMemoryTransport.Pair pair = InMemoryTransport.pair();
        CompletableFuture<Void> peer = CompletableFuture.runAsync(() -> {
            pair.server().receiveFrame(Frames.DEFAULT_MAX_FRAME_BYTES);
            Envelope error = Envelope.error(ProtocolCodec.UNKNOWN_ID, ErrorCode.MALFORMED_PAYLOAD, "too big", Map.of());
            pair.server().sendFrame(ProtocolCodec.encode(error), Frames.DEFAULT_MAX_FRAME_BYTES);
        });
        EnvelopeClient client = new EnvelopeClient("peer", pair.client(), Duration.ofSeconds(5));

        Envelope reply = client.call(Envelope.request("process", "peer", null));

        peer.get(5, TimeUnit.SECONDS);
        assertEquals(EnvelopeType.ERROR, reply.type());
        assertEquals(MalformedPayloadException.class, RemoteErrors.fromEnvelope(reply, "peer").getClass());
        assertFalse(client.isConnected());
    }

    @Test
    void uncorrelatedNonErrorReplyShouldStillBeRejected() throws Exception {
        InMemoryTransport.Pair pair = InMemoryTransport.pair();
        CompletableFuture<Void> peer = CompletableFuture.runAsync(() -> {
            pair.server().receiveFrame(Frames.DEFAULT_MAX_FRAME_BYTES);
            Envelope stray = Envelope.response(ProtocolCodec.UNKNOWN_ID, Map.of());
            pair.server().sendFrame(ProtocolCodec.encode(stray), Frames.DEFAULT_MAX_FRAME_BYTES);
        });
        EnvelopeClient client = new EnvelopeClient("peer", pair.client(), Duration.ofSeconds(5));

        assertThrows(InvalidMessageException.class, () -> client.call(Envelope.request("process", "peer", null)));
        peer.get(5, TimeUnit.SECONDS);
    }

    @Test
    void streamShouldHoldConnectionUntilTerminalReply() throws Exception {
        InMemoryTransport.Pair pair = InMemoryTransport.pair();
        CompletableFuture<Void> peer = CompletableFuture.runAsync(() -> {
            Envelope request = ProtocolCodec.decode(pair.server().receiveFrame(Frames.DEFAULT_MAX_FRAME_BYTES));
            for (int i = 0; i < 2; i++) {
                Envelope chunk = Envelope.streamChunk(request.id(), Map.of("role", "agent", "content", i));
                pair.server().sendFrame(ProtocolCodec.encode(chunk), Frames.DEFAULT_MAX_FRAME_BYTES);
            }
            pair.server().sendFrame(ProtocolCodec.encode(Envelope.streamEnd(request.id())), Frames.DEFAULT_MAX_FRAME_BYTES);
        });
        EnvelopeClient client = new EnvelopeClient("peer", pair.client(), Duration.ofSeconds(5));

        EnvelopeClient.Replies replies = client.stream(Envelope.request(Envelope.METHOD_STREAM, "peer", null));
        CompletableFuture<Envelope> blocked = CompletableFuture.supplyAsync(
                () -> client.call(Envelope.request("process", "peer", null)));

        assertEquals(EnvelopeType.STREAM_CHUNK, replies.next().type());
        assertEquals(EnvelopeType.STREAM_CHUNK, replies.next().type());
        assertFalse(blocked.isDone());
        assertEquals(EnvelopeType.STREAM_END, replies.next().type());
        assertTrue(replies.isFinished());
        assertThrows(IllegalStateException.class, replies::next);
        peer.get(5, TimeUnit.SECONDS);
        pair.server().close();
        blocked.handle((reply, error) -> null).get(5, TimeUnit.SECONDS);
    }

    @Test
    void silentStreamShouldTimeOutAndReleaseConnection() {
        InMemoryTransport.Pair pair = InMemoryTransport.pair();
        EnvelopeClient client = new EnvelopeClient("silent", pair.client(), Duration.ofMillis(100));

        EnvelopeClient.Replies replies = client.stream(Envelope.request(Envelope.METHOD_STREAM, "silent", null));

        assertThrows(ConnectionTimeoutException.class, replies::next);
        assertTrue(replies.isFinished());
        // the pair cannot reconnect, but the failure must come from dialing, not from waiting for the connection
        ConnectionException again = assertThrows(ConnectionException.class,
                () -> client.stream(Envelope.request(Envelope.METHOD_STREAM, "silent", null)));
        assertFalse(again instanceof ConnectionTimeoutException);
    }

    @Test
    void oversizedRequestShouldBeRejectedBeforeSending() {
        InMemoryTransport.Pair pair = InMemoryTransport.pair();
        EnvelopeClient client = new EnvelopeClient("peer", pair.client(), Duration.ofSeconds(1), 32);

        assertThrows(MalformedPayloadException.class,
                () -> client.call(Envelope.request("process", "peer", Map.of("big", "x".repeat(100)))));
        assertTrue(client.isConnected());
    }

    @Test
    void constructorShouldValidateArguments() {
        InMemoryTransport.Pair pair = InMemoryTransport.pair();
        assertThrows(IllegalArgumentException.class, () -> new EnvelopeClient("p", null, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new EnvelopeClient("p", pair.client(), Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new EnvelopeClient("p", pair.client(), Duration.ofSeconds(1), 0));
    }
}
