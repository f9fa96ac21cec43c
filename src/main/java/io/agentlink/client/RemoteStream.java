package io.agentlink.client;

import io.agentlink.agent.Message;
import io.agentlink.error.InvalidMessageException;
import io.agentlink.error.MalformedPayloadException;
import io.agentlink.protocol.Envelope;
import io.agentlink.protocol.EnvelopeType;
import io.agentlink.protocol.ProtocolCodec;
import io.agentlink.rpc.EnvelopeClient;
import io.agentlink.rpc.RemoteErrors;

import java.io.Closeable;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Messages streamed back by a remote agent, read lazily one frame per element.
 *
 * <p>{@link #hasNext()} blocks for the next chunk, bounded by the client timeout. An error
 * reply is thrown from {@code hasNext()} as its typed exception. The owning
 * {@link RemoteAgent} cannot send other requests until the stream ends or is closed.
 */
public final class RemoteStream implements Iterator<Message>, Closeable {
    private final String agentName;
    private final EnvelopeClient.Replies replies;

    private Message pending;
    private boolean done;

    RemoteStream(String agentName, EnvelopeClient.Replies replies) {
        this.agentName = agentName;
        this.replies = replies;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (done) {
            return false;
        }
        Envelope reply;
        try {
            reply = replies.next();
        } catch (RuntimeException e) {
            done = true;
            throw e;
        }
        switch (reply.type()) {
            case STREAM_CHUNK:
                pending = chunk(reply);
                return true;
            case STREAM_END:
                done = true;
                return false;
            case ERROR:
                done = true;
                throw RemoteErrors.fromEnvelope(reply, agentName);
            default:
                close();
                throw new InvalidMessageException(
                        "Expected 'stream_chunk' or 'stream_end' but got '" + reply.type().wireName() + "'",
                        Map.of("type", reply.type().wireName())
                );
        }
    }

    @Override
    public Message next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Stream " + replies.requestId() + " has ended");
        }
        Message out = pending;
        pending = null;
        return out;
    }

    /**
     * Stops reading. Closing before the end drops the connection.
     */
    @Override
    public void close() {
        done = true;
        pending = null;
        replies.close();
    }

    private Message chunk(Envelope reply) {
        Object rawMessage = reply.payload().get(Envelope.KEY_MESSAGE);
        try {
            if (rawMessage == null) {
                throw new MalformedPayloadException("Stream chunk is missing 'message'", Map.of("id", reply.id()));
            }
            return ProtocolCodec.messageFromMap(rawMessage);
        } catch (MalformedPayloadException e) {
            close();
            throw e;
        }
    }
}
