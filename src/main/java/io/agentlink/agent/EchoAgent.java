package io.agentlink.agent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Replies with {@code "Echo: " + content} and hands the caller's metadata back untouched.
 * Streaming yields the same reply one whitespace-separated token at a time, each tagged
 * with {@code chunk_index}.
 */
public final class EchoAgent implements Agent {
    public static final String NAME = "echo";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Message process(Message message) {
        return new Message(
                Message.ROLE_AGENT,
                "Echo: " + message.contentAsText(),
                message.metadata(),
                Instant.now()
        );
    }

    @Override
    public Iterator<Message> stream(Message message) {
        String[] tokens = process(message).contentAsText().split("\\s+");
        List<Message> chunks = new ArrayList<>(tokens.length);
        for (int i = 0; i < tokens.length; i++) {
            chunks.add(new Message(Message.ROLE_AGENT, tokens[i], message.metadata(), Instant.now())
                    .withMetadata("chunk_index", i));
        }
        return chunks.iterator();
    }

    @Override
    public List<String> capabilities() {
        return List.of("echo", "stream");
    }
}
