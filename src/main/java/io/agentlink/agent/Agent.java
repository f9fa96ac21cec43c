package io.agentlink.agent;

import java.util.Iterator;
import java.util.List;

/**
 * A named unit that turns one message into another. Local implementations,
 * {@code LocalAgent}-exported agents and {@code RemoteAgent} proxies are interchangeable.
 */
public interface Agent {
    String name();

    Message process(Message message) throws Exception;

    /**
     * Replies incrementally, one message per element. Agents that cannot stream keep this
     * default, which throws {@link UnsupportedOperationException}.
     */
    default Iterator<Message> stream(Message message) throws Exception {
        throw new UnsupportedOperationException(name() + " does not support streaming");
    }

    default List<String> capabilities() {
        return List.of();
    }
}
