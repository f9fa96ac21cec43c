package io.agentlink.agent;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MessageTest {
    @Test
    void blankRoleShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> Message.of(" ", "x"));
        assertThrows(IllegalArgumentException.class, () -> Message.of(null, "x"));
    }

    @Test
    void metadataShouldBeCopiedAndImmutable() {
        Map<String, Object> source = new HashMap<>();
        source.put("k", "v");
        Message message = Message.of("user", "x", source);
        source.put("k", "changed");

        assertEquals("v", message.metadata().get("k"));
        assertThrows(UnsupportedOperationException.class, () -> message.metadata().put("n", 1));
        assertNotNull(message.timestamp());
    }

    @Test
    void withMetadataShouldKeepTimestamp() {
        Message original = Message.of("user", "x");
        Message tagged = original.withMetadata("trace", "t1");

        assertEquals(original.timestamp(), tagged.timestamp());
        assertEquals("t1", tagged.metadata().get("trace"));
    }

    @Test
    void echoAgentShouldPrefixContentAndKeepMetadata() {
        Message reply = new EchoAgent().process(Message.of("user", 42, Map.of("a", 1)));

        assertEquals(Message.ROLE_AGENT, reply.role());
        assertEquals("Echo: 42", reply.content());
        assertEquals(Map.of("a", 1), reply.metadata());
    }
}
