package io.agentlink.agent;

public final class FailAgent implements Agent {
    public static final String NAME = "fail";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Message process(Message message) {
        throw new IllegalStateException("intentional failure from fail agent");
    }
}
