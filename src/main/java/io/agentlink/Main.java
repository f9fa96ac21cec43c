package io.agentlink;

import io.agentlink.cli.AgentLinkCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new AgentLinkCommand()).execute(args);
        System.exit(code);
    }
}
