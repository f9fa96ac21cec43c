package io.agentlink.cli;

import io.agentlink.agent.Agent;
import io.agentlink.agent.EchoAgent;
import io.agentlink.agent.FailAgent;
import io.agentlink.agent.Message;
import io.agentlink.agent.ScriptAgent;
import io.agentlink.client.RemoteAgent;
import io.agentlink.client.RemoteStream;
import io.agentlink.config.AgentLinkConfig;
import io.agentlink.error.AgentLinkException;
import io.agentlink.protocol.ProtocolCodec;
import io.agentlink.registry.AgentRegistration;
import io.agentlink.registry.AgentRegistry;
import io.agentlink.registry.RegistryServer;
import io.agentlink.registry.RemoteRegistry;
import io.agentlink.server.LocalAgent;
import io.agentlink.server.LocalAgentOptions;
import io.agentlink.transport.Endpoints;
import io.agentlink.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "agentlink",
        mixinStandardHelpOptions = true,
        description = "Expose and call agents over Unix-socket and TCP endpoints",
        subcommands = {
                AgentLinkCommand.ServeCommand.class,
                AgentLinkCommand.CallCommand.class,
                AgentLinkCommand.StreamCommand.class,
                AgentLinkCommand.PingCommand.class,
                AgentLinkCommand.RegistryServeCommand.class,
                AgentLinkCommand.RegistryListCommand.class
        }
)
public final class AgentLinkCommand implements Runnable {
    static final int EXIT_REMOTE_ERROR = 1;

    @Spec
    CommandSpec spec;

    @Option(names = {"--config"}, description = "Path to an agentlink-settings.json file")
    Path configFile;

    @Override
    public void run() {
        spec.commandLine().getOut().println("Use subcommands: serve | call | stream | ping | registry-serve | registry-list");
    }

    AgentLinkConfig config() {
        return configFile == null ? AgentLinkConfig.defaults() : AgentLinkConfig.load(configFile);
    }

    static void printJson(CommandSpec spec, Object value) {
        PrintWriter out = spec.commandLine().getOut();
        out.println(Jsons.toJson(value));
        out.flush();
    }

    static int printError(CommandSpec spec, AgentLinkException e) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error_code", e.code().wireName());
        out.put("error_message", e.getMessage());
        out.put("error_details", e.details());
        PrintWriter err = spec.commandLine().getErr();
        err.println(Jsons.toJson(out));
        err.flush();
        return EXIT_REMOTE_ERROR;
    }

    /**
     * Blocks until the JVM shuts down, or for {@code durationMs} when positive.
     */
    static void awaitShutdown(long durationMs, Runnable onShutdown) throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            onShutdown.run();
            done.countDown();
        }, "agentlink-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);
        if (durationMs > 0) {
            if (!done.await(durationMs, TimeUnit.MILLISECONDS)) {
                Runtime.getRuntime().removeShutdownHook(hook);
                onShutdown.run();
            }
            return;
        }
        done.await();
    }

    @Command(name = "serve", description = "Export a bundled agent on an endpoint")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        AgentLinkCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = {"--endpoint"}, required = true, description = "unix:///path.sock or tcp://host:port")
        String endpoint;

        @Option(names = {"--agent"}, defaultValue = "echo", description = "echo | fail | script")
        String agent;

        @Option(names = {"--name"}, description = "Agent name for script agents (defaults to 'script')")
        String name;

        @Option(names = {"--script"}, split = ",", description = "Command line for the script agent, comma separated")
        List<String> script;

        @Option(names = {"--script-timeout-ms"}, defaultValue = "10000", description = "Script execution timeout")
        long scriptTimeoutMs;

        @Option(names = {"--registry"}, description = "Registry endpoint to register with")
        String registry;

        @Option(names = {"--capability"}, description = "Capability to publish (repeatable)")
        List<String> capabilities;

        @Option(names = {"--duration-ms"}, defaultValue = "0", description = "Stop after this long; 0 runs until interrupted")
        long durationMs;

        @Override
        public Integer call() throws Exception {
            AgentLinkConfig config = parent.config();
            LocalAgentOptions options = config.localAgentOptions()
                    .withCapabilities(capabilities == null ? List.of() : capabilities);
            RemoteRegistry remoteRegistry = null;
            if (registry != null && !registry.isBlank()) {
                remoteRegistry = new RemoteRegistry(registry, config.requestTimeout());
                options = options.withRegistry(remoteRegistry);
            }
            LocalAgent local = new LocalAgent(createAgent(), Endpoints.newListener(endpoint), options);
            try {
                local.start();
            } catch (AgentLinkException e) {
                closeQuietly(remoteRegistry);
                return printError(spec, e);
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("agent", local.name());
            out.put("endpoint", local.endpoint());
            out.put("capabilities", local.capabilities());
            out.put("registry", registry);
            out.put("status", "listening");
            printJson(spec, out);
            RemoteRegistry registryToClose = remoteRegistry;
            awaitShutdown(durationMs, () -> {
                local.stop();
                closeQuietly(registryToClose);
            });
            return 0;
        }

        private Agent createAgent() {
            switch (agent.toLowerCase(Locale.ROOT)) {
                case EchoAgent.NAME:
                    return new EchoAgent();
                case FailAgent.NAME:
                    return new FailAgent();
                case "script":
                    if (script == null || script.isEmpty()) {
                        throw new IllegalArgumentException("--script is required for script agents");
                    }
                    return new ScriptAgent(name == null ? "script" : name, new ArrayList<>(script), scriptTimeoutMs);
                default:
                    throw new IllegalArgumentException("Unknown agent: " + agent + " (expected echo, fail or script)");
            }
        }

        private static void closeQuietly(RemoteRegistry registry) {
            if (registry != null) {
                registry.close();
            }
        }
    }

    @Command(name = "call", description = "Send one message to a remote agent and print the reply")
    static final class CallCommand implements Callable<Integer> {
        @ParentCommand
        AgentLinkCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = {"--endpoint"}, required = true, description = "Agent endpoint")
        String endpoint;

        @Option(names = {"--agent"}, defaultValue = "echo", description = "Remote agent name")
        String agent;

        @Option(names = {"--role"}, defaultValue = Message.ROLE_USER, description = "Message role")
        String role;

        @Option(names = {"--timeout-ms"}, defaultValue = "0", description = "Request timeout; 0 uses the configured default")
        long timeoutMs;

        @Parameters(index = "0", description = "Message content")
        String content;

        @Override
        public Integer call() {
            Duration timeout = timeoutMs > 0 ? Duration.ofMillis(timeoutMs) : parent.config().requestTimeout();
            try (RemoteAgent remote = new RemoteAgent(agent, endpoint, timeout)) {
                Message reply = remote.process(Message.of(role, content));
                printJson(spec, ProtocolCodec.messageToMap(reply));
                return 0;
            } catch (AgentLinkException e) {
                return printError(spec, e);
            }
        }
    }

    @Command(name = "stream", description = "Stream a remote agent's reply, one JSON line per chunk")
    static final class StreamCommand implements Callable<Integer> {
        @ParentCommand
        AgentLinkCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = {"--endpoint"}, required = true, description = "Agent endpoint")
        String endpoint;

        @Option(names = {"--agent"}, defaultValue = "echo", description = "Remote agent name")
        String agent;

        @Option(names = {"--role"}, defaultValue = Message.ROLE_USER, description = "Message role")
        String role;

        @Option(names = {"--timeout-ms"}, defaultValue = "0", description = "Per-chunk timeout; 0 uses the configured default")
        long timeoutMs;

        @Parameters(index = "0", description = "Message content")
        String content;

        @Override
        public Integer call() {
            Duration timeout = timeoutMs > 0 ? Duration.ofMillis(timeoutMs) : parent.config().requestTimeout();
            PrintWriter out = spec.commandLine().getOut();
            try (RemoteAgent remote = new RemoteAgent(agent, endpoint, timeout);
                 RemoteStream chunks = remote.stream(Message.of(role, content))) {
                while (chunks.hasNext()) {
                    out.println(Jsons.toJsonLine(ProtocolCodec.messageToMap(chunks.next())));
                    out.flush();
                }
                return 0;
            } catch (AgentLinkException e) {
                return printError(spec, e);
            }
        }
    }

    @Command(name = "ping", description = "Measure round trip to a remote agent")
    static final class PingCommand implements Callable<Integer> {
        @ParentCommand
        AgentLinkCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = {"--endpoint"}, required = true, description = "Agent endpoint")
        String endpoint;

        @Option(names = {"--agent"}, defaultValue = "echo", description = "Remote agent name")
        String agent;

        @Override
        public Integer call() {
            try (RemoteAgent remote = new RemoteAgent(agent, endpoint, parent.config().requestTimeout())) {
                Duration rtt = remote.ping();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("agent", agent);
                out.put("endpoint", remote.endpoint());
                out.put("status", "ok");
                out.put("rtt_ms", rtt.toNanos() / 1_000_000.0d);
                printJson(spec, out);
                return 0;
            } catch (AgentLinkException e) {
                return printError(spec, e);
            }
        }
    }

    @Command(name = "registry-serve", description = "Run an agent registry on an endpoint")
    static final class RegistryServeCommand implements Callable<Integer> {
        @ParentCommand
        AgentLinkCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = {"--endpoint"}, required = true, description = "Registry endpoint")
        String endpoint;

        @Option(names = {"--duration-ms"}, defaultValue = "0", description = "Stop after this long; 0 runs until interrupted")
        long durationMs;

        @Override
        public Integer call() throws Exception {
            AgentLinkConfig config = parent.config();
            AgentRegistry registry = new AgentRegistry(config.registryOptions());
            RegistryServer server = new RegistryServer(registry, Endpoints.newListener(endpoint), config.maxFrameBytes());
            try {
                server.start();
            } catch (AgentLinkException e) {
                return printError(spec, e);
            }
            registry.start();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("endpoint", server.endpoint());
            out.put("status", "listening");
            out.put("settings", config.toView());
            printJson(spec, out);
            awaitShutdown(durationMs, () -> {
                server.stop();
                registry.stop();
            });
            return 0;
        }
    }

    @Command(name = "registry-list", description = "List agents known to a registry")
    static final class RegistryListCommand implements Callable<Integer> {
        @ParentCommand
        AgentLinkCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = {"--endpoint"}, required = true, description = "Registry endpoint")
        String endpoint;

        @Override
        public Integer call() {
            try (RemoteRegistry registry = new RemoteRegistry(endpoint, parent.config().requestTimeout())) {
                List<Map<String, Object>> out = new ArrayList<>();
                for (AgentRegistration registration : registry.list()) {
                    out.add(registration.toMap());
                }
                printJson(spec, out);
                return 0;
            } catch (AgentLinkException e) {
                return printError(spec, e);
            }
        }
    }
}
