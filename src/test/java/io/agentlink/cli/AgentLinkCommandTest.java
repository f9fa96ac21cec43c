package io.agentlink.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentlink.agent.EchoAgent;
import io.agentlink.registry.AgentRegistration;
import io.agentlink.registry.AgentRegistry;
import io.agentlink.registry.RegistryServer;
import io.agentlink.server.LocalAgent;
import io.agentlink.transport.Endpoints;
import io.agentlink.transport.TcpListener;
import io.agentlink.util.Jsons;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentLinkCommandTest {
    @Test
    void callShouldPrintReplyAsJson() throws Exception {
        LocalAgent local = new LocalAgent(new EchoAgent(), new TcpListener("127.0.0.1", 0));
        local.start();
        try {
            Result result = run("call", "--endpoint", local.endpoint(), "hello");

            assertEquals(0, result.exitCode());
            JsonNode reply = Jsons.mapper().readTree(result.out());
            assertEquals("agent", reply.path("role").asText());
            assertEquals("Echo: hello", reply.path("content").asText());
        } finally {
            local.stop();
        }
    }

    @Test
    void callWithoutListenerShouldPrintErrorAndExitNonZero() throws Exception {
        Path root = Files.createTempDirectory("agentlink-cli-missing-");
        try {
            Result result = run("call", "--endpoint", Endpoints.unix(root.resolve("none.sock")), "hello");

            assertEquals(AgentLinkCommand.EXIT_REMOTE_ERROR, result.exitCode());
            JsonNode error = Jsons.mapper().readTree(result.err());
            assertEquals("CONNECTION_FAILED", error.path("error_code").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void streamShouldPrintOneJsonLinePerChunk() throws Exception {
        LocalAgent local = new LocalAgent(new EchoAgent(), new TcpListener("127.0.0.1", 0));
        local.start();
        try {
            Result result = run("stream", "--endpoint", local.endpoint(), "hi there");

            assertEquals(0, result.exitCode());
            String[] lines = result.out().strip().split("\\R");
            assertEquals(3, lines.length);
            assertEquals("Echo:", Jsons.mapper().readTree(lines[0]).path("content").asText());
            assertEquals("there", Jsons.mapper().readTree(lines[2]).path("content").asText());
        } finally {
            local.stop();
        }
    }

    @Test
    void pingShouldReportStatus() throws Exception {
        LocalAgent local = new LocalAgent(new EchoAgent(), new TcpListener("127.0.0.1", 0));
        local.start();
        try {
            Result result = run("ping", "--endpoint", local.endpoint());

            assertEquals(0, result.exitCode());
            JsonNode out = Jsons.mapper().readTree(result.out());
            assertEquals("ok", out.path("status").asText());
            assertTrue(out.path("rtt_ms").asDouble() >= 0.0d);
        } finally {
            local.stop();
        }
    }

    @Test
    void serveShouldExportAgentUntilDurationElapses() throws Exception {
        Path root = Files.createTempDirectory("agentlink-cli-serve-");
        Path socket = root.resolve("echo.sock");
        try {
            CompletableFuture<Result> serving = CompletableFuture.supplyAsync(
                    () -> run("serve", "--endpoint", Endpoints.unix(socket), "--duration-ms", "3000"));
            long deadline = System.currentTimeMillis() + 5_000L;
            while (!Files.exists(socket) && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }

            Result call = run("call", "--endpoint", Endpoints.unix(socket), "via cli");
            Result served = serving.get(10, TimeUnit.SECONDS);

            assertEquals(0, call.exitCode());
            assertEquals("Echo: via cli", Jsons.mapper().readTree(call.out()).path("content").asText());
            assertEquals(0, served.exitCode());
            assertEquals("listening", Jsons.mapper().readTree(served.out()).path("status").asText());
            assertTrue(Files.notExists(socket));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void registryListShouldPrintRegistrations() throws Exception {
        AgentRegistry registry = new AgentRegistry();
        registry.register(AgentRegistration.of("echo", "tcp://127.0.0.1:7000"));
        RegistryServer server = new RegistryServer(registry, new TcpListener("127.0.0.1", 0));
        server.start();
        try {
            Result result = run("registry-list", "--endpoint", server.endpoint());

            assertEquals(0, result.exitCode());
            JsonNode list = Jsons.mapper().readTree(result.out());
            assertEquals(1, list.size());
            assertEquals("echo", list.get(0).path("name").asText());
            assertEquals("tcp://127.0.0.1:7000", list.get(0).path("endpoint").asText());
        } finally {
            server.stop();
        }
    }

    private static Result run(String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine cmd = new CommandLine(new AgentLinkCommand());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        int code = cmd.execute(args);
        return new Result(code, out.toString(), err.toString());
    }

    private record Result(int exitCode, String out, String err) {
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException ignored) {
                    // best effort cleanup in tests
                }
            });
        }
    }
}
