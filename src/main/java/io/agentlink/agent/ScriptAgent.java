package io.agentlink.agent;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command per message: the message content goes to stdin, trimmed
 * stdout becomes the reply content. Spawn failure, non-zero exit and timeout are
 * raised as exceptions so an exporting {@code LocalAgent} reports them as agent errors.
 */
public final class ScriptAgent implements Agent {
    private static final int MAX_ERROR_CHARS = 512;
    private static final long WAIT_AFTER_EXIT_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final String name;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptAgent(String name, List<String> command, long timeoutMs) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("script agent name cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script agent command cannot be empty: " + name);
        }
        this.name = name;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String name() {
        return name;
    }

    public List<String> command() {
        return command;
    }

    @Override
    public Message process(Message message) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new IOException("script spawn failed: " + e.getMessage(), e);
        }

        // Read stdout concurrently so a chatty script cannot fill the pipe and stall.
        FutureTask<byte[]> output = new FutureTask<>(() -> process.getInputStream().readAllBytes());
        Thread reader = new Thread(output, "agentlink-script-" + name + "-stdout");
        reader.setDaemon(true);
        reader.start();
        try {
            byte[] input = message.contentAsText().getBytes(StandardCharsets.UTF_8);
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(input);
            }

            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                throw new IllegalStateException("script timeout after " + Duration.ofMillis(timeoutMs));
            }

            String combined = new String(awaitOutput(output, deadline), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new IllegalStateException("script exit=" + process.exitValue() + " output=" + truncate(combined));
            }
            return new Message(
                    Message.ROLE_AGENT,
                    combined.strip(),
                    Map.of("script_exit", 0),
                    Instant.now()
            );
        } catch (IOException | InterruptedException | RuntimeException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    private byte[] awaitOutput(FutureTask<byte[]> output, long deadline) throws IOException, InterruptedException {
        try {
            // stdout can outlive the process when it forked children that kept the pipe open
            return output.get(Math.max(0L, deadline - System.nanoTime()) + WAIT_AFTER_EXIT_NANOS, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new IllegalStateException("script output not closed after exit", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IllegalStateException("script output read failed: " + cause, cause);
        }
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
