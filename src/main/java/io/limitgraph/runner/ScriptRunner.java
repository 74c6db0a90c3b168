package io.limitgraph.runner;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.limitgraph.error.RunnerException;
import io.limitgraph.model.Session;
import io.limitgraph.model.TraceId;
import io.limitgraph.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command once per call. Each session gets its own working directory under
 * the sandbox root; input is fed on stdin and stdout/stderr are captured to files there.
 * The capture files are removed once the call returns or fails.
 */
public final class ScriptRunner implements BackendRunner {
    private static final Logger log = LoggerFactory.getLogger(ScriptRunner.class);
    private static final int MAX_ERROR_CHARS = 512;

    private final String id;
    private final RunnerKind kind;
    private final List<String> command;
    private final long timeoutMs;
    private final Path sandboxRoot;

    public ScriptRunner(String id, List<String> command, long timeoutMs, Path sandboxRoot) {
        this(id, RunnerKind.SCRIPT, command, timeoutMs, sandboxRoot);
    }

    private ScriptRunner(String id, RunnerKind kind, List<String> command, long timeoutMs, Path sandboxRoot) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("script runner id cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script runner command cannot be empty: " + id);
        }
        if (sandboxRoot == null) {
            throw new IllegalArgumentException("script runner sandbox root cannot be null: " + id);
        }
        this.id = id;
        this.kind = kind;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
        this.sandboxRoot = sandboxRoot;
    }

    /**
     * Interpreter runner: the input is the program, read from stdin.
     */
    public static ScriptRunner python(String interpreter, long timeoutMs, Path sandboxRoot) {
        String exe = interpreter == null || interpreter.isBlank() ? "python3" : interpreter;
        return new ScriptRunner("python", RunnerKind.PYTHON, List.of(exe, "-"), timeoutMs, sandboxRoot);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public RunnerKind kind() {
        return kind;
    }

    @Override
    public boolean healthCheck() {
        Path exe = Path.of(command.get(0));
        return !exe.isAbsolute() || Files.isExecutable(exe);
    }

    @Override
    public RunnerOutput executeIsolated(String input, Session session, TraceId traceId) {
        Path workDir = sandboxRoot.resolve(session.id().toString());
        Path stdoutFile = workDir.resolve(traceId + ".stdout");
        Path stderrFile = workDir.resolve(traceId + ".stderr");
        try {
            Files.createDirectories(workDir);
        } catch (IOException e) {
            throw new RunnerException(kind, session.id(), traceId, e);
        }

        try {
            return run(input, session, traceId, workDir, stdoutFile, stderrFile);
        } finally {
            discard(stdoutFile);
            discard(stderrFile);
        }
    }

    private RunnerOutput run(
            String input,
            Session session,
            TraceId traceId,
            Path workDir,
            Path stdoutFile,
            Path stderrFile
    ) {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.directory(workDir.toFile());
        pb.redirectOutput(stdoutFile.toFile());
        pb.redirectError(stderrFile.toFile());
        Map<String, String> env = pb.environment();
        env.put("LIMITGRAPH_SESSION_ID", session.id().toString());
        env.put("LIMITGRAPH_TRACE_ID", traceId.toString());
        env.put("LIMITGRAPH_ALLOW_NETWORK", Boolean.toString(session.config().allowNetwork()));
        env.put("HOME", workDir.toString());
        env.put("TMPDIR", workDir.toString());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new RunnerException(kind, session.id(), traceId, "spawn failed: " + e.getMessage());
        }

        long started = System.nanoTime();
        try {
            byte[] bytes = input == null ? new byte[0] : input.getBytes(StandardCharsets.UTF_8);
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(bytes);
                stdin.flush();
            }

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                throw new RunnerException(kind, session.id(), traceId, "timeout after " + Duration.ofMillis(timeoutMs));
            }

            String stdout = Files.readString(stdoutFile, StandardCharsets.UTF_8).strip();
            String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8).strip();
            ObjectNode metrics = Jsons.mapper().createObjectNode();
            metrics.put("session_id", session.id().toString());
            metrics.put("trace_id", traceId.toString());
            metrics.put("runner", id);
            metrics.put("exit_code", process.exitValue());
            metrics.put("runtime_ms", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            metrics.put("isolated", true);
            return new RunnerOutput(process.exitValue() == 0, stdout, truncate(stderr), metrics);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new RunnerException(kind, session.id(), traceId, e);
        } catch (IOException e) {
            process.destroyForcibly();
            throw new RunnerException(kind, session.id(), traceId, e);
        }
    }

    private static void discard(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("could not remove runner capture file={} error={}", file, e.toString());
        }
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        if (raw.length() <= MAX_ERROR_CHARS) {
            return raw;
        }
        return raw.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
