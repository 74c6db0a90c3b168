package io.limitgraph.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.limitgraph.error.StorageException;
import io.limitgraph.model.GovernanceCheckpoint;
import io.limitgraph.model.Provenance;
import io.limitgraph.model.RDSeries;
import io.limitgraph.model.SessionId;
import io.limitgraph.model.Trace;
import io.limitgraph.model.TraceId;
import io.limitgraph.util.Jsons;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * JSON files under one directory per session: {@code trace-<id>.json},
 * {@code rd-series[-<trace>].json}, {@code prov-<trace>.jsonl} and {@code chk-<trace>.jsonl}.
 */
public final class FileStorage implements Storage {
    private final Path root;

    public FileStorage(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    @Override
    public synchronized void persistTrace(Trace trace) {
        Path file = sessionDir(trace.sessionId()).resolve("trace-" + trace.id() + ".json");
        try {
            if (Files.exists(file)) {
                return;
            }
            writeAtomically(file, Jsons.toCompactBytes(trace));
        } catch (IOException e) {
            throw new StorageException("persist_trace", e);
        }
    }

    @Override
    public synchronized void persistRdSeries(SessionId sessionId, RDSeries series) {
        try {
            writeAtomically(seriesFile(sessionId, series.traceId()), Jsons.toCompactBytes(series));
        } catch (IOException e) {
            throw new StorageException("persist_rd_series", e);
        }
    }

    @Override
    public synchronized void persistProvenance(Provenance record) {
        Path file = sessionDir(record.sessionId()).resolve("prov-" + record.traceId() + ".jsonl");
        try {
            if (containsId(file, record.id())) {
                return;
            }
            appendLine(file, Jsons.toCompactJson(record));
        } catch (IOException e) {
            throw new StorageException("persist_provenance", e);
        }
    }

    @Override
    public synchronized void persistCheckpoint(GovernanceCheckpoint checkpoint) {
        Path file = sessionDir(checkpoint.sessionId()).resolve("chk-" + checkpoint.traceId() + ".jsonl");
        try {
            if (containsId(file, checkpoint.id())) {
                return;
            }
            appendLine(file, Jsons.toCompactJson(checkpoint));
        } catch (IOException e) {
            throw new StorageException("persist_checkpoint", e);
        }
    }

    @Override
    public synchronized Optional<Trace> loadTrace(SessionId sessionId, TraceId traceId) {
        Path file = root.resolve(sessionId.toString()).resolve("trace-" + traceId + ".json");
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Jsons.compactMapper().readValue(file.toFile(), Trace.class));
        } catch (IOException e) {
            throw new StorageException("load_trace", e);
        }
    }

    @Override
    public synchronized Optional<RDSeries> loadRdSeries(SessionId sessionId, TraceId traceId) {
        Path file = seriesFile(sessionId, traceId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Jsons.compactMapper().readValue(file.toFile(), RDSeries.class));
        } catch (IOException e) {
            throw new StorageException("load_rd_series", e);
        }
    }

    @Override
    public synchronized List<Provenance> listProvenance(SessionId sessionId, TraceId traceId) {
        Path file = root.resolve(sessionId.toString()).resolve("prov-" + traceId + ".jsonl");
        try {
            return readLines(file, Provenance.class);
        } catch (IOException e) {
            throw new StorageException("list_provenance", e);
        }
    }

    @Override
    public synchronized List<GovernanceCheckpoint> listCheckpoints(SessionId sessionId) {
        Path dir = root.resolve(sessionId.toString());
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<GovernanceCheckpoint> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.filter(p -> p.getFileName().toString().startsWith("chk-")).sorted().toList()) {
                out.addAll(readLines(file, GovernanceCheckpoint.class));
            }
        } catch (IOException e) {
            throw new StorageException("list_checkpoints", e);
        }
        out.sort(Comparator.comparing(GovernanceCheckpoint::timestamp));
        return out;
    }

    private Path sessionDir(SessionId sessionId) {
        Path dir = root.resolve(sessionId.toString());
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("create_session_dir", e);
        }
        return dir;
    }

    private Path seriesFile(SessionId sessionId, TraceId traceId) {
        String name = traceId == null ? "rd-series.json" : "rd-series-" + traceId + ".json";
        Path dir = root.resolve(sessionId.toString());
        if (!Files.isDirectory(dir)) {
            dir = sessionDir(sessionId);
        }
        return dir.resolve(name);
    }

    private static boolean containsId(Path file, String id) throws IOException {
        if (!Files.exists(file)) {
            return false;
        }
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            JsonNode node = Jsons.readTree(line);
            if (id.equals(node.path("id").asText(""))) {
                return true;
            }
        }
        return false;
    }

    private static <T> List<T> readLines(Path file, Class<T> type) throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<T> out = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                out.add(Jsons.compactMapper().readValue(line, type));
            }
        }
        return out;
    }

    private static void appendLine(Path file, String line) throws IOException {
        byte[] bytes = (line + "\n").getBytes(StandardCharsets.UTF_8);
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void writeAtomically(Path file, byte[] bytes) throws IOException {
        Path tmp = file.resolveSibling(file.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try (FileChannel channel = FileChannel.open(tmp,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
