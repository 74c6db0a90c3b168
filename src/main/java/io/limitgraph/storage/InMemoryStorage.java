package io.limitgraph.storage;

import io.limitgraph.model.GovernanceCheckpoint;
import io.limitgraph.model.Provenance;
import io.limitgraph.model.RDSeries;
import io.limitgraph.model.SessionId;
import io.limitgraph.model.Trace;
import io.limitgraph.model.TraceId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryStorage implements Storage {
    private final Map<TraceKey, Trace> traces = new ConcurrentHashMap<>();
    private final Map<TraceKey, RDSeries> series = new ConcurrentHashMap<>();
    private final Map<TraceKey, Map<String, Provenance>> provenance = new ConcurrentHashMap<>();
    private final Map<SessionId, Map<String, GovernanceCheckpoint>> checkpoints = new ConcurrentHashMap<>();

    @Override
    public void persistTrace(Trace trace) {
        traces.putIfAbsent(new TraceKey(trace.sessionId(), trace.id()), trace);
    }

    @Override
    public void persistRdSeries(SessionId sessionId, RDSeries rdSeries) {
        series.put(new TraceKey(sessionId, rdSeries.traceId()), rdSeries);
    }

    @Override
    public void persistProvenance(Provenance record) {
        Map<String, Provenance> rows = provenance.computeIfAbsent(
                new TraceKey(record.sessionId(), record.traceId()), k -> new LinkedHashMap<>());
        synchronized (rows) {
            rows.putIfAbsent(record.id(), record);
        }
    }

    @Override
    public void persistCheckpoint(GovernanceCheckpoint checkpoint) {
        Map<String, GovernanceCheckpoint> rows = checkpoints.computeIfAbsent(checkpoint.sessionId(), k -> new LinkedHashMap<>());
        synchronized (rows) {
            rows.putIfAbsent(checkpoint.id(), checkpoint);
        }
    }

    @Override
    public Optional<Trace> loadTrace(SessionId sessionId, TraceId traceId) {
        return Optional.ofNullable(traces.get(new TraceKey(sessionId, traceId)));
    }

    @Override
    public Optional<RDSeries> loadRdSeries(SessionId sessionId, TraceId traceId) {
        return Optional.ofNullable(series.get(new TraceKey(sessionId, traceId)));
    }

    @Override
    public List<Provenance> listProvenance(SessionId sessionId, TraceId traceId) {
        Map<String, Provenance> rows = provenance.get(new TraceKey(sessionId, traceId));
        if (rows == null) {
            return List.of();
        }
        synchronized (rows) {
            return List.copyOf(rows.values());
        }
    }

    @Override
    public List<GovernanceCheckpoint> listCheckpoints(SessionId sessionId) {
        Map<String, GovernanceCheckpoint> rows = checkpoints.get(sessionId);
        if (rows == null) {
            return List.of();
        }
        synchronized (rows) {
            return new ArrayList<>(rows.values());
        }
    }

    private record TraceKey(SessionId sessionId, TraceId traceId) {
    }
}
