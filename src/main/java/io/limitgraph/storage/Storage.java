package io.limitgraph.storage;

import io.limitgraph.model.GovernanceCheckpoint;
import io.limitgraph.model.Provenance;
import io.limitgraph.model.RDSeries;
import io.limitgraph.model.SessionId;
import io.limitgraph.model.Trace;
import io.limitgraph.model.TraceId;

import java.util.List;
import java.util.Optional;

/**
 * Persistence collaborator of the governance core.
 *
 * <p>Every {@code persist*} call is durable when it returns and idempotent when retried with
 * the same identifiers. Failures surface as {@link io.limitgraph.error.StorageException}; no
 * implementation retries on its own.
 */
public interface Storage {
    void persistTrace(Trace trace);

    /**
     * Stores the latest snapshot of a series. A series without a trace reference is the
     * session-level series.
     */
    void persistRdSeries(SessionId sessionId, RDSeries series);

    void persistProvenance(Provenance record);

    void persistCheckpoint(GovernanceCheckpoint checkpoint);

    Optional<Trace> loadTrace(SessionId sessionId, TraceId traceId);

    Optional<RDSeries> loadRdSeries(SessionId sessionId, TraceId traceId);

    /**
     * Provenance of one trace in append order.
     */
    List<Provenance> listProvenance(SessionId sessionId, TraceId traceId);

    List<GovernanceCheckpoint> listCheckpoints(SessionId sessionId);
}
