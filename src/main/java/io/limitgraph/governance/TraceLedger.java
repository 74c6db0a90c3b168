package io.limitgraph.governance;

import io.limitgraph.model.RDSeries;
import io.limitgraph.model.ReviewRecord;
import io.limitgraph.model.SessionId;
import io.limitgraph.model.Trace;
import io.limitgraph.model.TraceFlagInfo;
import io.limitgraph.model.TraceId;
import io.limitgraph.model.TraceState;

import java.util.ArrayList;
import java.util.List;

/**
 * Governance state of one trace. All access is guarded by the ledger's own monitor.
 */
final class TraceLedger {
    private final Trace trace;
    private final List<TraceFlagInfo> flags = new ArrayList<>();
    private TraceState state = TraceState.UNFLAGGED;
    private String quarantineReason;
    private boolean reviewRequired;
    private String provenanceHead = "";
    private boolean attested;
    private ReviewRecord review;
    private RDSeries series;

    TraceLedger(Trace trace) {
        this.trace = trace;
    }

    Trace trace() {
        return trace;
    }

    TraceId traceId() {
        return trace.id();
    }

    SessionId sessionId() {
        return trace.sessionId();
    }

    List<TraceFlagInfo> flags() {
        return List.copyOf(flags);
    }

    int flagCount() {
        return flags.size();
    }

    void addFlag(TraceFlagInfo info) {
        flags.add(info);
        if (state == TraceState.UNFLAGGED) {
            state = TraceState.FLAGGED;
        }
    }

    TraceState state() {
        return state;
    }

    void moveTo(TraceState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("trace " + trace.id() + " cannot move from " + state + " to " + next);
        }
        if (next == TraceState.ADMITTED && reviewRequired) {
            throw new IllegalStateException("trace " + trace.id() + " needs an approving review before leaving " + state);
        }
        state = next;
    }

    /**
     * Quarantine stays set across later merges until an approving review releases it.
     */
    void quarantine(String reason) {
        moveTo(TraceState.QUARANTINED);
        quarantineReason = reason;
        reviewRequired = true;
    }

    boolean quarantined() {
        return quarantineReason != null;
    }

    String quarantineReason() {
        return quarantineReason;
    }

    /**
     * Marks a trace whose merge was refused; only an approving review lets it be admitted again.
     */
    void holdForReview() {
        reviewRequired = true;
    }

    boolean reviewRequired() {
        return reviewRequired;
    }

    String provenanceHead() {
        return provenanceHead;
    }

    void chain(String head, boolean attestsContent) {
        provenanceHead = head;
        attested |= attestsContent;
    }

    boolean attested() {
        return attested;
    }

    ReviewRecord review() {
        return review;
    }

    void review(ReviewRecord record, boolean approves) {
        review = record;
        if (approves) {
            quarantineReason = null;
            reviewRequired = false;
        }
    }

    RDSeries series() {
        return series;
    }

    void series(RDSeries value) {
        series = value;
    }
}
