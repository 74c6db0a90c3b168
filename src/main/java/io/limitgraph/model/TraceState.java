package io.limitgraph.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Governance lifecycle of a single trace.
 *
 * <p>Transitions never lead back to {@link #UNFLAGGED}. Moving from {@link #BLOCKED} or
 * {@link #QUARANTINED} to {@link #ADMITTED} is further held back by the trace ledger until
 * an approving review is recorded.
 */
public enum TraceState {
    UNFLAGGED,
    FLAGGED,
    QUARANTINED,
    ADMITTED,
    BLOCKED;

    public boolean canTransitionTo(TraceState next) {
        return allowedNext().contains(next);
    }

    private Set<TraceState> allowedNext() {
        return switch (this) {
            case UNFLAGGED -> EnumSet.of(UNFLAGGED, FLAGGED, QUARANTINED, ADMITTED, BLOCKED);
            case FLAGGED -> EnumSet.of(FLAGGED, QUARANTINED, ADMITTED, BLOCKED);
            case QUARANTINED -> EnumSet.of(QUARANTINED, ADMITTED, BLOCKED);
            case ADMITTED -> EnumSet.of(ADMITTED, QUARANTINED, BLOCKED);
            case BLOCKED -> EnumSet.of(BLOCKED, QUARANTINED, ADMITTED);
        };
    }
}
