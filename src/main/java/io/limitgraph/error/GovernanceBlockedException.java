package io.limitgraph.error;

import io.limitgraph.model.GovernanceCheckpoint;

/**
 * A merge was denied. The checkpoint has already been persisted when this is thrown.
 */
public final class GovernanceBlockedException extends LimitGraphException {
    private final GovernanceCheckpoint checkpoint;

    public GovernanceBlockedException(GovernanceCheckpoint checkpoint) {
        super("Governance blocked merge of trace " + checkpoint.traceId() + ": " + String.join("; ", checkpoint.reasons()));
        this.checkpoint = checkpoint;
    }

    public GovernanceCheckpoint checkpoint() {
        return checkpoint;
    }
}
