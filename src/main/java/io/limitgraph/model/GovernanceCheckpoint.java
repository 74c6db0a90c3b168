package io.limitgraph.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

public record GovernanceCheckpoint(
        String id,
        SessionId sessionId,
        TraceId traceId,
        String label,
        GovernancePolicy policy,
        CheckpointOutcome outcome,
        List<TraceFlagInfo> triggeringFlags,
        List<String> reasons,
        Instant timestamp
) {
    public GovernanceCheckpoint {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(timestamp, "timestamp");
        label = label == null ? "" : label;
        triggeringFlags = triggeringFlags == null ? List.of() : List.copyOf(triggeringFlags);
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static GovernanceCheckpoint record(
            SessionId sessionId,
            TraceId traceId,
            String label,
            GovernancePolicy policy,
            CheckpointOutcome outcome,
            List<TraceFlagInfo> triggeringFlags,
            List<String> reasons,
            Instant timestamp
    ) {
        return new GovernanceCheckpoint(
                "chk_" + UUID.randomUUID(),
                sessionId,
                traceId,
                label,
                policy,
                outcome,
                triggeringFlags,
                reasons,
                timestamp
        );
    }

    public boolean passed() {
        return outcome == CheckpointOutcome.ADMIT;
    }
}
