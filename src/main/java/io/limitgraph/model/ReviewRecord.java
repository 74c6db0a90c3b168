package io.limitgraph.model;

import java.time.Instant;

/**
 * Explicit human review of a trace. {@code flagsCovered} is the number of flags the reviewer
 * saw; flags added afterwards are not waived by an approval.
 */
public record ReviewRecord(
        TraceId traceId,
        String reviewer,
        ReviewDecision decision,
        String note,
        int flagsCovered,
        Instant timestamp
) {
}
