package io.limitgraph.error;

import io.limitgraph.model.SessionId;
import io.limitgraph.model.TraceId;

public final class UnknownTraceException extends LimitGraphException {
    private final TraceId traceId;

    public UnknownTraceException(TraceId traceId) {
        super("Unknown trace: " + traceId);
        this.traceId = traceId;
    }

    public UnknownTraceException(SessionId sessionId, TraceId traceId) {
        super("Unknown trace " + traceId + " in session " + sessionId);
        this.traceId = traceId;
    }

    public TraceId traceId() {
        return traceId;
    }
}
