package io.limitgraph.error;

import io.limitgraph.model.SessionId;
import io.limitgraph.model.TraceId;
import io.limitgraph.runner.RunnerKind;

public final class RunnerException extends LimitGraphException {
    private final SessionId sessionId;
    private final TraceId traceId;
    private final RunnerKind kind;

    public RunnerException(RunnerKind kind, SessionId sessionId, TraceId traceId, String message) {
        super(describe(kind, sessionId, traceId) + ": " + message);
        this.sessionId = sessionId;
        this.traceId = traceId;
        this.kind = kind;
    }

    public RunnerException(RunnerKind kind, SessionId sessionId, TraceId traceId, Throwable cause) {
        super(describe(kind, sessionId, traceId) + ": " + cause.getMessage(), cause);
        this.sessionId = sessionId;
        this.traceId = traceId;
        this.kind = kind;
    }

    public SessionId sessionId() {
        return sessionId;
    }

    public TraceId traceId() {
        return traceId;
    }

    public RunnerKind kind() {
        return kind;
    }

    private static String describe(RunnerKind kind, SessionId sessionId, TraceId traceId) {
        return "Runner " + kind + " failed for session=" + sessionId + " trace=" + traceId;
    }
}
