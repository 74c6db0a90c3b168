package io.limitgraph.runner;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.limitgraph.model.Session;
import io.limitgraph.model.TraceId;
import io.limitgraph.util.Jsons;

public final class EchoRunner implements BackendRunner {
    @Override
    public String id() {
        return "echo";
    }

    @Override
    public RunnerKind kind() {
        return RunnerKind.ECHO;
    }

    @Override
    public RunnerOutput executeIsolated(String input, Session session, TraceId traceId) {
        ObjectNode metrics = Jsons.mapper().createObjectNode();
        metrics.put("session_id", session.id().toString());
        metrics.put("trace_id", traceId.toString());
        metrics.put("isolated", true);
        return RunnerOutput.ok(input == null ? "" : input, metrics);
    }
}
