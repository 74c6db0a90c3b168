package io.limitgraph.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Instant;
import java.util.Objects;

public record Trace(
        TraceId id,
        SessionId sessionId,
        JsonNode payload,
        Instant createdAt
) {
    public Trace {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(createdAt, "createdAt");
        payload = payload == null ? NullNode.getInstance() : payload.deepCopy();
    }

    public static Trace create(SessionId sessionId, JsonNode payload, Instant now) {
        return new Trace(TraceId.newId(), sessionId, payload, now);
    }

    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }
}
