package io.limitgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.UUID;

public record TraceId(@JsonValue UUID value) {
    public TraceId {
        Objects.requireNonNull(value, "value");
    }

    public static TraceId newId() {
        return new TraceId(UUID.randomUUID());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TraceId parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("trace id cannot be empty");
        }
        return new TraceId(UUID.fromString(raw.trim()));
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
