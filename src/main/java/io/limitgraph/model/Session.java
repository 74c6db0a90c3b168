package io.limitgraph.model;

import java.time.Instant;
import java.util.Objects;

public record Session(
        SessionId id,
        SessionConfig config,
        Instant createdAt
) {
    public Session {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public static Session open(SessionConfig config, Instant now) {
        return new Session(SessionId.newId(), config, now);
    }

    public String name() {
        return config.name();
    }
}
