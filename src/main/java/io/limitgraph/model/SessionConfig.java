package io.limitgraph.model;

import io.limitgraph.error.InvalidConfigException;

public record SessionConfig(
        String name,
        int maxConcurrency,
        boolean allowNetwork
) {
    public static final int DEFAULT_MAX_CONCURRENCY = 4;

    public SessionConfig {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigException("session name cannot be empty");
        }
        if (maxConcurrency <= 0) {
            throw new InvalidConfigException("maxConcurrency must be > 0, got " + maxConcurrency);
        }
        name = name.trim();
    }

    public static SessionConfig named(String name) {
        return new SessionConfig(name, DEFAULT_MAX_CONCURRENCY, false);
    }
}
