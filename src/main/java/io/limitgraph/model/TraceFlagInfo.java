package io.limitgraph.model;

import io.limitgraph.error.InvalidConfigException;

import java.time.Instant;
import java.util.Objects;

public record TraceFlagInfo(
        TraceFlag flag,
        String reason,
        int severity,
        boolean autoDetected,
        Instant timestamp
) {
    public static final int MIN_SEVERITY = 1;
    public static final int MAX_SEVERITY = 10;

    public TraceFlagInfo {
        Objects.requireNonNull(flag, "flag");
        Objects.requireNonNull(timestamp, "timestamp");
        if (severity < MIN_SEVERITY || severity > MAX_SEVERITY) {
            throw new InvalidConfigException("flag severity must be within [1,10], got " + severity);
        }
        reason = reason == null ? "" : reason;
    }

    public static TraceFlagInfo manual(TraceFlag flag, String reason, int severity, Instant timestamp) {
        return new TraceFlagInfo(flag, reason, severity, false, timestamp);
    }

    public static TraceFlagInfo detected(TraceFlag flag, String reason, int severity, Instant timestamp) {
        return new TraceFlagInfo(flag, reason, severity, true, timestamp);
    }
}
