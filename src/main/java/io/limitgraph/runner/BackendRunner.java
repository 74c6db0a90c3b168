package io.limitgraph.runner;

import io.limitgraph.model.Session;
import io.limitgraph.model.TraceId;

/**
 * Executes one unit of work inside a session's isolation boundary.
 *
 * <p>Calls for different sessions must never share mutable state (working directory,
 * memory or network context). Failures to execute at all are raised as
 * {@link io.limitgraph.error.RunnerException}; a run that completes unsuccessfully is a
 * normal {@link RunnerOutput} with {@code ok=false}.
 */
public interface BackendRunner {
    String id();

    RunnerKind kind();

    RunnerOutput executeIsolated(String input, Session session, TraceId traceId);

    default boolean healthCheck() {
        return true;
    }

    default boolean supportsIsolation() {
        return true;
    }
}
