package io.limitgraph.runner;

import com.fasterxml.jackson.databind.JsonNode;
import io.limitgraph.util.Jsons;

public record RunnerOutput(
        boolean ok,
        String stdout,
        String stderr,
        JsonNode metrics
) {
    public RunnerOutput {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        metrics = metrics == null ? Jsons.mapper().createObjectNode() : metrics;
    }

    public static RunnerOutput ok(String stdout, JsonNode metrics) {
        return new RunnerOutput(true, stdout, "", metrics);
    }
}
