package io.limitgraph.runner;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class RunnerRegistry {
    private final Map<String, BackendRunner> runners = new ConcurrentHashMap<>();

    public void register(BackendRunner runner) {
        runners.put(runner.id(), runner);
    }

    public Optional<BackendRunner> findById(String runnerId) {
        return Optional.ofNullable(runners.get(runnerId));
    }

    public BackendRunner require(String runnerId) {
        return findById(runnerId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown runner: " + runnerId));
    }

    public Collection<String> listRunnerIds() {
        return List.copyOf(runners.keySet());
    }
}
