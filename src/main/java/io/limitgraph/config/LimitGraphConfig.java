package io.limitgraph.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class LimitGraphConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "limitgraph-settings.json";

    private final Path rootDir;

    public LimitGraphConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static LimitGraphConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new LimitGraphConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path dbFile() {
        return rootDir.resolve("limitgraph.db");
    }

    public Path tracesRoot() {
        return rootDir.resolve("traces");
    }

    public Path sandboxRoot() {
        return rootDir.resolve("sandbox");
    }
}
