package io.limitgraph.storage;

import io.limitgraph.config.LimitGraphConfig;

import java.util.Locale;

public enum StorageKind {
    FILE,
    SQLITE,
    MEMORY;

    public static StorageKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return FILE;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    public Storage open(LimitGraphConfig config) {
        return switch (this) {
            case FILE -> new FileStorage(config.tracesRoot());
            case SQLITE -> {
                Database database = new Database(config);
                database.init();
                yield new SqliteStorage(database);
            }
            case MEMORY -> new InMemoryStorage();
        };
    }
}
