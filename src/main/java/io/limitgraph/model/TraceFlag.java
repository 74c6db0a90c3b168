package io.limitgraph.model;

public enum TraceFlag {
    JAILBREAK("Jailbreak"),
    ANOMALY("Anomaly"),
    HIGH_RISK("HighRisk"),
    UNSAFE("Unsafe"),
    UNVERIFIED("Unverified"),
    MALICIOUS("Malicious");

    private final String label;

    TraceFlag(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static TraceFlag fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("flag kind cannot be empty");
        }
        String normalized = raw.trim().replace("-", "_");
        for (TraceFlag value : values()) {
            if (value.name().equalsIgnoreCase(normalized) || value.label.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown flag kind: " + raw);
    }
}
