package io.limitgraph.model;

public enum CheckpointOutcome {
    ADMIT,
    BLOCK,
    QUARANTINE
}
