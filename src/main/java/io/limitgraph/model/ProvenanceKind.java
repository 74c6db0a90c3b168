package io.limitgraph.model;

public enum ProvenanceKind {
    /** Content produced by an execution or imported from outside. */
    ORIGIN,
    TRANSFORM,
    GOVERNANCE,
    REVIEW;

    public boolean attestsContent() {
        return this == ORIGIN || this == TRANSFORM;
    }
}
