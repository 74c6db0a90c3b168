package io.limitgraph.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.limitgraph.util.Hashing;
import io.limitgraph.util.Jsons;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only audit record. {@code contentHash} fingerprints the content the operation acted
 * on; {@code hash} covers the whole record including {@code previousHash}, so records of one
 * trace form a tamper-evident chain.
 */
public record Provenance(
        String id,
        SessionId sessionId,
        TraceId traceId,
        ProvenanceKind kind,
        String operation,
        String actor,
        String contentHash,
        String previousHash,
        String hash,
        Instant timestamp
) {
    public Provenance {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        operation = operation == null ? "" : operation;
        actor = actor == null ? "" : actor;
        previousHash = previousHash == null ? "" : previousHash;
    }

    public static Provenance create(
            SessionId sessionId,
            TraceId traceId,
            ProvenanceKind kind,
            String operation,
            String actor,
            JsonNode content,
            String previousHash,
            Instant timestamp
    ) {
        String id = "prv_" + UUID.randomUUID();
        String contentHash = contentHash(content);
        String prev = previousHash == null ? "" : previousHash;
        String hash = Hashing.sha256Hex(canonical(id, sessionId, traceId, kind, operation, actor, contentHash, prev, timestamp));
        return new Provenance(id, sessionId, traceId, kind, operation, actor, contentHash, prev, hash, timestamp);
    }

    public static String contentHash(JsonNode content) {
        return Hashing.sha256Hex(Jsons.toCanonicalBytes(content == null ? Jsons.mapper().nullNode() : content));
    }

    public boolean verifyContent(JsonNode content) {
        return contentHash.equals(contentHash(content));
    }

    public String recomputeHash() {
        return Hashing.sha256Hex(canonical(id, sessionId, traceId, kind, operation, actor, contentHash, previousHash, timestamp));
    }

    public boolean verifySelf() {
        return recomputeHash().equals(hash);
    }

    /**
     * Returns the index of the first record whose hash or back-link does not verify, or -1
     * when the whole chain is intact.
     */
    public static int firstBrokenLink(List<Provenance> chain) {
        String expectedPrev = "";
        for (int i = 0; i < chain.size(); i++) {
            Provenance row = chain.get(i);
            if (!row.previousHash().equals(expectedPrev) || !row.verifySelf()) {
                return i;
            }
            expectedPrev = row.hash();
        }
        return -1;
    }

    private static String canonical(
            String id,
            SessionId sessionId,
            TraceId traceId,
            ProvenanceKind kind,
            String operation,
            String actor,
            String contentHash,
            String previousHash,
            Instant timestamp
    ) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("session_id", sessionId.toString());
        row.put("trace_id", traceId.toString());
        row.put("kind", kind.name());
        row.put("operation", operation == null ? "" : operation);
        row.put("actor", actor == null ? "" : actor);
        row.put("content_hash", contentHash);
        row.put("prev_hash", previousHash == null ? "" : previousHash);
        row.put("timestamp", timestamp.toString());
        return Jsons.toCompactJson(row);
    }
}
