package io.limitgraph.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.limitgraph.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

final class ProvenanceTest {

    @Test
    void contentHashIsDeterministicAndKeyOrderIndependent() {
        JsonNode a = Jsons.readTree("{\"b\":1,\"a\":[1,2,{\"z\":true,\"y\":null}]}");
        JsonNode b = Jsons.readTree("{\"a\":[1,2,{\"y\":null,\"z\":true}],\"b\":1}");
        Assertions.assertEquals(Provenance.contentHash(a), Provenance.contentHash(b));
        Assertions.assertNotEquals(Provenance.contentHash(a), Provenance.contentHash(Jsons.readTree("{\"b\":2}")));
    }

    @Test
    void tamperedContentIsDetected() {
        JsonNode content = Jsons.readTree("{\"stdout\":\"ok\"}");
        Provenance record = Provenance.create(SessionId.newId(), TraceId.newId(), ProvenanceKind.ORIGIN,
                "runner.execute", "echo", content, null, Instant.now());
        Assertions.assertTrue(record.verifyContent(content));
        Assertions.assertFalse(record.verifyContent(Jsons.readTree("{\"stdout\":\"changed\"}")));
        Assertions.assertTrue(record.verifySelf());
        Assertions.assertEquals("", record.previousHash());
    }

    @Test
    void chainVerificationFindsFirstBrokenLink() {
        SessionId sessionId = SessionId.newId();
        TraceId traceId = TraceId.newId();
        Instant at = Instant.parse("2026-03-01T10:00:00Z");
        List<Provenance> chain = new ArrayList<>();
        String prev = "";
        for (int i = 0; i < 4; i++) {
            Provenance row = Provenance.create(sessionId, traceId, ProvenanceKind.GOVERNANCE, "op-" + i, "test",
                    Jsons.readTree("{\"i\":" + i + "}"), prev, at.plusSeconds(i));
            chain.add(row);
            prev = row.hash();
        }
        Assertions.assertEquals(-1, Provenance.firstBrokenLink(chain));

        Provenance original = chain.get(2);
        Provenance forged = new Provenance(original.id(), sessionId, traceId, original.kind(), "rewritten",
                original.actor(), original.contentHash(), original.previousHash(), original.hash(), original.timestamp());
        chain.set(2, forged);
        Assertions.assertEquals(2, Provenance.firstBrokenLink(chain));

        chain.set(2, original);
        chain.remove(1);
        Assertions.assertEquals(1, Provenance.firstBrokenLink(chain));
    }

    @Test
    void recordSurvivesJsonRoundTrip() throws Exception {
        Provenance record = Provenance.create(SessionId.newId(), TraceId.newId(), ProvenanceKind.REVIEW,
                "trace.review", "alice", Jsons.readTree("{\"decision\":\"APPROVE\"}"), "abc", Instant.now());
        Provenance loaded = Jsons.compactMapper().readValue(Jsons.toCompactJson(record), Provenance.class);
        Assertions.assertEquals(record, loaded);
        Assertions.assertTrue(loaded.verifySelf());
    }
}
