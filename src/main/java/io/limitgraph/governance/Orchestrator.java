package io.limitgraph.governance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.limitgraph.error.GovernanceBlockedException;
import io.limitgraph.error.RunnerException;
import io.limitgraph.error.UnknownTraceException;
import io.limitgraph.model.CheckpointOutcome;
import io.limitgraph.model.GovernanceCheckpoint;
import io.limitgraph.model.GovernancePolicy;
import io.limitgraph.model.Provenance;
import io.limitgraph.model.ProvenanceKind;
import io.limitgraph.model.RDSeries;
import io.limitgraph.model.ReviewDecision;
import io.limitgraph.model.ReviewRecord;
import io.limitgraph.model.Session;
import io.limitgraph.model.SessionId;
import io.limitgraph.model.Trace;
import io.limitgraph.model.TraceFlag;
import io.limitgraph.model.TraceFlagInfo;
import io.limitgraph.model.TraceId;
import io.limitgraph.model.TraceState;
import io.limitgraph.runner.BackendRunner;
import io.limitgraph.runner.RunnerOutput;
import io.limitgraph.security.SensitiveDataMasker;
import io.limitgraph.session.AdmissionGate;
import io.limitgraph.session.SessionManager;
import io.limitgraph.storage.Storage;
import io.limitgraph.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Governance core: owns the per-trace flag table and decides which traces may leave their
 * session.
 *
 * <p>The policy is fixed for the lifetime of an instance and shared by every session. Each
 * trace's ledger is locked on its own, so flagging one trace never waits on another. Storage
 * and runner calls happen outside of any cross-trace lock.
 */
public final class Orchestrator {
    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);
    private static final String SYSTEM_ACTOR = "orchestrator";
    static final String MERGE_LABEL = "merge";

    private final Storage storage;
    private final GovernancePolicy policy;
    private final AnomalyDetector detector;
    private final SessionManager sessions;
    private final Clock clock;
    private final ConcurrentMap<TraceId, TraceLedger> ledgers = new ConcurrentHashMap<>();

    public Orchestrator(
            Storage storage,
            GovernancePolicy policy,
            AnomalyDetector detector,
            SessionManager sessions,
            Clock clock
    ) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Orchestrator(Storage storage, GovernancePolicy policy) {
        this(storage, policy, PatternAnomalyDetector.defaults(), new SessionManager(), Clock.systemUTC());
    }

    public GovernancePolicy policy() {
        return policy;
    }

    public SessionManager sessions() {
        return sessions;
    }

    /**
     * Persists a new trace of the session, makes it known to the flag table and records its
     * ORIGIN provenance.
     */
    public Trace recordTrace(Session session, JsonNode payload) {
        Trace trace = Trace.create(session.id(), payload, clock.instant());
        storage.persistTrace(trace);
        TraceLedger ledger = ledgers.computeIfAbsent(trace.id(), id -> new TraceLedger(trace));
        appendProvenance(ledger, ProvenanceKind.ORIGIN, "trace.record", SYSTEM_ACTOR, trace.payload());
        log.debug("trace recorded session={} trace={} payload={}",
                session.id(), trace.id(), SensitiveDataMasker.excerpt(payload));
        return trace;
    }

    /**
     * Makes a trace that is already stored known to the flag table. Any provenance chain
     * found in storage is resumed; a chain that fails verification does not attest content.
     */
    public Trace registerTrace(Trace trace) {
        TraceLedger created = new TraceLedger(trace);
        TraceLedger existing = ledgers.putIfAbsent(trace.id(), created);
        if (existing != null) {
            return existing.trace();
        }
        List<Provenance> chain = storage.listProvenance(trace.sessionId(), trace.id());
        if (!chain.isEmpty()) {
            int broken = Provenance.firstBrokenLink(chain);
            boolean attests = broken < 0 && chain.stream().anyMatch(p -> p.kind().attestsContent());
            if (broken >= 0) {
                log.warn("provenance chain broken trace={} index={} records={}", trace.id(), broken, chain.size());
            }
            synchronized (created) {
                created.chain(chain.get(chain.size() - 1).hash(), attests);
            }
        }
        storage.loadRdSeries(trace.sessionId(), trace.id()).ifPresent(series -> {
            synchronized (created) {
                created.series(series);
            }
        });
        return trace;
    }

    /**
     * Executes {@code input} on the runner inside the session's admission gate, persists the
     * resulting trace with ORIGIN provenance and flags whatever the detector finds. A run that
     * completes with {@code ok=false} still produces a trace.
     */
    public Trace runTask(Session session, BackendRunner runner, String input) {
        AdmissionGate gate = sessions.gate(session);
        TraceId traceId = TraceId.newId();
        try {
            gate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunnerException(runner.kind(), session.id(), traceId, "interrupted while waiting for admission");
        }
        try {
            RunnerOutput output = runner.executeIsolated(input, session, traceId);
            ObjectNode payload = Jsons.mapper().createObjectNode();
            payload.put("runner", runner.id());
            payload.put("kind", runner.kind().name());
            payload.put("ok", output.ok());
            payload.put("input", input == null ? "" : input);
            payload.put("stdout", output.stdout());
            payload.put("stderr", output.stderr());
            payload.set("metrics", output.metrics());

            Trace trace = new Trace(traceId, session.id(), payload, clock.instant());
            storage.persistTrace(trace);
            TraceLedger ledger = ledgers.computeIfAbsent(traceId, id -> new TraceLedger(trace));
            appendProvenance(ledger, ProvenanceKind.ORIGIN, "runner.execute", runner.id(), trace.payload());
            for (TraceFlagInfo info : detectAnomalies(trace)) {
                flagTrace(traceId, info);
            }
            log.info("task finished session={} trace={} runner={} ok={} inFlight={}",
                    session.id(), traceId, runner.id(), output.ok(), gate.inFlight());
            return trace;
        } finally {
            gate.release();
        }
    }

    /**
     * Appends a flag and, when the policy says so, quarantines the trace in the same step.
     * The flag is visible only after its GOVERNANCE provenance has been persisted.
     */
    public void flagTrace(TraceId traceId, TraceFlagInfo info) {
        Objects.requireNonNull(info, "info");
        TraceLedger ledger = requireLedger(traceId);
        synchronized (ledger) {
            boolean quarantine = policy.quarantines(info) && !ledger.quarantined();
            ObjectNode content = flagJson(info);
            content.put("quarantine", quarantine);
            appendProvenance(ledger, ProvenanceKind.GOVERNANCE, "trace.flag", SYSTEM_ACTOR, content);
            ledger.addFlag(info);
            if (quarantine) {
                ledger.quarantine("auto: " + info.flag().label() + " severity " + info.severity());
            }
            log.warn("trace flagged trace={} flag={} severity={} auto={} state={} reason={}",
                    traceId, info.flag().label(), info.severity(), info.autoDetected(), ledger.state(), info.reason());
        }
    }

    public List<TraceFlagInfo> detectAnomalies(Trace trace) {
        return detectAnomalies(trace, seriesFor(trace.id()));
    }

    public List<TraceFlagInfo> detectAnomalies(Trace trace, RDSeries series) {
        return detector.detect(trace, series);
    }

    /**
     * Runs the detector on a known trace and flags every hit.
     */
    public List<TraceFlagInfo> scanTrace(TraceId traceId) {
        TraceLedger ledger = requireLedger(traceId);
        RDSeries series;
        synchronized (ledger) {
            series = ledger.series();
        }
        List<TraceFlagInfo> found = detector.detect(ledger.trace(), series);
        for (TraceFlagInfo info : found) {
            flagTrace(traceId, info);
        }
        return found;
    }

    public void quarantineTrace(TraceId traceId, String reason) {
        TraceLedger ledger = requireLedger(traceId);
        String why = reason == null || reason.isBlank() ? "manual quarantine" : reason.trim();
        synchronized (ledger) {
            ObjectNode content = Jsons.mapper().createObjectNode();
            content.put("reason", why);
            content.put("previous_state", ledger.state().name());
            appendProvenance(ledger, ProvenanceKind.GOVERNANCE, "trace.quarantine", SYSTEM_ACTOR, content);
            ledger.quarantine(why);
            log.warn("trace quarantined trace={} reason={}", traceId, why);
        }
    }

    public List<TraceFlagInfo> traceFlags(TraceId traceId) {
        TraceLedger ledger = requireLedger(traceId);
        synchronized (ledger) {
            return ledger.flags();
        }
    }

    public TraceState traceState(TraceId traceId) {
        TraceLedger ledger = requireLedger(traceId);
        synchronized (ledger) {
            return ledger.state();
        }
    }

    /**
     * True from the moment a trace is quarantined until an approving review releases it,
     * whatever state later merges have moved it to.
     */
    public boolean isQuarantined(TraceId traceId) {
        TraceLedger ledger = requireLedger(traceId);
        synchronized (ledger) {
            return ledger.quarantined();
        }
    }

    public Provenance recordProvenance(
            Session session,
            TraceId traceId,
            ProvenanceKind kind,
            String operation,
            String actor,
            JsonNode content
    ) {
        TraceLedger ledger = requireLedger(session.id(), traceId);
        synchronized (ledger) {
            return appendProvenance(ledger, kind, operation, actor, content);
        }
    }

    /**
     * Persists the latest snapshot of a series. A series tied to a known trace is also used
     * by later detection runs on that trace.
     */
    public void recordRdSeries(Session session, RDSeries series) {
        if (!session.id().equals(series.sessionId())) {
            throw new IllegalArgumentException("series belongs to session " + series.sessionId() + ", not " + session.id());
        }
        storage.persistRdSeries(session.id(), series);
        if (series.traceId() != null) {
            TraceLedger ledger = ledgers.get(series.traceId());
            if (ledger != null) {
                synchronized (ledger) {
                    ledger.series(series);
                }
            }
        }
        log.info("rd series stored session={} trace={} points={}", session.id(), series.traceId(), series.size());
    }

    /**
     * Review override hook. An approval waives the flag and severity gates for the flags present
     * now, releases any quarantine and lets a refused trace be admitted again; flags added later
     * are evaluated again. A rejection is final.
     */
    public ReviewRecord recordReview(TraceId traceId, String reviewer, ReviewDecision decision, String note) {
        if (reviewer == null || reviewer.isBlank()) {
            throw new IllegalArgumentException("reviewer cannot be empty");
        }
        Objects.requireNonNull(decision, "decision");
        TraceLedger ledger = requireLedger(traceId);
        synchronized (ledger) {
            ReviewRecord previous = ledger.review();
            if (previous != null && previous.decision() == ReviewDecision.REJECT) {
                throw new IllegalStateException("trace " + traceId + " was rejected by " + previous.reviewer());
            }
            ReviewRecord review = new ReviewRecord(
                    traceId, reviewer.trim(), decision, note == null ? "" : note, ledger.flagCount(), clock.instant());
            ObjectNode content = Jsons.mapper().createObjectNode();
            content.put("reviewer", review.reviewer());
            content.put("decision", decision.name());
            content.put("note", review.note());
            content.put("flags_covered", review.flagsCovered());
            content.put("state", ledger.state().name());
            appendProvenance(ledger, ProvenanceKind.REVIEW, "trace.review", review.reviewer(), content);
            ledger.review(review, decision == ReviewDecision.APPROVE);
            if (decision == ReviewDecision.REJECT) {
                ledger.moveTo(TraceState.BLOCKED);
            }
            log.info("trace reviewed trace={} reviewer={} decision={} flagsCovered={}",
                    traceId, review.reviewer(), decision, review.flagsCovered());
            return review;
        }
    }

    /**
     * Evaluates every gate, persists the checkpoint and only then moves the trace to its new
     * state. Throws {@link GovernanceBlockedException} carrying the persisted checkpoint when
     * any gate fails.
     */
    public GovernanceCheckpoint validateMerge(SessionId sessionId, TraceId traceId) {
        TraceLedger ledger = requireLedger(sessionId, traceId);
        GovernanceCheckpoint checkpoint;
        synchronized (ledger) {
            Evaluation evaluation = evaluate(ledger);
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("merge validation of trace " + traceId + " cancelled before commit");
            }
            checkpoint = GovernanceCheckpoint.record(
                    sessionId,
                    traceId,
                    MERGE_LABEL,
                    policy,
                    evaluation.outcome(),
                    evaluation.triggering(),
                    evaluation.reasons(),
                    clock.instant()
            );
            storage.persistCheckpoint(checkpoint);
            switch (evaluation.outcome()) {
                case ADMIT -> ledger.moveTo(TraceState.ADMITTED);
                case BLOCK -> {
                    ledger.holdForReview();
                    ledger.moveTo(TraceState.BLOCKED);
                }
                case QUARANTINE -> {
                    ledger.holdForReview();
                    ledger.moveTo(TraceState.QUARANTINED);
                }
            }
        }
        if (!checkpoint.passed()) {
            log.warn("merge blocked session={} trace={} outcome={} reasons={}",
                    sessionId, traceId, checkpoint.outcome(), checkpoint.reasons());
            throw new GovernanceBlockedException(checkpoint);
        }
        log.info("merge admitted session={} trace={} checkpoint={}", sessionId, traceId, checkpoint.id());
        return checkpoint;
    }

    public GovernanceStats governanceStats() {
        long traces = 0;
        long flagged = 0;
        long quarantined = 0;
        long admitted = 0;
        long blocked = 0;
        Map<TraceFlag, Long> byKind = new EnumMap<>(TraceFlag.class);
        for (TraceLedger ledger : ledgers.values()) {
            synchronized (ledger) {
                traces++;
                if (ledger.flagCount() > 0) {
                    flagged++;
                }
                if (ledger.quarantined()) {
                    quarantined++;
                }
                switch (ledger.state()) {
                    case ADMITTED -> admitted++;
                    case BLOCKED -> blocked++;
                    default -> {
                    }
                }
                for (TraceFlagInfo info : ledger.flags()) {
                    byKind.merge(info.flag(), 1L, Long::sum);
                }
            }
        }
        return new GovernanceStats(traces, flagged, quarantined, admitted, blocked, byKind);
    }

    private Evaluation evaluate(TraceLedger ledger) {
        List<String> reasons = new ArrayList<>();
        List<TraceFlagInfo> triggering = new ArrayList<>();
        ReviewRecord review = ledger.review();
        if (review != null && review.decision() == ReviewDecision.REJECT) {
            reasons.add("rejected by review from " + review.reviewer());
        }

        List<TraceFlagInfo> flags = ledger.flags();
        int waived = review != null && review.decision() == ReviewDecision.APPROVE
                ? Math.min(review.flagsCovered(), flags.size())
                : 0;
        List<TraceFlagInfo> open = flags.subList(waived, flags.size());

        for (TraceFlagInfo info : open) {
            if (policy.blocks(info)) {
                reasons.add("flag " + info.flag().label() + " is blocked by policy (severity "
                        + info.severity() + ": " + info.reason() + ")");
                addOnce(triggering, info);
            }
        }

        int maxSeverity = 0;
        for (TraceFlagInfo info : open) {
            maxSeverity = Math.max(maxSeverity, info.severity());
        }
        if (maxSeverity > policy.maxAnomalySeverity()) {
            reasons.add("max flag severity " + maxSeverity + " exceeds " + policy.maxAnomalySeverity());
            for (TraceFlagInfo info : open) {
                if (info.severity() > policy.maxAnomalySeverity()) {
                    addOnce(triggering, info);
                }
            }
        }

        if (policy.requireProvenance() && !ledger.attested()) {
            reasons.add("no provenance record attests the trace content");
        }

        boolean pendingReview = false;
        if (ledger.quarantined()) {
            pendingReview = policy.requireHumanReview();
            reasons.add((pendingReview ? "quarantined pending human review: " : "quarantined until an approving review: ")
                    + ledger.quarantineReason());
        } else if (ledger.reviewRequired()) {
            reasons.add("refused by an earlier merge; re-admission needs an approving review");
        }

        CheckpointOutcome outcome;
        if (reasons.isEmpty()) {
            outcome = CheckpointOutcome.ADMIT;
        } else if (pendingReview && reasons.size() == 1) {
            outcome = CheckpointOutcome.QUARANTINE;
        } else {
            outcome = CheckpointOutcome.BLOCK;
        }
        return new Evaluation(outcome, triggering, reasons);
    }

    private Provenance appendProvenance(
            TraceLedger ledger,
            ProvenanceKind kind,
            String operation,
            String actor,
            JsonNode content
    ) {
        synchronized (ledger) {
            Provenance record = Provenance.create(
                    ledger.sessionId(),
                    ledger.traceId(),
                    kind,
                    operation,
                    actor,
                    content,
                    ledger.provenanceHead(),
                    clock.instant()
            );
            storage.persistProvenance(record);
            ledger.chain(record.hash(), kind.attestsContent());
            return record;
        }
    }

    private RDSeries seriesFor(TraceId traceId) {
        TraceLedger ledger = ledgers.get(traceId);
        if (ledger == null) {
            return null;
        }
        synchronized (ledger) {
            return ledger.series();
        }
    }

    private TraceLedger requireLedger(TraceId traceId) {
        TraceLedger ledger = ledgers.get(traceId);
        if (ledger == null) {
            throw new UnknownTraceException(traceId);
        }
        return ledger;
    }

    private TraceLedger requireLedger(SessionId sessionId, TraceId traceId) {
        TraceLedger ledger = ledgers.get(traceId);
        if (ledger == null || !ledger.sessionId().equals(sessionId)) {
            throw new UnknownTraceException(sessionId, traceId);
        }
        return ledger;
    }

    private static ObjectNode flagJson(TraceFlagInfo info) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("flag", info.flag().label());
        node.put("reason", info.reason());
        node.put("severity", info.severity());
        node.put("auto_detected", info.autoDetected());
        node.put("timestamp", info.timestamp().toString());
        return node;
    }

    private static void addOnce(List<TraceFlagInfo> list, TraceFlagInfo info) {
        for (TraceFlagInfo existing : list) {
            if (existing == info) {
                return;
            }
        }
        list.add(info);
    }

    private record Evaluation(CheckpointOutcome outcome, List<TraceFlagInfo> triggering, List<String> reasons) {
    }
}
