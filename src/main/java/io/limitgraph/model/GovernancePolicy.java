package io.limitgraph.model;

import io.limitgraph.error.InvalidConfigException;

import java.util.Locale;

/**
 * Enforcement switches and thresholds shared read-only by every session of one orchestrator.
 *
 * <p>{@code maxAnomalySeverity} is checked against the highest severity of any flag on a
 * trace, independently of the per-kind block switches. With {@code blockAnomalyTraces} on,
 * an anomaly flag blocks only when its own severity is above that maximum. {@code quarantineSeverity} is the
 * severity at or above which {@code autoQuarantine} moves a flagged trace to quarantine.
 */
public record GovernancePolicy(
        boolean blockUnsafeMerge,
        boolean requireProvenance,
        boolean blockJailbreakTraces,
        boolean blockAnomalyTraces,
        int maxAnomalySeverity,
        boolean requireHumanReview,
        boolean autoQuarantine,
        boolean blockMaliciousTraces,
        int quarantineSeverity
) {
    public static final int DEFAULT_QUARANTINE_SEVERITY = 8;

    public GovernancePolicy {
        requireSeverity("maxAnomalySeverity", maxAnomalySeverity);
        requireSeverity("quarantineSeverity", quarantineSeverity);
    }

    public static GovernancePolicy permissive() {
        return new GovernancePolicy(false, false, false, false, 10, false, false, false, 10);
    }

    public static GovernancePolicy defaults() {
        return new GovernancePolicy(true, true, true, true, 7, false, true, true, DEFAULT_QUARANTINE_SEVERITY);
    }

    public static GovernancePolicy strict() {
        return new GovernancePolicy(true, true, true, true, 5, true, true, true, 6);
    }

    public static GovernancePolicy preset(String name) {
        String normalized = name == null || name.isBlank() ? "default" : name.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "permissive" -> permissive();
            case "default", "defaults", "balanced" -> defaults();
            case "strict" -> strict();
            default -> throw new InvalidConfigException("Unknown policy preset: " + name);
        };
    }

    public boolean blocks(TraceFlagInfo info) {
        return switch (info.flag()) {
            case JAILBREAK -> blockJailbreakTraces;
            case MALICIOUS -> blockMaliciousTraces;
            case UNSAFE, HIGH_RISK -> blockUnsafeMerge;
            case ANOMALY -> blockAnomalyTraces && info.severity() > maxAnomalySeverity;
            case UNVERIFIED -> requireProvenance;
        };
    }

    public boolean quarantines(TraceFlagInfo info) {
        if (!autoQuarantine) {
            return false;
        }
        if (info.severity() >= quarantineSeverity) {
            return true;
        }
        return (info.flag() == TraceFlag.JAILBREAK && blockJailbreakTraces)
                || (info.flag() == TraceFlag.MALICIOUS && blockMaliciousTraces);
    }

    private static void requireSeverity(String field, int value) {
        if (value < TraceFlagInfo.MIN_SEVERITY || value > TraceFlagInfo.MAX_SEVERITY) {
            throw new InvalidConfigException(field + " must be within [1,10], got " + value);
        }
    }
}
