package io.limitgraph.model;

import io.limitgraph.error.InvalidConfigException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;

final class GovernancePolicyTest {
    private static final Instant AT = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void presetsCarryExpectedThresholds() {
        GovernancePolicy permissive = GovernancePolicy.permissive();
        Assertions.assertFalse(permissive.blockJailbreakTraces());
        Assertions.assertFalse(permissive.autoQuarantine());
        Assertions.assertEquals(10, permissive.maxAnomalySeverity());

        GovernancePolicy defaults = GovernancePolicy.defaults();
        Assertions.assertTrue(defaults.autoQuarantine());
        Assertions.assertEquals(7, defaults.maxAnomalySeverity());
        Assertions.assertEquals(GovernancePolicy.DEFAULT_QUARANTINE_SEVERITY, defaults.quarantineSeverity());
        Assertions.assertFalse(defaults.requireHumanReview());

        GovernancePolicy strict = GovernancePolicy.strict();
        Assertions.assertTrue(strict.blockAnomalyTraces());
        Assertions.assertTrue(strict.requireHumanReview());
        Assertions.assertEquals(5, strict.maxAnomalySeverity());
    }

    @Test
    void presetLookupIsCaseInsensitive() {
        Assertions.assertEquals(GovernancePolicy.strict(), GovernancePolicy.preset(" STRICT "));
        Assertions.assertEquals(GovernancePolicy.defaults(), GovernancePolicy.preset("balanced"));
        Assertions.assertEquals(GovernancePolicy.defaults(), GovernancePolicy.preset(null));
        Assertions.assertThrows(InvalidConfigException.class, () -> GovernancePolicy.preset("lenient"));
    }

    @Test
    void severityThresholdsMustBeInRange() {
        Assertions.assertThrows(InvalidConfigException.class,
                () -> new GovernancePolicy(true, true, true, true, 0, true, true, true, 8));
        Assertions.assertThrows(InvalidConfigException.class,
                () -> new GovernancePolicy(true, true, true, true, 7, true, true, true, 11));
    }

    @Test
    void blockSwitchesMapToFlagKinds() {
        GovernancePolicy defaults = GovernancePolicy.defaults();
        Assertions.assertTrue(defaults.blockAnomalyTraces());
        Assertions.assertTrue(defaults.blocks(flag(TraceFlag.JAILBREAK, 1)));
        Assertions.assertTrue(defaults.blocks(flag(TraceFlag.MALICIOUS, 1)));
        Assertions.assertTrue(defaults.blocks(flag(TraceFlag.UNSAFE, 1)));
        Assertions.assertTrue(defaults.blocks(flag(TraceFlag.HIGH_RISK, 1)));
        Assertions.assertTrue(defaults.blocks(flag(TraceFlag.UNVERIFIED, 1)));
        for (TraceFlag kind : TraceFlag.values()) {
            Assertions.assertFalse(GovernancePolicy.permissive().blocks(flag(kind, 10)));
        }
    }

    @Test
    void anomalyBlocksOnlyAboveMaxSeverity() {
        GovernancePolicy defaults = GovernancePolicy.defaults();
        Assertions.assertFalse(defaults.blocks(flag(TraceFlag.ANOMALY, 3)));
        Assertions.assertFalse(defaults.blocks(flag(TraceFlag.ANOMALY, 7)));
        Assertions.assertTrue(defaults.blocks(flag(TraceFlag.ANOMALY, 8)));

        GovernancePolicy strict = GovernancePolicy.strict();
        Assertions.assertFalse(strict.blocks(flag(TraceFlag.ANOMALY, 1)));
        Assertions.assertTrue(strict.blocks(flag(TraceFlag.ANOMALY, 6)));

        GovernancePolicy anomaliesAllowed = new GovernancePolicy(true, true, true, false, 7, false, true, true, 8);
        Assertions.assertFalse(anomaliesAllowed.blocks(flag(TraceFlag.ANOMALY, 10)));
    }

    @Test
    void quarantineFollowsSeverityAndBlockedKinds() {
        GovernancePolicy defaults = GovernancePolicy.defaults();
        Assertions.assertTrue(defaults.quarantines(TraceFlagInfo.manual(TraceFlag.ANOMALY, "spike", 8, AT)));
        Assertions.assertFalse(defaults.quarantines(TraceFlagInfo.manual(TraceFlag.ANOMALY, "spike", 7, AT)));
        Assertions.assertTrue(defaults.quarantines(TraceFlagInfo.manual(TraceFlag.JAILBREAK, "low", 2, AT)));
        Assertions.assertFalse(GovernancePolicy.permissive().quarantines(
                TraceFlagInfo.manual(TraceFlag.JAILBREAK, "high", 10, AT)));
    }

    @Test
    void flagSeverityIsValidated() {
        Assertions.assertThrows(InvalidConfigException.class, () -> TraceFlagInfo.manual(TraceFlag.UNSAFE, "x", 0, AT));
        Assertions.assertThrows(InvalidConfigException.class, () -> TraceFlagInfo.manual(TraceFlag.UNSAFE, "x", 11, AT));
        Assertions.assertEquals(TraceFlag.HIGH_RISK, TraceFlag.fromString("HighRisk"));
        Assertions.assertEquals(TraceFlag.HIGH_RISK, TraceFlag.fromString("high-risk"));
    }

    @Test
    void stateMachineNeverReturnsToUnflagged() {
        for (TraceState state : TraceState.values()) {
            if (state != TraceState.UNFLAGGED) {
                Assertions.assertFalse(state.canTransitionTo(TraceState.UNFLAGGED), state.name());
            }
        }
        Assertions.assertFalse(TraceState.QUARANTINED.canTransitionTo(TraceState.FLAGGED));
        Assertions.assertTrue(TraceState.FLAGGED.canTransitionTo(TraceState.QUARANTINED));
    }

    private static TraceFlagInfo flag(TraceFlag kind, int severity) {
        return TraceFlagInfo.manual(kind, "test", severity, AT);
    }
}
