package io.limitgraph.config;

import io.limitgraph.error.InvalidConfigException;
import io.limitgraph.governance.DetectorConfig;
import io.limitgraph.governance.RiskSignature;
import io.limitgraph.model.GovernancePolicy;
import io.limitgraph.model.TraceFlag;
import io.limitgraph.rd.FgwConfig;
import io.limitgraph.storage.StorageKind;
import io.limitgraph.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Effective settings: {@code limitgraph-settings.json} overlaid on built-in defaults.
 *
 * <p>Policy, FGW and detector values are validated and rejected when out of range. Sizing
 * knobs such as the runner timeout are clamped instead.
 */
public record LimitGraphSettings(
        String policyPreset,
        GovernancePolicy policy,
        FgwConfig fgw,
        DetectorConfig detector,
        StorageKind storage,
        long runnerTimeoutMs
) {
    private static final Logger log = LoggerFactory.getLogger(LimitGraphSettings.class);

    public static final String DEFAULT_PRESET = "default";
    public static final long DEFAULT_RUNNER_TIMEOUT_MS = 30_000L;
    public static final long MIN_RUNNER_TIMEOUT_MS = 100L;

    public static LimitGraphSettings defaults() {
        return new LimitGraphSettings(
                DEFAULT_PRESET,
                GovernancePolicy.defaults(),
                FgwConfig.defaults(),
                DetectorConfig.defaults(),
                StorageKind.FILE,
                DEFAULT_RUNNER_TIMEOUT_MS
        );
    }

    public static LimitGraphSettings load(LimitGraphConfig config) {
        return load(config.settingsFile());
    }

    public static LimitGraphSettings load(Path file) {
        if (!Files.exists(file)) {
            log.debug("settings file {} not found, using defaults", file);
            return defaults();
        }
        SettingsFile parsed;
        try {
            parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new InvalidConfigException("Cannot read settings " + file + ": " + e.getMessage(), e);
        }
        LimitGraphSettings resolved = fromFile(parsed, defaults());
        log.info("settings loaded file={} preset={} storage={}", file, resolved.policyPreset(), resolved.storage());
        return resolved;
    }

    static LimitGraphSettings fromFile(SettingsFile file, LimitGraphSettings defaults) {
        if (file == null) {
            return defaults;
        }
        String preset = file.policyPreset() == null || file.policyPreset().isBlank()
                ? defaults.policyPreset()
                : file.policyPreset().trim();
        GovernancePolicy policy = overlay(file.policy(), GovernancePolicy.preset(preset));
        FgwConfig fgw = overlay(file.fgw(), defaults.fgw());
        DetectorConfig detector = overlay(file.detector(), defaults.detector());
        StorageKind storage;
        try {
            storage = file.storage() == null ? defaults.storage() : StorageKind.fromString(file.storage());
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigException("Unknown storage kind: " + file.storage(), e);
        }
        long timeout = sanitizeLong(file.runnerTimeoutMs(), defaults.runnerTimeoutMs(), MIN_RUNNER_TIMEOUT_MS);
        return new LimitGraphSettings(preset, policy, fgw, detector, storage, timeout);
    }

    private static GovernancePolicy overlay(PolicyFile file, GovernancePolicy base) {
        if (file == null) {
            return base;
        }
        return new GovernancePolicy(
                pick(file.blockUnsafeMerge(), base.blockUnsafeMerge()),
                pick(file.requireProvenance(), base.requireProvenance()),
                pick(file.blockJailbreakTraces(), base.blockJailbreakTraces()),
                pick(file.blockAnomalyTraces(), base.blockAnomalyTraces()),
                pick(file.maxAnomalySeverity(), base.maxAnomalySeverity()),
                pick(file.requireHumanReview(), base.requireHumanReview()),
                pick(file.autoQuarantine(), base.autoQuarantine()),
                pick(file.blockMaliciousTraces(), base.blockMaliciousTraces()),
                pick(file.quarantineSeverity(), base.quarantineSeverity())
        );
    }

    private static FgwConfig overlay(FgwFile file, FgwConfig base) {
        if (file == null) {
            return base;
        }
        return new FgwConfig(
                pick(file.alpha(), base.alpha()),
                pick(file.epsilon(), base.epsilon()),
                pick(file.maxIter(), base.maxIter()),
                pick(file.tol(), base.tol())
        );
    }

    private static DetectorConfig overlay(DetectorFile file, DetectorConfig base) {
        if (file == null) {
            return base;
        }
        List<RiskSignature> signatures = new ArrayList<>();
        if (file.includeDefaultSignatures() == null || file.includeDefaultSignatures()) {
            signatures.addAll(base.signatures());
        }
        if (file.signatures() != null) {
            for (SignatureFile raw : file.signatures()) {
                signatures.add(toSignature(raw));
            }
        }
        return new DetectorConfig(
                signatures,
                pick(file.repetitionMinTokens(), base.repetitionMinTokens()),
                pick(file.repetitionRatio(), base.repetitionRatio()),
                pick(file.distortionZScore(), base.distortionZScore()),
                pick(file.minSeriesPoints(), base.minSeriesPoints())
        );
    }

    private static RiskSignature toSignature(SignatureFile raw) {
        if (raw == null || raw.flag() == null || raw.severity() == null) {
            throw new InvalidConfigException("detector signature needs flag and severity");
        }
        TraceFlag flag;
        try {
            flag = TraceFlag.fromString(raw.flag());
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigException(e.getMessage(), e);
        }
        return new RiskSignature(flag, raw.severity(), raw.reason(), raw.patterns());
    }

    private static boolean pick(Boolean raw, boolean fallback) {
        return raw == null ? fallback : raw;
    }

    private static int pick(Integer raw, int fallback) {
        return raw == null ? fallback : raw;
    }

    private static double pick(Double raw, double fallback) {
        return raw == null ? fallback : raw;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            String policyPreset,
            PolicyFile policy,
            FgwFile fgw,
            DetectorFile detector,
            String storage,
            Long runnerTimeoutMs
    ) {
    }

    record PolicyFile(
            Boolean blockUnsafeMerge,
            Boolean requireProvenance,
            Boolean blockJailbreakTraces,
            Boolean blockAnomalyTraces,
            Integer maxAnomalySeverity,
            Boolean requireHumanReview,
            Boolean autoQuarantine,
            Boolean blockMaliciousTraces,
            Integer quarantineSeverity
    ) {
    }

    record FgwFile(
            Double alpha,
            Double epsilon,
            Integer maxIter,
            Double tol
    ) {
    }

    record DetectorFile(
            Boolean includeDefaultSignatures,
            List<SignatureFile> signatures,
            Integer repetitionMinTokens,
            Double repetitionRatio,
            Double distortionZScore,
            Integer minSeriesPoints
    ) {
    }

    record SignatureFile(
            String flag,
            Integer severity,
            String reason,
            List<String> patterns
    ) {
    }
}
