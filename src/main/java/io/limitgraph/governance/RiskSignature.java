package io.limitgraph.governance;

import io.limitgraph.error.InvalidConfigException;
import io.limitgraph.model.TraceFlag;
import io.limitgraph.model.TraceFlagInfo;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Case-insensitive substring rule. The first matching pattern is reported.
 */
public record RiskSignature(
        TraceFlag flag,
        int severity,
        String reason,
        List<String> patterns
) {
    public RiskSignature {
        Objects.requireNonNull(flag, "flag");
        if (severity < TraceFlagInfo.MIN_SEVERITY || severity > TraceFlagInfo.MAX_SEVERITY) {
            throw new InvalidConfigException("signature severity must be within [1,10], got " + severity);
        }
        if (patterns == null || patterns.isEmpty()) {
            throw new InvalidConfigException("signature for " + flag.label() + " needs at least one pattern");
        }
        patterns = patterns.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(p -> p.trim().toLowerCase(Locale.ROOT))
                .toList();
        if (patterns.isEmpty()) {
            throw new InvalidConfigException("signature for " + flag.label() + " has only blank patterns");
        }
        reason = reason == null || reason.isBlank() ? flag.label() + " signature matched" : reason.trim();
    }

    public static List<RiskSignature> defaults() {
        return List.of(
                new RiskSignature(TraceFlag.JAILBREAK, 10, "prompt-injection phrasing",
                        List.of("jailbreak", "ignore previous", "ignore all previous instructions",
                                "disregard your instructions", "developer mode enabled")),
                new RiskSignature(TraceFlag.MALICIOUS, 9, "destructive command",
                        List.of("rm -rf", "drop table", "mkfs.", ":(){ :|:& };:", "format c:"))
        );
    }

    /**
     * @param lowerText text already lower-cased with {@link Locale#ROOT}
     */
    public Optional<String> firstMatch(String lowerText) {
        for (String pattern : patterns) {
            if (lowerText.contains(pattern)) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }
}
