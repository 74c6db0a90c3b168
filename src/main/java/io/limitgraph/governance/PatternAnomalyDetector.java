package io.limitgraph.governance;

import com.fasterxml.jackson.databind.JsonNode;
import io.limitgraph.model.RDPoint;
import io.limitgraph.model.RDSeries;
import io.limitgraph.model.Trace;
import io.limitgraph.model.TraceFlag;
import io.limitgraph.model.TraceFlagInfo;
import io.limitgraph.security.SensitiveDataMasker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Keyword and statistics based detector. Every flag carries the trace's creation time, so
 * the result depends only on the trace, the series and the configuration.
 */
public final class PatternAnomalyDetector implements AnomalyDetector {
    private static final Logger log = LoggerFactory.getLogger(PatternAnomalyDetector.class);

    static final int CREDENTIAL_SEVERITY = 7;
    static final int REPETITION_SEVERITY = 6;
    static final int DISTORTION_SEVERITY = 7;

    private final DetectorConfig config;

    public PatternAnomalyDetector(DetectorConfig config) {
        this.config = config;
    }

    public static PatternAnomalyDetector defaults() {
        return new PatternAnomalyDetector(DetectorConfig.defaults());
    }

    public DetectorConfig config() {
        return config;
    }

    @Override
    public List<TraceFlagInfo> detect(Trace trace, RDSeries series) {
        JsonNode payload = trace.payload();
        Instant at = trace.createdAt();
        String text = flattenText(payload).toLowerCase(Locale.ROOT);
        List<TraceFlagInfo> out = new ArrayList<>();

        for (RiskSignature signature : config.signatures()) {
            Optional<String> match = signature.firstMatch(text);
            if (match.isPresent()) {
                out.add(TraceFlagInfo.detected(
                        signature.flag(),
                        signature.reason() + " (matched '" + match.get() + "')",
                        signature.severity(),
                        at
                ));
            }
        }

        List<String> secrets = SensitiveDataMasker.findSecrets(payload);
        if (!secrets.isEmpty()) {
            out.add(TraceFlagInfo.detected(
                    TraceFlag.HIGH_RISK,
                    "credential-like values at " + String.join(", ", secrets),
                    CREDENTIAL_SEVERITY,
                    at
            ));
        }

        repetition(text).ifPresent(reason -> out.add(
                TraceFlagInfo.detected(TraceFlag.ANOMALY, reason, REPETITION_SEVERITY, at)));

        if (series != null) {
            distortionOutlier(series).ifPresent(reason -> out.add(
                    TraceFlagInfo.detected(TraceFlag.ANOMALY, reason, DISTORTION_SEVERITY, at)));
        }

        log.debug("detector trace={} flags={} textChars={}", trace.id(), out.size(), text.length());
        return List.copyOf(out);
    }

    private Optional<String> repetition(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        String[] tokens = trimmed.split("\\s+");
        if (tokens.length < config.repetitionMinTokens()) {
            return Optional.empty();
        }
        // TreeMap keeps tie-breaking stable across runs.
        Map<String, Integer> counts = new TreeMap<>();
        for (String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        String top = null;
        int topCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > topCount) {
                top = entry.getKey();
                topCount = entry.getValue();
            }
        }
        double ratio = (double) topCount / tokens.length;
        if (ratio < config.repetitionRatio()) {
            return Optional.empty();
        }
        return Optional.of(String.format(Locale.ROOT,
                "excessive repetition: token '%s' is %.0f%% of %d tokens", top, ratio * 100.0, tokens.length));
    }

    private Optional<String> distortionOutlier(RDSeries series) {
        List<RDPoint> points = series.points();
        if (points.size() < config.minSeriesPoints()) {
            return Optional.empty();
        }
        RDPoint latest = points.get(points.size() - 1);
        int n = points.size() - 1;
        double mean = 0.0;
        for (int i = 0; i < n; i++) {
            mean += points.get(i).distortion();
        }
        mean /= n;
        double var = 0.0;
        for (int i = 0; i < n; i++) {
            double d = points.get(i).distortion() - mean;
            var += d * d;
        }
        double std = Math.sqrt(var / n);
        double delta = latest.distortion() - mean;
        if (delta <= 0.0) {
            return Optional.empty();
        }
        double z = std == 0.0 ? Double.POSITIVE_INFINITY : delta / std;
        if (z < config.distortionZScore()) {
            return Optional.empty();
        }
        return Optional.of(String.format(Locale.ROOT,
                "runaway distortion at step %d: %.6f vs mean %.6f (z=%s)",
                latest.step(), latest.distortion(), mean,
                Double.isInfinite(z) ? "inf" : String.format(Locale.ROOT, "%.2f", z)));
    }

    static String flattenText(JsonNode node) {
        StringBuilder sb = new StringBuilder();
        appendText(node, sb);
        return sb.toString();
    }

    private static void appendText(JsonNode node, StringBuilder sb) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                appendText(it.next().getValue(), sb);
            }
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                appendText(child, sb);
            }
            return;
        }
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append(node.asText(""));
    }
}
