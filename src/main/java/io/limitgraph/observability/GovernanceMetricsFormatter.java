package io.limitgraph.observability;

import io.limitgraph.governance.GovernanceStats;
import io.limitgraph.model.RDPoint;
import io.limitgraph.model.RDSeries;
import io.limitgraph.model.TraceFlag;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Prometheus text exposition of governance and RD state.
 */
public final class GovernanceMetricsFormatter {
    private GovernanceMetricsFormatter() {
    }

    public static String format(GovernanceStats stats) {
        return format(stats, null);
    }

    public static String format(GovernanceStats stats, String namespace) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "limitgraph_traces_total", "Traces known to the flag table", "namespace", namespace, stats.totalTraces());
        appendGauge(sb, "limitgraph_traces_flagged", "Traces carrying at least one flag", "namespace", namespace, stats.totalFlagged());

        Map<String, Long> byState = new LinkedHashMap<>();
        byState.put("quarantined", stats.totalQuarantined());
        byState.put("admitted", stats.totalAdmitted());
        byState.put("blocked", stats.totalBlocked());
        appendMapGauge(sb, "limitgraph_traces_by_state", "Traces grouped by governance state", "state", namespace, byState);

        Map<String, Long> byKind = new LinkedHashMap<>();
        for (TraceFlag flag : TraceFlag.values()) {
            byKind.put(flag.label(), stats.flagCount(flag));
        }
        appendMapGauge(sb, "limitgraph_flags_total", "Flags grouped by kind", "kind", namespace, byKind);
        return sb.toString();
    }

    /**
     * Series size, the latest point and the knee when one exists. Unbounded rates are
     * rendered as {@code +Inf}.
     */
    public static String formatSeries(RDSeries series, Optional<RDPoint> knee) {
        StringBuilder sb = new StringBuilder();
        String trace = series.traceId() == null ? "" : series.traceId().toString();
        appendGauge(sb, "limitgraph_rd_points", "Points in the RD series", "trace_id", trace, series.size());
        series.last().ifPresent(p -> {
            appendValue(sb, "limitgraph_rd_rate", "Rate of the latest refinement step", "trace_id", trace, p.rate());
            appendValue(sb, "limitgraph_rd_distortion", "Distortion of the latest refinement step", "trace_id", trace, p.distortion());
        });
        knee.ifPresent(p -> appendGauge(sb, "limitgraph_rd_knee_step", "Step index of the knee point", "trace_id", trace, p.step()));
        return sb.toString();
    }

    private static void appendMapGauge(
            StringBuilder sb,
            String metric,
            String help,
            String label,
            String namespace,
            Map<String, Long> values
    ) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Long> e : values.entrySet()) {
            sb.append(metric).append('{');
            if (namespace != null) {
                sb.append("namespace=\"").append(escapeLabel(namespace)).append("\",");
            }
            sb.append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        appendValue(sb, metric, help, label, labelValue, Long.toString(value));
    }

    private static void appendValue(StringBuilder sb, String metric, String help, String label, String labelValue, double value) {
        String text;
        if (Double.isInfinite(value)) {
            text = value > 0 ? "+Inf" : "-Inf";
        } else {
            text = String.format(Locale.ROOT, "%.6f", value);
        }
        appendValue(sb, metric, help, label, labelValue, text);
    }

    private static void appendValue(StringBuilder sb, String metric, String help, String label, String labelValue, String value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
