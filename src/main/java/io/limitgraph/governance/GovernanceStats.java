package io.limitgraph.governance;

import io.limitgraph.model.TraceFlag;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of the flag table. {@code totalFlagged} counts traces with at least one flag,
 * {@code flagsByKind} counts individual flags.
 */
public record GovernanceStats(
        long totalTraces,
        long totalFlagged,
        long totalQuarantined,
        long totalAdmitted,
        long totalBlocked,
        Map<TraceFlag, Long> flagsByKind
) {
    public GovernanceStats {
        EnumMap<TraceFlag, Long> copy = new EnumMap<>(TraceFlag.class);
        if (flagsByKind != null) {
            copy.putAll(flagsByKind);
        }
        flagsByKind = Collections.unmodifiableMap(copy);
    }

    public long flagCount(TraceFlag flag) {
        return flagsByKind.getOrDefault(flag, 0L);
    }

    public Map<String, Long> asMap() {
        Map<String, Long> out = new LinkedHashMap<>();
        out.put("total_traces", totalTraces);
        out.put("total_flagged", totalFlagged);
        out.put("total_quarantined", totalQuarantined);
        out.put("total_admitted", totalAdmitted);
        out.put("total_blocked", totalBlocked);
        for (Map.Entry<TraceFlag, Long> entry : flagsByKind.entrySet()) {
            out.put("flag_" + entry.getKey().label(), entry.getValue());
        }
        return out;
    }
}
