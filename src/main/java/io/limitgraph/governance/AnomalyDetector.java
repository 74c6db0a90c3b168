package io.limitgraph.governance;

import io.limitgraph.model.RDSeries;
import io.limitgraph.model.Trace;
import io.limitgraph.model.TraceFlagInfo;

import java.util.List;

/**
 * Pure risk scan of one trace. Implementations must return the same flags for the same
 * trace, series and configuration, and must mark every flag as auto-detected.
 */
@FunctionalInterface
public interface AnomalyDetector {
    /**
     * @param series RD series associated with the trace, or {@code null} when there is none
     */
    List<TraceFlagInfo> detect(Trace trace, RDSeries series);

    static AnomalyDetector none() {
        return (trace, series) -> List.of();
    }
}
