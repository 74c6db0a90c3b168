package io.limitgraph.model;

import io.limitgraph.error.InvalidConfigException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered refinement curve of one computation run. Step indices are strictly increasing;
 * {@link #append(RDPoint)} returns a new series and never mutates this one.
 */
public record RDSeries(
        SessionId sessionId,
        TraceId traceId,
        List<RDPoint> points
) {
    public RDSeries {
        points = points == null ? List.of() : List.copyOf(points);
        for (int i = 1; i < points.size(); i++) {
            if (points.get(i).step() <= points.get(i - 1).step()) {
                throw new InvalidConfigException("RD series steps must be strictly increasing at index " + i);
            }
        }
    }

    public static RDSeries empty(SessionId sessionId, TraceId traceId) {
        return new RDSeries(sessionId, traceId, List.of());
    }

    public RDSeries append(RDPoint point) {
        List<RDPoint> next = new ArrayList<>(points.size() + 1);
        next.addAll(points);
        next.add(point);
        return new RDSeries(sessionId, traceId, next);
    }

    public int size() {
        return points.size();
    }

    public Optional<RDPoint> last() {
        return points.isEmpty() ? Optional.empty() : Optional.of(points.get(points.size() - 1));
    }

    public int nextStep() {
        return last().map(p -> p.step() + 1).orElse(0);
    }
}
