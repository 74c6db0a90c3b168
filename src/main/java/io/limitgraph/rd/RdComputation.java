package io.limitgraph.rd;

import io.limitgraph.error.InvalidConfigException;
import io.limitgraph.model.RDPoint;
import io.limitgraph.model.RDSeries;
import io.limitgraph.model.SessionId;
import io.limitgraph.model.TraceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Rate-distortion engine for one refinement run.
 *
 * <p>Pure in-memory computation. Appends must be serialized by the caller; {@link #series()}
 * returns an immutable snapshot that is safe to share once the writer is done.
 */
public final class RdComputation {
    public static final double UNBOUNDED_RATE = Double.POSITIVE_INFINITY;
    public static final int MIN_KNEE_POINTS = 3;

    private static final Logger log = LoggerFactory.getLogger(RdComputation.class);
    private static final double LN2 = Math.log(2.0);

    private final FgwConfig config;
    private final SessionId sessionId;
    private final TraceId traceId;
    private final List<RDPoint> points;

    public RdComputation(FgwConfig config) {
        this(config, null, null);
    }

    public RdComputation(FgwConfig config, SessionId sessionId, TraceId traceId) {
        this.config = config == null ? FgwConfig.defaults() : config;
        this.sessionId = sessionId;
        this.traceId = traceId;
        this.points = new ArrayList<>();
    }

    public FgwConfig config() {
        return config;
    }

    public double computeFgwDistortion(double[][] featureCost, double[][] structureCost) {
        return computeFgwDistortion(featureCost, structureCost, config.alpha());
    }

    /**
     * Combines the optimal coupling cost of a feature-space cost matrix and of a
     * structure-space cost matrix: {@code alpha * feature + (1 - alpha) * structure}.
     * Both matrices relate the same source rows to the same target columns.
     */
    public double computeFgwDistortion(double[][] featureCost, double[][] structureCost, double alpha) {
        FgwConfig.requireAlpha(alpha);
        requireCostMatrix("featureCost", featureCost);
        requireCostMatrix("structureCost", structureCost);
        if (featureCost.length != structureCost.length || featureCost[0].length != structureCost[0].length) {
            throw new InvalidConfigException("featureCost is " + featureCost.length + "x" + featureCost[0].length
                    + " but structureCost is " + structureCost.length + "x" + structureCost[0].length);
        }
        double featureTerm = alpha == 0.0 ? 0.0 : couplingCost(featureCost);
        double structureTerm = alpha == 1.0 ? 0.0 : couplingCost(structureCost);
        return alpha * featureTerm + (1.0 - alpha) * structureTerm;
    }

    /**
     * Transport cost of the entropic optimal coupling between uniform marginals, solved in
     * the log domain so small epsilon values do not underflow.
     */
    double couplingCost(double[][] cost) {
        int n = cost.length;
        int m = cost[0].length;
        double max = 0.0;
        for (double[] row : cost) {
            for (double v : row) {
                max = Math.max(max, v);
            }
        }
        if (max == 0.0) {
            return 0.0;
        }
        double eps = config.epsilon() * max;
        double logA = -Math.log(n);
        double logB = -Math.log(m);
        double[] f = new double[n];
        double[] g = new double[m];
        double[] scratchRow = new double[m];
        double[] scratchCol = new double[n];
        for (int iter = 0; iter < config.maxIter(); iter++) {
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < m; j++) {
                    scratchRow[j] = (g[j] - cost[i][j]) / eps;
                }
                f[i] = eps * (logA - logSumExp(scratchRow));
            }
            for (int j = 0; j < m; j++) {
                for (int i = 0; i < n; i++) {
                    scratchCol[i] = (f[i] - cost[i][j]) / eps;
                }
                g[j] = eps * (logB - logSumExp(scratchCol));
            }
            // Columns are exact after the g-update; rows carry the residual.
            double err = 0.0;
            for (int i = 0; i < n; i++) {
                double rowMass = 0.0;
                for (int j = 0; j < m; j++) {
                    rowMass += Math.exp((f[i] + g[j] - cost[i][j]) / eps);
                }
                err += Math.abs(rowMass - 1.0 / n);
            }
            if (err < config.tol()) {
                break;
            }
        }
        double total = 0.0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < m; j++) {
                total += Math.exp((f[i] + g[j] - cost[i][j]) / eps) * cost[i][j];
            }
        }
        return Math.max(0.0, total);
    }

    /**
     * Pairwise Euclidean distances between source and target feature vectors.
     */
    public static double[][] featureCostMatrix(double[][] sourceFeatures, double[][] targetFeatures) {
        requireRectangular("sourceFeatures", sourceFeatures);
        requireRectangular("targetFeatures", targetFeatures);
        int dim = sourceFeatures[0].length;
        if (targetFeatures[0].length != dim) {
            throw new InvalidConfigException("feature dimensions differ: " + dim + " vs " + targetFeatures[0].length);
        }
        double[][] out = new double[sourceFeatures.length][targetFeatures.length];
        for (int i = 0; i < sourceFeatures.length; i++) {
            for (int j = 0; j < targetFeatures.length; j++) {
                double sum = 0.0;
                for (int k = 0; k < dim; k++) {
                    double d = sourceFeatures[i][k] - targetFeatures[j][k];
                    sum += d * d;
                }
                out[i][j] = Math.sqrt(sum);
            }
        }
        return out;
    }

    /**
     * Linearized structure cost: node i of the source is compared to node j of the target by
     * the Euclidean distance between their sorted intra-graph distance profiles. Profiles of
     * unequal length are compared over the shorter one.
     */
    public static double[][] structureCostMatrix(double[][] sourceStructure, double[][] targetStructure) {
        requireSquare("sourceStructure", sourceStructure);
        requireSquare("targetStructure", targetStructure);
        double[][] sourceProfiles = sortedRows(sourceStructure);
        double[][] targetProfiles = sortedRows(targetStructure);
        int width = Math.min(sourceStructure.length, targetStructure.length);
        double[][] out = new double[sourceStructure.length][targetStructure.length];
        for (int i = 0; i < sourceProfiles.length; i++) {
            for (int j = 0; j < targetProfiles.length; j++) {
                double sum = 0.0;
                for (int k = 0; k < width; k++) {
                    double d = sourceProfiles[i][k] - targetProfiles[j][k];
                    sum += d * d;
                }
                out[i][j] = Math.sqrt(sum);
            }
        }
        return out;
    }

    /**
     * Shannon rate-distortion bound of a Gaussian source, in bits.
     */
    public double computeRate(double distortion, double variance) {
        if (Double.isNaN(variance) || Double.isInfinite(variance) || variance <= 0.0) {
            throw new InvalidConfigException("variance must be finite and > 0, got " + variance);
        }
        if (Double.isNaN(distortion) || Double.isInfinite(distortion) || distortion < 0.0) {
            throw new InvalidConfigException("distortion must be finite and >= 0, got " + distortion);
        }
        if (distortion == 0.0) {
            return UNBOUNDED_RATE;
        }
        return Math.max(0.0, 0.5 * Math.log(variance / distortion) / LN2);
    }

    public RDPoint addRefinementPoint(double distortion, double variance) {
        double rate = computeRate(distortion, variance);
        RDPoint point = new RDPoint(points.size(), rate, distortion);
        points.add(point);
        log.debug("rd point step={} distortion={} rate={}", point.step(), distortion, rate);
        return point;
    }

    /**
     * Appends one point per {@code {distortion, variance}} pair, in order.
     */
    public RDSeries computeRdCurve(double[][] refinementSteps) {
        if (refinementSteps == null) {
            return series();
        }
        for (double[] step : refinementSteps) {
            if (step == null || step.length != 2) {
                throw new InvalidConfigException("refinement step must be {distortion, variance}");
            }
            addRefinementPoint(step[0], step[1]);
        }
        return series();
    }

    public Optional<RDPoint> findKneePoint() {
        return findKneePoint(points);
    }

    /**
     * Interior point of maximum Menger curvature in (reward, difficulty) space. Ties go to the
     * earliest step. Fewer than three points yields no knee.
     */
    public static Optional<RDPoint> findKneePoint(List<RDPoint> curve) {
        if (curve == null || curve.size() < MIN_KNEE_POINTS) {
            return Optional.empty();
        }
        int best = -1;
        double bestCurvature = Double.NEGATIVE_INFINITY;
        for (int i = 1; i < curve.size() - 1; i++) {
            double curvature = mengerCurvature(curve.get(i - 1), curve.get(i), curve.get(i + 1));
            if (curvature > bestCurvature) {
                bestCurvature = curvature;
                best = i;
            }
        }
        return Optional.of(curve.get(best));
    }

    static double mengerCurvature(RDPoint a, RDPoint b, RDPoint c) {
        if (a.unbounded() || b.unbounded() || c.unbounded()) {
            return 0.0;
        }
        double abx = b.reward() - a.reward();
        double aby = b.difficulty() - a.difficulty();
        double acx = c.reward() - a.reward();
        double acy = c.difficulty() - a.difficulty();
        double area = 0.5 * Math.abs(abx * acy - acx * aby);
        double ab = Math.hypot(abx, aby);
        double bc = Math.hypot(c.reward() - b.reward(), c.difficulty() - b.difficulty());
        double ca = Math.hypot(acx, acy);
        double denom = ab * bc * ca;
        if (denom == 0.0) {
            return 0.0;
        }
        return 4.0 * area / denom;
    }

    public RDSeries series() {
        return new RDSeries(sessionId, traceId, points);
    }

    public int size() {
        return points.size();
    }

    /**
     * Population variance; zero for empty input.
     */
    public static double estimateVariance(double[] data) {
        if (data == null || data.length == 0) {
            return 0.0;
        }
        double mean = 0.0;
        for (double v : data) {
            mean += v;
        }
        mean /= data.length;
        double sum = 0.0;
        for (double v : data) {
            sum += (v - mean) * (v - mean);
        }
        return sum / data.length;
    }

    public static double distortionReduction(double before, double after) {
        return Math.max(0.0, before - after);
    }

    private static double logSumExp(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            max = Math.max(max, v);
        }
        if (Double.isInfinite(max)) {
            return max;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += Math.exp(v - max);
        }
        return max + Math.log(sum);
    }

    private static double[][] sortedRows(double[][] matrix) {
        double[][] out = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            out[i] = matrix[i].clone();
            Arrays.sort(out[i]);
        }
        return out;
    }

    private static void requireCostMatrix(String name, double[][] matrix) {
        requireRectangular(name, matrix);
        for (double[] row : matrix) {
            for (double v : row) {
                if (Double.isNaN(v) || Double.isInfinite(v) || v < 0.0) {
                    throw new InvalidConfigException(name + " entries must be finite and >= 0");
                }
            }
        }
    }

    private static void requireSquare(String name, double[][] matrix) {
        requireRectangular(name, matrix);
        if (matrix.length != matrix[0].length) {
            throw new InvalidConfigException(name + " must be square, got " + matrix.length + "x" + matrix[0].length);
        }
    }

    private static void requireRectangular(String name, double[][] matrix) {
        if (matrix == null || matrix.length == 0 || matrix[0] == null || matrix[0].length == 0) {
            throw new InvalidConfigException(name + " cannot be empty");
        }
        int width = matrix[0].length;
        for (double[] row : matrix) {
            if (row == null || row.length != width) {
                throw new InvalidConfigException(name + " rows must all have length " + width);
            }
        }
    }
}
