package io.limitgraph.rd;

import io.limitgraph.error.InvalidConfigException;

/**
 * Fused Gromov-Wasserstein parameters.
 *
 * <p>{@code alpha} balances feature against structure cost. {@code epsilon} is the entropic
 * regularization relative to the largest entry of the cost matrix being solved.
 */
public record FgwConfig(
        double alpha,
        double epsilon,
        int maxIter,
        double tol
) {
    public static final double DEFAULT_ALPHA = 0.5;
    public static final double DEFAULT_EPSILON = 0.01;
    public static final int DEFAULT_MAX_ITER = 100;
    public static final double DEFAULT_TOL = 1e-6;

    public FgwConfig {
        requireAlpha(alpha);
        if (!(epsilon > 0.0) || Double.isInfinite(epsilon)) {
            throw new InvalidConfigException("epsilon must be > 0, got " + epsilon);
        }
        if (maxIter <= 0) {
            throw new InvalidConfigException("maxIter must be > 0, got " + maxIter);
        }
        if (!(tol > 0.0)) {
            throw new InvalidConfigException("tol must be > 0, got " + tol);
        }
    }

    public static FgwConfig defaults() {
        return new FgwConfig(DEFAULT_ALPHA, DEFAULT_EPSILON, DEFAULT_MAX_ITER, DEFAULT_TOL);
    }

    public FgwConfig withAlpha(double value) {
        return new FgwConfig(value, epsilon, maxIter, tol);
    }

    static void requireAlpha(double alpha) {
        if (Double.isNaN(alpha) || alpha < 0.0 || alpha > 1.0) {
            throw new InvalidConfigException("alpha must be within [0,1], got " + alpha);
        }
    }
}
