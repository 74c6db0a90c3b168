package io.limitgraph.governance;

import io.limitgraph.error.InvalidConfigException;

import java.util.List;

/**
 * Tuning of {@link PatternAnomalyDetector}.
 *
 * <p>Repetition fires when a payload has at least {@code repetitionMinTokens} tokens and its
 * most frequent token makes up at least {@code repetitionRatio} of them. The distortion check
 * compares the latest point of a series of at least {@code minSeriesPoints} points against
 * the points before it.
 */
public record DetectorConfig(
        List<RiskSignature> signatures,
        int repetitionMinTokens,
        double repetitionRatio,
        double distortionZScore,
        int minSeriesPoints
) {
    public static final int DEFAULT_REPETITION_MIN_TOKENS = 20;
    public static final double DEFAULT_REPETITION_RATIO = 0.5;
    public static final double DEFAULT_DISTORTION_Z_SCORE = 2.5;
    public static final int DEFAULT_MIN_SERIES_POINTS = 5;

    public DetectorConfig {
        signatures = signatures == null ? List.of() : List.copyOf(signatures);
        if (repetitionMinTokens < 2) {
            throw new InvalidConfigException("repetitionMinTokens must be >= 2, got " + repetitionMinTokens);
        }
        if (!(repetitionRatio > 0.0 && repetitionRatio <= 1.0)) {
            throw new InvalidConfigException("repetitionRatio must be within (0,1], got " + repetitionRatio);
        }
        if (!(distortionZScore > 0.0) || Double.isInfinite(distortionZScore)) {
            throw new InvalidConfigException("distortionZScore must be > 0, got " + distortionZScore);
        }
        if (minSeriesPoints < 3) {
            throw new InvalidConfigException("minSeriesPoints must be >= 3, got " + minSeriesPoints);
        }
    }

    public static DetectorConfig defaults() {
        return new DetectorConfig(
                RiskSignature.defaults(),
                DEFAULT_REPETITION_MIN_TOKENS,
                DEFAULT_REPETITION_RATIO,
                DEFAULT_DISTORTION_Z_SCORE,
                DEFAULT_MIN_SERIES_POINTS
        );
    }
}
