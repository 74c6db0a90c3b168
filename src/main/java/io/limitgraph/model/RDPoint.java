package io.limitgraph.model;

import io.limitgraph.error.InvalidConfigException;

/**
 * One observation on the reward/difficulty curve: reward is the rate, difficulty the
 * distortion. An unbounded rate is stored as positive infinity.
 */
public record RDPoint(
        int step,
        double reward,
        double difficulty
) {
    public RDPoint {
        if (step < 0) {
            throw new InvalidConfigException("step must be >= 0, got " + step);
        }
        if (Double.isNaN(reward) || reward < 0.0) {
            throw new InvalidConfigException("reward must be >= 0, got " + reward);
        }
        if (Double.isNaN(difficulty) || Double.isInfinite(difficulty) || difficulty < 0.0) {
            throw new InvalidConfigException("difficulty must be finite and >= 0, got " + difficulty);
        }
    }

    public double rate() {
        return reward;
    }

    public double distortion() {
        return difficulty;
    }

    public boolean unbounded() {
        return Double.isInfinite(reward);
    }
}
