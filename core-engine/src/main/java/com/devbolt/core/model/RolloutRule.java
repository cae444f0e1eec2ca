package com.devbolt.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.Objects;

/**
 * Percentage-based gradual enablement for a flag.
 *
 * <p>
 * The optional {@code seed} changes which users fall into the rollout without
 * changing the percentage; two flags sharing a seed bucket users independently
 * because the flag name is part of the hash input.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RolloutRule implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double percentage;
    private final String seed;

    /**
     * @param percentage share of users to include, in {@code [0, 100]}
     * @param seed       optional hash seed; may be {@code null}
     * @throws IllegalArgumentException if {@code percentage} is out of range
     */
    public RolloutRule(double percentage, String seed) {
        if (!Double.isFinite(percentage) || percentage < 0 || percentage > 100) {
            throw new IllegalArgumentException(
                    "Rollout percentage must be between 0 and 100, got: " + percentage);
        }
        this.percentage = percentage;
        this.seed = seed;
    }

    public static RolloutRule of(double percentage) {
        return new RolloutRule(percentage, null);
    }

    public double getPercentage() {
        return percentage;
    }

    public String getSeed() {
        return seed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RolloutRule that))
            return false;
        return Double.compare(percentage, that.percentage) == 0 && Objects.equals(seed, that.seed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(percentage, seed);
    }

    @Override
    public String toString() {
        return "RolloutRule{percentage=" + percentage + ", seed='" + seed + "'}";
    }
}
