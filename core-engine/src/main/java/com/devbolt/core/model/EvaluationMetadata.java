package com.devbolt.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Diagnostic detail attached to every {@link EvaluationResult}.
 *
 * <p>
 * Only the fields relevant to the deciding branch are set: a targeting match
 * sets {@code matchedRuleIndex}, a rollout sets {@code rolloutBucket}.
 * {@code variant} is reserved and currently always {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EvaluationMetadata implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final Integer matchedRuleIndex;
    private final Integer rolloutBucket;
    private final String variant;

    private EvaluationMetadata(Instant timestamp, Integer matchedRuleIndex, Integer rolloutBucket, String variant) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.matchedRuleIndex = matchedRuleIndex;
        this.rolloutBucket = rolloutBucket;
        this.variant = variant;
    }

    public static EvaluationMetadata at(Instant timestamp) {
        return new EvaluationMetadata(timestamp, null, null, null);
    }

    /**
     * @param ruleIndex zero-based position of the matching rule
     */
    public static EvaluationMetadata matchedRule(Instant timestamp, int ruleIndex) {
        return new EvaluationMetadata(timestamp, ruleIndex, null, null);
    }

    /**
     * @param bucket the subject's rollout bucket, in {@code [0, 99]}
     */
    public static EvaluationMetadata rollout(Instant timestamp, int bucket) {
        return new EvaluationMetadata(timestamp, null, bucket, null);
    }

    /**
     * @return evaluation start time
     */
    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return zero-based index of the targeting rule that decided the result,
     *         or {@code null}
     */
    public Integer getMatchedRuleIndex() {
        return matchedRuleIndex;
    }

    /**
     * @return rollout bucket in {@code [0, 99]}, or {@code null}
     */
    public Integer getRolloutBucket() {
        return rolloutBucket;
    }

    public String getVariant() {
        return variant;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EvaluationMetadata that))
            return false;
        return timestamp.equals(that.timestamp)
                && Objects.equals(matchedRuleIndex, that.matchedRuleIndex)
                && Objects.equals(rolloutBucket, that.rolloutBucket)
                && Objects.equals(variant, that.variant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, matchedRuleIndex, rolloutBucket, variant);
    }

    @Override
    public String toString() {
        return "EvaluationMetadata{" +
                "timestamp=" + timestamp +
                ", matchedRuleIndex=" + matchedRuleIndex +
                ", rolloutBucket=" + rolloutBucket +
                '}';
    }
}
