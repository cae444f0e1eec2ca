package com.devbolt.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of evaluating one flag for one context.
 *
 * <p>
 * {@code reason} is a human-readable explanation that names the deciding
 * branch (environment override, kill switch, targeting rule, rollout or
 * default), which makes every decision auditable.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code flagName}, {@code reason} and
 * {@code metadata} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class EvaluationResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String flagName;
    private final boolean enabled;
    private final String reason;
    private final EvaluationMetadata metadata;

    private EvaluationResult(Builder builder) {
        this.flagName = Objects.requireNonNull(builder.flagName, "flagName must not be null");
        this.enabled = builder.enabled;
        this.reason = Objects.requireNonNull(builder.reason, "reason must not be null");
        this.metadata = Objects.requireNonNull(builder.metadata, "metadata must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for results that carry only a timestamp, such as fallbacks.
     */
    public static EvaluationResult of(String flagName, boolean enabled, String reason, Instant timestamp) {
        return builder()
                .flagName(flagName)
                .enabled(enabled)
                .reason(reason)
                .metadata(EvaluationMetadata.at(timestamp))
                .build();
    }

    /**
     * Fluent builder for {@link EvaluationResult} instances.
     */
    public static class Builder {
        private String flagName;
        private boolean enabled;
        private String reason;
        private EvaluationMetadata metadata;

        public Builder flagName(String flagName) {
            this.flagName = flagName;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder metadata(EvaluationMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public EvaluationResult build() {
            return new EvaluationResult(this);
        }
    }

    public String getFlagName() {
        return flagName;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getReason() {
        return reason;
    }

    public EvaluationMetadata getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EvaluationResult that))
            return false;
        return enabled == that.enabled
                && flagName.equals(that.flagName)
                && reason.equals(that.reason)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(flagName, enabled, reason, metadata);
    }

    @Override
    public String toString() {
        return "EvaluationResult{" +
                "flagName='" + flagName + '\'' +
                ", enabled=" + enabled +
                ", reason='" + reason + '\'' +
                ", metadata=" + metadata +
                '}';
    }
}
