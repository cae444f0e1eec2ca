package com.devbolt.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Trusted configuration of a single feature flag.
 *
 * <p>
 * Instances are immutable: reloading configuration replaces the whole
 * {@link FlagsConfig}, it never edits a flag in place.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class FlagConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Global kill switch. */
    private final boolean enabled;

    private final String description;

    /** Last-resort percentage gate; {@code null} when absent. */
    private final RolloutRule rollout;

    /** Evaluated in declared order, first match wins. */
    private final List<TargetingRule> targeting;

    /** Environment name to forced outcome; supersedes everything else. */
    private final Map<String, Boolean> environments;

    /** Opaque, never consulted during evaluation. */
    private final Map<String, Object> metadata;

    private FlagConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.description = builder.description;
        this.rollout = builder.rollout;
        this.targeting = Collections.unmodifiableList(new ArrayList<>(builder.targeting));
        this.environments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.environments));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-filled with this configuration, for partial
     *         updates
     */
    public Builder toBuilder() {
        return builder()
                .enabled(enabled)
                .description(description)
                .rollout(rollout)
                .targeting(targeting)
                .environments(environments)
                .metadata(metadata);
    }

    /**
     * Shorthand for a flag with no rules, rollout or overrides.
     *
     * @param enabled the global switch
     * @return a new flag configuration
     */
    public static FlagConfig of(boolean enabled) {
        return builder().enabled(enabled).build();
    }

    /**
     * Fluent builder for {@link FlagConfig}.
     */
    public static class Builder {
        private boolean enabled;
        private String description;
        private RolloutRule rollout;
        private final List<TargetingRule> targeting = new ArrayList<>();
        private final Map<String, Boolean> environments = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder rollout(RolloutRule rollout) {
            this.rollout = rollout;
            return this;
        }

        public Builder rollout(double percentage) {
            return rollout(RolloutRule.of(percentage));
        }

        public Builder targetingRule(TargetingRule rule) {
            this.targeting.add(Objects.requireNonNull(rule, "rule must not be null"));
            return this;
        }

        public Builder targeting(List<TargetingRule> rules) {
            this.targeting.clear();
            if (rules != null) {
                rules.forEach(this::targetingRule);
            }
            return this;
        }

        public Builder environment(String environment, boolean enabled) {
            this.environments.put(Objects.requireNonNull(environment, "environment must not be null"), enabled);
            return this;
        }

        public Builder environments(Map<String, Boolean> environments) {
            this.environments.clear();
            if (environments != null) {
                environments.forEach((name, enabled) -> environment(name,
                        Objects.requireNonNull(enabled, "environment '" + name + "' value must not be null")));
            }
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public FlagConfig build() {
            return new FlagConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public boolean isEnabled() {
        return enabled;
    }

    public String getDescription() {
        return description;
    }

    public RolloutRule getRollout() {
        return rollout;
    }

    public List<TargetingRule> getTargeting() {
        return targeting;
    }

    public Map<String, Boolean> getEnvironments() {
        return environments;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FlagConfig that))
            return false;
        return enabled == that.enabled
                && Objects.equals(description, that.description)
                && Objects.equals(rollout, that.rollout)
                && targeting.equals(that.targeting)
                && environments.equals(that.environments)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, description, rollout, targeting, environments, metadata);
    }

    @Override
    public String toString() {
        return "FlagConfig{" +
                "enabled=" + enabled +
                ", rollout=" + rollout +
                ", targeting=" + targeting.size() + " rule(s)" +
                ", environments=" + environments +
                '}';
    }
}
