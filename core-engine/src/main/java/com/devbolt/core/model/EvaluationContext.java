package com.devbolt.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Caller-supplied facts about the subject of an evaluation.
 *
 * <p>
 * Targeting rules address {@code userId}, {@code email} and
 * {@code environment} by name; any other attribute name is looked up in
 * {@link #getCustomAttributes()}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are immutable and may be shared freely between threads. The
 * engine never modifies a context.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class EvaluationContext implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final EvaluationContext EMPTY = builder().build();

    public static final String USER_ID = "userId";
    public static final String EMAIL = "email";
    public static final String ENVIRONMENT = "environment";

    private final String userId;
    private final String email;
    private final String environment;

    /** {@code null} when never set, so merging can tell unset from empty. */
    private final Map<String, ScalarValue> customAttributes;

    /** Seed used for rollouts that declare none. Intended for tests. */
    private final String hashSeedOverride;

    private EvaluationContext(Builder builder) {
        this.userId = builder.userId;
        this.email = builder.email;
        this.environment = builder.environment;
        this.customAttributes = builder.customAttributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.customAttributes))
                : null;
        this.hashSeedOverride = builder.hashSeedOverride;
    }

    public static EvaluationContext empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link EvaluationContext}.
     */
    public static class Builder {
        private String userId;
        private String email;
        private String environment;
        private Map<String, ScalarValue> customAttributes;
        private String hashSeedOverride;

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        /**
         * Add one custom attribute.
         *
         * @param name  attribute name; must not be {@code null}
         * @param value a {@link String}, {@link Number} or {@link Boolean}
         */
        public Builder customAttribute(String name, Object value) {
            Objects.requireNonNull(name, "Attribute name must not be null");
            if (customAttributes == null) {
                customAttributes = new LinkedHashMap<>();
            }
            customAttributes.put(name, ScalarValue.of(value));
            return this;
        }

        /**
         * Replace all custom attributes.
         *
         * @param attributes attribute name to scalar value; {@code null} unsets
         */
        public Builder customAttributes(Map<String, ?> attributes) {
            if (attributes == null) {
                this.customAttributes = null;
                return this;
            }
            this.customAttributes = new LinkedHashMap<>();
            attributes.forEach(this::customAttribute);
            return this;
        }

        public Builder hashSeedOverride(String hashSeedOverride) {
            this.hashSeedOverride = hashSeedOverride;
            return this;
        }

        public EvaluationContext build() {
            return new EvaluationContext(this);
        }
    }

    // ---------------------------------------------------------------
    // Attribute resolution
    // ---------------------------------------------------------------

    /**
     * Resolve an attribute for rule matching. The fixed fields win over a
     * custom attribute of the same name.
     *
     * @param attribute the rule's attribute name
     * @return the value, or empty when the context does not carry it
     */
    public Optional<ScalarValue> getAttribute(String attribute) {
        if (USER_ID.equals(attribute)) {
            return Optional.ofNullable(userId).map(ScalarValue::ofString);
        }
        if (EMAIL.equals(attribute)) {
            return Optional.ofNullable(email).map(ScalarValue::ofString);
        }
        if (ENVIRONMENT.equals(attribute)) {
            return Optional.ofNullable(environment).map(ScalarValue::ofString);
        }
        return customAttributes != null
                ? Optional.ofNullable(customAttributes.get(attribute))
                : Optional.empty();
    }

    /**
     * Overlay this context on a set of defaults. Every field set here wins;
     * unset fields are taken from {@code defaults}. Custom attributes are
     * replaced as a whole, not merged key by key.
     *
     * @param defaults the fallback context; {@code null} means none
     * @return a new merged context
     */
    public EvaluationContext mergedOver(EvaluationContext defaults) {
        if (defaults == null || defaults == EMPTY) {
            return this;
        }
        return builder()
                .userId(userId != null ? userId : defaults.userId)
                .email(email != null ? email : defaults.email)
                .environment(environment != null ? environment : defaults.environment)
                .customAttributes(customAttributes != null ? customAttributes : defaults.customAttributes)
                .hashSeedOverride(hashSeedOverride != null ? hashSeedOverride : defaults.hashSeedOverride)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getUserId() {
        return userId;
    }

    public String getEmail() {
        return email;
    }

    public String getEnvironment() {
        return environment;
    }

    /**
     * @return unmodifiable map of custom attributes; empty if none were set
     */
    public Map<String, ScalarValue> getCustomAttributes() {
        return customAttributes != null ? customAttributes : Collections.emptyMap();
    }

    @JsonIgnore
    public String getHashSeedOverride() {
        return hashSeedOverride;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EvaluationContext that))
            return false;
        return Objects.equals(userId, that.userId)
                && Objects.equals(email, that.email)
                && Objects.equals(environment, that.environment)
                && Objects.equals(customAttributes, that.customAttributes)
                && Objects.equals(hashSeedOverride, that.hashSeedOverride);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, email, environment, customAttributes, hashSeedOverride);
    }

    @Override
    public String toString() {
        return "EvaluationContext{" +
                "userId='" + userId + '\'' +
                ", email='" + email + '\'' +
                ", environment='" + environment + '\'' +
                ", customAttributes=" + getCustomAttributes() +
                '}';
    }
}
