package com.devbolt.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A condition-action pair: when the context attribute compares true against
 * the operand, the flag is forced to {@link #isEnabled()}.
 *
 * <p>
 * {@code in} and {@code not_in} compare against {@link #getValues()}; every
 * other operator compares against {@link #getValue()}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code attribute} and {@code operator} are
 * required; the operand shape is checked by the configuration validator, not
 * here, so programmatic callers can build rules the matcher will treat as
 * non-matching.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class TargetingRule implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String attribute;
    private final TargetingOperator operator;
    private final boolean enabled;
    private final ScalarValue value;
    private final List<ScalarValue> values;
    private final String description;

    private TargetingRule(Builder builder) {
        this.attribute = Objects.requireNonNull(builder.attribute, "attribute must not be null");
        this.operator = Objects.requireNonNull(builder.operator, "operator must not be null");
        this.enabled = builder.enabled;
        this.value = builder.value;
        this.values = Collections.unmodifiableList(new ArrayList<>(builder.values));
        this.description = builder.description;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link TargetingRule} instances.
     */
    public static class Builder {
        private String attribute;
        private TargetingOperator operator;
        private boolean enabled;
        private ScalarValue value;
        private final List<ScalarValue> values = new ArrayList<>();
        private String description;

        public Builder attribute(String attribute) {
            this.attribute = attribute;
            return this;
        }

        public Builder operator(TargetingOperator operator) {
            this.operator = operator;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        /**
         * @param value a {@link String}, {@link Number}, {@link Boolean} or
         *              {@link ScalarValue}; {@code null} clears it
         */
        public Builder value(Object value) {
            this.value = value != null ? ScalarValue.of(value) : null;
            return this;
        }

        public Builder values(List<?> values) {
            this.values.clear();
            if (values != null) {
                values.forEach(v -> this.values.add(ScalarValue.of(v)));
            }
            return this;
        }

        public Builder values(Object... values) {
            return values(List.of(values));
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /**
         * @return a new rule
         * @throws NullPointerException if {@code attribute} or {@code operator}
         *                              is {@code null}
         */
        public TargetingRule build() {
            return new TargetingRule(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getAttribute() {
        return attribute;
    }

    public TargetingOperator getOperator() {
        return operator;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @return the single operand, or {@code null} for list operators
     */
    public ScalarValue getValue() {
        return value;
    }

    /**
     * @return unmodifiable operand list; empty for single-value operators
     */
    public List<ScalarValue> getValues() {
        return values;
    }

    public String getDescription() {
        return description;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TargetingRule that))
            return false;
        return enabled == that.enabled
                && attribute.equals(that.attribute)
                && operator == that.operator
                && Objects.equals(value, that.value)
                && values.equals(that.values)
                && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attribute, operator, enabled, value, values, description);
    }

    @Override
    public String toString() {
        return "TargetingRule{" +
                "attribute='" + attribute + '\'' +
                ", operator=" + operator +
                ", value=" + value +
                ", values=" + values +
                ", enabled=" + enabled +
                '}';
    }
}
