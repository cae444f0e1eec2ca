package com.devbolt.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The fixed set of comparison operators a targeting rule may use.
 *
 * <p>
 * Each constant carries the name used in configuration files.
 * </p>
 *
 * @since 1.0.0
 */
public enum TargetingOperator {

    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    IN("in"),
    NOT_IN("not_in"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    GREATER_THAN_OR_EQUAL("greater_than_or_equal"),
    LESS_THAN_OR_EQUAL("less_than_or_equal"),
    MATCHES_REGEX("matches_regex");

    private static final List<String> WIRE_NAMES = Collections.unmodifiableList(
            Arrays.stream(values()).map(TargetingOperator::getWireName).toList());

    private final String wireName;

    TargetingOperator(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * @return {@code true} for operators that compare against a {@code values}
     *         list rather than a single {@code value}
     */
    public boolean requiresValues() {
        return this == IN || this == NOT_IN;
    }

    /**
     * Look up an operator by its configuration name.
     *
     * @param wireName name as written in configuration, e.g. {@code starts_with}
     * @return the operator, or empty if the name is not one of the supported set
     */
    public static Optional<TargetingOperator> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        for (TargetingOperator op : values()) {
            if (op.wireName.equals(wireName)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    /**
     * @return configuration names of all operators, in declaration order
     */
    public static List<String> wireNames() {
        return WIRE_NAMES;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
