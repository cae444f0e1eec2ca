package com.devbolt.core.evaluation;

import com.devbolt.core.model.EvaluationContext;
import com.devbolt.core.model.ScalarValue;
import com.devbolt.core.model.TargetingRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates one targeting rule against one evaluation context.
 *
 * <h3>Fail-closed</h3>
 * <p>
 * {@link #matches(TargetingRule, EvaluationContext)} never throws. An absent
 * attribute, a non-numeric operand of a numeric comparison, or an invalid
 * pattern all mean "no match". Problems are reported to the logger so that a
 * single malformed rule cannot fail the whole evaluation.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Stateless apart from a cache of compiled patterns; safe for concurrent use.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleMatcher {

    private final Logger log;

    /** Patterns come only from validated configuration, so the key set is bounded by it. */
    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    public RuleMatcher() {
        this(LoggerFactory.getLogger(RuleMatcher.class));
    }

    /**
     * @param log logger for matching diagnostics; must not be {@code null}
     */
    public RuleMatcher(Logger log) {
        this.log = Objects.requireNonNull(log, "Logger must not be null");
    }

    /**
     * @param rule    the rule to test; must not be {@code null}
     * @param context the evaluation context; must not be {@code null}
     * @return {@code true} if the rule's condition holds
     */
    public boolean matches(TargetingRule rule, EvaluationContext context) {
        Objects.requireNonNull(rule, "TargetingRule must not be null");
        Objects.requireNonNull(context, "EvaluationContext must not be null");

        Optional<ScalarValue> resolved = context.getAttribute(rule.getAttribute());
        if (resolved.isEmpty()) {
            log.trace("Attribute '{}' absent from context, rule does not match", rule.getAttribute());
            return false;
        }

        try {
            return apply(rule, resolved.get());
        } catch (RuntimeException e) {
            log.error("Error evaluating rule {}: {}", rule, e.getMessage(), e);
            return false;
        }
    }

    private boolean apply(TargetingRule rule, ScalarValue actual) {
        if (rule.getOperator().requiresValues()) {
            return applyList(rule, actual);
        }

        ScalarValue expected = rule.getValue();
        if (expected == null) {
            log.warn("Rule on '{}' with operator '{}' has no value, treating as no match",
                    rule.getAttribute(), rule.getOperator());
            return false;
        }

        return switch (rule.getOperator()) {
            case EQUALS -> actual.equals(expected);
            case NOT_EQUALS -> !actual.equals(expected);
            case CONTAINS -> lower(actual).contains(lower(expected));
            case NOT_CONTAINS -> !lower(actual).contains(lower(expected));
            case STARTS_WITH -> lower(actual).startsWith(lower(expected));
            case ENDS_WITH -> lower(actual).endsWith(lower(expected));
            case GREATER_THAN -> compare(rule, actual, expected, cmp -> cmp > 0);
            case LESS_THAN -> compare(rule, actual, expected, cmp -> cmp < 0);
            case GREATER_THAN_OR_EQUAL -> compare(rule, actual, expected, cmp -> cmp >= 0);
            case LESS_THAN_OR_EQUAL -> compare(rule, actual, expected, cmp -> cmp <= 0);
            case MATCHES_REGEX -> matchesRegex(expected.asString(), actual.asString());
            case IN, NOT_IN -> throw new IllegalStateException("List operator reached single-value branch");
        };
    }

    private boolean applyList(TargetingRule rule, ScalarValue actual) {
        List<ScalarValue> values = rule.getValues();
        if (values.isEmpty()) {
            log.warn("Rule on '{}' with operator '{}' has no values, treating as no match",
                    rule.getAttribute(), rule.getOperator());
            return false;
        }
        boolean member = values.contains(actual);
        return switch (rule.getOperator()) {
            case IN -> member;
            case NOT_IN -> !member;
            default -> throw new IllegalStateException("Single-value operator reached list branch");
        };
    }

    private boolean compare(TargetingRule rule, ScalarValue actual, ScalarValue expected, IntPredicate test) {
        Optional<BigDecimal> left = actual.asDecimal();
        Optional<BigDecimal> right = expected.asDecimal();
        if (left.isEmpty() || right.isEmpty()) {
            log.debug("Non-numeric operand for '{}' {} {}, treating as no match",
                    rule.getAttribute(), rule.getOperator(), expected);
            return false;
        }
        return test.test(left.get().compareTo(right.get()));
    }

    private boolean matchesRegex(String pattern, String input) {
        Pattern compiled = patternCache.get(pattern);
        if (compiled == null) {
            try {
                compiled = Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                log.warn("Invalid regex pattern '{}': {}", pattern, e.getDescription());
                return false;
            }
            patternCache.putIfAbsent(pattern, compiled);
        }
        // Unanchored: the pattern may match anywhere in the input
        return compiled.matcher(input).find();
    }

    private static String lower(ScalarValue value) {
        return value.asString().toLowerCase(Locale.ROOT);
    }
}
