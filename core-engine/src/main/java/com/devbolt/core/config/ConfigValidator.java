package com.devbolt.core.config;

import com.devbolt.core.exception.ValidationException;
import com.devbolt.core.model.ScalarValue;
import com.devbolt.core.model.TargetingOperator;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Structural gate for raw configuration trees.
 *
 * <p>
 * A raw tree is what a YAML or JSON decoder produces: nested {@link Map}s,
 * {@link List}s and scalars. Nothing becomes a trusted
 * {@link com.devbolt.core.model.FlagsConfig} without passing
 * {@link #validate(Object)} first.
 * </p>
 *
 * <h3>Fail-fast, deterministic</h3>
 * <p>
 * The walk is depth-first in document order and stops at the first violation.
 * Each flag's name is checked before its body, and a body's fields are checked
 * in the fixed order {@code enabled}, {@code description}, {@code rollout},
 * {@code targeting}, {@code environments}, {@code metadata}, so the same
 * malformed input always yields the same error.
 * </p>
 *
 * <h3>Field paths</h3>
 * <p>
 * {@link ValidationException#getField()} uses dots for mapping keys and
 * brackets for list indexes, e.g. {@code my_flag.targeting[2].operator}.
 * Errors about the flag name itself use the path {@code flagName}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigValidator {

    public static final int MAX_FLAG_NAME_LENGTH = 100;
    public static final int MAX_DESCRIPTION_LENGTH = 500;

    private static final Pattern FLAG_NAME_PATTERN = Pattern.compile("^[a-z0-9_-]+$");

    private ConfigValidator() {
        // utility class: not instantiable
    }

    /**
     * Validate a whole configuration tree.
     *
     * @param config the decoded document
     * @throws ValidationException on the first structural violation
     */
    public static void validate(Object config) {
        if (config instanceof List) {
            throw new ValidationException("Config must be an object, not an array", null, config);
        }
        if (!(config instanceof Map<?, ?> flags)) {
            throw new ValidationException("Config must be an object", null, config);
        }

        for (Map.Entry<?, ?> entry : flags.entrySet()) {
            String flagName = validateFlagName(entry.getKey());
            validateFlagConfig(flagName, entry.getValue());
        }
    }

    /**
     * Validate a flag name on its own.
     *
     * @param name candidate name
     * @return the name as a string
     * @throws ValidationException if the name is empty, not a string, contains
     *                             characters other than {@code [a-z0-9_-]} or is
     *                             longer than {@value #MAX_FLAG_NAME_LENGTH}
     */
    public static String validateFlagName(Object name) {
        if (!(name instanceof String flagName) || flagName.isEmpty()) {
            throw new ValidationException("Flag name must be a non-empty string", "flagName", name);
        }
        if (!FLAG_NAME_PATTERN.matcher(flagName).matches()) {
            throw new ValidationException("Flag name \"" + flagName
                    + "\" must contain only lowercase letters, numbers, underscores, and hyphens",
                    "flagName", flagName);
        }
        if (flagName.length() > MAX_FLAG_NAME_LENGTH) {
            throw new ValidationException("Flag name \"" + flagName + "\" exceeds maximum length of "
                    + MAX_FLAG_NAME_LENGTH, "flagName", flagName);
        }
        return flagName;
    }

    // ---------------------------------------------------------------
    // Flag body
    // ---------------------------------------------------------------

    private static void validateFlagConfig(String flagName, Object config) {
        if (!(config instanceof Map<?, ?> flag)) {
            throw new ValidationException(prefix(flagName) + "config must be an object", flagName, config);
        }

        if (!(flag.get("enabled") instanceof Boolean)) {
            throw new ValidationException(prefix(flagName) + "'enabled' must be a boolean",
                    flagName + ".enabled", flag.get("enabled"));
        }

        if (flag.containsKey("description")) {
            validateDescription(flagName, flag.get("description"));
        }
        if (flag.containsKey("rollout")) {
            validateRollout(flagName, flag.get("rollout"));
        }
        if (flag.containsKey("targeting")) {
            validateTargeting(flagName, flag.get("targeting"));
        }
        if (flag.containsKey("environments")) {
            validateEnvironments(flagName, flag.get("environments"));
        }
        if (flag.containsKey("metadata")) {
            validateMetadata(flagName, flag.get("metadata"));
        }
    }

    private static void validateDescription(String flagName, Object description) {
        String field = flagName + ".description";
        if (!(description instanceof String text)) {
            throw new ValidationException(prefix(flagName) + "description must be a string", field, description);
        }
        if (text.length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException(prefix(flagName) + "description exceeds maximum length of "
                    + MAX_DESCRIPTION_LENGTH, field, description);
        }
    }

    private static void validateRollout(String flagName, Object rollout) {
        String field = flagName + ".rollout";
        if (!(rollout instanceof Map<?, ?> rolloutConfig)) {
            throw new ValidationException(prefix(flagName) + "rollout must be an object", field, rollout);
        }

        Object percentage = rolloutConfig.get("percentage");
        if (!(percentage instanceof Number number)) {
            throw new ValidationException(prefix(flagName) + "rollout.percentage must be a number",
                    field + ".percentage", percentage);
        }
        double value = number.doubleValue();
        if (!Double.isFinite(value)) {
            throw new ValidationException(prefix(flagName) + "rollout.percentage must be finite",
                    field + ".percentage", percentage);
        }
        if (value < 0 || value > 100) {
            throw new ValidationException(prefix(flagName) + "rollout.percentage must be between 0 and 100",
                    field + ".percentage", percentage);
        }

        if (rolloutConfig.containsKey("seed") && !(rolloutConfig.get("seed") instanceof String)) {
            throw new ValidationException(prefix(flagName) + "rollout.seed must be a string",
                    field + ".seed", rolloutConfig.get("seed"));
        }
    }

    // ---------------------------------------------------------------
    // Targeting
    // ---------------------------------------------------------------

    private static void validateTargeting(String flagName, Object targeting) {
        if (!(targeting instanceof List<?> rules)) {
            throw new ValidationException(prefix(flagName) + "targeting must be an array",
                    flagName + ".targeting", targeting);
        }
        for (int i = 0; i < rules.size(); i++) {
            validateTargetingRule(flagName, rules.get(i), i);
        }
    }

    private static void validateTargetingRule(String flagName, Object rule, int index) {
        String ruleKey = flagName + ".targeting[" + index + "]";
        String rulePrefix = prefix(flagName) + "targeting rule " + index + " ";

        if (!(rule instanceof Map<?, ?> targetingRule)) {
            throw new ValidationException(rulePrefix + "must be an object", ruleKey, rule);
        }

        Object attribute = targetingRule.get("attribute");
        if (!(attribute instanceof String name) || name.isEmpty()) {
            throw new ValidationException(rulePrefix + "attribute must be a non-empty string",
                    ruleKey + ".attribute", attribute);
        }

        Object operatorName = targetingRule.get("operator");
        Optional<TargetingOperator> parsed = operatorName instanceof String s
                ? TargetingOperator.fromWireName(s)
                : Optional.empty();
        if (parsed.isEmpty()) {
            throw new ValidationException(rulePrefix + "has invalid operator \"" + operatorName
                    + "\"; supported operators: " + String.join(", ", TargetingOperator.wireNames()),
                    ruleKey + ".operator", operatorName);
        }
        TargetingOperator operator = parsed.get();

        if (operator.requiresValues()) {
            Object values = targetingRule.get("values");
            if (!(values instanceof List<?> list) || list.isEmpty()) {
                throw new ValidationException(rulePrefix + "with operator \"" + operator
                        + "\" requires non-empty 'values' array", ruleKey + ".values", values);
            }
            for (Object value : list) {
                if (!ScalarValue.isScalar(value)) {
                    throw new ValidationException(rulePrefix + "values must be string, number, or boolean",
                            ruleKey + ".values", value);
                }
            }
        } else {
            // An empty string is a legitimate value; only absence is rejected
            if (!targetingRule.containsKey("value") || targetingRule.get("value") == null) {
                throw new ValidationException(rulePrefix + "with operator \"" + operator
                        + "\" requires 'value' field", ruleKey + ".value", null);
            }
            Object value = targetingRule.get("value");
            if (!ScalarValue.isScalar(value)) {
                throw new ValidationException(rulePrefix + "value must be string, number, or boolean",
                        ruleKey + ".value", value);
            }
        }

        if (!(targetingRule.get("enabled") instanceof Boolean)) {
            throw new ValidationException(rulePrefix + "'enabled' must be a boolean",
                    ruleKey + ".enabled", targetingRule.get("enabled"));
        }

        if (operator == TargetingOperator.MATCHES_REGEX) {
            Object pattern = targetingRule.get("value");
            try {
                Pattern.compile(ScalarValue.of(pattern).asString());
            } catch (PatternSyntaxException e) {
                throw new ValidationException(rulePrefix + "has invalid regex pattern: " + e.getDescription(),
                        ruleKey + ".value", pattern);
            }
        }

        if (targetingRule.containsKey("description") && !(targetingRule.get("description") instanceof String)) {
            throw new ValidationException(rulePrefix + "description must be a string",
                    ruleKey + ".description", targetingRule.get("description"));
        }
    }

    // ---------------------------------------------------------------
    // Environments / metadata
    // ---------------------------------------------------------------

    private static void validateEnvironments(String flagName, Object environments) {
        String field = flagName + ".environments";
        if (!(environments instanceof Map<?, ?> envs)) {
            throw new ValidationException(prefix(flagName) + "environments must be an object", field, environments);
        }
        for (Map.Entry<?, ?> entry : envs.entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw new ValidationException(prefix(flagName) + "environment names must be strings",
                        field + "." + entry.getKey(), entry.getKey());
            }
            if (!(entry.getValue() instanceof Boolean)) {
                throw new ValidationException(prefix(flagName) + "environment \"" + entry.getKey()
                        + "\" value must be a boolean", field + "." + entry.getKey(), entry.getValue());
            }
        }
    }

    private static void validateMetadata(String flagName, Object metadata) {
        if (!(metadata instanceof Map)) {
            throw new ValidationException(prefix(flagName) + "metadata must be an object",
                    flagName + ".metadata", metadata);
        }
    }

    private static String prefix(String flagName) {
        return "Flag \"" + flagName + "\": ";
    }
}
