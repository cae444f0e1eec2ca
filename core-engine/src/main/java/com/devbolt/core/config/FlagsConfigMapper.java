package com.devbolt.core.config;

import com.devbolt.core.model.FlagConfig;
import com.devbolt.core.model.FlagsConfig;
import com.devbolt.core.model.RolloutRule;
import com.devbolt.core.model.TargetingOperator;
import com.devbolt.core.model.TargetingRule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a raw configuration tree into the typed model.
 *
 * <p>
 * {@link #toFlagsConfig(Object)} validates first, so the typed model is the
 * only runtime representation: there is no code path that evaluates a loosely
 * typed rollout or rule map.
 * </p>
 *
 * @since 1.0.0
 */
public final class FlagsConfigMapper {

    private FlagsConfigMapper() {
        // utility class: not instantiable
    }

    /**
     * Validate and convert a raw tree.
     *
     * @param rawTree the decoded document
     * @return the trusted configuration
     * @throws com.devbolt.core.exception.ValidationException if the tree is
     *                                                        invalid
     */
    public static FlagsConfig toFlagsConfig(Object rawTree) {
        ConfigValidator.validate(rawTree);

        Map<?, ?> raw = (Map<?, ?>) rawTree;
        Map<String, FlagConfig> flags = new LinkedHashMap<>();
        raw.forEach((name, body) -> flags.put((String) name, toFlagConfig((Map<?, ?>) body)));
        return FlagsConfig.of(flags);
    }

    private static FlagConfig toFlagConfig(Map<?, ?> flag) {
        FlagConfig.Builder builder = FlagConfig.builder()
                .enabled((Boolean) flag.get("enabled"))
                .description((String) flag.get("description"));

        if (flag.get("rollout") instanceof Map<?, ?> rollout) {
            builder.rollout(new RolloutRule(
                    ((Number) rollout.get("percentage")).doubleValue(),
                    (String) rollout.get("seed")));
        }

        if (flag.get("targeting") instanceof List<?> rules) {
            for (Object rule : rules) {
                builder.targetingRule(toTargetingRule((Map<?, ?>) rule));
            }
        }

        if (flag.get("environments") instanceof Map<?, ?> environments) {
            environments.forEach((env, enabled) -> builder.environment((String) env, (Boolean) enabled));
        }

        if (flag.get("metadata") instanceof Map<?, ?> metadata) {
            Map<String, Object> copy = new LinkedHashMap<>();
            metadata.forEach((key, value) -> copy.put(String.valueOf(key), value));
            builder.metadata(copy);
        }

        return builder.build();
    }

    private static TargetingRule toTargetingRule(Map<?, ?> rule) {
        TargetingOperator operator = TargetingOperator.fromWireName((String) rule.get("operator"))
                .orElseThrow(() -> new IllegalStateException("Operator passed validation but is unknown"));

        TargetingRule.Builder builder = TargetingRule.builder()
                .attribute((String) rule.get("attribute"))
                .operator(operator)
                .enabled((Boolean) rule.get("enabled"))
                .description((String) rule.get("description"));

        if (operator.requiresValues()) {
            builder.values((List<?>) rule.get("values"));
        } else {
            builder.value(rule.get("value"));
        }
        return builder.build();
    }
}
