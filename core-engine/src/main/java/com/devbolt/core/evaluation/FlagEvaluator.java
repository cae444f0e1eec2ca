package com.devbolt.core.evaluation;

import com.devbolt.core.model.EvaluationContext;
import com.devbolt.core.model.EvaluationMetadata;
import com.devbolt.core.model.EvaluationResult;
import com.devbolt.core.model.FlagConfig;
import com.devbolt.core.model.RolloutRule;
import com.devbolt.core.model.ScalarValue;
import com.devbolt.core.model.TargetingRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decision engine for a single, already-trusted flag configuration.
 *
 * <h3>Priority chain</h3>
 * <p>
 * The first applicable step decides; later steps are not consulted.
 * </p>
 * <ol>
 * <li><b>Environment override</b>: the context's environment is a key of
 * {@code environments}. Beats everything, including the kill switch.</li>
 * <li><b>Kill switch</b>: {@code enabled: false} disables the flag.</li>
 * <li><b>Targeting</b>: first matching rule, in declared order, forces its
 * {@code enabled} value.</li>
 * <li><b>Rollout</b>: the subject is in if its bucket is below the
 * percentage.</li>
 * <li><b>Default</b>: enabled.</li>
 * </ol>
 *
 * <p>
 * Evaluation is synchronous and touches no shared mutable state, so one
 * instance may serve any number of threads.
 * </p>
 *
 * @since 1.0.0
 */
public class FlagEvaluator {

    static final String ANONYMOUS = "anonymous";

    private final Logger log;
    private final RuleMatcher ruleMatcher;
    private final String defaultSeed;
    private final Clock clock;

    public FlagEvaluator() {
        this(LoggerFactory.getLogger(FlagEvaluator.class), Bucketer.DEFAULT_SEED, Clock.systemUTC());
    }

    /**
     * @param log         logger for decision diagnostics; must not be
     *                    {@code null}
     * @param defaultSeed seed for rollouts that declare none and whose context
     *                    carries no override
     * @param clock       source of evaluation timestamps
     */
    public FlagEvaluator(Logger log, String defaultSeed, Clock clock) {
        this.log = Objects.requireNonNull(log, "Logger must not be null");
        this.defaultSeed = defaultSeed;
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.ruleMatcher = new RuleMatcher(log);
    }

    /**
     * Evaluate a flag.
     *
     * @param flagName name of the flag, used in the result and as hash input
     * @param config   the flag's trusted configuration
     * @param context  subject of the evaluation; never modified
     * @return the decision and the reason for it
     */
    public EvaluationResult evaluate(String flagName, FlagConfig config, EvaluationContext context) {
        Objects.requireNonNull(flagName, "flagName must not be null");
        Objects.requireNonNull(config, "FlagConfig must not be null");
        Objects.requireNonNull(context, "EvaluationContext must not be null");

        Instant startedAt = clock.instant();
        log.debug("Evaluating flag \"{}\" for {}", flagName, context);

        // 1. Environment override
        String environment = context.getEnvironment();
        Map<String, Boolean> environments = config.getEnvironments();
        if (environment != null && environments.containsKey(environment)) {
            boolean enabled = environments.get(environment);
            log.debug("Flag \"{}\" environment override: {} = {}", flagName, environment, enabled);
            return result(flagName, enabled, "Environment override: " + environment,
                    EvaluationMetadata.at(startedAt));
        }

        // 2. Kill switch
        if (!config.isEnabled()) {
            return result(flagName, false, "Flag is disabled globally", EvaluationMetadata.at(startedAt));
        }

        // 3. Targeting rules
        List<TargetingRule> targeting = config.getTargeting();
        for (int i = 0; i < targeting.size(); i++) {
            TargetingRule rule = targeting.get(i);
            if (ruleMatcher.matches(rule, context)) {
                log.debug("Flag \"{}\" matched targeting rule #{}: {}", flagName, i + 1, rule);
                String description = rule.getDescription();
                String reason = "Matched targeting rule #" + (i + 1)
                        + (description != null && !description.isEmpty() ? ": " + description : "");
                return result(flagName, rule.isEnabled(), reason, EvaluationMetadata.matchedRule(startedAt, i));
            }
        }

        // 4. Rollout
        RolloutRule rollout = config.getRollout();
        if (rollout != null) {
            String identifier = firstNonEmpty(context.getUserId(), context.getEmail(), ANONYMOUS);
            String seed = firstNonEmpty(rollout.getSeed(), context.getHashSeedOverride(), defaultSeed);
            int bucket = Bucketer.bucket(flagName, identifier, seed);
            boolean inRollout = bucket < rollout.getPercentage();

            log.debug("Flag \"{}\" rollout evaluation: percentage={}, bucket={}, inRollout={}",
                    flagName, rollout.getPercentage(), bucket, inRollout);
            return result(flagName, inRollout,
                    "Rollout " + ScalarValue.formatNumber(rollout.getPercentage()) + "% (user bucket: " + bucket + ")",
                    EvaluationMetadata.rollout(startedAt, bucket));
        }

        // 5. Default
        return result(flagName, true, "Flag is enabled for all users", EvaluationMetadata.at(startedAt));
    }

    private EvaluationResult result(String flagName, boolean enabled, String reason, EvaluationMetadata metadata) {
        log.debug("Flag \"{}\" evaluation complete: enabled={}, reason={}", flagName, enabled, reason);
        return EvaluationResult.builder()
                .flagName(flagName)
                .enabled(enabled)
                .reason(reason)
                .metadata(metadata)
                .build();
    }

    private static String firstNonEmpty(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isEmpty()) {
                return candidate;
            }
        }
        return null;
    }
}
