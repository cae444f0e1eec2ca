package com.devbolt.core.engine;

import com.devbolt.core.config.ConfigParser;
import com.devbolt.core.config.ConfigStore;
import com.devbolt.core.config.ConfigValidator;
import com.devbolt.core.evaluation.FlagEvaluator;
import com.devbolt.core.exception.FlagNotFoundException;
import com.devbolt.core.model.EvaluationContext;
import com.devbolt.core.model.EvaluationResult;
import com.devbolt.core.model.FlagConfig;
import com.devbolt.core.model.FlagsConfig;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the flag engine: owns the active configuration and answers
 * evaluation requests against it.
 *
 * <h3>Unknown flags</h3>
 * <p>
 * In strict mode an unknown flag raises {@link FlagNotFoundException}.
 * Otherwise the result is disabled with reason {@code "Flag not found"} and
 * only a timestamp in its metadata.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Every operation reads a single {@link ConfigStore#snapshot() snapshot}, so
 * {@link #replaceConfig(FlagsConfig)} may run concurrently with evaluations
 * without any reader observing a mix of two configurations.
 * </p>
 *
 * @since 1.0.0
 */
public class FlagEngine {

    private final ConfigStore store;
    private final FlagEvaluator evaluator;
    private final EngineOptions options;
    private final Logger log;

    public FlagEngine(FlagsConfig config) {
        this(config, EngineOptions.defaults());
    }

    /**
     * @param config  the initial trusted configuration; must not be
     *                {@code null}
     * @param options engine options; must not be {@code null}
     */
    public FlagEngine(FlagsConfig config, EngineOptions options) {
        Objects.requireNonNull(config, "FlagsConfig must not be null");
        this.options = Objects.requireNonNull(options, "EngineOptions must not be null");
        this.log = options.getLogger();
        this.store = new ConfigStore(config);
        this.evaluator = new FlagEvaluator(log, options.getDefaultHashSeed(), options.getClock());

        log.info("FlagEngine initialized with {} flag(s), strict={}", config.size(), options.isStrict());
    }

    /**
     * Build an engine from a YAML document.
     *
     * @throws com.devbolt.core.exception.ConfigParseException if the YAML is
     *                                                         malformed
     * @throws com.devbolt.core.exception.ValidationException  if the document
     *                                                         is invalid
     */
    public static FlagEngine fromYaml(String yaml, EngineOptions options) {
        return new FlagEngine(ConfigParser.parseYaml(yaml), options);
    }

    /**
     * Build an engine from a YAML file.
     *
     * @throws com.devbolt.core.exception.ConfigParseException if the file is
     *                                                         missing or
     *                                                         malformed
     * @throws com.devbolt.core.exception.ValidationException  if the document
     *                                                         is invalid
     */
    public static FlagEngine fromFile(Path path, EngineOptions options) {
        return new FlagEngine(ConfigParser.parseFile(path), options);
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * Evaluate a flag.
     *
     * @param flagName the flag to evaluate
     * @param context  the subject; {@code null} is treated as an empty context
     * @return the decision and its reason
     * @throws FlagNotFoundException in strict mode, if the flag does not exist
     */
    public EvaluationResult evaluate(String flagName, EvaluationContext context) {
        Optional<EvaluationResult> result = evaluateIfPresent(flagName, context);
        if (result.isPresent()) {
            return result.get();
        }
        if (options.isStrict()) {
            throw new FlagNotFoundException(flagName);
        }
        log.warn("Flag \"{}\" not found, returning disabled", flagName);
        return EvaluationResult.of(flagName, false, "Flag not found", options.getClock().instant());
    }

    /**
     * Evaluate a flag if the active configuration defines it. The lookup and
     * the evaluation read the same snapshot, so a concurrent
     * {@link #replaceConfig(FlagsConfig)} cannot remove the flag in between.
     * Strict mode does not apply here.
     *
     * @param flagName the flag to evaluate
     * @param context  the subject; {@code null} is treated as an empty context
     * @return the decision, or empty if the flag does not exist
     */
    public Optional<EvaluationResult> evaluateIfPresent(String flagName, EvaluationContext context) {
        Objects.requireNonNull(flagName, "flagName must not be null");
        EvaluationContext effective = context != null ? context : EvaluationContext.empty();

        return store.snapshot().get(flagName)
                .map(flag -> evaluator.evaluate(flagName, flag, effective));
    }

    public EvaluationResult evaluate(String flagName) {
        return evaluate(flagName, EvaluationContext.empty());
    }

    /**
     * @return {@code true} if the flag evaluates to enabled
     * @throws FlagNotFoundException in strict mode, if the flag does not exist
     */
    public boolean isEnabled(String flagName, EvaluationContext context) {
        return evaluate(flagName, context).isEnabled();
    }

    public boolean isEnabled(String flagName) {
        return isEnabled(flagName, EvaluationContext.empty());
    }

    // ---------------------------------------------------------------
    // Configuration access
    // ---------------------------------------------------------------

    /**
     * @return names of all flags in the active configuration, in document
     *         order
     */
    public List<String> getAllFlagNames() {
        return store.snapshot().flagNames();
    }

    public Optional<FlagConfig> getFlagConfig(String flagName) {
        return store.snapshot().get(flagName);
    }

    /**
     * @return the active configuration; immutable
     */
    public FlagsConfig getConfig() {
        return store.snapshot();
    }

    /**
     * Atomically replace the whole configuration, e.g. after the backing file
     * changed.
     *
     * @param config the new trusted configuration; must not be {@code null}
     */
    public void replaceConfig(FlagsConfig config) {
        FlagsConfig previous = store.replace(config);
        log.info("Configuration updated: {} flag(s) (was {})", config.size(), previous.size());
    }

    /**
     * Check a raw configuration tree without installing it.
     *
     * @param rawTree decoded configuration document
     * @throws com.devbolt.core.exception.ValidationException if it is invalid
     */
    public void validate(Object rawTree) {
        ConfigValidator.validate(rawTree);
    }

    public EngineOptions getOptions() {
        return options;
    }
}
