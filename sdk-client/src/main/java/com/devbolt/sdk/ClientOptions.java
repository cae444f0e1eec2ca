package com.devbolt.sdk;

import com.devbolt.core.model.EvaluationContext;
import com.devbolt.core.model.EvaluationResult;
import com.devbolt.core.model.FlagsConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Typed, immutable configuration for a {@link DevBoltClient}.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder} in application code, or {@link #fromEnvironment()}
 * to let deployment settings decide the config file and reload behaviour.
 * The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ClientOptions {

    static final String ENV_CONFIG_PATH = "DEVBOLT_CONFIG_PATH";
    static final String ENV_AUTO_RELOAD = "DEVBOLT_AUTO_RELOAD";
    static final String ENV_STRICT = "DEVBOLT_STRICT";
    static final String ENV_THROW_ON_ERROR = "DEVBOLT_THROW_ON_ERROR";
    static final String ENV_POLL_INTERVAL_MS = "DEVBOLT_POLL_INTERVAL_MS";

    // ---------------------------------------------------------------
    // Config file
    // ---------------------------------------------------------------
    private final String configPath;
    private final Path baseDirectory;
    private final boolean autoReload;
    private final Duration pollInterval;
    private final Duration stabilityThreshold;

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------
    private final EvaluationContext defaultContext;
    private final boolean strict;
    private final boolean throwOnError;
    private final Map<String, Boolean> fallbacks;

    // ---------------------------------------------------------------
    // Callbacks
    // ---------------------------------------------------------------
    private final Consumer<Exception> onError;
    private final Consumer<FlagsConfig> onConfigUpdate;
    private final BiConsumer<EvaluationResult, EvaluationContext> onFlagEvaluated;

    private ClientOptions(Builder b) {
        this.configPath = b.configPath;
        this.baseDirectory = b.baseDirectory;
        this.autoReload = b.autoReload;
        this.pollInterval = b.pollInterval;
        this.stabilityThreshold = b.stabilityThreshold;
        this.defaultContext = b.defaultContext;
        this.strict = b.strict;
        this.throwOnError = b.throwOnError;
        this.fallbacks = Collections.unmodifiableMap(new LinkedHashMap<>(b.fallbacks));
        this.onError = b.onError;
        this.onConfigUpdate = b.onConfigUpdate;
        this.onFlagEvaluated = b.onFlagEvaluated;
    }

    public static ClientOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build options from environment variables, falling back to the builder
     * defaults for anything unset.
     *
     * @return options for a client that has no callbacks and no default
     *         context
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static ClientOptions fromEnvironment() {
        return fromEnvironment(System::getenv).build();
    }

    /**
     * @param env variable lookup; returns {@code null} for unset variables
     * @return a builder pre-populated from {@code env}, for callers that want
     *         to add callbacks before building
     */
    static Builder fromEnvironment(Function<String, String> env) {
        try {
            Builder builder = new Builder()
                    .autoReload(parseBoolean(env, ENV_AUTO_RELOAD, true))
                    .strict(parseBoolean(env, ENV_STRICT, false))
                    .throwOnError(parseBoolean(env, ENV_THROW_ON_ERROR, false))
                    .pollInterval(Duration.ofMillis(Long.parseLong(value(env, ENV_POLL_INTERVAL_MS, "500"))));
            String path = value(env, ENV_CONFIG_PATH, null);
            if (path != null) {
                builder.configPath(path);
            }
            return builder;
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return the explicit config path, or {@code null} to search the default
     *         locations
     */
    public String getConfigPath() {
        return configPath;
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    public boolean isAutoReload() {
        return autoReload;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getStabilityThreshold() {
        return stabilityThreshold;
    }

    public EvaluationContext getDefaultContext() {
        return defaultContext;
    }

    public boolean isStrict() {
        return strict;
    }

    public boolean isThrowOnError() {
        return throwOnError;
    }

    public Map<String, Boolean> getFallbacks() {
        return fallbacks;
    }

    /**
     * @return the error callback, or {@code null} to use the client's default
     *         handler
     */
    public Consumer<Exception> getOnError() {
        return onError;
    }

    public Consumer<FlagsConfig> getOnConfigUpdate() {
        return onConfigUpdate;
    }

    public BiConsumer<EvaluationResult, EvaluationContext> getOnFlagEvaluated() {
        return onFlagEvaluated;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ClientOptions}.
     *
     * <p>
     * {@link #build()} rejects a non-positive poll interval, a negative
     * stability threshold and a {@code null} base directory.
     * </p>
     */
    public static class Builder {
        private String configPath;
        private Path baseDirectory = Path.of("").toAbsolutePath();
        private boolean autoReload = true;
        private Duration pollInterval = Duration.ofMillis(500);
        private Duration stabilityThreshold = Duration.ofMillis(100);
        private EvaluationContext defaultContext = EvaluationContext.empty();
        private boolean strict;
        private boolean throwOnError;
        private final Map<String, Boolean> fallbacks = new LinkedHashMap<>();
        private Consumer<Exception> onError;
        private Consumer<FlagsConfig> onConfigUpdate = config -> { };
        private BiConsumer<EvaluationResult, EvaluationContext> onFlagEvaluated = (result, context) -> { };

        public Builder configPath(String v) {
            this.configPath = v;
            return this;
        }

        public Builder baseDirectory(Path v) {
            this.baseDirectory = v;
            return this;
        }

        public Builder autoReload(boolean v) {
            this.autoReload = v;
            return this;
        }

        public Builder pollInterval(Duration v) {
            this.pollInterval = v;
            return this;
        }

        public Builder stabilityThreshold(Duration v) {
            this.stabilityThreshold = v;
            return this;
        }

        public Builder defaultContext(EvaluationContext v) {
            this.defaultContext = v != null ? v : EvaluationContext.empty();
            return this;
        }

        public Builder strict(boolean v) {
            this.strict = v;
            return this;
        }

        public Builder throwOnError(boolean v) {
            this.throwOnError = v;
            return this;
        }

        public Builder fallback(String flagName, boolean enabled) {
            this.fallbacks.put(Objects.requireNonNull(flagName, "flagName required"), enabled);
            return this;
        }

        public Builder fallbacks(Map<String, Boolean> v) {
            this.fallbacks.clear();
            if (v != null) {
                v.forEach(this::fallback);
            }
            return this;
        }

        public Builder onError(Consumer<Exception> v) {
            this.onError = v;
            return this;
        }

        public Builder onConfigUpdate(Consumer<FlagsConfig> v) {
            this.onConfigUpdate = Objects.requireNonNull(v, "onConfigUpdate must not be null");
            return this;
        }

        public Builder onFlagEvaluated(BiConsumer<EvaluationResult, EvaluationContext> v) {
            this.onFlagEvaluated = Objects.requireNonNull(v, "onFlagEvaluated must not be null");
            return this;
        }

        /**
         * Build and validate the options.
         *
         * @return validated {@link ClientOptions}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ClientOptions build() {
            Objects.requireNonNull(baseDirectory, "baseDirectory required");
            Objects.requireNonNull(pollInterval, "pollInterval required");
            Objects.requireNonNull(stabilityThreshold, "stabilityThreshold required");

            if (configPath != null && configPath.isBlank()) {
                throw new IllegalArgumentException("configPath must not be blank");
            }
            if (pollInterval.isZero() || pollInterval.isNegative()) {
                throw new IllegalArgumentException("pollInterval must be positive, got: " + pollInterval);
            }
            if (stabilityThreshold.isNegative()) {
                throw new IllegalArgumentException(
                        "stabilityThreshold must not be negative, got: " + stabilityThreshold);
            }

            return new ClientOptions(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(Function<String, String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static boolean parseBoolean(Function<String, String> env, String name, boolean defaultValue) {
        String value = value(env, name, null);
        return value != null ? Boolean.parseBoolean(value) : defaultValue;
    }

    @Override
    public String toString() {
        return "ClientOptions{" +
                "configPath='" + configPath + '\'' +
                ", baseDirectory=" + baseDirectory +
                ", autoReload=" + autoReload +
                ", pollInterval=" + pollInterval +
                ", stabilityThreshold=" + stabilityThreshold +
                ", strict=" + strict +
                ", throwOnError=" + throwOnError +
                ", fallbacks=" + fallbacks +
                '}';
    }
}
