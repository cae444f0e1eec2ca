package com.devbolt.core.engine;

import com.devbolt.core.evaluation.Bucketer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Immutable options for a {@link FlagEngine}.
 *
 * <h3>Logging</h3>
 * <p>
 * By default the engine logs through SLF4J under its own class names. Pass
 * {@link org.slf4j.helpers.NOPLogger#NOP_LOGGER} to silence it completely;
 * evaluation behaves identically either way.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineOptions {

    private static final EngineOptions DEFAULTS = builder().build();

    private final boolean strict;
    private final Logger logger;
    private final String defaultHashSeed;
    private final Clock clock;

    private EngineOptions(Builder b) {
        this.strict = b.strict;
        this.logger = b.logger;
        this.defaultHashSeed = b.defaultHashSeed;
        this.clock = b.clock;
    }

    public static EngineOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return {@code true} if an unknown flag is an error rather than a
     *         disabled result
     */
    public boolean isStrict() {
        return strict;
    }

    public Logger getLogger() {
        return logger;
    }

    public String getDefaultHashSeed() {
        return defaultHashSeed;
    }

    public Clock getClock() {
        return clock;
    }

    @Override
    public String toString() {
        return "EngineOptions{strict=" + strict + ", logger=" + logger.getName()
                + ", defaultHashSeed='" + defaultHashSeed + "'}";
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link EngineOptions}.
     */
    public static class Builder {
        private boolean strict = false;
        private Logger logger = LoggerFactory.getLogger(FlagEngine.class);
        private String defaultHashSeed = Bucketer.DEFAULT_SEED;
        private Clock clock = Clock.systemUTC();

        public Builder strict(boolean v) {
            this.strict = v;
            return this;
        }

        public Builder logger(Logger v) {
            this.logger = v;
            return this;
        }

        public Builder defaultHashSeed(String v) {
            this.defaultHashSeed = v;
            return this;
        }

        public Builder clock(Clock v) {
            this.clock = v;
            return this;
        }

        /**
         * @return validated options
         * @throws NullPointerException     if the logger or clock is {@code null}
         * @throws IllegalArgumentException if the default seed is blank
         */
        public EngineOptions build() {
            Objects.requireNonNull(logger, "logger required");
            Objects.requireNonNull(clock, "clock required");
            if (defaultHashSeed == null || defaultHashSeed.isBlank()) {
                throw new IllegalArgumentException("defaultHashSeed must not be blank");
            }
            return new EngineOptions(this);
        }
    }
}
