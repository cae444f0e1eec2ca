package com.devbolt.core.config;

import com.devbolt.core.model.FlagsConfig;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder of the active {@link FlagsConfig}.
 *
 * <p>
 * The configuration is replaced by swapping a single reference, never edited
 * in place. A reader that takes a {@link #snapshot()} sees either the whole
 * old configuration or the whole new one, never a mix, and no lock is taken on
 * the read path.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigStore {

    private final AtomicReference<FlagsConfig> active;

    public ConfigStore() {
        this(FlagsConfig.empty());
    }

    public ConfigStore(FlagsConfig initial) {
        this.active = new AtomicReference<>(Objects.requireNonNull(initial, "Initial config must not be null"));
    }

    /**
     * @return the configuration active at the time of the call
     */
    public FlagsConfig snapshot() {
        return active.get();
    }

    /**
     * Atomically install a new configuration.
     *
     * @param next the trusted replacement; must not be {@code null}
     * @return the configuration that was active before
     */
    public FlagsConfig replace(FlagsConfig next) {
        return active.getAndSet(Objects.requireNonNull(next, "Replacement config must not be null"));
    }
}
