package com.devbolt.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable mapping from flag name to {@link FlagConfig}: the unit of
 * configuration that is loaded, validated and swapped as a whole.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * new_checkout:
 *   enabled: true
 *   rollout:
 *     percentage: 25
 * beta_banner:
 *   enabled: false
 * </pre>
 *
 * <p>
 * Insertion order is preserved for {@link #flagNames()}; lookup does not
 * depend on it.
 * </p>
 *
 * @since 1.0.0
 */
public final class FlagsConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final FlagsConfig EMPTY = new FlagsConfig(Collections.emptyMap());

    private final Map<String, FlagConfig> flags;

    private FlagsConfig(Map<String, FlagConfig> flags) {
        this.flags = flags;
    }

    /**
     * @return the configuration with no flags
     */
    public static FlagsConfig empty() {
        return EMPTY;
    }

    /**
     * Create a configuration from a map of flags. The map is copied.
     *
     * @param flags flag name to flag configuration; must not be {@code null}
     * @return immutable configuration
     * @throws NullPointerException if {@code flags} or any key/value is
     *                              {@code null}
     */
    public static FlagsConfig of(Map<String, FlagConfig> flags) {
        Objects.requireNonNull(flags, "flags must not be null");
        Map<String, FlagConfig> copy = new LinkedHashMap<>();
        flags.forEach((name, config) -> copy.put(
                Objects.requireNonNull(name, "Flag name must not be null"),
                Objects.requireNonNull(config, "Config of flag '" + name + "' must not be null")));
        return new FlagsConfig(Collections.unmodifiableMap(copy));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder, mainly for tests and programmatic configuration.
     */
    public static class Builder {
        private final Map<String, FlagConfig> flags = new LinkedHashMap<>();

        public Builder flag(String name, FlagConfig config) {
            flags.put(name, config);
            return this;
        }

        public FlagsConfig build() {
            return FlagsConfig.of(flags);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public Optional<FlagConfig> get(String flagName) {
        return Optional.ofNullable(flags.get(flagName));
    }

    public boolean contains(String flagName) {
        return flags.containsKey(flagName);
    }

    /**
     * @return unmodifiable list of flag names in insertion order
     */
    public List<String> flagNames() {
        return Collections.unmodifiableList(new ArrayList<>(flags.keySet()));
    }

    /**
     * @return unmodifiable view of the underlying map
     */
    @JsonValue
    public Map<String, FlagConfig> asMap() {
        return flags;
    }

    public int size() {
        return flags.size();
    }

    public boolean isEmpty() {
        return flags.isEmpty();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FlagsConfig that))
            return false;
        return flags.equals(that.flags);
    }

    @Override
    public int hashCode() {
        return flags.hashCode();
    }

    @Override
    public String toString() {
        return "FlagsConfig{flags=" + flags.keySet() + '}';
    }
}
