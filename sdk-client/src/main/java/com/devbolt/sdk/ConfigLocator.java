package com.devbolt.sdk;

import com.devbolt.core.exception.ConfigParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Finds the flags file a client should load.
 *
 * <p>
 * An explicit path is resolved against the base directory and must exist.
 * Without one, {@link #DEFAULT_LOCATIONS} are tried in order and the first
 * existing regular file wins.
 * </p>
 */
public final class ConfigLocator {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLocator.class);

    public static final List<String> DEFAULT_LOCATIONS = List.of(
            ".devbolt/flags.yml",
            ".devbolt/flags.yaml",
            "devbolt.yml",
            "devbolt.yaml",
            ".devbolt.yml",
            ".devbolt.yaml");

    private ConfigLocator() {
        // utility class: not instantiable
    }

    /**
     * @param configPath    explicit path, absolute or relative to
     *                      {@code baseDirectory}; {@code null} to search
     * @param baseDirectory directory relative paths are resolved against
     * @return absolute, normalized path of an existing file
     * @throws ConfigParseException if no config file can be found
     */
    public static Path locate(String configPath, Path baseDirectory) {
        Objects.requireNonNull(baseDirectory, "baseDirectory must not be null");

        if (configPath != null) {
            Path resolved = baseDirectory.resolve(configPath).toAbsolutePath().normalize();
            if (!Files.isRegularFile(resolved)) {
                throw new ConfigParseException("Config file not found: " + resolved);
            }
            LOG.debug("Using explicit config path {}", resolved);
            return resolved;
        }

        for (String candidate : DEFAULT_LOCATIONS) {
            Path resolved = baseDirectory.resolve(candidate).toAbsolutePath().normalize();
            if (Files.isRegularFile(resolved)) {
                LOG.debug("Found config file at {}", resolved);
                return resolved;
            }
        }

        String searched = DEFAULT_LOCATIONS.stream()
                .map(candidate -> "  - " + baseDirectory.resolve(candidate).toAbsolutePath().normalize())
                .collect(Collectors.joining("\n"));
        throw new ConfigParseException("No DevBolt config file found. Searched:\n" + searched);
    }
}
