package com.devbolt.core.config;

import com.devbolt.core.exception.ConfigParseException;
import com.devbolt.core.exception.ValidationException;
import com.devbolt.core.model.FlagsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads a {@link FlagsConfig} from a YAML document.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>SnakeYAML decodes the text into plain maps, lists and scalars
 * ({@link SafeConstructor}: no arbitrary object instantiation, duplicate
 * keys rejected).</li>
 * <li>{@link ConfigValidator} checks the tree.</li>
 * <li>{@link FlagsConfigMapper} converts it into the typed model.</li>
 * </ol>
 *
 * <h3>Errors</h3>
 * <p>
 * Unreadable sources and malformed YAML raise {@link ConfigParseException};
 * well-formed documents with a bad structure raise
 * {@link ValidationException}. Either way nothing is returned, so callers
 * never see a partially applied configuration.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigParser {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigParser.class);

    private ConfigParser() {
        // utility class: not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Parse a YAML string.
     *
     * @param content YAML text; must not be {@code null}
     * @return validated configuration; empty for an empty document
     * @throws ConfigParseException if the YAML is malformed
     * @throws ValidationException  if the document violates the data model
     */
    public static FlagsConfig parseYaml(String content) {
        Objects.requireNonNull(content, "YAML content must not be null");
        return parse(new StringReader(content));
    }

    /**
     * Parse a YAML file.
     *
     * @param path file system path; must not be {@code null}
     * @return validated configuration
     * @throws ConfigParseException if the file is missing, unreadable or
     *                              malformed
     * @throws ValidationException  if the document violates the data model
     */
    public static FlagsConfig parseFile(Path path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            FlagsConfig config = parse(reader);
            LOG.debug("Parsed {} flag(s) from {}", config.size(), path);
            return config;
        } catch (NoSuchFileException e) {
            throw new ConfigParseException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigParseException("Failed to read config file: " + path + " (" + e.getMessage() + ")", e);
        }
    }

    /**
     * Parse a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return validated configuration
     * @throws ConfigParseException if the resource does not exist or is
     *                              malformed
     * @throws ValidationException  if the document violates the data model
     */
    public static FlagsConfig parseClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ConfigParser.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new ConfigParseException("Classpath resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new ConfigParseException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static FlagsConfig parse(Reader reader) {
        Object document = loadTree(reader);

        if (document == null) {
            LOG.warn("Config document is empty, no flags defined");
            return FlagsConfig.empty();
        }
        if (!(document instanceof Map) && !(document instanceof List)) {
            throw new ValidationException("Config must be a YAML object", null, document);
        }

        return FlagsConfigMapper.toFlagsConfig(document);
    }

    private static Object loadTree(Reader reader) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));
        try {
            return yaml.load(reader);
        } catch (YAMLException e) {
            throw new ConfigParseException("Failed to parse YAML: " + e.getMessage(), e);
        }
    }
}
