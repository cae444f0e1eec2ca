package com.devbolt.cli.config;

import com.devbolt.cli.CliException;
import com.devbolt.core.config.ConfigParser;
import com.devbolt.core.config.ConfigValidator;
import com.devbolt.core.exception.ValidationException;
import com.devbolt.core.model.FlagConfig;
import com.devbolt.core.model.FlagsConfig;
import com.devbolt.core.model.RolloutRule;
import com.devbolt.core.model.ScalarValue;
import com.devbolt.core.model.TargetingRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Reads and rewrites a flag file on behalf of the CLI commands.
 *
 * <h3>Reading</h3>
 * <p>
 * Goes through {@link ConfigParser}, so the CLI sees exactly what the engine
 * and the SDK would load.
 * </p>
 *
 * <h3>Writing</h3>
 * <p>
 * The model is turned back into plain maps with keys in a fixed order
 * ({@code enabled}, {@code description}, {@code rollout}, {@code targeting},
 * {@code environments}, {@code metadata}), checked by
 * {@link ConfigValidator} and dumped as block-style YAML. A document that
 * would not load again is never written. The file is replaced through a
 * temporary sibling so that a watching SDK never reads half a document.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigManager {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigManager.class);

    /** Location of the flag file relative to the project root. */
    public static final String DEFAULT_CONFIG_PATH = ".devbolt/flags.yml";

    private final Path configPath;

    public ConfigManager(Path configPath) {
        this.configPath = Objects.requireNonNull(configPath, "configPath must not be null");
    }

    public Path getConfigPath() {
        return configPath;
    }

    public boolean exists() {
        return Files.isRegularFile(configPath);
    }

    /**
     * @return the parsed and validated configuration
     * @throws CliException if the file is missing or invalid
     */
    public FlagsConfig read() {
        if (!exists()) {
            throw new CliException("Config file not found: " + configPath);
        }
        try {
            return ConfigParser.parseFile(configPath);
        } catch (ValidationException e) {
            throw new CliException("Invalid config: " + e.getMessage(), e);
        }
    }

    /**
     * Replace the whole file, creating parent directories as needed.
     *
     * @throws CliException if the configuration is invalid or the file
     *                      cannot be written
     */
    public void write(FlagsConfig config) {
        Map<String, Object> tree = toTree(config);
        try {
            ConfigValidator.validate(tree);
        } catch (ValidationException e) {
            throw new CliException("Refusing to write invalid config: " + e.getMessage(), e);
        }

        String yaml = toYaml(tree);
        try {
            Path dir = configPath.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, ".flags", ".tmp");
            try {
                Files.writeString(tmp, yaml, StandardCharsets.UTF_8);
                Files.move(tmp, configPath, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new CliException("Failed to write config file: " + configPath + " (" + e.getMessage() + ")", e);
        }
        LOG.debug("Wrote {} flag(s) to {}", config.size(), configPath);
    }

    /**
     * Add or replace one flag. A missing file is treated as empty.
     */
    public void setFlag(String flagName, FlagConfig flag) {
        FlagsConfig current = exists() ? read() : FlagsConfig.empty();
        Map<String, FlagConfig> flags = new LinkedHashMap<>(current.asMap());
        flags.put(flagName, flag);
        write(FlagsConfig.of(flags));
    }

    /**
     * Rewrite one existing flag, keeping its position in the file.
     *
     * @param update receives the current configuration, returns the new one
     * @return the new configuration
     * @throws CliException if the flag does not exist
     */
    public FlagConfig updateFlag(String flagName, UnaryOperator<FlagConfig> update) {
        FlagsConfig current = read();
        FlagConfig existing = current.get(flagName)
                .orElseThrow(() -> new CliException("Flag \"" + flagName + "\" not found"));
        FlagConfig updated = Objects.requireNonNull(update.apply(existing), "updated flag must not be null");

        Map<String, FlagConfig> flags = new LinkedHashMap<>(current.asMap());
        flags.put(flagName, updated);
        write(FlagsConfig.of(flags));
        return updated;
    }

    /**
     * @throws CliException if the flag does not exist
     */
    public void removeFlag(String flagName) {
        FlagsConfig current = read();
        if (!current.contains(flagName)) {
            throw new CliException("Flag \"" + flagName + "\" not found");
        }
        Map<String, FlagConfig> flags = new LinkedHashMap<>(current.asMap());
        flags.remove(flagName);
        write(FlagsConfig.of(flags));
    }

    public Optional<FlagConfig> getFlag(String flagName) {
        return read().get(flagName);
    }

    public FlagsConfig getAllFlags() {
        return read();
    }

    // ---------------------------------------------------------------
    // Plain tree conversion
    // ---------------------------------------------------------------

    /**
     * @return the configuration as nested maps, lists and scalars, in file
     *         order
     */
    public static Map<String, Object> toTree(FlagsConfig config) {
        Map<String, Object> tree = new LinkedHashMap<>();
        config.asMap().forEach((name, flag) -> tree.put(name, toTree(flag)));
        return tree;
    }

    public static Map<String, Object> toTree(FlagConfig flag) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("enabled", flag.isEnabled());
        if (flag.getDescription() != null && !flag.getDescription().isEmpty()) {
            node.put("description", flag.getDescription());
        }

        RolloutRule rollout = flag.getRollout();
        if (rollout != null) {
            Map<String, Object> rolloutNode = new LinkedHashMap<>();
            rolloutNode.put("percentage", ScalarValue.of(rollout.getPercentage()).toRaw());
            if (rollout.getSeed() != null) {
                rolloutNode.put("seed", rollout.getSeed());
            }
            node.put("rollout", rolloutNode);
        }

        if (!flag.getTargeting().isEmpty()) {
            node.put("targeting", flag.getTargeting().stream()
                    .map(ConfigManager::ruleTree)
                    .collect(Collectors.toList()));
        }
        if (!flag.getEnvironments().isEmpty()) {
            node.put("environments", new LinkedHashMap<>(flag.getEnvironments()));
        }
        if (!flag.getMetadata().isEmpty()) {
            node.put("metadata", new LinkedHashMap<>(flag.getMetadata()));
        }
        return node;
    }

    private static Map<String, Object> ruleTree(TargetingRule rule) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("attribute", rule.getAttribute());
        node.put("operator", rule.getOperator().getWireName());
        if (rule.getOperator().requiresValues()) {
            List<Object> values = rule.getValues().stream()
                    .map(ScalarValue::toRaw)
                    .collect(Collectors.toList());
            node.put("values", values);
        } else if (rule.getValue() != null) {
            node.put("value", rule.getValue().toRaw());
        }
        node.put("enabled", rule.isEnabled());
        if (rule.getDescription() != null && !rule.getDescription().isEmpty()) {
            node.put("description", rule.getDescription());
        }
        return node;
    }

    /**
     * @return block-style YAML for a plain tree
     */
    public static String toYaml(Object tree) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        options.setWidth(120);
        return new Yaml(options).dump(tree);
    }
}
