package com.devbolt.cli.command;

import com.devbolt.cli.CliContext;
import com.devbolt.cli.CliException;
import com.devbolt.cli.Option;
import com.devbolt.cli.ParsedArguments;
import com.devbolt.cli.config.ConfigManager;
import com.devbolt.core.model.FlagConfig;
import com.devbolt.core.model.FlagsConfig;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prints all flags as a table, JSON or YAML. {@code --environment} keeps only
 * flags that override that environment.
 */
public class ListCommand extends Command {

    public ListCommand() {
        super("list", List.of("ls"), List.of(), "List all feature flags",
                Option.valued("environment", null, "env", "Only flags with an override for this environment"),
                Option.valued("format", null, "format", "Output format: table, json or yaml (default: table)"));
    }

    @Override
    protected int run(ParsedArguments args, CliContext context) {
        String format = args.value("format").orElse("table");
        if (!List.of("table", "json", "yaml").contains(format)) {
            throw new CliException("Unknown format '" + format + "' (expected table, json or yaml)");
        }

        FlagsConfig flags = existingConfig(args, context).getAllFlags();
        if (args.has("environment")) {
            String env = args.value("environment").get();
            Map<String, FlagConfig> filtered = new LinkedHashMap<>();
            flags.asMap().forEach((name, flag) -> {
                if (flag.getEnvironments().containsKey(env)) {
                    filtered.put(name, flag);
                }
            });
            flags = FlagsConfig.of(filtered);
        }

        switch (format) {
            case "json" -> context.getDisplay().json(ConfigManager.toTree(flags));
            case "yaml" -> context.getDisplay().yaml(ConfigManager.toTree(flags));
            default -> context.getDisplay().flagTable(flags);
        }
        return EXIT_OK;
    }
}
