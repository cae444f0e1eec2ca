package com.devbolt.cli.command;

import com.devbolt.cli.CliContext;
import com.devbolt.cli.CliException;
import com.devbolt.cli.ParsedArguments;
import com.devbolt.cli.config.ConfigManager;
import com.devbolt.cli.output.Display;
import com.devbolt.core.exception.DevBoltException;
import com.devbolt.core.model.FlagConfig;
import com.devbolt.core.model.FlagsConfig;

import java.util.List;

/**
 * Loads the flag file exactly as the SDK would and reports what it found.
 */
public class ValidateCommand extends Command {

    public ValidateCommand() {
        super("validate", List.of(), List.of(), "Validate config file syntax");
    }

    @Override
    protected int run(ParsedArguments args, CliContext context) {
        ConfigManager manager = existingConfig(args, context);
        Display display = context.getDisplay();

        FlagsConfig config;
        try {
            config = manager.getAllFlags();
        } catch (DevBoltException e) {
            display.error("Config validation failed");
            throw new CliException(e.getMessage(), e);
        }

        int rules = config.asMap().values().stream()
                .map(FlagConfig::getTargeting)
                .mapToInt(List::size)
                .sum();
        display.success("Config file is valid");
        display.blank();
        display.line("  Flags: " + config.size());
        display.line("  Targeting Rules: " + rules);
        display.blank();
        return EXIT_OK;
    }
}
