package com.devbolt.cli.command;

import com.devbolt.cli.CliContext;
import com.devbolt.cli.CliException;
import com.devbolt.cli.Option;
import com.devbolt.cli.ParsedArguments;
import com.devbolt.cli.config.ConfigManager;
import com.devbolt.cli.output.Display;
import com.devbolt.cli.output.Prompter;
import com.devbolt.core.config.ConfigValidator;
import com.devbolt.core.exception.ValidationException;
import com.devbolt.core.model.FlagConfig;

import java.util.List;

/**
 * Adds a new flag. Values not given as options are asked for unless
 * {@code --yes} is set, in which case the flag is enabled, has no description
 * and no rollout.
 */
public class CreateCommand extends Command {

    public CreateCommand() {
        super("create", List.of(), List.of("<flag-name>"), "Create a new feature flag",
                Option.flag("enabled", "e", "Enable the flag immediately"),
                Option.valued("description", "d", "text", "Flag description"),
                Option.valued("rollout", "r", "percentage", "Set rollout percentage (0-100)"),
                Option.flag("yes", "y", "Skip interactive prompts"));
    }

    @Override
    protected int run(ParsedArguments args, CliContext context) {
        String flagName = args.positional(0);
        try {
            ConfigValidator.validateFlagName(flagName);
        } catch (ValidationException e) {
            throw new CliException(e.getMessage(), e);
        }

        ConfigManager manager = existingConfig(args, context);
        if (manager.getFlag(flagName).isPresent()) {
            throw new CliException("Flag \"" + flagName + "\" already exists. Use \"devbolt show "
                    + flagName + "\" to view it.");
        }

        String description = args.value("description").orElse(null);
        Boolean enabled = args.has("enabled") ? Boolean.TRUE : null;
        Double rollout = args.value("rollout").map(Command::parsePercentage).orElse(null);

        if (!args.has("yes")) {
            Prompter prompter = context.getPrompter();
            if (description == null) {
                description = prompter.input("Description:", "Feature flag for " + flagName);
            }
            if (enabled == null) {
                enabled = prompter.confirm("Enable this flag?", true);
            }
            if (rollout == null && prompter.confirm("Add gradual rollout?", false)) {
                rollout = prompter.number("Rollout percentage (0-100):", 0, 0, 100);
            }
        }

        FlagConfig.Builder flag = FlagConfig.builder()
                .enabled(enabled == null || enabled)
                .description(description);
        if (rollout != null) {
            flag.rollout(rollout);
        }
        manager.setFlag(flagName, flag.build());

        Display display = context.getDisplay();
        display.success("Flag \"" + flagName + "\" created successfully!");
        if (rollout != null && rollout > 0) {
            display.line("Rollout set to " + Display.percent(rollout));
        }
        return EXIT_OK;
    }
}
