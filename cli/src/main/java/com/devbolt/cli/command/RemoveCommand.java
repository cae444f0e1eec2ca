package com.devbolt.cli.command;

import com.devbolt.cli.CliContext;
import com.devbolt.cli.Option;
import com.devbolt.cli.ParsedArguments;
import com.devbolt.cli.config.ConfigManager;

import java.util.List;

public class RemoveCommand extends Command {

    public RemoveCommand() {
        super("remove", List.of("rm"), List.of("<flag-name>"), "Remove a feature flag",
                Option.flag("force", "f", "Skip confirmation prompt"));
    }

    @Override
    protected int run(ParsedArguments args, CliContext context) {
        String flagName = args.positional(0);
        ConfigManager manager = existingConfig(args, context);
        requireFlag(manager, flagName);

        if (!args.has("force") && !context.getPrompter()
                .confirm("Are you sure you want to remove flag \"" + flagName + "\"?", false)) {
            context.getDisplay().line("Removal cancelled");
            return EXIT_OK;
        }

        manager.removeFlag(flagName);
        context.getDisplay().success("Flag \"" + flagName + "\" removed");
        return EXIT_OK;
    }
}
