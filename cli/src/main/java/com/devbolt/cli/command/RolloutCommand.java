package com.devbolt.cli.command;

import com.devbolt.cli.CliContext;
import com.devbolt.cli.ParsedArguments;
import com.devbolt.cli.config.ConfigManager;
import com.devbolt.cli.output.Display;
import com.devbolt.core.model.RolloutRule;

import java.util.List;

/**
 * Sets the rollout percentage of a flag. An existing rollout seed is kept.
 */
public class RolloutCommand extends Command {

    public RolloutCommand() {
        super("rollout", List.of(), List.of("<flag-name>", "<percentage>"), "Set rollout percentage for a flag");
    }

    @Override
    protected int run(ParsedArguments args, CliContext context) {
        String flagName = args.positional(0);
        ConfigManager manager = existingConfig(args, context);
        double percentage = parsePercentage(args.positional(1));
        requireFlag(manager, flagName);

        manager.updateFlag(flagName, f -> f.toBuilder()
                .rollout(new RolloutRule(percentage, f.getRollout() != null ? f.getRollout().getSeed() : null))
                .build());

        Display display = context.getDisplay();
        String shown = Display.percent(percentage);
        display.success("Rollout for \"" + flagName + "\" set to " + shown);
        if (percentage == 0) {
            display.info("Flag is now disabled for all users (0% rollout)");
        } else if (percentage == 100) {
            display.info("Flag is now enabled for all users (100% rollout)");
        } else {
            display.info("Approximately " + shown + " of users will see this flag enabled");
        }
        return EXIT_OK;
    }
}
