package com.devbolt.cli.command;

import com.devbolt.cli.CliContext;
import com.devbolt.cli.Option;
import com.devbolt.cli.ParsedArguments;
import com.devbolt.cli.config.ConfigManager;
import com.devbolt.core.model.FlagConfig;

import java.util.List;

/**
 * Switches a flag globally or, with {@code --environment}, only for one
 * environment. One class serves {@code toggle}, {@code enable} and
 * {@code disable}; the latter two force the new state.
 */
public class ToggleCommand extends Command {

    private final Boolean target;

    private ToggleCommand(String name, String description, Boolean target) {
        super(name, List.of(), List.of("<flag-name>"), description,
                Option.valued("environment", null, "env", "Change only the override for this environment"));
        this.target = target;
    }

    public static ToggleCommand toggle() {
        return new ToggleCommand("toggle", "Toggle a flag on/off", null);
    }

    public static ToggleCommand enable() {
        return new ToggleCommand("enable", "Enable a flag", Boolean.TRUE);
    }

    public static ToggleCommand disable() {
        return new ToggleCommand("disable", "Disable a flag", Boolean.FALSE);
    }

    @Override
    protected int run(ParsedArguments args, CliContext context) {
        String flagName = args.positional(0);
        ConfigManager manager = existingConfig(args, context);
        FlagConfig flag = requireFlag(manager, flagName);

        if (args.has("environment")) {
            String env = args.value("environment").get();
            // toggling an environment without an override starts from the global switch
            boolean current = flag.getEnvironments().getOrDefault(env, flag.isEnabled());
            boolean next = target != null ? target : !current;
            manager.updateFlag(flagName, f -> f.toBuilder().environment(env, next).build());
            context.getDisplay().success("Flag \"" + flagName + "\" " + stateText(next)
                    + " for environment \"" + env + "\"");
        } else {
            boolean next = target != null ? target : !flag.isEnabled();
            manager.updateFlag(flagName, f -> f.toBuilder().enabled(next).build());
            context.getDisplay().success("Flag \"" + flagName + "\" " + stateText(next) + " globally");
        }
        return EXIT_OK;
    }

    private static String stateText(boolean enabled) {
        return enabled ? "enabled" : "disabled";
    }
}
