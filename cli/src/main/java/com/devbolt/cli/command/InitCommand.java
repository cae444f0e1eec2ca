package com.devbolt.cli.command;

import com.devbolt.cli.CliContext;
import com.devbolt.cli.Option;
import com.devbolt.cli.ParsedArguments;
import com.devbolt.cli.config.ConfigManager;
import com.devbolt.cli.output.Display;
import com.devbolt.core.model.FlagConfig;
import com.devbolt.core.model.FlagsConfig;
import com.devbolt.core.model.TargetingOperator;
import com.devbolt.core.model.TargetingRule;

import java.util.List;

/**
 * Creates the flag file, optionally seeded with one example of each feature.
 */
public class InitCommand extends Command {

    static final FlagsConfig EXAMPLES = FlagsConfig.builder()
            .flag("example_feature", FlagConfig.builder()
                    .enabled(true)
                    .description("Example feature flag")
                    .build())
            .flag("gradual_rollout", FlagConfig.builder()
                    .enabled(true)
                    .description("Feature with gradual rollout")
                    .rollout(50)
                    .build())
            .flag("environment_specific", FlagConfig.builder()
                    .enabled(true)
                    .description("Environment-specific feature")
                    .environment("production", false)
                    .environment("staging", true)
                    .environment("development", true)
                    .build())
            .flag("targeted_feature", FlagConfig.builder()
                    .enabled(true)
                    .description("Feature with user targeting")
                    .targetingRule(TargetingRule.builder()
                            .attribute("email")
                            .operator(TargetingOperator.ENDS_WITH)
                            .value("@company.com")
                            .enabled(true)
                            .build())
                    .build())
            .build();

    public InitCommand() {
        super("init", List.of(), List.of(), "Initialize DevBolt in the current directory",
                Option.flag("yes", "y", "Answer every question with its default"),
                Option.flag("no-examples", null, "Start with an empty flag file"));
    }

    @Override
    protected int run(ParsedArguments args, CliContext context) {
        Display display = context.getDisplay();
        boolean yes = args.has("yes");
        ConfigManager manager = configManager(args, context);

        if (manager.exists()) {
            display.warning("DevBolt config already exists at " + manager.getConfigPath());
            if (!yes && !context.getPrompter().confirm("Do you want to overwrite it?", false)) {
                display.line("Initialization cancelled");
                return EXIT_OK;
            }
        }

        boolean examples = !args.has("no-examples");
        if (examples && !yes) {
            examples = context.getPrompter().confirm("Create example flags?", true);
        }

        manager.write(examples ? EXAMPLES : FlagsConfig.empty());
        display.success("DevBolt initialized successfully!");
        display.blank();
        display.line("Config file created at: " + manager.getConfigPath());

        if (examples) {
            display.blank();
            display.line("Example flags created:");
            display.line("  • example_feature - Simple enabled flag");
            display.line("  • gradual_rollout - 50% rollout flag");
            display.line("  • environment_specific - Environment overrides");
            display.line("  • targeted_feature - User targeting rules");
        }

        display.blank();
        display.line("Next steps:");
        display.line("  1. Run devbolt list to see your flags");
        display.line("  2. Run devbolt create <flag-name> to create a new flag");
        display.line("  3. Add the SDK: com.devbolt:sdk-client");
        return EXIT_OK;
    }
}
