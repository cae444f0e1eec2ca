package com.devbolt.cli.command;

import com.devbolt.cli.CliContext;
import com.devbolt.cli.Option;
import com.devbolt.cli.ParsedArguments;
import com.devbolt.cli.output.Display;
import com.devbolt.core.engine.EngineOptions;
import com.devbolt.core.engine.FlagEngine;
import com.devbolt.core.model.EvaluationContext;
import com.devbolt.core.model.EvaluationMetadata;
import com.devbolt.core.model.EvaluationResult;
import com.devbolt.core.model.FlagsConfig;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates a flag against the file on disk for a context built from the
 * options, the same way the SDK would.
 */
public class StatusCommand extends Command {

    public StatusCommand() {
        super("status", List.of(), List.of("<flag-name>"), "Check if a flag is enabled for given context",
                Option.valued("user-id", "u", "userId", "User ID"),
                Option.valued("email", "e", "email", "User email"),
                Option.valued("environment", null, "env", "Environment"),
                Option.flag("verbose", "v", "Show detailed metadata"));
    }

    @Override
    protected int run(ParsedArguments args, CliContext context) {
        String flagName = args.positional(0);
        FlagsConfig config = existingConfig(args, context).getAllFlags();
        FlagEngine engine = new FlagEngine(config, EngineOptions.builder()
                .clock(context.getClock())
                .build());

        Map<String, String> shown = new LinkedHashMap<>();
        args.value("user-id").ifPresent(v -> shown.put(EvaluationContext.USER_ID, v));
        args.value("email").ifPresent(v -> shown.put(EvaluationContext.EMAIL, v));
        args.value("environment").ifPresent(v -> shown.put(EvaluationContext.ENVIRONMENT, v));
        EvaluationContext evaluationContext = EvaluationContext.builder()
                .userId(shown.get(EvaluationContext.USER_ID))
                .email(shown.get(EvaluationContext.EMAIL))
                .environment(shown.get(EvaluationContext.ENVIRONMENT))
                .build();

        EvaluationResult result = engine.evaluate(flagName, evaluationContext);

        Display display = context.getDisplay();
        display.blank();
        display.line("Flag Evaluation");
        display.line(Display.RULE);
        display.line("Flag: " + flagName);
        display.line("Result: " + (result.isEnabled() ? "ENABLED ✓" : "DISABLED ✗"));
        display.line("Reason: " + result.getReason());

        if (!shown.isEmpty()) {
            display.blank();
            display.line("Context:");
            shown.forEach((key, value) -> display.line("  " + key + ": " + value));
        }

        if (args.has("verbose")) {
            EvaluationMetadata metadata = result.getMetadata();
            display.blank();
            display.line("Metadata:");
            if (metadata.getMatchedRuleIndex() != null) {
                display.line("  Matched Rule: #" + (metadata.getMatchedRuleIndex() + 1));
            }
            if (metadata.getRolloutBucket() != null) {
                display.line("  Rollout Bucket: " + metadata.getRolloutBucket());
            }
            display.line("  Timestamp: " + metadata.getTimestamp());
        }
        display.blank();
        return EXIT_OK;
    }
}
