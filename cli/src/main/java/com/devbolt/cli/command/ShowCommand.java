package com.devbolt.cli.command;

import com.devbolt.cli.CliContext;
import com.devbolt.cli.ParsedArguments;
import com.devbolt.core.model.FlagConfig;

import java.util.List;

public class ShowCommand extends Command {

    public ShowCommand() {
        super("show", List.of(), List.of("<flag-name>"), "Show detailed information about a flag");
    }

    @Override
    protected int run(ParsedArguments args, CliContext context) {
        String flagName = args.positional(0);
        FlagConfig flag = requireFlag(existingConfig(args, context), flagName);
        context.getDisplay().flagDetail(flagName, flag);
        return EXIT_OK;
    }
}
