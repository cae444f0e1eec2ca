package com.devbolt.cli;

import com.devbolt.cli.command.Command;
import com.devbolt.cli.command.CreateCommand;
import com.devbolt.cli.command.InitCommand;
import com.devbolt.cli.command.ListCommand;
import com.devbolt.cli.command.RemoveCommand;
import com.devbolt.cli.command.RolloutCommand;
import com.devbolt.cli.command.ShowCommand;
import com.devbolt.cli.command.StatusCommand;
import com.devbolt.cli.command.ToggleCommand;
import com.devbolt.cli.command.ValidateCommand;
import com.devbolt.cli.output.Display;
import com.devbolt.cli.output.Prompter;
import com.devbolt.core.exception.DevBoltException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * {@code devbolt}: manage the flag file from the command line.
 *
 * <pre>
 * devbolt init
 * devbolt create new_checkout --rollout 10 --yes
 * devbolt status new_checkout --user-id user-123 --verbose
 * </pre>
 *
 * Exit status is 0 on success and 1 on any failure, with the reason printed
 * to stderr.
 *
 * @since 1.0.0
 */
public class DevBoltCli {

    private static final Logger LOG = LoggerFactory.getLogger(DevBoltCli.class);

    static final String VERSION = "1.0.0";

    private final List<Command> commands = List.of(
            new InitCommand(),
            new CreateCommand(),
            new ListCommand(),
            new ShowCommand(),
            ToggleCommand.toggle(),
            ToggleCommand.enable(),
            ToggleCommand.disable(),
            new RolloutCommand(),
            new RemoveCommand(),
            new StatusCommand(),
            new ValidateCommand());

    private final CliContext context;

    public DevBoltCli(CliContext context) {
        this.context = context;
    }

    public static void main(String[] args) {
        Display display = new Display(System.out, System.err);
        Prompter prompter = new Prompter(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
        CliContext context = new CliContext(Path.of("").toAbsolutePath(), display, prompter, Clock.systemUTC());

        System.exit(new DevBoltCli(context).run(args));
    }

    /**
     * @return the exit status
     */
    public int run(String... args) {
        Display display = context.getDisplay();
        if (args.length == 0) {
            display.line(usage());
            return Command.EXIT_FAILURE;
        }

        String name = args[0];
        if (List.of("-h", "--help", "help").contains(name)) {
            return help(args.length > 1 ? args[1] : null);
        }
        if (List.of("-V", "--version").contains(name)) {
            display.line(VERSION);
            return Command.EXIT_OK;
        }

        Optional<Command> command = find(name);
        if (command.isEmpty()) {
            display.error("Invalid command: " + String.join(" ", args));
            display.line(usage());
            return Command.EXIT_FAILURE;
        }

        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            LOG.debug("Running '{}' with {}", command.get().getName(), rest);
            return command.get().execute(rest, context);
        } catch (DevBoltException e) {
            LOG.debug("Command '{}' failed [{}]", command.get().getName(), e.getCode(), e);
            display.error(e.getMessage());
            return Command.EXIT_FAILURE;
        }
    }

    private int help(String commandName) {
        if (commandName == null) {
            context.getDisplay().line(usage());
            return Command.EXIT_OK;
        }
        Optional<Command> command = find(commandName);
        if (command.isEmpty()) {
            context.getDisplay().error("Invalid command: " + commandName);
            return Command.EXIT_FAILURE;
        }
        context.getDisplay().line(command.get().usage());
        return Command.EXIT_OK;
    }

    private Optional<Command> find(String name) {
        return commands.stream().filter(c -> c.answersTo(name)).findFirst();
    }

    String usage() {
        StringBuilder sb = new StringBuilder("DevBolt - Git-native feature flags for developers\n\n")
                .append("Usage: devbolt <command> [options]\n\nCommands:");
        for (Command command : commands) {
            sb.append(String.format("%n  %-40s %s", command.synopsis().substring("devbolt ".length()),
                    command.getDescription()));
        }
        sb.append("\n\nRun 'devbolt help <command>' for the options of a command.");
        return sb.toString();
    }
}
