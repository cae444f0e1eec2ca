package com.devbolt.cli.command;

import com.devbolt.cli.CliContext;
import com.devbolt.cli.CliException;
import com.devbolt.cli.Option;
import com.devbolt.cli.ParsedArguments;
import com.devbolt.cli.config.ConfigManager;
import com.devbolt.core.model.FlagConfig;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Base class of every CLI command.
 *
 * <p>
 * Subclasses declare their name, positional arguments and options; this class
 * parses the arguments, checks their count and adds the {@code --config} and
 * {@code --help} options every command shares. Failures are reported by
 * throwing {@link CliException}.
 * </p>
 */
public abstract class Command {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    static final String NO_CONFIG = "Config file not found. Run \"devbolt init\" first.";

    private static final Option CONFIG = Option.valued("config", null, "path",
            "Flag file to use (default: " + ConfigManager.DEFAULT_CONFIG_PATH + ")");
    private static final Option HELP = Option.flag("help", "h", "Show help for this command");

    private final String name;
    private final List<String> aliases;
    private final List<String> arguments;
    private final String description;
    private final List<Option> options;

    protected Command(String name, List<String> aliases, List<String> arguments, String description,
            Option... options) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.aliases = List.copyOf(aliases);
        this.arguments = List.copyOf(arguments);
        this.description = description;
        List<Option> all = new ArrayList<>(Arrays.asList(options));
        all.add(CONFIG);
        all.add(HELP);
        this.options = Collections.unmodifiableList(all);
    }

    /**
     * Parse {@code tokens} and run the command.
     *
     * @param tokens the arguments after the command name
     * @return the process exit status
     * @throws CliException on bad usage or a failed operation
     */
    public final int execute(List<String> tokens, CliContext context) {
        ParsedArguments args = ParsedArguments.parse(tokens, options);
        if (args.has(HELP.getLongName())) {
            context.getDisplay().line(usage());
            return EXIT_OK;
        }
        int given = args.getPositionals().size();
        if (given != arguments.size()) {
            throw new CliException((given < arguments.size() ? "Missing argument " + arguments.get(given)
                    : "Unexpected argument '" + args.positional(arguments.size()) + "'")
                    + "\nUsage: " + synopsis());
        }
        return run(args, context);
    }

    protected abstract int run(ParsedArguments args, CliContext context);

    // ---------------------------------------------------------------
    // Shared helpers
    // ---------------------------------------------------------------

    /**
     * @return a manager for {@code --config}, resolved against the working
     *         directory, or for the default location
     */
    protected ConfigManager configManager(ParsedArguments args, CliContext context) {
        String path = args.value(CONFIG.getLongName()).orElse(ConfigManager.DEFAULT_CONFIG_PATH);
        return new ConfigManager(context.getWorkingDirectory().resolve(path));
    }

    /**
     * Like {@link #configManager(ParsedArguments, CliContext)} but fails when
     * the file does not exist yet.
     */
    protected ConfigManager existingConfig(ParsedArguments args, CliContext context) {
        ConfigManager manager = configManager(args, context);
        if (!manager.exists()) {
            throw new CliException(NO_CONFIG);
        }
        return manager;
    }

    protected static FlagConfig requireFlag(ConfigManager manager, String flagName) {
        return manager.getFlag(flagName)
                .orElseThrow(() -> new CliException("Flag \"" + flagName + "\" not found"));
    }

    /**
     * @throws CliException unless {@code text} is a number in [0, 100]
     */
    protected static double parsePercentage(String text) {
        OptionalDouble parsed;
        try {
            parsed = OptionalDouble.of(Double.parseDouble(text.trim()));
        } catch (NumberFormatException e) {
            parsed = OptionalDouble.empty();
        }
        if (parsed.isEmpty() || Double.isNaN(parsed.getAsDouble())) {
            throw new CliException("Percentage must be a number, got '" + text + "'");
        }
        double value = parsed.getAsDouble();
        if (value < 0 || value > 100) {
            throw new CliException("Percentage must be between 0 and 100");
        }
        return value;
    }

    // ---------------------------------------------------------------
    // Help
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public String getDescription() {
        return description;
    }

    public boolean answersTo(String token) {
        return name.equals(token) || aliases.contains(token);
    }

    /**
     * @return e.g. {@code devbolt rollout <flag-name> <percentage> [options]}
     */
    public String synopsis() {
        StringBuilder sb = new StringBuilder("devbolt ").append(name);
        arguments.forEach(a -> sb.append(' ').append(a));
        return sb.append(" [options]").toString();
    }

    public String usage() {
        StringBuilder sb = new StringBuilder("Usage: ").append(synopsis()).append("\n\n").append(description);
        if (!aliases.isEmpty()) {
            sb.append("\nAliases: ").append(String.join(", ", aliases));
        }
        sb.append("\n\nOptions:");
        for (Option option : options) {
            sb.append(String.format("%n  %-32s %s", option.synopsis(), option.getDescription()));
        }
        return sb.toString();
    }
}
