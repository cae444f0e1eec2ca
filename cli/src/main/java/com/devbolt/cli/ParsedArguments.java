package com.devbolt.cli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The arguments of one command invocation, split into positionals and
 * options.
 *
 * <h3>Syntax</h3>
 * <ul>
 * <li>{@code --name value}, {@code --name=value} and {@code -n value} for
 * options that take a value</li>
 * <li>{@code --name} and {@code -n} for switches</li>
 * <li>{@code --} ends option parsing; everything after it is positional</li>
 * <li>tokens that look like negative numbers ({@code -5}) are positional</li>
 * </ul>
 * A repeated option keeps its last value.
 */
public final class ParsedArguments {

    private static final Pattern NEGATIVE_NUMBER = Pattern.compile("-\\d.*");

    private final List<String> positionals;
    private final Map<String, String> options;

    private ParsedArguments(List<String> positionals, Map<String, String> options) {
        this.positionals = Collections.unmodifiableList(positionals);
        this.options = Collections.unmodifiableMap(options);
    }

    /**
     * @param tokens  the raw arguments after the command name
     * @param allowed the options the command understands
     * @return the parsed arguments
     * @throws CliException on an unknown option or a missing option value
     */
    public static ParsedArguments parse(List<String> tokens, List<Option> allowed) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        List<String> positionals = new ArrayList<>();
        Map<String, String> options = new LinkedHashMap<>();

        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (token.equals("--")) {
                positionals.addAll(tokens.subList(i + 1, tokens.size()));
                break;
            }
            if (!token.startsWith("-") || token.equals("-") || NEGATIVE_NUMBER.matcher(token).matches()) {
                positionals.add(token);
                continue;
            }

            String name = token;
            String inlineValue = null;
            int eq = token.indexOf('=');
            if (token.startsWith("--") && eq > 0) {
                name = token.substring(0, eq);
                inlineValue = token.substring(eq + 1);
            }

            Option option = find(name, allowed);
            if (!option.takesValue()) {
                if (inlineValue != null) {
                    throw new CliException("Option '" + option + "' does not take a value");
                }
                options.put(option.getLongName(), "true");
            } else if (inlineValue != null) {
                options.put(option.getLongName(), inlineValue);
            } else if (i + 1 < tokens.size()) {
                options.put(option.getLongName(), tokens.get(++i));
            } else {
                throw new CliException("Option '" + option + "' requires a value");
            }
        }
        return new ParsedArguments(positionals, options);
    }

    private static Option find(String token, List<Option> allowed) {
        for (Option option : allowed) {
            if (token.equals("--" + option.getLongName())
                    || (option.getShortName() != null && token.equals("-" + option.getShortName()))) {
                return option;
            }
        }
        throw new CliException("Unknown option: " + token);
    }

    public List<String> getPositionals() {
        return positionals;
    }

    public String positional(int index) {
        return positionals.get(index);
    }

    /**
     * @param longName option name without dashes
     * @return {@code true} if the option was given
     */
    public boolean has(String longName) {
        return options.containsKey(longName);
    }

    public Optional<String> value(String longName) {
        return Optional.ofNullable(options.get(longName));
    }
}
