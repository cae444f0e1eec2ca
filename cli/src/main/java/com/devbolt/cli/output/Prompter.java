package com.devbolt.cli.output;

import com.devbolt.cli.CliException;
import com.devbolt.core.model.ScalarValue;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Line-based questions on the terminal. End of input answers every question
 * with its default, so a command piped from {@code /dev/null} behaves like
 * one run with {@code --yes} where defaults agree.
 */
public class Prompter {

    private final BufferedReader in;
    private final PrintStream out;

    public Prompter(BufferedReader in, PrintStream out) {
        this.in = Objects.requireNonNull(in, "in must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    /**
     * Ask a yes/no question until the answer is one of {@code y}, {@code yes},
     * {@code n}, {@code no} or empty.
     */
    public boolean confirm(String question, boolean defaultValue) {
        while (true) {
            String answer = ask(question + (defaultValue ? " (Y/n)" : " (y/N)"));
            if (answer == null || answer.isEmpty()) {
                return defaultValue;
            }
            switch (answer.toLowerCase(Locale.ROOT)) {
                case "y", "yes":
                    return true;
                case "n", "no":
                    return false;
                default:
                    out.println("Please answer yes or no");
            }
        }
    }

    /**
     * @return the trimmed answer, or {@code defaultValue} for an empty one
     */
    public String input(String question, String defaultValue) {
        String answer = ask(question + " (" + defaultValue + ")");
        return answer == null || answer.isEmpty() ? defaultValue : answer;
    }

    /**
     * Ask for a number in {@code [min, max]} until one is given.
     */
    public double number(String question, double defaultValue, double min, double max) {
        while (true) {
            String answer = ask(question + " (" + ScalarValue.formatNumber(defaultValue) + ")");
            if (answer == null || answer.isEmpty()) {
                return defaultValue;
            }
            OptionalDouble value = parse(answer);
            if (value.isPresent() && value.getAsDouble() >= min && value.getAsDouble() <= max) {
                return value.getAsDouble();
            }
            out.println("Please enter a number between " + ScalarValue.formatNumber(min)
                    + " and " + ScalarValue.formatNumber(max));
        }
    }

    private static OptionalDouble parse(String text) {
        try {
            return OptionalDouble.of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private String ask(String question) {
        out.print("? " + question + " ");
        out.flush();
        try {
            String line = in.readLine();
            return line != null ? line.trim() : null;
        } catch (IOException e) {
            throw new CliException("Failed to read answer: " + e.getMessage(), e);
        }
    }
}
