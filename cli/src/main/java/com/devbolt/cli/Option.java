package com.devbolt.cli;

import java.util.Objects;

/**
 * A named command line option, either a switch ({@code --force}) or one that
 * takes a value ({@code --format json}).
 */
public final class Option {

    private final String longName;
    private final String shortName;
    private final String valueName;
    private final String description;

    private Option(String longName, String shortName, String valueName, String description) {
        this.longName = Objects.requireNonNull(longName, "longName must not be null");
        this.shortName = shortName;
        this.valueName = valueName;
        this.description = description;
    }

    public static Option flag(String longName, String shortName, String description) {
        return new Option(longName, shortName, null, description);
    }

    public static Option valued(String longName, String shortName, String valueName, String description) {
        return new Option(longName, shortName, Objects.requireNonNull(valueName, "valueName must not be null"),
                description);
    }

    /**
     * @return the name without dashes, e.g. {@code user-id}
     */
    public String getLongName() {
        return longName;
    }

    /** @return the single-letter name, or {@code null} */
    public String getShortName() {
        return shortName;
    }

    public boolean takesValue() {
        return valueName != null;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return the left column of the help text, e.g.
     *         {@code -d, --description <text>}
     */
    public String synopsis() {
        StringBuilder sb = new StringBuilder();
        sb.append(shortName != null ? "-" + shortName + ", " : "    ");
        sb.append("--").append(longName);
        if (valueName != null) {
            sb.append(" <").append(valueName).append('>');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "--" + longName;
    }
}
