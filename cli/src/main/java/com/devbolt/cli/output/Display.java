package com.devbolt.cli.output;

import com.devbolt.cli.CliException;
import com.devbolt.cli.config.ConfigManager;
import com.devbolt.core.model.FlagConfig;
import com.devbolt.core.model.FlagsConfig;
import com.devbolt.core.model.ScalarValue;
import com.devbolt.core.model.TargetingRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Everything the CLI prints. Status lines go to stdout, errors and warnings
 * to stderr.
 */
public class Display {

    public static final String RULE = "─".repeat(60);

    private static final List<String> TABLE_HEADER =
            List.of("Flag Name", "Enabled", "Rollout", "Targeting", "Environments");

    private final PrintStream out;
    private final PrintStream err;
    private final ObjectMapper mapper;

    public Display(PrintStream out, PrintStream err) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.err = Objects.requireNonNull(err, "err must not be null");
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    // ---------------------------------------------------------------
    // Status lines
    // ---------------------------------------------------------------

    public void success(String message) {
        out.println("✓ " + message);
    }

    public void error(String message) {
        err.println("✗ " + message);
    }

    public void warning(String message) {
        err.println("⚠ " + message);
    }

    public void info(String message) {
        out.println("ℹ " + message);
    }

    public void line(String text) {
        out.println(text);
    }

    public void blank() {
        out.println();
    }

    // ---------------------------------------------------------------
    // Flags
    // ---------------------------------------------------------------

    /**
     * One row per flag: name, switch, rollout, rule count and overridden
     * environments.
     */
    public void flagTable(FlagsConfig flags) {
        if (flags.isEmpty()) {
            info("No flags found");
            return;
        }

        List<List<String>> rows = new ArrayList<>();
        flags.asMap().forEach((name, flag) -> rows.add(List.of(
                name,
                yesNo(flag.isEnabled()),
                flag.getRollout() != null ? percent(flag.getRollout().getPercentage()) : "-",
                flag.getTargeting().isEmpty() ? "-" : flag.getTargeting().size() + " rule(s)",
                flag.getEnvironments().isEmpty() ? "-" : String.join(", ", flag.getEnvironments().keySet()))));

        int[] widths = new int[TABLE_HEADER.size()];
        for (int c = 0; c < widths.length; c++) {
            widths[c] = TABLE_HEADER.get(c).length();
            for (List<String> row : rows) {
                widths[c] = Math.max(widths[c], row.get(c).length());
            }
        }

        String border = border(widths);
        out.println(border);
        out.println(row(TABLE_HEADER, widths));
        out.println(border);
        rows.forEach(r -> out.println(row(r, widths)));
        out.println(border);
    }

    public void flagDetail(String name, FlagConfig flag) {
        out.println();
        out.println(name);
        out.println(RULE);
        out.println("Enabled: " + yesNo(flag.isEnabled()));

        if (flag.getDescription() != null && !flag.getDescription().isEmpty()) {
            out.println("Description: " + flag.getDescription());
        }
        if (flag.getRollout() != null) {
            out.println("Rollout: " + percent(flag.getRollout().getPercentage()));
            if (flag.getRollout().getSeed() != null) {
                out.println("Rollout Seed: " + flag.getRollout().getSeed());
            }
        }

        if (!flag.getEnvironments().isEmpty()) {
            out.println();
            out.println("Environments:");
            flag.getEnvironments().forEach((env, enabled) ->
                    out.println("  " + env + ": " + (enabled ? "enabled" : "disabled")));
        }

        List<TargetingRule> rules = flag.getTargeting();
        if (!rules.isEmpty()) {
            out.println();
            out.println("Targeting Rules:");
            for (int i = 0; i < rules.size(); i++) {
                TargetingRule rule = rules.get(i);
                out.println("  " + (i + 1) + ". " + rule.getAttribute() + " " + rule.getOperator().getWireName()
                        + " " + operand(rule) + " → " + (rule.isEnabled() ? "enable" : "disable"));
                if (rule.getDescription() != null && !rule.getDescription().isEmpty()) {
                    out.println("     " + rule.getDescription());
                }
            }
        }

        if (!flag.getMetadata().isEmpty()) {
            out.println();
            out.println("Metadata:");
            out.print(ConfigManager.toYaml(flag.getMetadata()));
        }
        out.println();
    }

    // ---------------------------------------------------------------
    // Documents
    // ---------------------------------------------------------------

    public void json(Object tree) {
        try {
            out.println(mapper.writeValueAsString(tree));
        } catch (JsonProcessingException e) {
            throw new CliException("Failed to render JSON: " + e.getOriginalMessage(), e);
        }
    }

    public void yaml(Object tree) {
        out.print(ConfigManager.toYaml(tree));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    public static String percent(double percentage) {
        return ScalarValue.formatNumber(percentage) + "%";
    }

    private static String yesNo(boolean value) {
        return value ? "Yes" : "No";
    }

    private static String operand(TargetingRule rule) {
        if (rule.getValue() != null) {
            return rule.getValue().asString();
        }
        return rule.getValues().stream().map(ScalarValue::asString).collect(Collectors.joining(", "));
    }

    private static String border(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int w : widths) {
            sb.append("-".repeat(w + 2)).append('+');
        }
        return sb.toString();
    }

    private static String row(List<String> cells, int[] widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int c = 0; c < widths.length; c++) {
            String cell = cells.get(c);
            sb.append(' ').append(cell).append(" ".repeat(widths[c] - cell.length())).append(" |");
        }
        return sb.toString();
    }
}
