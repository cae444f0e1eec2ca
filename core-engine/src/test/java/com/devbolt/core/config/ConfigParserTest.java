package com.devbolt.core.config;

import com.devbolt.core.exception.ConfigParseException;
import com.devbolt.core.exception.ValidationException;
import com.devbolt.core.model.FlagConfig;
import com.devbolt.core.model.FlagsConfig;
import com.devbolt.core.model.ScalarValue;
import com.devbolt.core.model.TargetingOperator;
import com.devbolt.core.model.TargetingRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigParser}.
 */
class ConfigParserTest {

    @Test
    @DisplayName("Should load test flags from classpath in document order")
    void shouldLoadFromClasspath() {
        FlagsConfig config = ConfigParser.parseClasspath("test-flags.yml");

        assertThat(config.flagNames()).containsExactly("new_checkout", "rollout_flag", "kill_switch");

        FlagConfig checkout = config.get("new_checkout").orElseThrow();
        assertThat(checkout.isEnabled()).isTrue();
        assertThat(checkout.getDescription()).isEqualTo("New checkout flow");
        assertThat(checkout.getRollout().getPercentage()).isEqualTo(25.0);
        assertThat(checkout.getRollout().getSeed()).isNull();
        assertThat(checkout.getEnvironments()).containsEntry("development", true);
        assertThat(checkout.getTargeting()).hasSize(2);

        TargetingRule first = checkout.getTargeting().get(0);
        assertThat(first.getOperator()).isEqualTo(TargetingOperator.ENDS_WITH);
        assertThat(first.getValue()).isEqualTo(ScalarValue.ofString("@internal.example.com"));
        assertThat(first.getDescription()).isEqualTo("Employees first");

        TargetingRule second = checkout.getTargeting().get(1);
        assertThat(second.getOperator()).isEqualTo(TargetingOperator.IN);
        assertThat(second.getValues()).containsExactly(ScalarValue.ofString("US"), ScalarValue.ofString("CA"));
        assertThat(second.isEnabled()).isFalse();

        assertThat(config.get("kill_switch").orElseThrow().getMetadata())
                .containsEntry("owner", "payments")
                .containsEntry("ticket", "PAY-42");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ConfigParser.parseClasspath("does-not-exist.yml"))
                .isInstanceOf(ConfigParseException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should parse a file from disk")
    void shouldParseFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("flags.yml");
        Files.writeString(file, "beta:\n  enabled: true\n  rollout:\n    percentage: 12.5\n    seed: s1\n",
                StandardCharsets.UTF_8);

        FlagsConfig config = ConfigParser.parseFile(file);

        assertThat(config.get("beta").orElseThrow().getRollout().getPercentage()).isEqualTo(12.5);
        assertThat(config.get("beta").orElseThrow().getRollout().getSeed()).isEqualTo("s1");
    }

    @Test
    @DisplayName("Should report a missing file with its path")
    void shouldReportMissingFile(@TempDir Path dir) {
        Path missing = dir.resolve("nope.yml");

        assertThatThrownBy(() -> ConfigParser.parseFile(missing))
                .isInstanceOf(ConfigParseException.class)
                .hasMessage("Config file not found: " + missing);
    }

    @Test
    @DisplayName("Should return an empty config for an empty document")
    void shouldReturnEmptyForEmptyDocument() {
        assertThat(ConfigParser.parseYaml("").isEmpty()).isTrue();
        assertThat(ConfigParser.parseYaml("# only a comment\n").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should wrap malformed YAML in a parse error")
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> ConfigParser.parseYaml("flag: [unclosed"))
                .isInstanceOf(ConfigParseException.class)
                .hasMessageStartingWith("Failed to parse YAML:");
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys() {
        String yaml = "a:\n  enabled: true\na:\n  enabled: false\n";

        assertThatThrownBy(() -> ConfigParser.parseYaml(yaml))
                .isInstanceOf(ConfigParseException.class);
    }

    @Test
    @DisplayName("Should reject a scalar document and a top-level list")
    void shouldRejectNonMappingDocuments() {
        assertThatThrownBy(() -> ConfigParser.parseYaml("just a string"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Config must be a YAML object");
        assertThatThrownBy(() -> ConfigParser.parseYaml("- a\n- b\n"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Config must be an object, not an array");
    }

    @Test
    @DisplayName("Should surface validation errors from a well-formed document")
    void shouldSurfaceValidationErrors() {
        assertThatThrownBy(() -> ConfigParser.parseYaml("InvalidFlag:\n  enabled: true\n"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("lowercase");
    }
}
