package com.devbolt.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for command dispatch in {@link DevBoltCli}.
 */
class DevBoltCliTest {

    @TempDir
    Path dir;

    private CliHarness cli;

    @BeforeEach
    void setUp() {
        cli = new CliHarness(dir);
    }

    @Test
    @DisplayName("No arguments should print usage and fail")
    void shouldPrintUsageWithoutArguments() {
        assertThat(cli.run()).isEqualTo(1);

        assertThat(cli.out())
                .contains("Usage: devbolt <command> [options]")
                .contains("rollout <flag-name> <percentage> [options]")
                .contains("status <flag-name> [options]");
    }

    @Test
    @DisplayName("help should list commands or describe one")
    void shouldPrintHelp() {
        assertThat(cli.run("--help")).isZero();
        assertThat(cli.out()).contains("Commands:");

        cli.reset();
        assertThat(cli.run("help", "rm")).isZero();
        assertThat(cli.out())
                .contains("Usage: devbolt remove <flag-name> [options]")
                .contains("Aliases: rm")
                .contains("-f, --force");

        cli.reset();
        assertThat(cli.run("status", "-h")).isZero();
        assertThat(cli.out()).contains("-u, --user-id <userId>").contains("--config <path>");
    }

    @Test
    @DisplayName("--version should print the version")
    void shouldPrintVersion() {
        assertThat(cli.run("-V")).isZero();

        assertThat(cli.out().trim()).isEqualTo(DevBoltCli.VERSION);
    }

    @Test
    @DisplayName("An unknown command should fail with usage")
    void shouldRejectUnknownCommand() {
        assertThat(cli.run("explode", "now")).isEqualTo(1);

        assertThat(cli.err()).contains("✗ Invalid command: explode now");
        assertThat(cli.out()).contains("Commands:");
    }

    @Test
    @DisplayName("Usage errors should be reported on stderr")
    void shouldReportUsageErrors() {
        cli.run("init", "--yes");

        assertThat(cli.run("show")).isEqualTo(1);
        assertThat(cli.run("show", "a", "b")).isEqualTo(1);
        assertThat(cli.run("list", "--bogus")).isEqualTo(1);

        assertThat(cli.err())
                .contains("Missing argument <flag-name>\nUsage: devbolt show <flag-name> [options]")
                .contains("Unexpected argument 'b'")
                .contains("Unknown option: --bogus");
    }

    @Test
    @DisplayName("Commands that need a flag file should point at init")
    void shouldRequireInit() {
        for (String[] args : new String[][] {{"list"}, {"show", "x"}, {"toggle", "x"}, {"rollout", "x", "5"},
                {"remove", "x", "-f"}, {"status", "x"}}) {
            assertThat(cli.run(args)).isEqualTo(1);
        }

        assertThat(cli.err().split("Run \"devbolt init\" first", -1)).hasSize(7);
    }

    @Test
    @DisplayName("A full session against a custom file location")
    void shouldRunSessionWithCustomConfig() {
        assertThat(cli.run("init", "-y", "--no-examples", "--config", "conf/flags.yml")).isZero();
        assertThat(cli.run("create", "beta", "-y", "-r", "10", "--config", "conf/flags.yml")).isZero();
        assertThat(cli.run("rollout", "beta", "50", "--config", "conf/flags.yml")).isZero();
        cli.reset();

        assertThat(cli.run("status", "beta", "-u", "user-123", "--config", "conf/flags.yml")).isZero();

        assertThat(cli.out()).contains("Reason: Rollout 50% (user bucket: ");
        assertThat(dir.resolve("conf/flags.yml")).isRegularFile();
        assertThat(cli.manager().exists()).isFalse();
    }
}
