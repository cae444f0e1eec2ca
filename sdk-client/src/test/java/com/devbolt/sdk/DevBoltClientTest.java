package com.devbolt.sdk;

import com.devbolt.core.exception.ConfigParseException;
import com.devbolt.core.exception.FlagNotFoundException;
import com.devbolt.core.model.EvaluationContext;
import com.devbolt.core.model.EvaluationResult;
import com.devbolt.core.model.FlagsConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DevBoltClient}.
 */
class DevBoltClientTest {

    private static final String FLAGS = ""
            + "new_checkout:\n"
            + "  enabled: true\n"
            + "  targeting:\n"
            + "    - attribute: plan\n"
            + "      operator: equals\n"
            + "      value: enterprise\n"
            + "      enabled: true\n"
            + "  rollout:\n"
            + "    percentage: 0\n"
            + "beta:\n"
            + "  enabled: false\n";

    @TempDir
    Path dir;

    private DevBoltClient client;

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
    }

    @Test
    @DisplayName("Should find the default config file and evaluate flags")
    void shouldEvaluateFromDefaultLocation() throws IOException {
        writeFlags(".devbolt/flags.yml", FLAGS);
        client = new DevBoltClient(options().build());

        assertThat(client.isInitialized()).isTrue();
        assertThat(client.getAllFlagNames()).containsExactly("new_checkout", "beta");
        assertThat(client.isEnabled("beta")).isFalse();
        assertThat(client.isEnabled("new_checkout", context("free"))).isFalse();
        assertThat(client.evaluate("new_checkout", context("enterprise")).getReason())
                .isEqualTo("Matched targeting rule #1");

        ClientState state = client.getState();
        assertThat(state.isInitialized()).isTrue();
        assertThat(state.getConfigPath()).isEqualTo(dir.resolve(".devbolt/flags.yml"));
        assertThat(state.getLastLoadTime()).isNotNull();
        assertThat(state.getErrorCount()).isZero();
    }

    @Test
    @DisplayName("Should merge the caller's context over the default context")
    void shouldMergeDefaultContext() throws IOException {
        writeFlags("devbolt.yml", FLAGS);
        client = new DevBoltClient(options()
                .defaultContext(EvaluationContext.builder().customAttribute("plan", "enterprise").build())
                .build());

        assertThat(client.isEnabled("new_checkout")).isTrue();
        assertThat(client.isEnabled("new_checkout", EvaluationContext.builder().userId("u1").build())).isTrue();
        assertThat(client.isEnabled("new_checkout", context("free"))).isFalse();
    }

    @Test
    @DisplayName("Should answer unknown flags with the configured fallback")
    void shouldUseFallbackForUnknownFlag() throws IOException {
        writeFlags("devbolt.yml", FLAGS);
        client = new DevBoltClient(options().fallback("legacy", true).build());

        EvaluationResult legacy = client.evaluate("legacy");
        EvaluationResult other = client.evaluate("other");

        assertThat(legacy.isEnabled()).isTrue();
        assertThat(legacy.getReason()).isEqualTo("Flag not found, using fallback");
        assertThat(other.isEnabled()).isFalse();
    }

    @Test
    @DisplayName("Strict mode should report unknown flags as errors and still return a fallback")
    void strictModeShouldReportError() throws IOException {
        writeFlags("devbolt.yml", FLAGS);
        List<Exception> errors = new ArrayList<>();
        client = new DevBoltClient(options().strict(true).fallback("legacy", true).onError(errors::add).build());

        EvaluationResult result = client.evaluate("legacy");

        assertThat(result.isEnabled()).isTrue();
        assertThat(result.getReason()).isEqualTo("Error evaluating flag: Flag \"legacy\" not found");
        assertThat(errors).singleElement().isInstanceOf(FlagNotFoundException.class);
    }

    @Test
    @DisplayName("Strict mode with throwOnError should propagate unknown flags")
    void strictThrowOnErrorShouldPropagate() throws IOException {
        writeFlags("devbolt.yml", FLAGS);
        client = new DevBoltClient(options().strict(true).throwOnError(true).build());

        assertThatThrownBy(() -> client.evaluate("legacy")).isInstanceOf(FlagNotFoundException.class);
    }

    @Test
    @DisplayName("Should stay uninitialized and serve fallbacks when no config file exists")
    void shouldServeFallbacksWithoutConfig() {
        client = new DevBoltClient(options().fallback("beta", true).build());

        EvaluationResult result = client.evaluate("beta");

        assertThat(client.isInitialized()).isFalse();
        assertThat(result.isEnabled()).isTrue();
        assertThat(result.getReason()).isEqualTo("Client not initialized, using fallback");
        assertThat(client.getAllFlagNames()).isEmpty();
        assertThat(client.getFlagConfig("beta")).isEmpty();
        assertThat(client.getConfig().isEmpty()).isTrue();
        assertThat(client.getState().getErrorCount()).isEqualTo(1);
        assertThat(client.getState().getConfigPath()).isNull();
    }

    @Test
    @DisplayName("Should pass load failures to a custom error handler")
    void shouldCallCustomErrorHandler() throws IOException {
        writeFlags("devbolt.yml", "BadName:\n  enabled: true\n");
        List<Exception> errors = new ArrayList<>();

        client = new DevBoltClient(options().onError(errors::add).build());

        assertThat(client.isInitialized()).isFalse();
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0)).hasMessageContaining("lowercase");
    }

    @Test
    @DisplayName("throwOnError should make construction fail")
    void throwOnErrorShouldFailConstruction() {
        assertThatThrownBy(() -> new DevBoltClient(options().throwOnError(true).build()))
                .isInstanceOf(ConfigParseException.class)
                .hasMessageContaining("No DevBolt config file found");
    }

    @Test
    @DisplayName("Evaluation callback failures should not reach the caller")
    void callbackFailureShouldBeSwallowed() throws IOException {
        writeFlags("devbolt.yml", FLAGS);
        client = new DevBoltClient(options()
                .onFlagEvaluated((result, ctx) -> {
                    throw new IllegalStateException("listener broke");
                })
                .build());

        assertThat(client.isEnabled("beta")).isFalse();
    }

    @Test
    @DisplayName("Evaluation callback should receive the result and the merged context")
    void callbackShouldReceiveMergedContext() throws IOException {
        writeFlags("devbolt.yml", FLAGS);
        List<EvaluationContext> seen = new ArrayList<>();
        client = new DevBoltClient(options()
                .defaultContext(EvaluationContext.builder().environment("production").build())
                .onFlagEvaluated((result, ctx) -> seen.add(ctx))
                .build());

        client.evaluate("beta", EvaluationContext.builder().userId("u1").build());

        assertThat(seen).singleElement().satisfies(ctx -> {
            assertThat(ctx.getUserId()).isEqualTo("u1");
            assertThat(ctx.getEnvironment()).isEqualTo("production");
        });
    }

    @Test
    @DisplayName("Manual reload should install the new config and notify")
    void reloadShouldInstallNewConfig() throws IOException {
        Path file = writeFlags("devbolt.yml", FLAGS);
        List<FlagsConfig> updates = new ArrayList<>();
        client = new DevBoltClient(options().onConfigUpdate(updates::add).build());

        Files.writeString(file, "beta:\n  enabled: true\n");
        client.reload();

        assertThat(client.isEnabled("beta")).isTrue();
        assertThat(client.getAllFlagNames()).containsExactly("beta");
        assertThat(updates).singleElement().satisfies(cfg -> assertThat(cfg.flagNames()).containsExactly("beta"));
    }

    @Test
    @DisplayName("A failed reload should keep the previous config and count the error")
    void failedReloadShouldKeepConfig() throws IOException {
        Path file = writeFlags("devbolt.yml", FLAGS);
        client = new DevBoltClient(options().build());

        Files.writeString(file, "beta: [unclosed\n");
        client.reload();

        assertThat(client.getAllFlagNames()).containsExactly("new_checkout", "beta");
        assertThat(client.getState().getErrorCount()).isEqualTo(1);

        Files.writeString(file, FLAGS);
        client.reload();
        assertThat(client.getState().getErrorCount()).isZero();
    }

    @Test
    @DisplayName("Close should return the client to fallbacks")
    void closeShouldUninitialize() throws IOException {
        writeFlags("devbolt.yml", FLAGS);
        client = new DevBoltClient(options().build());

        client.close();

        assertThat(client.isInitialized()).isFalse();
        assertThat(client.evaluate("beta").getReason()).isEqualTo("Client not initialized, using fallback");
    }

    @Test
    @DisplayName("A reload after close should leave the client closed")
    void reloadAfterCloseShouldNotReopen() throws IOException {
        Path file = writeFlags("devbolt.yml", FLAGS);
        List<FlagsConfig> updates = new ArrayList<>();
        client = new DevBoltClient(options().onConfigUpdate(updates::add).build());
        client.close();

        Files.writeString(file, "beta:\n  enabled: true\n");
        client.reload();

        assertThat(client.isInitialized()).isFalse();
        assertThat(client.evaluate("beta").getReason()).isEqualTo("Client not initialized, using fallback");
        assertThat(updates).isEmpty();
    }

    @Test
    @DisplayName("A reload should initialize a client whose config file appeared later")
    void reloadShouldInitializeLateConfig() throws IOException {
        client = new DevBoltClient(options().build());
        assertThat(client.isInitialized()).isFalse();

        writeFlags("devbolt.yml", "beta:\n  enabled: true\n");
        client.reload();

        assertThat(client.isInitialized()).isTrue();
        assertThat(client.isEnabled("beta")).isTrue();
    }

    @Test
    @DisplayName("Should reload automatically when the file changes")
    void shouldAutoReload() throws Exception {
        Path file = writeFlags("devbolt.yml", FLAGS);
        List<FlagsConfig> updates = new CopyOnWriteArrayList<>();
        client = new DevBoltClient(options()
                .autoReload(true)
                .pollInterval(Duration.ofMillis(10))
                .stabilityThreshold(Duration.ofMillis(20))
                .onConfigUpdate(updates::add)
                .build());
        assertThat(client.isEnabled("beta")).isFalse();

        Files.writeString(file, "beta:\n  enabled: true\n");

        long deadline = System.currentTimeMillis() + 5_000;
        while (!client.isEnabled("beta") && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(client.isEnabled("beta")).isTrue();
        assertThat(updates).isNotEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ClientOptions.Builder options() {
        return ClientOptions.builder()
                .baseDirectory(dir)
                .autoReload(false);
    }

    private Path writeFlags(String relative, String content) throws IOException {
        Path file = dir.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    private static EvaluationContext context(String plan) {
        return EvaluationContext.builder().customAttribute("plan", plan).build();
    }
}
