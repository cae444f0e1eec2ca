package com.devbolt.sdk;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DevBolt}.
 */
class DevBoltTest {

    @TempDir
    Path dir;

    @AfterEach
    void tearDown() {
        DevBolt.destroy();
    }

    @Test
    @DisplayName("Should refuse to evaluate before initialize")
    void shouldGuardUninitializedUse() {
        assertThat(DevBolt.isInitialized()).isFalse();
        assertThatThrownBy(() -> DevBolt.isEnabled("beta"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("DevBolt not initialized. Call initialize() first.");
        assertThatThrownBy(() -> DevBolt.evaluate("beta", null))
                .hasMessage("DevBolt not initialized. Call initialize() first.");
        assertThatThrownBy(DevBolt::getInstance)
                .hasMessage("DevBolt not initialized. Call initialize() first.");
    }

    @Test
    @DisplayName("Should delegate to the default client once initialized")
    void shouldDelegateToClient() throws IOException {
        Files.writeString(dir.resolve("devbolt.yml"), "beta:\n  enabled: true\n");

        DevBoltClient client = DevBolt.initialize(options());

        assertThat(DevBolt.isInitialized()).isTrue();
        assertThat(DevBolt.getInstance()).isSameAs(client);
        assertThat(DevBolt.isEnabled("beta")).isTrue();
        assertThat(DevBolt.evaluate("beta", null).getReason()).isEqualTo("Flag is enabled for all users");
    }

    @Test
    @DisplayName("Re-initializing should close the previous client")
    void reinitializeShouldClosePrevious() throws IOException {
        Files.writeString(dir.resolve("devbolt.yml"), "beta:\n  enabled: true\n");

        DevBoltClient first = DevBolt.initialize(options());
        DevBoltClient second = DevBolt.initialize(options());

        assertThat(first.isInitialized()).isFalse();
        assertThat(second.isInitialized()).isTrue();
        assertThat(DevBolt.getInstance()).isSameAs(second);
    }

    @Test
    @DisplayName("Destroy should close the client and be safe to repeat")
    void destroyShouldReset() throws IOException {
        Files.writeString(dir.resolve("devbolt.yml"), "beta:\n  enabled: true\n");
        DevBoltClient client = DevBolt.initialize(options());

        DevBolt.destroy();
        DevBolt.destroy();

        assertThat(client.isInitialized()).isFalse();
        assertThat(DevBolt.isInitialized()).isFalse();
        assertThatThrownBy(DevBolt::getInstance).isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ClientOptions options() {
        return ClientOptions.builder().baseDirectory(dir).autoReload(false).build();
    }
}
