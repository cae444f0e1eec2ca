package com.devbolt.core.evaluation;

import com.devbolt.core.model.EvaluationContext;
import com.devbolt.core.model.EvaluationResult;
import com.devbolt.core.model.FlagConfig;
import com.devbolt.core.model.RolloutRule;
import com.devbolt.core.model.TargetingOperator;
import com.devbolt.core.model.TargetingRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.helpers.NOPLogger;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FlagEvaluator}.
 */
class FlagEvaluatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private FlagEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new FlagEvaluator(NOPLogger.NOP_LOGGER, Bucketer.DEFAULT_SEED,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should enable a plain flag for everyone")
    void shouldEnableByDefault() {
        EvaluationResult result = evaluator.evaluate("plain", FlagConfig.of(true), EvaluationContext.empty());

        assertThat(result.getFlagName()).isEqualTo("plain");
        assertThat(result.isEnabled()).isTrue();
        assertThat(result.getReason()).isEqualTo("Flag is enabled for all users");
        assertThat(result.getMetadata().getTimestamp()).isEqualTo(NOW);
        assertThat(result.getMetadata().getMatchedRuleIndex()).isNull();
        assertThat(result.getMetadata().getRolloutBucket()).isNull();
    }

    @Test
    @DisplayName("Kill switch should beat targeting and rollout")
    void killSwitchShouldWin() {
        FlagConfig config = FlagConfig.builder()
                .enabled(false)
                .targetingRule(rule("userId", "vip", true, null))
                .rollout(100)
                .build();

        EvaluationResult result = evaluator.evaluate("killed", config, ctx("vip"));

        assertThat(result.isEnabled()).isFalse();
        assertThat(result.getReason()).isEqualTo("Flag is disabled globally");
    }

    @Test
    @DisplayName("Environment override should beat the kill switch")
    void environmentOverrideShouldWin() {
        FlagConfig config = FlagConfig.builder()
                .enabled(false)
                .environment("development", true)
                .environment("production", false)
                .build();

        EvaluationResult dev = evaluator.evaluate("feature", config,
                EvaluationContext.builder().environment("development").build());
        EvaluationResult prod = evaluator.evaluate("feature", config,
                EvaluationContext.builder().environment("production").build());
        EvaluationResult other = evaluator.evaluate("feature", config,
                EvaluationContext.builder().environment("staging").build());

        assertThat(dev.isEnabled()).isTrue();
        assertThat(dev.getReason()).isEqualTo("Environment override: development");
        assertThat(prod.isEnabled()).isFalse();
        assertThat(prod.getReason()).isEqualTo("Environment override: production");
        assertThat(other.getReason()).isEqualTo("Flag is disabled globally");
    }

    @Test
    @DisplayName("Environment override should ignore kill switch, targeting and rollout together")
    void environmentOverrideShouldIgnoreAllOtherLayers() {
        FlagConfig config = FlagConfig.builder()
                .enabled(false)
                .environment("qa", true)
                .targetingRule(rule("userId", "alice", false, null))
                .rollout(0)
                .build();
        EvaluationContext ctx = EvaluationContext.builder().userId("alice").environment("qa").build();

        EvaluationResult result = evaluator.evaluate("layered", config, ctx);

        assertThat(result.isEnabled()).isTrue();
        assertThat(result.getReason()).isEqualTo("Environment override: qa");
        assertThat(result.getMetadata().getMatchedRuleIndex()).isNull();
        assertThat(result.getMetadata().getRolloutBucket()).isNull();
    }

    @Test
    @DisplayName("A non-matching rule without rollout should fall through to enabled")
    void nonMatchingRuleShouldFallThroughToDefault() {
        FlagConfig config = FlagConfig.builder()
                .enabled(true)
                .targetingRule(rule("userId", "alice", false, null))
                .build();

        EvaluationResult result = evaluator.evaluate("feature", config, ctx("bob"));

        assertThat(result.isEnabled()).isTrue();
        assertThat(result.getReason()).isEqualTo("Flag is enabled for all users");
    }

    @Test
    @DisplayName("First matching targeting rule should decide, with a 1-based reason and 0-based index")
    void firstMatchingRuleShouldDecide() {
        FlagConfig config = FlagConfig.builder()
                .targetingRule(rule("userId", "nobody", true, null))
                .targetingRule(rule("userId", "alice", false, "Alice opted out"))
                .targetingRule(rule("userId", "alice", true, "Never reached"))
                .build();

        EvaluationResult result = evaluator.evaluate("checkout", config, ctx("alice"));

        assertThat(result.isEnabled()).isFalse();
        assertThat(result.getReason()).isEqualTo("Matched targeting rule #2: Alice opted out");
        assertThat(result.getMetadata().getMatchedRuleIndex()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should omit the description suffix when a rule has none")
    void shouldOmitEmptyDescription() {
        FlagConfig config = FlagConfig.builder()
                .targetingRule(rule("userId", "alice", true, ""))
                .build();

        assertThat(evaluator.evaluate("checkout", config, ctx("alice")).getReason())
                .isEqualTo("Matched targeting rule #1");
    }

    @Test
    @DisplayName("Should fall through to rollout when no rule matches")
    void shouldFallThroughToRollout() {
        // rollout_flag/user-123 under the default seed hashes to bucket 45
        FlagConfig config = FlagConfig.builder()
                .targetingRule(rule("userId", "someone-else", false, null))
                .rollout(50)
                .build();

        EvaluationResult result = evaluator.evaluate("rollout_flag", config, ctx("user-123"));

        assertThat(result.isEnabled()).isTrue();
        assertThat(result.getReason()).isEqualTo("Rollout 50% (user bucket: 45)");
        assertThat(result.getMetadata().getRolloutBucket()).isEqualTo(45);
        assertThat(result.getMetadata().getMatchedRuleIndex()).isNull();
    }

    @Test
    @DisplayName("Should exclude subjects whose bucket is not below the percentage")
    void shouldExcludeAtBoundary() {
        EvaluationResult result = evaluator.evaluate("rollout_flag",
                FlagConfig.builder().rollout(45).build(), ctx("user-123"));

        assertThat(result.isEnabled()).isFalse();
        assertThat(result.getReason()).isEqualTo("Rollout 45% (user bucket: 45)");
    }

    @Test
    @DisplayName("Should render fractional percentages as written")
    void shouldRenderFractionalPercentage() {
        EvaluationResult result = evaluator.evaluate("rollout_flag",
                FlagConfig.builder().rollout(45.5).build(), ctx("user-123"));

        assertThat(result.isEnabled()).isTrue();
        assertThat(result.getReason()).isEqualTo("Rollout 45.5% (user bucket: 45)");
    }

    @Test
    @DisplayName("Rollout seed should take precedence over context override and default")
    void rolloutSeedShouldWin() {
        FlagConfig config = FlagConfig.builder().rollout(new RolloutRule(100, "custom")).build();
        EvaluationContext ctx = EvaluationContext.builder()
                .userId("user-123")
                .hashSeedOverride("ignored")
                .build();

        EvaluationResult result = evaluator.evaluate("rollout_flag", config, ctx);

        assertThat(result.getMetadata().getRolloutBucket()).isEqualTo(62);
    }

    @Test
    @DisplayName("Context seed override should apply when the rollout declares no seed")
    void contextSeedOverrideShouldApply() {
        FlagConfig config = FlagConfig.builder().rollout(100).build();
        EvaluationContext ctx = EvaluationContext.builder()
                .userId("user-123")
                .hashSeedOverride("custom")
                .build();

        assertThat(evaluator.evaluate("rollout_flag", config, ctx).getMetadata().getRolloutBucket())
                .isEqualTo(62);
    }

    @Test
    @DisplayName("Should bucket by email, then by the anonymous identifier")
    void shouldChooseRolloutIdentifier() {
        FlagConfig config = FlagConfig.builder().rollout(100).build();

        EvaluationResult byEmail = evaluator.evaluate("checkout", config,
                EvaluationContext.builder().email("alice@example.com").build());
        EvaluationResult anonymous = evaluator.evaluate("rollout_flag", config, EvaluationContext.empty());

        assertThat(byEmail.getMetadata().getRolloutBucket()).isEqualTo(12);
        assertThat(anonymous.getMetadata().getRolloutBucket()).isEqualTo(70);
        assertThat(anonymous.getMetadata().getRolloutBucket())
                .isEqualTo(Bucketer.bucket("rollout_flag", FlagEvaluator.ANONYMOUS));
    }

    @Test
    @DisplayName("Zero percent rollout should disable everyone")
    void zeroRolloutShouldDisable() {
        FlagConfig config = FlagConfig.builder().rollout(0).build();

        for (int i = 0; i < 50; i++) {
            assertThat(evaluator.evaluate("dark", config, ctx("user-" + i)).isEnabled()).isFalse();
        }
    }

    @Test
    @DisplayName("Should return the same decision for the same inputs")
    void shouldBeDeterministic() {
        FlagConfig config = FlagConfig.builder().rollout(30).build();

        for (int i = 0; i < 20; i++) {
            EvaluationContext ctx = ctx("user-" + i);
            assertThat(evaluator.evaluate("stable", config, ctx))
                    .isEqualTo(evaluator.evaluate("stable", config, ctx));
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static EvaluationContext ctx(String userId) {
        return EvaluationContext.builder().userId(userId).build();
    }

    private static TargetingRule rule(String attribute, String value, boolean enabled, String description) {
        return TargetingRule.builder()
                .attribute(attribute)
                .operator(TargetingOperator.EQUALS)
                .value(value)
                .enabled(enabled)
                .description(description)
                .build();
    }
}
