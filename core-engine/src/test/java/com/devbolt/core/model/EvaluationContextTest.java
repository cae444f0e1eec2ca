package com.devbolt.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EvaluationContext}.
 */
class EvaluationContextTest {

    @Test
    @DisplayName("Empty context should resolve nothing")
    void emptyShouldResolveNothing() {
        EvaluationContext ctx = EvaluationContext.empty();

        assertThat(ctx.getAttribute("userId")).isEmpty();
        assertThat(ctx.getAttribute("plan")).isEmpty();
        assertThat(ctx.getCustomAttributes()).isEmpty();
    }

    @Test
    @DisplayName("Caller fields should win over defaults when merging")
    void callerShouldWin() {
        EvaluationContext defaults = EvaluationContext.builder()
                .userId("default-user")
                .environment("production")
                .customAttribute("plan", "free")
                .build();
        EvaluationContext caller = EvaluationContext.builder()
                .userId("caller")
                .build();

        EvaluationContext merged = caller.mergedOver(defaults);

        assertThat(merged.getUserId()).isEqualTo("caller");
        assertThat(merged.getEnvironment()).isEqualTo("production");
        assertThat(merged.getAttribute("plan")).contains(ScalarValue.of("free"));
    }

    @Test
    @DisplayName("Caller custom attributes should replace the defaults wholesale")
    void customAttributesShouldReplaceWholesale() {
        EvaluationContext defaults = EvaluationContext.builder()
                .customAttributes(Map.of("plan", "free", "region", "eu"))
                .build();
        EvaluationContext caller = EvaluationContext.builder()
                .customAttribute("plan", "pro")
                .build();

        EvaluationContext merged = caller.mergedOver(defaults);

        assertThat(merged.getCustomAttributes()).containsOnlyKeys("plan");
        assertThat(merged.getAttribute("region")).isEmpty();
    }

    @Test
    @DisplayName("Merging over nothing should return the caller's context")
    void mergeOverNothing() {
        EvaluationContext caller = EvaluationContext.builder().email("a@b.c").build();

        assertThat(caller.mergedOver(null)).isSameAs(caller);
        assertThat(caller.mergedOver(EvaluationContext.empty())).isSameAs(caller);
    }

    @Test
    @DisplayName("Should keep an immutable copy of custom attributes")
    void shouldCopyAttributes() {
        EvaluationContext ctx = EvaluationContext.builder().customAttribute("n", 1).build();

        assertThat(ctx.getCustomAttributes()).isUnmodifiable();
        assertThat(ctx).isEqualTo(EvaluationContext.builder().customAttribute("n", 1.0).build());
    }
}
