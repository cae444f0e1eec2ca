package com.devbolt.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ScalarValue}.
 */
class ScalarValueTest {

    @Test
    @DisplayName("Should classify raw values by kind")
    void shouldClassifyRawValues() {
        assertThat(ScalarValue.of("x").getKind()).isEqualTo(ScalarValue.Kind.STRING);
        assertThat(ScalarValue.of(3L).getKind()).isEqualTo(ScalarValue.Kind.NUMBER);
        assertThat(ScalarValue.of(2.5f).getKind()).isEqualTo(ScalarValue.Kind.NUMBER);
        assertThat(ScalarValue.of(false).getKind()).isEqualTo(ScalarValue.Kind.BOOLEAN);
        assertThat(ScalarValue.isScalar(List.of())).isFalse();
    }

    @Test
    @DisplayName("Should reject nulls and composite values")
    void shouldRejectUnsupported() {
        assertThatThrownBy(() -> ScalarValue.of(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> ScalarValue.of(List.of(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported scalar type");
    }

    @Test
    @DisplayName("Numbers should be equal by value regardless of boxed type")
    void numbersShouldCompareByValue() {
        assertThat(ScalarValue.of(30)).isEqualTo(ScalarValue.of(30.0));
        assertThat(ScalarValue.of(30)).hasSameHashCodeAs(ScalarValue.of(30.0));
        assertThat(ScalarValue.of(0.0)).isEqualTo(ScalarValue.of(-0.0));
        assertThat(ScalarValue.of(0.0)).hasSameHashCodeAs(ScalarValue.of(-0.0));
        assertThat(ScalarValue.of(1)).isNotEqualTo(ScalarValue.of("1"));
        assertThat(ScalarValue.of(true)).isNotEqualTo(ScalarValue.of(1));
    }

    @Test
    @DisplayName("Should render integral numbers without a fraction")
    void shouldRenderNumbers() {
        assertThat(ScalarValue.of(42.0).asString()).isEqualTo("42");
        assertThat(ScalarValue.of(-7).asString()).isEqualTo("-7");
        assertThat(ScalarValue.of(12.5).asString()).isEqualTo("12.5");
        assertThat(ScalarValue.of(true).asString()).isEqualTo("true");
    }

    @Test
    @DisplayName("Should coerce to double where sensible")
    void shouldCoerceToDouble() {
        assertThat(ScalarValue.of(" 3.5 ").asDouble()).contains(3.5);
        assertThat(ScalarValue.of(true).asDouble()).contains(1.0);
        assertThat(ScalarValue.of(false).asDouble()).contains(0.0);
        assertThat(ScalarValue.of("").asDouble()).isEmpty();
        assertThat(ScalarValue.of("  ").asDouble()).isEmpty();
        assertThat(ScalarValue.of("abc").asDouble()).isEmpty();
        assertThat(ScalarValue.of("NaN").asDouble()).isEmpty();
    }

    @Test
    @DisplayName("Should expose the raw value for serialization")
    void shouldExposeRaw() {
        assertThat(ScalarValue.of("a").toRaw()).isEqualTo("a");
        assertThat(ScalarValue.of(2).toRaw()).isEqualTo(2L);
        assertThat(ScalarValue.of(2.0).toRaw()).isEqualTo(2L);
        assertThat(ScalarValue.of(2.5).toRaw()).isEqualTo(2.5);
        assertThat(ScalarValue.of(new BigInteger("123456789012345678901234567890")).toRaw())
                .isEqualTo(new BigInteger("123456789012345678901234567890"));
        assertThat(ScalarValue.of(true).toRaw()).isEqualTo(true);
    }

    @Test
    @DisplayName("Should keep every digit of large integral numbers")
    void shouldKeepLargeIntegersExact() {
        assertThat(ScalarValue.of(1234567890123456L).asString()).isEqualTo("1234567890123456");
        assertThat(ScalarValue.of(9007199254740993L).asString()).isEqualTo("9007199254740993");
        assertThat(ScalarValue.of(Long.MAX_VALUE).asString()).isEqualTo("9223372036854775807");
        assertThat(ScalarValue.of(9007199254740992L)).isNotEqualTo(ScalarValue.of(9007199254740993L));
        assertThat(ScalarValue.of(new BigInteger("9007199254740993")))
                .isEqualTo(ScalarValue.of(9007199254740993L))
                .hasSameHashCodeAs(ScalarValue.of(9007199254740993L));
    }

    @Test
    @DisplayName("Should render small and large fractions in plain notation")
    void shouldRenderPlainDecimals() {
        assertThat(ScalarValue.of(0.0001).asString()).isEqualTo("0.0001");
        assertThat(ScalarValue.of(1e20).asString()).isEqualTo("100000000000000000000");
        assertThat(ScalarValue.of(0.1f).asString()).isEqualTo("0.1");
        assertThat(ScalarValue.of(new BigDecimal("2.50")).asString()).isEqualTo("2.5");
        assertThat(ScalarValue.of(-0.0).asString()).isEqualTo("0");
        assertThat(ScalarValue.formatNumber(45.5)).isEqualTo("45.5");
        assertThat(ScalarValue.formatNumber(50.0)).isEqualTo("50");
    }

    @Test
    @DisplayName("Should expose exact decimals for numbers, booleans and numeric strings")
    void shouldCoerceToDecimal() {
        assertThat(ScalarValue.of(9007199254740993L).asDecimal()).contains(new BigDecimal("9007199254740993"));
        assertThat(ScalarValue.of(" 9007199254740993 ").asDecimal()).contains(new BigDecimal("9007199254740993"));
        assertThat(ScalarValue.of(true).asDecimal()).contains(BigDecimal.ONE);
        assertThat(ScalarValue.of("abc").asDecimal()).isEmpty();
        assertThat(ScalarValue.of(Double.NaN).asDecimal()).isEmpty();
    }

    @Test
    @DisplayName("Non-finite doubles should stay numbers without a numeric coercion")
    void shouldKeepNonFiniteDoubles() {
        ScalarValue infinity = ScalarValue.of(Double.POSITIVE_INFINITY);

        assertThat(infinity.getKind()).isEqualTo(ScalarValue.Kind.NUMBER);
        assertThat(infinity.asString()).isEqualTo("Infinity");
        assertThat(infinity.asDouble()).isEmpty();
        assertThat(infinity).isEqualTo(ScalarValue.of(Double.POSITIVE_INFINITY));
    }
}
