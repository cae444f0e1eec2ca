package com.devbolt.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A single attribute or operand value: a string, a number or a boolean.
 *
 * <h3>Coercion rules</h3>
 * <ul>
 * <li>{@link #asString()}: strings as-is, booleans as {@code true}/{@code false},
 * numbers in plain decimal notation without trailing zeros ({@code 5}, not
 * {@code 5.0}; {@code 0.0001}, not {@code 1.0E-4})</li>
 * <li>{@link #asDouble()}: numbers as-is, booleans as {@code 1}/{@code 0},
 * strings parsed after trimming; blank or unparsable strings and non-finite
 * results yield empty</li>
 * </ul>
 *
 * <h3>Equality</h3>
 * <p>
 * Values of different kinds are never equal. Numbers compare by exact decimal
 * value, so {@code 5} and {@code 5.0} are equal while {@code 9007199254740992}
 * and {@code 9007199254740993} are not.
 * </p>
 * <p>
 * Finite numbers are held as a {@link BigDecimal}, so integral values of any
 * size keep every digit. Only non-finite doubles fall back to a {@code double}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScalarValue implements Serializable {

    private static final long serialVersionUID = 2L;

    /** The closed set of value kinds. */
    public enum Kind {
        STRING, NUMBER, BOOLEAN
    }

    private final Kind kind;
    private final String stringValue;
    // null for non-finite numbers
    private final BigDecimal decimalValue;
    private final double numberValue;
    private final boolean booleanValue;

    private ScalarValue(Kind kind, String stringValue, BigDecimal decimalValue, double numberValue,
            boolean booleanValue) {
        this.kind = kind;
        this.stringValue = stringValue;
        this.decimalValue = decimalValue;
        this.numberValue = numberValue;
        this.booleanValue = booleanValue;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    public static ScalarValue ofString(String value) {
        return new ScalarValue(Kind.STRING, Objects.requireNonNull(value, "value must not be null"), null, 0,
                false);
    }

    public static ScalarValue ofNumber(long value) {
        return ofNumber(BigDecimal.valueOf(value));
    }

    public static ScalarValue ofNumber(double value) {
        if (!Double.isFinite(value)) {
            return new ScalarValue(Kind.NUMBER, null, null, value, false);
        }
        // valueOf goes through Double.toString, so 0.1 stays 0.1
        return ofNumber(BigDecimal.valueOf(value));
    }

    public static ScalarValue ofNumber(BigDecimal value) {
        Objects.requireNonNull(value, "value must not be null");
        return new ScalarValue(Kind.NUMBER, null, value, value.doubleValue(), false);
    }

    public static ScalarValue ofBoolean(boolean value) {
        return new ScalarValue(Kind.BOOLEAN, null, null, 0, value);
    }

    /**
     * Wrap a raw configuration or context value.
     *
     * @param raw a {@link String}, {@link Number} or {@link Boolean}
     * @return the wrapped value
     * @throws NullPointerException     if {@code raw} is {@code null}
     * @throws IllegalArgumentException if {@code raw} is of any other type
     */
    public static ScalarValue of(Object raw) {
        Objects.requireNonNull(raw, "Scalar value must not be null");
        if (raw instanceof ScalarValue sv) {
            return sv;
        }
        if (raw instanceof String s) {
            return ofString(s);
        }
        if (raw instanceof Number n) {
            return fromNumber(n);
        }
        if (raw instanceof Boolean b) {
            return ofBoolean(b);
        }
        throw new IllegalArgumentException(
                "Unsupported scalar type: " + raw.getClass().getName() + " (expected string, number or boolean)");
    }

    private static ScalarValue fromNumber(Number n) {
        if (n instanceof BigDecimal d) {
            return ofNumber(d);
        }
        if (n instanceof BigInteger bi) {
            return ofNumber(new BigDecimal(bi));
        }
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte
                || n instanceof AtomicLong || n instanceof AtomicInteger) {
            return ofNumber(n.longValue());
        }
        if (n instanceof Float f && Float.isFinite(f)) {
            // Float.toString keeps 0.1f as 0.1 instead of its widened double expansion
            return ofNumber(new BigDecimal(Float.toString(f)));
        }
        return ofNumber(n.doubleValue());
    }

    /**
     * @return {@code true} if {@code raw} can be wrapped by {@link #of(Object)}
     */
    public static boolean isScalar(Object raw) {
        return raw instanceof String || raw instanceof Number || raw instanceof Boolean;
    }

    // ---------------------------------------------------------------
    // Coercions
    // ---------------------------------------------------------------

    public Kind getKind() {
        return kind;
    }

    public String asString() {
        return switch (kind) {
            case STRING -> stringValue;
            case BOOLEAN -> Boolean.toString(booleanValue);
            case NUMBER -> decimalValue != null ? plain(decimalValue) : Double.toString(numberValue);
        };
    }

    /**
     * @return the exact decimal value of a finite number, a boolean as
     *         {@code 1}/{@code 0}, or a string parsed after trimming
     */
    public Optional<BigDecimal> asDecimal() {
        switch (kind) {
            case NUMBER:
                return Optional.ofNullable(decimalValue);
            case BOOLEAN:
                return Optional.of(booleanValue ? BigDecimal.ONE : BigDecimal.ZERO);
            default:
                String trimmed = stringValue.trim();
                if (trimmed.isEmpty()) {
                    return Optional.empty();
                }
                try {
                    return Optional.of(new BigDecimal(trimmed));
                } catch (NumberFormatException e) {
                    return asDouble().map(BigDecimal::valueOf);
                }
        }
    }

    public Optional<Double> asDouble() {
        switch (kind) {
            case NUMBER:
                return Double.isFinite(numberValue) ? Optional.of(numberValue) : Optional.empty();
            case BOOLEAN:
                return Optional.of(booleanValue ? 1.0 : 0.0);
            default:
                String trimmed = stringValue.trim();
                if (trimmed.isEmpty()) {
                    return Optional.empty();
                }
                try {
                    double parsed = Double.parseDouble(trimmed);
                    return Double.isFinite(parsed) ? Optional.of(parsed) : Optional.empty();
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
        }
    }

    /**
     * Render a number the way configuration authors wrote it: integral values
     * lose their fractional part and no exponent is used.
     *
     * @param value the number
     * @return its textual form
     */
    public static String formatNumber(double value) {
        return Double.isFinite(value) ? plain(BigDecimal.valueOf(value)) : Double.toString(value);
    }

    private static String plain(BigDecimal value) {
        return value.signum() == 0 ? "0" : value.stripTrailingZeros().toPlainString();
    }

    /**
     * @return the underlying Java value ({@link String}, {@link Boolean}, or
     *         for numbers a {@link Long}, {@link BigInteger} or {@link Double});
     *         used for JSON output
     */
    @JsonValue
    public Object toRaw() {
        return switch (kind) {
            case STRING -> stringValue;
            case NUMBER -> rawNumber();
            case BOOLEAN -> booleanValue;
        };
    }

    private Object rawNumber() {
        if (decimalValue == null) {
            return numberValue;
        }
        if (decimalValue.signum() == 0 || decimalValue.stripTrailingZeros().scale() <= 0) {
            BigInteger integral = decimalValue.toBigIntegerExact();
            return integral.bitLength() < 64 ? (Object) integral.longValue() : integral;
        }
        return numberValue;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScalarValue that))
            return false;
        if (kind != that.kind)
            return false;
        return switch (kind) {
            case STRING -> stringValue.equals(that.stringValue);
            case NUMBER -> decimalValue != null && that.decimalValue != null
                    ? decimalValue.compareTo(that.decimalValue) == 0
                    : numberValue == that.numberValue;
            case BOOLEAN -> booleanValue == that.booleanValue;
        };
    }

    @Override
    public int hashCode() {
        return switch (kind) {
            case STRING -> Objects.hash(kind, stringValue);
            // stripped so that 5 and 5.0 hash alike, matching compareTo
            case NUMBER -> decimalValue != null
                    ? Objects.hash(kind, decimalValue.signum() == 0 ? BigDecimal.ZERO : decimalValue.stripTrailingZeros())
                    : Objects.hash(kind, numberValue);
            case BOOLEAN -> Objects.hash(kind, booleanValue);
        };
    }

    @Override
    public String toString() {
        return kind == Kind.STRING
                ? '"' + stringValue + '"'
                : asString().toLowerCase(Locale.ROOT);
    }
}
