package io.github.eutro.phpir.util;

import io.github.eutro.phpir.bound.BoundExpression;
import org.jetbrains.annotations.Nullable;

/**
 * Conversions between statically known PHP values, as the runtime performs them.
 * <p>
 * Values are represented as {@link Boolean}, {@link Long}, {@link Double}, {@link String},
 * or null for {@code NULL}. Conversions that cannot be decided return null.
 */
public class PhpValues {
    /**
     * Convert a value to a boolean, the way {@code (bool)} does.
     *
     * @param value The value.
     * @return Its truthiness, or null if unknown.
     */
    public static @Nullable Boolean tryConvertToBool(@Nullable Object value) {
        if (value == null) return false;
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof Long) return (Long) value != 0;
        if (value instanceof Double) {
            double d = (Double) value;
            return d != 0 || Double.isNaN(d);
        }
        if (value instanceof String) {
            String s = (String) value;
            return !s.isEmpty() && !s.equals("0");
        }
        return null;
    }

    /**
     * Convert a value to a string, the way {@code (string)} does.
     * Floating point values are not converted, since their
     * string form depends on runtime settings.
     *
     * @param value The value.
     * @return The string, or null if unknown.
     */
    public static @Nullable String tryConvertToString(@Nullable Object value) {
        if (value == null) return "";
        if (value instanceof Boolean) return (Boolean) value ? "1" : "";
        if (value instanceof Long) return Long.toString((Long) value);
        if (value instanceof String) return (String) value;
        return null;
    }

    /**
     * Get a value as a boolean, without conversion.
     *
     * @param value The value.
     * @return The boolean, or null if it is not one.
     */
    public static @Nullable Boolean asBool(@Nullable Object value) {
        return value instanceof Boolean ? (Boolean) value : null;
    }

    /**
     * Whether a value is the integer {@code expected}, without conversion.
     *
     * @param value    The value.
     * @param expected The integer.
     * @return Whether it is.
     */
    public static boolean isInteger(@Nullable Object value, long expected) {
        return value instanceof Long && (Long) value == expected;
    }

    /**
     * Get the statically known truthiness of an expression.
     *
     * @param expr The expression.
     * @return The truthiness, or null if unknown.
     */
    public static @Nullable Boolean knownBool(BoundExpression expr) {
        return expr.hasConstantValue() ? tryConvertToBool(expr.constantValue()) : null;
    }

    /**
     * Get the statically known string conversion of an expression.
     *
     * @param expr The expression.
     * @return The string, or null if unknown.
     */
    public static @Nullable String knownString(BoundExpression expr) {
        return expr.hasConstantValue() ? tryConvertToString(expr.constantValue()) : null;
    }
}
