package com.tablette.widgets.reacttable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;

/**
 * Renders cell values for display.
 */
public final class ValueFormatter {
    private ValueFormatter() {}

    public static String format(Object value) {
        return format(value, null, null, null);
    }

    /**
     * Booleans become {@code true}/{@code false}. Floating point values are fixed to the
     * precision when one is given and written without an exponent otherwise. Integral values
     * get thousands separators and anything else falls back to its string form. Never throws.
     */
    public static String format(Object value, String prefix, String suffix, Integer precision) {
        return (prefix != null ? prefix : "")
                + formatValue(value, precision)
                + (suffix != null ? suffix : "");
    }

    private static String formatValue(Object value, Integer precision) {
        if (value instanceof Boolean) {
            return value.toString().toLowerCase(Locale.ROOT);
        }
        if (precision != null && precision >= 0 && isFloating(value)) {
            return String.format(Locale.US, "%." + precision + "f", value);
        }
        if (isFloating(value)) {
            return plain(value);
        }
        if (isIntegral(value)) {
            return String.format(Locale.US, "%,d", value);
        }
        return String.valueOf(value);
    }

    /**
     * Shortest decimal form without an exponent, so {@code 12345678.9} never renders as
     * {@code 1.23456789E7}.
     */
    private static String plain(Object value) {
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Float) {
            return new BigDecimal(value.toString()).toPlainString();
        }
        return BigDecimal.valueOf((Double) value).toPlainString();
    }

    private static boolean isFloating(Object value) {
        if (value instanceof Double) {
            return !((Double) value).isNaN() && !((Double) value).isInfinite();
        }
        if (value instanceof Float) {
            return !((Float) value).isNaN() && !((Float) value).isInfinite();
        }
        return value instanceof BigDecimal;
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger;
    }
}
