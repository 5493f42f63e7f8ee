package io.github.calltable.converter;

import java.math.BigDecimal;

/**
 * Renders scalar values as the text written to the call table.
 *
 * <p>Booleans are {@code True}/{@code False}. Floating point values use the shortest
 * decimal form with at least one fractional digit ({@code 12345678.9}, {@code 3.0});
 * scientific notation is used only below {@code 1e-4} or from {@code 1e16} upwards
 * ({@code 1e+16}, {@code 1.5e-05}). Non-finite values are {@code nan}, {@code inf}
 * and {@code -inf}. Everything else uses {@code toString()}.</p>
 */
public final class TextRenderer {

    private static final int MIN_PLAIN_EXPONENT = -4;
    private static final int MAX_PLAIN_EXPONENT = 16;

    private TextRenderer() {
    }

    /**
     * Returns the cell text for {@code value}, or the empty string for null.
     */
    public static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        if (value instanceof Double || value instanceof Float) {
            return renderDouble(((Number) value).doubleValue());
        }
        return value.toString();
    }

    static String renderDouble(double d) {
        if (Double.isNaN(d)) {
            return "nan";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "inf" : "-inf";
        }
        if (d == 0.0) {
            return 1.0 / d < 0 ? "-0.0" : "0.0";
        }

        BigDecimal decimal = BigDecimal.valueOf(d).stripTrailingZeros();
        int exponent = decimal.precision() - decimal.scale() - 1;
        if (exponent < MIN_PLAIN_EXPONENT || exponent >= MAX_PLAIN_EXPONENT) {
            return scientific(decimal, exponent);
        }

        String plain = decimal.toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    private static String scientific(BigDecimal decimal, int exponent) {
        String digits = decimal.unscaledValue().abs().toString();
        StringBuilder sb = new StringBuilder();
        if (decimal.signum() < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent < 0 ? '-' : '+');
        int magnitude = Math.abs(exponent);
        if (magnitude < 10) {
            sb.append('0');
        }
        return sb.append(magnitude).toString();
    }
}
