package io.github.calltable.converter;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Base class for the converters that coerce a decoded JSON value to one {@link FieldKind}.
 *
 * <p>A null input short-circuits to null before any kind-specific logic runs.
 * Unexpected runtime failures inside {@link #doConvert(Object)} are reported
 * as {@link CoercionException}.</p>
 *
 * @param <T> the Java type produced for the kind
 */
public abstract class AbstractTypeConverter<T> {

    /**
     * Decimal literal accepted for numeric strings: optional sign, digits with an
     * optional fraction (or a bare fraction) and an optional exponent.
     */
    private static final Pattern DECIMAL = Pattern.compile(
            "[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final FieldKind kind;

    protected AbstractTypeConverter(FieldKind kind) {
        this.kind = kind;
    }

    /**
     * Converts a decoded JSON value.
     *
     * @return the converted value, or null for a null input
     * @throws CoercionException if the value cannot be represented as this kind
     */
    public T convert(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return doConvert(value);
        } catch (CoercionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw conversionError(value, e.getMessage(), e);
        }
    }

    /**
     * Converts a value read from {@code fieldName}, naming the field in any error.
     */
    public T convert(Object value, String fieldName) {
        try {
            return convert(value);
        } catch (CoercionException e) {
            throw e.inField(fieldName);
        }
    }

    /**
     * Performs the actual conversion of a non-null value.
     */
    protected abstract T doConvert(Object value) throws CoercionException;

    /**
     * Returns the kind this converter produces.
     */
    public FieldKind getKind() {
        return kind;
    }

    protected CoercionException unsupportedType(Object value) {
        return new CoercionException(value, kind,
                "Unsupported input type: " + value.getClass().getName());
    }

    protected CoercionException conversionError(Object value, String message) {
        return new CoercionException(value, kind, message);
    }

    protected CoercionException conversionError(Object value, String message, Throwable cause) {
        return new CoercionException(value, kind, message, cause);
    }

    /**
     * Parses a numeric string as a double. Surrounding whitespace is ignored and
     * {@code nan}, {@code inf} and {@code infinity} are recognized in any case.
     *
     * @throws NumberFormatException if the text is not a decimal literal
     */
    protected static double parseDouble(String text) {
        String str = text.strip();
        String lower = str.toLowerCase(Locale.ROOT);
        String unsigned = lower.startsWith("+") || lower.startsWith("-") ? lower.substring(1) : lower;
        boolean negative = lower.startsWith("-");
        switch (unsigned) {
            case "nan":
                return Double.NaN;
            case "inf":
            case "infinity":
                return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            default:
                break;
        }
        if (!DECIMAL.matcher(str).matches()) {
            throw new NumberFormatException("Not a decimal number: '" + text + "'");
        }
        return Double.parseDouble(str);
    }
}
