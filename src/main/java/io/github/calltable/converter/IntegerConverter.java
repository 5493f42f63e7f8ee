package io.github.calltable.converter;

/**
 * Converter for integer values.
 *
 * <p>Booleans map to 0 and 1. Numbers and numeric strings are read as a double
 * first and then truncated toward zero, so {@code "3.0"} and {@code 3.9} both
 * become 3.</p>
 */
public class IntegerConverter extends AbstractTypeConverter<Long> {

    // 2^63; every double strictly below it in magnitude fits in a long
    private static final double LONG_BOUND = 0x1p63;

    public IntegerConverter() {
        super(FieldKind.INTEGER);
    }

    @Override
    protected Long doConvert(Object value) throws CoercionException {
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }

        if (value instanceof Number n) {
            return truncate(n.doubleValue(), value);
        }

        if (value instanceof CharSequence cs) {
            String str = cs.toString();
            try {
                return truncate(parseDouble(str), value);
            } catch (NumberFormatException e) {
                throw conversionError(value, "Invalid integer string: '" + str + "'", e);
            }
        }

        throw unsupportedType(value);
    }

    private Long truncate(double d, Object original) {
        if (!Double.isFinite(d)) {
            throw conversionError(original, "Cannot convert non-finite value to integer");
        }
        if (d >= LONG_BOUND || d < -LONG_BOUND) {
            throw conversionError(original,
                    String.format("Value %s is outside integer range [%d, %d]",
                            d, Long.MIN_VALUE, Long.MAX_VALUE));
        }
        return (long) d;
    }
}
