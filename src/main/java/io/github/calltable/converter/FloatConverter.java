package io.github.calltable.converter;

/**
 * Converter for floating point values.
 */
public class FloatConverter extends AbstractTypeConverter<Double> {

    public FloatConverter() {
        super(FieldKind.FLOAT);
    }

    @Override
    protected Double doConvert(Object value) throws CoercionException {
        if (value instanceof Double d) {
            return d;
        }

        if (value instanceof Number n) {
            return n.doubleValue();
        }

        // booleans are numeric for this purpose
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }

        if (value instanceof CharSequence cs) {
            String str = cs.toString();
            try {
                return parseDouble(str);
            } catch (NumberFormatException e) {
                throw conversionError(value, "Invalid float string: '" + str + "'", e);
            }
        }

        throw unsupportedType(value);
    }
}
