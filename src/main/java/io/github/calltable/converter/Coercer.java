package io.github.calltable.converter;

import java.util.EnumMap;
import java.util.Map;

/**
 * Entry point for coercing raw values to a {@link FieldKind}.
 *
 * <p>Holds one converter per kind. Instances are immutable and may be shared.</p>
 */
public class Coercer {

    private final Map<FieldKind, AbstractTypeConverter<?>> converters = new EnumMap<>(FieldKind.class);

    public Coercer() {
        register(new StringConverter());
        register(new IntegerConverter());
        register(new FloatConverter());
        register(new BooleanConverter());
    }

    private void register(AbstractTypeConverter<?> converter) {
        converters.put(converter.getKind(), converter);
    }

    /**
     * Coerces a value to the given kind.
     *
     * @param value the raw value, may be null
     * @param kind the target kind
     * @return the coerced value, or null when {@code value} is null
     * @throws CoercionException if the value cannot be represented as {@code kind}
     */
    public Object coerce(Object value, FieldKind kind) {
        if (value == null) {
            return null;
        }
        return converterFor(kind).convert(value);
    }

    /**
     * Coerces a value to the given kind, naming the field in any error.
     */
    public Object coerce(Object value, FieldKind kind, String fieldName) {
        if (value == null) {
            return null;
        }
        return converterFor(kind).convert(value, fieldName);
    }

    /**
     * Returns the converter registered for a kind.
     */
    public AbstractTypeConverter<?> converterFor(FieldKind kind) {
        AbstractTypeConverter<?> converter = converters.get(kind);
        if (converter == null) {
            throw new IllegalArgumentException("No converter for kind: " + kind);
        }
        return converter;
    }
}
