package io.github.calltable.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collection;
import java.util.Map;

/**
 * Converter for string values.
 *
 * <p>Scalars use their {@link TextRenderer} form; nested objects and arrays are
 * rendered as compact JSON. This conversion never rejects a non-null value.</p>
 */
public class StringConverter extends AbstractTypeConverter<String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public StringConverter() {
        super(FieldKind.STRING);
    }

    @Override
    protected String doConvert(Object value) {
        if (value instanceof CharSequence cs) {
            return cs.toString();
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            try {
                return OBJECT_MAPPER.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return value.toString();
            }
        }
        return TextRenderer.render(value);
    }
}
