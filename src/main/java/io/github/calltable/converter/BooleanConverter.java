package io.github.calltable.converter;

import java.util.Locale;
import java.util.Set;

/**
 * Converter for boolean values.
 *
 * <p>Booleans pass through. Strings are trimmed and compared case-insensitively:
 * <ul>
 *   <li>{@code true, 1, yes, y} - true</li>
 *   <li>{@code false, 0, no, n} - false</li>
 * </ul>
 * Any other string, and any other input type, is rejected.</p>
 */
public class BooleanConverter extends AbstractTypeConverter<Boolean> {

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "y");

    private static final Set<String> FALSE_VALUES = Set.of("false", "0", "no", "n");

    public BooleanConverter() {
        super(FieldKind.BOOLEAN);
    }

    @Override
    protected Boolean doConvert(Object value) throws CoercionException {
        if (value instanceof Boolean b) {
            return b;
        }

        if (value instanceof CharSequence cs) {
            String lower = cs.toString().strip().toLowerCase(Locale.ROOT);
            if (TRUE_VALUES.contains(lower)) {
                return true;
            }
            if (FALSE_VALUES.contains(lower)) {
                return false;
            }
            throw conversionError(value, "Invalid boolean string: '" + cs + "'");
        }

        throw unsupportedType(value);
    }
}
