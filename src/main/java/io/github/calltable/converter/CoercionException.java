package io.github.calltable.converter;

/**
 * Thrown when a value cannot be coerced to its column's {@link FieldKind}.
 *
 * <p>Converters raise it without a field; {@link AbstractTypeConverter#convert(Object, String)}
 * attaches the column name through {@link #inField(String)}.</p>
 */
public class CoercionException extends RuntimeException {

    private static final int MAX_VALUE_LENGTH = 50;

    private final String field;
    private final Object value;
    private final FieldKind kind;
    private final String reason;

    public CoercionException(Object value, FieldKind kind, String reason) {
        this(null, value, kind, reason, null);
    }

    public CoercionException(Object value, FieldKind kind, String reason, Throwable cause) {
        this(null, value, kind, reason, cause);
    }

    private CoercionException(String field, Object value, FieldKind kind, String reason, Throwable cause) {
        super(describe(field, value, kind, reason), cause);
        this.field = field;
        this.value = value;
        this.kind = kind;
        this.reason = reason;
    }

    /**
     * Returns this failure tied to {@code field}. An exception that already names a
     * field is returned unchanged.
     */
    public CoercionException inField(String field) {
        if (this.field != null || field == null || field.isEmpty()) {
            return this;
        }
        CoercionException located = new CoercionException(field, value, kind, reason, getCause());
        located.setStackTrace(getStackTrace());
        return located;
    }

    private static String describe(String field, Object value, FieldKind kind, String reason) {
        String sourceType = value == null ? "null" : value.getClass().getSimpleName();
        String message = String.format("Cannot coerce %s (%s) to %s: %s",
                abbreviate(value), sourceType, kind.getTypeName(), reason);
        return field == null ? message : "Field '" + field + "': " + message;
    }

    private static String abbreviate(Object value) {
        if (value == null) {
            return "null";
        }
        String text = value instanceof CharSequence ? "'" + value + "'" : value.toString();
        return text.length() > MAX_VALUE_LENGTH ? text.substring(0, MAX_VALUE_LENGTH - 3) + "..." : text;
    }

    /**
     * Returns the column being extracted, or null when raised outside a record.
     */
    public String getField() {
        return field;
    }

    public Object getValue() {
        return value;
    }

    public FieldKind getKind() {
        return kind;
    }

    /**
     * Returns why the value was rejected, without the value and kind prefix.
     */
    public String getReason() {
        return reason;
    }
}
