package io.github.calltable.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One extracted row, values in {@link CallSchema#COLUMNS} order. Values may be null.
 */
public record CallRow(List<Object> values) {

    public CallRow {
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Returns the value of the named column.
     *
     * @throws IllegalArgumentException if the column is not part of the schema
     */
    public Object get(String column) {
        for (int i = 0; i < CallSchema.COLUMNS.size(); i++) {
            if (CallSchema.COLUMNS.get(i).name().equals(column)) {
                return values.get(i);
            }
        }
        throw new IllegalArgumentException("Unknown column: " + column);
    }
}
