package io.github.calltable.schema;

import io.github.calltable.converter.FieldKind;

/**
 * One output column: its name and the kind its values are coerced to.
 */
public record SchemaColumn(String name, FieldKind kind) {
}
