package io.github.calltable.schema;

import java.util.List;

/**
 * A single reason a raw record was rejected before extraction.
 *
 * @param kind what went wrong
 * @param fields the fields involved, sorted for missing fields
 * @param message human-readable description
 */
public record ValidationError(Kind kind, List<String> fields, String message) {

    public enum Kind {
        /** One or more required keys are absent. */
        MISSING_FIELDS,
        /** A present value has a shape the column can never accept. */
        INADMISSIBLE_TYPE
    }

    public ValidationError {
        fields = List.copyOf(fields);
    }

    static ValidationError missingFields(List<String> sortedFields) {
        return new ValidationError(Kind.MISSING_FIELDS, sortedFields,
                "Missing required fields: " + sortedFields);
    }

    static ValidationError inadmissibleType(String field, String expectation) {
        return new ValidationError(Kind.INADMISSIBLE_TYPE, List.of(field), field + " must be " + expectation);
    }
}
