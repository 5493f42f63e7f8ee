package io.github.calltable.schema;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks a raw record against the required field set before extraction.
 *
 * <p>Besides key presence, three fields that tend to drift in shape get a coarse
 * admissibility check. The check only looks at the value's JSON type; whether the
 * value actually converts is decided later by the coercer, so a record can pass here
 * and still be rejected during extraction.</p>
 */
public class SchemaValidator {

    public ValidationResult validate(Map<String, Object> record) {
        List<ValidationError> errors = new ArrayList<>();

        List<String> missing = new ArrayList<>();
        for (String field : CallSchema.REQUIRED_FIELDS) {
            if (!record.containsKey(field)) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            missing.sort(null);
            errors.add(ValidationError.missingFields(missing));
        }

        if (record.containsKey(CallSchema.TOTAL_CALL_TIME)
                && !isNumericLike(record.get(CallSchema.TOTAL_CALL_TIME))) {
            errors.add(ValidationError.inadmissibleType(CallSchema.TOTAL_CALL_TIME, "numeric-like or string"));
        }
        if (record.containsKey(CallSchema.SENTIMENT_SCORE)
                && !isNumericLike(record.get(CallSchema.SENTIMENT_SCORE))) {
            errors.add(ValidationError.inadmissibleType(CallSchema.SENTIMENT_SCORE, "numeric-like or string"));
        }
        if (record.containsKey(CallSchema.FOOD_PROGRAM)
                && !isBooleanLike(record.get(CallSchema.FOOD_PROGRAM))) {
            errors.add(ValidationError.inadmissibleType(CallSchema.FOOD_PROGRAM, "boolean-like"));
        }

        return ValidationResult.of(errors);
    }

    // a present null is not admissible
    private static boolean isNumericLike(Object value) {
        return value instanceof Number || value instanceof CharSequence || value instanceof Boolean;
    }

    private static boolean isBooleanLike(Object value) {
        return value instanceof Boolean || value instanceof CharSequence || isIntegral(value);
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }
}
