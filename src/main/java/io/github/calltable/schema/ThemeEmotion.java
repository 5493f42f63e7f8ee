package io.github.calltable.schema;

import java.util.Optional;

/**
 * Result of deriving {@code last_theme_emotion} from a record's {@code themes} array.
 *
 * <p>The derivation is best-effort: every outcome other than {@link Reason#DERIVED}
 * yields an empty value, never an error.</p>
 */
public record ThemeEmotion(String value, Reason reason) {

    public enum Reason {
        DERIVED,
        /** No {@code themes} key, or a null value. */
        ABSENT,
        NOT_A_LIST,
        EMPTY,
        /** The last element is not a JSON object. */
        NOT_AN_OBJECT,
        /** The last element has no {@code emotion} key, or it is null. */
        MISSING_EMOTION,
        /** An unexpected exception was raised while deriving. */
        FAILED
    }

    static ThemeEmotion derived(String value) {
        return new ThemeEmotion(value, Reason.DERIVED);
    }

    static ThemeEmotion none(Reason reason) {
        return new ThemeEmotion(null, reason);
    }

    public Optional<String> asOptional() {
        return Optional.ofNullable(value);
    }
}
