package io.github.calltable.converter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class TextRendererTest {

    @Test
    @DisplayName("renders null as an empty cell")
    void rendersNull() {
        assertThat(TextRenderer.render(null)).isEmpty();
    }

    @Test
    @DisplayName("renders booleans capitalized")
    void rendersBooleans() {
        assertThat(TextRenderer.render(true)).isEqualTo("True");
        assertThat(TextRenderer.render(false)).isEqualTo("False");
    }

    @Test
    @DisplayName("leaves strings and integers as they are")
    void rendersOtherScalars() {
        assertThat(TextRenderer.render("Resolved")).isEqualTo("Resolved");
        assertThat(TextRenderer.render(7L)).isEqualTo("7");
        assertThat(TextRenderer.render(-9007199254740993L)).isEqualTo("-9007199254740993");
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "12.5, 12.5",
            "3.0, 3.0",
            "100.0, 100.0",
            "12345678.9, 12345678.9",
            "-0.25, -0.25",
            "0.0001, 0.0001",
            "0.000015, 1.5e-05",
            "1.0E16, 1e+16",
            "1.5E16, 1.5e+16"
    })
    @DisplayName("renders finite doubles in shortest decimal form")
    void rendersFiniteDoubles(double value, String expected) {
        assertThat(TextRenderer.render(value)).isEqualTo(expected);
    }

    @Test
    @DisplayName("renders zero and non-finite doubles")
    void rendersSpecialDoubles() {
        assertThat(TextRenderer.render(0.0)).isEqualTo("0.0");
        assertThat(TextRenderer.render(-0.0)).isEqualTo("-0.0");
        assertThat(TextRenderer.render(Double.NaN)).isEqualTo("nan");
        assertThat(TextRenderer.render(Double.POSITIVE_INFINITY)).isEqualTo("inf");
        assertThat(TextRenderer.render(Double.NEGATIVE_INFINITY)).isEqualTo("-inf");
    }
}
