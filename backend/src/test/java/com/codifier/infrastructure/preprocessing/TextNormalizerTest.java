package com.codifier.infrastructure.preprocessing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private TextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TextNormalizer();
    }

    @Test
    @DisplayName("null and empty input")
    void null_and_empty() {
        assertThat(normalizer.normalize(null)).isNull();
        assertThat(normalizer.normalize("")).isEmpty();
    }

    @Test
    @DisplayName("Invisible characters from PDF extraction are removed")
    void invisible_characters() {
        assertThat(normalizer.normalize("thirty\u200B days\uFEFF")).isEqualTo("thirty days");
        assertThat(normalizer.normalize("Magis\u00ADtrate")).isEqualTo("Magistrate");
    }

    @Test
    @DisplayName("Control characters are removed")
    void control_characters() {
        assertThat(normalizer.normalize("Section\u0001 15\u0007")).isEqualTo("Section 15");
    }

    @Test
    @DisplayName("Non-breaking and typographic spaces become plain spaces")
    void special_spaces() {
        assertThat(normalizer.normalize("Section\u00A015(2)")).isEqualTo("Section 15(2)");
    }

    @Test
    @DisplayName("Line endings are unified and excessive blank lines reduced")
    void line_breaks() {
        assertThat(normalizer.normalize("first\r\nsecond\rthird")).isEqualTo("first\nsecond\nthird");
        assertThat(normalizer.normalize("first\n\n\n\nsecond")).isEqualTo("first\n\nsecond");
    }

    @Test
    @DisplayName("Single-line normalization collapses every whitespace run")
    void normalize_line() {
        assertThat(normalizer.normalizeLine("  (2) An appeal\n shall   be\tfiled  ")).isEqualTo("(2) An appeal shall be filed");
    }

    @Test
    @DisplayName("Unicode NFC normalization")
    void nfc() {
        assertThat(normalizer.normalize("Re\u0301gime")).isEqualTo("R\u00E9gime");
    }

    @Test
    @DisplayName("Clean text is unchanged")
    void clean_text_unchanged() {
        String input = "(2) An appeal shall be filed within thirty days of the order.";
        assertThat(normalizer.normalize(input)).isEqualTo(input);
    }
}
