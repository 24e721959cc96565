package com.codifier.infrastructure.preprocessing;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Cleans text coming out of PDF/DOCX/OCR extraction before it is stored or matched:
 * - Unicode NFC normalization
 * - Invisible/control character removal
 * - Whitespace normalization (collapse runs, trim)
 */
@Component
public class TextNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except \n, \r, \t
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    // Non-breaking and typographic spaces extracted from PDFs
    private static final Pattern SPECIAL_SPACES = Pattern.compile("[\\u00A0\\u2002-\\u200A\\u202F\\u205F\\u3000]");

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("[ \\t]{2,}");

    private static final Pattern EXCESSIVE_NEWLINES = Pattern.compile("\\n{3,}");

    private static final Pattern ANY_WHITESPACE = Pattern.compile("\\s+");

    /**
     * Normalize a multi-line block, keeping line breaks.
     *
     * @param text raw extracted text
     * @return normalized text
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = SPECIAL_SPACES.matcher(result).replaceAll(" ");
        result = result.replace("\r\n", "\n").replace("\r", "\n");
        result = MULTIPLE_SPACES.matcher(result).replaceAll(" ");
        result = EXCESSIVE_NEWLINES.matcher(result).replaceAll("\n\n");
        return result.strip();
    }

    /**
     * Normalize text that must end up on a single line: every whitespace run becomes one space.
     */
    public String normalizeLine(String text) {
        String result = normalize(text);
        if (result == null || result.isEmpty()) {
            return result;
        }
        return ANY_WHITESPACE.matcher(result).replaceAll(" ");
    }
}
