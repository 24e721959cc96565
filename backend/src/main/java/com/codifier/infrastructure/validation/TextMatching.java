package com.codifier.infrastructure.validation;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loose text comparisons used when checking extracted changes against the amendment text.
 */
public final class TextMatching {

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");

    private static final Set<String> STOPWORDS = Set.of(
            "the", "of", "in", "a", "an", "and", "or", "to", "for", "by", "with", "shall", "be",
            "section", "sub", "subsection", "clause", "words", "word", "act", "principal", "throughout"
    );

    private TextMatching() {
    }

    /**
     * Lowercase, quotes and punctuation dropped, whitespace runs collapsed.
     */
    public static String normalizeForMatch(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase()
                .replaceAll("[\"'‘’“”]", "")
                .replaceAll("[^\\p{L}\\p{N}()]+", " ")
                .strip();
    }

    /**
     * Whether {@code needle} occurs in {@code haystack}, ignoring case, quotes, punctuation and spacing.
     */
    public static boolean containsLoosely(String haystack, String needle) {
        String n = normalizeForMatch(needle);
        return !n.isEmpty() && normalizeForMatch(haystack).contains(n);
    }

    /**
     * Meaningful tokens of a text: words and numbers, stopwords removed.
     */
    public static Set<String> meaningTokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null) {
            return tokens;
        }
        Matcher m = WORD.matcher(text.toLowerCase());
        while (m.find()) {
            if (!STOPWORDS.contains(m.group())) {
                tokens.add(m.group());
            }
        }
        return tokens;
    }

    public static boolean sharesToken(String a, String b) {
        Set<String> tokensA = meaningTokens(a);
        Set<String> tokensB = meaningTokens(b);
        return tokensA.stream().anyMatch(tokensB::contains);
    }
}
