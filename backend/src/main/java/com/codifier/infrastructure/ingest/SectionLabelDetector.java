package com.codifier.infrastructure.ingest;

import com.codifier.domain.act.model.SectionPath;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers a line's section path from its leading label, relative to the path of the line before it.
 *
 * <ul>
 *   <li>{@code 15.} or {@code Section 15} opens a section (optionally followed by {@code (1)} on the same line)</li>
 *   <li>{@code (2)} opens a subsection of the current section</li>
 *   <li>{@code (a)} opens a clause</li>
 *   <li>{@code (i)}, {@code (ii)}, ... open a sub-clause while a clause is open, unless the
 *       letter is simply the next clause ({@code (i)} right after clause {@code (h)})</li>
 * </ul>
 * Lines without a label continue the previous unit.
 */
@Component
public class SectionLabelDetector {

    private static final Pattern SECTION_START = Pattern.compile(
            "^\\s*(?:(?:section|sec\\.)\\s+(\\d+[A-Za-z]?)\\b\\.?|(\\d+[A-Za-z]?)\\.(?=\\s|$))\\s*(?:\\((\\d+[A-Za-z]?)\\))?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern PAREN_LABEL = Pattern.compile("^\\s*\\(([0-9A-Za-z]+)\\)");

    private static final Pattern ROMAN = Pattern.compile("[ivxlc]+");

    /**
     * @param text     line text
     * @param previous path of the previous line ({@link SectionPath#ROOT} at the start)
     * @return the path the label opens, or empty when the line carries no label
     */
    public Optional<SectionPath> detect(String text, SectionPath previous) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher section = SECTION_START.matcher(text);
        if (section.find()) {
            String label = section.group(1) != null ? section.group(1) : section.group(2);
            return Optional.of(new SectionPath(label, section.group(3), null, null));
        }

        Matcher paren = PAREN_LABEL.matcher(text);
        if (!paren.find() || previous == null || previous.isRoot()) {
            return Optional.empty();
        }
        String label = paren.group(1);
        if (Character.isDigit(label.charAt(0))) {
            return Optional.of(new SectionPath(previous.section(), label, null, null));
        }
        String lower = label.toLowerCase();
        if (isSubClause(lower, previous)) {
            return Optional.of(new SectionPath(previous.section(), previous.subsection(), previous.clause(), lower));
        }
        return Optional.of(new SectionPath(previous.section(), previous.subsection(), lower, null));
    }

    private boolean isSubClause(String label, SectionPath previous) {
        if (previous.clause() == null || !ROMAN.matcher(label).matches()) {
            return false;
        }
        // (i) after (h), (v) after (u), (x) after (w) continue the clause sequence
        String clause = previous.clause();
        boolean nextLetter = label.length() == 1 && clause.length() == 1 && label.charAt(0) == clause.charAt(0) + 1;
        String subClause = previous.subClause();
        if (subClause != null && SectionPath.isRoman(subClause)
                && SectionPath.romanValue(label) == SectionPath.romanValue(subClause) + 1) {
            return true;
        }
        return !nextLetter;
    }
}
