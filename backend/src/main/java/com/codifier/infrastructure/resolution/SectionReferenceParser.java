package com.codifier.infrastructure.resolution;

import com.codifier.domain.act.model.SectionLevel;
import com.codifier.domain.act.model.SectionPath;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses references as legislation writes them into {@link SectionPath}s.
 *
 * <p>Accepts the compact form ("Section 15(2)(a)(ii)", "s. 15A") and the long form
 * ("clause (b) of sub-section (2) of section 15"), and mixes of both
 * ("clause (a) of Section 15(2)"). Long-form labels take precedence over the compact chain.
 */
@Component
public class SectionReferenceParser {

    private static final Pattern UNIT = Pattern.compile(
            "\\b(sub-?\\s?clause|clause|sub-?\\s?section|section|sec\\.|s\\.)\\s*"
                    + "(\\(\\s*[0-9A-Za-z]+\\s*\\)|\\d+[A-Za-z]*)"
                    + "((?:\\s*\\(\\s*[0-9A-Za-z]+\\s*\\))*)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CHAIN_LABEL = Pattern.compile("\\(\\s*([0-9A-Za-z]+)\\s*\\)");

    private static final Pattern OUTSIDE_SCOPE = Pattern.compile(
            "\\b(schedule|chapter|part|form|annexure|appendix)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern OF_OUTSIDE_SCOPE = Pattern.compile(
            "\\bof\\s+(?:the\\s+)?(?:\\w+\\s+)?(schedule|chapter|part|form|annexure|appendix)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DIGITS = Pattern.compile("\\d+[A-Za-z]*");

    /**
     * Parses a complete reference.
     *
     * @return the reference, or empty when no section can be identified
     */
    public Optional<SectionReference> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String[] labels = collectLabels(raw);
        boolean mentionsOutside = OUTSIDE_SCOPE.matcher(raw).find();
        if (labels[0] == null) {
            return mentionsOutside ? Optional.of(SectionReference.outsideScope(raw)) : Optional.empty();
        }
        if (OF_OUTSIDE_SCOPE.matcher(raw).find()) {
            return Optional.of(SectionReference.outsideScope(raw));
        }
        return Optional.of(SectionReference.of(toPath(labels), raw));
    }

    /**
     * Parses a reference that may omit outer levels, filling them from {@code base}.
     * "clause (c)" relative to Section 4(b) is Section 4(c).
     */
    public Optional<SectionPath> parseRelative(String raw, SectionPath base) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String[] labels = collectLabels(raw);
        if (labels[0] != null) {
            return Optional.of(toPath(labels));
        }
        SectionLevel deepestGiven = null;
        for (SectionLevel level : SectionLevel.values()) {
            if (labels[level.ordinal()] != null) {
                deepestGiven = level;
            }
        }
        if (deepestGiven == null || base == null || base.isRoot()) {
            return Optional.empty();
        }
        String[] merged = new String[4];
        for (SectionLevel level : SectionLevel.values()) {
            int i = level.ordinal();
            if (i > deepestGiven.ordinal()) {
                break;
            }
            merged[i] = labels[i] != null ? labels[i] : base.label(level);
        }
        return Optional.of(toPath(merged));
    }

    /**
     * Whether the text names a section at all; used to decide if a reference needs context.
     */
    public boolean mentionsSection(String raw) {
        return raw != null && collectLabels(raw)[0] != null;
    }

    /**
     * Every section-bearing reference in the text with its start offset, in text order.
     */
    public List<Mention> findSectionMentions(String text) {
        List<Mention> mentions = new ArrayList<>();
        if (text == null) {
            return mentions;
        }
        Matcher m = UNIT.matcher(text);
        while (m.find()) {
            if (levelOf(m.group(1)) == SectionLevel.SECTION && DIGITS.matcher(m.group(2)).matches()) {
                mentions.add(new Mention(m.start(), m.group().strip()));
            }
        }
        return mentions;
    }

    public record Mention(int start, String text) {}

    private String[] collectLabels(String raw) {
        String[] labels = new String[4];
        String[] explicit = new String[4];
        Matcher m = UNIT.matcher(raw);
        while (m.find()) {
            SectionLevel level = levelOf(m.group(1));
            String label = stripParens(m.group(2));
            if (level == SectionLevel.SECTION) {
                if (labels[0] != null || !DIGITS.matcher(label).matches()) {
                    continue;
                }
                labels[0] = label;
                assignChain(labels, m.group(3));
            } else if (explicit[level.ordinal()] == null) {
                explicit[level.ordinal()] = label;
                String[] chained = new String[4];
                chained[level.ordinal()] = label;
                assignChainBelow(chained, level, m.group(3));
                for (int i = level.ordinal() + 1; i < 4; i++) {
                    if (explicit[i] == null && chained[i] != null) {
                        explicit[i] = chained[i];
                    }
                }
            }
        }
        for (int i = 1; i < 4; i++) {
            if (explicit[i] != null) {
                labels[i] = explicit[i];
            }
        }
        return labels;
    }

    // "(2)(a)(ii)" after a section number: numeric first label is a subsection, then clause, then sub-clause
    private void assignChain(String[] labels, String chain) {
        Matcher m = CHAIN_LABEL.matcher(chain);
        while (m.find()) {
            String label = m.group(1);
            if (labels[1] == null && labels[2] == null && Character.isDigit(label.charAt(0))) {
                labels[1] = label;
            } else if (labels[2] == null) {
                labels[2] = label;
            } else if (labels[3] == null) {
                labels[3] = label;
            }
        }
    }

    private void assignChainBelow(String[] labels, SectionLevel level, String chain) {
        Matcher m = CHAIN_LABEL.matcher(chain);
        int next = level.ordinal() + 1;
        while (m.find() && next < 4) {
            labels[next++] = m.group(1);
        }
    }

    private static SectionLevel levelOf(String keyword) {
        String k = keyword.toLowerCase().replaceAll("[\\s-]", "");
        return switch (k) {
            case "subclause" -> SectionLevel.SUB_CLAUSE;
            case "clause" -> SectionLevel.CLAUSE;
            case "subsection" -> SectionLevel.SUBSECTION;
            default -> SectionLevel.SECTION;
        };
    }

    private static String stripParens(String label) {
        return label.replaceAll("[()\\s]", "");
    }

    private static SectionPath toPath(String[] labels) {
        return new SectionPath(labels[0], labels[1], labels[2], labels[3]);
    }
}
