package com.codifier.domain.act.model;

import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hierarchical address of a line inside an Act: Section → Subsection → Clause → Sub-clause.
 * Intermediate levels may be absent ("clause (b) of section 4" has no subsection).
 *
 * <p>Paths are totally ordered so that a parent precedes its children and siblings follow
 * their label order (numeric labels by value, sub-clauses by roman value, letters alphabetically).
 *
 * @param section    section label, e.g. "15" or "15A" (nullable only for {@link #ROOT})
 * @param subsection subsection label, e.g. "2" (nullable)
 * @param clause     clause label, e.g. "a" (nullable)
 * @param subClause  sub-clause label, e.g. "ii" (nullable)
 */
public record SectionPath(
        String section,
        String subsection,
        String clause,
        String subClause
) implements Comparable<SectionPath> {

    /** Address of lines that precede the first section (long title, preamble). */
    public static final SectionPath ROOT = new SectionPath(null, null, null, null);

    private static final Pattern NUMERIC_LABEL = Pattern.compile("(\\d+)([A-Za-z]*)");
    private static final Pattern ROMAN_LABEL = Pattern.compile("[ivxlc]+");
    private static final Map<Character, Integer> ROMAN_VALUES = Map.of(
            'i', 1, 'v', 5, 'x', 10, 'l', 50, 'c', 100);

    public SectionPath {
        section = normalize(section, true);
        subsection = normalize(subsection, true);
        clause = normalize(clause, false);
        subClause = normalize(subClause, false);
        if (section == null && (subsection != null || clause != null || subClause != null)) {
            throw new IllegalArgumentException("A section path below section level requires a section");
        }
    }

    public static SectionPath ofSection(String section) {
        return new SectionPath(section, null, null, null);
    }

    public boolean isRoot() {
        return section == null;
    }

    public String label(SectionLevel level) {
        return switch (level) {
            case SECTION -> section;
            case SUBSECTION -> subsection;
            case CLAUSE -> clause;
            case SUB_CLAUSE -> subClause;
        };
    }

    /**
     * Deepest level carrying a label, or null for {@link #ROOT}.
     */
    public SectionLevel deepestLevel() {
        if (subClause != null) return SectionLevel.SUB_CLAUSE;
        if (clause != null) return SectionLevel.CLAUSE;
        if (subsection != null) return SectionLevel.SUBSECTION;
        if (section != null) return SectionLevel.SECTION;
        return null;
    }

    public String deepestLabel() {
        SectionLevel level = deepestLevel();
        return level == null ? null : label(level);
    }

    /**
     * Returns a copy with the given level relabelled and every deeper level cleared.
     */
    public SectionPath withLabel(SectionLevel level, String label) {
        return switch (level) {
            case SECTION -> new SectionPath(label, null, null, null);
            case SUBSECTION -> new SectionPath(section, label, null, null);
            case CLAUSE -> new SectionPath(section, subsection, label, null);
            case SUB_CLAUSE -> new SectionPath(section, subsection, clause, label);
        };
    }

    /**
     * True when {@code other} is this unit or lies inside it. Every level down to this
     * path's deepest level must match exactly, absent levels included.
     */
    public boolean contains(SectionPath other) {
        SectionLevel deepest = deepestLevel();
        if (deepest == null) {
            return true;
        }
        for (SectionLevel level : SectionLevel.values()) {
            if (!Objects.equals(label(level), other.label(level))) {
                return false;
            }
            if (level == deepest) {
                return true;
            }
        }
        return true;
    }

    /**
     * Moves {@code descendant} from this unit to {@code target}: levels down to this path's
     * deepest level are taken from {@code target}, deeper levels are kept.
     */
    public SectionPath rebase(SectionPath descendant, SectionPath target) {
        if (!contains(descendant)) {
            throw new IllegalArgumentException(descendant + " is not inside " + this);
        }
        int depth = deepestLevel().ordinal();
        String[] labels = new String[4];
        for (SectionLevel level : SectionLevel.values()) {
            labels[level.ordinal()] = level.ordinal() <= depth ? target.label(level) : descendant.label(level);
        }
        return new SectionPath(labels[0], labels[1], labels[2], labels[3]);
    }

    @Override
    public int compareTo(SectionPath other) {
        for (SectionLevel level : SectionLevel.values()) {
            int cmp = compareLabels(label(level), other.label(level), level);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    /**
     * Distance between two labels of the same level, used for nearest-match lookups.
     */
    public static int labelDistance(String a, String b, SectionLevel level) {
        if (a == null || b == null) {
            return Integer.MAX_VALUE / 2;
        }
        Matcher ma = NUMERIC_LABEL.matcher(a);
        Matcher mb = NUMERIC_LABEL.matcher(b);
        if (ma.matches() && mb.matches()) {
            return Math.abs(Integer.parseInt(ma.group(1)) - Integer.parseInt(mb.group(1)));
        }
        if (level == SectionLevel.SUB_CLAUSE && isRoman(a) && isRoman(b)) {
            return Math.abs(romanValue(a) - romanValue(b));
        }
        return Math.abs(letterValue(a) - letterValue(b));
    }

    static int compareLabels(String a, String b, SectionLevel level) {
        if (Objects.equals(a, b)) return 0;
        if (a == null) return -1;
        if (b == null) return 1;

        Matcher ma = NUMERIC_LABEL.matcher(a);
        Matcher mb = NUMERIC_LABEL.matcher(b);
        if (ma.matches() && mb.matches()) {
            int cmp = Integer.compare(Integer.parseInt(ma.group(1)), Integer.parseInt(mb.group(1)));
            return cmp != 0 ? cmp : ma.group(2).compareToIgnoreCase(mb.group(2));
        }
        if (ma.matches()) return -1;
        if (mb.matches()) return 1;

        if (level == SectionLevel.SUB_CLAUSE && isRoman(a) && isRoman(b)) {
            return Integer.compare(romanValue(a), romanValue(b));
        }
        return Comparator.<String>naturalOrder().compare(a.toLowerCase(), b.toLowerCase());
    }

    public static boolean isRoman(String label) {
        return label != null && ROMAN_LABEL.matcher(label).matches();
    }

    public static int romanValue(String roman) {
        int total = 0;
        int previous = 0;
        for (int i = roman.length() - 1; i >= 0; i--) {
            int value = ROMAN_VALUES.get(roman.charAt(i));
            total += value < previous ? -value : value;
            previous = Math.max(previous, value);
        }
        return total;
    }

    private static int letterValue(String label) {
        int value = 0;
        for (char c : label.toLowerCase().toCharArray()) {
            value = value * 27 + (Character.isLetter(c) ? c - 'a' + 1 : 0);
        }
        return value;
    }

    private static String normalize(String label, boolean upperSuffix) {
        if (label == null || label.isBlank()) {
            return null;
        }
        String trimmed = label.strip();
        return upperSuffix ? trimmed.toUpperCase() : trimmed.toLowerCase();
    }

    /**
     * Renders the path the way Acts cite it, e.g. "Section 15(2)(a)(ii)".
     */
    @Override
    public String toString() {
        if (isRoot()) {
            return "Preamble";
        }
        StringBuilder sb = new StringBuilder("Section ").append(section);
        if (subsection != null) sb.append('(').append(subsection).append(')');
        if (clause != null) sb.append('(').append(clause).append(')');
        if (subClause != null) sb.append('(').append(subClause).append(')');
        return sb.toString();
    }
}
