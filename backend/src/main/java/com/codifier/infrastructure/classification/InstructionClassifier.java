package com.codifier.infrastructure.classification;

import com.codifier.domain.amendment.model.InstructionSpan;
import com.codifier.domain.change.model.ChangeIntent;
import com.codifier.domain.change.model.ChangeKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies one instruction span into change intents with a prioritized pattern table.
 *
 * <p>Patterns are tried in priority order (more specific first). A pattern claims the region
 * it matched; later patterns may only match regions nobody claimed, so one span can yield
 * several non-overlapping intents ("delete clause (b) and renumber clause (c) as clause (b)").
 * A span that no pattern matches yields a single UNCLASSIFIED intent; nothing is dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InstructionClassifier {

    private static final String Q = "[\"'‘’“”]";
    private static final String QUOTED = Q + "([^\"‘’“”]+?)" + Q;
    private static final String WORDS = "(?:the\\s+words?(?:\\s*,\\s*letters?\\s+(?:and|or)\\s+figures?)?\\s+)?";

    private static final String UNIT = "(?:sub-?\\s?clause|clause|sub-?\\s?section|section|sec\\.)\\s*"
            + "(?:\\(\\s*[0-9A-Za-z]+\\s*\\)|\\d+[A-Za-z]*)(?:\\s*\\(\\s*[0-9A-Za-z]+\\s*\\))*";
    private static final String OUTER = "(?:the\\s+)?(?:[a-z]+\\s+)?(?:schedule|chapter|part|form|annexure|appendix)"
            + "(?:\\s+[0-9ivxlc]+[a-z]?\\b)?";
    private static final String REF = "(?:" + UNIT + "(?:\\s*,?\\s+of\\s+(?:the\\s+)?(?:" + UNIT + "|" + OUTER + "))*|" + OUTER + ")";

    private static final String IN_REF = "(?:in\\s+(?<ref>" + REF + ")\\s*,?\\s*)?";
    private static final String FOLLOWING = "\\s*,?\\s*(?:namely\\s*)?[:,\\-\u2013\u2014]*\\s*(?<new>.+)$";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL | Pattern.UNICODE_CASE;

    private record PatternEntry(Pattern pattern, ChangeKind kind, Function<Matcher, Extracted> template) {}

    /** Raw captures of one match; {@code reference} may still need context. */
    private record Extracted(String reference, String originalText, String newText) {}

    /**
     * Patterns in priority order (higher priority = earlier in list).
     */
    private static final List<PatternEntry> PATTERNS = List.of(
            // 1. Renumbering: "Section 15A shall be renumbered as Section 15B", "renumber clause (c) as clause (b)"
            entry("(?<ref>" + REF + ")\\s*,?\\s*(?:shall\\s+be\\s+|is\\s+(?:hereby\\s+)?)?re-?numbered\\s+as\\s+(?<new>" + REF + ")",
                    ChangeKind.RENUMBERING, m -> new Extracted(m.group("ref"), m.group("ref"), m.group("new"))),
            entry("re-?number\\s+(?<ref>" + REF + ")\\s+as\\s+(?<new>" + REF + ")",
                    ChangeKind.RENUMBERING, m -> new Extracted(m.group("ref"), m.group("ref"), m.group("new"))),

            // 2. Global replacement: "for the words 'X' wherever they occur, the words 'Y' shall be substituted"
            entry("for\\s+" + WORDS + quoted("old") + "\\s*,?\\s*wherever\\s+(?:they|it)\\s+occurs?\\s*,?\\s*"
                            + "(?:" + WORDS + quoted("new") + "\\s+shall\\s+be\\s+substituted|(?:substitute|read)\\s+" + WORDS + quoted("new2") + ")",
                    ChangeKind.GLOBAL_REPLACE, m -> global(m)),
            entry("wherever\\s+" + WORDS + quoted("old") + "\\s+occurs?\\s*(?:in\\s+the\\s+(?:principal\\s+)?act\\s*)?,?\\s*"
                            + "(?:substitute\\s+" + WORDS + quoted("new") + "|(?:it|they)\\s+shall\\s+be\\s+(?:substituted|replaced)\\s+(?:by|with)\\s+" + WORDS + quoted("new2") + ")",
                    ChangeKind.GLOBAL_REPLACE, m -> global(m)),
            entry("substitute\\s+" + WORDS + quoted("new") + "\\s+for\\s+" + WORDS + quoted("old") + "\\s*,?\\s*wherever\\s+(?:they|it)\\s+occurs?",
                    ChangeKind.GLOBAL_REPLACE, m -> global(m)),

            // 3. Insert words: "after the words 'X', insert 'Y'" (modelled as substituting X with "X Y")
            entry(IN_REF + "(?<pos>after|before)\\s+" + WORDS + quoted("old") + "\\s*,?\\s*"
                            + "(?:insert\\s+" + WORDS + quoted("new") + "|" + WORDS + quoted("new2") + "\\s+shall\\s+be\\s+inserted)",
                    ChangeKind.SUBSTITUTION, m -> {
                        String anchor = m.group("old");
                        String inserted = first(m, "new", "new2");
                        String combined = "after".equalsIgnoreCase(m.group("pos"))
                                ? anchor + " " + inserted
                                : inserted + " " + anchor;
                        return new Extracted(m.group("ref"), anchor, combined);
                    }),

            // 4. Substitute words: "for the words 'X', substitute 'Y'", "substitute 'Y' for 'X'"
            entry(IN_REF + "for\\s+" + WORDS + quoted("old") + "\\s*,?\\s*"
                            + "(?:(?:substitute|read)\\s+" + WORDS + quoted("new") + "|" + WORDS + quoted("new2") + "\\s+shall\\s+be\\s+substituted)",
                    ChangeKind.SUBSTITUTION, m -> new Extracted(m.group("ref"), m.group("old"), first(m, "new", "new2"))),
            entry(IN_REF + "substitute\\s+" + WORDS + quoted("new") + "\\s+for\\s+" + WORDS + quoted("old"),
                    ChangeKind.SUBSTITUTION, m -> new Extracted(m.group("ref"), m.group("old"), m.group("new"))),

            // 5. Substitute unit: "for Section 12, the following section shall be substituted, namely: ..."
            entry("for\\s+(?<ref>" + REF + ")\\s*,?\\s*(?:the\\s+following(?:\\s+[a-z\\-]+){0,2}\\s+shall\\s+be\\s+substituted|substitute\\s+the\\s+following(?:\\s+[a-z\\-]+)?)" + FOLLOWING,
                    ChangeKind.SUBSTITUTION, m -> new Extracted(m.group("ref"), null, unquote(m.group("new")))),
            entry("substitute\\s+(?<ref>" + REF + ")\\s+(?:with|by)\\s*(?:the\\s+following(?:\\s+[a-z\\-]+)?)?" + FOLLOWING,
                    ChangeKind.SUBSTITUTION, m -> new Extracted(m.group("ref"), null, unquote(m.group("new")))),
            entry("(?<ref>" + REF + ")\\s+shall\\s+be\\s+(?:substituted|replaced)\\s+(?:by|with)\\s*(?:the\\s+following(?:\\s+[a-z\\-]+)?)?" + FOLLOWING,
                    ChangeKind.SUBSTITUTION, m -> new Extracted(m.group("ref"), null, unquote(m.group("new")))),

            // 6. Insert unit: "after Section 15, the following section shall be inserted, namely: ..."
            entry("after\\s+(?<ref>" + REF + ")\\s*,?\\s*(?:the\\s+following(?:\\s+[a-z\\-]+){0,2}\\s+shall\\s+be\\s+inserted|insert\\s+the\\s+following(?:\\s+[a-z\\-]+)?)" + FOLLOWING,
                    ChangeKind.INSERTION, m -> new Extracted(m.group("ref"), null, unquote(m.group("new")))),
            entry("insert\\s+(?:the\\s+following(?:\\s+[a-z\\-]+)?\\s+)?after\\s+(?<ref>" + REF + ")" + FOLLOWING,
                    ChangeKind.INSERTION, m -> new Extracted(m.group("ref"), null, unquote(m.group("new")))),

            // 7. Omit words: "the words 'X' shall be omitted", "omit the words 'X'"
            entry(IN_REF + WORDS + quoted("old") + "\\s*,?\\s*(?:occurring\\s+[a-z]+(?:\\s+[a-z]+)?\\s*,?\\s*)?shall\\s+be\\s+(?:omitted|deleted)",
                    ChangeKind.DELETION, m -> new Extracted(m.group("ref"), m.group("old"), null)),
            entry(IN_REF + "(?:omit|delete)\\s+" + WORDS + quoted("old") + "(?:\\s*,?\\s*(?:from|in)\\s+(?<ref2>" + REF + "))?",
                    ChangeKind.DELETION, m -> new Extracted(first(m, "ref", "ref2"), m.group("old"), null)),

            // 8. Delete unit: "Delete Section 99", "clause (d) shall be omitted"
            entry("(?:omit|delete)\\s+(?<ref>" + REF + ")",
                    ChangeKind.DELETION, m -> new Extracted(m.group("ref"), null, null)),
            entry("(?<ref>" + REF + ")\\s*(?:of\\s+the\\s+principal\\s+act\\s*)?,?\\s*shall\\s+be\\s+(?:omitted|deleted)",
                    ChangeKind.DELETION, m -> new Extracted(m.group("ref"), null, null))
    );

    private final ReferenceContext referenceContext;

    /**
     * Classify one span.
     *
     * @param span instruction span
     * @return intents in text order; never empty
     */
    public List<ChangeIntent> classify(InstructionSpan span) {
        String text = span.text();
        List<Claim> claims = new ArrayList<>();

        for (PatternEntry entry : PATTERNS) {
            Matcher matcher = entry.pattern.matcher(text);
            while (matcher.find()) {
                if (matcher.end() == matcher.start()) {
                    continue;
                }
                int start = matcher.start();
                int end = matcher.end();
                boolean overlaps = claims.stream().anyMatch(c -> start < c.end && c.start < end);
                if (!overlaps) {
                    claims.add(new Claim(start, end, entry, entry.template.apply(matcher)));
                }
            }
        }

        if (claims.isEmpty()) {
            log.debug("[Classifier] Span {} matched no pattern", span.index());
            return List.of(ChangeIntent.unclassified(null, text, span.index(), span.location()));
        }

        claims.sort(Comparator.comparingInt(Claim::start));
        List<ChangeIntent> intents = new ArrayList<>();
        for (Claim claim : claims) {
            intents.add(toIntent(claim, span));
        }
        log.debug("[Classifier] Span {} -> {}", span.index(),
                intents.stream().map(ChangeIntent::kind).toList());
        return intents;
    }

    private ChangeIntent toIntent(Claim claim, InstructionSpan span) {
        Extracted extracted = claim.extracted;
        String reference = extracted.reference() == null ? null : extracted.reference().strip();
        ChangeKind kind = claim.entry.kind;

        if (kind == ChangeKind.GLOBAL_REPLACE) {
            return ChangeIntent.globalReplace("wherever \"" + extracted.originalText() + "\" occurs",
                    extracted.originalText(), extracted.newText(), span.text(), span.index(), span.location());
        }

        reference = referenceContext.complete(reference, span.text(), claim.start);
        if (reference == null) {
            // word change without any location: keep the matched wording so the record stays traceable
            reference = span.text().substring(claim.start, claim.end).strip();
        }

        try {
            return new ChangeIntent(kind, reference, extracted.originalText(), extracted.newText(),
                    span.text(), span.index(), span.location());
        } catch (IllegalArgumentException e) {
            log.warn("[Classifier] Span {} matched {} but could not form an intent: {}", span.index(), kind, e.getMessage());
            return ChangeIntent.unclassified(reference, span.text(), span.index(), span.location());
        }
    }

    private record Claim(int start, int end, PatternEntry entry, Extracted extracted) {}

    private static PatternEntry entry(String regex, ChangeKind kind, Function<Matcher, Extracted> template) {
        return new PatternEntry(Pattern.compile(regex, FLAGS), kind, template);
    }

    private static String quoted(String group) {
        return Q + "(?<" + group + ">[^\"‘’“”]+?)" + Q;
    }

    private static Extracted global(Matcher m) {
        return new Extracted(null, m.group("old"), first(m, "new", "new2"));
    }

    private static String first(Matcher m, String... groups) {
        String regex = m.pattern().pattern();
        for (String group : groups) {
            if (regex.contains("(?<" + group + ">") && m.group(group) != null) {
                return m.group(group);
            }
        }
        return null;
    }

    private static String unquote(String text) {
        String stripped = text.strip();
        if (stripped.endsWith(".") && stripped.length() > 1 && isQuote(stripped.charAt(stripped.length() - 2))) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        if (stripped.length() >= 2 && isQuote(stripped.charAt(0)) && isQuote(stripped.charAt(stripped.length() - 1))) {
            stripped = stripped.substring(1, stripped.length() - 1).strip();
        }
        return stripped;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '‘' || c == '’' || c == '“' || c == '”';
    }
}
