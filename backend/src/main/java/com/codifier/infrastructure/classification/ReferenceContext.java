package com.codifier.infrastructure.classification;

import com.codifier.infrastructure.resolution.SectionReferenceParser;
import com.codifier.infrastructure.resolution.SectionReferenceParser.Mention;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Completes references that lack a section from the surrounding instruction:
 * in "In Section 7, omit clause (d)" the reference "clause (d)" means clause (d) of Section 7.
 */
@Component
@RequiredArgsConstructor
public class ReferenceContext {

    private final SectionReferenceParser referenceParser;

    /**
     * @param reference  reference as extracted (nullable)
     * @param spanText   full instruction text
     * @param matchStart offset of the instruction part the reference belongs to
     * @return the reference with the nearest preceding section mention appended (or the first
     *         mention of the span when none precedes), or the reference unchanged
     */
    public String complete(String reference, String spanText, int matchStart) {
        if (reference != null && referenceParser.parse(reference).isPresent()) {
            return reference;
        }
        List<Mention> mentions = referenceParser.findSectionMentions(spanText);
        if (mentions.isEmpty()) {
            return reference;
        }
        Mention context = mentions.get(0);
        for (Mention mention : mentions) {
            if (mention.start() < matchStart) {
                context = mention;
            }
        }
        return reference == null ? context.text() : reference + " of " + context.text();
    }
}
