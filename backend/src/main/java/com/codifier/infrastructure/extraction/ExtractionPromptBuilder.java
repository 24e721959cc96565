package com.codifier.infrastructure.extraction;

import com.codifier.domain.act.model.Act;
import com.codifier.domain.act.model.ActOutlineEntry;
import com.codifier.domain.amendment.model.Amendment;
import com.codifier.domain.amendment.model.InstructionSpan;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

@Component
public class ExtractionPromptBuilder {

    private static final int MAX_OUTLINE_ENTRIES = 200;

    private static final String SYSTEM_PROMPT = """
            Role: legislative drafting analyst.
            Input: one amendment instruction and the outline of the Act it amends.
            Task: list every change the instruction makes to the Act.

            Output: a JSON object
            {
              "changes": [
                {
                  "kind": "substitution | insertion | deletion | renumbering | global_replace",
                  "target_reference": "unit being changed, e.g. Section 15(2)(a) or clause (b) of Section 4",
                  "original_text": "exact words replaced or omitted, or the old reference for renumbering; null otherwise",
                  "new_text": "exact replacement or inserted text, or the new reference for renumbering; null for deletion",
                  "citation": "the exact words of the instruction this change comes from"
                }
              ]
            }

            Rules:
            - Copy quoted words exactly, without the quotation marks.
            - "wherever X occurs" is global_replace; its target_reference is "throughout the Act".
            - "after the words X insert Y" is a substitution of X with "X Y".
            - Substituting or inserting a whole unit: original_text is null and new_text is the full new text.
            - Deleting a whole unit: original_text and new_text are null.
            - Instructions that change nothing in the Act (commencement, short title) produce no changes.
            - If you cannot tell what the instruction changes, return {"changes": []}.""";

    public String getSystemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String buildUserMessage(Amendment amendment, InstructionSpan span, Act act) {
        StringBuilder sb = new StringBuilder();
        if (amendment.title() != null && !amendment.title().isBlank()) {
            sb.append("Amendment: ").append(amendment.title()).append("\n");
        }
        sb.append("Act: ").append(act.getTitle() == null ? act.getDocumentId() : act.getTitle()).append("\n");
        sb.append("Act outline:\n");
        sb.append(act.outline().stream()
                .limit(MAX_OUTLINE_ENTRIES)
                .map(ExtractionPromptBuilder::outlineLine)
                .collect(Collectors.joining("\n")));
        sb.append("\n\nInstruction (page ").append(span.location().page())
                .append(", paragraph ").append(span.location().paragraph()).append("):\n")
                .append(span.text());
        return sb.toString();
    }

    private static String outlineLine(ActOutlineEntry entry) {
        return "- " + entry.sectionPath() + ": " + entry.heading();
    }
}
