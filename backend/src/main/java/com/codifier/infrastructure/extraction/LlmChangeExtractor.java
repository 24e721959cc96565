package com.codifier.infrastructure.extraction;

import com.codifier.domain.act.model.Act;
import com.codifier.domain.amendment.model.Amendment;
import com.codifier.domain.amendment.model.InstructionSpan;
import com.codifier.domain.change.model.ChangeIntent;
import com.codifier.domain.change.model.ChangeKind;
import com.codifier.domain.change.model.ChangeSet;
import com.codifier.domain.change.service.ChangeExtractor;
import com.codifier.infrastructure.ai.LlmCallException;
import com.codifier.infrastructure.ai.OpenAiChatService;
import com.codifier.infrastructure.classification.ReferenceContext;
import com.codifier.infrastructure.validation.TextMatching;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Model-based pass: asks the chat model for the changes of each instruction span, then
 * locates them with the same resolver as the pattern pass.
 *
 * <p>A failed call fails the whole pass. An answer that cannot be read, or a change that
 * does not form a valid intent, becomes an UNCLASSIFIED intent for that span.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmChangeExtractor implements ChangeExtractor {

    public static final String NAME = "llm";

    private final OpenAiChatService chatService;
    private final ExtractionPromptBuilder promptBuilder;
    private final ReferenceContext referenceContext;
    private final ChangeSetAssembler assembler;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ChangeSet extract(Amendment amendment, Act act) {
        List<ChangeIntent> intents = new ArrayList<>();
        for (InstructionSpan span : amendment.spans()) {
            String content;
            try {
                content = chatService.completeJson(promptBuilder.getSystemPrompt(),
                        promptBuilder.buildUserMessage(amendment, span, act));
            } catch (LlmCallException e) {
                throw new ExtractionException("LLM extraction failed at instruction " + span.index() + ": " + e.getMessage(), e);
            }
            intents.addAll(parseIntents(content, span));
        }
        return assembler.assemble(amendment, act, intents, NAME);
    }

    List<ChangeIntent> parseIntents(String content, InstructionSpan span) {
        JsonNode changes;
        try {
            changes = objectMapper.readTree(content).path("changes");
        } catch (JsonProcessingException e) {
            log.warn("[Extraction:llm] Unreadable answer for span {}: {}", span.index(), e.getOriginalMessage());
            return List.of(ChangeIntent.unclassified(null, span.text(), span.index(), span.location()));
        }
        if (!changes.isArray() || changes.isEmpty()) {
            return List.of(ChangeIntent.unclassified(null, span.text(), span.index(), span.location()));
        }

        List<ChangeIntent> intents = new ArrayList<>();
        for (JsonNode change : changes) {
            intents.add(toIntent(change, span));
        }
        return intents;
    }

    private ChangeIntent toIntent(JsonNode node, InstructionSpan span) {
        String kindText = text(node, "kind");
        String reference = text(node, "target_reference");
        String original = text(node, "original_text");
        String newText = text(node, "new_text");
        String citation = text(node, "citation");

        if (citation == null || !TextMatching.containsLoosely(span.text(), citation)) {
            citation = span.text();
        }

        ChangeKind kind = kindOf(kindText);
        if (kind == null) {
            log.debug("[Extraction:llm] Unknown kind '{}' for span {}", kindText, span.index());
            return ChangeIntent.unclassified(reference, citation, span.index(), span.location());
        }

        try {
            return switch (kind) {
                case GLOBAL_REPLACE -> ChangeIntent.globalReplace(
                        reference == null ? "throughout the Act" : reference, original, newText,
                        citation, span.index(), span.location());
                case INSERTION -> original == null
                        ? ChangeIntent.insertion(complete(reference, span), newText, citation, span.index(), span.location())
                        : ChangeIntent.substitution(complete(reference, span), original, original + " " + newText,
                                citation, span.index(), span.location());
                case RENUMBERING -> ChangeIntent.renumbering(
                        complete(reference != null ? reference : original, span), newText,
                        citation, span.index(), span.location());
                default -> new ChangeIntent(kind, complete(reference, span), original, newText,
                        citation, span.index(), span.location());
            };
        } catch (IllegalArgumentException e) {
            log.debug("[Extraction:llm] Invalid {} for span {}: {}", kind, span.index(), e.getMessage());
            return ChangeIntent.unclassified(reference, citation, span.index(), span.location());
        }
    }

    private String complete(String reference, InstructionSpan span) {
        return referenceContext.complete(reference, span.text(), span.text().length());
    }

    private static ChangeKind kindOf(String kind) {
        if (kind == null) {
            return null;
        }
        return switch (kind.strip().toLowerCase().replace('-', '_').replace(' ', '_')) {
            case "substitution", "substitute", "replace" -> ChangeKind.SUBSTITUTION;
            case "insertion", "insert" -> ChangeKind.INSERTION;
            case "deletion", "delete", "omission", "omit" -> ChangeKind.DELETION;
            case "renumbering", "renumber" -> ChangeKind.RENUMBERING;
            case "global_replace", "multiple_occurrence" -> ChangeKind.GLOBAL_REPLACE;
            default -> null;
        };
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().strip();
        return text.isEmpty() || "null".equalsIgnoreCase(text) ? null : text;
    }
}
