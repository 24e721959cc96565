package com.codifier.infrastructure.extraction;

import com.codifier.domain.act.model.LineRange;
import com.codifier.domain.amendment.model.Amendment;
import com.codifier.domain.amendment.model.InstructionSpan;
import com.codifier.domain.amendment.model.SourceLocation;
import com.codifier.domain.change.model.ChangeIntent;
import com.codifier.domain.change.model.ChangeKind;
import com.codifier.domain.change.model.ChangeRecord;
import com.codifier.domain.change.model.ChangeSet;
import com.codifier.infrastructure.ai.LlmCallException;
import com.codifier.infrastructure.ai.OpenAiChatService;
import com.codifier.infrastructure.classification.ReferenceContext;
import com.codifier.infrastructure.resolution.LocationResolver;
import com.codifier.infrastructure.resolution.SectionReferenceParser;
import com.codifier.support.SampleActs;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmChangeExtractorTest {

    private static final InstructionSpan SPAN =
            new InstructionSpan(0, "In Section 7, omit clause (d) and the words \"or otherwise\".", new SourceLocation(1, 1));

    @Mock
    private OpenAiChatService chatService;

    private LlmChangeExtractor extractor;

    @BeforeEach
    void setUp() {
        SectionReferenceParser parser = new SectionReferenceParser();
        extractor = new LlmChangeExtractor(chatService, new ExtractionPromptBuilder(), new ReferenceContext(parser),
                new ChangeSetAssembler(new LocationResolver(parser), 1), new ObjectMapper());
    }

    @Test
    @DisplayName("Extracted changes are located in the Act and tagged with the pass name")
    void extract_locates_changes() {
        Amendment amendment = SampleActs.amendment("In Section 15(2), for the words 'thirty days', substitute 'forty-five days'.");
        when(chatService.completeJson(anyString(), contains("thirty days"))).thenReturn("""
                {"changes":[{"kind":"substitution","target_reference":"Section 15(2)",
                  "original_text":"thirty days","new_text":"forty-five days","citation":"for the words 'thirty days'"}]}""");

        ChangeSet changeSet = extractor.extract(amendment, SampleActs.sampleAct());

        assertThat(changeSet.records()).hasSize(1);
        ChangeRecord record = changeSet.records().get(0);
        assertThat(record.extractedBy()).isEqualTo(LlmChangeExtractor.NAME);
        assertThat(record.range()).isEqualTo(LineRange.single(12));
        assertThat(record.sourceCitation()).isEqualTo("for the words 'thirty days'");
        assertThat(record.contextBefore()).isEqualTo("(1) Any person aggrieved may appeal to the District Magistrate.");
        assertThat(record.contextAfter()).isEqualTo("(a) the appeal shall be in writing;");
    }

    @Test
    @DisplayName("A failed model call fails the whole pass")
    void extract_call_failure() {
        Amendment amendment = SampleActs.amendment("Delete Section 16.");
        when(chatService.completeJson(anyString(), anyString())).thenThrow(new LlmCallException("timeout"));

        assertThatThrownBy(() -> extractor.extract(amendment, SampleActs.sampleAct()))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("instruction 0");
    }

    @Test
    @DisplayName("Section-less references are completed from the instruction")
    void parse_completes_reference() {
        List<ChangeIntent> intents = extractor.parseIntents("""
                {"changes":[
                  {"kind":"deletion","target_reference":"clause (d)","original_text":null,"new_text":null,"citation":"omit clause (d)"},
                  {"kind":"omit","target_reference":"Section 7","original_text":"or otherwise","new_text":null,"citation":"the words \\"or otherwise\\""}
                ]}""", SPAN);

        assertThat(intents).extracting(ChangeIntent::kind).containsExactly(ChangeKind.DELETION, ChangeKind.DELETION);
        assertThat(intents.get(0).targetReference()).isEqualTo("clause (d) of Section 7");
        assertThat(intents.get(1).originalText()).isEqualTo("or otherwise");
    }

    @Test
    @DisplayName("Insertion after words becomes a substitution of the anchor")
    void parse_insert_after_words() {
        List<ChangeIntent> intents = extractor.parseIntents("""
                {"changes":[{"kind":"insertion","target_reference":"Section 7","original_text":"or otherwise",
                  "new_text":"in any manner","citation":null}]}""", SPAN);

        ChangeIntent intent = intents.get(0);
        assertThat(intent.kind()).isEqualTo(ChangeKind.SUBSTITUTION);
        assertThat(intent.originalText()).isEqualTo("or otherwise");
        assertThat(intent.newText()).isEqualTo("or otherwise in any manner");
    }

    @Test
    @DisplayName("Global replacement without a reference applies throughout the Act")
    void parse_global_replace() {
        ChangeIntent intent = extractor.parseIntents("""
                {"changes":[{"kind":"global_replace","original_text":"Collector","new_text":"District Collector"}]}""",
                SPAN).get(0);

        assertThat(intent.kind()).isEqualTo(ChangeKind.GLOBAL_REPLACE);
        assertThat(intent.targetReference()).isEqualTo("throughout the Act");
    }

    @Test
    @DisplayName("Citations that are not in the instruction are replaced by the instruction text")
    void parse_foreign_citation() {
        ChangeIntent intent = extractor.parseIntents("""
                {"changes":[{"kind":"deletion","target_reference":"clause (d) of Section 7",
                  "citation":"Omit the entire Chapter."}]}""", SPAN).get(0);

        assertThat(intent.sourceCitation()).isEqualTo(SPAN.text());
    }

    @Test
    @DisplayName("Unreadable, empty or malformed answers become unclassified intents")
    void parse_unusable_answers() {
        assertThat(extractor.parseIntents("not json", SPAN))
                .singleElement().extracting(ChangeIntent::kind).isEqualTo(ChangeKind.UNCLASSIFIED);
        assertThat(extractor.parseIntents("{\"changes\":[]}", SPAN))
                .singleElement().extracting(ChangeIntent::kind).isEqualTo(ChangeKind.UNCLASSIFIED);
        assertThat(extractor.parseIntents("{\"changes\":[{\"kind\":\"repeal\",\"target_reference\":\"Section 7\"}]}", SPAN))
                .singleElement().extracting(ChangeIntent::kind).isEqualTo(ChangeKind.UNCLASSIFIED);
        assertThat(extractor.parseIntents(
                "{\"changes\":[{\"kind\":\"deletion\",\"target_reference\":\"Section 7\",\"new_text\":\"something\"}]}", SPAN))
                .singleElement().extracting(ChangeIntent::kind).isEqualTo(ChangeKind.UNCLASSIFIED);
    }
}
