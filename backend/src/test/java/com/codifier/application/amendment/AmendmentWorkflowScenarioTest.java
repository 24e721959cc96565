package com.codifier.application.amendment;

import com.codifier.application.apply.ApplyAppService;
import com.codifier.application.apply.exception.VersionConflictException;
import com.codifier.application.review.ReviewAppService;
import com.codifier.domain.act.model.Act;
import com.codifier.domain.act.model.LineRange;
import com.codifier.domain.amendment.model.Amendment;
import com.codifier.domain.apply.model.ApplyResult;
import com.codifier.domain.change.model.ChangeKind;
import com.codifier.domain.change.model.ChangeRecord;
import com.codifier.domain.change.model.ChangeSet;
import com.codifier.domain.change.model.ConfidenceLevel;
import com.codifier.domain.change.model.ResolutionFailure;
import com.codifier.domain.change.model.ReviewRequirement;
import com.codifier.domain.review.model.Decision;
import com.codifier.domain.review.model.ReviewState;
import com.codifier.infrastructure.ai.OpenAiChatService;
import com.codifier.infrastructure.apply.ApplyEngine;
import com.codifier.infrastructure.apply.ReversePatcher;
import com.codifier.infrastructure.classification.InstructionClassifier;
import com.codifier.infrastructure.classification.ReferenceContext;
import com.codifier.infrastructure.extraction.ChangeSetAssembler;
import com.codifier.infrastructure.extraction.ExtractionPromptBuilder;
import com.codifier.infrastructure.extraction.LlmChangeExtractor;
import com.codifier.infrastructure.extraction.PatternChangeExtractor;
import com.codifier.infrastructure.ingest.InstructionSegmenter;
import com.codifier.infrastructure.ingest.SectionLabelDetector;
import com.codifier.infrastructure.persistence.InMemoryActRepository;
import com.codifier.infrastructure.persistence.InMemoryAmendmentRepository;
import com.codifier.infrastructure.persistence.InMemoryApplyRecordRepository;
import com.codifier.infrastructure.persistence.InMemoryChangeSetRepository;
import com.codifier.infrastructure.persistence.InMemoryReviewDecisionRepository;
import com.codifier.infrastructure.preprocessing.TextNormalizer;
import com.codifier.infrastructure.resolution.LocationResolver;
import com.codifier.infrastructure.resolution.SectionReferenceParser;
import com.codifier.infrastructure.validation.DualPassReconciler;
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
import static org.mockito.Mockito.lenient;

/**
 * Ingest, extract with both passes, review and apply, with the model answers stubbed.
 */
@ExtendWith(MockitoExtension.class)
class AmendmentWorkflowScenarioTest {

    private static final String SUBSTITUTE = "In Section 15(2), for the words 'thirty days', substitute 'forty-five days'.";
    private static final String GLOBAL = "Wherever \"District Magistrate\" occurs, substitute \"District Commissioner\".";
    private static final String OMIT_WORDS = "In Section 16, the words \"with fine\" shall be omitted.";
    private static final String MISSING = "Delete Section 99.";

    @Mock
    private OpenAiChatService chatService;

    private AmendmentProcessingService amendments;
    private ReviewAppService review;
    private ApplyAppService apply;

    @BeforeEach
    void setUp() {
        InMemoryActRepository actRepository = new InMemoryActRepository();
        InMemoryChangeSetRepository changeSetRepository = new InMemoryChangeSetRepository();
        SectionReferenceParser parser = new SectionReferenceParser();
        TextNormalizer normalizer = new TextNormalizer();
        ReferenceContext referenceContext = new ReferenceContext(parser);
        ChangeSetAssembler assembler = new ChangeSetAssembler(new LocationResolver(parser), 1);

        review = new ReviewAppService(changeSetRepository, new InMemoryReviewDecisionRepository(), actRepository);
        apply = new ApplyAppService(review, actRepository, new InMemoryApplyRecordRepository(),
                new ApplyEngine(parser, new SectionLabelDetector()), new ReversePatcher());
        amendments = new AmendmentProcessingService(new InMemoryAmendmentRepository(), actRepository, changeSetRepository,
                new InstructionSegmenter(normalizer), new DualPassReconciler(0.8, 15), review,
                List.of(new PatternChangeExtractor(new InstructionClassifier(referenceContext), assembler),
                        new LlmChangeExtractor(chatService, new ExtractionPromptBuilder(), referenceContext, assembler,
                                new ObjectMapper())),
                "pattern", "llm", 30, false);

        actRepository.saveInitial(SampleActs.sampleAct());
        lenient().when(chatService.completeJson(anyString(), anyString()))
                .thenAnswer(invocation -> modelAnswer(invocation.getArgument(1)));
    }

    private static String modelAnswer(String userMessage) {
        if (userMessage.contains("thirty days")) {
            return """
                    {"changes":[{"kind":"substitution","target_reference":"Section 15(2)","original_text":"thirty days",
                      "new_text":"forty-five days","citation":"for the words 'thirty days', substitute 'forty-five days'"}]}""";
        }
        if (userMessage.contains("Wherever")) {
            return """
                    {"changes":[{"kind":"global_replace","target_reference":"throughout the Act",
                      "original_text":"District Magistrate","new_text":"District Commissioner",
                      "citation":"Wherever \\"District Magistrate\\" occurs"}]}""";
        }
        if (userMessage.contains("with fine")) {
            return """
                    {"changes":[{"kind":"deletion","target_reference":"Section 16","original_text":"with fine",
                      "new_text":null,"citation":"the words \\"with fine\\" shall be omitted"}]}""";
        }
        if (userMessage.contains("Section 99")) {
            return """
                    {"changes":[{"kind":"deletion","target_reference":"Section 99","citation":"Delete Section 99."}]}""";
        }
        return "{\"changes\":[]}";
    }

    private ChangeSet extract(String... instructions) {
        Amendment amendment = amendments.register("The Sample (Amendment) Act, 2024", "Act No. 7 of 2024",
                "The Sample Act, 2020", List.of(instructions), null);
        return amendments.extract(amendment.amendmentId(), SampleActs.DOCUMENT_ID);
    }

    private static ChangeRecord onLine(ChangeSet changeSet, long lineId) {
        return changeSet.records().stream()
                .filter(record -> LineRange.single(lineId).equals(record.range()))
                .findFirst().orElseThrow();
    }

    @Test
    @DisplayName("Both passes agree on a word substitution: one HIGH record, auto-accept eligible")
    void agreeing_passes() {
        ChangeSet changeSet = extract(SUBSTITUTE);

        assertThat(changeSet.records()).singleElement().satisfies(record -> {
            assertThat(record.kind()).isEqualTo(ChangeKind.SUBSTITUTION);
            assertThat(record.range()).isEqualTo(LineRange.single(12));
            assertThat(record.confidence().score()).isEqualTo(95);
            assertThat(record.validation().secondaryConfirmed()).isTrue();
            assertThat(record.reviewRequirement()).isEqualTo(ReviewRequirement.AUTO_ACCEPT_ELIGIBLE);
            assertThat(record.sourceCitation()).isEqualTo(SUBSTITUTE);
        });
        assertThat(changeSet.incomplete()).isFalse();
    }

    @Test
    @DisplayName("Global replacement reviewed record by record; only accepted occurrences are applied")
    void global_replace_partial_acceptance() {
        ChangeSet changeSet = extract(GLOBAL);
        assertThat(changeSet.records()).hasSize(3)
                .allSatisfy(record -> assertThat(record.confidence().level()).isEqualTo(ConfidenceLevel.HIGH));

        ChangeRecord definition = onLine(changeSet, 6);
        review.submitDecision(definition.changeId(), Decision.REJECTED, "reviewer-1", ReviewState.PENDING,
                "the definition keeps the old designation");
        review.bulkDecision(changeSet.changeSetId(),
                List.of(onLine(changeSet, 9).changeId(), onLine(changeSet, 11).changeId()),
                Decision.ACCEPTED, "reviewer-1", null);
        ApplyResult result = apply.apply(changeSet.changeSetId());

        Act v2 = result.newAct();
        assertThat(v2.getVersion()).isEqualTo(2);
        assertThat(v2.line(6).orElseThrow().text()).contains("District Magistrate");
        assertThat(v2.line(9).orElseThrow().text()).contains("District Commissioner");
        assertThat(v2.line(11).orElseThrow().text()).contains("District Commissioner");
        assertThat(result.manifest().appliedCount()).isEqualTo(2);
        assertThat(result.manifest().entries()).allSatisfy(entry -> assertThat(entry.reviewerId()).isEqualTo("reviewer-1"));
    }

    @Test
    @DisplayName("A ChangeSet extracted before another apply must be extracted again")
    void version_conflict_then_reextract() {
        ChangeSet first = extract(SUBSTITUTE);
        ChangeSet second = extract(OMIT_WORDS);
        review.autoAccept(first.changeSetId());
        review.autoAccept(second.changeSetId());
        apply.apply(first.changeSetId());

        assertThatThrownBy(() -> apply.apply(second.changeSetId()))
                .isInstanceOf(VersionConflictException.class);

        ChangeSet again = extract(OMIT_WORDS);
        assertThat(again.actVersion()).isEqualTo(2);
        review.autoAccept(again.changeSetId());
        Act v3 = apply.apply(again.changeSetId()).newAct();

        assertThat(v3.getVersion()).isEqualTo(3);
        assertThat(v3.line(16).orElseThrow().text()).isEqualTo("Whoever contravenes this Act shall be punished.");
        assertThat(v3.line(12).orElseThrow().text()).contains("forty-five days");
    }

    @Test
    @DisplayName("A reference to a missing section stays visible as one LOW record for a supervisor")
    void unresolved_reference() {
        ChangeSet changeSet = extract(MISSING);

        assertThat(changeSet.records()).singleElement().satisfies(record -> {
            assertThat(record.isResolved()).isFalse();
            assertThat(record.resolution().failure()).isEqualTo(ResolutionFailure.REFERENCE_NOT_FOUND);
            assertThat(record.confidence().level()).isEqualTo(ConfidenceLevel.LOW);
            assertThat(record.reviewRequirement()).isEqualTo(ReviewRequirement.SUPERVISOR);
        });
        assertThat(changeSet.incomplete()).isTrue();
        assertThat(review.listPending(changeSet.changeSetId(), ConfidenceLevel.LOW)).hasSize(1);
    }
}
