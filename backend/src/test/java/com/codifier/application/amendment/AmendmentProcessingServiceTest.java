package com.codifier.application.amendment;

import com.codifier.application.amendment.exception.AmendmentNotFoundException;
import com.codifier.application.review.ReviewAppService;
import com.codifier.domain.act.model.Act;
import com.codifier.domain.amendment.model.Amendment;
import com.codifier.domain.change.model.ChangeRecord;
import com.codifier.domain.change.model.ChangeSet;
import com.codifier.domain.change.model.ConfidenceLevel;
import com.codifier.domain.change.service.ChangeExtractor;
import com.codifier.domain.review.model.ReviewState;
import com.codifier.infrastructure.classification.InstructionClassifier;
import com.codifier.infrastructure.classification.ReferenceContext;
import com.codifier.infrastructure.extraction.ChangeSetAssembler;
import com.codifier.infrastructure.extraction.ExtractionException;
import com.codifier.infrastructure.extraction.PatternChangeExtractor;
import com.codifier.infrastructure.ingest.InstructionSegmenter;
import com.codifier.infrastructure.persistence.InMemoryActRepository;
import com.codifier.infrastructure.persistence.InMemoryAmendmentRepository;
import com.codifier.infrastructure.persistence.InMemoryChangeSetRepository;
import com.codifier.infrastructure.persistence.InMemoryReviewDecisionRepository;
import com.codifier.infrastructure.preprocessing.TextNormalizer;
import com.codifier.infrastructure.resolution.LocationResolver;
import com.codifier.infrastructure.resolution.SectionReferenceParser;
import com.codifier.infrastructure.validation.DualPassReconciler;
import com.codifier.support.SampleActs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AmendmentProcessingServiceTest {

    private static final String SUBSTITUTE = "In Section 15(2), for the words 'thirty days', substitute 'forty-five days'.";

    @Mock
    private ChangeExtractor llmExtractor;

    private InMemoryAmendmentRepository amendmentRepository;
    private InMemoryActRepository actRepository;
    private InMemoryChangeSetRepository changeSetRepository;
    private ReviewAppService reviewAppService;
    private InstructionSegmenter segmenter;
    private PatternChangeExtractor patternExtractor;

    @BeforeEach
    void setUp() {
        amendmentRepository = new InMemoryAmendmentRepository();
        actRepository = new InMemoryActRepository();
        changeSetRepository = new InMemoryChangeSetRepository();
        reviewAppService = new ReviewAppService(changeSetRepository, new InMemoryReviewDecisionRepository(), actRepository);
        segmenter = new InstructionSegmenter(new TextNormalizer());
        SectionReferenceParser parser = new SectionReferenceParser();
        patternExtractor = new PatternChangeExtractor(new InstructionClassifier(new ReferenceContext(parser)),
                new ChangeSetAssembler(new LocationResolver(parser), 1));
        actRepository.saveInitial(SampleActs.sampleAct());
        lenient().when(llmExtractor.name()).thenReturn("llm");
    }

    private AmendmentProcessingService service(String primary, String secondary, boolean autoAccept,
                                               List<ChangeExtractor> extractors) {
        return new AmendmentProcessingService(amendmentRepository, actRepository, changeSetRepository, segmenter,
                new DualPassReconciler(0.8, 15), reviewAppService, extractors, primary, secondary, 30, autoAccept);
    }

    private AmendmentProcessingService service(String secondary) {
        return service("pattern", secondary, false, List.of(patternExtractor, llmExtractor));
    }

    private ChangeExtractor patternNamed(String name) {
        return new ChangeExtractor() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public ChangeSet extract(Amendment amendment, Act act) {
                return patternExtractor.extract(amendment, act);
            }
        };
    }

    @Test
    @DisplayName("Register splits raw text into instruction spans")
    void register_raw_text() {
        Amendment amendment = service("none").register("The Sample (Amendment) Act, 2024", "Act No. 7 of 2024",
                "The Sample Act, 2020", null, "1. Delete Section 16.\n2. " + SUBSTITUTE);

        assertThat(amendment.spans()).hasSize(2);
        assertThat(service("none").getAmendment(amendment.amendmentId())).isEqualTo(amendment);
    }

    @Test
    @DisplayName("An amendment without instruction text is refused; unknown ids are not found")
    void register_refused() {
        assertThatThrownBy(() -> service("none").register("Empty", null, null, List.of(" "), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service("none").getAmendment("missing"))
                .isInstanceOf(AmendmentNotFoundException.class);
    }

    @Test
    @DisplayName("A failing secondary pass degrades to single-pass confidence with a note")
    void secondary_failure() {
        when(llmExtractor.extract(any(), any())).thenThrow(new ExtractionException("model unavailable"));
        AmendmentProcessingService service = service("llm");
        Amendment amendment = service.register("Amendment", null, null, List.of(SUBSTITUTE), null);

        ChangeSet changeSet = service.extract(amendment.amendmentId(), SampleActs.DOCUMENT_ID);

        assertThat(changeSet.notes()).anySatisfy(note -> assertThat(note)
                .contains("'llm' failed").contains("model unavailable"));
        ChangeRecord record = changeSet.records().get(0);
        assertThat(record.confidence().level()).isEqualTo(ConfidenceLevel.MEDIUM);
        assertThat(record.validation().secondaryConfirmed()).isFalse();
        assertThat(changeSetRepository.findById(changeSet.changeSetId())).isPresent();
    }

    @Test
    @DisplayName("A failing primary pass is replaced by the secondary pass")
    void primary_failure() {
        when(llmExtractor.extract(any(), any())).thenThrow(new ExtractionException("model unavailable"));
        AmendmentProcessingService service = service("llm", "pattern", false, List.of(patternExtractor, llmExtractor));
        Amendment amendment = service.register("Amendment", null, null, List.of(SUBSTITUTE), null);

        ChangeSet changeSet = service.extract(amendment.amendmentId(), SampleActs.DOCUMENT_ID);

        assertThat(changeSet.records()).hasSize(1);
        assertThat(changeSet.notes()).anySatisfy(note -> assertThat(note).contains("'pattern' used as primary"));
    }

    @Test
    @DisplayName("Extraction fails only when every pass fails")
    void all_passes_fail() {
        when(llmExtractor.extract(any(), any())).thenThrow(new ExtractionException("model unavailable"));
        AmendmentProcessingService service = service("llm", "none", false, List.of(patternExtractor, llmExtractor));
        Amendment amendment = service.register("Amendment", null, null, List.of(SUBSTITUTE), null);

        assertThatThrownBy(() -> service.extract(amendment.amendmentId(), SampleActs.DOCUMENT_ID))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("model unavailable");
    }

    @Test
    @DisplayName("A disabled secondary pass is noted on the ChangeSet")
    void secondary_disabled() {
        AmendmentProcessingService service = service("none");
        Amendment amendment = service.register("Amendment", null, null, List.of(SUBSTITUTE), null);

        ChangeSet changeSet = service.extract(amendment.amendmentId(), SampleActs.DOCUMENT_ID);

        assertThat(changeSet.notes()).anySatisfy(note -> assertThat(note).contains("disabled"));
        assertThat(changeSet.records().get(0).confidence().score()).isEqualTo(85);
    }

    @Test
    @DisplayName("Unknown pass names fail at startup")
    void unknown_pass() {
        assertThatThrownBy(() -> service("pattern", "regex", false, List.of(patternExtractor)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("regex");
        assertThatThrownBy(() -> service("llm", "none", false, List.of(patternExtractor)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("With auto-accept enabled, confirmed HIGH records are pre-selected after extraction")
    void auto_accept_after_extraction() {
        AmendmentProcessingService service = service("pattern", "twin", true,
                List.of(patternExtractor, patternNamed("twin")));
        Amendment amendment = service.register("Amendment", null, null, List.of(SUBSTITUTE, "Delete Section 99."), null);

        ChangeSet changeSet = service.extract(amendment.amendmentId(), SampleActs.DOCUMENT_ID);

        ChangeRecord confirmed = changeSet.records().stream()
                .filter(ChangeRecord::isResolved).findFirst().orElseThrow();
        ChangeRecord unresolved = changeSet.records().stream()
                .filter(record -> !record.isResolved()).findFirst().orElseThrow();
        assertThat(confirmed.confidence().score()).isEqualTo(95);
        assertThat(reviewAppService.stateOf(confirmed.changeId())).isEqualTo(ReviewState.ACCEPTED);
        assertThat(reviewAppService.stateOf(unresolved.changeId())).isEqualTo(ReviewState.PENDING);
    }
}
