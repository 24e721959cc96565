package com.codifier.application.apply;

import com.codifier.application.apply.exception.ApplyPreconditionException;
import com.codifier.application.apply.exception.VersionConflictException;
import com.codifier.application.review.ReviewAppService;
import com.codifier.domain.act.model.Act;
import com.codifier.domain.apply.model.ApplyResult;
import com.codifier.domain.change.model.ChangeRecord;
import com.codifier.domain.review.model.Decision;
import com.codifier.domain.review.model.ReviewState;
import com.codifier.infrastructure.apply.ApplyEngine;
import com.codifier.infrastructure.apply.ReversePatcher;
import com.codifier.infrastructure.ingest.SectionLabelDetector;
import com.codifier.infrastructure.persistence.InMemoryActRepository;
import com.codifier.infrastructure.persistence.InMemoryApplyRecordRepository;
import com.codifier.infrastructure.persistence.InMemoryChangeSetRepository;
import com.codifier.infrastructure.persistence.InMemoryReviewDecisionRepository;
import com.codifier.infrastructure.resolution.SectionReferenceParser;
import com.codifier.support.ChangeRecords;
import com.codifier.support.SampleActs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.codifier.support.ChangeRecords.deleteSection;
import static com.codifier.support.ChangeRecords.substituteThirtyDays;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApplyAppServiceTest {

    private InMemoryActRepository actRepository;
    private InMemoryChangeSetRepository changeSetRepository;
    private ReviewAppService reviewAppService;
    private ApplyAppService service;
    private Act v1;

    @BeforeEach
    void setUp() {
        actRepository = new InMemoryActRepository();
        changeSetRepository = new InMemoryChangeSetRepository();
        reviewAppService = new ReviewAppService(changeSetRepository, new InMemoryReviewDecisionRepository(), actRepository);
        service = new ApplyAppService(reviewAppService, actRepository, new InMemoryApplyRecordRepository(),
                new ApplyEngine(new SectionReferenceParser(), new SectionLabelDetector()), new ReversePatcher());
        v1 = SampleActs.sampleAct();
        actRepository.saveInitial(v1);
    }

    private void storeAndAccept(String changeSetId, ChangeRecord... records) {
        changeSetRepository.save(ChangeRecords.changeSet(changeSetId, v1, records));
        for (ChangeRecord record : records) {
            reviewAppService.submitDecision(record.changeId(), Decision.ACCEPTED, "reviewer-1", ReviewState.PENDING, null);
        }
    }

    @Test
    @DisplayName("Applying accepted changes appends the next version with a manifest")
    void apply_appends_version() {
        storeAndAccept("changeset-1",
                ChangeRecords.confirmed(substituteThirtyDays(), v1),
                ChangeRecords.assessed(deleteSection("16"), v1, 80));

        ApplyResult result = service.apply("changeset-1");

        assertThat(result.newAct().getVersion()).isEqualTo(2);
        assertThat(actRepository.findHead(SampleActs.DOCUMENT_ID)).get().extracting(Act::getVersion).isEqualTo(2);
        assertThat(result.manifest().appliedCount()).isEqualTo(2);
        assertThat(service.getManifest("changeset-1")).isEqualTo(result.manifest());
        assertThat(actRepository.findVersion(SampleActs.DOCUMENT_ID, 1)).get().isSameAs(v1);
    }

    @Test
    @DisplayName("Rejected records are left out of the new version")
    void apply_skips_rejected() {
        ChangeRecord words = ChangeRecords.confirmed(substituteThirtyDays(), v1);
        ChangeRecord penalties = ChangeRecords.assessed(deleteSection("16"), v1, 80);
        storeAndAccept("changeset-1", words, penalties);
        reviewAppService.submitDecision(penalties.changeId(), Decision.REJECTED, "reviewer-2", ReviewState.ACCEPTED, null);

        ApplyResult result = service.apply("changeset-1");

        assertThat(result.manifest().entries()).singleElement()
                .extracting(entry -> entry.changeId()).isEqualTo(words.changeId());
        assertThat(result.newAct().line(16)).isPresent();
    }

    @Test
    @DisplayName("A ChangeSet extracted against an older version is refused")
    void version_conflict() {
        storeAndAccept("changeset-1", ChangeRecords.confirmed(substituteThirtyDays(), v1));
        storeAndAccept("changeset-2", ChangeRecords.assessed(deleteSection("16"), v1, 80));
        service.apply("changeset-1");

        assertThatThrownBy(() -> service.apply("changeset-2"))
                .isInstanceOf(VersionConflictException.class)
                .satisfies(e -> {
                    VersionConflictException conflict = (VersionConflictException) e;
                    assertThat(conflict.getExpectedVersion()).isEqualTo(1);
                    assertThat(conflict.getHeadVersion()).isEqualTo(2);
                });
        assertThat(actRepository.findHistory(SampleActs.DOCUMENT_ID)).hasSize(2);
    }

    @Test
    @DisplayName("Nothing accepted, nothing to apply")
    void nothing_accepted() {
        changeSetRepository.save(ChangeRecords.changeSet("changeset-1", v1,
                ChangeRecords.confirmed(substituteThirtyDays(), v1)));

        assertThatThrownBy(() -> service.apply("changeset-1"))
                .isInstanceOf(ApplyPreconditionException.class)
                .extracting("code").isEqualTo(ApplyPreconditionException.NOTHING_ACCEPTED);
        assertThatThrownBy(() -> service.getManifest("changeset-1"))
                .isInstanceOf(ApplyPreconditionException.class)
                .extracting("code").isEqualTo(ApplyPreconditionException.NOT_APPLIED);
    }

    @Test
    @DisplayName("Revert appends a version with the parent's content and can itself be reverted")
    void revert_chain() {
        storeAndAccept("changeset-1",
                ChangeRecords.confirmed(substituteThirtyDays(), v1),
                ChangeRecords.assessed(deleteSection("16"), v1, 80));
        Act v2 = service.apply("changeset-1").newAct();

        Act v3 = service.revert(SampleActs.DOCUMENT_ID);
        Act v4 = service.revert(SampleActs.DOCUMENT_ID);

        assertThat(v3.getVersion()).isEqualTo(3);
        assertThat(v3.getLines()).isEqualTo(v1.getLines());
        assertThat(v3.getSourceChangeSetId()).isNull();
        assertThat(v4.getVersion()).isEqualTo(4);
        assertThat(v4.getLines()).isEqualTo(v2.getLines());
        assertThat(v4.getRetiredLineIds()).containsExactlyInAnyOrder(15L, 16L);
    }

    @Test
    @DisplayName("The ingested version has nothing to revert")
    void revert_initial() {
        assertThatThrownBy(() -> service.revert(SampleActs.DOCUMENT_ID))
                .isInstanceOf(ApplyPreconditionException.class)
                .extracting("code").isEqualTo(ApplyPreconditionException.NOTHING_TO_REVERT);
        assertThat(actRepository.findHistory(SampleActs.DOCUMENT_ID)).extracting(Act::getVersion).containsExactly(1);
    }

    @Test
    @DisplayName("Concurrent applies against the same base version: one wins, the other conflicts")
    void concurrent_applies() throws Exception {
        storeAndAccept("changeset-1", ChangeRecords.confirmed(substituteThirtyDays(), v1));
        storeAndAccept("changeset-2", ChangeRecords.assessed(deleteSection("16"), v1, 80));
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        for (String changeSetId : List.of("changeset-1", "changeset-2")) {
            results.add(executor.submit(() -> {
                start.await();
                try {
                    service.apply(changeSetId);
                    return true;
                } catch (VersionConflictException e) {
                    return false;
                }
            }));
        }
        start.countDown();

        int successes = 0;
        for (Future<Boolean> result : results) {
            if (result.get(10, TimeUnit.SECONDS)) {
                successes++;
            }
        }
        executor.shutdown();

        assertThat(successes).isEqualTo(1);
        assertThat(actRepository.findHead(SampleActs.DOCUMENT_ID)).get().extracting(Act::getVersion).isEqualTo(2);
        assertThat(actRepository.findVersion(SampleActs.DOCUMENT_ID, 3)).isEmpty();
    }
}
