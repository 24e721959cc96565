package com.codifier.application.review;

import com.codifier.application.review.exception.ChangeConflictException;
import com.codifier.application.review.exception.ChangeNotFoundException;
import com.codifier.application.review.exception.InvalidTransitionException;
import com.codifier.application.review.exception.StaleReviewException;
import com.codifier.domain.act.model.Act;
import com.codifier.domain.change.model.ChangeRecord;
import com.codifier.domain.change.model.ConfidenceLevel;
import com.codifier.domain.review.model.Decision;
import com.codifier.domain.review.model.ReviewDecision;
import com.codifier.domain.review.model.ReviewState;
import com.codifier.infrastructure.persistence.InMemoryActRepository;
import com.codifier.infrastructure.persistence.InMemoryChangeSetRepository;
import com.codifier.infrastructure.persistence.InMemoryReviewDecisionRepository;
import com.codifier.support.ChangeRecords;
import com.codifier.support.SampleActs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
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

class ReviewAppServiceTest {

    private static final String CHANGE_SET_ID = "changeset-1";

    private InMemoryChangeSetRepository changeSetRepository;
    private InMemoryReviewDecisionRepository decisionRepository;
    private ReviewAppService service;
    private Act act;

    @BeforeEach
    void setUp() {
        changeSetRepository = new InMemoryChangeSetRepository();
        decisionRepository = new InMemoryReviewDecisionRepository();
        InMemoryActRepository actRepository = new InMemoryActRepository();
        service = new ReviewAppService(changeSetRepository, decisionRepository, actRepository);
        act = SampleActs.sampleAct();
        actRepository.saveInitial(act);
    }

    private void store(ChangeRecord... records) {
        changeSetRepository.save(ChangeRecords.changeSet(CHANGE_SET_ID, act, records));
    }

    private ReviewDecision accept(ChangeRecord record) {
        return service.submitDecision(record.changeId(), Decision.ACCEPTED, "reviewer-1", ReviewState.PENDING, null);
    }

    @Nested
    @DisplayName("Single decisions")
    class SingleDecisions {

        @Test
        @DisplayName("Accepting a pending record logs the decision")
        void accept_pending() {
            ChangeRecord record = ChangeRecords.confirmed(substituteThirtyDays(), act);
            store(record);

            ReviewDecision decision = service.submitDecision(record.changeId(), Decision.ACCEPTED, "reviewer-1",
                    ReviewState.PENDING, "checked against the gazette");

            assertThat(decision.active()).isTrue();
            assertThat(decision.changeSetId()).isEqualTo(CHANGE_SET_ID);
            assertThat(decision.comment()).isEqualTo("checked against the gazette");
            assertThat(service.stateOf(record.changeId())).isEqualTo(ReviewState.ACCEPTED);
        }

        @Test
        @DisplayName("A decision based on an outdated state is rejected as stale")
        void stale_state() {
            ChangeRecord record = ChangeRecords.confirmed(substituteThirtyDays(), act);
            store(record);
            accept(record);

            assertThatThrownBy(() -> service.submitDecision(record.changeId(), Decision.FLAGGED, "reviewer-2",
                    ReviewState.PENDING, null))
                    .isInstanceOf(StaleReviewException.class)
                    .extracting("currentState").isEqualTo(ReviewState.ACCEPTED);
        }

        @Test
        @DisplayName("Reopening is only possible from flagged")
        void invalid_transition() {
            ChangeRecord record = ChangeRecords.confirmed(substituteThirtyDays(), act);
            store(record);

            assertThatThrownBy(() -> service.submitDecision(record.changeId(), Decision.REOPENED, "reviewer-1",
                    ReviewState.PENDING, null))
                    .isInstanceOf(InvalidTransitionException.class);

            service.submitDecision(record.changeId(), Decision.FLAGGED, "reviewer-1", ReviewState.PENDING, "unclear");
            service.submitDecision(record.changeId(), Decision.REOPENED, "reviewer-1", ReviewState.FLAGGED, null);
            assertThat(service.stateOf(record.changeId())).isEqualTo(ReviewState.PENDING);
        }

        @Test
        @DisplayName("Unresolved records can be rejected but never accepted")
        void unresolved_cannot_be_accepted() {
            ChangeRecord record = ChangeRecords.assessed(deleteSection("99"), act, 20);
            store(record);

            assertThatThrownBy(() -> accept(record))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessageContaining("REFERENCE_NOT_FOUND");

            service.submitDecision(record.changeId(), Decision.REJECTED, "supervisor-1", ReviewState.PENDING, null);
            assertThat(service.stateOf(record.changeId())).isEqualTo(ReviewState.REJECTED);
        }

        @Test
        @DisplayName("A reversal supersedes the earlier decision and keeps it in the history")
        void reversal_keeps_history() {
            ChangeRecord record = ChangeRecords.confirmed(substituteThirtyDays(), act);
            store(record);
            accept(record);

            service.submitDecision(record.changeId(), Decision.REJECTED, "reviewer-2", ReviewState.ACCEPTED, "wrong date");

            List<ReviewDecision> history = service.history(record.changeId());
            assertThat(history).extracting(ReviewDecision::decision).containsExactly(Decision.ACCEPTED, Decision.REJECTED);
            assertThat(history).filteredOn(ReviewDecision::active).singleElement()
                    .extracting(ReviewDecision::reviewerId).isEqualTo("reviewer-2");
            assertThat(service.acceptedDecisions(CHANGE_SET_ID)).isEmpty();
        }

        @Test
        @DisplayName("Unknown changes and missing reviewers are refused")
        void bad_input() {
            store(ChangeRecords.confirmed(substituteThirtyDays(), act));

            assertThatThrownBy(() -> service.submitDecision("missing", Decision.ACCEPTED, "reviewer-1", null, null))
                    .isInstanceOf(ChangeNotFoundException.class);
            assertThatThrownBy(() -> service.submitDecision("missing", Decision.ACCEPTED, " ", null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Conflicts")
    class Conflicts {

        @Test
        @DisplayName("Accepting a range that overlaps an accepted one fails with both ids")
        void overlapping_accept() {
            ChangeRecord words = ChangeRecords.confirmed(substituteThirtyDays(), act);
            ChangeRecord section = ChangeRecords.assessed(deleteSection("15"), act, 80);
            store(words, section);
            accept(words);

            assertThatThrownBy(() -> accept(section))
                    .isInstanceOf(ChangeConflictException.class)
                    .satisfies(e -> {
                        ChangeConflictException conflict = (ChangeConflictException) e;
                        assertThat(conflict.getChangeId()).isEqualTo(section.changeId());
                        assertThat(conflict.getConflictingChangeId()).isEqualTo(words.changeId());
                    });
            assertThat(service.stateOf(section.changeId())).isEqualTo(ReviewState.PENDING);
        }

        @Test
        @DisplayName("Rejecting the accepted record frees its range")
        void reject_then_accept() {
            ChangeRecord words = ChangeRecords.confirmed(substituteThirtyDays(), act);
            ChangeRecord section = ChangeRecords.assessed(deleteSection("15"), act, 80);
            store(words, section);
            accept(words);

            service.submitDecision(words.changeId(), Decision.REJECTED, "reviewer-1", ReviewState.ACCEPTED, null);
            accept(section);

            assertThat(service.acceptedDecisions(CHANGE_SET_ID)).containsOnlyKeys(section.changeId());
        }

        @Test
        @DisplayName("A conflicting bulk accept records nothing")
        void bulk_all_or_nothing() {
            ChangeRecord words = ChangeRecords.confirmed(substituteThirtyDays(), act);
            ChangeRecord section = ChangeRecords.assessed(deleteSection("15"), act, 80);
            store(words, section);

            assertThatThrownBy(() -> service.bulkDecision(CHANGE_SET_ID, List.of(words.changeId(), section.changeId()),
                    Decision.ACCEPTED, "reviewer-1", null))
                    .isInstanceOf(ChangeConflictException.class);

            assertThat(service.stateOf(words.changeId())).isEqualTo(ReviewState.PENDING);
            assertThat(service.stateOf(section.changeId())).isEqualTo(ReviewState.PENDING);
        }
    }

    @Test
    @DisplayName("Bulk decisions share one batch id")
    void bulk_batch() {
        ChangeRecord words = ChangeRecords.confirmed(substituteThirtyDays(), act);
        ChangeRecord section = ChangeRecords.assessed(deleteSection("16"), act, 80);
        store(words, section);

        List<ReviewDecision> decisions = service.bulkDecision(CHANGE_SET_ID,
                List.of(words.changeId(), section.changeId()), Decision.ACCEPTED, "reviewer-1", "batch");

        assertThat(decisions).hasSize(2);
        assertThat(decisions.get(0).batchId()).isNotNull().isEqualTo(decisions.get(1).batchId());
        assertThat(service.acceptedDecisions(CHANGE_SET_ID)).hasSize(2);
    }

    @Test
    @DisplayName("Pending list is in document order, unresolved last, and filters by confidence")
    void list_pending() {
        ChangeRecord penalties = ChangeRecords.assessed(deleteSection("16"), act, 80);
        ChangeRecord words = ChangeRecords.confirmed(substituteThirtyDays(), act);
        ChangeRecord missing = ChangeRecords.assessed(deleteSection("99"), act, 20);
        ChangeRecord definitions = ChangeRecords.assessed(deleteSection("2"), act, 75);
        store(penalties, missing, words, definitions);

        assertThat(service.listPending(CHANGE_SET_ID, null))
                .extracting(item -> item.record().changeId())
                .containsExactly(definitions.changeId(), words.changeId(), penalties.changeId(), missing.changeId());

        accept(words);
        service.submitDecision(definitions.changeId(), Decision.FLAGGED, "reviewer-1", ReviewState.PENDING, null);

        assertThat(service.listPending(CHANGE_SET_ID, null))
                .extracting(item -> item.record().changeId())
                .containsExactly(definitions.changeId(), penalties.changeId(), missing.changeId());
        assertThat(service.listPending(CHANGE_SET_ID, ConfidenceLevel.LOW))
                .singleElement().extracting(item -> item.record().changeId()).isEqualTo(missing.changeId());
    }

    @Test
    @DisplayName("Auto-accept pre-selects eligible records as logged system decisions")
    void auto_accept() {
        ChangeRecord words = ChangeRecords.confirmed(substituteThirtyDays(), act);
        ChangeRecord section = ChangeRecords.assessed(deleteSection("16"), act, 80);
        store(words, section);

        List<ReviewDecision> decisions = service.autoAccept(CHANGE_SET_ID);

        assertThat(decisions).singleElement().satisfies(decision -> {
            assertThat(decision.changeId()).isEqualTo(words.changeId());
            assertThat(decision.reviewerId()).isEqualTo(ReviewAppService.AUTO_ACCEPT_REVIEWER);
        });
        assertThat(service.stateOf(section.changeId())).isEqualTo(ReviewState.PENDING);
        assertThat(service.autoAccept(CHANGE_SET_ID)).isEmpty();
    }

    @Test
    @DisplayName("Concurrent decisions on one record: exactly one wins")
    void concurrent_decisions() throws Exception {
        ChangeRecord record = ChangeRecords.confirmed(substituteThirtyDays(), act);
        store(record);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        for (int i = 0; i < threads; i++) {
            String reviewer = "reviewer-" + i;
            results.add(executor.submit(() -> {
                start.await();
                try {
                    service.submitDecision(record.changeId(), Decision.ACCEPTED, reviewer, ReviewState.PENDING, null);
                    return true;
                } catch (StaleReviewException e) {
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
        assertThat(service.history(record.changeId())).hasSize(1);
    }
}
