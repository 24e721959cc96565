package com.codifier.application.review;

import com.codifier.application.act.exception.ActNotFoundException;
import com.codifier.application.review.exception.ChangeConflictException;
import com.codifier.application.review.exception.ChangeNotFoundException;
import com.codifier.application.review.exception.ChangeSetNotFoundException;
import com.codifier.application.review.exception.InvalidTransitionException;
import com.codifier.application.review.exception.StaleReviewException;
import com.codifier.domain.act.model.Act;
import com.codifier.domain.act.model.PositionSpan;
import com.codifier.domain.act.repository.ActRepository;
import com.codifier.domain.change.model.ChangeRecord;
import com.codifier.domain.change.model.ChangeSet;
import com.codifier.domain.change.model.ConfidenceLevel;
import com.codifier.domain.change.model.ReviewRequirement;
import com.codifier.domain.change.repository.ChangeSetRepository;
import com.codifier.domain.review.model.Decision;
import com.codifier.domain.review.model.ReviewDecision;
import com.codifier.domain.review.model.ReviewState;
import com.codifier.domain.review.repository.ReviewDecisionRepository;
import com.codifier.infrastructure.locking.KeyedLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Review state machine over the records of a ChangeSet.
 *
 * <p>Decision writes are serialized per ChangeSet. A record's state is the target state of its
 * active decision (PENDING when it has none). Accepting checks for overlap with every other
 * accepted record of the ChangeSet, measured on line positions of the target Act version.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewAppService {

    public static final String AUTO_ACCEPT_REVIEWER = "system:auto-accept";

    private final ChangeSetRepository changeSetRepository;
    private final ReviewDecisionRepository decisionRepository;
    private final ActRepository actRepository;
    private final KeyedLocks changeSetLocks = new KeyedLocks();

    public ChangeSet getChangeSet(String changeSetId) {
        return changeSetRepository.findById(changeSetId)
                .orElseThrow(() -> new ChangeSetNotFoundException(changeSetId));
    }

    public ReviewState stateOf(String changeId) {
        return decisionRepository.findActive(changeId)
                .map(d -> d.decision().targetState())
                .orElse(ReviewState.PENDING);
    }

    /**
     * Records a single decision.
     *
     * @param expectedState state the reviewer saw; a different current state fails with stale review
     */
    public ReviewDecision submitDecision(String changeId, Decision decision, String reviewerId,
                                         ReviewState expectedState, String comment) {
        requireReviewer(reviewerId);
        ChangeSet changeSet = changeSetRepository.findByChangeId(changeId)
                .orElseThrow(() -> new ChangeNotFoundException(changeId));
        ChangeRecord record = changeSet.find(changeId).orElseThrow(() -> new ChangeNotFoundException(changeId));

        return changeSetLocks.withLock(changeSet.changeSetId(), () -> {
            ReviewState current = stateOf(changeId);
            if (expectedState != null && expectedState != current) {
                throw new StaleReviewException(changeId, expectedState, current);
            }
            checkTransition(record, current, decision);
            if (decision == Decision.ACCEPTED) {
                checkConflicts(changeSet, List.of(record));
            }
            ReviewDecision saved = newDecision(record, changeSet, decision, reviewerId, comment, null);
            decisionRepository.appendAll(List.of(saved));
            log.info("[Review] {} {} -> {} by {} ({})", changeId, current, decision.targetState(), reviewerId,
                    record.confidence().level());
            return saved;
        });
    }

    /**
     * Applies one decision to several records of a ChangeSet, all or nothing.
     */
    public List<ReviewDecision> bulkDecision(String changeSetId, List<String> changeIds, Decision decision,
                                             String reviewerId, String comment) {
        requireReviewer(reviewerId);
        if (changeIds == null || changeIds.isEmpty()) {
            throw new IllegalArgumentException("No changes selected");
        }
        ChangeSet changeSet = getChangeSet(changeSetId);
        List<ChangeRecord> records = new ArrayList<>();
        for (String changeId : new LinkedHashSet<>(changeIds)) {
            records.add(changeSet.find(changeId).orElseThrow(() -> new ChangeNotFoundException(changeId)));
        }

        return changeSetLocks.withLock(changeSetId, () -> {
            for (ChangeRecord record : records) {
                checkTransition(record, stateOf(record.changeId()), decision);
            }
            if (decision == Decision.ACCEPTED) {
                checkConflicts(changeSet, records);
            }
            String batchId = UUID.randomUUID().toString();
            List<ReviewDecision> decisions = records.stream()
                    .map(record -> newDecision(record, changeSet, decision, reviewerId, comment, batchId))
                    .toList();
            decisionRepository.appendAll(decisions);
            log.info("[Review] Batch {} on ChangeSet {}: {} changes -> {} by {}",
                    batchId, changeSetId, decisions.size(), decision.targetState(), reviewerId);
            return decisions;
        });
    }

    /**
     * Open records (pending or flagged) in document order, optionally limited to one confidence band.
     */
    public List<ReviewItem> listPending(String changeSetId, ConfidenceLevel confidenceFilter) {
        ChangeSet changeSet = getChangeSet(changeSetId);
        Act act = targetAct(changeSet);
        Map<String, ReviewDecision> active = activeDecisions(changeSetId);

        return changeSet.records().stream()
                .map(record -> toItem(record, active.get(record.changeId())))
                .filter(item -> item.state().isOpen())
                .filter(item -> confidenceFilter == null || item.record().confidence().level() == confidenceFilter)
                .sorted(Comparator.comparingInt(item -> documentPosition(act, item.record())))
                .toList();
    }

    /**
     * Every record of a ChangeSet with its state, in extraction order.
     */
    public List<ReviewItem> listAll(String changeSetId) {
        ChangeSet changeSet = getChangeSet(changeSetId);
        Map<String, ReviewDecision> active = activeDecisions(changeSetId);
        return changeSet.records().stream()
                .map(record -> toItem(record, active.get(record.changeId())))
                .toList();
    }

    /**
     * Pre-selects HIGH-confidence, discrepancy-free pending records as accepted. Each acceptance
     * is a regular logged decision by {@link #AUTO_ACCEPT_REVIEWER}; conflicting records are skipped.
     */
    public List<ReviewDecision> autoAccept(String changeSetId) {
        ChangeSet changeSet = getChangeSet(changeSetId);
        return changeSetLocks.withLock(changeSetId, () -> {
            List<ReviewDecision> accepted = new ArrayList<>();
            for (ChangeRecord record : changeSet.records()) {
                if (record.reviewRequirement() != ReviewRequirement.AUTO_ACCEPT_ELIGIBLE
                        || !record.isApplicable()
                        || stateOf(record.changeId()) != ReviewState.PENDING) {
                    continue;
                }
                try {
                    checkConflicts(changeSet, List.of(record));
                } catch (ChangeConflictException e) {
                    log.warn("[Review] Auto-accept skipped {}: {}", record.changeId(), e.getMessage());
                    continue;
                }
                ReviewDecision decision = newDecision(record, changeSet, Decision.ACCEPTED, AUTO_ACCEPT_REVIEWER,
                        "Pre-selected: confidence " + record.confidence().score() + ", confirmed by both passes", null);
                decisionRepository.appendAll(List.of(decision));
                accepted.add(decision);
            }
            log.info("[Review] Auto-accepted {} of {} changes in ChangeSet {}",
                    accepted.size(), changeSet.records().size(), changeSetId);
            return accepted;
        });
    }

    public List<ReviewDecision> history(String changeId) {
        if (changeSetRepository.findByChangeId(changeId).isEmpty()) {
            throw new ChangeNotFoundException(changeId);
        }
        return decisionRepository.findHistory(changeId);
    }

    /**
     * Active ACCEPTED decisions of a ChangeSet keyed by change id.
     */
    public Map<String, ReviewDecision> acceptedDecisions(String changeSetId) {
        Map<String, ReviewDecision> accepted = new LinkedHashMap<>();
        activeDecisions(changeSetId).forEach((changeId, decision) -> {
            if (decision.decision() == Decision.ACCEPTED) {
                accepted.put(changeId, decision);
            }
        });
        return accepted;
    }

    private void checkTransition(ChangeRecord record, ReviewState current, Decision decision) {
        if (!current.allows(decision)) {
            throw new InvalidTransitionException(String.format(
                    "Change %s is %s; %s is not allowed (allowed: %s)",
                    record.changeId(), current, decision, current.allowedDecisions()));
        }
        if (decision == Decision.ACCEPTED && !record.isApplicable()) {
            throw new InvalidTransitionException(String.format(
                    "Change %s is %s and cannot be accepted; resolve it in a new amendment extraction or reject it",
                    record.changeId(), record.isResolved() ? "unclassified" : "unresolved (" + record.resolution().failure() + ")"));
        }
    }

    /**
     * Fails when any candidate overlaps an already accepted record or another candidate.
     */
    private void checkConflicts(ChangeSet changeSet, List<ChangeRecord> candidates) {
        Act act = targetAct(changeSet);
        Map<String, ReviewDecision> accepted = acceptedDecisions(changeSet.changeSetId());

        Map<String, PositionSpan> taken = new LinkedHashMap<>();
        for (String changeId : accepted.keySet()) {
            changeSet.find(changeId).flatMap(record -> span(act, record))
                    .ifPresent(span -> taken.put(changeId, span));
        }
        for (ChangeRecord candidate : candidates) {
            taken.remove(candidate.changeId());
        }

        for (ChangeRecord candidate : candidates) {
            PositionSpan span = span(act, candidate).orElseThrow(() -> new InvalidTransitionException(
                    "Change " + candidate.changeId() + " does not map onto " + act));
            for (Map.Entry<String, PositionSpan> other : taken.entrySet()) {
                if (span.overlaps(other.getValue())) {
                    log.warn("[Review] Conflict: {} overlaps accepted {}", candidate.changeId(), other.getKey());
                    throw new ChangeConflictException(candidate.changeId(), other.getKey());
                }
            }
            taken.put(candidate.changeId(), span);
        }
    }

    private Act targetAct(ChangeSet changeSet) {
        return actRepository.findVersion(changeSet.documentId(), changeSet.actVersion())
                .orElseThrow(() -> new ActNotFoundException(changeSet.documentId(), changeSet.actVersion()));
    }

    private Map<String, ReviewDecision> activeDecisions(String changeSetId) {
        Map<String, ReviewDecision> active = new HashMap<>();
        for (ReviewDecision decision : decisionRepository.findActiveByChangeSet(changeSetId)) {
            active.put(decision.changeId(), decision);
        }
        return active;
    }

    private static ReviewItem toItem(ChangeRecord record, ReviewDecision active) {
        ReviewState state = active == null ? ReviewState.PENDING : active.decision().targetState();
        return new ReviewItem(record, state, active);
    }

    private static Optional<PositionSpan> span(Act act, ChangeRecord record) {
        return record.isResolved() ? act.positionsOf(record.range()) : Optional.empty();
    }

    // unresolved records sort after every located one, in extraction order
    private static int documentPosition(Act act, ChangeRecord record) {
        return span(act, record).map(PositionSpan::start).orElse(Integer.MAX_VALUE);
    }

    private static ReviewDecision newDecision(ChangeRecord record, ChangeSet changeSet, Decision decision,
                                              String reviewerId, String comment, String batchId) {
        return new ReviewDecision(UUID.randomUUID().toString(), record.changeId(), changeSet.changeSetId(),
                decision, reviewerId, comment, Instant.now(), batchId, true);
    }

    private static void requireReviewer(String reviewerId) {
        if (reviewerId == null || reviewerId.isBlank()) {
            throw new IllegalArgumentException("reviewerId is required");
        }
    }
}
