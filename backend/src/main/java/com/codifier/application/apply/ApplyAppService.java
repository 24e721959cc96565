package com.codifier.application.apply;

import com.codifier.application.act.exception.ActNotFoundException;
import com.codifier.application.apply.exception.ApplyPreconditionException;
import com.codifier.application.apply.exception.VersionConflictException;
import com.codifier.application.review.ReviewAppService;
import com.codifier.domain.act.model.Act;
import com.codifier.domain.act.repository.ActRepository;
import com.codifier.domain.apply.model.AcceptedChange;
import com.codifier.domain.apply.model.ApplyManifest;
import com.codifier.domain.apply.model.ApplyResult;
import com.codifier.domain.apply.model.ReversePatch;
import com.codifier.domain.apply.repository.ApplyRecordRepository;
import com.codifier.domain.change.model.ChangeSet;
import com.codifier.domain.review.model.ReviewDecision;
import com.codifier.infrastructure.apply.ApplyEngine;
import com.codifier.infrastructure.apply.ReversePatcher;
import com.codifier.infrastructure.locking.KeyedLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Merges accepted changes into a new Act version, and reverts the latest one.
 * Both serialize per document and append with a compare-and-set on the head version.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApplyAppService {

    private final ReviewAppService reviewAppService;
    private final ActRepository actRepository;
    private final ApplyRecordRepository applyRecordRepository;
    private final ApplyEngine applyEngine;
    private final ReversePatcher reversePatcher;
    private final KeyedLocks documentLocks = new KeyedLocks();

    public ApplyResult apply(String changeSetId) {
        ChangeSet changeSet = reviewAppService.getChangeSet(changeSetId);
        String documentId = changeSet.documentId();

        return documentLocks.withLock(documentId, () -> {
            Act head = actRepository.findHead(documentId)
                    .orElseThrow(() -> new ActNotFoundException(documentId));
            if (head.getVersion() != changeSet.actVersion()) {
                log.warn("[Apply] ChangeSet {} targets {} v{}, head is v{}",
                        changeSetId, documentId, changeSet.actVersion(), head.getVersion());
                throw new VersionConflictException(documentId, changeSet.actVersion(), head.getVersion());
            }

            Map<String, ReviewDecision> accepted = reviewAppService.acceptedDecisions(changeSetId);
            if (accepted.isEmpty()) {
                throw new ApplyPreconditionException(ApplyPreconditionException.NOTHING_ACCEPTED,
                        "ChangeSet " + changeSetId + " has no accepted changes");
            }
            List<AcceptedChange> changes = changeSet.records().stream()
                    .filter(record -> accepted.containsKey(record.changeId()))
                    .map(record -> new AcceptedChange(record, accepted.get(record.changeId())))
                    .toList();

            ApplyResult result = applyEngine.apply(head, changes, changeSetId);
            if (!actRepository.appendIfHead(result.newAct())) {
                Act current = actRepository.findHead(documentId).orElse(head);
                throw new VersionConflictException(documentId, head.getVersion(), current.getVersion());
            }
            applyRecordRepository.save(result.reversePatch(), result.manifest());
            log.info("[Apply] ChangeSet {} applied: {} v{} -> v{}",
                    changeSetId, documentId, head.getVersion(), result.newAct().getVersion());
            return result;
        });
    }

    /**
     * Appends a new version equal to the parent of the head, using the head's reverse patch.
     */
    public Act revert(String documentId) {
        return documentLocks.withLock(documentId, () -> {
            Act head = actRepository.findHead(documentId)
                    .orElseThrow(() -> new ActNotFoundException(documentId));
            ReversePatch patch = applyRecordRepository.findReversePatch(documentId, head.getVersion())
                    .orElseThrow(() -> new ApplyPreconditionException(ApplyPreconditionException.NOTHING_TO_REVERT,
                            "Version " + head.getVersion() + " of " + documentId + " has nothing to revert"));

            ReversePatcher.Undo undo = reversePatcher.undo(head, patch);
            Act reverted = head.successor(undo.lines(), head.getNextLineId(), undo.retiredLineIds(), null);
            if (!actRepository.appendIfHead(reverted)) {
                Act current = actRepository.findHead(documentId).orElse(head);
                throw new VersionConflictException(documentId, head.getVersion(), current.getVersion());
            }
            applyRecordRepository.save(
                    new ReversePatch(documentId, head.getVersion(), reverted.getVersion(), undo.appliedHunks()), null);
            log.info("[Apply] {} v{} reverted to the content of v{} as v{}",
                    documentId, head.getVersion(), patch.fromVersion(), reverted.getVersion());
            return reverted;
        });
    }

    public ApplyManifest getManifest(String changeSetId) {
        reviewAppService.getChangeSet(changeSetId);
        return applyRecordRepository.findManifest(changeSetId)
                .orElseThrow(() -> new ApplyPreconditionException(ApplyPreconditionException.NOT_APPLIED,
                        "ChangeSet " + changeSetId + " has not been applied"));
    }
}
