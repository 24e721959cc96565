package com.codifier.infrastructure.validation;

import com.codifier.domain.act.model.LineRange;
import com.codifier.domain.amendment.model.Amendment;
import com.codifier.domain.change.model.ChangeIntent;
import com.codifier.domain.change.model.ChangeKind;
import com.codifier.domain.change.model.ChangeRecord;
import com.codifier.domain.change.model.ChangeSet;
import com.codifier.domain.change.model.Confidence;
import com.codifier.domain.change.model.ConfidenceLevel;
import com.codifier.domain.change.model.ResolutionFailure;
import com.codifier.domain.change.model.ValidationStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges two independent extraction passes into one scored ChangeSet.
 *
 * <p>Records are paired on (kind, resolved range). A pair that also agrees on its texts is
 * confirmed and scores HIGH; a disagreeing pair, or a record only one pass found, is capped
 * at MEDIUM and always needs a reviewer. Unresolved and unclassified records are LOW.
 * The citation guard overrides everything: a citation that is blank or absent from the
 * amendment makes the record LOW.
 */
@Slf4j
@Component
public class DualPassReconciler {

    static final int CONFIRMED_BASE = 90;
    static final int SINGLE_PASS_BASE = 70;
    static final int SINGLE_PASS_MAX = 85;
    static final int SIGNAL_WEIGHT = 3;
    static final int NO_TOKEN_OVERLAP_MAX = 60;
    static final int CITATION_FAILURE_MAX = 50;
    static final int UNRESOLVED_SCORE = 20;
    static final int UNCLASSIFIED_SCORE = 10;

    private final double coverageThreshold;
    private final int fuzzyPenalty;

    public DualPassReconciler(@Value("${validation.coverage-threshold:0.8}") double coverageThreshold,
                              @Value("${validation.fuzzy-penalty:15}") int fuzzyPenalty) {
        this.coverageThreshold = coverageThreshold;
        this.fuzzyPenalty = fuzzyPenalty;
    }

    private record PairKey(ChangeKind kind, LineRange range) {}

    /**
     * @param amendment source amendment (citation guard and token overlap are checked against it)
     * @param primary   primary pass; its id, document and version are kept
     * @param secondary secondary pass, empty when that pass failed
     * @param notes     processing notes to carry on the result (degraded passes, ...)
     */
    public ChangeSet reconcile(Amendment amendment, ChangeSet primary, ChangeSet secondary, List<String> notes) {
        String amendmentText = amendment.fullText();

        Map<PairKey, Deque<ChangeRecord>> secondaryByKey = new LinkedHashMap<>();
        List<ChangeRecord> secondaryUnresolved = new ArrayList<>();
        for (ChangeRecord record : secondary.records()) {
            if (record.isApplicable()) {
                secondaryByKey.computeIfAbsent(new PairKey(record.kind(), record.range()), k -> new ArrayDeque<>())
                        .add(record);
            } else {
                secondaryUnresolved.add(record);
            }
        }

        List<ChangeRecord> merged = new ArrayList<>();
        Set<String> primaryFailures = new HashSet<>();
        Set<Integer> primaryClassifiedSpans = new HashSet<>();
        int confirmed = 0;
        int disagreements = 0;

        for (ChangeRecord record : primary.records()) {
            if (record.kind() != ChangeKind.UNCLASSIFIED) {
                primaryClassifiedSpans.add(record.intent().spanIndex());
            }
            if (!record.isApplicable()) {
                primaryFailures.add(failureKey(record));
                merged.add(assessUnresolved(record, amendmentText, true));
                continue;
            }
            Deque<ChangeRecord> candidates = secondaryByKey.get(new PairKey(record.kind(), record.range()));
            ChangeRecord partner = candidates == null ? null : candidates.pollFirst();
            if (partner == null) {
                merged.add(assessUnpaired(record, amendmentText, true));
            } else if (sameTexts(record.intent(), partner.intent())) {
                confirmed++;
                merged.add(assessConfirmed(record, amendmentText));
            } else {
                disagreements++;
                merged.add(assessDisagreement(record, partner, amendmentText));
            }
        }

        int secondaryOnly = 0;
        for (Deque<ChangeRecord> leftovers : secondaryByKey.values()) {
            for (ChangeRecord record : leftovers) {
                secondaryOnly++;
                merged.add(assessUnpaired(record, amendmentText, false));
            }
        }
        for (ChangeRecord record : secondaryUnresolved) {
            boolean gapAlreadyCovered = record.kind() == ChangeKind.UNCLASSIFIED
                    && primaryClassifiedSpans.contains(record.intent().spanIndex());
            if (!gapAlreadyCovered && primaryFailures.add(failureKey(record))) {
                merged.add(assessUnresolved(record, amendmentText, false));
            }
        }

        List<String> allNotes = new ArrayList<>(notes);
        ChangeSet result = ChangeSet.of(primary.changeSetId(), primary.amendmentId(), primary.documentId(),
                primary.actVersion(), merged, amendment.spans().size(), coverageThreshold, allNotes);
        if (result.incomplete()) {
            allNotes.add(String.format("Coverage %.0f%% is below the %.0f%% threshold; some instructions produced no applicable change",
                    result.coverage() * 100, coverageThreshold * 100));
            result = ChangeSet.of(primary.changeSetId(), primary.amendmentId(), primary.documentId(),
                    primary.actVersion(), merged, amendment.spans().size(), coverageThreshold, allNotes);
            log.warn("[Reconciler] ChangeSet {} incomplete: coverage {}", result.changeSetId(),
                    String.format("%.2f", result.coverage()));
        }

        log.info("[Reconciler] ChangeSet {}: {} records ({} confirmed, {} disagreements, {} secondary-only), avg confidence {}",
                result.changeSetId(), merged.size(), confirmed, disagreements, secondaryOnly,
                String.format("%.1f", result.summary().averageConfidence()));
        return result;
    }

    private ChangeRecord assessConfirmed(ChangeRecord record, String amendmentText) {
        int score = CONFIRMED_BASE + signals(record);
        ValidationStatus validation = new ValidationStatus(true, true, null);
        Confidence confidence = Confidence.of(score);
        if (record.resolution().fuzzy()) {
            confidence = Confidence.of(score - fuzzyPenalty).capAt(ConfidenceLevel.MEDIUM);
        }
        return guardCitation(record.withAssessment(confidence, validation), amendmentText);
    }

    private ChangeRecord assessDisagreement(ChangeRecord record, ChangeRecord partner, String amendmentText) {
        String discrepancy = String.format("%s pass read %s -> %s, %s pass read %s -> %s",
                record.extractedBy(), quote(record.intent().originalText()), quote(record.intent().newText()),
                partner.extractedBy(), quote(partner.intent().originalText()), quote(partner.intent().newText()));
        int score = SINGLE_PASS_BASE + SIGNAL_WEIGHT * signals(record);
        if (record.resolution().fuzzy()) {
            score -= fuzzyPenalty;
        }
        Confidence confidence = Confidence.of(score).capAt(ConfidenceLevel.MEDIUM);
        ValidationStatus validation = new ValidationStatus(true, false, discrepancy);
        log.debug("[Reconciler] {} disagreement on {}: {}", record.changeId(), record.range(), discrepancy);
        return guardCitation(record.withAssessment(confidence, validation), amendmentText);
    }

    private ChangeRecord assessUnpaired(ChangeRecord record, String amendmentText, boolean fromPrimary) {
        int score = Math.min(SINGLE_PASS_MAX, SINGLE_PASS_BASE + SIGNAL_WEIGHT * signals(record));
        if (record.resolution().fuzzy()) {
            score -= fuzzyPenalty;
        }
        String reference = record.kind() == ChangeKind.GLOBAL_REPLACE
                ? record.intent().originalText()
                : record.intent().targetReference();
        if (!TextMatching.sharesToken(reference, amendmentText)) {
            score = Math.min(score, NO_TOKEN_OVERLAP_MAX);
        }
        Confidence confidence = Confidence.of(score).capAt(ConfidenceLevel.MEDIUM);
        ValidationStatus validation = new ValidationStatus(fromPrimary, false, null);
        return guardCitation(record.withAssessment(confidence, validation), amendmentText);
    }

    private ChangeRecord assessUnresolved(ChangeRecord record, String amendmentText, boolean fromPrimary) {
        int score = record.kind() == ChangeKind.UNCLASSIFIED ? UNCLASSIFIED_SCORE : UNRESOLVED_SCORE;
        ValidationStatus validation = new ValidationStatus(fromPrimary, false, null);
        return guardCitation(record.withAssessment(Confidence.of(score), validation), amendmentText);
    }

    /**
     * Blank citations and citations that do not occur in the amendment are hard failures.
     */
    private ChangeRecord guardCitation(ChangeRecord record, String amendmentText) {
        String citation = record.sourceCitation();
        if (citation != null && !citation.isBlank() && TextMatching.containsLoosely(amendmentText, citation)) {
            return record;
        }
        Confidence confidence = Confidence.of(Math.min(record.confidence().score(), CITATION_FAILURE_MAX));
        ValidationStatus validation = record.validation().withDiscrepancy("citation not found in amendment text");
        log.warn("[Reconciler] {} citation not found in amendment text", record.changeId());
        return record.withAssessment(confidence, validation);
    }

    /**
     * Structural signals consistent with the citation, one point each.
     */
    static int signals(ChangeRecord record) {
        ChangeIntent intent = record.intent();
        String citation = intent.sourceCitation();
        int signals = 0;
        if (!record.resolution().fuzzy()) signals++;
        if (intent.kind() == ChangeKind.GLOBAL_REPLACE || TextMatching.containsLoosely(citation, intent.targetReference())) signals++;
        if (intent.originalText() == null || TextMatching.containsLoosely(citation, intent.originalText())) signals++;
        if (intent.newText() == null || TextMatching.containsLoosely(citation, intent.newText())) signals++;
        if (record.range().isSingleLine()) signals++;
        return signals;
    }

    private static boolean sameTexts(ChangeIntent a, ChangeIntent b) {
        return Objects.equals(normalize(a.originalText()), normalize(b.originalText()))
                && Objects.equals(normalize(a.newText()), normalize(b.newText()));
    }

    private static String normalize(String text) {
        return text == null ? null : text.strip().replaceAll("\\s+", " ");
    }

    private static String failureKey(ChangeRecord record) {
        ResolutionFailure failure = record.resolution().failure();
        return record.kind() + "|" + record.intent().spanIndex() + "|" + failure;
    }

    private static String quote(String text) {
        return text == null ? "(none)" : "'" + text + "'";
    }
}
