package com.codifier.application.amendment;

import com.codifier.application.act.exception.ActNotFoundException;
import com.codifier.application.amendment.exception.AmendmentNotFoundException;
import com.codifier.application.review.ReviewAppService;
import com.codifier.domain.act.model.Act;
import com.codifier.domain.act.repository.ActRepository;
import com.codifier.domain.amendment.model.Amendment;
import com.codifier.domain.amendment.model.InstructionSpan;
import com.codifier.domain.amendment.repository.AmendmentRepository;
import com.codifier.domain.change.model.ChangeSet;
import com.codifier.domain.change.repository.ChangeSetRepository;
import com.codifier.domain.change.service.ChangeExtractor;
import com.codifier.infrastructure.extraction.ExtractionException;
import com.codifier.infrastructure.ingest.InstructionSegmenter;
import com.codifier.infrastructure.validation.DualPassReconciler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Registers amendments and turns them into reconciled ChangeSets.
 *
 * <p>The two configured extraction passes run in parallel. A pass that fails or times out is
 * dropped with a note and the other pass is reconciled alone; only when both fail does
 * extraction fail.
 */
@Slf4j
@Service
public class AmendmentProcessingService {

    private static final String NO_PASS = "none";

    private final AmendmentRepository amendmentRepository;
    private final ActRepository actRepository;
    private final ChangeSetRepository changeSetRepository;
    private final InstructionSegmenter segmenter;
    private final DualPassReconciler reconciler;
    private final ReviewAppService reviewAppService;
    private final Map<String, ChangeExtractor> extractors;
    private final String primaryPass;
    private final String secondaryPass;
    private final long timeoutSeconds;
    private final boolean autoAcceptEnabled;

    public AmendmentProcessingService(AmendmentRepository amendmentRepository,
                                      ActRepository actRepository,
                                      ChangeSetRepository changeSetRepository,
                                      InstructionSegmenter segmenter,
                                      DualPassReconciler reconciler,
                                      ReviewAppService reviewAppService,
                                      List<ChangeExtractor> extractors,
                                      @Value("${extraction.primary:pattern}") String primaryPass,
                                      @Value("${extraction.secondary:llm}") String secondaryPass,
                                      @Value("${extraction.timeout-seconds:120}") long timeoutSeconds,
                                      @Value("${review.auto-accept-enabled:false}") boolean autoAcceptEnabled) {
        this.amendmentRepository = amendmentRepository;
        this.actRepository = actRepository;
        this.changeSetRepository = changeSetRepository;
        this.segmenter = segmenter;
        this.reconciler = reconciler;
        this.reviewAppService = reviewAppService;
        this.extractors = extractors.stream().collect(Collectors.toMap(ChangeExtractor::name, Function.identity()));
        this.primaryPass = primaryPass;
        this.secondaryPass = secondaryPass;
        this.timeoutSeconds = timeoutSeconds;
        this.autoAcceptEnabled = autoAcceptEnabled;
        if (!this.extractors.containsKey(primaryPass)) {
            throw new IllegalStateException("Unknown primary extraction pass '" + primaryPass + "', known: " + this.extractors.keySet());
        }
        if (!NO_PASS.equals(secondaryPass) && !this.extractors.containsKey(secondaryPass)) {
            throw new IllegalStateException("Unknown secondary extraction pass '" + secondaryPass + "', known: " + this.extractors.keySet());
        }
    }

    /**
     * Registers an amendment from explicit paragraphs, or from raw text split into spans.
     */
    public Amendment register(String title, String amendmentNumber, String targetAct,
                              List<String> paragraphs, String rawText) {
        List<InstructionSpan> spans = paragraphs != null && !paragraphs.isEmpty()
                ? segmenter.fromParagraphs(paragraphs)
                : segmenter.segment(rawText);
        if (spans.isEmpty()) {
            throw new IllegalArgumentException("Amendment has no instruction text");
        }
        Amendment amendment = new Amendment(UUID.randomUUID().toString(), title, amendmentNumber, targetAct,
                spans, Instant.now());
        amendmentRepository.save(amendment);
        log.info("[Amendment] Registered {} '{}' with {} instruction spans", amendment.amendmentId(), title, spans.size());
        return amendment;
    }

    public Amendment getAmendment(String amendmentId) {
        return amendmentRepository.findById(amendmentId)
                .orElseThrow(() -> new AmendmentNotFoundException(amendmentId));
    }

    /**
     * Extracts, reconciles and stores the ChangeSet of an amendment against the head version
     * of a document.
     */
    public ChangeSet extract(String amendmentId, String documentId) {
        Amendment amendment = getAmendment(amendmentId);
        Act act = actRepository.findHead(documentId)
                .orElseThrow(() -> new ActNotFoundException(documentId));

        long startTime = System.currentTimeMillis();
        List<String> notes = new ArrayList<>();
        ChangeExtractor primary = extractors.get(primaryPass);
        ChangeExtractor secondary = NO_PASS.equals(secondaryPass) ? null : extractors.get(secondaryPass);

        CompletableFuture<ChangeSet> primaryFuture = runPass(primary, amendment, act);
        CompletableFuture<ChangeSet> secondaryFuture = secondary == null ? null : runPass(secondary, amendment, act);

        ChangeSet primarySet = await(primaryFuture, primary.name(), notes);
        ChangeSet secondarySet = null;
        if (secondaryFuture == null) {
            notes.add("Secondary extraction pass disabled; every change is single-pass");
        } else {
            secondarySet = await(secondaryFuture, secondary.name(), notes);
        }

        if (primarySet == null && secondarySet == null) {
            throw new ExtractionException("All extraction passes failed: " + String.join("; ", notes));
        }
        if (primarySet == null) {
            primarySet = secondarySet;
            secondarySet = null;
            notes.add("Secondary pass '" + secondary.name() + "' used as primary");
        }
        if (secondarySet == null) {
            secondarySet = ChangeSet.of(UUID.randomUUID().toString(), amendmentId, documentId, act.getVersion(),
                    List.of(), amendment.spans().size(), 0.0, List.of());
        }

        ChangeSet changeSet = changeSetRepository.save(reconciler.reconcile(amendment, primarySet, secondarySet, notes));
        log.info("[Amendment] Extracted ChangeSet {} for amendment {} against {} in {}ms: {} records, coverage {}",
                changeSet.changeSetId(), amendmentId, act, System.currentTimeMillis() - startTime,
                changeSet.records().size(), String.format("%.2f", changeSet.coverage()));

        if (autoAcceptEnabled) {
            reviewAppService.autoAccept(changeSet.changeSetId());
        }
        return changeSet;
    }

    private CompletableFuture<ChangeSet> runPass(ChangeExtractor extractor, Amendment amendment, Act act) {
        return CompletableFuture.supplyAsync(() -> extractor.extract(amendment, act))
                .orTimeout(timeoutSeconds, TimeUnit.SECONDS);
    }

    private ChangeSet await(CompletableFuture<ChangeSet> future, String passName, List<String> notes) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String reason = cause instanceof TimeoutException
                    ? "timed out after " + timeoutSeconds + "s"
                    : cause.getMessage();
            log.warn("[Amendment] Extraction pass '{}' failed: {}", passName, reason, cause);
            notes.add("Extraction pass '" + passName + "' failed (" + reason + "); reconciled without it");
            return null;
        }
    }
}
