package com.codifier.interfaces.api.review;

import com.codifier.application.apply.ApplyAppService;
import com.codifier.application.review.ReviewAppService;
import com.codifier.domain.apply.model.ApplyManifest;
import com.codifier.domain.change.model.ChangeSet;
import com.codifier.domain.change.model.ConfidenceLevel;
import com.codifier.interfaces.api.dto.ApplyResponse;
import com.codifier.interfaces.api.dto.BulkDecisionRequest;
import com.codifier.interfaces.api.dto.ChangeResponse;
import com.codifier.interfaces.api.dto.ChangeSetResponse;
import com.codifier.interfaces.api.dto.DecisionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/changesets")
@RequiredArgsConstructor
public class ChangeSetController {

    private final ReviewAppService reviewAppService;
    private final ApplyAppService applyAppService;

    @GetMapping("/{changeSetId}")
    public ResponseEntity<ChangeSetResponse> get(@PathVariable String changeSetId) {
        ChangeSet changeSet = reviewAppService.getChangeSet(changeSetId);
        return ResponseEntity.ok(ChangeSetResponse.from(changeSet,
                reviewAppService.listAll(changeSetId).stream().map(ChangeResponse::from).toList()));
    }

    @GetMapping("/{changeSetId}/pending")
    public ResponseEntity<List<ChangeResponse>> pending(@PathVariable String changeSetId,
                                                        @RequestParam(required = false) ConfidenceLevel confidence) {
        return ResponseEntity.ok(reviewAppService.listPending(changeSetId, confidence).stream()
                .map(ChangeResponse::from)
                .toList());
    }

    @PostMapping("/{changeSetId}/decisions/bulk")
    public ResponseEntity<List<DecisionResponse>> bulkDecision(@PathVariable String changeSetId,
                                                               @Valid @RequestBody BulkDecisionRequest request) {
        return ResponseEntity.ok(reviewAppService.bulkDecision(changeSetId, request.changeIds(), request.decision(),
                        request.reviewerId(), request.comment()).stream()
                .map(DecisionResponse::from)
                .toList());
    }

    @PostMapping("/{changeSetId}/auto-accept")
    public ResponseEntity<List<DecisionResponse>> autoAccept(@PathVariable String changeSetId) {
        return ResponseEntity.ok(reviewAppService.autoAccept(changeSetId).stream()
                .map(DecisionResponse::from)
                .toList());
    }

    @PostMapping("/{changeSetId}/apply")
    public ResponseEntity<ApplyResponse> apply(@PathVariable String changeSetId) {
        return ResponseEntity.ok(ApplyResponse.from(applyAppService.apply(changeSetId)));
    }

    @GetMapping("/{changeSetId}/manifest")
    public ResponseEntity<ApplyManifest> manifest(@PathVariable String changeSetId) {
        return ResponseEntity.ok(applyAppService.getManifest(changeSetId));
    }
}
