package com.codifier.interfaces.api.amendment;

import com.codifier.application.amendment.AmendmentProcessingService;
import com.codifier.application.review.ReviewAppService;
import com.codifier.domain.amendment.model.Amendment;
import com.codifier.domain.change.model.ChangeSet;
import com.codifier.interfaces.api.dto.AmendmentResponse;
import com.codifier.interfaces.api.dto.ChangeResponse;
import com.codifier.interfaces.api.dto.ChangeSetResponse;
import com.codifier.interfaces.api.dto.ExtractRequest;
import com.codifier.interfaces.api.dto.RegisterAmendmentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/amendments")
@RequiredArgsConstructor
public class AmendmentController {

    private final AmendmentProcessingService amendmentProcessingService;
    private final ReviewAppService reviewAppService;

    @PostMapping
    public ResponseEntity<AmendmentResponse> register(@Valid @RequestBody RegisterAmendmentRequest request) {
        Amendment amendment = amendmentProcessingService.register(request.title(), request.amendmentNumber(),
                request.targetAct(), request.paragraphs(), request.text());
        return ResponseEntity.status(HttpStatus.CREATED).body(AmendmentResponse.from(amendment));
    }

    @GetMapping("/{amendmentId}")
    public ResponseEntity<AmendmentResponse> get(@PathVariable String amendmentId) {
        return ResponseEntity.ok(AmendmentResponse.from(amendmentProcessingService.getAmendment(amendmentId)));
    }

    @PostMapping("/{amendmentId}/extract")
    public ResponseEntity<ChangeSetResponse> extract(@PathVariable String amendmentId,
                                                     @Valid @RequestBody ExtractRequest request) {
        ChangeSet changeSet = amendmentProcessingService.extract(amendmentId, request.documentId());
        return ResponseEntity.status(HttpStatus.CREATED).body(ChangeSetResponse.from(changeSet,
                reviewAppService.listAll(changeSet.changeSetId()).stream().map(ChangeResponse::from).toList()));
    }
}
