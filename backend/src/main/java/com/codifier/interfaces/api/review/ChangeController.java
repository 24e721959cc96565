package com.codifier.interfaces.api.review;

import com.codifier.application.review.ReviewAppService;
import com.codifier.interfaces.api.dto.DecisionRequest;
import com.codifier.interfaces.api.dto.DecisionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/changes")
@RequiredArgsConstructor
public class ChangeController {

    private final ReviewAppService reviewAppService;

    @PostMapping("/{changeId}/decisions")
    public ResponseEntity<DecisionResponse> decide(@PathVariable String changeId,
                                                   @Valid @RequestBody DecisionRequest request) {
        return ResponseEntity.ok(DecisionResponse.from(reviewAppService.submitDecision(changeId, request.decision(),
                request.reviewerId(), request.expectedState(), request.comment())));
    }

    @GetMapping("/{changeId}/decisions")
    public ResponseEntity<List<DecisionResponse>> history(@PathVariable String changeId) {
        return ResponseEntity.ok(reviewAppService.history(changeId).stream()
                .map(DecisionResponse::from)
                .toList());
    }
}
