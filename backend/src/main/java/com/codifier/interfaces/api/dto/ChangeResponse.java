package com.codifier.interfaces.api.dto;

import com.codifier.application.review.ReviewItem;
import com.codifier.domain.change.model.ChangeIntent;
import com.codifier.domain.change.model.ChangeKind;
import com.codifier.domain.change.model.ChangeRecord;
import com.codifier.domain.change.model.ConfidenceLevel;
import com.codifier.domain.change.model.Resolution;
import com.codifier.domain.change.model.ResolutionFailure;
import com.codifier.domain.change.model.ReviewRequirement;
import com.codifier.domain.review.model.ReviewState;

import java.util.List;

public record ChangeResponse(
        String changeId,
        ChangeKind kind,
        String targetReference,
        String originalText,
        String newText,
        String sourceCitation,
        int spanIndex,
        int page,
        int paragraph,
        Location location,
        int confidenceScore,
        ConfidenceLevel confidenceLevel,
        Validation validation,
        ReviewRequirement reviewRequirement,
        ReviewState state,
        String contextBefore,
        String contextAfter,
        String extractedBy
) {
    public record Location(
            boolean resolved,
            Long startLineId,
            Long endLineId,
            String sectionPath,
            boolean fuzzy,
            ResolutionFailure failure,
            String detail,
            List<String> candidates
    ) {}

    public record Validation(boolean primaryExtracted, boolean secondaryConfirmed, String discrepancy) {}

    public static ChangeResponse from(ReviewItem item) {
        ChangeRecord record = item.record();
        ChangeIntent intent = record.intent();
        Resolution resolution = record.resolution();
        Location location = new Location(
                resolution.isResolved(),
                resolution.isResolved() ? resolution.range().startLineId() : null,
                resolution.isResolved() ? resolution.range().endLineId() : null,
                resolution.sectionPath() == null ? null : resolution.sectionPath().toString(),
                resolution.fuzzy(),
                resolution.failure(),
                resolution.detail(),
                resolution.candidates());
        return new ChangeResponse(record.changeId(), intent.kind(), intent.targetReference(), intent.originalText(),
                intent.newText(), intent.sourceCitation(), intent.spanIndex(),
                intent.location() == null ? 0 : intent.location().page(),
                intent.location() == null ? 0 : intent.location().paragraph(),
                location, record.confidence().score(), record.confidence().level(),
                new Validation(record.validation().primaryExtracted(), record.validation().secondaryConfirmed(),
                        record.validation().discrepancy()),
                record.reviewRequirement(), item.state(), record.contextBefore(), record.contextAfter(),
                record.extractedBy());
    }
}
