package com.codifier.interfaces.api.dto;

import com.codifier.domain.change.model.ChangeSet;
import com.codifier.domain.change.model.ChangeSetSummary;

import java.time.Instant;
import java.util.List;

public record ChangeSetResponse(
        String changeSetId,
        String amendmentId,
        String documentId,
        int actVersion,
        double coverage,
        boolean incomplete,
        ChangeSetSummary summary,
        List<String> notes,
        List<Integer> unparsedSpans,
        Instant createdAt,
        List<ChangeResponse> changes
) {
    public static ChangeSetResponse from(ChangeSet changeSet, List<ChangeResponse> changes) {
        return new ChangeSetResponse(changeSet.changeSetId(), changeSet.amendmentId(), changeSet.documentId(),
                changeSet.actVersion(), changeSet.coverage(), changeSet.incomplete(), changeSet.summary(),
                changeSet.notes(), changeSet.unparsedSpans(), changeSet.createdAt(), changes);
    }
}
