package com.codifier.interfaces.api.dto;

import com.codifier.domain.apply.model.ApplyManifest;
import com.codifier.domain.apply.model.ApplyResult;

public record ApplyResponse(
        String documentId,
        int baseVersion,
        int newVersion,
        int reverseHunks,
        ApplyManifest manifest
) {
    public static ApplyResponse from(ApplyResult result) {
        return new ApplyResponse(result.newAct().getDocumentId(), result.reversePatch().fromVersion(),
                result.newAct().getVersion(), result.reversePatch().hunks().size(), result.manifest());
    }
}
