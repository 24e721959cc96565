package com.codifier.domain.apply.repository;

import com.codifier.domain.apply.model.ApplyManifest;
import com.codifier.domain.apply.model.ReversePatch;

import java.util.Optional;

/**
 * Reverse patches and manifests of applied ChangeSets.
 */
public interface ApplyRecordRepository {

    void save(ReversePatch reversePatch, ApplyManifest manifest);

    /**
     * Reverse patch that undoes the edit producing the given version.
     */
    Optional<ReversePatch> findReversePatch(String documentId, int toVersion);

    Optional<ApplyManifest> findManifest(String changeSetId);
}
