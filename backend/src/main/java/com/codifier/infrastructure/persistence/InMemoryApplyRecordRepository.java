package com.codifier.infrastructure.persistence;

import com.codifier.domain.apply.model.ApplyManifest;
import com.codifier.domain.apply.model.ReversePatch;
import com.codifier.domain.apply.repository.ApplyRecordRepository;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryApplyRecordRepository implements ApplyRecordRepository {

    private final Map<String, ReversePatch> patches = new ConcurrentHashMap<>();
    private final Map<String, ApplyManifest> manifests = new ConcurrentHashMap<>();

    @Override
    public void save(ReversePatch reversePatch, ApplyManifest manifest) {
        patches.put(key(reversePatch.documentId(), reversePatch.toVersion()), reversePatch);
        if (manifest != null) {
            manifests.put(manifest.changeSetId(), manifest);
        }
    }

    @Override
    public Optional<ReversePatch> findReversePatch(String documentId, int toVersion) {
        return Optional.ofNullable(patches.get(key(documentId, toVersion)));
    }

    @Override
    public Optional<ApplyManifest> findManifest(String changeSetId) {
        return Optional.ofNullable(manifests.get(changeSetId));
    }

    private static String key(String documentId, int version) {
        return documentId + "@" + version;
    }
}
