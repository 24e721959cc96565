package com.codifier.infrastructure.persistence;

import com.codifier.domain.change.model.ChangeRecord;
import com.codifier.domain.change.model.ChangeSet;
import com.codifier.domain.change.repository.ChangeSetRepository;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryChangeSetRepository implements ChangeSetRepository {

    private final Map<String, ChangeSet> changeSets = new ConcurrentHashMap<>();
    private final Map<String, String> changeSetByChangeId = new ConcurrentHashMap<>();

    @Override
    public ChangeSet save(ChangeSet changeSet) {
        changeSets.put(changeSet.changeSetId(), changeSet);
        for (ChangeRecord record : changeSet.records()) {
            changeSetByChangeId.put(record.changeId(), changeSet.changeSetId());
        }
        return changeSet;
    }

    @Override
    public Optional<ChangeSet> findById(String changeSetId) {
        return Optional.ofNullable(changeSets.get(changeSetId));
    }

    @Override
    public Optional<ChangeSet> findByChangeId(String changeId) {
        return Optional.ofNullable(changeSetByChangeId.get(changeId)).map(changeSets::get);
    }
}
