package com.codifier.domain.change.repository;

import com.codifier.domain.change.model.ChangeSet;

import java.util.Optional;

public interface ChangeSetRepository {

    ChangeSet save(ChangeSet changeSet);

    Optional<ChangeSet> findById(String changeSetId);

    /**
     * ChangeSet containing the given change record.
     */
    Optional<ChangeSet> findByChangeId(String changeId);
}
