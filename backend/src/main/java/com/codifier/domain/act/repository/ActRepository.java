package com.codifier.domain.act.repository;

import com.codifier.domain.act.model.Act;

import java.util.List;
import java.util.Optional;

/**
 * Append-only store of Act version chains, one chain per document.
 */
public interface ActRepository {

    /**
     * Stores version 1 of a new document.
     *
     * @throws IllegalArgumentException if the document already exists or the Act is not version 1
     */
    void saveInitial(Act act);

    Optional<Act> findHead(String documentId);

    Optional<Act> findVersion(String documentId, int version);

    List<Act> findHistory(String documentId);

    /**
     * Appends {@code next} if its parent version is still the head of the chain.
     *
     * @return false when another version was appended first
     */
    boolean appendIfHead(Act next);
}
