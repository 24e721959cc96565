package com.codifier.infrastructure.persistence;

import com.codifier.domain.amendment.model.Amendment;
import com.codifier.domain.amendment.repository.AmendmentRepository;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryAmendmentRepository implements AmendmentRepository {

    private final Map<String, Amendment> amendments = new ConcurrentHashMap<>();

    @Override
    public Amendment save(Amendment amendment) {
        amendments.put(amendment.amendmentId(), amendment);
        return amendment;
    }

    @Override
    public Optional<Amendment> findById(String amendmentId) {
        return Optional.ofNullable(amendments.get(amendmentId));
    }
}
