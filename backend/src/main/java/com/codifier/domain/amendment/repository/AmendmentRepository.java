package com.codifier.domain.amendment.repository;

import com.codifier.domain.amendment.model.Amendment;

import java.util.Optional;

public interface AmendmentRepository {

    Amendment save(Amendment amendment);

    Optional<Amendment> findById(String amendmentId);
}
