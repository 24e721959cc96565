package com.codifier.infrastructure.persistence;

import com.codifier.domain.review.model.ReviewDecision;
import com.codifier.domain.review.repository.ReviewDecisionRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryReviewDecisionRepository implements ReviewDecisionRepository {

    private final Map<String, List<ReviewDecision>> historyByChangeId = new ConcurrentHashMap<>();

    @Override
    public synchronized void appendAll(List<ReviewDecision> decisions) {
        for (ReviewDecision decision : decisions) {
            List<ReviewDecision> history = historyByChangeId.computeIfAbsent(decision.changeId(), k -> new ArrayList<>());
            history.replaceAll(previous -> previous.active() ? previous.superseded() : previous);
            history.add(decision);
        }
    }

    @Override
    public synchronized Optional<ReviewDecision> findActive(String changeId) {
        return historyByChangeId.getOrDefault(changeId, List.of()).stream()
                .filter(ReviewDecision::active)
                .findFirst();
    }

    @Override
    public synchronized List<ReviewDecision> findActiveByChangeSet(String changeSetId) {
        return historyByChangeId.values().stream()
                .flatMap(List::stream)
                .filter(decision -> decision.active() && decision.changeSetId().equals(changeSetId))
                .toList();
    }

    @Override
    public synchronized List<ReviewDecision> findHistory(String changeId) {
        return List.copyOf(historyByChangeId.getOrDefault(changeId, List.of()));
    }
}
