package com.codifier.infrastructure.persistence;

import com.codifier.domain.act.model.Act;
import com.codifier.domain.act.repository.ActRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryActRepository implements ActRepository {

    private final Map<String, List<Act>> chains = new ConcurrentHashMap<>();

    @Override
    public void saveInitial(Act act) {
        if (act.getVersion() != 1) {
            throw new IllegalArgumentException("Initial version must be 1, got " + act.getVersion());
        }
        List<Act> chain = new ArrayList<>();
        chain.add(act);
        if (chains.putIfAbsent(act.getDocumentId(), chain) != null) {
            throw new IllegalArgumentException("Document " + act.getDocumentId() + " already exists");
        }
    }

    @Override
    public Optional<Act> findHead(String documentId) {
        List<Act> chain = chains.get(documentId);
        if (chain == null) {
            return Optional.empty();
        }
        synchronized (chain) {
            return Optional.of(chain.get(chain.size() - 1));
        }
    }

    @Override
    public Optional<Act> findVersion(String documentId, int version) {
        List<Act> chain = chains.get(documentId);
        if (chain == null) {
            return Optional.empty();
        }
        synchronized (chain) {
            return version >= 1 && version <= chain.size() ? Optional.of(chain.get(version - 1)) : Optional.empty();
        }
    }

    @Override
    public List<Act> findHistory(String documentId) {
        List<Act> chain = chains.get(documentId);
        if (chain == null) {
            return List.of();
        }
        synchronized (chain) {
            return List.copyOf(chain);
        }
    }

    @Override
    public boolean appendIfHead(Act next) {
        List<Act> chain = chains.get(next.getDocumentId());
        if (chain == null) {
            throw new IllegalArgumentException("Document " + next.getDocumentId() + " does not exist");
        }
        synchronized (chain) {
            Act head = chain.get(chain.size() - 1);
            if (next.getParentVersion() == null || head.getVersion() != next.getParentVersion()
                    || next.getVersion() != head.getVersion() + 1) {
                return false;
            }
            chain.add(next);
            return true;
        }
    }
}
