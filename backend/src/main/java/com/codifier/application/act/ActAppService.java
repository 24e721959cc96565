package com.codifier.application.act;

import com.codifier.application.act.exception.ActNotFoundException;
import com.codifier.domain.act.model.Act;
import com.codifier.domain.act.model.ActOutlineEntry;
import com.codifier.domain.act.model.IngestedLine;
import com.codifier.domain.act.repository.ActRepository;
import com.codifier.infrastructure.ingest.ActIngestor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class ActAppService {

    private static final Pattern PAGE_MARKER = Pattern.compile("^\\s*---\\s*PAGE\\s+(\\d+)\\s*---\\s*$", Pattern.CASE_INSENSITIVE);

    private final ActIngestor actIngestor;
    private final ActRepository actRepository;

    /**
     * Ingests version 1 of a new document.
     *
     * @param documentId requested id, generated when blank
     */
    public Act ingest(String documentId, String title, List<IngestedLine> lines) {
        String id = documentId == null || documentId.isBlank() ? UUID.randomUUID().toString() : documentId;
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("An Act needs at least one line");
        }
        Act act = actIngestor.ingest(id, title, lines);
        actRepository.saveInitial(act);
        return act;
    }

    /**
     * Ingests plain extracted text, one Act line per text line; {@code --- PAGE n ---} markers set the page.
     */
    public Act ingestText(String documentId, String title, String text) {
        List<IngestedLine> lines = new ArrayList<>();
        int page = 1;
        for (String line : text == null ? new String[0] : text.split("\\R")) {
            Matcher marker = PAGE_MARKER.matcher(line);
            if (marker.matches()) {
                page = Integer.parseInt(marker.group(1));
            } else if (!line.isBlank()) {
                lines.add(IngestedLine.of(line, page));
            }
        }
        return ingest(documentId, title, lines);
    }

    public Act getHead(String documentId) {
        return actRepository.findHead(documentId)
                .orElseThrow(() -> new ActNotFoundException(documentId));
    }

    public Act getVersion(String documentId, int version) {
        return actRepository.findVersion(documentId, version)
                .orElseThrow(() -> new ActNotFoundException(documentId, version));
    }

    public List<Act> getHistory(String documentId) {
        List<Act> history = actRepository.findHistory(documentId);
        if (history.isEmpty()) {
            throw new ActNotFoundException(documentId);
        }
        return history;
    }

    public List<ActOutlineEntry> getOutline(String documentId) {
        return getHead(documentId).outline();
    }
}
