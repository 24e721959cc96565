package com.codifier.infrastructure.ingest;

import com.codifier.domain.act.model.Act;
import com.codifier.domain.act.model.ActLine;
import com.codifier.domain.act.model.IngestedLine;
import com.codifier.domain.act.model.SectionPath;
import com.codifier.infrastructure.preprocessing.TextNormalizer;
import com.codifier.infrastructure.resolution.SectionReference;
import com.codifier.infrastructure.resolution.SectionReferenceParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds version 1 of an Act from extracted lines: normalizes text, assigns line ids and
 * section paths. An extractor-supplied hint wins over the detected label; a path that would
 * break document order is ignored and the line continues the previous unit.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActIngestor {

    private final TextNormalizer textNormalizer;
    private final SectionReferenceParser referenceParser;
    private final SectionLabelDetector labelDetector;

    public Act ingest(String documentId, String title, List<IngestedLine> ingestedLines) {
        List<ActLine> lines = new ArrayList<>();
        SectionPath previous = SectionPath.ROOT;
        long nextId = 1;
        int ignoredLabels = 0;

        for (IngestedLine ingested : ingestedLines) {
            String text = textNormalizer.normalizeLine(ingested.text());
            if (text == null || text.isEmpty()) {
                continue;
            }
            SectionPath path = pathFor(ingested, text, previous).orElse(previous);
            if (path.compareTo(previous) < 0) {
                log.debug("[Ingest] Label of line {} ({}) would precede {}, keeping previous unit", nextId, path, previous);
                ignoredLabels++;
                path = previous;
            }
            lines.add(new ActLine(nextId++, path, text, ingested.page()));
            previous = path;
        }

        Act act = Act.initial(documentId, title, lines);
        log.info("[Ingest] Act {} ingested: {} lines, {} sections, {} out-of-order labels ignored",
                documentId, act.size(), act.outline().size(), ignoredLabels);
        return act;
    }

    private Optional<SectionPath> pathFor(IngestedLine ingested, String text, SectionPath previous) {
        if (ingested.sectionPathHint() != null && !ingested.sectionPathHint().isBlank()) {
            Optional<SectionPath> hinted = referenceParser.parse(ingested.sectionPathHint())
                    .map(SectionReference::path);
            if (hinted.isPresent()) {
                return hinted;
            }
        }
        return labelDetector.detect(text, previous);
    }
}
