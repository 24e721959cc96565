package com.codifier.infrastructure.extraction;

import com.codifier.domain.act.model.Act;
import com.codifier.domain.act.model.ActLine;
import com.codifier.domain.act.model.PositionSpan;
import com.codifier.domain.amendment.model.Amendment;
import com.codifier.domain.change.model.ChangeIntent;
import com.codifier.domain.change.model.ChangeRecord;
import com.codifier.domain.change.model.ChangeSet;
import com.codifier.domain.change.model.Confidence;
import com.codifier.domain.change.model.Resolution;
import com.codifier.domain.change.model.ReviewRequirement;
import com.codifier.domain.change.model.ValidationStatus;
import com.codifier.infrastructure.resolution.LocationResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns classified intents into an unscored pass ChangeSet: resolves each intent against the
 * Act, creates one record per resolved range and attaches reviewer context lines.
 * Scores are assigned later by the reconciler.
 */
@Slf4j
@Component
public class ChangeSetAssembler {

    private final LocationResolver locationResolver;
    private final int contextLines;

    public ChangeSetAssembler(LocationResolver locationResolver,
                              @Value("${apply.context-lines:1}") int contextLines) {
        this.locationResolver = locationResolver;
        this.contextLines = contextLines;
    }

    public ChangeSet assemble(Amendment amendment, Act act, List<ChangeIntent> intents, String passName) {
        List<ChangeRecord> records = new ArrayList<>();
        for (ChangeIntent intent : intents) {
            records.addAll(toRecords(intent, act, passName));
        }
        ChangeSet changeSet = ChangeSet.of(UUID.randomUUID().toString(), amendment.amendmentId(), act.getDocumentId(),
                act.getVersion(), records, amendment.spans().size(), 0.0, List.of());
        log.info("[Extraction:{}] {} intents -> {} records, coverage {}", passName, intents.size(), records.size(),
                String.format("%.2f", changeSet.coverage()));
        return changeSet;
    }

    public List<ChangeRecord> toRecords(ChangeIntent intent, Act act, String passName) {
        List<ChangeRecord> records = new ArrayList<>();
        for (Resolution resolution : locationResolver.resolve(intent, act)) {
            String before = null;
            String after = null;
            if (resolution.isResolved()) {
                Optional<PositionSpan> span = act.positionsOf(resolution.range());
                if (span.isPresent()) {
                    before = context(act, span.get().start() - contextLines, span.get().start());
                    after = context(act, span.get().end() + 1, span.get().end() + 1 + contextLines);
                }
            }
            Confidence provisional = Confidence.of(0);
            ValidationStatus validation = ValidationStatus.singlePass();
            records.add(new ChangeRecord(UUID.randomUUID().toString(), intent, resolution, provisional, validation,
                    ReviewRequirement.of(provisional, validation), before, after, passName));
        }
        return records;
    }

    private static String context(Act act, int from, int to) {
        int start = Math.max(0, from);
        int end = Math.min(act.size(), to);
        if (start >= end) {
            return null;
        }
        List<ActLine> lines = act.getLines().subList(start, end);
        return Act.joinText(lines);
    }
}
