package com.codifier.interfaces.api.dto;

import com.codifier.domain.act.model.Act;
import com.codifier.domain.act.model.ActLine;

import java.time.Instant;
import java.util.List;

public record ActResponse(
        String documentId,
        String title,
        int version,
        Integer parentVersion,
        String sourceChangeSetId,
        Instant createdAt,
        int lineCount,
        List<LineEntry> lines
) {
    public record LineEntry(long lineId, String sectionPath, String text, int page) {}

    public static ActResponse from(Act act, boolean withLines) {
        List<LineEntry> lines = withLines
                ? act.getLines().stream().map(ActResponse::line).toList()
                : null;
        return new ActResponse(act.getDocumentId(), act.getTitle(), act.getVersion(), act.getParentVersion(),
                act.getSourceChangeSetId(), act.getCreatedAt(), act.size(), lines);
    }

    private static LineEntry line(ActLine line) {
        return new LineEntry(line.lineId(), line.sectionPath().toString(), line.text(), line.page());
    }
}
