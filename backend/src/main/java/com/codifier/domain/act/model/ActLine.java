package com.codifier.domain.act.model;

/**
 * One line of an Act version.
 *
 * @param lineId      stable identifier, unique across every version of the document and never reused
 * @param sectionPath hierarchical address of the line
 * @param text        line content
 * @param page        source page the line was ingested from (0 when unknown or created by an amendment)
 */
public record ActLine(
        long lineId,
        SectionPath sectionPath,
        String text,
        int page
) {
    public ActLine {
        if (sectionPath == null) {
            sectionPath = SectionPath.ROOT;
        }
        if (text == null) {
            text = "";
        }
    }

    public ActLine withText(String newText) {
        return new ActLine(lineId, sectionPath, newText, page);
    }

    public ActLine withSectionPath(SectionPath newPath) {
        return new ActLine(lineId, newPath, text, page);
    }
}
