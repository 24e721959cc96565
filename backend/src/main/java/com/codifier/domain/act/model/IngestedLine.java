package com.codifier.domain.act.model;

/**
 * A line as delivered by the text-extraction collaborator (PDF/DOCX/OCR), before ids are assigned.
 *
 * @param text            extracted text of the line
 * @param page            source page number
 * @param sectionPathHint optional section reference supplied by the extractor, e.g. "Section 15(2)"
 */
public record IngestedLine(String text, int page, String sectionPathHint) {

    public static IngestedLine of(String text, int page) {
        return new IngestedLine(text, page, null);
    }
}
