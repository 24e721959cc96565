package com.codifier.domain.act.model;

/**
 * One section of an Act outline: its address, heading and a short preview of the content.
 */
public record ActOutlineEntry(
        SectionPath sectionPath,
        String heading,
        String contentPreview,
        LineRange range,
        int lineCount
) {}
