package com.codifier.domain.act.model;

/**
 * Hierarchy levels of a statutory address, outermost first.
 */
public enum SectionLevel {
    SECTION,
    SUBSECTION,
    CLAUSE,
    SUB_CLAUSE
}
