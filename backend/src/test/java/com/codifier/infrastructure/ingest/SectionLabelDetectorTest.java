package com.codifier.infrastructure.ingest;

import com.codifier.domain.act.model.SectionPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SectionLabelDetectorTest {

    private final SectionLabelDetector detector = new SectionLabelDetector();

    @Test
    @DisplayName("Numbered headings and 'Section n' open sections")
    void sections() {
        assertThat(detector.detect("15. Appeals.", SectionPath.ROOT)).contains(SectionPath.ofSection("15"));
        assertThat(detector.detect("15A. Review.", SectionPath.ofSection("15"))).contains(SectionPath.ofSection("15A"));
        assertThat(detector.detect("Section 4(1) The Board shall meet.", SectionPath.ofSection("3")))
                .contains(new SectionPath("4", "1", null, null));
    }

    @Test
    @DisplayName("Parenthesised labels open units below the current section")
    void nested_units() {
        SectionPath s15 = SectionPath.ofSection("15");
        SectionPath s15_2 = new SectionPath("15", "2", null, null);
        SectionPath s15_2a = new SectionPath("15", "2", "a", null);

        assertThat(detector.detect("(2) An appeal shall be filed", s15)).contains(s15_2);
        assertThat(detector.detect("(a) in writing;", s15_2)).contains(s15_2a);
        assertThat(detector.detect("(i) signed;", s15_2a)).contains(new SectionPath("15", "2", "a", "i"));
        assertThat(detector.detect("(ii) dated;", new SectionPath("15", "2", "a", "i")))
                .contains(new SectionPath("15", "2", "a", "ii"));
    }

    @Test
    @DisplayName("Roman-looking letters that continue the clause sequence are clauses")
    void next_clause_letter() {
        assertThat(detector.detect("(i) the ninth clause", new SectionPath("2", null, "h", null)))
                .contains(new SectionPath("2", null, "i", null));
        assertThat(detector.detect("(c) the third clause", new SectionPath("2", null, "b", "ii")))
                .contains(new SectionPath("2", null, "c", null));
        assertThat(detector.detect("(b) the second clause", new SectionPath("2", null, "a", "iii")))
                .contains(new SectionPath("2", null, "b", null));
    }

    @Test
    @DisplayName("Unlabelled lines and labels before any section carry no path")
    void no_label() {
        assertThat(detector.detect("continued text of the clause", SectionPath.ofSection("3"))).isEmpty();
        assertThat(detector.detect("(1) stray label", SectionPath.ROOT)).isEmpty();
        assertThat(detector.detect("  ", SectionPath.ofSection("3"))).isEmpty();
    }
}
