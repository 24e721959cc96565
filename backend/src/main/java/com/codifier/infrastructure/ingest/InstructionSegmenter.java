package com.codifier.infrastructure.ingest;

import com.codifier.domain.amendment.model.InstructionSpan;
import com.codifier.domain.amendment.model.SourceLocation;
import com.codifier.infrastructure.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits raw amendment text into instruction spans.
 *
 * <p>{@code --- PAGE n ---} markers set the page number. A blank line, or a line starting
 * with a paragraph number ({@code 3.} or {@code (3)}), starts a new paragraph. Paragraphs are
 * numbered from 1 on each page.
 *
 * <p>Text introduced by "namely:" or "the following ... shall be inserted/substituted" is a
 * block: it stays in the instruction's span, its lines keep their line breaks, and numbered
 * lines inside it do not split. A quoted block ends at its closing quote, an unquoted one at
 * the next blank line. Wrapped prose lines are joined with a space.
 */
@Component
@RequiredArgsConstructor
public class InstructionSegmenter {

    private static final Pattern PAGE_MARKER = Pattern.compile("^\\s*---\\s*PAGE\\s+(\\d+)\\s*---\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern PARAGRAPH_NUMBER = Pattern.compile("^\\s*(?:\\d+\\.|\\(\\d+\\))\\s");

    private static final Pattern BLOCK_INTRO = Pattern.compile(
            "(?:namely\\s*[:\\-\u2013\u2014]+"
                    + "|the\\s+following(?:\\s+[a-z\\-]+){0,3}\\s+shall\\s+be\\s+(?:inserted|substituted|added)(?:\\s*,?\\s*namely)?\\s*[:,\\-\u2013\u2014]*"
                    + "|(?:insert|substitute)\\s+the\\s+following(?:\\s+[a-z\\-]+){0,2}\\s*[:\\-\u2013\u2014]+)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CLOSING_QUOTE = Pattern.compile("[\"'‘’“”]\\s*[.;,]?\\s*$");

    private final TextNormalizer textNormalizer;

    public List<InstructionSpan> segment(String rawText) {
        List<InstructionSpan> spans = new ArrayList<>();
        if (rawText == null || rawText.isBlank()) {
            return spans;
        }

        int page = 1;
        int paragraph = 0;
        SpanText current = new SpanText();

        for (String rawLine : rawText.replace("\r\n", "\n").split("\n", -1)) {
            Matcher marker = PAGE_MARKER.matcher(rawLine);
            if (marker.matches()) {
                if (!current.inBlock()) {
                    flush(spans, current);
                }
                page = Integer.parseInt(marker.group(1));
                paragraph = 0;
                continue;
            }
            String line = textNormalizer.normalizeLine(rawLine);
            if (line == null || line.isEmpty()) {
                if (!current.continuesAfterBlankLine()) {
                    flush(spans, current);
                }
                continue;
            }
            if (!current.inBlock() && PARAGRAPH_NUMBER.matcher(line).find()) {
                flush(spans, current);
            }
            if (current.isEmpty()) {
                current.start(page, ++paragraph);
            }
            current.append(line);
        }
        flush(spans, current);
        return spans;
    }

    /**
     * Spans from text already split by the caller, one per entry, all on page 1. Line breaks
     * inside an entry follow the same block rules as {@link #segment(String)}.
     */
    public List<InstructionSpan> fromParagraphs(List<String> paragraphs) {
        List<InstructionSpan> spans = new ArrayList<>();
        int paragraph = 0;
        for (String text : paragraphs) {
            if (text == null) {
                continue;
            }
            SpanText span = new SpanText();
            for (String rawLine : text.split("\\R")) {
                String line = textNormalizer.normalizeLine(rawLine);
                if (line != null && !line.isEmpty()) {
                    span.append(line);
                }
            }
            if (span.isEmpty()) {
                continue;
            }
            span.start(1, ++paragraph);
            flush(spans, span);
        }
        return spans;
    }

    private static void flush(List<InstructionSpan> spans, SpanText current) {
        if (current.isEmpty()) {
            return;
        }
        spans.add(new InstructionSpan(spans.size(), current.text(), new SourceLocation(current.page, current.paragraph)));
        current.reset();
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '‘' || c == '’' || c == '“' || c == '”';
    }

    private static boolean isDoubleQuote(char c) {
        return c == '"' || c == '“' || c == '”';
    }

    /**
     * Text of one span being collected, with the state of a block it may contain.
     */
    private static final class SpanText {

        private enum Block { NONE, AWAITING, QUOTED, UNQUOTED }

        private final StringBuilder text = new StringBuilder();
        private Block block = Block.NONE;
        private int proseStart;
        private int blockStart;
        private int page;
        private int paragraph;

        void start(int page, int paragraph) {
            this.page = page;
            this.paragraph = paragraph;
        }

        boolean isEmpty() {
            return text.isEmpty();
        }

        boolean inBlock() {
            return block != Block.NONE;
        }

        boolean continuesAfterBlankLine() {
            return block == Block.AWAITING || block == Block.QUOTED;
        }

        String text() {
            return text.toString().strip();
        }

        void append(String line) {
            switch (block) {
                case AWAITING -> {
                    text.append('\n');
                    int contentStart = text.length();
                    text.append(line);
                    openBlock(contentStart);
                }
                case QUOTED -> {
                    text.append('\n').append(line);
                    closeIfComplete();
                }
                case UNQUOTED -> text.append('\n').append(line);
                case NONE -> {
                    if (!text.isEmpty()) {
                        text.append(' ');
                    }
                    text.append(line);
                    detectIntro();
                }
            }
        }

        void reset() {
            text.setLength(0);
            block = Block.NONE;
            proseStart = 0;
            blockStart = 0;
        }

        private void detectIntro() {
            Matcher m = BLOCK_INTRO.matcher(text);
            m.region(proseStart, text.length());
            int end = -1;
            while (m.find()) {
                end = m.end();
            }
            if (end < 0) {
                return;
            }
            int contentStart = end;
            while (contentStart < text.length() && Character.isWhitespace(text.charAt(contentStart))) {
                contentStart++;
            }
            if (contentStart == text.length()) {
                block = Block.AWAITING;
            } else if (isQuote(text.charAt(contentStart))) {
                openBlock(contentStart);
            }
        }

        private void openBlock(int contentStart) {
            blockStart = contentStart;
            block = isQuote(text.charAt(contentStart)) ? Block.QUOTED : Block.UNQUOTED;
            closeIfComplete();
        }

        private void closeIfComplete() {
            if (block != Block.QUOTED) {
                return;
            }
            String content = text.substring(blockStart);
            if (content.length() < 2 || !CLOSING_QUOTE.matcher(content).find()) {
                return;
            }
            // quoted terms inside a double-quoted block come in pairs
            if (isDoubleQuote(content.charAt(0)) && content.chars().filter(c -> isDoubleQuote((char) c)).count() % 2 != 0) {
                return;
            }
            block = Block.NONE;
            proseStart = text.length();
        }
    }
}
