package com.bookforge.ocr.layout;

import com.bookforge.ocr.model.BoundingBox;
import com.bookforge.ocr.model.MergedBlock;
import com.bookforge.ocr.model.RawLine;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups a page's OCR lines into paragraph blocks.
 *
 * <p>Lines are walked top to bottom. Each candidate line is compared with the
 * previous line of the group being built; {@link #shouldMerge} decides whether
 * it continues that group or starts a new one. Text signals (dashes,
 * hyphenation, lowercase continuations) are checked before spacing.</p>
 */
public class ParagraphMerger {

    private static final Logger LOGGER = LoggerFactory.getLogger(ParagraphMerger.class);

    static final double MAX_GAP_FACTOR = 2.5;
    static final double INDENT_FACTOR = 2.0;
    static final double SHORT_LINE_RATIO = 0.5;
    static final double PARAGRAPH_GAP_FACTOR = 1.3;
    static final double LINE_GAP_FACTOR = 1.8;

    /**
     * Page-level values the merge decision needs.
     */
    public static class MergeContext {
        public final int page;
        public final double medianLineHeight;
        public final double pageWidth;

        public MergeContext(int page, double medianLineHeight, double pageWidth) {
            this.page = page;
            this.medianLineHeight = medianLineHeight;
            this.pageWidth = pageWidth;
        }
    }

    /**
     * Merges lines already sorted by vertical position.
     *
     * @param sortedLines one page's lines, top to bottom
     * @param context     the page's merge context
     * @return merged blocks in line order; empty for an empty page
     */
    public MutableList<MergedBlock> merge(ListIterable<RawLine> sortedLines, MergeContext context) {
        MutableList<MergedBlock> result = Lists.mutable.empty();
        if (sortedLines.isEmpty()) {
            return result;
        }

        MutableList<RawLine> currentGroup = Lists.mutable.of(sortedLines.getFirst());
        for (int i = 1; i < sortedLines.size(); i++) {
            RawLine previous = sortedLines.get(i - 1);
            RawLine candidate = sortedLines.get(i);
            if (shouldMerge(previous, candidate, currentGroup, context)) {
                currentGroup.add(candidate);
            } else {
                result.add(finalizeGroup(currentGroup));
                currentGroup = Lists.mutable.of(candidate);
            }
        }
        result.add(finalizeGroup(currentGroup));

        LOGGER.debug("Page {}: merged {} lines into {} blocks", context.page, sortedLines.size(), result.size());
        return result;
    }

    /**
     * Decides whether {@code candidate} continues the group whose last line is
     * {@code previous}. Rules are checked in order and the first one that
     * applies decides.
     */
    public boolean shouldMerge(RawLine previous, RawLine candidate, ListIterable<RawLine> currentGroup,
                               MergeContext context) {
        boolean previousEndsSentence = TextShape.endsWithSentencePunctuation(previous.text);

        // === 1. Attribution marker always opens a new block ===
        if (TextShape.startsWithDashMarker(candidate.text)) {
            return false;
        }

        // === 2. Word hyphenated across the line break ===
        if (TextShape.endsWithMidWordHyphen(previous.text)) {
            return true;
        }

        // === 3. Unfinished sentence continued in lowercase ===
        if (!previousEndsSentence && TextShape.startsWithLowercase(candidate.text)) {
            return true;
        }

        // === 4. Spatial gate ===
        double gap = candidate.box.y - previous.box.y;
        if (gap > context.medianLineHeight * MAX_GAP_FACTOR) {
            return false;
        }
        if (gap <= 0) {
            return false;
        }

        // === 5. Indented after a finished sentence: new paragraph ===
        double groupStartX = currentGroup.getFirst().box.x;
        boolean significantIndent = candidate.box.x > groupStartX + context.medianLineHeight * INDENT_FACTOR;
        if (significantIndent && previousEndsSentence) {
            return false;
        }

        // === 6. Short finished line followed by extra space: paragraph end ===
        boolean previousIsShort = previous.box.width < context.pageWidth * SHORT_LINE_RATIO;
        boolean extraSpace = gap > context.medianLineHeight * PARAGRAPH_GAP_FACTOR;
        if (previousIsShort && previousEndsSentence && extraSpace) {
            return false;
        }

        // === 7. Default: ordinary line spacing ===
        return gap <= context.medianLineHeight * LINE_GAP_FACTOR;
    }

    MergedBlock finalizeGroup(ListIterable<RawLine> group) {
        RawLine first = group.getFirst();
        BoundingBox box = first.box;
        StringBuilder text = new StringBuilder(first.text.trim());
        for (int i = 1; i < group.size(); i++) {
            RawLine line = group.get(i);
            box = box.union(line.box);
            appendLine(text, line.text.trim());
        }

        double meanFontSize = group.sumOfDouble(line -> line.fontSize) / group.size();
        return new MergedBlock(first.page, box, text.toString(), group.size(), (int) Math.round(meanFontSize));
    }

    /**
     * Appends a line, rejoining a hyphenated word or separating with one space.
     */
    static void appendLine(StringBuilder text, String lineText) {
        if (lineText.isEmpty()) {
            return;
        }
        if (text.length() == 0) {
            text.append(lineText);
        } else if (TextShape.endsWithMidWordHyphen(text.toString())) {
            text.setLength(text.length() - 1);
            text.append(lineText);
        } else {
            text.append(' ').append(lineText);
        }
    }
}
