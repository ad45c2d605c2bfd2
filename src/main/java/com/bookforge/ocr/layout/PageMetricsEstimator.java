package com.bookforge.ocr.layout;

import com.bookforge.ocr.model.RawLine;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.list.mutable.primitive.DoubleArrayList;

/**
 * Estimates a page's average font size and typical line-to-line distance.
 *
 * <p>The line height is a median over consecutive vertical deltas, so a few
 * large jumps from images or column breaks do not skew it.</p>
 */
public class PageMetricsEstimator {

    static final double DEFAULT_FONT_SIZE = 12.0;
    static final double OUTLIER_DELTA_FACTOR = 4.0;
    static final double FALLBACK_LINE_HEIGHT_FACTOR = 1.5;

    public PageMetrics estimate(ListIterable<RawLine> lines) {
        MutableList<RawLine> fontSized = lines.select(line -> line.fontSize > 0).toList();
        double avgFontSize = fontSized.isEmpty()
            ? DEFAULT_FONT_SIZE
            : fontSized.sumOfDouble(line -> line.fontSize) / fontSized.size();

        MutableList<RawLine> sorted = lines.toSortedListBy(line -> line.box.y);
        DoubleArrayList deltas = new DoubleArrayList();
        for (int i = 1; i < sorted.size(); i++) {
            double delta = sorted.get(i).box.y - sorted.get(i - 1).box.y;
            // column breaks and images produce huge jumps
            if (delta > 0 && delta <= avgFontSize * OUTLIER_DELTA_FACTOR) {
                deltas.add(delta);
            }
        }

        double medianLineHeight;
        if (deltas.isEmpty()) {
            medianLineHeight = avgFontSize * FALLBACK_LINE_HEIGHT_FACTOR;
        } else {
            deltas.sortThis();
            medianLineHeight = deltas.get(deltas.size() / 2);
        }
        return new PageMetrics(avgFontSize, medianLineHeight);
    }
}
