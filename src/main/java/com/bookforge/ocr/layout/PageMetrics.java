package com.bookforge.ocr.layout;

/**
 * Per-page baselines every later stage measures against.
 */
public final class PageMetrics {
    public final double avgFontSize;
    public final double medianLineHeight;

    public PageMetrics(double avgFontSize, double medianLineHeight) {
        this.avgFontSize = avgFontSize;
        this.medianLineHeight = medianLineHeight;
    }

    @Override
    public String toString() {
        return String.format("avgFontSize=%.1f, medianLineHeight=%.1f", avgFontSize, medianLineHeight);
    }
}
