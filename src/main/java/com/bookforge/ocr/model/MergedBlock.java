package com.bookforge.ocr.model;

/**
 * A paragraph-level group of consecutive raw lines. Only the values copied
 * out of the lines are kept: the union box, the joined text, how many lines
 * went in and their rounded mean font size.
 */
public final class MergedBlock {
    public final int page;
    public final BoundingBox box;
    public final String text;
    public final int lineCount;
    public final int fontSize;

    public MergedBlock(int page, BoundingBox box, String text, int lineCount, int fontSize) {
        this.page = page;
        this.box = box;
        this.text = text;
        this.lineCount = lineCount;
        this.fontSize = fontSize;
    }

    public boolean isSingleLine() {
        return lineCount == 1;
    }

    @Override
    public String toString() {
        return "MergedBlock{page=" + page + ", box=" + box + ", lines=" + lineCount + ", text='" + text + "'}";
    }
}
