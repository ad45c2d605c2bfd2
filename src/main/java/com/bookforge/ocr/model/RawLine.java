package com.bookforge.ocr.model;

import java.util.Objects;

/**
 * One line as recognized by an OCR engine: page index, position, text and
 * an estimated font size.
 */
public final class RawLine {
    public final int page;
    public final BoundingBox box;
    public final String text;
    public final double fontSize;

    public RawLine(int page, BoundingBox box, String text, double fontSize) {
        this.page = page;
        this.box = Objects.requireNonNull(box, "box");
        this.text = text == null ? "" : text;
        this.fontSize = fontSize;
    }

    public RawLine(int page, double x, double y, double width, double height, String text, double fontSize) {
        this(page, new BoundingBox(x, y, width, height), text, fontSize);
    }

    /**
     * Creates a line from an OCR engine's corner-form box {@code [x1, y1, x2, y2]}.
     */
    public static RawLine fromCorners(int page, double[] bbox, String text, double fontSize) {
        if (bbox == null || bbox.length != 4) {
            throw new IllegalArgumentException("bbox must have exactly 4 coordinates");
        }
        return new RawLine(page, BoundingBox.fromCorners(bbox[0], bbox[1], bbox[2], bbox[3]), text, fontSize);
    }

    @Override
    public String toString() {
        return "RawLine{page=" + page + ", box=" + box + ", text='" + text + "'}";
    }
}
