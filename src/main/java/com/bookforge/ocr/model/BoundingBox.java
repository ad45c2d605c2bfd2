package com.bookforge.ocr.model;

import java.util.Objects;

/**
 * Axis-aligned rectangle in page coordinates. The origin is the top-left
 * corner of the page and y grows downward, matching OCR engine output.
 */
public final class BoundingBox {
    public final double x;
    public final double y;
    public final double width;
    public final double height;

    public BoundingBox(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    /**
     * Builds a box from corner form {@code [x1, y1, x2, y2]}, the layout used by
     * OCR text lines and layout-detection regions.
     */
    public static BoundingBox fromCorners(double x1, double y1, double x2, double y2) {
        return new BoundingBox(x1, y1, x2 - x1, y2 - y1);
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public double centerX() {
        return x + width / 2.0;
    }

    public double area() {
        return width * height;
    }

    /**
     * Smallest box containing both this box and {@code other}.
     */
    public BoundingBox union(BoundingBox other) {
        double minX = Math.min(x, other.x);
        double minY = Math.min(y, other.y);
        double maxX = Math.max(right(), other.right());
        double maxY = Math.max(bottom(), other.bottom());
        return new BoundingBox(minX, minY, maxX - minX, maxY - minY);
    }

    public double intersectionArea(BoundingBox other) {
        double xOverlap = Math.max(0, Math.min(right(), other.right()) - Math.max(x, other.x));
        double yOverlap = Math.max(0, Math.min(bottom(), other.bottom()) - Math.max(y, other.y));
        return xOverlap * yOverlap;
    }

    public boolean contains(BoundingBox other) {
        return other.x >= x && other.y >= y && other.right() <= right() && other.bottom() <= bottom();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundingBox)) return false;
        BoundingBox that = (BoundingBox) o;
        return Double.compare(that.x, x) == 0
            && Double.compare(that.y, y) == 0
            && Double.compare(that.width, width) == 0
            && Double.compare(that.height, height) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height);
    }

    @Override
    public String toString() {
        return String.format("(%.1f, %.1f) %.1fx%.1f", x, y, width, height);
    }
}
