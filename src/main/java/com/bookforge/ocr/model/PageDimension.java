package com.bookforge.ocr.model;

public final class PageDimension {
    public final double width;
    public final double height;

    public PageDimension(double width, double height) {
        this.width = width;
        this.height = height;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
