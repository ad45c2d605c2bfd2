package com.bookforge.ocr.model.category;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Page region a category belongs to.
 */
public enum RegionClass {
    BODY("body"),
    HEADER("header"),
    FOOTER("footer");

    private final String id;

    RegionClass(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
