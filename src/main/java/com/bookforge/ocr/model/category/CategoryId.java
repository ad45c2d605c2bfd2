package com.bookforge.ocr.model.category;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The fixed set of semantic block categories.
 */
public enum CategoryId {

    TITLE("title"),

    HEADING("heading"),

    /**
     * Epigraphs and other set-off passages. Layout detection also routes formulas here.
     */
    EPIGRAPH("epigraph"),

    /**
     * Dash-introduced attribution lines such as "— Mark Twain".
     */
    ATTRIBUTION("attribution"),

    BODY("body"),

    /**
     * Only produced from layout regions; no heuristic rule assigns it.
     */
    CAPTION("caption"),

    HEADER("header"),

    FOOTER("footer");

    private final String id;

    CategoryId(String id) {
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
