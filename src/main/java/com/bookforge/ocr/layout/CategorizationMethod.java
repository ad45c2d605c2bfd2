package com.bookforge.ocr.layout;

/**
 * How the blocks of a page are categorized. Chosen once per page, based on
 * whether layout-detection regions were supplied for it.
 */
public enum CategorizationMethod {

    /**
     * Position, size and text-shape rules.
     */
    HEURISTIC("heuristic rules"),

    /**
     * Overlap with labeled regions from the layout-detection plugin.
     */
    LAYOUT_REGIONS("layout regions");

    private final String displayName;

    CategorizationMethod(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
