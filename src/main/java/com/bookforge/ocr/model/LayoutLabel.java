package com.bookforge.ocr.model;

import com.bookforge.ocr.model.category.CategoryId;

/**
 * Region labels emitted by the layout-detection plugin.
 *
 * <p>Each label declares the category its text is filed under, so a new
 * label cannot be added without deciding where it goes.</p>
 */
public enum LayoutLabel {

    TITLE("Title", CategoryId.TITLE),
    SECTION_HEADER("SectionHeader", CategoryId.HEADING),
    TEXT("Text", CategoryId.BODY),
    HANDWRITING("Handwriting", CategoryId.BODY),
    TEXT_INLINE_MATH("TextInlineMath", CategoryId.BODY),
    LIST_ITEM("ListItem", CategoryId.BODY),
    FORM("Form", CategoryId.BODY),
    TABLE("Table", CategoryId.BODY),
    FIGURE("Figure", CategoryId.BODY),
    PICTURE("Picture", CategoryId.BODY),
    TABLE_OF_CONTENTS("TableOfContents", CategoryId.BODY),
    CAPTION("Caption", CategoryId.CAPTION),
    FOOTNOTE("Footnote", CategoryId.FOOTER),
    PAGE_FOOTER("PageFooter", CategoryId.FOOTER),
    PAGE_HEADER("PageHeader", CategoryId.HEADER),
    FORMULA("Formula", CategoryId.EPIGRAPH);

    private final String label;
    private final CategoryId categoryId;

    LayoutLabel(String label, CategoryId categoryId) {
        this.label = label;
        this.categoryId = categoryId;
    }

    /**
     * The label as it appears in the plugin's output, e.g. {@code SectionHeader}.
     */
    public String getLabel() {
        return label;
    }

    public CategoryId getCategoryId() {
        return categoryId;
    }

    /**
     * Resolves a plugin label.
     *
     * @throws IllegalArgumentException if the label is not part of the closed set
     */
    public static LayoutLabel fromLabel(String label) {
        for (LayoutLabel value : values()) {
            if (value.label.equals(label)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown layout label: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
