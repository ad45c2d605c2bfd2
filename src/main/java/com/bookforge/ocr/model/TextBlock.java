package com.bookforge.ocr.model;

import com.bookforge.ocr.model.category.CategoryId;
import com.bookforge.ocr.model.category.RegionClass;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A categorized, OCR-derived paragraph block as handed to the editor and
 * export layers.
 */
@JsonPropertyOrder({"id", "page", "x", "y", "width", "height", "text", "font_size", "font_name",
    "char_count", "region", "category_id", "is_ocr", "line_count"})
public final class TextBlock {

    public static final String OCR_FONT_NAME = "OCR";

    private final String id;
    private final int page;
    private final BoundingBox box;
    private final String text;
    private final int fontSize;
    private final CategoryId categoryId;
    private final RegionClass region;
    private final int lineCount;

    public TextBlock(String id, MergedBlock block, CategoryId categoryId, RegionClass region) {
        this(id, block.page, block.box, block.text, block.fontSize, categoryId, region, block.lineCount);
    }

    public TextBlock(String id, int page, BoundingBox box, String text, int fontSize,
                     CategoryId categoryId, RegionClass region, int lineCount) {
        this.id = Objects.requireNonNull(id, "id");
        this.page = page;
        this.box = Objects.requireNonNull(box, "box");
        this.text = text;
        this.fontSize = fontSize;
        this.categoryId = Objects.requireNonNull(categoryId, "categoryId");
        this.region = Objects.requireNonNull(region, "region");
        this.lineCount = lineCount;
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("page")
    public int getPage() {
        return page;
    }

    @JsonIgnore
    public BoundingBox getBox() {
        return box;
    }

    @JsonProperty("x")
    public double getX() {
        return box.x;
    }

    @JsonProperty("y")
    public double getY() {
        return box.y;
    }

    @JsonProperty("width")
    public double getWidth() {
        return box.width;
    }

    @JsonProperty("height")
    public double getHeight() {
        return box.height;
    }

    @JsonProperty("text")
    public String getText() {
        return text;
    }

    @JsonProperty("font_size")
    public int getFontSize() {
        return fontSize;
    }

    @JsonProperty("font_name")
    public String getFontName() {
        return OCR_FONT_NAME;
    }

    @JsonProperty("char_count")
    public int getCharCount() {
        return text.length();
    }

    @JsonProperty("region")
    public RegionClass getRegion() {
        return region;
    }

    @JsonProperty("category_id")
    public CategoryId getCategoryId() {
        return categoryId;
    }

    /**
     * Always true: every block produced here comes from OCR rather than the
     * PDF's own text layer.
     */
    @JsonProperty("is_ocr")
    public boolean isOcr() {
        return true;
    }

    @JsonProperty("line_count")
    public int getLineCount() {
        return lineCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextBlock)) return false;
        TextBlock that = (TextBlock) o;
        return page == that.page
            && fontSize == that.fontSize
            && lineCount == that.lineCount
            && id.equals(that.id)
            && box.equals(that.box)
            && Objects.equals(text, that.text)
            && categoryId == that.categoryId
            && region == that.region;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, page, box, text, fontSize, categoryId, region, lineCount);
    }

    @Override
    public String toString() {
        return "TextBlock{" + id + ", " + categoryId + ", text='" + text + "'}";
    }
}
