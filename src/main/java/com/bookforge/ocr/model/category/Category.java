package com.bookforge.ocr.model.category;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A category's display metadata plus the statistics of one processing run.
 * Instances are immutable; {@link #withStatistics} returns a new value.
 */
@JsonPropertyOrder({"id", "name", "description", "color", "block_count", "char_count",
    "font_size", "region", "sample_text", "enabled"})
public final class Category {
    private final CategoryId id;
    private final String name;
    private final String description;
    private final String color;
    private final int fontSize;
    private final RegionClass region;
    private final boolean enabled;
    private final int blockCount;
    private final int charCount;
    private final String sampleText;

    public Category(CategoryId id, String name, String description, String color,
                    int fontSize, RegionClass region, boolean enabled) {
        this(id, name, description, color, fontSize, region, enabled, 0, 0, "");
    }

    private Category(CategoryId id, String name, String description, String color,
                     int fontSize, RegionClass region, boolean enabled,
                     int blockCount, int charCount, String sampleText) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.description = description;
        this.color = color;
        this.fontSize = fontSize;
        this.region = Objects.requireNonNull(region, "region");
        this.enabled = enabled;
        this.blockCount = blockCount;
        this.charCount = charCount;
        this.sampleText = sampleText;
    }

    public Category withStatistics(int blockCount, int charCount, String sampleText) {
        return new Category(id, name, description, color, fontSize, region, enabled,
            blockCount, charCount, sampleText == null ? "" : sampleText);
    }

    @JsonProperty("id")
    public CategoryId getId() {
        return id;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("color")
    public String getColor() {
        return color;
    }

    /**
     * Nominal font size used when rendering this category, not a measured value.
     */
    @JsonProperty("font_size")
    public int getFontSize() {
        return fontSize;
    }

    @JsonProperty("region")
    public RegionClass getRegion() {
        return region;
    }

    @JsonProperty("enabled")
    public boolean isEnabled() {
        return enabled;
    }

    @JsonProperty("block_count")
    public int getBlockCount() {
        return blockCount;
    }

    @JsonProperty("char_count")
    public int getCharCount() {
        return charCount;
    }

    @JsonProperty("sample_text")
    public String getSampleText() {
        return sampleText;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Category)) return false;
        Category that = (Category) o;
        return fontSize == that.fontSize
            && enabled == that.enabled
            && blockCount == that.blockCount
            && charCount == that.charCount
            && id == that.id
            && region == that.region
            && Objects.equals(name, that.name)
            && Objects.equals(description, that.description)
            && Objects.equals(color, that.color)
            && Objects.equals(sampleText, that.sampleText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, description, color, fontSize, region, enabled, blockCount, charCount, sampleText);
    }

    @Override
    public String toString() {
        return "Category{" + id + ", blocks=" + blockCount + ", chars=" + charCount + "}";
    }
}
