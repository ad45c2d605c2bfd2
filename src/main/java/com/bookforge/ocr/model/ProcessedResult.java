package com.bookforge.ocr.model;

import com.bookforge.ocr.model.category.Category;
import com.bookforge.ocr.model.category.CategoryId;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one post-processing run: the categorized blocks in document
 * order and the statistics of every category that received at least one block.
 */
@JsonPropertyOrder({"blocks", "categories"})
public final class ProcessedResult {

    private final MutableList<TextBlock> blocks;
    private final Map<CategoryId, Category> categories;

    public ProcessedResult(List<TextBlock> blocks, Map<CategoryId, Category> categories) {
        this.blocks = Lists.mutable.ofAll(blocks).asUnmodifiable();
        this.categories = categories.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(categories));
    }

    public static ProcessedResult empty() {
        return new ProcessedResult(Collections.emptyList(), Collections.emptyMap());
    }

    @JsonProperty("blocks")
    public List<TextBlock> getBlocks() {
        return blocks;
    }

    /**
     * Categories keyed by id, iterating in taxonomy order.
     */
    @JsonIgnore
    public Map<CategoryId, Category> getCategories() {
        return categories;
    }

    @JsonProperty("categories")
    public Map<String, Category> getCategoriesById() {
        Map<String, Category> byId = new LinkedHashMap<>();
        categories.forEach((id, category) -> byId.put(id.getId(), category));
        return byId;
    }

    /**
     * Blocks whose category is enabled, i.e. what an export includes by default.
     */
    @JsonIgnore
    public List<TextBlock> getEnabledBlocks() {
        return blocks.select(block -> {
            Category category = categories.get(block.getCategoryId());
            return category != null && category.isEnabled();
        });
    }
}
