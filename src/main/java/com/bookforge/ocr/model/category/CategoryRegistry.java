package com.bookforge.ocr.model.category;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.EnumMap;
import java.util.Map;

/**
 * The category taxonomy. {@link #DEFAULT} is the process-wide table; it holds
 * display metadata only and is never mutated, run statistics are built by
 * {@link CategoryAggregator} as new {@link Category} values.
 */
public final class CategoryRegistry {

    public static final CategoryRegistry DEFAULT = new CategoryRegistry(Lists.immutable.of(
        new Category(CategoryId.TITLE, "Titles",
            "Chapter titles and main headings", "#e91e63", 24, RegionClass.BODY, true),
        new Category(CategoryId.HEADING, "Section Headings",
            "Section headings and subheadings", "#9c27b0", 18, RegionClass.BODY, true),
        new Category(CategoryId.EPIGRAPH, "Epigraphs",
            "Epigraphs, block quotes and set-off formulas", "#00bcd4", 14, RegionClass.BODY, true),
        new Category(CategoryId.ATTRIBUTION, "Attributions",
            "Quote attributions introduced by a dash", "#607d8b", 12, RegionClass.BODY, true),
        new Category(CategoryId.BODY, "Body Text",
            "Main body text content", "#8bc34a", 12, RegionClass.BODY, true),
        new Category(CategoryId.CAPTION, "Captions",
            "Image captions and figure descriptions", "#ff9800", 10, RegionClass.BODY, true),
        new Category(CategoryId.HEADER, "Page Headers",
            "Page headers and running heads", "#795548", 10, RegionClass.HEADER, false),
        new Category(CategoryId.FOOTER, "Page Footers",
            "Page footers and page numbers", "#9e9e9e", 10, RegionClass.FOOTER, false)));

    private final ImmutableList<Category> categories;
    private final Map<CategoryId, Category> byId;

    private CategoryRegistry(ImmutableList<Category> categories) {
        this.categories = categories;
        EnumMap<CategoryId, Category> index = new EnumMap<>(CategoryId.class);
        for (Category category : categories) {
            index.put(category.getId(), category);
        }
        if (index.size() != CategoryId.values().length) {
            throw new IllegalStateException("Category table must define every CategoryId, got " + index.keySet());
        }
        this.byId = index;
    }

    /**
     * All categories in taxonomy order.
     */
    public ImmutableList<Category> getCategories() {
        return categories;
    }

    public Category get(CategoryId id) {
        return byId.get(id);
    }

    public RegionClass regionOf(CategoryId id) {
        return byId.get(id).getRegion();
    }

    public boolean isEnabledByDefault(CategoryId id) {
        return byId.get(id).isEnabled();
    }
}
