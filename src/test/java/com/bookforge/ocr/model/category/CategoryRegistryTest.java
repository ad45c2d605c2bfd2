package com.bookforge.ocr.model.category;

import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CategoryRegistryTest {

    @Test
    void defaultRegistry_shouldDefineEveryCategoryInTaxonomyOrder() {
        CategoryRegistry registry = CategoryRegistry.DEFAULT;

        assertEquals(CategoryId.values().length, registry.getCategories().size());
        assertEquals(Lists.mutable.of(CategoryId.values()),
            registry.getCategories().collect(Category::getId).toList());
    }

    @Test
    void headerAndFooter_shouldBeDisabledWithTheirOwnRegion() {
        CategoryRegistry registry = CategoryRegistry.DEFAULT;

        assertFalse(registry.isEnabledByDefault(CategoryId.HEADER));
        assertFalse(registry.isEnabledByDefault(CategoryId.FOOTER));
        assertEquals(RegionClass.HEADER, registry.regionOf(CategoryId.HEADER));
        assertEquals(RegionClass.FOOTER, registry.regionOf(CategoryId.FOOTER));
    }

    @Test
    void contentCategories_shouldBeEnabledInBodyRegion() {
        CategoryRegistry registry = CategoryRegistry.DEFAULT;
        for (CategoryId id : new CategoryId[] {CategoryId.TITLE, CategoryId.HEADING, CategoryId.EPIGRAPH,
                CategoryId.ATTRIBUTION, CategoryId.BODY, CategoryId.CAPTION}) {
            assertTrue(registry.isEnabledByDefault(id), id + " should be enabled");
            assertEquals(RegionClass.BODY, registry.regionOf(id));
        }
    }

    @Test
    void title_shouldCarryDisplayMetadata() {
        Category title = CategoryRegistry.DEFAULT.get(CategoryId.TITLE);

        assertEquals("Titles", title.getName());
        assertEquals("#e91e63", title.getColor());
        assertEquals(24, title.getFontSize());
    }
}
