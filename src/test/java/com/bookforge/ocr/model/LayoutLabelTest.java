package com.bookforge.ocr.model;

import com.bookforge.ocr.model.category.CategoryId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LayoutLabelTest {

    @Test
    void everyLabel_shouldMapToACategory() {
        for (LayoutLabel label : LayoutLabel.values()) {
            assertNotNull(label.getCategoryId(), "No category for " + label.name());
            assertSame(label, LayoutLabel.fromLabel(label.getLabel()));
        }
    }

    @Test
    void categoryTable_shouldMatchPluginLabels() {
        assertEquals(CategoryId.TITLE, LayoutLabel.fromLabel("Title").getCategoryId());
        assertEquals(CategoryId.HEADING, LayoutLabel.fromLabel("SectionHeader").getCategoryId());
        assertEquals(CategoryId.BODY, LayoutLabel.fromLabel("Text").getCategoryId());
        assertEquals(CategoryId.BODY, LayoutLabel.fromLabel("TableOfContents").getCategoryId());
        assertEquals(CategoryId.CAPTION, LayoutLabel.fromLabel("Caption").getCategoryId());
        assertEquals(CategoryId.FOOTER, LayoutLabel.fromLabel("Footnote").getCategoryId());
        assertEquals(CategoryId.FOOTER, LayoutLabel.fromLabel("PageFooter").getCategoryId());
        assertEquals(CategoryId.HEADER, LayoutLabel.fromLabel("PageHeader").getCategoryId());
        assertEquals(CategoryId.EPIGRAPH, LayoutLabel.fromLabel("Formula").getCategoryId());
    }

    @Test
    void fromLabel_withUnknownLabel_shouldThrow() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> LayoutLabel.fromLabel("Marginalia"));
        assertTrue(e.getMessage().contains("Marginalia"));
    }

    @Test
    void fromLabel_shouldBeCaseSensitive() {
        assertThrows(IllegalArgumentException.class, () -> LayoutLabel.fromLabel("title"));
    }
}
