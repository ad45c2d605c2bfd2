package com.bookforge.ocr.layout;

import com.bookforge.ocr.model.PageDimension;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class OcrPostProcessorConfigTest {

    @Test
    void emptyProperties_shouldYieldDefaults() {
        OcrPostProcessorConfig config = new OcrPostProcessorConfig(new Properties());

        PageDimension fallback = config.getFallbackPageDimension();
        assertEquals(600, fallback.width, 1e-9);
        assertEquals(800, fallback.height, 1e-9);
        assertEquals(100, config.getSampleTextLength());
        assertEquals(0.30, config.getMinLayoutOverlap(), 1e-9);
    }

    @Test
    void properties_shouldOverrideDefaults() {
        Properties properties = new Properties();
        properties.setProperty("page.fallback.width", "612");
        properties.setProperty("page.fallback.height", "792");
        properties.setProperty("category.sample.length", "40");
        properties.setProperty("layout.min.overlap", "0.5");

        OcrPostProcessorConfig config = new OcrPostProcessorConfig(properties);

        assertEquals(612, config.getFallbackPageDimension().width, 1e-9);
        assertEquals(792, config.getFallbackPageDimension().height, 1e-9);
        assertEquals(40, config.getSampleTextLength());
        assertEquals(0.5, config.getMinLayoutOverlap(), 1e-9);
    }

    @Test
    void missingResource_shouldYieldDefaults() {
        OcrPostProcessorConfig config = new OcrPostProcessorConfig("no-such-config.properties");

        assertEquals(100, config.getSampleTextLength());
    }

    @Test
    void defaultResource_shouldBeLoadedFromClasspath() {
        OcrPostProcessorConfig config = new OcrPostProcessorConfig();

        assertEquals(600, config.getFallbackPageDimension().width, 1e-9);
        assertEquals(0.30, config.getMinLayoutOverlap(), 1e-9);
    }

    @Test
    void constructor_shouldCopyProperties() {
        Properties properties = new Properties();
        OcrPostProcessorConfig config = new OcrPostProcessorConfig(properties);
        properties.setProperty("category.sample.length", "5");

        assertEquals(100, config.getSampleTextLength());
    }
}
