package com.bookforge.ocr.layout;

import com.bookforge.ocr.layout.strategy.LayoutRegionCategorizationStrategy;
import com.bookforge.ocr.model.PageDimension;
import com.bookforge.ocr.model.category.CategoryAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Loads post-processor settings from {@code ocr-postprocessor.properties}.
 * Every setting has a default, so the file is optional.
 */
public class OcrPostProcessorConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(OcrPostProcessorConfig.class);

    private static final String DEFAULT_CONFIG = "ocr-postprocessor.properties";

    private final Properties properties;

    public OcrPostProcessorConfig() {
        this(DEFAULT_CONFIG);
    }

    public OcrPostProcessorConfig(String configPath) {
        this.properties = new Properties();
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(configPath)) {
            if (input == null) {
                LOGGER.info("No {} on the classpath, using defaults.", configPath);
                return;
            }
            properties.load(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + configPath, e);
        }
    }

    public OcrPostProcessorConfig(Properties properties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
    }

    /**
     * Size assumed for pages with no dimension entry.
     */
    public PageDimension getFallbackPageDimension() {
        return new PageDimension(
            getDouble("page.fallback.width", 600),
            getDouble("page.fallback.height", 800));
    }

    public int getSampleTextLength() {
        return Integer.parseInt(properties.getProperty("category.sample.length",
            String.valueOf(CategoryAggregator.DEFAULT_SAMPLE_LENGTH)));
    }

    /**
     * Overlap ratio a block must exceed for a layout region's label to apply.
     */
    public double getMinLayoutOverlap() {
        return getDouble("layout.min.overlap", LayoutRegionCategorizationStrategy.DEFAULT_MIN_OVERLAP);
    }

    private double getDouble(String key, double defaultValue) {
        return Double.parseDouble(properties.getProperty(key, String.valueOf(defaultValue)));
    }
}
