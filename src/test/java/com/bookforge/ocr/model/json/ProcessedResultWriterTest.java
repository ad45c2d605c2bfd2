package com.bookforge.ocr.model.json;

import com.bookforge.ocr.layout.OcrPostProcessor;
import com.bookforge.ocr.layout.OcrPostProcessorConfig;
import com.bookforge.ocr.model.PageDimension;
import com.bookforge.ocr.model.ProcessedResult;
import com.bookforge.ocr.model.RawLine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class ProcessedResultWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static ProcessedResult sampleResult() {
        OcrPostProcessor processor = new OcrPostProcessor(new OcrPostProcessorConfig(new Properties()));
        return processor.process(List.of(
            new RawLine(0, 50, 20, 200, 12, "Running Head", 12),
            new RawLine(0, 50, 300, 400, 12, "Body text of the page.", 12)),
            List.of(new PageDimension(600, 800)), null);
    }

    @Test
    void toJson_shouldUseSnakeCaseBlockFields() throws Exception {
        JsonNode root = objectMapper.readTree(new ProcessedResultWriter().toJson(sampleResult()));

        JsonNode block = root.path("blocks").get(1);
        assertEquals("ocr_p0_1", block.path("id").asText());
        assertEquals(0, block.path("page").asInt());
        assertEquals(50, block.path("x").asDouble(), 1e-9);
        assertEquals("Body text of the page.", block.path("text").asText());
        assertEquals(12, block.path("font_size").asInt());
        assertEquals("OCR", block.path("font_name").asText());
        assertEquals(22, block.path("char_count").asInt());
        assertEquals("body", block.path("category_id").asText());
        assertEquals("body", block.path("region").asText());
        assertTrue(block.path("is_ocr").asBoolean());
        assertEquals(1, block.path("line_count").asInt());
        assertTrue(block.path("box").isMissingNode());
    }

    @Test
    void toJson_shouldKeyCategoriesByIdInTaxonomyOrder() throws Exception {
        JsonNode categories = objectMapper.readTree(new ProcessedResultWriter().toJson(sampleResult()))
            .path("categories");

        Iterator<String> names = categories.fieldNames();
        assertEquals("body", names.next());
        assertEquals("header", names.next());
        assertFalse(names.hasNext());

        JsonNode header = categories.path("header");
        assertEquals("Page Headers", header.path("name").asText());
        assertEquals(1, header.path("block_count").asInt());
        assertEquals(12, header.path("char_count").asInt());
        assertEquals("Running Head", header.path("sample_text").asText());
        assertFalse(header.path("enabled").asBoolean());
        assertEquals("header", header.path("region").asText());
    }

    @Test
    void toJson_ofEmptyResult_shouldHaveEmptyContainers() throws Exception {
        JsonNode root = objectMapper.readTree(new ProcessedResultWriter().toJson(ProcessedResult.empty()));

        assertTrue(root.path("blocks").isArray());
        assertEquals(0, root.path("blocks").size());
        assertTrue(root.path("categories").isObject());
        assertEquals(0, root.path("categories").size());
    }
}
