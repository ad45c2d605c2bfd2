package com.bookforge.ocr.model.json;

import com.bookforge.ocr.model.ProcessedResult;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes a {@link ProcessedResult} as {@code {"blocks": [...], "categories": {...}}}
 * with snake_case field names.
 */
public class ProcessedResultWriter {

    private final ObjectMapper objectMapper;

    public ProcessedResultWriter() {
        this.objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    public String toJson(ProcessedResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            // every output type is a plain value object, so this indicates a programming error
            throw new IllegalStateException("Unable to serialize processed result", e);
        }
    }

    /**
     * Writes to the stream without closing it.
     */
    public void write(ProcessedResult result, OutputStream output) throws IOException {
        objectMapper.writeValue(output, result);
    }

    public void write(ProcessedResult result, Path path) throws IOException {
        try (OutputStream output = Files.newOutputStream(path)) {
            write(result, output);
        }
    }
}
