package com.bookforge.ocr.model.json;

import com.bookforge.ocr.model.BoundingBox;
import com.bookforge.ocr.model.LayoutLabel;
import com.bookforge.ocr.model.LayoutRegion;
import com.bookforge.ocr.model.PageDimension;
import com.bookforge.ocr.model.RawLine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads an OCR document: page dimensions, recognized lines and optional
 * layout regions keyed by page index.
 *
 * <p>A line carries either {@code x/y/width/height} or a corner-form
 * {@code bbox} of four numbers. Layout regions always use {@code bbox}.</p>
 */
public class OcrDocumentReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(OcrDocumentReader.class);

    private final ObjectMapper objectMapper;

    public OcrDocumentReader() {
        this(new ObjectMapper());
    }

    public OcrDocumentReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public OcrDocument read(Path path) throws OcrInputException {
        try (InputStream input = Files.newInputStream(path)) {
            return read(input);
        } catch (IOException e) {
            throw new OcrInputException("Unable to read OCR document " + path, e);
        }
    }

    public OcrDocument read(InputStream input) throws OcrInputException {
        JsonNode root;
        try {
            root = objectMapper.readTree(input);
        } catch (JsonProcessingException e) {
            throw new OcrInputException("Malformed OCR document: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new OcrInputException("Unable to read OCR document", e);
        }
        if (root == null || !root.isObject()) {
            throw new OcrInputException("OCR document must be a JSON object");
        }

        List<PageDimension> dimensions = readPageDimensions(root.path("page_dimensions"));
        List<RawLine> lines = readLines(root.path("lines"));
        Map<Integer, List<LayoutRegion>> regions = readLayoutRegions(root.path("layout_regions"));
        LOGGER.debug("Read {} lines, {} page dimensions, layout regions for {} pages",
            lines.size(), dimensions.size(), regions.size());
        return new OcrDocument(lines, dimensions, regions);
    }

    private List<PageDimension> readPageDimensions(JsonNode node) throws OcrInputException {
        List<PageDimension> dimensions = new ArrayList<>();
        if (node.isMissingNode() || node.isNull()) {
            return dimensions;
        }
        requireArray(node, "page_dimensions");
        for (JsonNode dimension : node) {
            if (dimension.isNull()) {
                // keeps later pages at their index; the processor substitutes the fallback size
                dimensions.add(null);
                continue;
            }
            dimensions.add(new PageDimension(
                dimension.path("width").asDouble(0),
                dimension.path("height").asDouble(0)));
        }
        return dimensions;
    }

    private List<RawLine> readLines(JsonNode node) throws OcrInputException {
        List<RawLine> lines = new ArrayList<>();
        if (node.isMissingNode() || node.isNull()) {
            return lines;
        }
        requireArray(node, "lines");
        int index = 0;
        for (JsonNode line : node) {
            lines.add(readLine(line, index++));
        }
        return lines;
    }

    private RawLine readLine(JsonNode line, int index) throws OcrInputException {
        int page = line.path("page").asInt(0);
        String text = line.path("text").asText("");
        double fontSize = line.path("font_size").asDouble(0);

        JsonNode bbox = line.get("bbox");
        if (bbox != null) {
            return RawLine.fromCorners(page, readCorners(bbox, "lines[" + index + "].bbox"), text, fontSize);
        }
        if (!line.has("x") || !line.has("y")) {
            throw new OcrInputException("lines[" + index + "] has neither bbox nor x/y");
        }
        return new RawLine(page,
            line.path("x").asDouble(),
            line.path("y").asDouble(),
            line.path("width").asDouble(0),
            line.path("height").asDouble(0),
            text, fontSize);
    }

    private Map<Integer, List<LayoutRegion>> readLayoutRegions(JsonNode node) throws OcrInputException {
        Map<Integer, List<LayoutRegion>> regionsByPage = new TreeMap<>();
        if (node.isMissingNode() || node.isNull()) {
            return regionsByPage;
        }
        if (!node.isObject()) {
            throw new OcrInputException("layout_regions must be an object keyed by page index");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            int page;
            try {
                page = Integer.parseInt(entry.getKey().trim());
            } catch (NumberFormatException e) {
                throw new OcrInputException("Invalid page key in layout_regions: " + entry.getKey(), e);
            }
            String where = "layout_regions[" + page + "]";
            requireArray(entry.getValue(), where);
            List<LayoutRegion> regions = new ArrayList<>();
            int position = 0;
            for (JsonNode region : entry.getValue()) {
                regions.add(readRegion(region, where + "[" + position + "]", position));
                position++;
            }
            regionsByPage.put(page, regions);
        }
        return regionsByPage;
    }

    private LayoutRegion readRegion(JsonNode region, String where, int defaultPosition) throws OcrInputException {
        LayoutLabel label;
        try {
            label = LayoutLabel.fromLabel(region.path("label").asText(""));
        } catch (IllegalArgumentException e) {
            throw new OcrInputException(where + ": " + e.getMessage(), e);
        }
        JsonNode bbox = region.get("bbox");
        if (bbox == null) {
            throw new OcrInputException(where + " has no bbox");
        }
        double[] corners = readCorners(bbox, where + ".bbox");

        List<double[]> polygon = new ArrayList<>();
        JsonNode points = region.path("polygon");
        if (points.isArray()) {
            for (JsonNode point : points) {
                polygon.add(new double[] {point.path(0).asDouble(), point.path(1).asDouble()});
            }
        }
        return new LayoutRegion(label,
            BoundingBox.fromCorners(corners[0], corners[1], corners[2], corners[3]),
            region.path("confidence").asDouble(1.0),
            polygon,
            region.path("position").asInt(defaultPosition));
    }

    private static double[] readCorners(JsonNode bbox, String where) throws OcrInputException {
        if (!bbox.isArray() || bbox.size() != 4) {
            throw new OcrInputException(where + " must be [x1, y1, x2, y2]");
        }
        double[] corners = new double[4];
        for (int i = 0; i < 4; i++) {
            if (!bbox.get(i).isNumber()) {
                throw new OcrInputException(where + " contains a non-numeric coordinate");
            }
            corners[i] = bbox.get(i).asDouble();
        }
        return corners;
    }

    private static void requireArray(JsonNode node, String name) throws OcrInputException {
        if (!node.isArray()) {
            throw new OcrInputException(name + " must be an array");
        }
    }
}
