package com.bookforge.ocr.model.json;

import com.bookforge.ocr.model.LayoutRegion;
import com.bookforge.ocr.model.PageDimension;
import com.bookforge.ocr.model.RawLine;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The three inputs of one post-processing run, as read from JSON.
 */
public final class OcrDocument {

    private final List<RawLine> lines;
    private final List<PageDimension> pageDimensions;
    private final Map<Integer, List<LayoutRegion>> layoutRegionsByPage;

    public OcrDocument(List<RawLine> lines, List<PageDimension> pageDimensions,
                       Map<Integer, List<LayoutRegion>> layoutRegionsByPage) {
        this.lines = Collections.unmodifiableList(lines);
        this.pageDimensions = Collections.unmodifiableList(pageDimensions);
        this.layoutRegionsByPage = Collections.unmodifiableMap(layoutRegionsByPage);
    }

    public List<RawLine> getLines() {
        return lines;
    }

    public List<PageDimension> getPageDimensions() {
        return pageDimensions;
    }

    public Map<Integer, List<LayoutRegion>> getLayoutRegionsByPage() {
        return layoutRegionsByPage;
    }
}
