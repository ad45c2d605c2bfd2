package com.bookforge.ocr.layout.strategy;

import com.bookforge.ocr.layout.AbstractPageCategorizationStrategy;
import com.bookforge.ocr.layout.CategorizationMethod;
import com.bookforge.ocr.model.LayoutRegion;
import com.bookforge.ocr.model.MergedBlock;
import com.bookforge.ocr.model.category.CategoryId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Categorizes blocks by the layout region they overlap most.
 *
 * <p>Overlap is measured against the block's own area, not the region's, so a
 * large region does not win just by being large. A block whose best overlap
 * does not exceed the threshold is body text; this strategy never falls back
 * to heuristics.</p>
 */
public class LayoutRegionCategorizationStrategy extends AbstractPageCategorizationStrategy {

    private static final Logger LOGGER = LoggerFactory.getLogger(LayoutRegionCategorizationStrategy.class);

    public static final double DEFAULT_MIN_OVERLAP = 0.30;

    private final double minOverlap;

    public LayoutRegionCategorizationStrategy() {
        this(DEFAULT_MIN_OVERLAP);
    }

    public LayoutRegionCategorizationStrategy(double minOverlap) {
        this.minOverlap = minOverlap;
    }

    @Override
    public CategorizationMethod getMethod() {
        return CategorizationMethod.LAYOUT_REGIONS;
    }

    @Override
    public CategoryId categorize(MergedBlock block, PageContext context) {
        LayoutRegion bestMatch = null;
        double bestOverlap = 0;
        double blockArea = block.box.area();

        for (LayoutRegion region : context.layoutRegions) {
            double overlap = overlapRatio(block, region, blockArea);
            if (overlap > bestOverlap) {
                bestOverlap = overlap;
                bestMatch = region;
            }
        }

        LOGGER.trace("Block at {} best match: {} ({} overlap)",
            block.box, bestMatch == null ? "none" : bestMatch.label, bestOverlap);

        if (bestMatch != null && bestOverlap > minOverlap) {
            return bestMatch.label.getCategoryId();
        }
        return CategoryId.BODY;
    }

    /**
     * Share of the block's area covered by the region, 0 for a degenerate block.
     */
    static double overlapRatio(MergedBlock block, LayoutRegion region, double blockArea) {
        if (blockArea <= 0) {
            return 0;
        }
        return block.box.intersectionArea(region.box) / blockArea;
    }

    public double getMinOverlap() {
        return minOverlap;
    }
}
