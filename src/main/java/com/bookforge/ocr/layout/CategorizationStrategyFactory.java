package com.bookforge.ocr.layout;

import com.bookforge.ocr.layout.strategy.HeuristicCategorizationStrategy;
import com.bookforge.ocr.layout.strategy.LayoutRegionCategorizationStrategy;
import com.bookforge.ocr.model.LayoutRegion;

import java.util.List;

/**
 * Picks the categorization strategy for a page.
 *
 * <p>A page with layout regions is categorized by region overlap; a page
 * without them by heuristics. Strategies are stateless, so one instance of
 * each is created and reused.</p>
 */
public class CategorizationStrategyFactory {

    private final HeuristicCategorizationStrategy heuristicStrategy;
    private final LayoutRegionCategorizationStrategy layoutRegionStrategy;

    public CategorizationStrategyFactory() {
        this(LayoutRegionCategorizationStrategy.DEFAULT_MIN_OVERLAP);
    }

    public CategorizationStrategyFactory(double minLayoutOverlap) {
        this.heuristicStrategy = new HeuristicCategorizationStrategy();
        this.layoutRegionStrategy = new LayoutRegionCategorizationStrategy(minLayoutOverlap);
    }

    /**
     * Chooses the strategy from what was supplied for the page.
     *
     * @param layoutRegions the page's layout regions, may be null
     */
    public PageCategorizationStrategy createStrategy(List<LayoutRegion> layoutRegions) {
        return getStrategy(detectMethod(layoutRegions));
    }

    public CategorizationMethod detectMethod(List<LayoutRegion> layoutRegions) {
        if (layoutRegions != null && !layoutRegions.isEmpty()) {
            return CategorizationMethod.LAYOUT_REGIONS;
        }
        return CategorizationMethod.HEURISTIC;
    }

    public PageCategorizationStrategy getStrategy(CategorizationMethod method) {
        switch (method) {
            case LAYOUT_REGIONS:
                return layoutRegionStrategy;
            case HEURISTIC:
            default:
                return heuristicStrategy;
        }
    }
}
