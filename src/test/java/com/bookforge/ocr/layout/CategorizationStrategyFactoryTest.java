package com.bookforge.ocr.layout;

import com.bookforge.ocr.layout.strategy.HeuristicCategorizationStrategy;
import com.bookforge.ocr.layout.strategy.LayoutRegionCategorizationStrategy;
import com.bookforge.ocr.model.BoundingBox;
import com.bookforge.ocr.model.LayoutLabel;
import com.bookforge.ocr.model.LayoutRegion;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CategorizationStrategyFactoryTest {

    private final CategorizationStrategyFactory factory = new CategorizationStrategyFactory();

    @Test
    void detectMethod_withoutRegions_shouldUseHeuristics() {
        assertEquals(CategorizationMethod.HEURISTIC, factory.detectMethod(null));
        assertEquals(CategorizationMethod.HEURISTIC, factory.detectMethod(Collections.emptyList()));
    }

    @Test
    void detectMethod_withRegions_shouldUseLayoutRegions() {
        List<LayoutRegion> regions = List.of(new LayoutRegion(LayoutLabel.TEXT, new BoundingBox(0, 0, 10, 10)));

        assertEquals(CategorizationMethod.LAYOUT_REGIONS, factory.detectMethod(regions));
        assertInstanceOf(LayoutRegionCategorizationStrategy.class, factory.createStrategy(regions));
    }

    @Test
    void createStrategy_shouldReuseStatelessInstances() {
        PageCategorizationStrategy first = factory.createStrategy(null);
        PageCategorizationStrategy second = factory.createStrategy(Collections.emptyList());

        assertInstanceOf(HeuristicCategorizationStrategy.class, first);
        assertSame(first, second);
        assertEquals(CategorizationMethod.HEURISTIC, first.getMethod());
    }

    @Test
    void constructor_shouldPassOverlapThresholdToLayoutStrategy() {
        CategorizationStrategyFactory custom = new CategorizationStrategyFactory(0.5);

        LayoutRegionCategorizationStrategy strategy =
            (LayoutRegionCategorizationStrategy) custom.getStrategy(CategorizationMethod.LAYOUT_REGIONS);
        assertEquals(0.5, strategy.getMinOverlap(), 1e-9);
    }
}
