package com.bookforge.ocr.layout;

import com.bookforge.ocr.layout.PageCategorizationStrategy.PageContext;
import com.bookforge.ocr.layout.ParagraphMerger.MergeContext;
import com.bookforge.ocr.model.LayoutRegion;
import com.bookforge.ocr.model.MergedBlock;
import com.bookforge.ocr.model.PageDimension;
import com.bookforge.ocr.model.ProcessedResult;
import com.bookforge.ocr.model.RawLine;
import com.bookforge.ocr.model.TextBlock;
import com.bookforge.ocr.model.category.Category;
import com.bookforge.ocr.model.category.CategoryAggregator;
import com.bookforge.ocr.model.category.CategoryId;
import com.bookforge.ocr.model.category.CategoryRegistry;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.multimap.list.MutableListMultimap;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns raw OCR lines into categorized paragraph blocks.
 *
 * <p>Lines are grouped by page and pages are processed in ascending order.
 * For each page the metrics are estimated, lines merged into paragraphs, and
 * the paragraphs categorized with the strategy chosen for that page. The
 * category statistics are folded over the finished block list.</p>
 *
 * <p>The transform keeps no state between calls: the same input always
 * produces the same result.</p>
 *
 * @see CategorizationStrategyFactory
 * @see ParagraphMerger
 */
public class OcrPostProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(OcrPostProcessor.class);

    private final PageDimension fallbackDimension;
    private final PageMetricsEstimator metricsEstimator;
    private final ParagraphMerger paragraphMerger;
    private final CategorizationStrategyFactory strategyFactory;
    private final CategoryRegistry registry;
    private final CategoryAggregator aggregator;

    public OcrPostProcessor() {
        this(new OcrPostProcessorConfig());
    }

    public OcrPostProcessor(OcrPostProcessorConfig config) {
        this(config, CategoryRegistry.DEFAULT);
    }

    public OcrPostProcessor(OcrPostProcessorConfig config, CategoryRegistry registry) {
        this.fallbackDimension = config.getFallbackPageDimension();
        this.metricsEstimator = new PageMetricsEstimator();
        this.paragraphMerger = new ParagraphMerger();
        this.strategyFactory = new CategorizationStrategyFactory(config.getMinLayoutOverlap());
        this.registry = Objects.requireNonNull(registry, "registry");
        this.aggregator = new CategoryAggregator(registry, config.getSampleTextLength());
    }

    /**
     * Processes one OCR run.
     *
     * @param rawLines            every recognized line, any page, any order
     * @param pageDimensions      page sizes indexed by page; missing entries use the fallback size
     * @param layoutRegionsByPage layout regions per page index, may be null; a page with
     *                            regions is categorized by overlap, one without by heuristics
     * @return blocks in page order plus statistics of the categories used
     */
    public ProcessedResult process(List<RawLine> rawLines,
                                   List<PageDimension> pageDimensions,
                                   Map<Integer, List<LayoutRegion>> layoutRegionsByPage) {
        Objects.requireNonNull(rawLines, "rawLines");
        List<PageDimension> dimensions = pageDimensions == null ? Collections.emptyList() : pageDimensions;
        Map<Integer, List<LayoutRegion>> regionsByPage =
            layoutRegionsByPage == null ? Collections.emptyMap() : layoutRegionsByPage;

        LOGGER.info("Processing {} OCR lines (layout regions supplied for {} pages)",
            rawLines.size(), regionsByPage.size());
        if (rawLines.isEmpty()) {
            return ProcessedResult.empty();
        }

        MutableListMultimap<Integer, RawLine> linesByPage = Lists.mutable.ofAll(rawLines).groupBy(line -> line.page);
        MutableList<TextBlock> blocks = Lists.mutable.empty();
        for (Integer page : linesByPage.keysView().toSortedList()) {
            blocks.addAll(processPage(page, linesByPage.get(page),
                dimensionFor(page, dimensions), regionsByPage.get(page)));
        }

        Map<CategoryId, Category> categories = aggregator.aggregate(blocks);
        LOGGER.info("Produced {} blocks in {} categories from {} lines",
            blocks.size(), categories.size(), rawLines.size());
        return new ProcessedResult(blocks, categories);
    }

    /**
     * Merges and categorizes the lines of a single page.
     */
    MutableList<TextBlock> processPage(int page, ListIterable<RawLine> lines,
                                       PageDimension dimension, List<LayoutRegion> layoutRegions) {
        if (lines.isEmpty()) {
            return Lists.mutable.empty();
        }

        MutableList<RawLine> sorted = lines.toSortedListBy(line -> line.box.y);
        PageMetrics metrics = metricsEstimator.estimate(sorted);
        LOGGER.debug("Page {}: {} lines, {}", page, sorted.size(), metrics);

        MutableList<MergedBlock> merged =
            paragraphMerger.merge(sorted, new MergeContext(page, metrics.medianLineHeight, dimension.width));

        PageCategorizationStrategy strategy = strategyFactory.createStrategy(layoutRegions);
        PageContext context = new PageContext(page, dimension, metrics, layoutRegions);
        MutableList<CategoryId> categories = strategy.categorizePage(merged, context);

        MutableList<TextBlock> blocks = Lists.mutable.withInitialCapacity(merged.size());
        for (int i = 0; i < merged.size(); i++) {
            CategoryId categoryId = categories.get(i);
            blocks.add(new TextBlock(blockId(page, i), merged.get(i), categoryId, registry.regionOf(categoryId)));
        }
        return blocks;
    }

    PageDimension dimensionFor(int page, List<PageDimension> dimensions) {
        if (page >= 0 && page < dimensions.size()) {
            PageDimension dimension = dimensions.get(page);
            if (dimension != null && dimension.width > 0 && dimension.height > 0) {
                return dimension;
            }
        }
        return fallbackDimension;
    }

    /**
     * Ids are derived from position only, so reprocessing yields the same ids.
     */
    static String blockId(int page, int index) {
        return "ocr_p" + page + "_" + index;
    }
}
