package com.bookforge.ocr.model.category;

import com.bookforge.ocr.model.TextBlock;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Folds a run's categorized blocks into per-category statistics.
 *
 * <p>Each step of the fold produces a new immutable map of tallies, so the
 * aggregator holds no state between calls and a registry can be shared by
 * any number of runs.</p>
 */
public class CategoryAggregator {

    public static final int DEFAULT_SAMPLE_LENGTH = 100;

    private final CategoryRegistry registry;
    private final int sampleLength;

    public CategoryAggregator(CategoryRegistry registry) {
        this(registry, DEFAULT_SAMPLE_LENGTH);
    }

    public CategoryAggregator(CategoryRegistry registry, int sampleLength) {
        this.registry = Objects.requireNonNull(registry, "registry");
        if (sampleLength < 0) {
            throw new IllegalArgumentException("sampleLength must not be negative: " + sampleLength);
        }
        this.sampleLength = sampleLength;
    }

    /**
     * Builds the category map for the given blocks, in document order.
     *
     * @return categories with at least one block, iterating in taxonomy order
     */
    public Map<CategoryId, Category> aggregate(ListIterable<TextBlock> blocks) {
        ImmutableMap<CategoryId, CategoryTally> tallies =
            blocks.injectInto(Maps.immutable.<CategoryId, CategoryTally>empty(), this::accumulate);
        if (tallies.isEmpty()) {
            return Collections.emptyMap();
        }

        EnumMap<CategoryId, Category> result = new EnumMap<>(CategoryId.class);
        for (Category category : registry.getCategories()) {
            CategoryTally tally = tallies.get(category.getId());
            if (tally != null) {
                result.put(category.getId(),
                    category.withStatistics(tally.blockCount, tally.charCount, tally.sampleText));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    private ImmutableMap<CategoryId, CategoryTally> accumulate(ImmutableMap<CategoryId, CategoryTally> tallies,
                                                               TextBlock block) {
        CategoryTally current = tallies.get(block.getCategoryId());
        CategoryTally next = current == null
            ? CategoryTally.first(block, sampleLength)
            : current.plus(block);
        return tallies.newWithKeyValue(block.getCategoryId(), next);
    }
}
