package com.bookforge.ocr.layout;

import com.bookforge.ocr.model.MergedBlock;
import com.bookforge.ocr.model.category.CategoryId;
import org.eclipse.collections.api.bag.MutableBag;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for categorization strategies. Subclasses decide a single block;
 * this class walks the page and reports what it assigned.
 */
public abstract class AbstractPageCategorizationStrategy implements PageCategorizationStrategy {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractPageCategorizationStrategy.class);

    @Override
    public MutableList<CategoryId> categorizePage(ListIterable<MergedBlock> blocks, PageContext context) {
        MutableList<CategoryId> categories = blocks.collect(block -> categorize(block, context)).toList();

        if (LOGGER.isDebugEnabled()) {
            MutableBag<CategoryId> counts = categories.toBag();
            LOGGER.debug("Page {}: categorized {} blocks using {}: {}",
                context.page, blocks.size(), getMethod(), counts.toStringOfItemToCount());
        }
        return categories;
    }
}
