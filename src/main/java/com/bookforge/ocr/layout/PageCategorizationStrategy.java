package com.bookforge.ocr.layout;

import com.bookforge.ocr.model.BoundingBox;
import com.bookforge.ocr.model.LayoutRegion;
import com.bookforge.ocr.model.MergedBlock;
import com.bookforge.ocr.model.PageDimension;
import com.bookforge.ocr.model.category.CategoryId;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;

/**
 * Assigns categories to the merged blocks of one page.
 *
 * <p>Implementations are stateless and side-effect free: the category of a
 * block depends only on the block and the {@link PageContext}, so one
 * instance can serve every page and every run.</p>
 */
public interface PageCategorizationStrategy {

    /**
     * The method this strategy implements.
     */
    CategorizationMethod getMethod();

    /**
     * Categorizes a single block.
     *
     * @param block   a merged block of the page
     * @param context page geometry, metrics and layout regions
     * @return the block's category, never null
     */
    CategoryId categorize(MergedBlock block, PageContext context);

    /**
     * Categorizes every block of a page.
     *
     * @return one category per block, in block order
     */
    MutableList<CategoryId> categorizePage(ListIterable<MergedBlock> blocks, PageContext context);

    /**
     * Page information a categorization decision may consult.
     */
    class PageContext {
        /**
         * A block whose centre lies within this fraction of the page width
         * from the page centre counts as centred.
         */
        public static final double CENTERED_TOLERANCE = 0.15;

        public final int page;
        public final double pageWidth;
        public final double pageHeight;
        public final double pageCenterX;
        public final double avgFontSize;
        public final ImmutableList<LayoutRegion> layoutRegions;

        public PageContext(int page, PageDimension dimension, PageMetrics metrics, List<LayoutRegion> layoutRegions) {
            this.page = page;
            this.pageWidth = dimension.width;
            this.pageHeight = dimension.height;
            this.pageCenterX = dimension.width / 2.0;
            this.avgFontSize = metrics.avgFontSize;
            this.layoutRegions = layoutRegions == null
                ? Lists.immutable.empty()
                : Lists.immutable.ofAll(layoutRegions);
        }

        /**
         * Vertical position of the box's top edge as a fraction of page height.
         */
        public double yPercent(BoundingBox box) {
            return box.y / pageHeight;
        }

        public boolean isCentered(BoundingBox box) {
            return Math.abs(box.centerX() - pageCenterX) < pageWidth * CENTERED_TOLERANCE;
        }
    }
}
