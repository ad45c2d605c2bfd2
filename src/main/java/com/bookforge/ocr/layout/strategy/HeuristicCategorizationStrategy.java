package com.bookforge.ocr.layout.strategy;

import com.bookforge.ocr.layout.AbstractPageCategorizationStrategy;
import com.bookforge.ocr.layout.CategorizationMethod;
import com.bookforge.ocr.layout.TextShape;
import com.bookforge.ocr.model.MergedBlock;
import com.bookforge.ocr.model.category.CategoryId;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Categorizes blocks from position, font size and text shape when no layout
 * regions are available for the page.
 *
 * <p>Rules are evaluated in list order; the first match wins and blocks that
 * match nothing are body text. There is no caption rule: caption only comes
 * from layout regions.</p>
 */
public class HeuristicCategorizationStrategy extends AbstractPageCategorizationStrategy {

    static final double HEADER_ZONE = 0.06;
    static final double FOOTER_ZONE = 0.94;
    static final double CHAPTER_NUMBER_ZONE = 0.20;
    static final double ALL_CAPS_TITLE_ZONE = 0.35;
    static final double LARGE_FONT_TITLE_ZONE = 0.40;
    static final double LARGE_FONT_FACTOR = 1.15;
    static final int SHORT_TEXT = 30;
    static final int LINE_TEXT = 80;

    private static final ImmutableList<HeuristicRule> RULES = Lists.immutable.of(
        new HeuristicRule("header", CategoryId.HEADER, (block, ctx) ->
            ctx.yPercent(block.box) < HEADER_ZONE
                && block.isSingleLine()
                && text(block).length() < SHORT_TEXT),

        new HeuristicRule("footer", CategoryId.FOOTER, (block, ctx) ->
            ctx.yPercent(block.box) > FOOTER_ZONE
                && block.isSingleLine()
                && TextShape.looksLikePageNumber(block.text)),

        new HeuristicRule("attribution", CategoryId.ATTRIBUTION, (block, ctx) ->
            TextShape.startsWithDashMarker(block.text)
                && text(block).length() < LINE_TEXT
                && block.isSingleLine()),

        new HeuristicRule("chapter-number", CategoryId.TITLE, (block, ctx) ->
            text(block).length() < SHORT_TEXT
                && ctx.yPercent(block.box) < CHAPTER_NUMBER_ZONE
                && block.isSingleLine()
                && TextShape.isChapterNumber(block.text)),

        new HeuristicRule("title", CategoryId.TITLE, (block, ctx) -> {
            String text = text(block);
            double yPercent = ctx.yPercent(block.box);
            boolean capsTitle = TextShape.isAllCaps(text)
                && yPercent < ALL_CAPS_TITLE_ZONE
                && text.length() < LINE_TEXT;
            boolean largeFontTitle = block.fontSize > ctx.avgFontSize * LARGE_FONT_FACTOR
                && text.length() < LINE_TEXT
                && yPercent < LARGE_FONT_TITLE_ZONE
                && block.isSingleLine();
            return capsTitle || largeFontTitle;
        }),

        new HeuristicRule("heading", CategoryId.HEADING, (block, ctx) ->
            TextShape.isAllCaps(text(block))
                && text(block).length() < LINE_TEXT
                && block.isSingleLine()
                && ctx.yPercent(block.box) >= ALL_CAPS_TITLE_ZONE));

    @Override
    public CategorizationMethod getMethod() {
        return CategorizationMethod.HEURISTIC;
    }

    @Override
    public CategoryId categorize(MergedBlock block, PageContext context) {
        HeuristicRule rule = RULES.detect(candidate -> candidate.matches(block, context));
        return rule == null ? CategoryId.BODY : rule.getCategory();
    }

    /**
     * The rule chain in evaluation order.
     */
    public ImmutableList<HeuristicRule> getRules() {
        return RULES;
    }

    private static String text(MergedBlock block) {
        return block.text.trim();
    }
}
