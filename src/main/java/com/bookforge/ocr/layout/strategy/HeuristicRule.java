package com.bookforge.ocr.layout.strategy;

import com.bookforge.ocr.layout.PageCategorizationStrategy.PageContext;
import com.bookforge.ocr.model.MergedBlock;
import com.bookforge.ocr.model.category.CategoryId;
import org.eclipse.collections.api.block.predicate.Predicate2;

/**
 * One entry of the heuristic rule chain: a named condition and the category
 * it assigns when the condition holds.
 */
public final class HeuristicRule {
    private final String name;
    private final CategoryId category;
    private final Predicate2<MergedBlock, PageContext> condition;

    public HeuristicRule(String name, CategoryId category, Predicate2<MergedBlock, PageContext> condition) {
        this.name = name;
        this.category = category;
        this.condition = condition;
    }

    public String getName() {
        return name;
    }

    public CategoryId getCategory() {
        return category;
    }

    public boolean matches(MergedBlock block, PageContext context) {
        return condition.accept(block, context);
    }

    @Override
    public String toString() {
        return name + " -> " + category;
    }
}
