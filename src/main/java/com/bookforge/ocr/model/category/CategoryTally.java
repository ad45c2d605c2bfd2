package com.bookforge.ocr.model.category;

import com.bookforge.ocr.model.TextBlock;

/**
 * Running statistics for one category. Immutable: {@link #plus} returns a new tally.
 */
final class CategoryTally {
    final int blockCount;
    final int charCount;
    final String sampleText;

    private CategoryTally(int blockCount, int charCount, String sampleText) {
        this.blockCount = blockCount;
        this.charCount = charCount;
        this.sampleText = sampleText;
    }

    /**
     * Tally for the first block of a category; that block supplies the sample.
     */
    static CategoryTally first(TextBlock block, int sampleLength) {
        String text = block.getText();
        String sample = text.length() > sampleLength ? text.substring(0, sampleLength) : text;
        return new CategoryTally(1, text.length(), sample);
    }

    CategoryTally plus(TextBlock block) {
        return new CategoryTally(blockCount + 1, charCount + block.getText().length(), sampleText);
    }
}
