package com.bookforge.ocr.layout;

import java.util.regex.Pattern;

/**
 * Text-shape tests shared by paragraph merging and heuristic categorization.
 * All methods take the raw line or block text and trim it themselves.
 */
public final class TextShape {

    // em dash, en dash, hyphen
    private static final Pattern DASH_MARKER = Pattern.compile("^[\\u2014\\u2013-]");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?:;][\\s\"'\\u201d\\u2019]*$");
    private static final Pattern PAGE_NUMBER_CHARS = Pattern.compile("^[\\d\\u2014\\u2013\\s-]+$");
    private static final Pattern PAGE_N = Pattern.compile("^page\\s*\\d+$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CHAPTER_NUMBER = Pattern.compile("^(\\d+|[IVXLCDM]+)\\.?$");

    private TextShape() {
    }

    public static boolean startsWithDashMarker(String text) {
        return DASH_MARKER.matcher(text.trim()).find();
    }

    /**
     * A word broken across lines: a letter immediately followed by a trailing hyphen.
     */
    public static boolean endsWithMidWordHyphen(String text) {
        String trimmed = text.trim();
        int length = trimmed.length();
        return length >= 2
            && trimmed.charAt(length - 1) == '-'
            && Character.isLetter(trimmed.charAt(length - 2));
    }

    /**
     * Ends with {@code . ! ? : ;}, optionally followed by closing quotes.
     */
    public static boolean endsWithSentencePunctuation(String text) {
        return SENTENCE_END.matcher(text.trim()).find();
    }

    public static boolean startsWithLowercase(String text) {
        String trimmed = text.trim();
        return !trimmed.isEmpty() && Character.isLowerCase(trimmed.charAt(0));
    }

    /**
     * More than three cased letters and none of them lowercase. Letters
     * without case (CJK, digits) are ignored.
     */
    public static boolean isAllCaps(String text) {
        int upper = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            if (Character.isUpperCase(c)) {
                upper++;
            }
        }
        return upper > 3;
    }

    /**
     * Digits, dashes and spaces only, "page N", or anything shorter than 15 characters.
     */
    public static boolean looksLikePageNumber(String text) {
        String trimmed = text.trim();
        return PAGE_NUMBER_CHARS.matcher(trimmed).matches()
            || PAGE_N.matcher(trimmed).matches()
            || trimmed.length() < 15;
    }

    /**
     * An arabic or upper-case Roman numeral on its own, optionally followed by a period.
     */
    public static boolean isChapterNumber(String text) {
        return CHAPTER_NUMBER.matcher(text.trim()).matches();
    }
}
