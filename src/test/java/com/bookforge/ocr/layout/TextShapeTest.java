package com.bookforge.ocr.layout;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TextShapeTest {

    @Test
    void startsWithDashMarker_shouldAcceptEmEnAndHyphen() {
        assertTrue(TextShape.startsWithDashMarker("— Mark Twain"));
        assertTrue(TextShape.startsWithDashMarker("– Anonymous"));
        assertTrue(TextShape.startsWithDashMarker("  - Proverb"));
        assertFalse(TextShape.startsWithDashMarker("Mark Twain —"));
    }

    @Test
    void endsWithMidWordHyphen_shouldRequireLetterBeforeHyphen() {
        assertTrue(TextShape.endsWithMidWordHyphen("an exam-"));
        assertTrue(TextShape.endsWithMidWordHyphen("an exam-  "));
        assertFalse(TextShape.endsWithMidWordHyphen("pages 10-"));
        assertFalse(TextShape.endsWithMidWordHyphen("a dash -"));
        assertFalse(TextShape.endsWithMidWordHyphen("-"));
    }

    @Test
    void endsWithSentencePunctuation_shouldAllowClosingQuotes() {
        assertTrue(TextShape.endsWithSentencePunctuation("It was over."));
        assertTrue(TextShape.endsWithSentencePunctuation("Was it over?"));
        assertTrue(TextShape.endsWithSentencePunctuation("as follows:"));
        assertTrue(TextShape.endsWithSentencePunctuation("\"It was over.\""));
        assertTrue(TextShape.endsWithSentencePunctuation("“It was over!”"));
        assertFalse(TextShape.endsWithSentencePunctuation("It was over,"));
        assertFalse(TextShape.endsWithSentencePunctuation("It was"));
    }

    @Test
    void startsWithLowercase_shouldIgnoreLeadingWhitespace() {
        assertTrue(TextShape.startsWithLowercase("  continued"));
        assertFalse(TextShape.startsWithLowercase("Continued"));
        assertFalse(TextShape.startsWithLowercase("   "));
    }

    @Test
    void isAllCaps_shouldNeedMoreThanThreeUppercaseLetters() {
        assertTrue(TextShape.isAllCaps("CHAPTER ONE"));
        assertTrue(TextShape.isAllCaps("PART 2: THE END"));
        assertFalse(TextShape.isAllCaps("ABC"));
        assertFalse(TextShape.isAllCaps("Chapter One"));
        assertFalse(TextShape.isAllCaps("12345"));
    }

    @Test
    void looksLikePageNumber_shouldAcceptNumbersAndShortText() {
        assertTrue(TextShape.looksLikePageNumber("42"));
        assertTrue(TextShape.looksLikePageNumber("— 117 —"));
        assertTrue(TextShape.looksLikePageNumber("Page 12"));
        assertTrue(TextShape.looksLikePageNumber("Short footer"));
        assertFalse(TextShape.looksLikePageNumber("The closing sentence of the chapter."));
    }

    @Test
    void isChapterNumber_shouldAcceptArabicAndUpperRoman() {
        assertTrue(TextShape.isChapterNumber("12"));
        assertTrue(TextShape.isChapterNumber("12."));
        assertTrue(TextShape.isChapterNumber("XIV"));
        assertTrue(TextShape.isChapterNumber(" IV. "));
        assertFalse(TextShape.isChapterNumber("iv"));
        assertFalse(TextShape.isChapterNumber("Chapter 1"));
    }
}
