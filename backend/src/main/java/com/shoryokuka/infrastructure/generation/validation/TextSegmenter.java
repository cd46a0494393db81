package com.shoryokuka.infrastructure.generation.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits section text into paragraphs (one per slot) and sentences.
 */
public final class TextSegmenter {

    // Blank line, possibly holding spaces or ideographic spaces
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t\\u3000]*\\n");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u3000]");
    private static final String TERMINATORS = "。！？!?";
    private static final String CLOSERS = "」』）)";

    private TextSegmenter() {
    }

    public static List<String> paragraphs(String text) {
        return List.of(PARAGRAPH_BREAK.split(text, -1));
    }

    public static boolean isSingleParagraph(String text) {
        return !PARAGRAPH_BREAK.matcher(text).find();
    }

    public static List<Sentence> sentences(String paragraph) {
        List<Sentence> sentences = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < paragraph.length(); i++) {
            char c = paragraph.charAt(i);
            if (c == '\n') {
                add(sentences, paragraph, start, i);
                start = i + 1;
            } else if (TERMINATORS.indexOf(c) >= 0) {
                add(sentences, paragraph, start, i + 1);
                start = i + 1;
            }
        }
        add(sentences, paragraph, start, paragraph.length());
        return sentences;
    }

    /**
     * Character count with all whitespace removed, the way application forms count.
     */
    public static int visibleLength(String text) {
        return WHITESPACE.matcher(text).replaceAll("").length();
    }

    private static void add(List<Sentence> sentences, String paragraph, int start, int end) {
        while (start < end && isSpace(paragraph.charAt(start))) {
            start++;
        }
        while (end > start && isSpace(paragraph.charAt(end - 1))) {
            end--;
        }
        if (start < end) {
            sentences.add(new Sentence(paragraph.substring(start, end), start, end));
        }
    }

    private static boolean isSpace(char c) {
        return Character.isWhitespace(c) || c == '　';
    }

    /**
     * A sentence with its offsets inside the paragraph.
     */
    public record Sentence(String text, int start, int end) {

        public boolean isListItem(String marker) {
            return text.startsWith(marker);
        }

        public String opening(int length) {
            return text.length() <= length ? text : text.substring(0, length);
        }

        /**
         * Last characters before the terminator and any closing bracket.
         */
        public String ending(int length) {
            int end = text.length();
            while (end > 0 && (TERMINATORS.indexOf(text.charAt(end - 1)) >= 0
                    || CLOSERS.indexOf(text.charAt(end - 1)) >= 0)) {
                end--;
            }
            return text.substring(Math.max(0, end - length), end);
        }
    }
}
