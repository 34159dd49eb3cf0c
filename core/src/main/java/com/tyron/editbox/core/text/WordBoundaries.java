package com.tyron.editbox.core.text;

/**
 * Word navigation over a {@link TextBuffer}.
 *
 * A word is a run of non-whitespace code points. Moving in either direction first skips the
 * whitespace next to the caret and then the word behind it.
 */
public final class WordBoundaries {

    private WordBoundaries() {
    }

    public static int previousWordStart(TextBuffer text, int from) {
        int i = Math.min(Math.max(from, 0), text.length());
        while (i > 0 && Character.isWhitespace(text.codePointAt(i - 1))) {
            i--;
        }
        while (i > 0 && !Character.isWhitespace(text.codePointAt(i - 1))) {
            i--;
        }
        return i;
    }

    public static int nextWordEnd(TextBuffer text, int from) {
        int len = text.length();
        int i = Math.min(Math.max(from, 0), len);
        while (i < len && Character.isWhitespace(text.codePointAt(i))) {
            i++;
        }
        while (i < len && !Character.isWhitespace(text.codePointAt(i))) {
            i++;
        }
        return i;
    }
}
