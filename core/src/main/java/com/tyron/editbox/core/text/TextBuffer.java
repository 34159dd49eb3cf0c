package com.tyron.editbox.core.text;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable sequence of Unicode code points.
 *
 * Every edit returns a new buffer and leaves the receiver untouched, so a candidate can be built,
 * checked and thrown away without affecting the text that is currently committed.
 * All indices are code point offsets.
 */
public final class TextBuffer {

    public static final TextBuffer EMPTY = new TextBuffer(new int[0]);

    private final int[] codePoints;
    private String string;

    private TextBuffer(int[] codePoints) {
        this.codePoints = codePoints;
    }

    public static TextBuffer of(@NotNull String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            return EMPTY;
        }
        return new TextBuffer(text.codePoints().toArray());
    }

    public static TextBuffer ofCodePoint(int codePoint) {
        if (!Character.isValidCodePoint(codePoint)) {
            throw new IllegalArgumentException("Not a code point: " + codePoint);
        }
        return new TextBuffer(new int[]{codePoint});
    }

    private static TextBuffer wrap(int[] codePoints) {
        return codePoints.length == 0 ? EMPTY : new TextBuffer(codePoints);
    }

    public int length() {
        return codePoints.length;
    }

    public boolean isEmpty() {
        return codePoints.length == 0;
    }

    public int codePointAt(int index) {
        Objects.checkIndex(index, codePoints.length);
        return codePoints[index];
    }

    public TextBuffer insertAt(int index, int codePoint) {
        return insertAt(index, ofCodePoint(codePoint));
    }

    public TextBuffer insertAt(int index, @NotNull TextBuffer run) {
        return replaceRange(index, index, run);
    }

    public TextBuffer deleteRange(int low, int high) {
        return replaceRange(low, high, EMPTY);
    }

    /**
     * Replaces the range {@code [low, high)} with {@code run}.
     */
    public TextBuffer replaceRange(int low, int high, @NotNull TextBuffer run) {
        Objects.requireNonNull(run, "run");
        checkRange(low, high);
        if (low == high && run.isEmpty()) {
            return this;
        }

        int[] result = new int[codePoints.length - (high - low) + run.codePoints.length];
        System.arraycopy(codePoints, 0, result, 0, low);
        System.arraycopy(run.codePoints, 0, result, low, run.codePoints.length);
        System.arraycopy(codePoints, high, result, low + run.codePoints.length, codePoints.length - high);
        return wrap(result);
    }

    public TextBuffer substring(int low, int high) {
        checkRange(low, high);
        if (low == 0 && high == codePoints.length) {
            return this;
        }
        return wrap(Arrays.copyOfRange(codePoints, low, high));
    }

    /**
     * @return the first {@code length} code points, or this buffer when it is not longer than that.
     */
    public TextBuffer truncate(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length < 0: " + length);
        }
        return length >= codePoints.length ? this : substring(0, length);
    }

    /**
     * @return a buffer of the same length where every code point is {@code maskCodePoint}.
     */
    public TextBuffer mask(int maskCodePoint) {
        if (codePoints.length == 0) {
            return this;
        }
        int[] result = new int[codePoints.length];
        Arrays.fill(result, maskCodePoint);
        return new TextBuffer(result);
    }

    /**
     * @return the number of leading code points this buffer shares with {@code other}.
     */
    public int commonPrefixLength(@NotNull TextBuffer other) {
        int mismatch = Arrays.mismatch(codePoints, other.codePoints);
        return mismatch < 0 ? codePoints.length : mismatch;
    }

    private void checkRange(int low, int high) {
        int len = codePoints.length;
        if (low < 0 || high < low || high > len) {
            throw new IndexOutOfBoundsException("range [" + low + ", " + high + ") is out of bounds for length=" + len);
        }
    }

    @Override
    public String toString() {
        String s = string;
        if (s == null) {
            s = new String(codePoints, 0, codePoints.length);
            string = s;
        }
        return s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextBuffer other)) return false;
        return Arrays.equals(codePoints, other.codePoints);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(codePoints);
    }
}
