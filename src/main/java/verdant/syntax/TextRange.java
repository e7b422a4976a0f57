// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.syntax;

/**
 * A half-open range {@code [start, end)} of UTF-16 code unit offsets into a document's text.
 */
public record TextRange(int start, int end) {
    public TextRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid text range " + start + ".." + end);
        }
    }

    /**
     * Returns the range starting at {@code start} with the given length.
     */
    public static TextRange at(final int start, final int length) {
        return new TextRange(start, start + length);
    }

    /**
     * Returns the empty range at the given offset.
     */
    public static TextRange empty(final int offset) {
        return new TextRange(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Checks whether the given offset lies within this range, the end excluded.
     */
    public boolean contains(final int offset) {
        return start <= offset && offset < end;
    }

    /**
     * Checks whether the given range lies completely within this range.
     */
    public boolean contains(final TextRange other) {
        return start <= other.start && other.end <= end;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
