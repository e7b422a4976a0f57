// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.parser;

import verdant.config.ParseConfig;
import verdant.syntax.GreenNodeBuilder;
import verdant.syntax.SyntaxKind;

/**
 * The text being parsed together with the configuration, plus the line-oriented scanning primitives shared by all
 * parsers.
 * <p>
 * All positions are absolute offsets into the text. Regions are given as {@code [pos, limit)}; no primitive ever
 * looks past {@code limit}.
 */
final class Source {
    Source(final String text, final ParseConfig config) {
        this.text = text;
        this.config = config;
    }

    String text() {
        return text;
    }

    ParseConfig config() {
        return config;
    }

    int length() {
        return text.length();
    }

    char charAt(final int index) {
        return text.charAt(index);
    }

    String slice(final int start, final int end) {
        return text.substring(start, end);
    }

    /**
     * Returns the offset of the line terminator of the line containing {@code pos}, or {@code limit}.
     */
    int lineContentEnd(final int pos, final int limit) {
        int i = pos;
        while (i < limit) {
            final var c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                break;
            }
            i += 1;
        }
        return i;
    }

    /**
     * Returns the offset just past the line terminator of the line containing {@code pos}, or {@code limit}.
     */
    int lineEnd(final int pos, final int limit) {
        final var contentEnd = lineContentEnd(pos, limit);
        if (contentEnd >= limit) {
            return contentEnd;
        }
        if (text.charAt(contentEnd) == '\r' && contentEnd + 1 < limit && text.charAt(contentEnd + 1) == '\n') {
            return contentEnd + 2;
        }
        return contentEnd + 1;
    }

    /**
     * Checks whether the line starting at {@code pos} exists and consists of spaces and tabs only.
     */
    boolean isBlankLine(final int pos, final int limit) {
        if (pos >= limit) {
            return false;
        }
        final var contentEnd = lineContentEnd(pos, limit);
        return skipSpaces(pos, contentEnd) == contentEnd;
    }

    int skipSpaces(final int pos, final int limit) {
        int i = pos;
        while (i < limit && isSpace(text.charAt(i))) {
            i += 1;
        }
        return i;
    }

    /**
     * Returns the offset just past the last non-space character in {@code [start, end)}, or {@code start}.
     */
    int trimEnd(final int start, final int end) {
        int i = end;
        while (i > start && isSpace(text.charAt(i - 1))) {
            i -= 1;
        }
        return i;
    }

    /**
     * Returns the offset of the first character of the line containing {@code pos}.
     */
    int lineStart(final int pos) {
        int i = pos;
        while (i > 0 && !atLineStart(i)) {
            i -= 1;
        }
        return i;
    }

    boolean atLineStart(final int pos) {
        if (pos == 0) {
            return true;
        }
        final var previous = text.charAt(pos - 1);
        return previous == '\n' || previous == '\r';
    }

    boolean startsWith(final int pos, final int limit, final String prefix) {
        return pos + prefix.length() <= limit && text.startsWith(prefix, pos);
    }

    boolean startsWithIgnoreCase(final int pos, final int limit, final String prefix) {
        return pos + prefix.length() <= limit && text.regionMatches(true, pos, prefix, 0, prefix.length());
    }

    int indexOf(final String needle, final int from, final int limit) {
        final var index = text.indexOf(needle, from);
        return (index < 0 || index + needle.length() > limit) ? -1 : index;
    }

    /**
     * Emits the text of {@code [start, end)} as a token of the given kind; nothing for an empty range.
     */
    void token(final GreenNodeBuilder builder, final SyntaxKind kind, final int start, final int end) {
        if (start < end) {
            builder.token(kind, text.substring(start, end));
        }
    }

    /**
     * Emits the blank lines starting at {@code pos} as {@code BLANK_LINE} tokens and returns the offset past them.
     */
    int postBlank(final GreenNodeBuilder builder, final int pos, final int limit) {
        int i = pos;
        while (isBlankLine(i, limit)) {
            final var end = lineEnd(i, limit);
            builder.token(SyntaxKind.BLANK_LINE, text.substring(i, end));
            i = end;
        }
        return i;
    }

    /**
     * Emits the line terminator of the line whose content ends at {@code contentEnd} and returns the offset past it.
     */
    int newLine(final GreenNodeBuilder builder, final int contentEnd, final int limit) {
        final var end = lineEnd(contentEnd, limit);
        token(builder, SyntaxKind.NEW_LINE, contentEnd, end);
        return end;
    }

    static boolean isSpace(final char c) {
        return c == ' ' || c == '\t';
    }

    static boolean isWhitespace(final char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    static boolean isAsciiDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isAsciiLetter(final char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static boolean isAsciiAlphanumeric(final char c) {
        return isAsciiLetter(c) || isAsciiDigit(c);
    }

    private final String text;
    private final ParseConfig config;
}
