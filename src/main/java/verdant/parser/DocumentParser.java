// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.parser;

import verdant.syntax.GreenNode;
import verdant.syntax.GreenNodeBuilder;
import verdant.syntax.SyntaxKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parser of the document structure: the zeroth section, headlines and everything that can only appear right after a
 * headline line.
 * <p>
 * A headline extends up to the next headline of the same or lower level, so the parse of a headline depends on its
 * own text only. The incremental reparser relies on that.
 */
final class DocumentParser {
    DocumentParser(final Source source) {
        this.source = source;
        elements = new ElementParser(source);
    }

    GreenNode parseDocument() {
        final var length = source.length();
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.DOCUMENT);
        final var firstHeadline = nextHeadline(0, length, Integer.MAX_VALUE);
        int pos = 0;
        final var properties = propertyDrawer(0, firstHeadline);
        if (properties != null) {
            builder.push(properties);
            pos += properties.textLength();
        }
        sectionOrBlankLines(builder, pos, firstHeadline);
        headlines(builder, firstHeadline, length);
        return builder.finishNode().finish();
    }

    /**
     * Parses the headline starting at offset 0, ending at the next headline of the same or lower level. Returns
     * {@code null} if the text doesn't start with a headline.
     */
    @Nullable GreenNode parseHeadline() {
        final var length = source.length();
        final var level = headlineLevel(0, length);
        if (level == 0) {
            return null;
        }
        return headline(0, nextHeadline(source.lineEnd(0, length), length, level), level);
    }

    // Returns the number of stars if a headline starts at pos, which must be at the start of a line, or 0.
    private int headlineLevel(final int pos, final int limit) {
        int i = pos;
        while (i < limit && source.charAt(i) == '*') {
            i += 1;
        }
        if (i == pos || i >= limit || !Source.isSpace(source.charAt(i))) {
            return 0;
        }
        return i - pos;
    }

    // Returns the start of the first headline line in [pos, limit) whose level is at most maxLevel, or limit.
    private int nextHeadline(final int pos, final int limit, final int maxLevel) {
        int line = pos;
        while (line < limit) {
            final var level = headlineLevel(line, limit);
            if (level != 0 && level <= maxLevel) {
                return line;
            }
            line = source.lineEnd(line, limit);
        }
        return limit;
    }

    private void headlines(final GreenNodeBuilder builder, final int pos, final int limit) {
        int i = pos;
        while (i < limit) {
            final var level = headlineLevel(i, limit);
            assert level != 0 : "Headline expected";
            final var end = nextHeadline(source.lineEnd(i, limit), limit, level);
            builder.push(headline(i, end, level));
            i = end;
        }
    }

    private GreenNode headline(final int pos, final int end, final int level) {
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.HEADLINE);
        final var contentEnd = source.lineContentEnd(pos, end);
        source.token(builder, SyntaxKind.HEADLINE_STARS, pos, pos + level);
        int i = whitespace(builder, pos + level, contentEnd);
        i = todoKeyword(builder, i, contentEnd);
        i = priority(builder, i, contentEnd);

        final var trimmed = source.trimEnd(i, contentEnd);
        final var tagsStart = tagsStart(i, trimmed);
        final var titleEnd = source.trimEnd(i, (tagsStart >= 0) ? tagsStart : trimmed);
        if (titleEnd > i) {
            builder.startNode(SyntaxKind.HEADLINE_TITLE);
            builder.pushAll(elements.inline().parse(i, titleEnd));
            builder.finishNode();
        }
        if (tagsStart >= 0) {
            source.token(builder, SyntaxKind.WHITESPACE, titleEnd, tagsStart);
            tags(builder, tagsStart, trimmed);
            source.token(builder, SyntaxKind.WHITESPACE, trimmed, contentEnd);
        } else {
            source.token(builder, SyntaxKind.WHITESPACE, titleEnd, contentEnd);
        }
        int next = source.newLine(builder, contentEnd, end);

        final var planning = planning(next, end);
        if (planning != null) {
            builder.push(planning);
            next += planning.textLength();
        }
        final var properties = propertyDrawer(next, end);
        if (properties != null) {
            builder.push(properties);
            next += properties.textLength();
        }
        final var firstChild = nextHeadline(next, end, Integer.MAX_VALUE);
        sectionOrBlankLines(builder, next, firstChild);
        headlines(builder, firstChild, end);
        return builder.finishNode().finish();
    }

    private int whitespace(final GreenNodeBuilder builder, final int pos, final int limit) {
        final var end = source.skipSpaces(pos, limit);
        source.token(builder, SyntaxKind.WHITESPACE, pos, end);
        return end;
    }

    private int todoKeyword(final GreenNodeBuilder builder, final int pos, final int limit) {
        int wordEnd = pos;
        while (wordEnd < limit && !Source.isSpace(source.charAt(wordEnd))) {
            wordEnd += 1;
        }
        if (wordEnd == pos) {
            return pos;
        }
        final var word = source.slice(pos, wordEnd);
        final var config = source.config();
        final SyntaxKind kind;
        if (config.activeTodoKeywords().contains(word)) {
            kind = SyntaxKind.HEADLINE_KEYWORD_TODO;
        } else if (config.doneTodoKeywords().contains(word)) {
            kind = SyntaxKind.HEADLINE_KEYWORD_DONE;
        } else {
            return pos;
        }
        builder.token(kind, word);
        return whitespace(builder, wordEnd, limit);
    }

    // "[#A]" or "[#1]" to "[#99]", followed by whitespace or the end of the line.
    private int priority(final GreenNodeBuilder builder, final int pos, final int limit) {
        if (!source.startsWith(pos, limit, "[#")) {
            return pos;
        }
        int close = pos + 2;
        while (close < limit && close - pos < 4 && Source.isAsciiDigit(source.charAt(close))) {
            close += 1;
        }
        if (close == pos + 2 && close < limit && Character.isLetter(source.charAt(close))) {
            close += 1;
        }
        if (close == pos + 2 || close >= limit || source.charAt(close) != ']') {
            return pos;
        }
        if (close + 1 < limit && !Source.isSpace(source.charAt(close + 1))) {
            return pos;
        }
        builder.startNode(SyntaxKind.HEADLINE_PRIORITY);
        builder.token(SyntaxKind.L_BRACKET, "[");
        builder.token(SyntaxKind.HASH, "#");
        source.token(builder, SyntaxKind.TEXT, pos + 2, close);
        builder.token(SyntaxKind.R_BRACKET, "]");
        builder.finishNode();
        return whitespace(builder, close + 1, limit);
    }

    // Returns the start of a ":tag1:tag2:" cluster ending at end, preceded by whitespace or by titleStart, or -1.
    private int tagsStart(final int titleStart, final int end) {
        int start = end;
        while (start > titleStart && isTagChar(source.charAt(start - 1))) {
            start -= 1;
        }
        if (end - start < 3 || source.charAt(start) != ':' || source.charAt(end - 1) != ':') {
            return -1;
        }
        if (start > titleStart && !Source.isSpace(source.charAt(start - 1))) {
            return -1;
        }
        return (source.indexOf("::", start, end) < 0) ? start : -1;
    }

    private void tags(final GreenNodeBuilder builder, final int start, final int end) {
        builder.startNode(SyntaxKind.HEADLINE_TAGS);
        int tagStart = start + 1;
        builder.token(SyntaxKind.COLON, ":");
        while (tagStart < end) {
            final var colon = source.indexOf(":", tagStart, end);
            source.token(builder, SyntaxKind.TEXT, tagStart, colon);
            builder.token(SyntaxKind.COLON, ":");
            tagStart = colon + 1;
        }
        builder.finishNode();
    }

    private static boolean isTagChar(final char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '@' || c == '#' || c == '%' || c == ':';
    }

    // One or more "KEYWORD: timestamp" items on the line at pos.
    private @Nullable GreenNode planning(final int pos, final int limit) {
        if (pos >= limit) {
            return null;
        }
        final var contentEnd = source.lineContentEnd(pos, limit);
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.PLANNING);
        int i = whitespace(builder, pos, contentEnd);
        if (i == contentEnd) {
            return null;
        }
        while (i < contentEnd) {
            final SyntaxKind kind;
            final String keyword;
            if (source.startsWith(i, contentEnd, "DEADLINE:")) {
                kind = SyntaxKind.PLANNING_DEADLINE;
                keyword = "DEADLINE:";
            } else if (source.startsWith(i, contentEnd, "SCHEDULED:")) {
                kind = SyntaxKind.PLANNING_SCHEDULED;
                keyword = "SCHEDULED:";
            } else if (source.startsWith(i, contentEnd, "CLOSED:")) {
                kind = SyntaxKind.PLANNING_CLOSED;
                keyword = "CLOSED:";
            } else {
                return null;
            }
            final var timestampStart = source.skipSpaces(i + keyword.length(), contentEnd);
            final var timestamp = elements.timestamps().parse(timestampStart, contentEnd);
            if (timestamp == null) {
                return null;
            }
            builder.startNode(kind);
            builder.token(SyntaxKind.PLANNING_KEYWORD, keyword);
            source.token(builder, SyntaxKind.WHITESPACE, i + keyword.length(), timestampStart);
            builder.push(timestamp);
            builder.finishNode();
            i = whitespace(builder, timestampStart + timestamp.textLength(), contentEnd);
        }
        source.newLine(builder, contentEnd, limit);
        return builder.finishNode().finish();
    }

    // A ":PROPERTIES:" drawer at pos whose every line is a node property, including the blank lines after it.
    private @Nullable GreenNode propertyDrawer(final int pos, final int limit) {
        if (pos >= limit) {
            return null;
        }
        final var contentEnd = source.lineContentEnd(pos, limit);
        final var start = source.skipSpaces(pos, contentEnd);
        if (!source.startsWithIgnoreCase(start, contentEnd, ":PROPERTIES:")
            || source.skipSpaces(start + 12, contentEnd) != contentEnd) {
            return null;
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.PROPERTY_DRAWER);
        int line = elements.drawerDelimiter(builder, SyntaxKind.DRAWER_BEGIN, pos, limit);
        while (true) {
            if (line >= limit) {
                return null;
            }
            if (elements.isDrawerEnd(line, limit)) {
                break;
            }
            final var property = nodeProperty(line, limit);
            if (property == null) {
                return null;
            }
            builder.push(property);
            line += property.textLength();
        }
        final var end = elements.drawerDelimiter(builder, SyntaxKind.DRAWER_END, line, limit);
        source.postBlank(builder, end, limit);
        return builder.finishNode().finish();
    }

    // ":NAME: value" or ":NAME+: value", the value being optional.
    private @Nullable GreenNode nodeProperty(final int pos, final int limit) {
        final var contentEnd = source.lineContentEnd(pos, limit);
        final var colon = source.skipSpaces(pos, contentEnd);
        if (colon >= contentEnd || source.charAt(colon) != ':') {
            return null;
        }
        int nameEnd = colon + 1;
        while (nameEnd < contentEnd && source.charAt(nameEnd) != ':' && !Source.isWhitespace(source.charAt(nameEnd))) {
            nameEnd += 1;
        }
        if (nameEnd >= contentEnd || source.charAt(nameEnd) != ':') {
            return null;
        }
        final var plus = nameEnd > colon + 1 && source.charAt(nameEnd - 1) == '+';
        final var textEnd = plus ? nameEnd - 1 : nameEnd;
        if (textEnd == colon + 1) {
            return null;
        }
        if (nameEnd + 1 < contentEnd && !Source.isSpace(source.charAt(nameEnd + 1))) {
            return null;
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.NODE_PROPERTY);
        source.token(builder, SyntaxKind.WHITESPACE, pos, colon);
        builder.token(SyntaxKind.COLON, ":");
        source.token(builder, SyntaxKind.TEXT, colon + 1, textEnd);
        if (plus) {
            builder.token(SyntaxKind.PLUS, "+");
        }
        builder.token(SyntaxKind.COLON, ":");
        final var valueStart = source.skipSpaces(nameEnd + 1, contentEnd);
        final var valueEnd = source.trimEnd(valueStart, contentEnd);
        source.token(builder, SyntaxKind.WHITESPACE, nameEnd + 1, valueStart);
        source.token(builder, SyntaxKind.TEXT, valueStart, valueEnd);
        source.token(builder, SyntaxKind.WHITESPACE, valueEnd, contentEnd);
        source.newLine(builder, contentEnd, limit);
        return builder.finishNode().finish();
    }

    // A section, or bare blank lines if [pos, end) consists of blank lines only.
    private void sectionOrBlankLines(final GreenNodeBuilder builder, final int pos, final int end) {
        int i = pos;
        while (source.isBlankLine(i, end)) {
            i = source.lineEnd(i, end);
        }
        if (i >= end) {
            source.postBlank(builder, pos, end);
            return;
        }
        builder.startNode(SyntaxKind.SECTION);
        builder.pushAll(elements.parseElements(pos, end));
        builder.finishNode();
    }

    private final Source source;
    private final ElementParser elements;
}
