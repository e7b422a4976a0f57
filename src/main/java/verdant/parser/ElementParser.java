// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.parser;

import java.util.ArrayList;
import java.util.List;
import verdant.syntax.GreenElement;
import verdant.syntax.GreenNode;
import verdant.syntax.GreenNodeBuilder;
import verdant.syntax.GreenToken;
import verdant.syntax.SyntaxKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parser of elements, the line-oriented building blocks of sections, drawers, greater blocks and list items.
 * <p>
 * Element parsers are tried in a fixed order at the start of each line; the paragraph is the fallback. Each element
 * owns the blank lines following it. Affiliated keywords are attached to the element following them, unless that
 * element can't carry them, in which case they're parsed as plain keywords.
 * <p>
 * Every parser returns {@code null} when its element doesn't start at the given position; the length of a returned
 * node is the number of characters it consumed.
 */
final class ElementParser {
    ElementParser(final Source source) {
        this.source = source;
        inline = new InlineParser(source);
        timestamps = new TimestampParser(source);
        blocks = new BlockParser(source, this);
        lists = new ListParser(source, this);
        tables = new TableParser(source, this);
    }

    InlineParser inline() {
        return inline;
    }

    TimestampParser timestamps() {
        return timestamps;
    }

    /**
     * Parses {@code [pos, limit)} as a sequence of elements. Leading blank lines become {@code BLANK_LINE} tokens.
     */
    List<GreenElement> parseElements(final int pos, final int limit) {
        final var result = new ArrayList<GreenElement>();
        int i = pos;
        while (i < limit) {
            if (source.isBlankLine(i, limit)) {
                final var end = source.lineEnd(i, limit);
                result.add(GreenToken.of(SyntaxKind.BLANK_LINE, source.slice(i, end)));
                i = end;
                continue;
            }
            final var element = parseElement(i, limit);
            result.add(element);
            i += element.textLength();
        }
        return result;
    }

    /**
     * Checks whether an element other than a paragraph starts at the line at {@code pos}. Used to end paragraphs.
     */
    boolean startsElement(final int pos, final int limit) {
        return tryNonParagraph(pos, limit, List.of()) != null;
    }

    private GreenNode parseElement(final int pos, final int limit) {
        final var affiliated = new ArrayList<GreenNode>();
        int i = pos;
        while (i < limit) {
            final var keyword = affiliatedKeyword(i, limit);
            if (keyword == null) {
                break;
            }
            affiliated.add(keyword);
            i += keyword.textLength();
        }
        if (affiliated.isEmpty()) {
            final var element = tryElement(pos, limit, affiliated);
            assert element != null : "Elements without affiliated keywords always parse";
            return element;
        }
        if (i < limit && !source.isBlankLine(i, limit)) {
            final var element = tryElement(i, limit, affiliated);
            if (element != null) {
                return element;
            }
        }
        // Nothing to attach to: the first of the keywords is an ordinary keyword.
        final var line = matchKeywordLine(pos, limit);
        assert line != null;
        return keyword(line, SyntaxKind.KEYWORD, limit, true);
    }

    private @Nullable GreenNode tryElement(final int pos, final int limit, final List<GreenNode> affiliated) {
        final var element = tryNonParagraph(pos, limit, affiliated);
        if (element != null) {
            return element;
        }
        if (!affiliated.isEmpty() && startsElement(pos, limit)) {
            return null;
        }
        return paragraph(pos, limit, affiliated);
    }

    // Returns null both when no element starts at pos and when one does, but can't carry the affiliated keywords.
    private @Nullable GreenNode tryNonParagraph(final int pos, final int limit, final List<GreenNode> affiliated) {
        @Nullable GreenNode node = blocks.parseBlock(pos, limit, affiliated);
        if (node == null) {
            node = blocks.parseDynamicBlock(pos, limit, affiliated);
        }
        if (node == null) {
            node = drawer(pos, limit, affiliated);
        }
        if (node == null) {
            node = babelCall(pos, limit, affiliated);
        }
        if (node == null && affiliated.isEmpty()) {
            node = plainKeyword(pos, limit);
        }
        if (node == null && affiliated.isEmpty()) {
            node = clock(pos, limit);
        }
        if (node == null) {
            node = tables.parse(pos, limit, affiliated);
        }
        if (node == null) {
            node = lists.parse(pos, limit, affiliated);
        }
        if (node == null && affiliated.isEmpty()) {
            node = prefixedLines(pos, limit, '#', SyntaxKind.COMMENT, SyntaxKind.HASH);
        }
        if (node == null) {
            node = fixedWidth(pos, limit, affiliated);
        }
        if (node == null) {
            node = rule(pos, limit, affiliated);
        }
        if (node == null) {
            node = footnoteDefinition(pos, limit, affiliated);
        }
        return node;
    }

    private GreenNode paragraph(final int pos, final int limit, final List<GreenNode> affiliated) {
        int contentEnd = source.lineContentEnd(pos, limit);
        int line = source.lineEnd(pos, limit);
        while (line < limit && !source.isBlankLine(line, limit) && !startsElement(line, limit)) {
            contentEnd = source.lineContentEnd(line, limit);
            line = source.lineEnd(line, limit);
        }
        final var builder = open(SyntaxKind.PARAGRAPH, affiliated);
        builder.pushAll(inline.parse(pos, contentEnd));
        final var end = source.newLine(builder, contentEnd, limit);
        return close(builder, end, limit);
    }

    // Keywords.

    /**
     * The layout of a {@code #+KEY[optional]: value} line. {@code optionalStart} is -1 when there's no optional part.
     */
    record KeywordLine(
        int start,
        int hashPlus,
        int keyEnd,
        int optionalStart,
        int optionalEnd,
        int colon,
        int contentEnd
    ) {
        String key(final Source source) {
            return source.slice(hashPlus + 2, keyEnd);
        }
    }

    @Nullable KeywordLine matchKeywordLine(final int pos, final int limit) {
        final var contentEnd = source.lineContentEnd(pos, limit);
        final var hashPlus = source.skipSpaces(pos, contentEnd);
        if (!source.startsWith(hashPlus, contentEnd, "#+")) {
            return null;
        }
        int i = hashPlus + 2;
        while (i < contentEnd) {
            final var c = source.charAt(i);
            if (Source.isWhitespace(c) || c == ':' || c == '[' || c == ']') {
                break;
            }
            i += 1;
        }
        final var keyEnd = i;
        if (keyEnd == hashPlus + 2 || keyEnd >= contentEnd) {
            return null;
        }
        int optionalStart = -1;
        int optionalEnd = -1;
        if (source.charAt(i) == '[') {
            final var close = source.text().indexOf(']', i + 1);
            if (close < 0 || close + 1 >= contentEnd) {
                return null;
            }
            optionalStart = i + 1;
            optionalEnd = close;
            i = close + 1;
        }
        if (source.charAt(i) != ':') {
            return null;
        }
        return new KeywordLine(pos, hashPlus, keyEnd, optionalStart, optionalEnd, i, contentEnd);
    }

    /**
     * Builds a keyword-like node from a matched line. Affiliated keyword values listed as parsed contain objects.
     */
    GreenNode keyword(final KeywordLine line, final SyntaxKind kind, final int limit, final boolean withPostBlank) {
        final var builder = new GreenNodeBuilder();
        builder.startNode(kind);
        source.token(builder, SyntaxKind.WHITESPACE, line.start(), line.hashPlus());
        builder.token(SyntaxKind.HASH_PLUS, "#+");
        source.token(builder, SyntaxKind.KEYWORD_KEY, line.hashPlus() + 2, line.keyEnd());
        if (line.optionalStart() >= 0) {
            builder.token(SyntaxKind.L_BRACKET, "[");
            source.token(builder, SyntaxKind.TEXT, line.optionalStart(), line.optionalEnd());
            builder.token(SyntaxKind.R_BRACKET, "]");
        }
        builder.token(SyntaxKind.COLON, ":");
        if (kind == SyntaxKind.AFFILIATED_KEYWORD && source.config().isParsedKeyword(line.key(source))) {
            builder.pushAll(inline.parse(line.colon() + 1, line.contentEnd()));
        } else {
            source.token(builder, SyntaxKind.TEXT, line.colon() + 1, line.contentEnd());
        }
        final var end = source.newLine(builder, line.contentEnd(), limit);
        if (withPostBlank) {
            source.postBlank(builder, end, limit);
        }
        return builder.finishNode().finish();
    }

    private @Nullable GreenNode affiliatedKeyword(final int pos, final int limit) {
        final var line = matchKeywordLine(pos, limit);
        if (line == null) {
            return null;
        }
        final var key = line.key(source);
        final var config = source.config();
        if (!config.isAffiliatedKeyword(key) || (line.optionalStart() >= 0 && !config.isDualKeyword(key))) {
            return null;
        }
        return keyword(line, SyntaxKind.AFFILIATED_KEYWORD, limit, false);
    }

    private @Nullable GreenNode plainKeyword(final int pos, final int limit) {
        final var line = matchKeywordLine(pos, limit);
        return (line == null) ? null : keyword(line, SyntaxKind.KEYWORD, limit, true);
    }

    private @Nullable GreenNode babelCall(final int pos, final int limit, final List<GreenNode> affiliated) {
        final var line = matchKeywordLine(pos, limit);
        if (line == null || line.optionalStart() >= 0 || !line.key(source).equalsIgnoreCase("CALL")) {
            return null;
        }
        final var call = keyword(line, SyntaxKind.BABEL_CALL, limit, true);
        if (affiliated.isEmpty()) {
            return call;
        }
        final var children = new ArrayList<GreenElement>(affiliated);
        children.addAll(call.children());
        return GreenNode.of(SyntaxKind.BABEL_CALL, children);
    }

    // Drawers.

    private @Nullable GreenNode drawer(final int pos, final int limit, final List<GreenNode> affiliated) {
        final var contentEnd = source.lineContentEnd(pos, limit);
        final var colon = source.skipSpaces(pos, contentEnd);
        if (colon >= contentEnd || source.charAt(colon) != ':') {
            return null;
        }
        int nameEnd = colon + 1;
        while (nameEnd < contentEnd && isDrawerNameChar(source.charAt(nameEnd))) {
            nameEnd += 1;
        }
        if (nameEnd == colon + 1 || nameEnd >= contentEnd || source.charAt(nameEnd) != ':') {
            return null;
        }
        if (source.skipSpaces(nameEnd + 1, contentEnd) != contentEnd) {
            return null;
        }
        if (source.slice(colon + 1, nameEnd).equalsIgnoreCase("END")) {
            return null;
        }
        final var contentStart = source.lineEnd(pos, limit);
        final var endLine = findDrawerEnd(contentStart, limit);
        if (endLine < 0) {
            return null;
        }
        final var builder = open(SyntaxKind.DRAWER, affiliated);
        drawerDelimiter(builder, SyntaxKind.DRAWER_BEGIN, pos, limit);
        builder.startNode(SyntaxKind.DRAWER_CONTENT);
        builder.pushAll(parseElements(contentStart, endLine));
        builder.finishNode();
        final var end = drawerDelimiter(builder, SyntaxKind.DRAWER_END, endLine, limit);
        return close(builder, end, limit);
    }

    /**
     * Returns the start of the first {@code :END:} line in {@code [pos, limit)}, or -1.
     */
    int findDrawerEnd(final int pos, final int limit) {
        int line = pos;
        while (line < limit) {
            if (isDrawerEnd(line, limit)) {
                return line;
            }
            line = source.lineEnd(line, limit);
        }
        return -1;
    }

    boolean isDrawerEnd(final int pos, final int limit) {
        final var contentEnd = source.lineContentEnd(pos, limit);
        final var start = source.skipSpaces(pos, contentEnd);
        return source.startsWithIgnoreCase(start, contentEnd, ":END:")
            && source.skipSpaces(start + 5, contentEnd) == contentEnd;
    }

    /**
     * Emits a {@code :NAME:} line, already known to be well-formed, as a node of the given kind and returns the
     * offset past it.
     */
    int drawerDelimiter(final GreenNodeBuilder builder, final SyntaxKind kind, final int pos, final int limit) {
        final var contentEnd = source.lineContentEnd(pos, limit);
        final var colon = source.skipSpaces(pos, contentEnd);
        final var closing = source.text().indexOf(':', colon + 1);
        builder.startNode(kind);
        source.token(builder, SyntaxKind.WHITESPACE, pos, colon);
        builder.token(SyntaxKind.COLON, ":");
        source.token(builder, SyntaxKind.TEXT, colon + 1, closing);
        builder.token(SyntaxKind.COLON, ":");
        source.token(builder, SyntaxKind.WHITESPACE, closing + 1, contentEnd);
        final var end = source.newLine(builder, contentEnd, limit);
        builder.finishNode();
        return end;
    }

    // Simple elements.

    private @Nullable GreenNode clock(final int pos, final int limit) {
        final var contentEnd = source.lineContentEnd(pos, limit);
        final var keyword = source.skipSpaces(pos, contentEnd);
        if (!source.startsWith(keyword, contentEnd, "CLOCK:")) {
            return null;
        }
        final var timestampStart = source.skipSpaces(keyword + 6, contentEnd);
        if (timestampStart == keyword + 6) {
            return null;
        }
        final var timestamp = timestamps.parse(timestampStart, contentEnd);
        if (timestamp == null || timestamp.kind() != SyntaxKind.TIMESTAMP_INACTIVE) {
            return null;
        }
        final var timestampEnd = timestampStart + timestamp.textLength();
        final var arrow = source.skipSpaces(timestampEnd, contentEnd);
        int durationStart = -1;
        int durationEnd = -1;
        if (source.startsWith(arrow, contentEnd, "=>")) {
            durationStart = source.skipSpaces(arrow + 2, contentEnd);
            durationEnd = durationStart;
            while (durationEnd < contentEnd && !Source.isWhitespace(source.charAt(durationEnd))) {
                durationEnd += 1;
            }
            if (durationEnd == durationStart || source.skipSpaces(durationEnd, contentEnd) != contentEnd) {
                return null;
            }
        } else if (arrow != contentEnd) {
            return null;
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.CLOCK);
        source.token(builder, SyntaxKind.WHITESPACE, pos, keyword);
        builder.token(SyntaxKind.CLOCK_KEYWORD, "CLOCK:");
        source.token(builder, SyntaxKind.WHITESPACE, keyword + 6, timestampStart);
        builder.push(timestamp);
        if (durationStart >= 0) {
            source.token(builder, SyntaxKind.WHITESPACE, timestampEnd, arrow);
            builder.token(SyntaxKind.DOUBLE_ARROW, "=>");
            source.token(builder, SyntaxKind.WHITESPACE, arrow + 2, durationStart);
            source.token(builder, SyntaxKind.TEXT, durationStart, durationEnd);
            source.token(builder, SyntaxKind.WHITESPACE, durationEnd, contentEnd);
        } else {
            source.token(builder, SyntaxKind.WHITESPACE, timestampEnd, contentEnd);
        }
        final var end = source.newLine(builder, contentEnd, limit);
        return close(builder, end, limit);
    }

    private @Nullable GreenNode fixedWidth(final int pos, final int limit, final List<GreenNode> affiliated) {
        final var node = prefixedLines(pos, limit, ':', SyntaxKind.FIXED_WIDTH, SyntaxKind.COLON);
        if (node == null || affiliated.isEmpty()) {
            return node;
        }
        final var children = new ArrayList<GreenElement>(affiliated);
        children.addAll(node.children());
        return GreenNode.of(SyntaxKind.FIXED_WIDTH, children);
    }

    // Consecutive lines starting with the prefix character followed by whitespace or the end of the line.
    private @Nullable GreenNode prefixedLines(
        final int pos,
        final int limit,
        final char prefix,
        final SyntaxKind kind,
        final SyntaxKind prefixKind
    ) {
        if (!isPrefixedLine(pos, limit, prefix)) {
            return null;
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode(kind);
        int line = pos;
        while (line < limit && isPrefixedLine(line, limit, prefix)) {
            final var contentEnd = source.lineContentEnd(line, limit);
            final var prefixStart = source.skipSpaces(line, contentEnd);
            source.token(builder, SyntaxKind.WHITESPACE, line, prefixStart);
            builder.token(prefixKind, String.valueOf(prefix));
            source.token(builder, SyntaxKind.TEXT, prefixStart + 1, contentEnd);
            line = source.newLine(builder, contentEnd, limit);
        }
        return close(builder, line, limit);
    }

    private boolean isPrefixedLine(final int pos, final int limit, final char prefix) {
        final var contentEnd = source.lineContentEnd(pos, limit);
        final var start = source.skipSpaces(pos, contentEnd);
        return start < contentEnd
            && source.charAt(start) == prefix
            && (start + 1 == contentEnd || Source.isSpace(source.charAt(start + 1)));
    }

    private @Nullable GreenNode rule(final int pos, final int limit, final List<GreenNode> affiliated) {
        final var contentEnd = source.lineContentEnd(pos, limit);
        final var dashesStart = source.skipSpaces(pos, contentEnd);
        int dashesEnd = dashesStart;
        while (dashesEnd < contentEnd && source.charAt(dashesEnd) == '-') {
            dashesEnd += 1;
        }
        if (dashesEnd - dashesStart < 5 || source.skipSpaces(dashesEnd, contentEnd) != contentEnd) {
            return null;
        }
        final var builder = open(SyntaxKind.RULE, affiliated);
        source.token(builder, SyntaxKind.WHITESPACE, pos, dashesStart);
        source.token(builder, SyntaxKind.DASHES, dashesStart, dashesEnd);
        source.token(builder, SyntaxKind.WHITESPACE, dashesEnd, contentEnd);
        final var end = source.newLine(builder, contentEnd, limit);
        return close(builder, end, limit);
    }

    private @Nullable GreenNode footnoteDefinition(final int pos, final int limit, final List<GreenNode> affiliated) {
        if (!source.atLineStart(pos) || !source.startsWith(pos, limit, "[fn:")) {
            return null;
        }
        final var contentEnd = source.lineContentEnd(pos, limit);
        final var labelStart = pos + 4;
        int labelEnd = labelStart;
        while (labelEnd < contentEnd && isDrawerNameChar(source.charAt(labelEnd))) {
            labelEnd += 1;
        }
        if (labelEnd == labelStart || labelEnd >= contentEnd || source.charAt(labelEnd) != ']') {
            return null;
        }
        final var builder = open(SyntaxKind.FN_DEF, affiliated);
        builder.token(SyntaxKind.L_BRACKET, "[");
        builder.token(SyntaxKind.TEXT, "fn");
        builder.token(SyntaxKind.COLON, ":");
        source.token(builder, SyntaxKind.TEXT, labelStart, labelEnd);
        builder.token(SyntaxKind.R_BRACKET, "]");
        final var definitionStart = source.skipSpaces(labelEnd + 1, contentEnd);
        source.token(builder, SyntaxKind.WHITESPACE, labelEnd + 1, definitionStart);
        builder.pushAll(inline.parse(definitionStart, contentEnd));
        final var end = source.newLine(builder, contentEnd, limit);
        return close(builder, end, limit);
    }

    // Shared helpers.

    GreenNodeBuilder open(final SyntaxKind kind, final List<GreenNode> affiliated) {
        final var builder = new GreenNodeBuilder();
        builder.startNode(kind);
        builder.pushAll(affiliated);
        return builder;
    }

    GreenNode close(final GreenNodeBuilder builder, final int pos, final int limit) {
        source.postBlank(builder, pos, limit);
        return builder.finishNode().finish();
    }

    private static boolean isDrawerNameChar(final char c) {
        return Source.isAsciiAlphanumeric(c) || c == '_' || c == '-';
    }

    private final Source source;
    private final InlineParser inline;
    private final TimestampParser timestamps;
    private final BlockParser blocks;
    private final ListParser lists;
    private final TableParser tables;
}
