// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.parser;

import java.util.List;
import verdant.syntax.GreenNode;
import verdant.syntax.GreenNodeBuilder;
import verdant.syntax.SyntaxKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parser of plain lists.
 * <p>
 * An item spans its bullet line plus every following line indented deeper than the bullet; blank lines in between
 * belong to the item as long as a deeper line follows them. Items of one list share the bullet's column. Two
 * consecutive blank lines end the list.
 */
final class ListParser {
    ListParser(final Source source, final ElementParser elements) {
        this.source = source;
        this.elements = elements;
    }

    @Nullable GreenNode parse(final int pos, final int limit, final List<GreenNode> affiliated) {
        var item = matchBullet(pos, limit);
        if (item == null) {
            return null;
        }
        final var builder = elements.open(SyntaxKind.LIST, affiliated);
        while (true) {
            final var itemEnd = itemEnd(item, limit);
            int blanksEnd = itemEnd;
            int blankLines = 0;
            while (source.isBlankLine(blanksEnd, limit)) {
                blanksEnd = source.lineEnd(blanksEnd, limit);
                blankLines += 1;
            }
            final var next = (blankLines < 2 && blanksEnd < limit) ? matchBullet(blanksEnd, limit) : null;
            if (next == null || next.column() != item.column()) {
                item(builder, item, itemEnd, itemEnd);
                return elements.close(builder, itemEnd, limit);
            }
            item(builder, item, itemEnd, blanksEnd);
            item = next;
        }
    }

    private @Nullable Bullet matchBullet(final int pos, final int limit) {
        final var contentEnd = source.lineContentEnd(pos, limit);
        final var bulletStart = source.skipSpaces(pos, contentEnd);
        if (bulletStart >= contentEnd) {
            return null;
        }
        final var column = bulletStart - source.lineStart(bulletStart);
        final var c = source.charAt(bulletStart);
        int bulletEnd;
        boolean ordered = false;
        if (c == '-' || c == '+' || (c == '*' && column > 0)) {
            bulletEnd = bulletStart + 1;
        } else {
            bulletEnd = bulletStart;
            while (bulletEnd < contentEnd && Source.isAsciiDigit(source.charAt(bulletEnd))) {
                bulletEnd += 1;
            }
            if (bulletEnd == bulletStart && Source.isAsciiAlphanumeric(c)) {
                bulletEnd += 1;
            }
            if (bulletEnd == bulletStart || bulletEnd >= contentEnd) {
                return null;
            }
            final var terminator = source.charAt(bulletEnd);
            if (terminator != '.' && terminator != ')') {
                return null;
            }
            bulletEnd += 1;
            ordered = true;
        }
        if (bulletEnd < contentEnd && !Source.isSpace(source.charAt(bulletEnd))) {
            return null;
        }
        return new Bullet(pos, bulletStart, bulletEnd, column, ordered);
    }

    // Returns the end of the last non-blank line belonging to the item.
    private int itemEnd(final Bullet item, final int limit) {
        int end = source.lineEnd(item.bulletStart(), limit);
        int line = end;
        int blankLines = 0;
        while (line < limit) {
            final var lineEnd = source.lineEnd(line, limit);
            if (source.isBlankLine(line, limit)) {
                blankLines += 1;
                if (blankLines >= 2) {
                    break;
                }
            } else if (source.skipSpaces(line, lineEnd) - line > item.column()) {
                blankLines = 0;
                end = lineEnd;
            } else {
                break;
            }
            line = lineEnd;
        }
        return end;
    }

    private void item(final GreenNodeBuilder builder, final Bullet item, final int contentLimit, final int end) {
        builder.startNode(SyntaxKind.LIST_ITEM);
        source.token(builder, SyntaxKind.WHITESPACE, item.start(), item.bulletStart());
        source.token(builder, SyntaxKind.LIST_ITEM_BULLET, item.bulletStart(), item.bulletEnd());
        final var lineEnd = source.lineContentEnd(item.bulletEnd(), contentLimit);
        int i = whitespace(builder, item.bulletEnd(), lineEnd);

        final var counterEnd = counterEnd(i, lineEnd);
        if (counterEnd >= 0) {
            builder.startNode(SyntaxKind.LIST_ITEM_COUNTER);
            builder.token(SyntaxKind.L_BRACKET, "[");
            source.token(builder, SyntaxKind.TEXT, i + 1, counterEnd - 1);
            builder.token(SyntaxKind.R_BRACKET, "]");
            builder.finishNode();
            i = whitespace(builder, counterEnd, lineEnd);
        }

        if (isCheckBox(i, lineEnd)) {
            builder.startNode(SyntaxKind.LIST_ITEM_CHECK_BOX);
            builder.token(SyntaxKind.L_BRACKET, "[");
            source.token(builder, SyntaxKind.TEXT, i + 1, i + 2);
            builder.token(SyntaxKind.R_BRACKET, "]");
            builder.finishNode();
            i = whitespace(builder, i + 3, lineEnd);
        }

        final var separator = item.ordered() ? -1 : tagSeparator(i, lineEnd);
        if (separator >= 0) {
            final var tagEnd = source.trimEnd(i, separator);
            builder.startNode(SyntaxKind.LIST_ITEM_TAG);
            builder.pushAll(elements.inline().parse(i, tagEnd));
            builder.finishNode();
            source.token(builder, SyntaxKind.WHITESPACE, tagEnd, separator);
            builder.token(SyntaxKind.COLON2, "::");
            i = whitespace(builder, separator + 2, lineEnd);
        }

        final var contentStart = (i == lineEnd) ? source.newLine(builder, lineEnd, contentLimit) : i;
        builder.startNode(SyntaxKind.LIST_ITEM_CONTENT);
        builder.pushAll(elements.parseElements(contentStart, contentLimit));
        builder.finishNode();
        source.postBlank(builder, contentLimit, end);
        builder.finishNode();
    }

    private int whitespace(final GreenNodeBuilder builder, final int pos, final int limit) {
        final var end = source.skipSpaces(pos, limit);
        source.token(builder, SyntaxKind.WHITESPACE, pos, end);
        return end;
    }

    // Returns the offset past a "[@N]" counter set at pos, or -1.
    private int counterEnd(final int pos, final int limit) {
        if (!source.startsWith(pos, limit, "[@")) {
            return -1;
        }
        int i = pos + 2;
        while (i < limit && Source.isAsciiDigit(source.charAt(i))) {
            i += 1;
        }
        if (i == pos + 2 && i < limit && Source.isAsciiAlphanumeric(source.charAt(i))) {
            i += 1;
        }
        if (i == pos + 2 || i >= limit || source.charAt(i) != ']') {
            return -1;
        }
        return (i + 1 == limit || Source.isSpace(source.charAt(i + 1))) ? i + 1 : -1;
    }

    private boolean isCheckBox(final int pos, final int limit) {
        return pos + 3 <= limit
            && source.charAt(pos) == '['
            && " X-".indexOf(source.charAt(pos + 1)) >= 0
            && source.charAt(pos + 2) == ']'
            && (pos + 3 == limit || Source.isSpace(source.charAt(pos + 3)));
    }

    // Returns the offset of a "::" separating a descriptive item's tag from its content, or -1.
    private int tagSeparator(final int pos, final int limit) {
        final var index = source.indexOf(" ::", pos, limit);
        for (int i = index; i >= 0; i = source.indexOf(" ::", i + 1, limit)) {
            final var separator = i + 1;
            final var after = separator + 2;
            if (after == limit || Source.isSpace(source.charAt(after))) {
                return (source.trimEnd(pos, separator) > pos) ? separator : -1;
            }
        }
        return -1;
    }

    private final Source source;
    private final ElementParser elements;

    private record Bullet(int start, int bulletStart, int bulletEnd, int column, boolean ordered) {
    }
}
