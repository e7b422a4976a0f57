// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.parser;

import java.util.List;
import verdant.syntax.GreenNode;
import verdant.syntax.GreenNodeBuilder;
import verdant.syntax.SyntaxKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parser of Org tables: consecutive lines starting with {@code |}, followed by any number of {@code #+TBLFM:} lines.
 */
final class TableParser {
    TableParser(final Source source, final ElementParser elements) {
        this.source = source;
        this.elements = elements;
    }

    @Nullable GreenNode parse(final int pos, final int limit, final List<GreenNode> affiliated) {
        if (!isTableLine(pos, limit)) {
            return null;
        }
        final var builder = elements.open(SyntaxKind.ORG_TABLE, affiliated);
        int line = pos;
        while (line < limit && isTableLine(line, limit)) {
            final var contentEnd = source.lineContentEnd(line, limit);
            final var pipe = source.skipSpaces(line, contentEnd);
            if (pipe + 1 < contentEnd && source.charAt(pipe + 1) == '-') {
                builder.startNode(SyntaxKind.ORG_TABLE_RULE_ROW);
                source.token(builder, SyntaxKind.WHITESPACE, line, pipe);
                builder.token(SyntaxKind.PIPE, "|");
                source.token(builder, SyntaxKind.TEXT, pipe + 1, contentEnd);
            } else {
                builder.startNode(SyntaxKind.ORG_TABLE_STANDARD_ROW);
                source.token(builder, SyntaxKind.WHITESPACE, line, pipe);
                builder.token(SyntaxKind.PIPE, "|");
                cells(builder, pipe + 1, contentEnd);
            }
            line = source.newLine(builder, contentEnd, limit);
            builder.finishNode();
        }
        while (line < limit) {
            final var formula = elements.matchKeywordLine(line, limit);
            if (formula == null || !formula.key(source).equalsIgnoreCase("TBLFM") || formula.optionalStart() >= 0) {
                break;
            }
            final var keyword = elements.keyword(formula, SyntaxKind.KEYWORD, limit, false);
            builder.push(keyword);
            line += keyword.textLength();
        }
        return elements.close(builder, line, limit);
    }

    private boolean isTableLine(final int pos, final int limit) {
        final var contentEnd = source.lineContentEnd(pos, limit);
        final var start = source.skipSpaces(pos, contentEnd);
        return start < contentEnd && source.charAt(start) == '|';
    }

    // Cells of [pos, end), pos being just past the leading pipe. Text after the last pipe is a cell of its own,
    // unless it's all whitespace.
    private void cells(final GreenNodeBuilder builder, final int pos, final int end) {
        int cellStart = pos;
        while (true) {
            final var pipe = source.indexOf("|", cellStart, end);
            if (pipe < 0) {
                break;
            }
            cell(builder, cellStart, pipe);
            builder.token(SyntaxKind.PIPE, "|");
            cellStart = pipe + 1;
        }
        if (source.skipSpaces(cellStart, end) == end) {
            source.token(builder, SyntaxKind.WHITESPACE, cellStart, end);
        } else {
            cell(builder, cellStart, end);
        }
    }

    private void cell(final GreenNodeBuilder builder, final int start, final int end) {
        final var contentStart = source.skipSpaces(start, end);
        final var contentEnd = source.trimEnd(contentStart, end);
        builder.startNode(SyntaxKind.ORG_TABLE_CELL);
        source.token(builder, SyntaxKind.WHITESPACE, start, contentStart);
        builder.pushAll(elements.inline().parse(contentStart, contentEnd));
        source.token(builder, SyntaxKind.WHITESPACE, contentEnd, end);
        builder.finishNode();
    }

    private final Source source;
    private final ElementParser elements;
}
