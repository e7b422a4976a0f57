// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.parser;

import java.util.List;
import java.util.Locale;
import verdant.syntax.GreenNode;
import verdant.syntax.GreenNodeBuilder;
import verdant.syntax.SyntaxKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parser of {@code #+BEGIN_NAME} … {@code #+END_NAME} blocks and {@code #+BEGIN:} … {@code #+END:} dynamic blocks.
 * <p>
 * The contents of source, export, example and comment blocks are raw text, in which a comma escaping a leading
 * {@code *} or {@code #+} is a separate {@code COMMA} token. Verse blocks contain objects; every other block contains
 * elements. A block without its closing line isn't a block.
 */
final class BlockParser {
    BlockParser(final Source source, final ElementParser elements) {
        this.source = source;
        this.elements = elements;
    }

    @Nullable GreenNode parseBlock(final int pos, final int limit, final List<GreenNode> affiliated) {
        final var contentEnd = source.lineContentEnd(pos, limit);
        final var hashPlus = source.skipSpaces(pos, contentEnd);
        if (!source.startsWithIgnoreCase(hashPlus, contentEnd, "#+BEGIN_")) {
            return null;
        }
        final var nameStart = hashPlus + 8;
        int nameEnd = nameStart;
        while (nameEnd < contentEnd && !Source.isWhitespace(source.charAt(nameEnd))) {
            nameEnd += 1;
        }
        if (nameEnd == nameStart) {
            return null;
        }
        final var name = source.slice(nameStart, nameEnd);
        final var bodyStart = source.lineEnd(pos, limit);
        final var endLine = findEnd(bodyStart, limit, "#+END_" + name);
        if (endLine < 0) {
            return null;
        }
        final var kind = blockKind(name);
        final var builder = elements.open(kind, affiliated);

        builder.startNode(SyntaxKind.BLOCK_BEGIN);
        source.token(builder, SyntaxKind.WHITESPACE, pos, hashPlus);
        builder.token(SyntaxKind.HASH_PLUS, "#+");
        source.token(builder, SyntaxKind.KEYWORD_KEY, hashPlus + 2, nameEnd);
        final var trimmed = source.trimEnd(nameEnd, contentEnd);
        final var parametersStart = source.skipSpaces(nameEnd, trimmed);
        source.token(builder, SyntaxKind.WHITESPACE, nameEnd, parametersStart);
        switch (kind) {
            case SOURCE_BLOCK -> sourceParameters(builder, parametersStart, trimmed);
            case EXPORT_BLOCK -> exportParameters(builder, parametersStart, trimmed);
            default -> source.token(builder, SyntaxKind.TEXT, parametersStart, trimmed);
        }
        source.token(builder, SyntaxKind.WHITESPACE, trimmed, contentEnd);
        source.newLine(builder, contentEnd, limit);
        builder.finishNode();

        builder.startNode(SyntaxKind.BLOCK_CONTENT);
        switch (kind) {
            case SOURCE_BLOCK, EXPORT_BLOCK, EXAMPLE_BLOCK, COMMENT_BLOCK -> rawContent(builder, bodyStart, endLine);
            case VERSE_BLOCK -> builder.pushAll(elements.inline().parse(bodyStart, endLine));
            default -> builder.pushAll(elements.parseElements(bodyStart, endLine));
        }
        builder.finishNode();

        final var end = endDelimiter(builder, endLine, limit, name.length() + 4);
        return elements.close(builder, end, limit);
    }

    @Nullable GreenNode parseDynamicBlock(final int pos, final int limit, final List<GreenNode> affiliated) {
        final var contentEnd = source.lineContentEnd(pos, limit);
        final var hashPlus = source.skipSpaces(pos, contentEnd);
        if (!source.startsWithIgnoreCase(hashPlus, contentEnd, "#+BEGIN:")) {
            return null;
        }
        final var argumentsStart = source.skipSpaces(hashPlus + 8, contentEnd);
        final var trimmed = source.trimEnd(argumentsStart, contentEnd);
        if (argumentsStart == trimmed) {
            return null;
        }
        final var bodyStart = source.lineEnd(pos, limit);
        final var endLine = findEnd(bodyStart, limit, "#+END:");
        if (endLine < 0) {
            return null;
        }
        final var builder = elements.open(SyntaxKind.DYN_BLOCK, affiliated);

        builder.startNode(SyntaxKind.BLOCK_BEGIN);
        source.token(builder, SyntaxKind.WHITESPACE, pos, hashPlus);
        builder.token(SyntaxKind.HASH_PLUS, "#+");
        source.token(builder, SyntaxKind.KEYWORD_KEY, hashPlus + 2, hashPlus + 7);
        builder.token(SyntaxKind.COLON, ":");
        source.token(builder, SyntaxKind.WHITESPACE, hashPlus + 8, argumentsStart);
        source.token(builder, SyntaxKind.TEXT, argumentsStart, trimmed);
        source.token(builder, SyntaxKind.WHITESPACE, trimmed, contentEnd);
        source.newLine(builder, contentEnd, limit);
        builder.finishNode();

        builder.startNode(SyntaxKind.BLOCK_CONTENT);
        builder.pushAll(elements.parseElements(bodyStart, endLine));
        builder.finishNode();

        final var endContentEnd = source.lineContentEnd(endLine, limit);
        final var endHashPlus = source.skipSpaces(endLine, endContentEnd);
        builder.startNode(SyntaxKind.BLOCK_END);
        source.token(builder, SyntaxKind.WHITESPACE, endLine, endHashPlus);
        builder.token(SyntaxKind.HASH_PLUS, "#+");
        source.token(builder, SyntaxKind.KEYWORD_KEY, endHashPlus + 2, endHashPlus + 5);
        builder.token(SyntaxKind.COLON, ":");
        source.token(builder, SyntaxKind.WHITESPACE, endHashPlus + 6, endContentEnd);
        final var end = source.newLine(builder, endContentEnd, limit);
        builder.finishNode();
        return elements.close(builder, end, limit);
    }

    private static SyntaxKind blockKind(final String name) {
        return switch (name.toUpperCase(Locale.ROOT)) {
            case "SRC" -> SyntaxKind.SOURCE_BLOCK;
            case "EXPORT" -> SyntaxKind.EXPORT_BLOCK;
            case "EXAMPLE" -> SyntaxKind.EXAMPLE_BLOCK;
            case "COMMENT" -> SyntaxKind.COMMENT_BLOCK;
            case "QUOTE" -> SyntaxKind.QUOTE_BLOCK;
            case "CENTER" -> SyntaxKind.CENTER_BLOCK;
            case "VERSE" -> SyntaxKind.VERSE_BLOCK;
            default -> SyntaxKind.SPECIAL_BLOCK;
        };
    }

    // Returns the start of the first line in [pos, limit) consisting of the delimiter, case-insensitively, surrounded
    // by optional spaces, or -1.
    private int findEnd(final int pos, final int limit, final String delimiter) {
        int line = pos;
        while (line < limit) {
            final var contentEnd = source.lineContentEnd(line, limit);
            final var start = source.skipSpaces(line, contentEnd);
            if (source.startsWithIgnoreCase(start, contentEnd, delimiter)
                && source.skipSpaces(start + delimiter.length(), contentEnd) == contentEnd) {
                return line;
            }
            line = source.lineEnd(line, limit);
        }
        return -1;
    }

    private int endDelimiter(final GreenNodeBuilder builder, final int pos, final int limit, final int keyLength) {
        final var contentEnd = source.lineContentEnd(pos, limit);
        final var hashPlus = source.skipSpaces(pos, contentEnd);
        final var keyEnd = hashPlus + 2 + keyLength;
        builder.startNode(SyntaxKind.BLOCK_END);
        source.token(builder, SyntaxKind.WHITESPACE, pos, hashPlus);
        builder.token(SyntaxKind.HASH_PLUS, "#+");
        source.token(builder, SyntaxKind.KEYWORD_KEY, hashPlus + 2, keyEnd);
        source.token(builder, SyntaxKind.WHITESPACE, keyEnd, contentEnd);
        final var end = source.newLine(builder, contentEnd, limit);
        builder.finishNode();
        return end;
    }

    // Language, switches and header arguments. Header arguments start at the first colon preceded by a space.
    private void sourceParameters(final GreenNodeBuilder builder, final int start, final int end) {
        int languageEnd = start;
        while (languageEnd < end && !Source.isWhitespace(source.charAt(languageEnd))) {
            languageEnd += 1;
        }
        source.token(builder, SyntaxKind.SRC_BLOCK_LANGUAGE, start, languageEnd);
        final var switchesStart = source.skipSpaces(languageEnd, end);
        source.token(builder, SyntaxKind.WHITESPACE, languageEnd, switchesStart);
        int parametersStart = end;
        for (int i = switchesStart; i < end; i += 1) {
            if (source.charAt(i) == ':' && (i == switchesStart || Source.isSpace(source.charAt(i - 1)))) {
                parametersStart = i;
                break;
            }
        }
        final var switchesEnd = source.trimEnd(switchesStart, parametersStart);
        source.token(builder, SyntaxKind.SRC_BLOCK_SWITCHES, switchesStart, switchesEnd);
        source.token(builder, SyntaxKind.WHITESPACE, switchesEnd, parametersStart);
        source.token(builder, SyntaxKind.SRC_BLOCK_PARAMETERS, parametersStart, end);
    }

    private void exportParameters(final GreenNodeBuilder builder, final int start, final int end) {
        int typeEnd = start;
        while (typeEnd < end && !Source.isWhitespace(source.charAt(typeEnd))) {
            typeEnd += 1;
        }
        source.token(builder, SyntaxKind.EXPORT_BLOCK_TYPE, start, typeEnd);
        final var restStart = source.skipSpaces(typeEnd, end);
        source.token(builder, SyntaxKind.WHITESPACE, typeEnd, restStart);
        source.token(builder, SyntaxKind.TEXT, restStart, end);
    }

    private void rawContent(final GreenNodeBuilder builder, final int start, final int end) {
        int textStart = start;
        int line = start;
        while (line < end) {
            final var contentEnd = source.lineContentEnd(line, end);
            final var comma = source.skipSpaces(line, contentEnd);
            if (source.startsWith(comma, contentEnd, ",*") || source.startsWith(comma, contentEnd, ",#+")) {
                source.token(builder, SyntaxKind.TEXT, textStart, comma);
                builder.token(SyntaxKind.COMMA, ",");
                textStart = comma + 1;
            }
            line = source.lineEnd(line, end);
        }
        source.token(builder, SyntaxKind.TEXT, textStart, end);
    }

    private final Source source;
    private final ElementParser elements;
}
