// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.parser;

import java.util.ArrayList;
import java.util.List;
import verdant.config.UseSubSuperscript;
import verdant.syntax.Entities;
import verdant.syntax.GreenElement;
import verdant.syntax.GreenNode;
import verdant.syntax.GreenNodeBuilder;
import verdant.syntax.GreenToken;
import verdant.syntax.SyntaxKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parser of inline objects: emphasis, links, footnote references, macros, timestamps, statistics cookies, targets,
 * export snippets, inline babel calls, inline source blocks, line breaks, entities, subscripts and superscripts, and
 * cloze deletions when enabled.
 * <p>
 * Text between objects becomes {@code TEXT} tokens. Markup that doesn't form a complete object stays literal text.
 */
final class InlineParser {
    InlineParser(final Source source) {
        this.source = source;
        timestamps = new TimestampParser(source);
    }

    /**
     * Parses the objects of {@code [start, end)}.
     */
    List<GreenElement> parse(final int start, final int end) {
        return parse(start, end, true);
    }

    private List<GreenElement> parse(final int start, final int end, final boolean allowLinks) {
        final var result = new ArrayList<GreenElement>();
        int textStart = start;
        int i = start;
        while (i < end) {
            final var object = parseObject(i, start, end, allowLinks);
            if (object == null) {
                i += 1;
                continue;
            }
            if (textStart < i) {
                result.add(GreenToken.of(SyntaxKind.TEXT, source.slice(textStart, i)));
            }
            result.add(object);
            i += object.textLength();
            textStart = i;
        }
        if (textStart < end) {
            result.add(GreenToken.of(SyntaxKind.TEXT, source.slice(textStart, end)));
        }
        return result;
    }

    private @Nullable GreenNode parseObject(
        final int pos,
        final int regionStart,
        final int end,
        final boolean allowLinks
    ) {
        final var c = source.charAt(pos);
        switch (c) {
            case '*', '/', '+', '=', '~' -> {
                return parseEmphasis(pos, regionStart, end);
            }
            case '_' -> {
                final var underline = parseEmphasis(pos, regionStart, end);
                return (underline != null) ? underline : parseScript(pos, regionStart, end);
            }
            case '^' -> {
                return parseScript(pos, regionStart, end);
            }
            case '[' -> {
                if (source.startsWith(pos, end, "[[")) {
                    return allowLinks ? parseLink(pos, end) : null;
                }
                if (source.startsWith(pos, end, "[fn:")) {
                    return parseFootnoteReference(pos, end);
                }
                final var cookie = parseCookie(pos, end);
                return (cookie != null) ? cookie : timestamps.parse(pos, end);
            }
            case '<' -> {
                if (source.startsWith(pos, end, "<<")) {
                    return parseTarget(pos, end);
                }
                return timestamps.parse(pos, end);
            }
            case '{' -> {
                final var macro = parseMacro(pos, end);
                return (macro != null || !source.config().cloze()) ? macro : parseCloze(pos, end);
            }
            case '@' -> {
                return parseSnippet(pos, end);
            }
            case 'c' -> {
                return parseInlineCall(pos, regionStart, end);
            }
            case 's' -> {
                return parseInlineSource(pos, regionStart, end);
            }
            case '\\' -> {
                final var lineBreak = parseLineBreak(pos, end);
                return (lineBreak != null) ? lineBreak : parseEntity(pos, end);
            }
            default -> {
                return null;
            }
        }
    }

    private @Nullable GreenNode parseEmphasis(final int pos, final int regionStart, final int end) {
        final var marker = source.charAt(pos);
        if (pos > regionStart && !isEmphasisPre(source.charAt(pos - 1))) {
            return null;
        }
        if (pos + 1 >= end || Source.isWhitespace(source.charAt(pos + 1))) {
            return null;
        }
        int newLines = 0;
        for (int j = pos + 1; j < end; j += 1) {
            final var c = source.charAt(j);
            if (c == '\n' || (c == '\r' && (j + 1 >= end || source.charAt(j + 1) != '\n'))) {
                newLines += 1;
                if (newLines > 1) {
                    return null;
                }
            }
            if (c != marker || j == pos + 1 || Source.isWhitespace(source.charAt(j - 1))) {
                continue;
            }
            if (j + 1 < end && !isEmphasisPost(source.charAt(j + 1))) {
                continue;
            }
            return buildEmphasis(marker, pos, j);
        }
        return null;
    }

    private GreenNode buildEmphasis(final char marker, final int pos, final int close) {
        final SyntaxKind kind;
        final SyntaxKind markerKind;
        switch (marker) {
            case '*' -> {
                kind = SyntaxKind.BOLD;
                markerKind = SyntaxKind.STAR;
            }
            case '/' -> {
                kind = SyntaxKind.ITALIC;
                markerKind = SyntaxKind.SLASH;
            }
            case '_' -> {
                kind = SyntaxKind.UNDERLINE;
                markerKind = SyntaxKind.UNDERSCORE;
            }
            case '+' -> {
                kind = SyntaxKind.STRIKE;
                markerKind = SyntaxKind.PLUS;
            }
            case '=' -> {
                kind = SyntaxKind.VERBATIM;
                markerKind = SyntaxKind.EQUAL;
            }
            case '~' -> {
                kind = SyntaxKind.CODE;
                markerKind = SyntaxKind.TILDE;
            }
            default -> throw new IllegalArgumentException("Not an emphasis marker: " + marker);
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode(kind);
        builder.token(markerKind, String.valueOf(marker));
        if (kind == SyntaxKind.VERBATIM || kind == SyntaxKind.CODE) {
            source.token(builder, SyntaxKind.TEXT, pos + 1, close);
        } else {
            builder.pushAll(parse(pos + 1, close, true));
        }
        builder.token(markerKind, String.valueOf(marker));
        return builder.finishNode().finish();
    }

    private @Nullable GreenNode parseScript(final int pos, final int regionStart, final int end) {
        final var mode = source.config().useSubSuperscript();
        if (mode == UseSubSuperscript.NIL || pos == regionStart || pos + 1 >= end) {
            return null;
        }
        if (Source.isWhitespace(source.charAt(pos - 1))) {
            return null;
        }
        final var marker = source.charAt(pos);
        final var kind = (marker == '_') ? SyntaxKind.SUBSCRIPT : SyntaxKind.SUPERSCRIPT;
        final var markerKind = (marker == '_') ? SyntaxKind.UNDERSCORE : SyntaxKind.CARET;
        final var builder = new GreenNodeBuilder();
        builder.startNode(kind);
        builder.token(markerKind, String.valueOf(marker));
        if (source.charAt(pos + 1) == '{') {
            final var close = findBalanced(pos + 1, end, '{', '}');
            if (close < 0) {
                return null;
            }
            builder.token(SyntaxKind.L_CURLY, "{");
            builder.pushAll(parse(pos + 2, close, true));
            builder.token(SyntaxKind.R_CURLY, "}");
            return builder.finishNode().finish();
        }
        if (mode != UseSubSuperscript.TRUE) {
            return null;
        }
        if (source.charAt(pos + 1) == '*') {
            builder.token(SyntaxKind.TEXT, "*");
            return builder.finishNode().finish();
        }
        int i = pos + 1;
        if (source.charAt(i) == '+' || source.charAt(i) == '-') {
            i += 1;
        }
        int lastAlphanumericEnd = -1;
        while (i < end) {
            final var c = source.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                lastAlphanumericEnd = i + 1;
            } else if (c != ',' && c != '.' && c != '\\') {
                break;
            }
            i += 1;
        }
        if (lastAlphanumericEnd < 0) {
            return null;
        }
        source.token(builder, SyntaxKind.TEXT, pos + 1, lastAlphanumericEnd);
        return builder.finishNode().finish();
    }

    private @Nullable GreenNode parseLink(final int pos, final int end) {
        final var lineEnd = source.lineContentEnd(pos, end);
        int pathEnd = pos + 2;
        while (pathEnd < lineEnd && source.charAt(pathEnd) != ']' && source.charAt(pathEnd) != '[') {
            pathEnd += 1;
        }
        if (pathEnd == pos + 2 || pathEnd + 1 >= end || source.charAt(pathEnd) != ']') {
            return null;
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.LINK);
        builder.token(SyntaxKind.L_BRACKET, "[");
        builder.token(SyntaxKind.L_BRACKET, "[");
        source.token(builder, SyntaxKind.LINK_PATH, pos + 2, pathEnd);
        builder.token(SyntaxKind.R_BRACKET, "]");
        final var next = source.charAt(pathEnd + 1);
        if (next == ']') {
            builder.token(SyntaxKind.R_BRACKET, "]");
            return builder.finishNode().finish();
        }
        if (next != '[') {
            return null;
        }
        final var descriptionStart = pathEnd + 2;
        final var descriptionEnd = source.indexOf("]]", descriptionStart, end);
        if (descriptionEnd <= descriptionStart || source.indexOf("[[", descriptionStart, descriptionEnd) >= 0) {
            return null;
        }
        builder.token(SyntaxKind.L_BRACKET, "[");
        builder.pushAll(parse(descriptionStart, descriptionEnd, false));
        builder.token(SyntaxKind.R_BRACKET, "]");
        builder.token(SyntaxKind.R_BRACKET, "]");
        return builder.finishNode().finish();
    }

    private @Nullable GreenNode parseFootnoteReference(final int pos, final int end) {
        final var labelStart = pos + 4;
        int labelEnd = labelStart;
        while (labelEnd < end && isLabelChar(source.charAt(labelEnd))) {
            labelEnd += 1;
        }
        if (labelEnd >= end) {
            return null;
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.FN_REF);
        builder.token(SyntaxKind.L_BRACKET, "[");
        builder.token(SyntaxKind.TEXT, "fn");
        builder.token(SyntaxKind.COLON, ":");
        source.token(builder, SyntaxKind.TEXT, labelStart, labelEnd);
        final var after = source.charAt(labelEnd);
        if (after == ']') {
            if (labelEnd == labelStart) {
                return null;
            }
            builder.token(SyntaxKind.R_BRACKET, "]");
            return builder.finishNode().finish();
        }
        if (after != ':') {
            return null;
        }
        final var close = findBalanced(pos, end, '[', ']');
        if (close < 0 || close <= labelEnd + 1) {
            return null;
        }
        builder.token(SyntaxKind.COLON, ":");
        builder.pushAll(parse(labelEnd + 1, close, true));
        builder.token(SyntaxKind.R_BRACKET, "]");
        return builder.finishNode().finish();
    }

    private @Nullable GreenNode parseCookie(final int pos, final int end) {
        int i = pos + 1;
        final var numeratorStart = i;
        while (i < end && Source.isAsciiDigit(source.charAt(i))) {
            i += 1;
        }
        final var numeratorEnd = i;
        if (i >= end) {
            return null;
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.COOKIE);
        builder.token(SyntaxKind.L_BRACKET, "[");
        source.token(builder, SyntaxKind.TEXT, numeratorStart, numeratorEnd);
        if (source.charAt(i) == '%') {
            builder.token(SyntaxKind.PERCENT, "%");
            i += 1;
        } else if (source.charAt(i) == '/') {
            builder.token(SyntaxKind.SLASH, "/");
            i += 1;
            final var denominatorStart = i;
            while (i < end && Source.isAsciiDigit(source.charAt(i))) {
                i += 1;
            }
            source.token(builder, SyntaxKind.TEXT, denominatorStart, i);
        } else {
            return null;
        }
        if (i >= end || source.charAt(i) != ']') {
            return null;
        }
        builder.token(SyntaxKind.R_BRACKET, "]");
        return builder.finishNode().finish();
    }

    private @Nullable GreenNode parseTarget(final int pos, final int end) {
        final var contentStart = pos + 2;
        final var lineEnd = source.lineContentEnd(pos, end);
        final var close = source.indexOf(">>", contentStart, lineEnd);
        if (close <= contentStart) {
            return null;
        }
        for (int i = contentStart; i < close; i += 1) {
            final var c = source.charAt(i);
            if (c == '<' || c == '>') {
                return null;
            }
        }
        if (Source.isWhitespace(source.charAt(contentStart)) || Source.isWhitespace(source.charAt(close - 1))) {
            return null;
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.TARGET);
        builder.token(SyntaxKind.L_ANGLE, "<");
        builder.token(SyntaxKind.L_ANGLE, "<");
        source.token(builder, SyntaxKind.TEXT, contentStart, close);
        builder.token(SyntaxKind.R_ANGLE, ">");
        builder.token(SyntaxKind.R_ANGLE, ">");
        return builder.finishNode().finish();
    }

    private @Nullable GreenNode parseMacro(final int pos, final int end) {
        if (!source.startsWith(pos, end, "{{{")) {
            return null;
        }
        final var nameStart = pos + 3;
        if (nameStart >= end || !Character.isLetter(source.charAt(nameStart))) {
            return null;
        }
        int nameEnd = nameStart + 1;
        while (nameEnd < end && isLabelChar(source.charAt(nameEnd))) {
            nameEnd += 1;
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.MACROS);
        builder.token(SyntaxKind.L_CURLY, "{");
        builder.token(SyntaxKind.L_CURLY, "{");
        builder.token(SyntaxKind.L_CURLY, "{");
        source.token(builder, SyntaxKind.TEXT, nameStart, nameEnd);
        int i = nameEnd;
        if (i < end && source.charAt(i) == '(') {
            final var close = source.indexOf(")}}}", i + 1, end);
            if (close < 0) {
                return null;
            }
            builder.token(SyntaxKind.L_PARENS, "(");
            source.token(builder, SyntaxKind.TEXT, i + 1, close);
            builder.token(SyntaxKind.R_PARENS, ")");
            i = close + 1;
        }
        if (!source.startsWith(i, end, "}}}")) {
            return null;
        }
        builder.token(SyntaxKind.R_CURLY, "}");
        builder.token(SyntaxKind.R_CURLY, "}");
        builder.token(SyntaxKind.R_CURLY, "}");
        return builder.finishNode().finish();
    }

    private @Nullable GreenNode parseSnippet(final int pos, final int end) {
        if (!source.startsWith(pos, end, "@@")) {
            return null;
        }
        final var backendStart = pos + 2;
        int backendEnd = backendStart;
        while (backendEnd < end && isLabelChar(source.charAt(backendEnd))) {
            backendEnd += 1;
        }
        if (backendEnd == backendStart || backendEnd >= end || source.charAt(backendEnd) != ':') {
            return null;
        }
        final var close = source.indexOf("@@", backendEnd + 1, end);
        if (close < 0) {
            return null;
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.SNIPPET);
        builder.token(SyntaxKind.AT2, "@@");
        source.token(builder, SyntaxKind.TEXT, backendStart, backendEnd);
        builder.token(SyntaxKind.COLON, ":");
        source.token(builder, SyntaxKind.TEXT, backendEnd + 1, close);
        builder.token(SyntaxKind.AT2, "@@");
        return builder.finishNode().finish();
    }

    private @Nullable GreenNode parseInlineCall(final int pos, final int regionStart, final int end) {
        if (!source.startsWith(pos, end, "call_") || !atWordStart(pos, regionStart)) {
            return null;
        }
        final var lineEnd = source.lineContentEnd(pos, end);
        final var nameStart = pos + 5;
        int i = nameStart;
        while (i < lineEnd && !Source.isWhitespace(source.charAt(i)) && "[]()".indexOf(source.charAt(i)) < 0) {
            i += 1;
        }
        if (i == nameStart || i >= lineEnd) {
            return null;
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.INLINE_CALL);
        builder.token(SyntaxKind.TEXT, "call");
        builder.token(SyntaxKind.UNDERSCORE, "_");
        source.token(builder, SyntaxKind.TEXT, nameStart, i);
        i = bracketed(builder, i, lineEnd, '[', ']', SyntaxKind.L_BRACKET, SyntaxKind.R_BRACKET);
        if (i < 0 || i >= lineEnd || source.charAt(i) != '(') {
            return null;
        }
        i = bracketed(builder, i, lineEnd, '(', ')', SyntaxKind.L_PARENS, SyntaxKind.R_PARENS);
        if (i < 0) {
            return null;
        }
        i = bracketed(builder, i, lineEnd, '[', ']', SyntaxKind.L_BRACKET, SyntaxKind.R_BRACKET);
        if (i < 0) {
            return null;
        }
        return builder.finishNode().finish();
    }

    private @Nullable GreenNode parseInlineSource(final int pos, final int regionStart, final int end) {
        if (!source.startsWith(pos, end, "src_") || !atWordStart(pos, regionStart)) {
            return null;
        }
        final var lineEnd = source.lineContentEnd(pos, end);
        final var languageStart = pos + 4;
        int i = languageStart;
        while (i < lineEnd && !Source.isWhitespace(source.charAt(i)) && "[{".indexOf(source.charAt(i)) < 0) {
            i += 1;
        }
        if (i == languageStart || i >= lineEnd) {
            return null;
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.INLINE_SRC);
        builder.token(SyntaxKind.TEXT, "src");
        builder.token(SyntaxKind.UNDERSCORE, "_");
        source.token(builder, SyntaxKind.TEXT, languageStart, i);
        i = bracketed(builder, i, lineEnd, '[', ']', SyntaxKind.L_BRACKET, SyntaxKind.R_BRACKET);
        if (i < 0 || i >= lineEnd || source.charAt(i) != '{') {
            return null;
        }
        i = bracketed(builder, i, lineEnd, '{', '}', SyntaxKind.L_CURLY, SyntaxKind.R_CURLY);
        if (i < 0) {
            return null;
        }
        return builder.finishNode().finish();
    }

    private @Nullable GreenNode parseLineBreak(final int pos, final int end) {
        if (!source.startsWith(pos, end, "\\\\")) {
            return null;
        }
        final var lineEnd = source.lineContentEnd(pos, end);
        final var spacesEnd = source.skipSpaces(pos + 2, lineEnd);
        if (spacesEnd != lineEnd) {
            return null;
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.LINE_BREAK);
        builder.token(SyntaxKind.BACKSLASH2, "\\\\");
        source.token(builder, SyntaxKind.WHITESPACE, pos + 2, spacesEnd);
        return builder.finishNode().finish();
    }

    // An entity name must be followed by "{}" or by something other than a letter.
    private @Nullable GreenNode parseEntity(final int pos, final int end) {
        final var nameStart = pos + 1;
        int nameEnd = nameStart;
        while (nameEnd < end && Source.isAsciiLetter(source.charAt(nameEnd))) {
            nameEnd += 1;
        }
        int digitsEnd = nameEnd;
        while (digitsEnd < end && Source.isAsciiDigit(source.charAt(digitsEnd))) {
            digitsEnd += 1;
        }
        if (digitsEnd > nameEnd && Entities.lookup(source.slice(nameStart, digitsEnd)) != null) {
            nameEnd = digitsEnd;
        }
        if (nameEnd == nameStart || Entities.lookup(source.slice(nameStart, nameEnd)) == null) {
            return null;
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.ENTITY);
        builder.token(SyntaxKind.BACKSLASH, "\\");
        source.token(builder, SyntaxKind.ENTITY_NAME, nameStart, nameEnd);
        if (source.startsWith(nameEnd, end, "{}")) {
            builder.token(SyntaxKind.L_CURLY, "{");
            builder.token(SyntaxKind.R_CURLY, "}");
        } else if (nameEnd < end && Character.isLetter(source.charAt(nameEnd))) {
            return null;
        }
        return builder.finishNode().finish();
    }

    // The text ends at the first closing brace outside of a $...$ fragment.
    private @Nullable GreenNode parseCloze(final int pos, final int end) {
        if (!source.startsWith(pos, end, "{{")) {
            return null;
        }
        final var textStart = pos + 2;
        int textEnd = -1;
        boolean insideLatex = false;
        for (int i = textStart; i < end; i += 1) {
            final var c = source.charAt(i);
            if (c == '}' && !insideLatex) {
                textEnd = i;
                break;
            } else if (c == '$') {
                insideLatex = !insideLatex;
            }
        }
        if (textEnd <= textStart) {
            return null;
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.CLOZE);
        builder.token(SyntaxKind.L_CURLY, "{");
        builder.token(SyntaxKind.L_CURLY, "{");
        builder.pushAll(parse(textStart, textEnd, true));
        builder.token(SyntaxKind.R_CURLY, "}");
        int i = textEnd + 1;
        if (i < end && source.charAt(i) == '{') {
            final var close = source.indexOf("}", i + 1, end);
            if (close < 0) {
                return null;
            }
            builder.token(SyntaxKind.L_CURLY, "{");
            source.token(builder, SyntaxKind.TEXT, i + 1, close);
            builder.token(SyntaxKind.R_CURLY, "}");
            i = close + 1;
        }
        if (i < end && source.charAt(i) == '@') {
            final var close = source.indexOf("}", i + 1, end);
            if (close < 0) {
                return null;
            }
            builder.token(SyntaxKind.AT, "@");
            source.token(builder, SyntaxKind.TEXT, i + 1, close);
            i = close;
        }
        if (i >= end || source.charAt(i) != '}') {
            return null;
        }
        builder.token(SyntaxKind.R_CURLY, "}");
        return builder.finishNode().finish();
    }

    // Emits an optional bracketed part starting at pos, returning the offset past it, pos if there's no opening
    // bracket, or -1 if the bracket isn't closed before limit.
    private int bracketed(
        final GreenNodeBuilder builder,
        final int pos,
        final int limit,
        final char open,
        final char close,
        final SyntaxKind openKind,
        final SyntaxKind closeKind
    ) {
        if (pos >= limit || source.charAt(pos) != open) {
            return pos;
        }
        final var closeIndex = source.text().indexOf(close, pos + 1);
        if (closeIndex < 0 || closeIndex >= limit) {
            return -1;
        }
        builder.token(openKind, String.valueOf(open));
        source.token(builder, SyntaxKind.TEXT, pos + 1, closeIndex);
        builder.token(closeKind, String.valueOf(close));
        return closeIndex + 1;
    }

    // Returns the offset of the bracket closing the one at pos, or -1.
    private int findBalanced(final int pos, final int end, final char open, final char close) {
        int depth = 0;
        for (int i = pos; i < end; i += 1) {
            final var c = source.charAt(i);
            if (c == open) {
                depth += 1;
            } else if (c == close) {
                depth -= 1;
                if (depth == 0) {
                    return i;
                }
            } else if (c == '\n' || c == '\r') {
                return -1;
            }
        }
        return -1;
    }

    private boolean atWordStart(final int pos, final int regionStart) {
        return pos == regionStart || !Source.isAsciiAlphanumeric(source.charAt(pos - 1));
    }

    private static boolean isEmphasisPre(final char c) {
        return Source.isWhitespace(c) || "-('\"{".indexOf(c) >= 0;
    }

    private static boolean isEmphasisPost(final char c) {
        return Source.isWhitespace(c) || "-.,;:!?')}[\"\\".indexOf(c) >= 0;
    }

    private static boolean isLabelChar(final char c) {
        return Source.isAsciiAlphanumeric(c) || c == '_' || c == '-';
    }

    private final Source source;
    private final TimestampParser timestamps;
}
