// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.parser;

import java.util.ArrayList;
import java.util.List;
import verdant.syntax.GreenNode;
import verdant.syntax.GreenNodeBuilder;
import verdant.syntax.SyntaxKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parser of timestamps: active {@code <2024-01-02 Tue 10:00-11:00 +1w -2d>}, inactive {@code [2024-01-02]}, ranges
 * {@code <…>--<…>} and diary timestamps {@code <%%(sexp)>}.
 * <p>
 * A single timestamp is a flat node of tokens; the two ends of a range are separated by a {@code MINUS2} token.
 */
final class TimestampParser {
    TimestampParser(final Source source) {
        this.source = source;
    }

    /**
     * Parses a timestamp starting at {@code pos}, or returns {@code null} if there's none.
     */
    @Nullable GreenNode parse(final int pos, final int limit) {
        if (pos >= limit) {
            return null;
        }
        final var open = source.charAt(pos);
        if (open == '<' && source.startsWith(pos, limit, "<%%(")) {
            return parseDiary(pos, limit);
        }
        if (open != '<' && open != '[') {
            return null;
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode((open == '<') ? SyntaxKind.TIMESTAMP_ACTIVE : SyntaxKind.TIMESTAMP_INACTIVE);
        final var end = parseStamp(builder, pos, limit);
        if (end < 0) {
            return null;
        }
        if (source.startsWith(end, limit, "--") && end + 2 < limit && source.charAt(end + 2) == open) {
            final var secondBuilder = new GreenNodeBuilder();
            secondBuilder.startNode(SyntaxKind.TIMESTAMP_ACTIVE);
            if (parseStamp(secondBuilder, end + 2, limit) >= 0) {
                builder.token(SyntaxKind.MINUS2, "--");
                builder.pushAll(secondBuilder.finishNode().finish().children());
            }
        }
        return builder.finishNode().finish();
    }

    private @Nullable GreenNode parseDiary(final int pos, final int limit) {
        final var lineEnd = source.lineContentEnd(pos, limit);
        final var close = source.indexOf(")>", pos + 3, lineEnd);
        if (close < 0) {
            return null;
        }
        final var builder = new GreenNodeBuilder();
        builder.startNode(SyntaxKind.TIMESTAMP_DIARY);
        builder.token(SyntaxKind.L_ANGLE, "<");
        builder.token(SyntaxKind.PERCENT2, "%%");
        source.token(builder, SyntaxKind.TEXT, pos + 3, close + 1);
        builder.token(SyntaxKind.R_ANGLE, ">");
        return builder.finishNode().finish();
    }

    // Emits the tokens of one bracketed timestamp, returning the offset past it, or -1 if there's no timestamp.
    // Nothing is emitted on failure.
    private int parseStamp(final GreenNodeBuilder builder, final int pos, final int limit) {
        final var open = source.charAt(pos);
        final var close = (open == '<') ? '>' : ']';
        final var lineEnd = source.lineContentEnd(pos, limit);
        final var closeIndex = source.text().indexOf(close, pos + 1);
        if (closeIndex < 0 || closeIndex >= lineEnd) {
            return -1;
        }
        // Validate before emitting anything.
        final var parts = new StampScanner(pos + 1, closeIndex);
        if (!parts.scan()) {
            return -1;
        }
        builder.token((open == '<') ? SyntaxKind.L_ANGLE : SyntaxKind.L_BRACKET, String.valueOf(open));
        parts.emit(builder);
        builder.token((close == '>') ? SyntaxKind.R_ANGLE : SyntaxKind.R_BRACKET, String.valueOf(close));
        return closeIndex + 1;
    }

    private final Source source;

    // Scans the inside of one timestamp, recording the token boundaries, so that emission can happen after
    // validation.
    private final class StampScanner {
        private StampScanner(final int start, final int end) {
            this.start = start;
            this.end = end;
        }

        private boolean scan() {
            int i = start;
            if (!digits(i, 4) || !at(i + 4, '-') || !digits(i + 5, 2) || !at(i + 7, '-') || !digits(i + 8, 2)) {
                return false;
            }
            i += 10;
            boolean seenDayName = false;
            boolean seenTime = false;
            boolean seenRepeater = false;
            boolean seenDelay = false;
            while (i < end) {
                final var spacesEnd = source.skipSpaces(i, end);
                if (spacesEnd == i) {
                    return false;
                }
                tokens.add(new Part(SyntaxKind.WHITESPACE, i, spacesEnd));
                i = spacesEnd;
                if (i == end) {
                    break;
                }
                final var c = source.charAt(i);
                if (Source.isAsciiDigit(c)) {
                    if (seenTime || seenRepeater || seenDelay) {
                        return false;
                    }
                    final var timeEnd = scanTime(i);
                    if (timeEnd < 0) {
                        return false;
                    }
                    i = timeEnd;
                    if (at(i, '-') && i + 1 < end && Source.isAsciiDigit(source.charAt(i + 1))) {
                        tokens.add(new Part(SyntaxKind.MINUS, i, i + 1));
                        final var secondEnd = scanTime(i + 1);
                        if (secondEnd < 0) {
                            return false;
                        }
                        i = secondEnd;
                    }
                    seenTime = true;
                } else if (c == '+' || (c == '.' && at(i + 1, '+'))) {
                    if (seenRepeater) {
                        return false;
                    }
                    final var markEnd = (c == '.' || at(i + 1, '+')) ? i + 2 : i + 1;
                    i = scanCookie(SyntaxKind.TIMESTAMP_REPEATER_MARK, i, markEnd);
                    if (i < 0) {
                        return false;
                    }
                    seenRepeater = true;
                } else if (c == '-') {
                    if (seenDelay) {
                        return false;
                    }
                    final var markEnd = at(i + 1, '-') ? i + 2 : i + 1;
                    i = scanCookie(SyntaxKind.TIMESTAMP_DELAY_MARK, i, markEnd);
                    if (i < 0) {
                        return false;
                    }
                    seenDelay = true;
                } else {
                    if (seenDayName || seenTime || seenRepeater || seenDelay) {
                        return false;
                    }
                    int j = i;
                    while (j < end && isDayNameChar(source.charAt(j))) {
                        j += 1;
                    }
                    if (j == i) {
                        return false;
                    }
                    tokens.add(new Part(SyntaxKind.TIMESTAMP_DAYNAME, i, j));
                    i = j;
                    seenDayName = true;
                }
            }
            return true;
        }

        private void emit(final GreenNodeBuilder builder) {
            source.token(builder, SyntaxKind.TIMESTAMP_YEAR, start, start + 4);
            source.token(builder, SyntaxKind.MINUS, start + 4, start + 5);
            source.token(builder, SyntaxKind.TIMESTAMP_MONTH, start + 5, start + 7);
            source.token(builder, SyntaxKind.MINUS, start + 7, start + 8);
            source.token(builder, SyntaxKind.TIMESTAMP_DAY, start + 8, start + 10);
            for (final var part : tokens) {
                source.token(builder, part.kind, part.start, part.end);
            }
        }

        private int scanTime(final int pos) {
            int i = pos;
            while (i < end && i - pos < 2 && Source.isAsciiDigit(source.charAt(i))) {
                i += 1;
            }
            if (i == pos || !at(i, ':') || !digits(i + 1, 2)) {
                return -1;
            }
            tokens.add(new Part(SyntaxKind.TIMESTAMP_HOUR, pos, i));
            tokens.add(new Part(SyntaxKind.COLON, i, i + 1));
            tokens.add(new Part(SyntaxKind.TIMESTAMP_MINUTE, i + 1, i + 3));
            return i + 3;
        }

        private int scanCookie(final SyntaxKind markKind, final int pos, final int markEnd) {
            int i = markEnd;
            while (i < end && Source.isAsciiDigit(source.charAt(i))) {
                i += 1;
            }
            if (i == markEnd || i >= end || "hdwmy".indexOf(source.charAt(i)) < 0) {
                return -1;
            }
            tokens.add(new Part(markKind, pos, markEnd));
            tokens.add(new Part(SyntaxKind.TIMESTAMP_VALUE, markEnd, i));
            tokens.add(new Part(SyntaxKind.TIMESTAMP_UNIT, i, i + 1));
            return i + 1;
        }

        private boolean digits(final int pos, final int count) {
            if (pos + count > end) {
                return false;
            }
            for (int i = pos; i < pos + count; i += 1) {
                if (!Source.isAsciiDigit(source.charAt(i))) {
                    return false;
                }
            }
            return true;
        }

        private boolean at(final int pos, final char c) {
            return pos < end && source.charAt(pos) == c;
        }

        private final int start;
        private final int end;
        private final List<Part> tokens = new ArrayList<>();
    }

    private static boolean isDayNameChar(final char c) {
        return !Source.isWhitespace(c) && !Source.isAsciiDigit(c) && c != '+' && c != '-' && c != ']' && c != '>';
    }

    private record Part(SyntaxKind kind, int start, int end) {
    }
}
