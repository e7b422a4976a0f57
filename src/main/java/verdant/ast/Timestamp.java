// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import verdant.syntax.SyntaxToken;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A timestamp: active {@code <…>}, inactive {@code […]}, a range of either, or a diary timestamp {@code <%%(…)>}.
 * <p>
 * The start fields describe the first date; the end fields describe the second date of a range, or the end of a
 * time range such as {@code <2024-01-02 Tue 10:00-12:00>}, and equal the start fields otherwise. All fields are
 * {@code null} for diary timestamps.
 */
public record Timestamp(SyntaxNode syntax) implements AstNode {
    public Timestamp {
        if (!KINDS.contains(syntax.kind())) {
            throw new IllegalArgumentException("Expected one of " + KINDS + ", got " + syntax);
        }
    }

    public static @Nullable Timestamp cast(final SyntaxNode node) {
        return (KINDS.contains(node.kind())) ? new Timestamp(node) : null;
    }

    public boolean isActive() {
        return syntax.kind() == SyntaxKind.TIMESTAMP_ACTIVE;
    }

    public boolean isInactive() {
        return syntax.kind() == SyntaxKind.TIMESTAMP_INACTIVE;
    }

    public boolean isDiary() {
        return syntax.kind() == SyntaxKind.TIMESTAMP_DIARY;
    }

    /**
     * Checks whether this is a date range, {@code <…>--<…>}, or a time range within one date.
     */
    public boolean isRange() {
        final var stamps = stamps();
        return stamps.size() > 1 || count(stamps.get(0), SyntaxKind.TIMESTAMP_HOUR) > 1;
    }

    /**
     * Returns the expression of a diary timestamp, parentheses included, or {@code null}.
     */
    public @Nullable String diarySexp() {
        return isDiary() ? Views.textToken(syntax, 0) : null;
    }

    public @Nullable Integer yearStart() {
        return number(stamps().get(0), SyntaxKind.TIMESTAMP_YEAR, 0);
    }

    public @Nullable Integer monthStart() {
        return number(stamps().get(0), SyntaxKind.TIMESTAMP_MONTH, 0);
    }

    public @Nullable Integer dayStart() {
        return number(stamps().get(0), SyntaxKind.TIMESTAMP_DAY, 0);
    }

    public @Nullable Integer hourStart() {
        return number(stamps().get(0), SyntaxKind.TIMESTAMP_HOUR, 0);
    }

    public @Nullable Integer minuteStart() {
        return number(stamps().get(0), SyntaxKind.TIMESTAMP_MINUTE, 0);
    }

    public @Nullable Integer yearEnd() {
        return number(last(), SyntaxKind.TIMESTAMP_YEAR, 0);
    }

    public @Nullable Integer monthEnd() {
        return number(last(), SyntaxKind.TIMESTAMP_MONTH, 0);
    }

    public @Nullable Integer dayEnd() {
        return number(last(), SyntaxKind.TIMESTAMP_DAY, 0);
    }

    public @Nullable Integer hourEnd() {
        return timeEnd(SyntaxKind.TIMESTAMP_HOUR);
    }

    public @Nullable Integer minuteEnd() {
        return timeEnd(SyntaxKind.TIMESTAMP_MINUTE);
    }

    /**
     * Returns the repeater of the first date, such as {@code +1w}, {@code ++2d} or {@code .+1m}, or {@code null}.
     */
    public @Nullable String repeater() {
        return cookie(SyntaxKind.TIMESTAMP_REPEATER_MARK);
    }

    /**
     * Returns the warning delay of the first date, such as {@code -2d} or {@code --1w}, or {@code null}.
     */
    public @Nullable String warning() {
        return cookie(SyntaxKind.TIMESTAMP_DELAY_MARK);
    }

    // The tokens of each bracketed date, split at the "--" of a range.
    private List<List<SyntaxToken>> stamps() {
        final var result = new ArrayList<List<SyntaxToken>>();
        var current = new ArrayList<SyntaxToken>();
        for (final var token : syntax.leaves()) {
            if (token.kind() == SyntaxKind.MINUS2) {
                result.add(current);
                current = new ArrayList<>();
            } else {
                current.add(token);
            }
        }
        result.add(current);
        return result;
    }

    private List<SyntaxToken> last() {
        final var stamps = stamps();
        return stamps.get(stamps.size() - 1);
    }

    private @Nullable Integer timeEnd(final SyntaxKind kind) {
        final var stamps = stamps();
        if (stamps.size() > 1) {
            return number(stamps.get(1), kind, 0);
        }
        final var second = number(stamps.get(0), kind, 1);
        return (second != null) ? second : number(stamps.get(0), kind, 0);
    }

    private @Nullable String cookie(final SyntaxKind markKind) {
        final var tokens = stamps().get(0);
        for (int i = 0; i + 2 < tokens.size(); i += 1) {
            if (tokens.get(i).kind() == markKind) {
                return tokens.get(i).text() + tokens.get(i + 1).text() + tokens.get(i + 2).text();
            }
        }
        return null;
    }

    private static @Nullable Integer number(final List<SyntaxToken> tokens, final SyntaxKind kind, final int index) {
        int seen = 0;
        for (final var token : tokens) {
            if (token.kind() != kind) {
                continue;
            }
            if (seen == index) {
                return Integer.parseInt(token.text());
            }
            seen += 1;
        }
        return null;
    }

    private static int count(final List<SyntaxToken> tokens, final SyntaxKind kind) {
        int result = 0;
        for (final var token : tokens) {
            if (token.kind() == kind) {
                result += 1;
            }
        }
        return result;
    }

    private static final Set<SyntaxKind> KINDS = EnumSet.of(
        SyntaxKind.TIMESTAMP_ACTIVE, SyntaxKind.TIMESTAMP_INACTIVE, SyntaxKind.TIMESTAMP_DIARY
    );
}
