// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The {@code DEADLINE:}, {@code SCHEDULED:} and {@code CLOSED:} line right after a headline.
 */
public record Planning(SyntaxNode syntax) implements AstNode {
    public Planning {
        Views.requireKind(syntax, SyntaxKind.PLANNING);
    }

    public static @Nullable Planning cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.PLANNING) ? new Planning(node) : null;
    }

    public @Nullable Timestamp deadline() {
        return timestamp(SyntaxKind.PLANNING_DEADLINE);
    }

    public @Nullable Timestamp scheduled() {
        return timestamp(SyntaxKind.PLANNING_SCHEDULED);
    }

    public @Nullable Timestamp closed() {
        return timestamp(SyntaxKind.PLANNING_CLOSED);
    }

    private @Nullable Timestamp timestamp(final SyntaxKind kind) {
        final var item = syntax.firstChild(kind);
        if (item == null) {
            return null;
        }
        for (final var child : item.children()) {
            final var timestamp = Timestamp.cast(child);
            if (timestamp != null) {
                return timestamp;
            }
        }
        return null;
    }
}
