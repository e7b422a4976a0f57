// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@code CLOCK: [timestamp] => duration} line.
 */
public record Clock(SyntaxNode syntax) implements AstNode {
    public Clock {
        Views.requireKind(syntax, SyntaxKind.CLOCK);
    }

    public static @Nullable Clock cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.CLOCK) ? new Clock(node) : null;
    }

    public @Nullable Timestamp timestamp() {
        return Views.firstChild(syntax, SyntaxKind.TIMESTAMP_INACTIVE, Timestamp::new);
    }

    /**
     * Returns the duration after {@code =>}, or {@code null} for a running clock.
     */
    public @Nullable String duration() {
        return Views.textToken(syntax, 0);
    }

    public boolean isRunning() {
        return duration() == null;
    }
}
