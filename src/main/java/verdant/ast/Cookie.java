// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A statistics cookie, {@code [2/5]} or {@code [40%]}.
 */
public record Cookie(SyntaxNode syntax) implements AstNode {
    public Cookie {
        Views.requireKind(syntax, SyntaxKind.COOKIE);
    }

    public static @Nullable Cookie cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.COOKIE) ? new Cookie(node) : null;
    }

    public boolean isPercent() {
        return syntax.firstToken(SyntaxKind.PERCENT) != null;
    }

    /**
     * Returns the text between the brackets.
     */
    public String value() {
        final var raw = raw();
        return raw.substring(1, raw.length() - 1);
    }
}
