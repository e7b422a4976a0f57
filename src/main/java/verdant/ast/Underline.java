// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * {@code _underline_} text. Its contents are objects.
 */
public record Underline(SyntaxNode syntax) implements AstNode {
    public Underline {
        Views.requireKind(syntax, SyntaxKind.UNDERLINE);
    }

    public static @Nullable Underline cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.UNDERLINE) ? new Underline(node) : null;
    }
}
