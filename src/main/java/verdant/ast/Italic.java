// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * {@code /italic/} text. Its contents are objects.
 */
public record Italic(SyntaxNode syntax) implements AstNode {
    public Italic {
        Views.requireKind(syntax, SyntaxKind.ITALIC);
    }

    public static @Nullable Italic cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.ITALIC) ? new Italic(node) : null;
    }
}
