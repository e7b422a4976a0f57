// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * {@code *bold*} text. Its contents are objects.
 */
public record Bold(SyntaxNode syntax) implements AstNode {
    public Bold {
        Views.requireKind(syntax, SyntaxKind.BOLD);
    }

    public static @Nullable Bold cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.BOLD) ? new Bold(node) : null;
    }
}
