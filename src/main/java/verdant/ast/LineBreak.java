// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@code \\} at the end of a line.
 */
public record LineBreak(SyntaxNode syntax) implements AstNode {
    public LineBreak {
        Views.requireKind(syntax, SyntaxKind.LINE_BREAK);
    }

    public static @Nullable LineBreak cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.LINE_BREAK) ? new LineBreak(node) : null;
    }
}
