// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * {@code +strike-through+} text. Its contents are objects.
 */
public record Strike(SyntaxNode syntax) implements AstNode {
    public Strike {
        Views.requireKind(syntax, SyntaxKind.STRIKE);
    }

    public static @Nullable Strike cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.STRIKE) ? new Strike(node) : null;
    }
}
