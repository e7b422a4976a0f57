// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Consecutive {@code : text} lines, exported verbatim.
 */
public record FixedWidth(SyntaxNode syntax) implements AstNode {
    public FixedWidth {
        Views.requireKind(syntax, SyntaxKind.FIXED_WIDTH);
    }

    public static @Nullable FixedWidth cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.FIXED_WIDTH) ? new FixedWidth(node) : null;
    }

    public String value() {
        return Views.prefixedLinesValue(syntax, SyntaxKind.COLON);
    }
}
