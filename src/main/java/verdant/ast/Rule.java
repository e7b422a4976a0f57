// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A horizontal rule of five or more dashes.
 */
public record Rule(SyntaxNode syntax) implements AstNode {
    public Rule {
        Views.requireKind(syntax, SyntaxKind.RULE);
    }

    public static @Nullable Rule cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.RULE) ? new Rule(node) : null;
    }
}
