// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

public record Target(SyntaxNode syntax) implements AstNode {
    public Target {
        Views.requireKind(syntax, SyntaxKind.TARGET);
    }

    public static @Nullable Target cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.TARGET) ? new Target(node) : null;
    }

    public String target() {
        final var target = Views.textToken(syntax, 0);
        return (target == null) ? "" : target;
    }
}
