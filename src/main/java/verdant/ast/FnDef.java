// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A footnote definition, {@code [fn:label] contents}, starting at column zero.
 */
public record FnDef(SyntaxNode syntax) implements AstNode {
    public FnDef {
        Views.requireKind(syntax, SyntaxKind.FN_DEF);
    }

    public static @Nullable FnDef cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.FN_DEF) ? new FnDef(node) : null;
    }

    public String label() {
        final var label = Views.textToken(syntax, 1);
        return (label == null) ? "" : label;
    }
}
