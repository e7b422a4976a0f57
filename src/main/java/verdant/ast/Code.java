// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

public record Code(SyntaxNode syntax) implements AstNode {
    public Code {
        Views.requireKind(syntax, SyntaxKind.CODE);
    }

    public static @Nullable Code cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.CODE) ? new Code(node) : null;
    }

    public String value() {
        final var value = Views.textToken(syntax, 0);
        return (value == null) ? "" : value;
    }
}
