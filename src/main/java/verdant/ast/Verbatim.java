// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * {@code =verbatim=} text. Its contents are never parsed.
 */
public record Verbatim(SyntaxNode syntax) implements AstNode {
    public Verbatim {
        Views.requireKind(syntax, SyntaxKind.VERBATIM);
    }

    public static @Nullable Verbatim cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.VERBATIM) ? new Verbatim(node) : null;
    }

    public String value() {
        final var value = Views.textToken(syntax, 0);
        return (value == null) ? "" : value;
    }
}
