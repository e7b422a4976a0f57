// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An export snippet, {@code @@backend:value@@}, passed verbatim to the named backend only.
 */
public record Snippet(SyntaxNode syntax) implements AstNode {
    public Snippet {
        Views.requireKind(syntax, SyntaxKind.SNIPPET);
    }

    public static @Nullable Snippet cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.SNIPPET) ? new Snippet(node) : null;
    }

    public String backend() {
        final var backend = Views.textToken(syntax, 0);
        return (backend == null) ? "" : backend;
    }

    public String value() {
        final var value = Views.textToken(syntax, 1);
        return (value == null) ? "" : value;
    }
}
