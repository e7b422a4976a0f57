// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

public record Superscript(SyntaxNode syntax) implements AstNode {
    public Superscript {
        Views.requireKind(syntax, SyntaxKind.SUPERSCRIPT);
    }

    public static @Nullable Superscript cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.SUPERSCRIPT) ? new Superscript(node) : null;
    }

    /**
     * Checks whether the contents are enclosed in braces.
     */
    public boolean isBraced() {
        return syntax.firstToken(SyntaxKind.L_CURLY) != null;
    }

    /**
     * Returns the source text of the contents, without the marker and braces.
     */
    public String contentRaw() {
        final var braced = Views.enclosed(syntax, SyntaxKind.L_CURLY);
        if (braced != null) {
            return braced;
        }
        final var text = Views.textToken(syntax, 0);
        return (text == null) ? "" : text;
    }
}
