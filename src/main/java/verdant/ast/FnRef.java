// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A footnote reference: {@code [fn:label]}, {@code [fn:label:definition]} or the anonymous {@code [fn::definition]}.
 */
public record FnRef(SyntaxNode syntax) implements AstNode {
    public FnRef {
        Views.requireKind(syntax, SyntaxKind.FN_REF);
    }

    public static @Nullable FnRef cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.FN_REF) ? new FnRef(node) : null;
    }

    /**
     * Returns the label, or {@code null} for an anonymous footnote.
     */
    public @Nullable String label() {
        final var children = syntax.childrenWithTokens();
        for (int i = 0; i + 1 < children.size(); i += 1) {
            if (children.get(i).kind() == SyntaxKind.COLON) {
                final var next = children.get(i + 1);
                return (next.kind() == SyntaxKind.TEXT) ? next.text() : null;
            }
        }
        return null;
    }

    /**
     * Checks whether the reference carries its own definition.
     */
    public boolean isInline() {
        return syntax.tokens(SyntaxKind.COLON).size() > 1;
    }

    /**
     * Returns the source text of the inline definition, or {@code null}.
     */
    public @Nullable String definitionRaw() {
        final var colons = syntax.tokens(SyntaxKind.COLON);
        if (colons.size() < 2) {
            return null;
        }
        final var children = syntax.childrenWithTokens();
        final var builder = new StringBuilder();
        for (int i = colons.get(1).indexInParent() + 1; i < children.size() - 1; i += 1) {
            builder.append(children.get(i).text());
        }
        return builder.toString();
    }
}
