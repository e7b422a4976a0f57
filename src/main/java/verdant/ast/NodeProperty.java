// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One {@code :NAME: value} line of a property drawer.
 */
public record NodeProperty(SyntaxNode syntax) implements AstNode {
    public NodeProperty {
        Views.requireKind(syntax, SyntaxKind.NODE_PROPERTY);
    }

    public static @Nullable NodeProperty cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.NODE_PROPERTY) ? new NodeProperty(node) : null;
    }

    public String name() {
        final var name = Views.textToken(syntax, 0);
        return (name == null) ? "" : name;
    }

    /**
     * Checks whether the name ends with {@code +}, meaning the value is appended to the previous one.
     */
    public boolean isAppend() {
        return syntax.firstToken(SyntaxKind.PLUS) != null;
    }

    public String value() {
        final var value = Views.textToken(syntax, 1);
        return (value == null) ? "" : value;
    }
}
