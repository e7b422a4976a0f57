// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.List;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@code :NAME:} … {@code :END:} drawer.
 */
public record Drawer(SyntaxNode syntax) implements AstNode {
    public Drawer {
        Views.requireKind(syntax, SyntaxKind.DRAWER);
    }

    public static @Nullable Drawer cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.DRAWER) ? new Drawer(node) : null;
    }

    public String name() {
        final var name = Views.textToken(Views.part(syntax, SyntaxKind.DRAWER_BEGIN), 0);
        return (name == null) ? "" : name;
    }

    /**
     * Returns the source text between the delimiter lines.
     */
    public String contentRaw() {
        return Views.part(syntax, SyntaxKind.DRAWER_CONTENT).text();
    }

    public List<AstNode> elements() {
        return Views.elements(Views.part(syntax, SyntaxKind.DRAWER_CONTENT));
    }
}
