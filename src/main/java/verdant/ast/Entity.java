// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.Entities;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import verdant.util.UnreachableCodeReachedError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A named entity, {@code \name} or {@code \name{}}, standing for a special character.
 */
public record Entity(SyntaxNode syntax) implements AstNode {
    public Entity {
        Views.requireKind(syntax, SyntaxKind.ENTITY);
    }

    public static @Nullable Entity cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.ENTITY) ? new Entity(node) : null;
    }

    public String name() {
        final var name = Views.tokenText(syntax, SyntaxKind.ENTITY_NAME);
        return (name == null) ? "" : name;
    }

    /**
     * Checks whether the name is terminated by {@code {}}.
     */
    public boolean hasBraces() {
        return syntax.firstToken(SyntaxKind.L_CURLY) != null;
    }

    public Entities.Definition definition() {
        final var definition = Entities.lookup(name());
        if (definition == null) {
            throw new UnreachableCodeReachedError("Unknown entity " + name());
        }
        return definition;
    }

    public String latex() {
        return definition().latex();
    }

    public String html() {
        return definition().html();
    }

    public String utf8() {
        return definition().utf8();
    }
}
