// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.ArrayList;
import java.util.List;
import verdant.syntax.SyntaxElement;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A cloze deletion, {@code {{text}}}, optionally followed by a hint in braces and an {@code @id}:
 * {@code {{text}{hint}@id}}.
 * <p>
 * The text may contain inline markup; the hint and the id are plain text.
 */
public record Cloze(SyntaxNode syntax) implements AstNode {
    public Cloze {
        Views.requireKind(syntax, SyntaxKind.CLOZE);
    }

    public static @Nullable Cloze cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.CLOZE) ? new Cloze(node) : null;
    }

    /**
     * Returns the elements between the opening braces and the first closing brace.
     */
    public List<SyntaxElement> text() {
        final var children = syntax.childrenWithTokens();
        final var result = new ArrayList<SyntaxElement>();
        for (int i = 2; i < children.size() && children.get(i).kind() != SyntaxKind.R_CURLY; i += 1) {
            result.add(children.get(i));
        }
        return result;
    }

    public String textRaw() {
        final var builder = new StringBuilder();
        for (final var element : text()) {
            builder.append(element.text());
        }
        return builder.toString();
    }

    /**
     * Returns the hint, possibly empty, or {@code null} if there's none.
     */
    public @Nullable String hint() {
        final var children = syntax.childrenWithTokens();
        for (int i = 2; i < children.size(); i += 1) {
            if (children.get(i).kind() == SyntaxKind.L_CURLY) {
                return Views.enclosedAt(syntax, i);
            }
        }
        return null;
    }

    /**
     * Returns the id, possibly empty, or {@code null} if there's none.
     */
    public @Nullable String id() {
        final var children = syntax.childrenWithTokens();
        for (int i = 0; i < children.size(); i += 1) {
            if (children.get(i).kind() == SyntaxKind.AT) {
                final var next = children.get(i + 1);
                return (next.kind() == SyntaxKind.TEXT) ? next.text() : "";
            }
        }
        return null;
    }
}
