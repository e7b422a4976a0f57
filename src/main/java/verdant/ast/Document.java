// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.ArrayList;
import java.util.List;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The root of a parsed document: an optional property drawer, the zeroth section and the top-level headlines.
 */
public record Document(SyntaxNode syntax) implements AstNode {
    public Document {
        Views.requireKind(syntax, SyntaxKind.DOCUMENT);
    }

    public static @Nullable Document cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.DOCUMENT) ? new Document(node) : null;
    }

    /**
     * Returns the zeroth section, the content before the first headline, or {@code null} if there's none.
     */
    public @Nullable Section section() {
        return Views.firstChild(syntax, SyntaxKind.SECTION, Section::new);
    }

    public List<Headline> headlines() {
        return Views.children(syntax, SyntaxKind.HEADLINE, Headline::new);
    }

    /**
     * Returns the property drawer at the very start of the document, if any.
     */
    public @Nullable PropertyDrawer properties() {
        return Views.firstChild(syntax, SyntaxKind.PROPERTY_DRAWER, PropertyDrawer::new);
    }

    /**
     * Returns the keywords of the zeroth section, in order.
     */
    public List<Keyword> keywords() {
        final var section = syntax.firstChild(SyntaxKind.SECTION);
        return (section == null) ? List.of() : Views.children(section, SyntaxKind.KEYWORD, Keyword::new);
    }

    /**
     * Returns the values of the {@code #+TITLE} keywords of the zeroth section joined with spaces, or {@code null}
     * if there are none.
     */
    public @Nullable String title() {
        final var parts = new ArrayList<String>();
        for (final var keyword : keywords()) {
            if (keyword.key().equalsIgnoreCase("TITLE")) {
                parts.add(keyword.value());
            }
        }
        return parts.isEmpty() ? null : String.join(" ", parts);
    }
}
