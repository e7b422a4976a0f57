// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The inline content of a headline's title.
 */
public record HeadlineTitle(SyntaxNode syntax) implements AstNode {
    public HeadlineTitle {
        Views.requireKind(syntax, SyntaxKind.HEADLINE_TITLE);
    }

    public static @Nullable HeadlineTitle cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.HEADLINE_TITLE) ? new HeadlineTitle(node) : null;
    }

    public @Nullable Headline headline() {
        final var parent = syntax.parent();
        return (parent == null) ? null : Headline.cast(parent);
    }

    /**
     * Returns the level of the headline the title belongs to.
     */
    public int level() {
        final var headline = headline();
        return (headline == null) ? 0 : headline.level();
    }
}
