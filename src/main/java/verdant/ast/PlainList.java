// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.List;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A plain list: unordered ({@code -}, {@code +}, {@code *}), ordered ({@code 1.}, {@code 1)}) or descriptive (items
 * with a {@code tag ::}).
 */
public record PlainList(SyntaxNode syntax) implements AstNode {
    public PlainList {
        Views.requireKind(syntax, SyntaxKind.LIST);
    }

    public static @Nullable PlainList cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.LIST) ? new PlainList(node) : null;
    }

    public List<ListItem> items() {
        return Views.children(syntax, SyntaxKind.LIST_ITEM, ListItem::new);
    }

    /**
     * Checks whether the first item's bullet is a counter.
     */
    public boolean isOrdered() {
        final var items = items();
        return !items.isEmpty() && items.get(0).isOrdered();
    }

    /**
     * Checks whether the first item has a tag.
     */
    public boolean isDescriptive() {
        final var items = items();
        return !items.isEmpty() && items.get(0).tag() != null;
    }

    public List<AffiliatedKeyword> affiliatedKeywords() {
        return Views.affiliatedKeywords(syntax);
    }
}
