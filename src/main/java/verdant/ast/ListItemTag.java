// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

public record ListItemTag(SyntaxNode syntax) implements AstNode {
    public ListItemTag {
        Views.requireKind(syntax, SyntaxKind.LIST_ITEM_TAG);
    }

    public static @Nullable ListItemTag cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.LIST_ITEM_TAG) ? new ListItemTag(node) : null;
    }
}
