// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

public record OrgTableCell(SyntaxNode syntax) implements AstNode {
    public OrgTableCell {
        Views.requireKind(syntax, SyntaxKind.ORG_TABLE_CELL);
    }

    public static @Nullable OrgTableCell cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.ORG_TABLE_CELL) ? new OrgTableCell(node) : null;
    }

    /**
     * Returns the contents of the cell without the surrounding whitespace.
     */
    public String text() {
        return raw().strip();
    }
}
