// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A row of a table: a standard row of cells or a {@code |---} rule row.
 */
public record OrgTableRow(SyntaxNode syntax) implements AstNode {
    public OrgTableRow {
        if (!KINDS.contains(syntax.kind())) {
            throw new IllegalArgumentException("Expected one of " + KINDS + ", got " + syntax);
        }
    }

    public static @Nullable OrgTableRow cast(final SyntaxNode node) {
        return (KINDS.contains(node.kind())) ? new OrgTableRow(node) : null;
    }

    public boolean isRule() {
        return syntax.kind() == SyntaxKind.ORG_TABLE_RULE_ROW;
    }

    /**
     * Checks whether this is a standard row before the rule row that ends the table's header.
     */
    public boolean isHeader() {
        final var parent = syntax.parent();
        final var table = (parent == null) ? null : OrgTable.cast(parent);
        if (isRule() || table == null) {
            return false;
        }
        final var headerEnd = table.headerEnd();
        return headerEnd >= 0 && table.rows().indexOf(this) < headerEnd;
    }

    public List<OrgTableCell> cells() {
        return Views.children(syntax, SyntaxKind.ORG_TABLE_CELL, OrgTableCell::new);
    }

    private static final Set<SyntaxKind> KINDS = EnumSet.of(
        SyntaxKind.ORG_TABLE_STANDARD_ROW, SyntaxKind.ORG_TABLE_RULE_ROW
    );
}
