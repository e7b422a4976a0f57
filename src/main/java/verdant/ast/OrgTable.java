// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.ArrayList;
import java.util.List;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A table of {@code |}-separated cells.
 * <p>
 * Row and column indices count standard rows only; rule rows are reported by {@link #ruleRowIndices()} as indices
 * into {@link #rows()}.
 */
public record OrgTable(SyntaxNode syntax) implements AstNode {
    public OrgTable {
        Views.requireKind(syntax, SyntaxKind.ORG_TABLE);
    }

    public static @Nullable OrgTable cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.ORG_TABLE) ? new OrgTable(node) : null;
    }

    /**
     * Returns all rows, rule rows included.
     */
    public List<OrgTableRow> rows() {
        final var result = new ArrayList<OrgTableRow>();
        for (final var child : syntax.children()) {
            final var row = OrgTableRow.cast(child);
            if (row != null) {
                result.add(row);
            }
        }
        return result;
    }

    /**
     * Returns the standard rows.
     */
    public List<OrgTableRow> standardRows() {
        final var result = new ArrayList<OrgTableRow>();
        for (final var row : rows()) {
            if (!row.isRule()) {
                result.add(row);
            }
        }
        return result;
    }

    public int rowCount() {
        return standardRows().size();
    }

    /**
     * Returns the number of cells of the widest standard row.
     */
    public int columnCount() {
        int result = 0;
        for (final var row : standardRows()) {
            result = Math.max(result, row.cells().size());
        }
        return result;
    }

    /**
     * Returns the cell at the given standard row and column, or {@code null} if the row is shorter.
     *
     * @throws IndexOutOfBoundsException If there's no such standard row.
     */
    public @Nullable OrgTableCell cell(final int row, final int column) {
        final var cells = standardRows().get(row).cells();
        return (column >= 0 && column < cells.size()) ? cells.get(column) : null;
    }

    public List<Integer> ruleRowIndices() {
        final var result = new ArrayList<Integer>();
        final var rows = rows();
        for (int i = 0; i < rows.size(); i += 1) {
            if (rows.get(i).isRule()) {
                result.add(i);
            }
        }
        return result;
    }

    /**
     * Checks whether the table has a header: standard rows followed by a rule row followed by more standard rows.
     */
    public boolean hasHeader() {
        return headerEnd() >= 0;
    }

    /**
     * Returns the values of the {@code #+TBLFM:} lines.
     */
    public List<String> formulas() {
        final var result = new ArrayList<String>();
        for (final var keyword : Views.children(syntax, SyntaxKind.KEYWORD, Keyword::new)) {
            result.add(keyword.value());
        }
        return result;
    }

    public List<AffiliatedKeyword> affiliatedKeywords() {
        return Views.affiliatedKeywords(syntax);
    }

    // Index into rows() of the rule row ending the header, or -1.
    int headerEnd() {
        final var rows = rows();
        int firstRule = -1;
        for (int i = 0; i < rows.size(); i += 1) {
            if (rows.get(i).isRule()) {
                firstRule = i;
                break;
            }
        }
        if (firstRule <= 0) {
            return -1;
        }
        for (int i = firstRule + 1; i < rows.size(); i += 1) {
            if (!rows.get(i).isRule()) {
                return firstRule;
            }
        }
        return -1;
    }
}
