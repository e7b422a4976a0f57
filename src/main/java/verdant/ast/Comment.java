// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Consecutive {@code # comment} lines.
 */
public record Comment(SyntaxNode syntax) implements AstNode {
    public Comment {
        Views.requireKind(syntax, SyntaxKind.COMMENT);
    }

    public static @Nullable Comment cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.COMMENT) ? new Comment(node) : null;
    }

    /**
     * Returns the text of the lines without the {@code #} prefixes, joined with newlines.
     */
    public String value() {
        return Views.prefixedLinesValue(syntax, SyntaxKind.HASH);
    }
}
