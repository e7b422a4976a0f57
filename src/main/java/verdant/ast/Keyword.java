// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@code #+KEY: value} line. Table formulas, {@code #+TBLFM:}, are keywords owned by their table.
 */
public record Keyword(SyntaxNode syntax) implements AstNode {
    public Keyword {
        Views.requireKind(syntax, SyntaxKind.KEYWORD);
    }

    public static @Nullable Keyword cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.KEYWORD) ? new Keyword(node) : null;
    }

    public String key() {
        return Views.keywordKey(syntax);
    }

    /**
     * Returns the bracketed part between the key and the colon, or {@code null}.
     */
    public @Nullable String optional() {
        return Views.keywordOptional(syntax);
    }

    /**
     * Returns the value after the colon, trimmed.
     */
    public String value() {
        return Views.textAfterColon(syntax);
    }
}
