// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A keyword attached to the element following it, such as {@code #+CAPTION:} or {@code #+ATTR_HTML:}.
 * <p>
 * The value of a parsed keyword contains objects; {@link #value()} returns its source text either way.
 */
public record AffiliatedKeyword(SyntaxNode syntax) implements AstNode {
    public AffiliatedKeyword {
        Views.requireKind(syntax, SyntaxKind.AFFILIATED_KEYWORD);
    }

    public static @Nullable AffiliatedKeyword cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.AFFILIATED_KEYWORD) ? new AffiliatedKeyword(node) : null;
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
