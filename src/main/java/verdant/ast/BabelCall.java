// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.List;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@code #+CALL:} line.
 */
public record BabelCall(SyntaxNode syntax) implements AstNode {
    public BabelCall {
        Views.requireKind(syntax, SyntaxKind.BABEL_CALL);
    }

    public static @Nullable BabelCall cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.BABEL_CALL) ? new BabelCall(node) : null;
    }

    public String value() {
        return Views.textAfterColon(syntax);
    }

    public List<AffiliatedKeyword> affiliatedKeywords() {
        return Views.affiliatedKeywords(syntax);
    }
}
