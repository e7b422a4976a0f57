// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.List;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@code #+BEGIN_QUOTE} block containing elements.
 */
public record QuoteBlock(SyntaxNode syntax) implements AstNode {
    public QuoteBlock {
        Views.requireKind(syntax, SyntaxKind.QUOTE_BLOCK);
    }

    public static @Nullable QuoteBlock cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.QUOTE_BLOCK) ? new QuoteBlock(node) : null;
    }

    /**
     * Returns the offset of the first line after the {@code #+BEGIN} line.
     */
    public int contentStart() {
        return Views.part(syntax, SyntaxKind.BLOCK_CONTENT).textRange().start();
    }

    /**
     * Returns the offset of the {@code #+END} line.
     */
    public int contentEnd() {
        return Views.part(syntax, SyntaxKind.BLOCK_CONTENT).textRange().end();
    }

    public List<AstNode> elements() {
        return Views.elements(Views.part(syntax, SyntaxKind.BLOCK_CONTENT));
    }
}
