// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.List;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A block with a name other than the standard ones, such as {@code #+BEGIN_NOTE}.
 */
public record SpecialBlock(SyntaxNode syntax) implements AstNode {
    public SpecialBlock {
        Views.requireKind(syntax, SyntaxKind.SPECIAL_BLOCK);
    }

    public static @Nullable SpecialBlock cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.SPECIAL_BLOCK) ? new SpecialBlock(node) : null;
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

    /**
     * Returns the name of the block, as written after {@code BEGIN_}.
     */
    public String name() {
        final var key = Views.keywordKey(Views.part(syntax, SyntaxKind.BLOCK_BEGIN));
        return key.substring(Math.min(6, key.length()));
    }

    /**
     * Returns the text after the name on the first line, or {@code null}.
     */
    public @Nullable String parameters() {
        return Views.textToken(Views.part(syntax, SyntaxKind.BLOCK_BEGIN), 0);
    }

    public List<AstNode> elements() {
        return Views.elements(Views.part(syntax, SyntaxKind.BLOCK_CONTENT));
    }
}
