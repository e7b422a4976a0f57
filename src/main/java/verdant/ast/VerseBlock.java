// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@code #+BEGIN_VERSE} block. Its contents are objects, line breaks included.
 */
public record VerseBlock(SyntaxNode syntax) implements AstNode {
    public VerseBlock {
        Views.requireKind(syntax, SyntaxKind.VERSE_BLOCK);
    }

    public static @Nullable VerseBlock cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.VERSE_BLOCK) ? new VerseBlock(node) : null;
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
}
