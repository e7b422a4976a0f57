// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

public record CommentBlock(SyntaxNode syntax) implements AstNode {
    public CommentBlock {
        Views.requireKind(syntax, SyntaxKind.COMMENT_BLOCK);
    }

    public static @Nullable CommentBlock cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.COMMENT_BLOCK) ? new CommentBlock(node) : null;
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
     * Returns the contents, with commas escaping leading {@code *} and {@code #+} removed.
     */
    public String value() {
        return Views.unescapedText(syntax.firstChild(SyntaxKind.BLOCK_CONTENT));
    }
}
