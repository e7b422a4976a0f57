// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.List;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@code #+BEGIN_SRC language switches :header arguments} block.
 */
public record SourceBlock(SyntaxNode syntax) implements AstNode {
    public SourceBlock {
        Views.requireKind(syntax, SyntaxKind.SOURCE_BLOCK);
    }

    public static @Nullable SourceBlock cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.SOURCE_BLOCK) ? new SourceBlock(node) : null;
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

    public @Nullable String language() {
        return Views.tokenText(Views.part(syntax, SyntaxKind.BLOCK_BEGIN), SyntaxKind.SRC_BLOCK_LANGUAGE);
    }

    public @Nullable String switches() {
        return Views.tokenText(Views.part(syntax, SyntaxKind.BLOCK_BEGIN), SyntaxKind.SRC_BLOCK_SWITCHES);
    }

    /**
     * Returns the header arguments, the part of the first line starting at the first {@code :} preceded by a space.
     */
    public @Nullable String parameters() {
        return Views.tokenText(Views.part(syntax, SyntaxKind.BLOCK_BEGIN), SyntaxKind.SRC_BLOCK_PARAMETERS);
    }

    /**
     * Returns the contents, with commas escaping leading {@code *} and {@code #+} removed.
     */
    public String value() {
        return Views.unescapedText(syntax.firstChild(SyntaxKind.BLOCK_CONTENT));
    }

    public List<AffiliatedKeyword> affiliatedKeywords() {
        return Views.affiliatedKeywords(syntax);
    }
}
