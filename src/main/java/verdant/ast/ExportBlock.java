// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@code #+BEGIN_EXPORT backend} block, whose contents are passed verbatim to the named backend.
 */
public record ExportBlock(SyntaxNode syntax) implements AstNode {
    public ExportBlock {
        Views.requireKind(syntax, SyntaxKind.EXPORT_BLOCK);
    }

    public static @Nullable ExportBlock cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.EXPORT_BLOCK) ? new ExportBlock(node) : null;
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
     * Returns the name of the backend, or an empty string if it's missing.
     */
    public String type() {
        final var type = Views.tokenText(Views.part(syntax, SyntaxKind.BLOCK_BEGIN), SyntaxKind.EXPORT_BLOCK_TYPE);
        return (type == null) ? "" : type;
    }

    /**
     * Returns the contents, with commas escaping leading {@code *} and {@code #+} removed.
     */
    public String value() {
        return Views.unescapedText(syntax.firstChild(SyntaxKind.BLOCK_CONTENT));
    }
}
