// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.List;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A dynamic block, {@code #+BEGIN: name arguments} … {@code #+END:}.
 */
public record DynBlock(SyntaxNode syntax) implements AstNode {
    public DynBlock {
        Views.requireKind(syntax, SyntaxKind.DYN_BLOCK);
    }

    public static @Nullable DynBlock cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.DYN_BLOCK) ? new DynBlock(node) : null;
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

    public String name() {
        final var text = arguments();
        final var space = indexOfWhitespace(text);
        return (space < 0) ? text : text.substring(0, space);
    }

    /**
     * Returns everything after the name on the first line, trimmed, or an empty string.
     */
    public String parameters() {
        final var text = arguments();
        final var space = indexOfWhitespace(text);
        return (space < 0) ? "" : text.substring(space).strip();
    }

    public List<AstNode> elements() {
        return Views.elements(Views.part(syntax, SyntaxKind.BLOCK_CONTENT));
    }

    private String arguments() {
        final var text = Views.textToken(Views.part(syntax, SyntaxKind.BLOCK_BEGIN), 0);
        return (text == null) ? "" : text;
    }

    private static int indexOfWhitespace(final String text) {
        for (int i = 0; i < text.length(); i += 1) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
