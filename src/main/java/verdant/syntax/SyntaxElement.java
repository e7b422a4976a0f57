// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.syntax;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A positioned element of one version of a syntax tree: a {@link SyntaxNode} or a {@link SyntaxToken}.
 * <p>
 * Positioned elements are cheap handles over green elements; the same green element shared by two versions of a
 * document gets a different handle, and possibly a different range, in each.
 */
public sealed interface SyntaxElement permits SyntaxNode, SyntaxToken {
    SyntaxKind kind();

    GreenElement green();

    /**
     * Returns the absolute range of this element in its version of the document.
     */
    TextRange textRange();

    /**
     * Returns the node containing this element, or {@code null} for the root.
     */
    @Nullable SyntaxNode parent();

    /**
     * Returns the position of this element among its parent's children.
     */
    int indexInParent();

    default String text() {
        return green().text();
    }
}
