// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.syntax;

/**
 * An immutable element of the green tree: a node or a token.
 * <p>
 * Green elements know their kind and text length, but not their position or parent, so any subtree can be shared
 * between versions of a document. Equality is structural.
 */
public sealed interface GreenElement permits GreenNode, GreenToken {
    SyntaxKind kind();

    int textLength();

    /**
     * Appends the text of this element to the given builder.
     */
    void appendTo(StringBuilder builder);

    /**
     * Reconstructs the text of this element.
     */
    default String text() {
        final var builder = new StringBuilder(textLength());
        appendTo(builder);
        return builder.toString();
    }
}
