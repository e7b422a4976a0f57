// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.export;

import verdant.ast.AstNode;
import verdant.syntax.SyntaxToken;

/**
 * An event produced by {@link Traversal#walk}.
 */
public sealed interface Event {
    /**
     * Entering a container; the events of its children follow.
     */
    record Enter(AstNode node) implements Event {
    }

    /**
     * Leaving a container that was entered and not skipped.
     */
    record Leave(AstNode node) implements Event {
    }

    /**
     * A plain text token.
     */
    record Text(SyntaxToken token) implements Event {
    }

    /**
     * A token of any other kind, produced only for traversers that ask for token-level detail.
     */
    record Token(SyntaxToken token) implements Event {
    }
}
