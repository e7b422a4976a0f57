// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.List;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The elements between a headline, or the start of the document, and the next headline.
 */
public record Section(SyntaxNode syntax) implements AstNode {
    public Section {
        Views.requireKind(syntax, SyntaxKind.SECTION);
    }

    public static @Nullable Section cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.SECTION) ? new Section(node) : null;
    }

    public List<AstNode> elements() {
        return Views.elements(syntax);
    }
}
