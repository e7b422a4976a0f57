// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.List;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A paragraph of inline content.
 */
public record Paragraph(SyntaxNode syntax) implements AstNode {
    public Paragraph {
        Views.requireKind(syntax, SyntaxKind.PARAGRAPH);
    }

    public static @Nullable Paragraph cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.PARAGRAPH) ? new Paragraph(node) : null;
    }

    public List<AffiliatedKeyword> affiliatedKeywords() {
        return Views.affiliatedKeywords(syntax);
    }
}
