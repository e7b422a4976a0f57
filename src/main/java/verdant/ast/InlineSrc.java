// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Inline source code, {@code src_language[parameters]{body}}.
 */
public record InlineSrc(SyntaxNode syntax) implements AstNode {
    public InlineSrc {
        Views.requireKind(syntax, SyntaxKind.INLINE_SRC);
    }

    public static @Nullable InlineSrc cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.INLINE_SRC) ? new InlineSrc(node) : null;
    }

    public String language() {
        final var language = Views.textToken(syntax, 1);
        return (language == null) ? "" : language;
    }

    public @Nullable String parameters() {
        return Views.enclosed(syntax, SyntaxKind.L_BRACKET);
    }

    public String body() {
        final var body = Views.enclosed(syntax, SyntaxKind.L_CURLY);
        return (body == null) ? "" : body;
    }
}
