// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An inline babel call, {@code call_name[inside header](arguments)[end header]}.
 */
public record InlineCall(SyntaxNode syntax) implements AstNode {
    public InlineCall {
        Views.requireKind(syntax, SyntaxKind.INLINE_CALL);
    }

    public static @Nullable InlineCall cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.INLINE_CALL) ? new InlineCall(node) : null;
    }

    public String name() {
        final var name = Views.textToken(syntax, 1);
        return (name == null) ? "" : name;
    }

    public String arguments() {
        final var arguments = Views.enclosed(syntax, SyntaxKind.L_PARENS);
        return (arguments == null) ? "" : arguments;
    }

    public @Nullable String insideHeader() {
        return header(true);
    }

    public @Nullable String endHeader() {
        return header(false);
    }

    private @Nullable String header(final boolean beforeArguments) {
        final var children = syntax.childrenWithTokens();
        boolean seenArguments = false;
        for (int i = 0; i < children.size(); i += 1) {
            final var kind = children.get(i).kind();
            if (kind == SyntaxKind.L_PARENS) {
                seenArguments = true;
            } else if (kind == SyntaxKind.L_BRACKET && seenArguments != beforeArguments) {
                return Views.enclosedAt(syntax, i);
            }
        }
        return null;
    }
}
