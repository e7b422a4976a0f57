// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.ArrayList;
import java.util.List;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A macro call, {@code {{{name(arguments)}}}}.
 */
public record Macros(SyntaxNode syntax) implements AstNode {
    public Macros {
        Views.requireKind(syntax, SyntaxKind.MACROS);
    }

    public static @Nullable Macros cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.MACROS) ? new Macros(node) : null;
    }

    public String name() {
        final var name = Views.textToken(syntax, 0);
        return (name == null) ? "" : name;
    }

    /**
     * Returns the text between the parentheses, or {@code null} if there are none.
     */
    public @Nullable String arguments() {
        return Views.enclosed(syntax, SyntaxKind.L_PARENS);
    }

    /**
     * Returns the comma-separated arguments, trimmed. A comma preceded by a backslash doesn't separate arguments.
     */
    public List<String> argumentList() {
        final var arguments = arguments();
        if (arguments == null) {
            return List.of();
        }
        final var result = new ArrayList<String>();
        final var current = new StringBuilder();
        for (int i = 0; i < arguments.length(); i += 1) {
            final var c = arguments.charAt(i);
            if (c == '\\' && i + 1 < arguments.length() && arguments.charAt(i + 1) == ',') {
                current.append(',');
                i += 1;
            } else if (c == ',') {
                result.add(current.toString().strip());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        result.add(current.toString().strip());
        return result;
    }
}
