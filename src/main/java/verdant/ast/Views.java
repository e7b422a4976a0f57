// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import verdant.util.UnreachableCodeReachedError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Child lookup helpers shared by the view types.
 */
final class Views {
    private Views() {
    }

    static void requireKind(final SyntaxNode node, final SyntaxKind kind) {
        if (node.kind() != kind) {
            throw new IllegalArgumentException("Expected a " + kind + " node, got " + node);
        }
    }

    static @Nullable String tokenText(final SyntaxNode node, final SyntaxKind kind) {
        final var token = node.firstToken(kind);
        return (token == null) ? null : token.text();
    }

    /**
     * Returns the text of the {@code index}th direct {@code TEXT} token, or {@code null} if there are fewer.
     */
    static @Nullable String textToken(final SyntaxNode node, final int index) {
        final var tokens = node.tokens(SyntaxKind.TEXT);
        return (index < tokens.size()) ? tokens.get(index).text() : null;
    }

    static <V> List<V> children(final SyntaxNode node, final SyntaxKind kind, final Function<SyntaxNode, V> view) {
        final var result = new ArrayList<V>();
        for (final var child : node.children(kind)) {
            result.add(view.apply(child));
        }
        return result;
    }

    static <V> @Nullable V firstChild(
        final SyntaxNode node,
        final SyntaxKind kind,
        final Function<SyntaxNode, V> view
    ) {
        final var child = node.firstChild(kind);
        return (child == null) ? null : view.apply(child);
    }

    /**
     * Returns the views of the container children of the given node.
     */
    static List<AstNode> elements(final @Nullable SyntaxNode node) {
        final var result = new ArrayList<AstNode>();
        if (node == null) {
            return result;
        }
        for (final var child : node.children()) {
            final var view = AstNodes.cast(child);
            if (view != null) {
                result.add(view);
            } else if (child.kind().role() == SyntaxKind.Role.TRANSPARENT) {
                result.addAll(elements(child));
            }
        }
        return result;
    }

    /**
     * Returns the child node of the given kind that the parser always produces for the node's kind.
     */
    static SyntaxNode part(final SyntaxNode node, final SyntaxKind kind) {
        final var part = node.firstChild(kind);
        if (part == null) {
            throw new UnreachableCodeReachedError(node + " has no " + kind + " child");
        }
        return part;
    }

    static String keywordKey(final SyntaxNode node) {
        final var key = tokenText(node, SyntaxKind.KEYWORD_KEY);
        return (key == null) ? "" : key;
    }

    // The text in brackets between the key and the colon.
    static @Nullable String keywordOptional(final SyntaxNode node) {
        boolean inBrackets = false;
        for (final var child : node.childrenWithTokens()) {
            if (child.kind() == SyntaxKind.L_BRACKET) {
                inBrackets = true;
            } else if (child.kind() == SyntaxKind.COLON) {
                return null;
            } else if (inBrackets && child.kind() == SyntaxKind.TEXT) {
                return child.text();
            }
        }
        return null;
    }

    /**
     * Returns the text between the opening token at {@code openIndex} among the node's children and the next closing
     * bracket, parenthesis or brace token.
     */
    static String enclosedAt(final SyntaxNode node, final int openIndex) {
        final var children = node.childrenWithTokens();
        final var builder = new StringBuilder();
        for (int i = openIndex + 1; i < children.size(); i += 1) {
            final var kind = children.get(i).kind();
            if (kind == SyntaxKind.R_BRACKET || kind == SyntaxKind.R_PARENS || kind == SyntaxKind.R_CURLY) {
                break;
            }
            builder.append(children.get(i).text());
        }
        return builder.toString();
    }

    /**
     * Returns the text enclosed by the first child token of the given opening kind, or {@code null} if there's none.
     */
    static @Nullable String enclosed(final SyntaxNode node, final SyntaxKind open) {
        final var children = node.childrenWithTokens();
        for (int i = 0; i < children.size(); i += 1) {
            if (children.get(i).kind() == open) {
                return enclosedAt(node, i);
            }
        }
        return null;
    }

    static List<AffiliatedKeyword> affiliatedKeywords(final SyntaxNode node) {
        return children(node, SyntaxKind.AFFILIATED_KEYWORD, AffiliatedKeyword::new);
    }

    /**
     * Returns the text between the first direct {@code COLON} token and the line terminator, trimmed.
     */
    static String textAfterColon(final SyntaxNode node) {
        final var builder = new StringBuilder();
        boolean seenColon = false;
        for (final var child : node.childrenWithTokens()) {
            if (child.kind() == SyntaxKind.NEW_LINE || child.kind() == SyntaxKind.BLANK_LINE) {
                break;
            }
            if (seenColon) {
                builder.append(child.text());
            } else if (child.kind() == SyntaxKind.COLON) {
                seenColon = true;
            }
        }
        return builder.toString().strip();
    }

    /**
     * Returns the text of a raw block content node, with escaping commas removed.
     */
    static String unescapedText(final @Nullable SyntaxNode content) {
        if (content == null) {
            return "";
        }
        final var builder = new StringBuilder();
        for (final var token : content.leaves()) {
            if (token.kind() != SyntaxKind.COMMA) {
                builder.append(token.text());
            }
        }
        return builder.toString();
    }

    /**
     * Returns the contents of prefixed lines, such as comments, joined with newlines. A single space after each prefix
     * is dropped.
     */
    static String prefixedLinesValue(final SyntaxNode node, final SyntaxKind prefixKind) {
        final var lines = new ArrayList<String>();
        for (final var child : node.childrenWithTokens()) {
            if (child.kind() == prefixKind) {
                lines.add("");
            } else if (child.kind() == SyntaxKind.TEXT && !lines.isEmpty()) {
                lines.set(lines.size() - 1, stripOneSpace(child.text()));
            }
        }
        return String.join("\n", lines);
    }

    private static String stripOneSpace(final String text) {
        return (text.startsWith(" ") || text.startsWith("\t")) ? text.substring(1) : text;
    }
}
