// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.ArrayList;
import java.util.List;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A headline: the title line, optional planning and property drawer, the section, and the child headlines.
 * <p>
 * Everything is derived from the tokens of the title line; for example, {@link #level()} is always the length of the
 * stars token.
 */
public record Headline(SyntaxNode syntax) implements AstNode {
    public Headline {
        Views.requireKind(syntax, SyntaxKind.HEADLINE);
    }

    public static @Nullable Headline cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.HEADLINE) ? new Headline(node) : null;
    }

    /**
     * Returns the number of stars.
     */
    public int level() {
        final var stars = syntax.firstToken(SyntaxKind.HEADLINE_STARS);
        return (stars == null) ? 0 : stars.text().length();
    }

    /**
     * Returns the todo keyword, active or done, or {@code null} if the headline has none.
     */
    public @Nullable String todoKeyword() {
        final var todo = Views.tokenText(syntax, SyntaxKind.HEADLINE_KEYWORD_TODO);
        return (todo != null) ? todo : Views.tokenText(syntax, SyntaxKind.HEADLINE_KEYWORD_DONE);
    }

    public boolean isTodo() {
        return syntax.firstToken(SyntaxKind.HEADLINE_KEYWORD_TODO) != null;
    }

    public boolean isDone() {
        return syntax.firstToken(SyntaxKind.HEADLINE_KEYWORD_DONE) != null;
    }

    /**
     * Returns the priority inside the {@code [#X]} cookie, or {@code null}.
     */
    public @Nullable String priority() {
        final var cookie = syntax.firstChild(SyntaxKind.HEADLINE_PRIORITY);
        return (cookie == null) ? null : Views.textToken(cookie, 0);
    }

    public @Nullable HeadlineTitle title() {
        return Views.firstChild(syntax, SyntaxKind.HEADLINE_TITLE, HeadlineTitle::new);
    }

    /**
     * Returns the source text of the title, without the keyword, the priority and the tags, or an empty string.
     */
    public String titleRaw() {
        final var title = syntax.firstChild(SyntaxKind.HEADLINE_TITLE);
        return (title == null) ? "" : title.text();
    }

    public List<String> tags() {
        final var tags = syntax.firstChild(SyntaxKind.HEADLINE_TAGS);
        if (tags == null) {
            return List.of();
        }
        final var result = new ArrayList<String>();
        for (final var token : tags.tokens(SyntaxKind.TEXT)) {
            result.add(token.text());
        }
        return result;
    }

    public boolean isCommented() {
        final var title = titleRaw();
        return title.startsWith("COMMENT") && (title.length() == 7 || Character.isWhitespace(title.charAt(7)));
    }

    public boolean isArchived() {
        return tags().contains("ARCHIVE");
    }

    public @Nullable Planning planning() {
        return Views.firstChild(syntax, SyntaxKind.PLANNING, Planning::new);
    }

    public @Nullable Timestamp scheduled() {
        final var planning = planning();
        return (planning == null) ? null : planning.scheduled();
    }

    public @Nullable Timestamp deadline() {
        final var planning = planning();
        return (planning == null) ? null : planning.deadline();
    }

    public @Nullable Timestamp closed() {
        final var planning = planning();
        return (planning == null) ? null : planning.closed();
    }

    public @Nullable PropertyDrawer properties() {
        return Views.firstChild(syntax, SyntaxKind.PROPERTY_DRAWER, PropertyDrawer::new);
    }

    public @Nullable Section section() {
        return Views.firstChild(syntax, SyntaxKind.SECTION, Section::new);
    }

    /**
     * Returns the direct child headlines.
     */
    public List<Headline> headlines() {
        return Views.children(syntax, SyntaxKind.HEADLINE, Headline::new);
    }
}
