// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.syntax;

/**
 * The closed set of kinds of syntax tokens and syntax nodes.
 * <p>
 * Every kind has a {@link Role} that tells the traversal engine how to treat elements of that kind.
 */
public enum SyntaxKind {
    // Tokens.
    /** Plain text, the only token kind surfaced by traversal as text. */
    TEXT(Role.TOKEN),
    WHITESPACE(Role.TOKEN),
    /** A line terminator: {@code \n}, {@code \r\n} or {@code \r}. */
    NEW_LINE(Role.TOKEN),
    /** A whole line consisting of whitespace only, including its terminator. */
    BLANK_LINE(Role.TOKEN),
    HEADLINE_STARS(Role.TOKEN),
    HEADLINE_KEYWORD_TODO(Role.TOKEN),
    HEADLINE_KEYWORD_DONE(Role.TOKEN),
    L_BRACKET(Role.TOKEN),
    R_BRACKET(Role.TOKEN),
    L_ANGLE(Role.TOKEN),
    R_ANGLE(Role.TOKEN),
    L_CURLY(Role.TOKEN),
    R_CURLY(Role.TOKEN),
    L_PARENS(Role.TOKEN),
    R_PARENS(Role.TOKEN),
    COLON(Role.TOKEN),
    /** {@code ::}, separating a descriptive list item's tag from its content. */
    COLON2(Role.TOKEN),
    HASH(Role.TOKEN),
    /** {@code #+}, introducing keywords and block delimiters. */
    HASH_PLUS(Role.TOKEN),
    PLUS(Role.TOKEN),
    MINUS(Role.TOKEN),
    /** {@code --}, separating the two ends of a timestamp range. */
    MINUS2(Role.TOKEN),
    STAR(Role.TOKEN),
    SLASH(Role.TOKEN),
    UNDERSCORE(Role.TOKEN),
    EQUAL(Role.TOKEN),
    TILDE(Role.TOKEN),
    CARET(Role.TOKEN),
    PERCENT(Role.TOKEN),
    PERCENT2(Role.TOKEN),
    AT2(Role.TOKEN),
    COMMA(Role.TOKEN),
    PIPE(Role.TOKEN),
    DOUBLE_ARROW(Role.TOKEN),
    BACKSLASH(Role.TOKEN),
    BACKSLASH2(Role.TOKEN),
    AT(Role.TOKEN),
    /** The five or more dashes of a horizontal rule. */
    DASHES(Role.TOKEN),
    KEYWORD_KEY(Role.TOKEN),
    PLANNING_KEYWORD(Role.TOKEN),
    CLOCK_KEYWORD(Role.TOKEN),
    LIST_ITEM_BULLET(Role.TOKEN),
    LINK_PATH(Role.TOKEN),
    SRC_BLOCK_LANGUAGE(Role.TOKEN),
    SRC_BLOCK_SWITCHES(Role.TOKEN),
    SRC_BLOCK_PARAMETERS(Role.TOKEN),
    EXPORT_BLOCK_TYPE(Role.TOKEN),
    TIMESTAMP_YEAR(Role.TOKEN),
    TIMESTAMP_MONTH(Role.TOKEN),
    TIMESTAMP_DAY(Role.TOKEN),
    TIMESTAMP_DAYNAME(Role.TOKEN),
    TIMESTAMP_HOUR(Role.TOKEN),
    TIMESTAMP_MINUTE(Role.TOKEN),
    TIMESTAMP_REPEATER_MARK(Role.TOKEN),
    TIMESTAMP_DELAY_MARK(Role.TOKEN),
    TIMESTAMP_VALUE(Role.TOKEN),
    TIMESTAMP_UNIT(Role.TOKEN),
    /** The name of an entity, looked up in {@link Entities}. */
    ENTITY_NAME(Role.TOKEN),

    // Document structure.
    DOCUMENT(Role.CONTAINER),
    SECTION(Role.CONTAINER),
    HEADLINE(Role.CONTAINER),
    HEADLINE_TITLE(Role.CONTAINER),
    HEADLINE_TAGS(Role.OPAQUE),
    HEADLINE_PRIORITY(Role.OPAQUE),
    PLANNING(Role.CONTAINER),
    PLANNING_DEADLINE(Role.TRANSPARENT),
    PLANNING_SCHEDULED(Role.TRANSPARENT),
    PLANNING_CLOSED(Role.TRANSPARENT),
    PROPERTY_DRAWER(Role.CONTAINER),
    NODE_PROPERTY(Role.CONTAINER),

    // Elements.
    PARAGRAPH(Role.CONTAINER),
    KEYWORD(Role.CONTAINER),
    AFFILIATED_KEYWORD(Role.CONTAINER),
    BABEL_CALL(Role.CONTAINER),
    DRAWER(Role.CONTAINER),
    DRAWER_BEGIN(Role.OPAQUE),
    DRAWER_CONTENT(Role.TRANSPARENT),
    DRAWER_END(Role.OPAQUE),
    SOURCE_BLOCK(Role.CONTAINER),
    EXPORT_BLOCK(Role.CONTAINER),
    EXAMPLE_BLOCK(Role.CONTAINER),
    COMMENT_BLOCK(Role.CONTAINER),
    QUOTE_BLOCK(Role.CONTAINER),
    CENTER_BLOCK(Role.CONTAINER),
    VERSE_BLOCK(Role.CONTAINER),
    SPECIAL_BLOCK(Role.CONTAINER),
    DYN_BLOCK(Role.CONTAINER),
    BLOCK_BEGIN(Role.OPAQUE),
    BLOCK_CONTENT(Role.TRANSPARENT),
    BLOCK_END(Role.OPAQUE),
    LIST(Role.CONTAINER),
    LIST_ITEM(Role.CONTAINER),
    LIST_ITEM_COUNTER(Role.OPAQUE),
    LIST_ITEM_CHECK_BOX(Role.OPAQUE),
    LIST_ITEM_TAG(Role.CONTAINER),
    LIST_ITEM_CONTENT(Role.TRANSPARENT),
    ORG_TABLE(Role.CONTAINER),
    ORG_TABLE_RULE_ROW(Role.CONTAINER),
    ORG_TABLE_STANDARD_ROW(Role.CONTAINER),
    ORG_TABLE_CELL(Role.CONTAINER),
    COMMENT(Role.CONTAINER),
    FIXED_WIDTH(Role.CONTAINER),
    RULE(Role.CONTAINER),
    CLOCK(Role.CONTAINER),
    FN_DEF(Role.CONTAINER),

    // Objects.
    BOLD(Role.CONTAINER),
    ITALIC(Role.CONTAINER),
    UNDERLINE(Role.CONTAINER),
    STRIKE(Role.CONTAINER),
    VERBATIM(Role.CONTAINER),
    CODE(Role.CONTAINER),
    LINK(Role.CONTAINER),
    FN_REF(Role.CONTAINER),
    MACROS(Role.CONTAINER),
    TIMESTAMP_ACTIVE(Role.CONTAINER),
    TIMESTAMP_INACTIVE(Role.CONTAINER),
    TIMESTAMP_DIARY(Role.CONTAINER),
    COOKIE(Role.CONTAINER),
    TARGET(Role.CONTAINER),
    SNIPPET(Role.CONTAINER),
    INLINE_CALL(Role.CONTAINER),
    INLINE_SRC(Role.CONTAINER),
    LINE_BREAK(Role.CONTAINER),
    SUBSCRIPT(Role.CONTAINER),
    SUPERSCRIPT(Role.CONTAINER),
    ENTITY(Role.CONTAINER),
    /** A cloze deletion, {@code {{text}{hint}@id}}, parsed only when enabled in the configuration. */
    CLOZE(Role.CONTAINER);

    SyntaxKind(final Role role) {
        this.role = role;
    }

    public Role role() {
        return role;
    }

    public boolean isToken() {
        return role == Role.TOKEN;
    }

    private final Role role;

    /**
     * How the traversal engine treats elements of a kind.
     */
    public enum Role {
        /** A leaf; never has children. */
        TOKEN,
        /** A node surfaced with enter and leave events, whose children are visited. */
        CONTAINER,
        /** A node that isn't surfaced, but whose children are visited as if they were its parent's. */
        TRANSPARENT,
        /** A node that is neither surfaced nor descended into. Its text still takes part in serialization. */
        OPAQUE,
    }
}
