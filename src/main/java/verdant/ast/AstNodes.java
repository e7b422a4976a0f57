// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Conversions from syntax nodes to views.
 */
public final class AstNodes {
    private AstNodes() {
    }

    /**
     * Returns the view of the given node, or {@code null} if its kind has no view, which is the case for transparent
     * and opaque nodes.
     */
    public static @Nullable AstNode cast(final SyntaxNode node) {
        return switch (node.kind()) {
            case DOCUMENT -> new Document(node);
            case SECTION -> new Section(node);
            case HEADLINE -> new Headline(node);
            case HEADLINE_TITLE -> new HeadlineTitle(node);
            case PLANNING -> new Planning(node);
            case PROPERTY_DRAWER -> new PropertyDrawer(node);
            case NODE_PROPERTY -> new NodeProperty(node);
            case PARAGRAPH -> new Paragraph(node);
            case KEYWORD -> new Keyword(node);
            case AFFILIATED_KEYWORD -> new AffiliatedKeyword(node);
            case BABEL_CALL -> new BabelCall(node);
            case DRAWER -> new Drawer(node);
            case SOURCE_BLOCK -> new SourceBlock(node);
            case EXPORT_BLOCK -> new ExportBlock(node);
            case EXAMPLE_BLOCK -> new ExampleBlock(node);
            case COMMENT_BLOCK -> new CommentBlock(node);
            case QUOTE_BLOCK -> new QuoteBlock(node);
            case CENTER_BLOCK -> new CenterBlock(node);
            case VERSE_BLOCK -> new VerseBlock(node);
            case SPECIAL_BLOCK -> new SpecialBlock(node);
            case DYN_BLOCK -> new DynBlock(node);
            case LIST -> new PlainList(node);
            case LIST_ITEM -> new ListItem(node);
            case LIST_ITEM_TAG -> new ListItemTag(node);
            case ORG_TABLE -> new OrgTable(node);
            case ORG_TABLE_RULE_ROW, ORG_TABLE_STANDARD_ROW -> new OrgTableRow(node);
            case ORG_TABLE_CELL -> new OrgTableCell(node);
            case COMMENT -> new Comment(node);
            case FIXED_WIDTH -> new FixedWidth(node);
            case RULE -> new Rule(node);
            case CLOCK -> new Clock(node);
            case FN_DEF -> new FnDef(node);
            case BOLD -> new Bold(node);
            case ITALIC -> new Italic(node);
            case UNDERLINE -> new Underline(node);
            case STRIKE -> new Strike(node);
            case VERBATIM -> new Verbatim(node);
            case CODE -> new Code(node);
            case LINK -> new Link(node);
            case FN_REF -> new FnRef(node);
            case MACROS -> new Macros(node);
            case TIMESTAMP_ACTIVE, TIMESTAMP_INACTIVE, TIMESTAMP_DIARY -> new Timestamp(node);
            case COOKIE -> new Cookie(node);
            case TARGET -> new Target(node);
            case SNIPPET -> new Snippet(node);
            case INLINE_CALL -> new InlineCall(node);
            case INLINE_SRC -> new InlineSrc(node);
            case LINE_BREAK -> new LineBreak(node);
            case SUBSCRIPT -> new Subscript(node);
            case SUPERSCRIPT -> new Superscript(node);
            case ENTITY -> new Entity(node);
            case CLOZE -> new Cloze(node);
            default -> null;
        };
    }

    /**
     * Returns the view of the given node if it is of the requested type, or {@code null}.
     */
    public static <N extends AstNode> @Nullable N cast(final SyntaxNode node, final Class<N> type) {
        final var view = cast(node);
        return type.isInstance(view) ? type.cast(view) : null;
    }
}
