// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.export;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import verdant.ast.Cloze;
import verdant.ast.Comment;
import verdant.ast.CommentBlock;
import verdant.ast.Cookie;
import verdant.ast.Entity;
import verdant.ast.ExportBlock;
import verdant.ast.FixedWidth;
import verdant.ast.FnDef;
import verdant.ast.FnRef;
import verdant.ast.Headline;
import verdant.ast.InlineSrc;
import verdant.ast.Link;
import verdant.ast.ListItem;
import verdant.ast.ListItemTag;
import verdant.ast.OrgTable;
import verdant.ast.OrgTableCell;
import verdant.ast.OrgTableRow;
import verdant.ast.PlainList;
import verdant.ast.Snippet;
import verdant.ast.SourceBlock;
import verdant.ast.SpecialBlock;
import verdant.ast.Target;
import verdant.ast.Timestamp;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The default renderers of {@link HtmlExport}.
 */
final class HtmlDefaults {
    private HtmlDefaults() {
    }

    static EnumMap<SyntaxKind, HtmlRenderer> renderers() {
        final var map = new EnumMap<SyntaxKind, HtmlRenderer>(SyntaxKind.class);
        map.put(SyntaxKind.DOCUMENT, HtmlRenderer.element("main"));
        map.put(SyntaxKind.HEADLINE, HtmlRenderer.typed(Headline.class, HtmlDefaults::headline));
        map.put(SyntaxKind.HEADLINE_TITLE, HtmlRenderer.suppressed());
        map.put(SyntaxKind.SECTION, HtmlRenderer.element("section"));
        map.put(SyntaxKind.PARAGRAPH, HtmlRenderer.element("p"));

        map.put(SyntaxKind.BOLD, HtmlRenderer.element("b"));
        map.put(SyntaxKind.ITALIC, HtmlRenderer.element("i"));
        map.put(SyntaxKind.UNDERLINE, HtmlRenderer.element("u"));
        map.put(SyntaxKind.STRIKE, HtmlRenderer.element("s"));
        map.put(SyntaxKind.VERBATIM, HtmlRenderer.element("code"));
        map.put(SyntaxKind.CODE, HtmlRenderer.element("code"));
        map.put(SyntaxKind.SUBSCRIPT, HtmlRenderer.element("sub"));
        map.put(SyntaxKind.SUPERSCRIPT, HtmlRenderer.element("sup"));
        map.put(SyntaxKind.LINE_BREAK, HtmlRenderer.emptyElement("br"));
        map.put(SyntaxKind.RULE, HtmlRenderer.emptyElement("hr"));
        map.put(SyntaxKind.LINK, HtmlRenderer.typed(Link.class, HtmlDefaults::link, HtmlDefaults::linkEnd));
        map.put(SyntaxKind.TIMESTAMP_ACTIVE, HtmlRenderer.typed(Timestamp.class, HtmlDefaults::timestamp));
        map.put(SyntaxKind.TIMESTAMP_INACTIVE, HtmlRenderer.typed(Timestamp.class, HtmlDefaults::timestamp));
        map.put(SyntaxKind.TIMESTAMP_DIARY, HtmlRenderer.typed(Timestamp.class, HtmlDefaults::timestamp));
        map.put(SyntaxKind.SNIPPET, HtmlRenderer.typed(Snippet.class, HtmlDefaults::snippet));
        map.put(SyntaxKind.FN_REF, HtmlRenderer.typed(FnRef.class, HtmlDefaults::footnoteReference));
        map.put(SyntaxKind.FN_DEF, HtmlRenderer.typed(FnDef.class, HtmlDefaults::footnoteDefinition));
        map.put(SyntaxKind.TARGET, HtmlRenderer.typed(Target.class, HtmlDefaults::target));
        map.put(SyntaxKind.COOKIE, HtmlRenderer.typed(Cookie.class, HtmlDefaults::cookie));
        map.put(SyntaxKind.INLINE_SRC, HtmlRenderer.typed(InlineSrc.class, HtmlDefaults::inlineSource));
        map.put(SyntaxKind.ENTITY, HtmlRenderer.typed(
            Entity.class,
            (final Entity entity, final HtmlContext context) -> {
                context.out().raw(entity.html());
                context.skip();
            }
        ));
        map.put(SyntaxKind.CLOZE, HtmlRenderer.typed(
            Cloze.class,
            (final Cloze cloze, final HtmlContext context) -> {
                context.out().startTag("span", HtmlWriter.Attribute.of("class", "cloze"));
                context.renderAll(cloze.text());
                context.out().endTag("span");
                context.skip();
            }
        ));

        map.put(SyntaxKind.SOURCE_BLOCK, HtmlRenderer.typed(
            SourceBlock.class,
            HtmlDefaults::sourceBlock,
            (final SourceBlock block, final HtmlContext context) -> context.out().endTag("code").endTag("pre")
        ));
        map.put(SyntaxKind.EXAMPLE_BLOCK, HtmlRenderer.element("pre", HtmlWriter.Attribute.of("class", "example")));
        map.put(SyntaxKind.EXPORT_BLOCK, HtmlRenderer.typed(ExportBlock.class, HtmlDefaults::exportBlock));
        map.put(SyntaxKind.QUOTE_BLOCK, HtmlRenderer.element("blockquote"));
        map.put(SyntaxKind.CENTER_BLOCK, HtmlRenderer.element("div", HtmlWriter.Attribute.of("class", "center")));
        map.put(SyntaxKind.VERSE_BLOCK, HtmlRenderer.element("p", HtmlWriter.Attribute.of("class", "verse")));
        map.put(SyntaxKind.SPECIAL_BLOCK, HtmlRenderer.typed(
            SpecialBlock.class,
            (final SpecialBlock block, final HtmlContext context) ->
                context.out().startTag("div", HtmlWriter.Attribute.of("class", block.name().toLowerCase(Locale.ROOT))),
            (final SpecialBlock block, final HtmlContext context) -> context.out().endTag("div")
        ));
        map.put(SyntaxKind.COMMENT_BLOCK, HtmlRenderer.typed(
            CommentBlock.class,
            (final CommentBlock block, final HtmlContext context) -> comment(block.value(), context)
        ));
        map.put(SyntaxKind.COMMENT, HtmlRenderer.typed(
            Comment.class,
            (final Comment comment, final HtmlContext context) -> comment(comment.value(), context)
        ));
        map.put(SyntaxKind.FIXED_WIDTH, HtmlRenderer.typed(
            FixedWidth.class,
            (final FixedWidth fixedWidth, final HtmlContext context) -> {
                context.out()
                    .startTag("pre", HtmlWriter.Attribute.of("class", "example"))
                    .text(fixedWidth.value())
                    .endTag("pre");
                context.skip();
            }
        ));

        map.put(SyntaxKind.LIST, HtmlRenderer.typed(
            PlainList.class,
            (final PlainList list, final HtmlContext context) -> context.out().startTag(listElement(list)),
            (final PlainList list, final HtmlContext context) -> context.out().endTag(listElement(list))
        ));
        map.put(SyntaxKind.LIST_ITEM, HtmlRenderer.typed(
            ListItem.class,
            HtmlDefaults::listItem,
            HtmlDefaults::listItemEnd
        ));
        map.put(SyntaxKind.LIST_ITEM_TAG, HtmlRenderer.typed(
            ListItemTag.class,
            (final ListItemTag tag, final HtmlContext context) -> {
                context.out().startTag("dt");
                final var parent = tag.syntax().parent();
                final var item = (parent == null) ? null : ListItem.cast(parent);
                if (item != null) {
                    checkBox(item, context);
                }
            },
            (final ListItemTag tag, final HtmlContext context) -> context.out().endTag("dt").startTag("dd")
        ));

        map.put(SyntaxKind.ORG_TABLE, HtmlRenderer.element("table"));
        map.put(SyntaxKind.ORG_TABLE_RULE_ROW, HtmlRenderer.suppressed());
        map.put(SyntaxKind.ORG_TABLE_STANDARD_ROW, HtmlRenderer.typed(
            OrgTableRow.class,
            HtmlDefaults::tableRow,
            HtmlDefaults::tableRowEnd
        ));
        map.put(SyntaxKind.ORG_TABLE_CELL, HtmlRenderer.typed(
            OrgTableCell.class,
            (final OrgTableCell cell, final HtmlContext context) -> context.out().startTag(cellElement(cell)),
            (final OrgTableCell cell, final HtmlContext context) -> context.out().endTag(cellElement(cell))
        ));

        for (final var kind : SUPPRESSED) {
            map.put(kind, HtmlRenderer.suppressed());
        }
        return map;
    }

    // The title is rendered here, so that headlines without one still get their heading element.
    private static void headline(final Headline headline, final HtmlContext context) {
        if (headline.isCommented()) {
            context.skip();
            return;
        }
        final var heading = "h" + Math.max(1, Math.min(headline.level(), 6));
        context.out().startTag(heading);
        final var title = headline.title();
        if (title != null) {
            context.renderAll(title.syntax().childrenWithTokens());
        }
        context.out().endTag(heading);
    }

    private static void link(final Link link, final HtmlContext context) {
        final var path = link.path().startsWith("file:") ? link.path().substring(5) : link.path();
        final var out = context.out();
        if (link.isImage()) {
            out.emptyTag("img", HtmlWriter.Attribute.of("src", path));
            context.skip();
            return;
        }
        out.startTag("a", HtmlWriter.Attribute.of("href", path));
        if (!link.hasDescription()) {
            out.text(path).endTag("a");
            context.skip();
        }
    }

    private static void linkEnd(final Link link, final HtmlContext context) {
        context.out().endTag("a");
    }

    // The en dash between the two ends of a range is written as a character reference.
    private static void timestamp(final Timestamp timestamp, final HtmlContext context) {
        final var out = context.out();
        out.startTag("span", HtmlWriter.Attribute.of("class", "timestamp-wrapper"))
            .startTag("span", HtmlWriter.Attribute.of("class", "timestamp"));
        for (final var token : timestamp.syntax().leaves()) {
            if (token.kind() == SyntaxKind.MINUS2) {
                out.raw("&#x2013;");
            } else {
                out.text(token.text());
            }
        }
        out.endTag("span").endTag("span");
        context.skip();
    }

    private static void snippet(final Snippet snippet, final HtmlContext context) {
        if (snippet.backend().equalsIgnoreCase("html")) {
            context.out().raw(snippet.value());
        }
        context.skip();
    }

    private static void footnoteReference(final FnRef reference, final HtmlContext context) {
        final var label = reference.label();
        final var out = context.out().startTag("sup");
        if (label == null) {
            final var definition = reference.definitionRaw();
            out.text((definition == null) ? "" : definition);
        } else {
            out.startTag(
                "a",
                HtmlWriter.Attribute.of("id", "fnr." + label),
                HtmlWriter.Attribute.of("class", "footref"),
                HtmlWriter.Attribute.of("href", "#fn." + label)
            ).text(label).endTag("a");
        }
        out.endTag("sup");
        context.skip();
    }

    // The definition's contents are everything after the label's closing bracket.
    private static void footnoteDefinition(final FnDef definition, final HtmlContext context) {
        final var label = definition.label();
        context.out()
            .startTag("div", HtmlWriter.Attribute.of("class", "footdef"))
            .startTag("sup")
            .startTag(
                "a",
                HtmlWriter.Attribute.of("id", "fn." + label),
                HtmlWriter.Attribute.of("class", "footnum"),
                HtmlWriter.Attribute.of("href", "#fnr." + label)
            )
            .text(label)
            .endTag("a")
            .endTag("sup")
            .startTag("div", HtmlWriter.Attribute.of("class", "footpara"));
        boolean inContents = false;
        for (final var child : definition.syntax().childrenWithTokens()) {
            if (inContents) {
                context.render(child);
            } else if (child.kind() == SyntaxKind.R_BRACKET) {
                inContents = true;
            }
        }
        context.out().endTag("div").endTag("div");
        context.skip();
    }

    private static void target(final Target target, final HtmlContext context) {
        context.out().startTag("span", HtmlWriter.Attribute.of("id", target.target())).endTag("span");
        context.skip();
    }

    private static void cookie(final Cookie cookie, final HtmlContext context) {
        context.out().text(cookie.raw());
        context.skip();
    }

    private static void inlineSource(final InlineSrc source, final HtmlContext context) {
        context.out()
            .startTag("code", HtmlWriter.Attribute.of("class", "src src-" + source.language()))
            .text(source.body())
            .endTag("code");
        context.skip();
    }

    private static void sourceBlock(final SourceBlock block, final HtmlContext context) {
        final var language = block.language();
        context.out().startTag("pre");
        if (language == null || language.isEmpty()) {
            context.out().startTag("code");
        } else {
            context.out().startTag("code", HtmlWriter.Attribute.of("class", "language-" + language));
        }
    }

    private static void exportBlock(final ExportBlock block, final HtmlContext context) {
        if (block.type().equalsIgnoreCase("html")) {
            context.out().raw(block.value());
        }
        context.skip();
    }

    private static void comment(final String text, final HtmlContext context) {
        context.out().raw("<!--").text(text).raw("-->");
        context.skip();
    }

    private static String listElement(final PlainList list) {
        if (list.isOrdered()) {
            return "ol";
        }
        return list.isDescriptive() ? "dl" : "ul";
    }

    // Items with a tag are rendered as <dt>…</dt><dd>…</dd>, the tag renderer writing everything up to <dd>.
    private static void listItem(final ListItem item, final HtmlContext context) {
        if (item.tag() == null) {
            context.out().startTag("li");
            checkBox(item, context);
        }
    }

    private static void listItemEnd(final ListItem item, final HtmlContext context) {
        context.out().endTag((item.tag() == null) ? "li" : "dd");
    }

    private static void checkBox(final ListItem item, final HtmlContext context) {
        final var checkBox = item.checkbox();
        if (checkBox == null) {
            return;
        }
        final var mark = switch (checkBox) {
            case ON -> "X";
            case OFF -> "&#xa0;";
            case TRANSITIONAL -> "-";
        };
        context.out().startTag("code").raw("[" + mark + "]").endTag("code").raw(" ");
    }

    private static void tableRow(final OrgTableRow row, final HtmlContext context) {
        final var rows = standardRows(row);
        final var index = rows.indexOf(row);
        final var previous = (index > 0) ? rows.get(index - 1) : null;
        if (row.isHeader() && previous == null) {
            context.out().startTag("thead");
        } else if (!row.isHeader() && (previous == null || previous.isHeader())) {
            context.out().startTag("tbody");
        }
        context.out().startTag("tr");
    }

    private static void tableRowEnd(final OrgTableRow row, final HtmlContext context) {
        context.out().endTag("tr");
        final var rows = standardRows(row);
        final var index = rows.indexOf(row);
        final @Nullable OrgTableRow next = (index + 1 < rows.size()) ? rows.get(index + 1) : null;
        if (row.isHeader() && (next == null || !next.isHeader())) {
            context.out().endTag("thead");
        } else if (!row.isHeader() && next == null) {
            context.out().endTag("tbody");
        }
    }

    private static List<OrgTableRow> standardRows(final OrgTableRow row) {
        final @Nullable SyntaxNode parent = row.syntax().parent();
        final var table = (parent == null) ? null : OrgTable.cast(parent);
        return (table == null) ? List.of(row) : table.standardRows();
    }

    private static String cellElement(final OrgTableCell cell) {
        final var parent = cell.syntax().parent();
        final var row = (parent == null) ? null : OrgTableRow.cast(parent);
        return (row != null && row.isHeader()) ? "th" : "td";
    }

    private static final SyntaxKind[] SUPPRESSED = {
        SyntaxKind.KEYWORD,
        SyntaxKind.AFFILIATED_KEYWORD,
        SyntaxKind.BABEL_CALL,
        SyntaxKind.PLANNING,
        SyntaxKind.PROPERTY_DRAWER,
        SyntaxKind.NODE_PROPERTY,
        SyntaxKind.DRAWER,
        SyntaxKind.CLOCK,
        SyntaxKind.MACROS,
        SyntaxKind.INLINE_CALL,
    };
}
