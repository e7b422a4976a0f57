// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.export;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import verdant.ast.AstNode;
import verdant.ast.Code;
import verdant.ast.Entity;
import verdant.ast.ExampleBlock;
import verdant.ast.ExportBlock;
import verdant.ast.FixedWidth;
import verdant.ast.FnDef;
import verdant.ast.FnRef;
import verdant.ast.Headline;
import verdant.ast.HeadlineTitle;
import verdant.ast.InlineSrc;
import verdant.ast.Link;
import verdant.ast.ListItem;
import verdant.ast.OrgTable;
import verdant.ast.OrgTableRow;
import verdant.ast.PlainList;
import verdant.ast.Snippet;
import verdant.ast.SourceBlock;
import verdant.ast.Timestamp;
import verdant.ast.Verbatim;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import verdant.syntax.SyntaxToken;
import verdant.util.UnreachableCodeReachedError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A traverser producing CommonMark, with GitHub-style tables and footnotes.
 * <p>
 * Text is written as is, without escaping Markdown syntax characters. Keywords, drawers, planning lines, comments and
 * macros produce no output. Quote blocks and list items are rendered into separate buffers, which are then indented
 * or prefixed as a whole when the container is left.
 * <p>
 * An instance accumulates the output of every walk it takes part in; use {@link #render} for one-off rendering.
 */
public final class MarkdownExport implements Traverser {
    public MarkdownExport() {
        buffers.add(new StringBuilder());
    }

    /**
     * Renders the subtree rooted at the given node.
     */
    public static String render(final SyntaxNode node) {
        final var export = new MarkdownExport();
        Traversal.walk(node, export);
        return export.finish();
    }

    /**
     * Returns the output, ending in a single newline unless it's empty.
     */
    public String finish() {
        if (buffers.size() != 1) {
            throw new IllegalStateException("Unfinished containers: " + (buffers.size() - 1));
        }
        final var output = buffers.get(0).toString().stripTrailing();
        return output.isEmpty() ? output : output + "\n";
    }

    @Override
    public boolean tokenLevel() {
        return true;
    }

    @Override
    public void event(final Event event, final TraversalContext context) {
        if (event instanceof Event.Enter enter) {
            enter(enter.node(), context);
        } else if (event instanceof Event.Leave leave) {
            leave(leave.node());
        } else if (event instanceof Event.Text text) {
            if (!inFootnoteLabel && !inClozeExtras) {
                out().append(text.token().text());
            }
        } else if (event instanceof Event.Token token) {
            token(token.token());
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private void enter(final AstNode node, final TraversalContext context) {
        final var out = out();
        if (SKIPPED.contains(node.kind())) {
            context.skip();
        } else if (node instanceof Headline headline) {
            if (headline.isCommented()) {
                context.skip();
            } else if (headline.title() == null) {
                out.append("#".repeat(Math.max(1, Math.min(headline.level(), 6)))).append("\n\n");
            }
        } else if (node instanceof HeadlineTitle title) {
            out.append("#".repeat(Math.max(1, Math.min(title.level(), 6)))).append(' ');
        } else if (node instanceof Verbatim verbatim) {
            inlineCode(verbatim.value(), context);
        } else if (node instanceof Code code) {
            inlineCode(code.value(), context);
        } else if (node instanceof InlineSrc source) {
            inlineCode(source.body(), context);
        } else if (node instanceof Link link) {
            link(link, context);
        } else if (node instanceof Entity entity) {
            out.append(entity.utf8());
            context.skip();
        } else if (node instanceof Timestamp timestamp) {
            out.append(timestamp.raw());
            context.skip();
        } else if (node instanceof Snippet snippet) {
            if (isRawBackend(snippet.backend())) {
                out.append(snippet.value());
            }
            context.skip();
        } else if (node instanceof FnRef reference) {
            final var label = reference.label();
            out.append("[^").append((label == null) ? "" : label).append(']');
            context.skip();
        } else if (node instanceof FnDef definition) {
            out.append("[^").append(definition.label()).append("]: ");
            inFootnoteLabel = true;
        } else if (node instanceof SourceBlock block) {
            final var language = block.language();
            fence((language == null) ? "" : language, block.value(), context);
        } else if (node instanceof ExampleBlock block) {
            fence("", block.value(), context);
        } else if (node instanceof FixedWidth fixedWidth) {
            fence("", fixedWidth.value(), context);
        } else if (node instanceof ExportBlock block) {
            if (isRawBackend(block.type())) {
                out.append(block.value()).append('\n');
            }
            context.skip();
        } else if (node instanceof ListItem item) {
            buffers.add(new StringBuilder());
            checkBox(item);
        } else if (node instanceof OrgTableRow row) {
            if (row.isRule()) {
                context.skip();
            } else {
                out.append('|');
            }
        } else {
            switch (node.kind()) {
                case BOLD -> out.append("**");
                case ITALIC -> out.append('*');
                case STRIKE -> out.append("~~");
                case UNDERLINE -> out.append("<u>");
                case SUBSCRIPT -> out.append("<sub>");
                case SUPERSCRIPT -> out.append("<sup>");
                case LIST_ITEM_TAG -> out.append("**");
                case ORG_TABLE_CELL -> out.append(' ');
                case QUOTE_BLOCK -> buffers.add(new StringBuilder());
                case LINE_BREAK -> out.append('\\');
                case RULE -> {
                    out.append("---\n\n");
                    context.skip();
                }
                case COOKIE -> {
                    out.append(node.raw());
                    context.skip();
                }
                default -> {
                }
            }
        }
    }

    private void leave(final AstNode node) {
        if (node instanceof ListItem item) {
            final var content = buffers.remove(buffers.size() - 1).toString().strip();
            final var marker = bulletMarker(item);
            final var indent = " ".repeat(marker.length());
            final var out = out();
            out.append(marker);
            appendIndented(out, content, indent);
            out.append('\n');
            return;
        }
        if (node instanceof OrgTableRow row) {
            out().append('\n');
            if (isLastHeaderRow(row)) {
                final var table = tableOf(row);
                final var columns = (table == null) ? row.cells().size() : table.columnCount();
                out().append("|").append(" --- |".repeat(Math.max(1, columns))).append('\n');
            }
            return;
        }
        final var out = out();
        switch (node.kind()) {
            case HEADLINE_TITLE, PARAGRAPH, VERSE_BLOCK -> out.append("\n\n");
            case BOLD -> out.append("**");
            case ITALIC -> out.append('*');
            case STRIKE -> out.append("~~");
            case UNDERLINE -> out.append("</u>");
            case SUBSCRIPT -> out.append("</sub>");
            case SUPERSCRIPT -> out.append("</sup>");
            case LIST_ITEM_TAG -> out.append("**: ");
            case ORG_TABLE_CELL -> out.append(" |");
            case LIST, ORG_TABLE -> out.append('\n');
            case FN_DEF -> out.append("\n\n");
            case CLOZE -> inClozeExtras = false;
            case LINK -> {
                final var link = (Link) node;
                out.append("](").append(linkPath(link)).append(')');
            }
            case QUOTE_BLOCK -> {
                final var content = buffers.remove(buffers.size() - 1).toString().strip();
                final var quoted = out();
                quoted.append("> ");
                appendIndented(quoted, content, "> ");
                quoted.append("\n\n");
            }
            default -> {
            }
        }
    }

    // Only the text after a footnote definition's label is its contents, and only the text before the first closing
    // brace of a cloze is its answer.
    private void token(final SyntaxToken token) {
        if (inFootnoteLabel && token.kind() == SyntaxKind.R_BRACKET) {
            inFootnoteLabel = false;
        } else if (token.kind() == SyntaxKind.R_CURLY && token.parent().kind() == SyntaxKind.CLOZE) {
            inClozeExtras = true;
        }
    }

    private void link(final Link link, final TraversalContext context) {
        final var out = out();
        final var path = linkPath(link);
        if (link.isImage()) {
            out.append("![](").append(path).append(')');
            context.skip();
        } else if (!link.hasDescription()) {
            out.append('<').append(path).append('>');
            context.skip();
        } else {
            out.append('[');
        }
    }

    private static String linkPath(final Link link) {
        final var path = link.path();
        return path.startsWith("file:") ? path.substring(5) : path;
    }

    private void inlineCode(final String value, final TraversalContext context) {
        final var fence = value.contains("`") ? "``" : "`";
        final var padding = (value.startsWith("`") || value.endsWith("`")) ? " " : "";
        out().append(fence).append(padding).append(value).append(padding).append(fence);
        context.skip();
    }

    private void fence(final String info, final String value, final TraversalContext context) {
        final var out = out();
        out.append("```").append(info).append('\n').append(value);
        if (!value.isEmpty() && !value.endsWith("\n")) {
            out.append('\n');
        }
        out.append("```\n\n");
        context.skip();
    }

    private void checkBox(final ListItem item) {
        final var checkBox = item.checkbox();
        if (checkBox != null) {
            out().append(switch (checkBox) {
                case ON -> "[x] ";
                case OFF -> "[ ] ";
                case TRANSITIONAL -> "[-] ";
            });
        }
    }

    // Ordered items keep their own number; letters are not valid CommonMark markers, so they're numbered by position.
    private static String bulletMarker(final ListItem item) {
        if (!item.isOrdered()) {
            return "- ";
        }
        final var bullet = item.bullet();
        final var number = bullet.substring(0, bullet.length() - 1);
        if (!number.isEmpty() && number.chars().allMatch(Character::isDigit)) {
            return number + ". ";
        }
        final var parent = item.syntax().parent();
        final var list = (parent == null) ? null : PlainList.cast(parent);
        final var position = (list == null) ? 0 : list.items().indexOf(item);
        return (position + 1) + ". ";
    }

    private static boolean isLastHeaderRow(final OrgTableRow row) {
        final var table = tableOf(row);
        if (table == null) {
            return false;
        }
        final var rows = table.standardRows();
        final var index = rows.indexOf(row);
        if (!table.hasHeader()) {
            return index == 0;
        }
        return row.isHeader() && (index + 1 == rows.size() || !rows.get(index + 1).isHeader());
    }

    private static @Nullable OrgTable tableOf(final OrgTableRow row) {
        final var parent = row.syntax().parent();
        return (parent == null) ? null : OrgTable.cast(parent);
    }

    private static boolean isRawBackend(final String backend) {
        return RAW_BACKENDS.contains(backend.toLowerCase(Locale.ROOT));
    }

    private static void appendIndented(final StringBuilder out, final String content, final String indent) {
        final var lines = content.split("\n", -1);
        for (int i = 0; i < lines.length; i += 1) {
            if (i > 0) {
                out.append('\n');
                if (!lines[i].isEmpty() || indent.startsWith(">")) {
                    out.append(indent);
                }
            }
            out.append(lines[i]);
        }
    }

    private StringBuilder out() {
        return buffers.get(buffers.size() - 1);
    }

    private static final Set<SyntaxKind> SKIPPED = EnumSet.of(
        SyntaxKind.KEYWORD,
        SyntaxKind.AFFILIATED_KEYWORD,
        SyntaxKind.BABEL_CALL,
        SyntaxKind.PLANNING,
        SyntaxKind.PROPERTY_DRAWER,
        SyntaxKind.DRAWER,
        SyntaxKind.CLOCK,
        SyntaxKind.COMMENT,
        SyntaxKind.COMMENT_BLOCK,
        SyntaxKind.MACROS,
        SyntaxKind.INLINE_CALL,
        SyntaxKind.TARGET
    );

    private static final Set<String> RAW_BACKENDS = Set.of("md", "markdown", "html");

    private final ArrayList<StringBuilder> buffers = new ArrayList<>();
    private boolean inFootnoteLabel;
    private boolean inClozeExtras;
}
