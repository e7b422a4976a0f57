// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant;

import java.util.ArrayList;
import java.util.List;
import verdant.ast.AstNode;
import verdant.ast.Document;
import verdant.ast.Keyword;
import verdant.config.ParseConfig;
import verdant.edit.IncrementalReparser;
import verdant.export.Event;
import verdant.export.HtmlExport;
import verdant.export.MarkdownExport;
import verdant.export.Traversal;
import verdant.export.TraversalContext;
import verdant.export.Traverser;
import verdant.parser.Parser;
import verdant.syntax.GreenNode;
import verdant.syntax.SyntaxNode;
import verdant.syntax.TextRange;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One version of a parsed Org document.
 * <p>
 * An {@code Org} is immutable: {@link #replaceRange} returns a new version and leaves this one, and every view and
 * node obtained from it, untouched. Versions share the subtrees an edit didn't affect. Offsets are UTF-16 code unit
 * offsets into {@link #text()}.
 */
public final class Org {
    private Org(final GreenNode green, final ParseConfig config) {
        this.green = green;
        this.config = config;
        root = SyntaxNode.root(green);
    }

    /**
     * Parses the given text with the default configuration.
     */
    public static Org parse(final String text) {
        return parse(text, ParseConfig.defaults());
    }

    /**
     * Parses the given text. Parsing never fails; text that forms no recognized construct becomes plain text.
     */
    public static Org parse(final String text, final ParseConfig config) {
        return new Org(Parser.parse(text, config), config);
    }

    /**
     * Returns the configuration the document was parsed with, which is also used to reparse edited parts.
     */
    public ParseConfig config() {
        return config;
    }

    public GreenNode green() {
        return green;
    }

    /**
     * Returns the root node, of kind {@code DOCUMENT}.
     */
    public SyntaxNode root() {
        return root;
    }

    public Document document() {
        return new Document(root);
    }

    /**
     * Returns the text of the document, which is exactly the text it was parsed from, with edits applied.
     */
    public String text() {
        return root.text();
    }

    /**
     * Serializes the document back to Org. This is always identical to {@link #text()}.
     */
    public String toOrg() {
        return text();
    }

    /**
     * Renders the document to HTML with the default renderers.
     */
    public String toHtml() {
        return toHtml(HtmlExport.defaults());
    }

    public String toHtml(final HtmlExport export) {
        return export.render(root);
    }

    /**
     * Renders the document to CommonMark.
     */
    public String toMarkdown() {
        return MarkdownExport.render(root);
    }

    /**
     * Walks the whole tree, passing the events to the given traverser.
     */
    public void traverse(final Traverser traverser) {
        Traversal.walk(root, traverser);
    }

    /**
     * Returns the first node of the given view type in document order, or {@code null} if there's none.
     */
    public <N extends AstNode> @Nullable N firstNode(final Class<N> type) {
        final var result = new ArrayList<N>(1);
        traverse((final Event event, final TraversalContext context) -> {
            if (event instanceof Event.Enter enter && type.isInstance(enter.node())) {
                result.add(type.cast(enter.node()));
                context.stop();
            }
        });
        return result.isEmpty() ? null : result.get(0);
    }

    /**
     * Returns every node of the given view type, in document order.
     */
    public <N extends AstNode> List<N> nodes(final Class<N> type) {
        final var result = new ArrayList<N>();
        traverse((final Event event, final TraversalContext context) -> {
            if (event instanceof Event.Enter enter && type.isInstance(enter.node())) {
                result.add(type.cast(enter.node()));
            }
        });
        return result;
    }

    /**
     * Returns the innermost node of the given view type whose range contains the given offset, or {@code null}.
     */
    public <N extends AstNode> @Nullable N nodeAtOffset(final Class<N> type, final int offset) {
        final var result = new ArrayList<N>(1);
        traverse((final Event event, final TraversalContext context) -> {
            if (event instanceof Event.Enter enter) {
                final var node = enter.node();
                if (!node.textRange().contains(offset)) {
                    context.skip();
                } else if (type.isInstance(node)) {
                    result.add(type.cast(node));
                }
            }
        });
        return result.isEmpty() ? null : result.get(result.size() - 1);
    }

    /**
     * Returns the values of the {@code #+TITLE} keywords before the first headline, or {@code null}.
     */
    public @Nullable String title() {
        return document().title();
    }

    /**
     * Returns the keywords before the first headline.
     */
    public List<Keyword> keywords() {
        return document().keywords();
    }

    /**
     * Returns a new version of the document with the given range replaced by {@code replacement}.
     * <p>
     * If the range doesn't lie within the document, {@link verdant.edit.EditRangeErrorCondition} is signaled as
     * fatal.
     */
    @CheckReturnValue
    public Org replaceRange(final TextRange range, final String replacement) {
        return replaceRange(range.start(), range.end(), replacement);
    }

    /**
     * Returns a new version of the document with the text between {@code start} and {@code end} replaced by
     * {@code replacement}.
     * <p>
     * If the range doesn't lie within the document, {@link verdant.edit.EditRangeErrorCondition} is signaled as
     * fatal.
     */
    @CheckReturnValue
    public Org replaceRange(final int start, final int end, final String replacement) {
        return new Org(IncrementalReparser.replaceRange(root, config, start, end, replacement), config);
    }

    @Override
    public String toString() {
        return "Org[" + green.textLength() + " characters]";
    }

    private final GreenNode green;
    private final ParseConfig config;
    private final SyntaxNode root;
}
