// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.export;

import java.util.EnumMap;
import verdant.ast.AstNode;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The HTML renderer: a table from container kinds to {@link HtmlRenderer}s, driven by a {@link Traversal}.
 * <p>
 * The defaults map the document to {@code <main>}, headlines to {@code <h1>} through {@code <h6>} holding their
 * titles, sections to {@code <section>}, paragraphs to {@code <p>} and so on; keywords, planning lines, drawers and
 * property drawers produce no output. Containers of kinds without a renderer are rendered as their children. Any
 * kind can be overridden through {@link #toBuilder()}.
 * <p>
 * Instances are immutable and can be used from multiple threads.
 */
public final class HtmlExport {
    private HtmlExport(final EnumMap<SyntaxKind, HtmlRenderer> renderers) {
        this.renderers = new EnumMap<>(renderers);
    }

    /**
     * Returns the export with the default renderers.
     */
    public static HtmlExport defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a builder initialized with the default renderers.
     */
    public static Builder builder() {
        return DEFAULTS.toBuilder();
    }

    /**
     * Returns a builder initialized with this export's renderers.
     */
    public Builder toBuilder() {
        return new Builder(renderers);
    }

    /**
     * Returns the renderer for the given kind, or {@code null} if containers of that kind are rendered as their
     * children.
     */
    public @Nullable HtmlRenderer renderer(final SyntaxKind kind) {
        return renderers.get(kind);
    }

    /**
     * Renders the subtree rooted at the given node.
     */
    public String render(final SyntaxNode node) {
        final var out = new HtmlWriter();
        renderTo(node, out);
        return out.toString();
    }

    /**
     * Renders the subtree of the given view.
     */
    public String render(final AstNode node) {
        return render(node.syntax());
    }

    void renderTo(final SyntaxNode node, final HtmlWriter out) {
        final var context = new HtmlContext(this, out);
        Traversal.walk(node, (final Event event, final TraversalContext traversal) -> {
            context.bind(traversal);
            if (event instanceof Event.Enter enter) {
                final var renderer = renderers.get(enter.node().kind());
                if (renderer != null) {
                    renderer.enter(enter.node(), context);
                }
            } else if (event instanceof Event.Leave leave) {
                final var renderer = renderers.get(leave.node().kind());
                if (renderer != null) {
                    renderer.leave(leave.node(), context);
                }
            } else if (event instanceof Event.Text text) {
                out.text(text.token().text());
            }
        });
    }

    private static final HtmlExport DEFAULTS = new HtmlExport(HtmlDefaults.renderers());

    private final EnumMap<SyntaxKind, HtmlRenderer> renderers;

    /**
     * A mutable set of renderers from which exports are built.
     */
    public static final class Builder {
        private Builder(final EnumMap<SyntaxKind, HtmlRenderer> renderers) {
            this.renderers = new EnumMap<>(renderers);
        }

        /**
         * Sets the renderer of containers of the given kind.
         *
         * @throws IllegalArgumentException if the kind isn't a container kind
         */
        public Builder override(final SyntaxKind kind, final HtmlRenderer renderer) {
            if (kind.role() != SyntaxKind.Role.CONTAINER) {
                throw new IllegalArgumentException("Not a container kind: " + kind);
            }
            renderers.put(kind, renderer);
            return this;
        }

        /**
         * Makes containers of the given kind produce no output at all.
         */
        public Builder suppress(final SyntaxKind kind) {
            return override(kind, HtmlRenderer.suppressed());
        }

        /**
         * Makes containers of the given kind render as their children.
         */
        public Builder unwrap(final SyntaxKind kind) {
            return override(kind, HtmlRenderer.transparent());
        }

        public HtmlExport build() {
            return new HtmlExport(renderers);
        }

        private final EnumMap<SyntaxKind, HtmlRenderer> renderers;
    }
}
