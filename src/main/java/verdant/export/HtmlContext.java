// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.export;

import java.util.List;
import verdant.syntax.SyntaxElement;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;

/**
 * What an {@link HtmlRenderer} can do while rendering: write output and steer the traversal.
 */
public final class HtmlContext {
    HtmlContext(final HtmlExport export, final HtmlWriter out) {
        this.export = export;
        this.out = out;
    }

    public HtmlWriter out() {
        return out;
    }

    /**
     * Returns the export whose renderers are in use.
     */
    public HtmlExport export() {
        return export;
    }

    /**
     * Skips the children and the leave action of the container being entered.
     */
    public void skip() {
        traversal.skip();
    }

    /**
     * Stops rendering. Elements left open stay open.
     */
    public void stop() {
        traversal.stop();
    }

    /**
     * Renders the given element with the same renderers into the same output. This lets a renderer that skips its
     * container's children still render some of them.
     * <p>
     * A nested rendering is independent: stopping it doesn't stop the rendering it was started from.
     */
    public void render(final SyntaxElement element) {
        if (element instanceof SyntaxNode node) {
            export.renderTo(node, out);
        } else if (element.kind() == SyntaxKind.TEXT) {
            out.text(element.text());
        }
    }

    /**
     * Renders the given elements in order, as {@link #render(SyntaxElement)} does.
     */
    public void renderAll(final List<? extends SyntaxElement> elements) {
        for (final var element : elements) {
            render(element);
        }
    }

    void bind(final TraversalContext traversal) {
        this.traversal = traversal;
    }

    private final HtmlExport export;
    private final HtmlWriter out;
    private TraversalContext traversal = new TraversalContext();
}
