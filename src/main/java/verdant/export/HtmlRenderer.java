// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.export;

import verdant.ast.AstNode;

/**
 * The HTML rendering of one kind of container, called when the container is entered and left.
 * <p>
 * A renderer that calls {@link HtmlContext#skip()} from {@link #enter} is responsible for the whole output of the
 * container, since neither its children nor {@link #leave} will be rendered.
 */
public interface HtmlRenderer {
    void enter(AstNode node, HtmlContext context);

    default void leave(final AstNode node, final HtmlContext context) {
    }

    /**
     * Returns a renderer that wraps the container's children in the given element.
     */
    static HtmlRenderer element(final String name, final HtmlWriter.Attribute... attributes) {
        return new HtmlRenderer() {
            @Override
            public void enter(final AstNode node, final HtmlContext context) {
                context.out().startTag(name, attributes);
            }

            @Override
            public void leave(final AstNode node, final HtmlContext context) {
                context.out().endTag(name);
            }
        };
    }

    /**
     * Returns a renderer that writes a self-closed element in place of the container.
     */
    static HtmlRenderer emptyElement(final String name) {
        return (final AstNode node, final HtmlContext context) -> {
            context.out().emptyTag(name);
            context.skip();
        };
    }

    /**
     * Returns a renderer that outputs nothing for the container, not even its children.
     */
    static HtmlRenderer suppressed() {
        return (final AstNode node, final HtmlContext context) -> context.skip();
    }

    /**
     * Returns a renderer that outputs nothing for the container itself, but renders its children.
     */
    static HtmlRenderer transparent() {
        return (final AstNode node, final HtmlContext context) -> {
        };
    }

    /**
     * Returns a renderer for containers viewed as the given type.
     *
     * @throws ClassCastException when called for a container of a different view type
     */
    static <N extends AstNode> HtmlRenderer typed(final Class<N> type, final Enter<? super N> enter) {
        return (final AstNode node, final HtmlContext context) -> enter.enter(type.cast(node), context);
    }

    /**
     * Returns a renderer for containers viewed as the given type, with separate enter and leave actions.
     *
     * @throws ClassCastException when called for a container of a different view type
     */
    static <N extends AstNode> HtmlRenderer typed(
        final Class<N> type,
        final Enter<? super N> enter,
        final Leave<? super N> leave
    ) {
        return new HtmlRenderer() {
            @Override
            public void enter(final AstNode node, final HtmlContext context) {
                enter.enter(type.cast(node), context);
            }

            @Override
            public void leave(final AstNode node, final HtmlContext context) {
                leave.leave(type.cast(node), context);
            }
        };
    }

    @FunctionalInterface
    interface Enter<N extends AstNode> {
        void enter(N node, HtmlContext context);
    }

    @FunctionalInterface
    interface Leave<N extends AstNode> {
        void leave(N node, HtmlContext context);
    }
}
