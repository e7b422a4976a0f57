// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * A builder of green trees, used by the parser.
 * <p>
 * Children are accumulated on a stack; {@link #startNode(SyntaxKind)} opens a node and {@link #finishNode()} closes
 * the most recently opened one. Empty token texts are silently dropped, so callers can emit optional parts
 * unconditionally.
 */
public final class GreenNodeBuilder {
    public GreenNodeBuilder() {
    }

    /**
     * Appends a token of the given kind to the currently open node, unless {@code text} is empty.
     */
    public GreenNodeBuilder token(final SyntaxKind kind, final String text) {
        if (!text.isEmpty()) {
            children.add(GreenToken.of(kind, text));
        }
        return this;
    }

    /**
     * Appends an already built element to the currently open node.
     */
    public GreenNodeBuilder push(final GreenElement element) {
        children.add(element);
        return this;
    }

    /**
     * Appends already built elements to the currently open node.
     */
    public GreenNodeBuilder pushAll(final List<? extends GreenElement> elements) {
        children.addAll(elements);
        return this;
    }

    /**
     * Opens a new node of the given kind.
     */
    public GreenNodeBuilder startNode(final SyntaxKind kind) {
        parents.add(new OpenNode(kind, children.size()));
        return this;
    }

    /**
     * Closes the most recently opened node.
     */
    public GreenNodeBuilder finishNode() {
        if (parents.isEmpty()) {
            throw new IllegalStateException("No open node to finish");
        }
        final var open = parents.remove(parents.size() - 1);
        final var nodeChildren = children.subList(open.firstChild, children.size());
        final var node = GreenNode.of(open.kind, nodeChildren);
        nodeChildren.clear();
        children.add(node);
        return this;
    }

    /**
     * Returns the single finished node. No node may be open.
     */
    public GreenNode finish() {
        if (!parents.isEmpty()) {
            throw new IllegalStateException("Unfinished node of kind " + parents.get(parents.size() - 1).kind);
        }
        if (children.size() != 1 || !(children.get(0) instanceof GreenNode node)) {
            throw new IllegalStateException("Expected exactly one root node, got " + children);
        }
        return node;
    }

    private final List<GreenElement> children = new ArrayList<>();
    private final List<OpenNode> parents = new ArrayList<>();

    private record OpenNode(SyntaxKind kind, int firstChild) {
    }
}
