// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A positioned node of one version of a syntax tree.
 * <p>
 * A node is a green node plus its absolute offset and parent handle. Children handles are created on demand, so two
 * calls to {@link #children()} return equal, but not identical, handles. Ranges are always derived from the green
 * elements' lengths; nothing positional is stored in the green tree.
 */
public final class SyntaxNode implements SyntaxElement {
    private SyntaxNode(
        final GreenNode green,
        final @Nullable SyntaxNode parent,
        final int offset,
        final int indexInParent
    ) {
        this.green = green;
        this.parent = parent;
        this.offset = offset;
        this.indexInParent = indexInParent;
    }

    /**
     * Returns the root handle of the tree rooted at the given green node.
     */
    public static SyntaxNode root(final GreenNode green) {
        return new SyntaxNode(green, null, 0, 0);
    }

    @Override
    public SyntaxKind kind() {
        return green.kind();
    }

    @Override
    public GreenNode green() {
        return green;
    }

    @Override
    public TextRange textRange() {
        return TextRange.at(offset, green.textLength());
    }

    @Override
    public @Nullable SyntaxNode parent() {
        return parent;
    }

    @Override
    public int indexInParent() {
        return indexInParent;
    }

    /**
     * Returns the root of the tree this node belongs to.
     */
    public SyntaxNode root() {
        var node = this;
        while (node.parent != null) {
            node = node.parent;
        }
        return node;
    }

    /**
     * Returns all children, nodes and tokens, in order.
     */
    public List<SyntaxElement> childrenWithTokens() {
        final var greenChildren = green.children();
        final var result = new ArrayList<SyntaxElement>(greenChildren.size());
        var childOffset = offset;
        for (int i = 0; i < greenChildren.size(); i += 1) {
            final var child = greenChildren.get(i);
            result.add(wrap(child, childOffset, i));
            childOffset += child.textLength();
        }
        return result;
    }

    /**
     * Returns the child nodes, in order, skipping tokens.
     */
    public List<SyntaxNode> children() {
        final var result = new ArrayList<SyntaxNode>();
        final var greenChildren = green.children();
        var childOffset = offset;
        for (int i = 0; i < greenChildren.size(); i += 1) {
            final var child = greenChildren.get(i);
            if (child instanceof GreenNode node) {
                result.add(new SyntaxNode(node, this, childOffset, i));
            }
            childOffset += child.textLength();
        }
        return result;
    }

    /**
     * Returns the child nodes of the given kind, in order.
     */
    public List<SyntaxNode> children(final SyntaxKind kind) {
        final var result = new ArrayList<SyntaxNode>();
        for (final var child : children()) {
            if (child.kind() == kind) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Returns the first child node of the given kind, or {@code null} if there's none.
     */
    public @Nullable SyntaxNode firstChild(final SyntaxKind kind) {
        for (final var child : children()) {
            if (child.kind() == kind) {
                return child;
            }
        }
        return null;
    }

    /**
     * Returns the first direct child token of the given kind, or {@code null} if there's none.
     */
    public @Nullable SyntaxToken firstToken(final SyntaxKind kind) {
        for (final var child : childrenWithTokens()) {
            if (child instanceof SyntaxToken token && token.kind() == kind) {
                return token;
            }
        }
        return null;
    }

    /**
     * Returns the direct child tokens of the given kind, in order.
     */
    public List<SyntaxToken> tokens(final SyntaxKind kind) {
        final var result = new ArrayList<SyntaxToken>();
        for (final var child : childrenWithTokens()) {
            if (child instanceof SyntaxToken token && token.kind() == kind) {
                result.add(token);
            }
        }
        return result;
    }

    /**
     * Returns every leaf token of this subtree, in document order.
     */
    public List<SyntaxToken> leaves() {
        final var result = new ArrayList<SyntaxToken>();
        collectLeaves(result);
        return result;
    }

    /**
     * Returns this node and all of its descendant nodes, in pre-order.
     */
    public List<SyntaxNode> descendants() {
        final var result = new ArrayList<SyntaxNode>();
        final var stack = new ArrayList<SyntaxNode>();
        stack.add(this);
        while (!stack.isEmpty()) {
            final var node = stack.remove(stack.size() - 1);
            result.add(node);
            final var children = node.children();
            for (int i = children.size() - 1; i >= 0; i -= 1) {
                stack.add(children.get(i));
            }
        }
        return result;
    }

    /**
     * Returns the ancestors of this node, starting with its parent and ending with the root.
     */
    public List<SyntaxNode> ancestors() {
        final var result = new ArrayList<SyntaxNode>();
        for (var node = parent; node != null; node = node.parent) {
            result.add(node);
        }
        return result;
    }

    /**
     * Returns the token whose range contains the given absolute offset, or {@code null} if the offset lies outside of
     * this node. An offset equal to this node's end yields the last token.
     */
    public @Nullable SyntaxToken tokenAtOffset(final int absoluteOffset) {
        final var range = textRange();
        if (absoluteOffset < range.start() || absoluteOffset > range.end() || range.isEmpty()) {
            return null;
        }
        var node = this;
        while (true) {
            @Nullable SyntaxElement found = null;
            for (final var child : node.childrenWithTokens()) {
                final var childRange = child.textRange();
                if (childRange.isEmpty()) {
                    continue;
                }
                if (childRange.contains(absoluteOffset) || childRange.end() == absoluteOffset) {
                    found = child;
                    if (childRange.contains(absoluteOffset)) {
                        break;
                    }
                }
            }
            if (found == null) {
                return null;
            }
            if (found instanceof SyntaxToken token) {
                return token;
            }
            node = (SyntaxNode) found;
        }
    }

    /**
     * Returns a new root green node in which this node is replaced with {@code replacement}.
     * <p>
     * Only the path from this node to the root is rebuilt; every other subtree is shared with this version.
     */
    @CheckReturnValue
    public GreenNode replaceWith(final GreenNode replacement) {
        var newGreen = replacement;
        var node = this;
        while (node.parent != null) {
            newGreen = node.parent.green.withChild(node.indexInParent, newGreen);
            node = node.parent;
        }
        return newGreen;
    }

    /**
     * Returns an indented dump of this subtree, one element per line, in the form {@code KIND@start..end "text"}.
     */
    public String debugDump() {
        final var builder = new StringBuilder();
        debugDump(builder, 0);
        return builder.toString();
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        return this == object
            || (object instanceof SyntaxNode other && green == other.green && offset == other.offset
                && Objects.equals(parent, other.parent));
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(green), offset);
    }

    @Override
    public String toString() {
        return kind() + "@" + textRange();
    }

    private void debugDump(final StringBuilder builder, final int depth) {
        builder.append("  ".repeat(depth)).append(this).append('\n');
        for (final var child : childrenWithTokens()) {
            if (child instanceof SyntaxNode node) {
                node.debugDump(builder, depth + 1);
            } else {
                builder.append("  ".repeat(depth + 1)).append(child).append('\n');
            }
        }
    }

    private void collectLeaves(final List<SyntaxToken> result) {
        for (final var child : childrenWithTokens()) {
            if (child instanceof SyntaxToken token) {
                result.add(token);
            } else {
                ((SyntaxNode) child).collectLeaves(result);
            }
        }
    }

    private SyntaxElement wrap(final GreenElement child, final int childOffset, final int index) {
        if (child instanceof GreenNode node) {
            return new SyntaxNode(node, this, childOffset, index);
        }
        return new SyntaxToken((GreenToken) child, this, childOffset, index);
    }

    private final GreenNode green;
    private final @Nullable SyntaxNode parent;
    private final int offset;
    private final int indexInParent;
}
