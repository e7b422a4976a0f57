// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.syntax;

import java.util.List;
import verdant.util.collection.ImmutableList;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable interior node of the green tree.
 * <p>
 * The text length and hash code are computed once, at construction. Nodes may be empty, for example an empty table
 * cell.
 */
public final class GreenNode implements GreenElement {
    private GreenNode(final SyntaxKind kind, final ImmutableList<GreenElement> children) {
        this.kind = kind;
        this.children = children;
        int length = 0;
        int hash = kind.hashCode();
        for (final var child : children) {
            length += child.textLength();
            hash = hash * 31 + child.hashCode();
        }
        textLength = length;
        hashCode = hash;
    }

    /**
     * Creates a new node of the given kind with the given children.
     *
     * @throws IllegalArgumentException If {@code kind} is a token kind.
     */
    public static GreenNode of(final SyntaxKind kind, final List<? extends GreenElement> children) {
        if (kind.isToken()) {
            throw new IllegalArgumentException(kind + " is not a node kind");
        }
        return new GreenNode(kind, ImmutableList.copyOf(children));
    }

    @Override
    public SyntaxKind kind() {
        return kind;
    }

    @Override
    public int textLength() {
        return textLength;
    }

    public ImmutableList<GreenElement> children() {
        return children;
    }

    /**
     * Returns a copy of this node with the child at {@code index} replaced. Other children are shared.
     */
    @CheckReturnValue
    public GreenNode withChild(final int index, final GreenElement child) {
        return new GreenNode(kind, children.with(index, child));
    }

    @Override
    public void appendTo(final StringBuilder builder) {
        for (final var child : children) {
            child.appendTo(builder);
        }
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        if (this == object) {
            return true;
        }
        return object instanceof GreenNode other
            && kind == other.kind
            && textLength == other.textLength
            && hashCode == other.hashCode
            && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return kind + "@" + textLength;
    }

    private final SyntaxKind kind;
    private final ImmutableList<GreenElement> children;
    private final int textLength;
    private final int hashCode;
}
