// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.syntax;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A positioned token.
 */
public final class SyntaxToken implements SyntaxElement {
    SyntaxToken(final GreenToken green, final SyntaxNode parent, final int offset, final int indexInParent) {
        this.green = green;
        this.parent = parent;
        this.offset = offset;
        this.indexInParent = indexInParent;
    }

    @Override
    public SyntaxKind kind() {
        return green.kind();
    }

    @Override
    public GreenToken green() {
        return green;
    }

    @Override
    public TextRange textRange() {
        return TextRange.at(offset, green.textLength());
    }

    @Override
    public SyntaxNode parent() {
        return parent;
    }

    @Override
    public int indexInParent() {
        return indexInParent;
    }

    @Override
    public String text() {
        return green.text();
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        return this == object
            || (object instanceof SyntaxToken other && green == other.green && offset == other.offset
                && parent.equals(other.parent));
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(green), offset);
    }

    @Override
    public String toString() {
        return kind() + "@" + textRange() + " " + Debug.quote(green.text());
    }

    private final GreenToken green;
    private final SyntaxNode parent;
    private final int offset;
    private final int indexInParent;
}
