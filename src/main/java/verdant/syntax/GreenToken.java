// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.syntax;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable leaf of the green tree holding a non-empty slice of the source text.
 */
public final class GreenToken implements GreenElement {
    private GreenToken(final SyntaxKind kind, final String text) {
        this.kind = kind;
        this.text = text;
    }

    /**
     * Creates a new token of the given kind.
     *
     * @throws IllegalArgumentException If {@code kind} isn't a token kind or {@code text} is empty.
     */
    public static GreenToken of(final SyntaxKind kind, final String text) {
        if (!kind.isToken()) {
            throw new IllegalArgumentException(kind + " is not a token kind");
        }
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Tokens can't be empty");
        }
        return new GreenToken(kind, text);
    }

    @Override
    public SyntaxKind kind() {
        return kind;
    }

    @Override
    public int textLength() {
        return text.length();
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public void appendTo(final StringBuilder builder) {
        builder.append(text);
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        return this == object
            || (object instanceof GreenToken other && kind == other.kind && text.equals(other.text));
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text);
    }

    @Override
    public String toString() {
        return kind + " " + Debug.quote(text);
    }

    private final SyntaxKind kind;
    private final String text;
}
