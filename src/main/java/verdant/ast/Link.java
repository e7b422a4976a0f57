// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.List;
import java.util.Locale;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A bracket link, {@code [[path]]} or {@code [[path][description]]}.
 */
public record Link(SyntaxNode syntax) implements AstNode {
    public Link {
        Views.requireKind(syntax, SyntaxKind.LINK);
    }

    public static @Nullable Link cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.LINK) ? new Link(node) : null;
    }

    public String path() {
        final var path = Views.tokenText(syntax, SyntaxKind.LINK_PATH);
        return (path == null) ? "" : path;
    }

    public boolean hasDescription() {
        return syntax.tokens(SyntaxKind.L_BRACKET).size() > 2;
    }

    /**
     * Returns the source text of the description, or {@code null} if the link has none.
     */
    public @Nullable String descriptionRaw() {
        if (!hasDescription()) {
            return null;
        }
        return Views.enclosedAt(syntax, syntax.tokens(SyntaxKind.L_BRACKET).get(2).indexInParent());
    }

    /**
     * Checks whether this is a link without a description to an image file, which is exported as the image itself.
     */
    public boolean isImage() {
        if (hasDescription()) {
            return false;
        }
        final var path = path().toLowerCase(Locale.ROOT);
        for (final var extension : IMAGE_EXTENSIONS) {
            if (path.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    private static final List<String> IMAGE_EXTENSIONS =
        List.of(".png", ".jpg", ".jpeg", ".gif", ".svg", ".webp", ".bmp", ".tif", ".tiff", ".xpm", ".pbm", ".pgm");
}
