// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.export;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Escaping of text for inclusion in HTML, in element content and in double-quoted attribute values alike.
 */
public final class HtmlEscape {
    private HtmlEscape() {
    }

    /**
     * Returns the given string with {@code <}, {@code >}, {@code &}, {@code '} and {@code "} replaced by character
     * references.
     */
    public static String escape(final String string) {
        final var builder = new StringBuilder(string.length());
        escapeTo(builder, string);
        return builder.toString();
    }

    /**
     * Appends the escaped form of the given string to the builder.
     */
    public static void escapeTo(final StringBuilder builder, final String string) {
        int index = 0;
        int indexToEscape;
        while ((indexToEscape = findCharacterToEscape(string, index)) >= 0) {
            builder.append(string, index, indexToEscape);
            builder.append(Objects.requireNonNull(escape(string.charAt(indexToEscape))));
            index = indexToEscape + 1;
        }
        builder.append(string, index, string.length());
    }

    private static @Nullable String escape(final char character) {
        return switch (character) {
            case '<' -> "&lt;";
            case '>' -> "&gt;";
            case '&' -> "&amp;";
            case '\'' -> "&apos;";
            case '"' -> "&quot;";
            default -> null;
        };
    }

    private static int findCharacterToEscape(final String string, final int startIndex) {
        final var length = string.length();
        for (int i = startIndex; i < length; i += 1) {
            if (escape(string.charAt(i)) != null) {
                return i;
            }
        }
        return -1;
    }
}
