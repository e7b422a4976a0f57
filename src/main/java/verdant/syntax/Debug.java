// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.syntax;

/**
 * Helpers for debug output of syntax trees.
 */
final class Debug {
    private Debug() {
    }

    static String quote(final String text) {
        final var builder = new StringBuilder(text.length() + 2);
        builder.append('"');
        for (int i = 0; i < text.length(); i += 1) {
            final var c = text.charAt(i);
            switch (c) {
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                case '"' -> builder.append("\\\"");
                case '\\' -> builder.append("\\\\");
                default -> builder.append(c);
            }
        }
        return builder.append('"').toString();
    }
}
