// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.parser;

import verdant.config.ParseConfig;
import verdant.syntax.GreenNode;
import verdant.util.Trace;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Entry points of the Org parser.
 * <p>
 * Parsing never fails: every input produces a tree whose text is exactly the input, with anything that doesn't form
 * a recognized construct degrading to paragraphs and plain text.
 */
public final class Parser {
    private Parser() {
    }

    /**
     * Parses a whole document into a green tree of kind {@code DOCUMENT}.
     */
    public static GreenNode parse(final String text, final ParseConfig config) {
        try (final var trace = new Trace(() -> "Parsing Org document of " + text.length() + " characters")) {
            trace.use();
            return new DocumentParser(new Source(text, config)).parseDocument();
        }
    }

    /**
     * Parses the headline starting at the beginning of {@code text}.
     * <p>
     * The headline ends before the next headline of the same or lower level, so the result may cover only a prefix of
     * {@code text}; callers compare its length with the text's.
     *
     * @return The {@code HEADLINE} node, or {@code null} if {@code text} doesn't start with a headline.
     */
    public static @Nullable GreenNode parseHeadline(final String text, final ParseConfig config) {
        try (final var trace = new Trace(() -> "Parsing Org headline of " + text.length() + " characters")) {
            trace.use();
            return new DocumentParser(new Source(text, config)).parseHeadline();
        }
    }
}
