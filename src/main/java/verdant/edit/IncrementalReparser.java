// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.edit;

import verdant.config.ParseConfig;
import verdant.parser.Parser;
import verdant.syntax.GreenNode;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import verdant.util.Trace;
import verdant.util.condition.ConditionContext;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Applies text replacements to syntax trees, reparsing as little as possible.
 * <p>
 * Since a headline extends up to the next headline of the same or lower level, its parse depends on its own text
 * only. An edit within a headline is therefore applied by reparsing just that headline, provided the result is still
 * one headline of the same level covering exactly the edited text, and that text still ends with a line break,
 * unless the headline ends the document. Otherwise the enclosing headlines are tried, and finally the whole
 * document. The result is always the tree a full parse of the edited text would produce, sharing every subtree
 * outside the reparsed headline with the original tree.
 */
public final class IncrementalReparser {
    private IncrementalReparser() {
    }

    /**
     * Returns the root of a new tree for the text of {@code root} with {@code start..end} replaced by
     * {@code replacement}.
     * <p>
     * If the range doesn't lie within the document, {@link EditRangeErrorCondition} is signaled as fatal.
     */
    @CheckReturnValue
    public static GreenNode replaceRange(
        final SyntaxNode root,
        final ParseConfig config,
        final int start,
        final int end,
        final String replacement
    ) {
        try (final var trace = new Trace(() -> "Replacing range " + start + ".." + end)) {
            trace.use();
            final var length = root.textRange().length();
            if (start < 0 || end < start || end > length) {
                throw ConditionContext.error(new EditRangeErrorCondition(start, end, length));
            }
            var headline = innermostHeadline(root, start, end);
            while (headline != null) {
                final var reparsed = reparseHeadline(headline, config, length, start, end, replacement);
                if (reparsed != null) {
                    return headline.replaceWith(reparsed);
                }
                headline = parentHeadline(headline);
            }
            final var text = root.text();
            return Parser.parse(text.substring(0, start) + replacement + text.substring(end), config);
        }
    }

    // The innermost headline whose range equals start..end or whose body, after the stars and the space following
    // them, contains it.
    private static @Nullable SyntaxNode innermostHeadline(final SyntaxNode root, final int start, final int end) {
        @Nullable SyntaxNode result = null;
        var node = root;
        while (true) {
            @Nullable SyntaxNode next = null;
            for (final var child : node.children(SyntaxKind.HEADLINE)) {
                if (isEditable(child, start, end)) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                return result;
            }
            result = next;
            node = next;
        }
    }

    private static boolean isEditable(final SyntaxNode headline, final int start, final int end) {
        final var range = headline.textRange();
        if (range.start() == start && range.end() == end) {
            return true;
        }
        final var stars = headline.firstToken(SyntaxKind.HEADLINE_STARS);
        final var level = (stars == null) ? 0 : stars.text().length();
        return range.start() + level + 1 <= start && end <= range.end();
    }

    private static @Nullable SyntaxNode parentHeadline(final SyntaxNode headline) {
        final var parent = headline.parent();
        return (parent != null && parent.kind() == SyntaxKind.HEADLINE) ? parent : null;
    }

    private static @Nullable GreenNode reparseHeadline(
        final SyntaxNode headline,
        final ParseConfig config,
        final int documentLength,
        final int start,
        final int end,
        final String replacement
    ) {
        final var range = headline.textRange();
        final var oldText = headline.text();
        final var newText = oldText.substring(0, start - range.start())
            + replacement
            + oldText.substring(end - range.start());
        final var endsDocument = range.end() == documentLength;
        if (!endsDocument && !endsWithLineBreak(newText)) {
            return null;
        }
        final var reparsed = Parser.parseHeadline(newText, config);
        if (reparsed == null || reparsed.textLength() != newText.length()) {
            return null;
        }
        return (level(reparsed) == level(headline.green())) ? reparsed : null;
    }

    private static boolean endsWithLineBreak(final String text) {
        return text.endsWith("\n") || text.endsWith("\r");
    }

    private static int level(final GreenNode headline) {
        final var stars = headline.children().get(0);
        return (stars.kind() == SyntaxKind.HEADLINE_STARS) ? stars.textLength() : 0;
    }
}
