// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.test;

import java.util.stream.LongStream;
import verdant.Org;
import verdant.ast.Headline;
import verdant.syntax.GreenToken;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import verdant.syntax.TextRange;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

final class SyntaxTreeTest {
    static LongStream provideSeeds() {
        return LongStream.generate(RandomUtils::generateRandomSeed).limit(8);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "\n",
        "*",
        "* ",
        "text without newline",
        "* title\n*section*",
        "* 1\n** 2\n*** 3\n****4",
        "#+TITLE: x\r\n* a\r\nbody\r",
        "- a\n- b\n\n\n- c",
        "| a |\n|---|\n| b |\n#+TBLFM: $1=2",
        "#+BEGIN_SRC\n,* x\n#+END_SRC",
        "#+BEGIN_SRC unterminated",
        "[[unclosed link and *unclosed bold",
        ":PROPERTIES:\n:A: 1\n:END:\n* H\n:PROPERTIES:\n:B: 2\n:END:\n",
        "日本語 *太字* 😀\n",
    })
    void roundTripPreservesText(final String text) {
        final var org = Org.parse(text);
        assertThat(org.toOrg()).isEqualTo(text);
        assertThat(org.green().textLength()).isEqualTo(text.length());
        assertCoverage(org.root());
    }

    @ParameterizedTest(name = seededTestDisplayName)
    @MethodSource("provideSeeds")
    void roundTripPreservesRandomText(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        for (int i = 0; i < 50; i += 1) {
            final var text = RandomUtils.generateDocument(random, random.nextInt(40));
            final var org = Org.parse(text);
            assertThat(org.toOrg()).isEqualTo(text);
            assertCoverage(org.root());
            assertHeadlineLevels(org);
        }
    }

    @Test
    void headlineLevelIsTheNumberOfStars() {
        final var org = Org.parse("* 1\n** 2\n*** 3\n****4\n***** 5\n");
        assertThat(org.nodes(Headline.class)).extracting(Headline::level).containsExactly(1, 2, 3, 5);
        assertHeadlineLevels(org);
    }

    @Test
    void headlinesNestByLevel() {
        final var document = Org.parse("* a\n** b\n*** c\n** d\n* e\n").document();
        final var headlines = document.headlines();
        assertThat(headlines).extracting(Headline::titleRaw).containsExactly("a", "e");
        assertThat(headlines.get(0).headlines()).extracting(Headline::titleRaw).containsExactly("b", "d");
        final var grandchildren = headlines.get(0).headlines().get(0).headlines();
        assertThat(grandchildren).extracting(Headline::titleRaw).containsExactly("c");
    }

    @Test
    void greenNodesCompareStructurally() {
        final var first = Org.parse("* a\nsome *text*\n").green();
        final var second = Org.parse("* a\nsome *text*\n").green();
        assertThat(first).isNotSameAs(second);
        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        assertThat(first).isNotEqualTo(Org.parse("* a\nsome /text/\n").green());
    }

    @Test
    void greenTokensRejectEmptyText() {
        assertThatExceptionOfType(IllegalArgumentException.class)
            .isThrownBy(() -> GreenToken.of(SyntaxKind.TEXT, ""));
    }

    @Test
    void redNodesKnowTheirPositions() {
        final var root = Org.parse("#+TITLE: t\n* a\nbody\n").root();
        final var headline = root.firstChild(SyntaxKind.HEADLINE);
        assertThat(headline).isNotNull();
        assertThat(headline.textRange()).isEqualTo(new TextRange(11, 20));
        assertThat(headline.parent()).isEqualTo(root);
        assertThat(headline.root()).isEqualTo(root);
        assertThat(headline.text()).isEqualTo("* a\nbody\n");
        final var token = root.tokenAtOffset(15);
        assertThat(token).isNotNull();
        assertThat(token.text()).isEqualTo("body");
        assertThat(token.textRange()).isEqualTo(new TextRange(15, 19));
    }

    @Test
    void ancestorsEndAtTheRoot() {
        final var root = Org.parse("* a *b*\n").root();
        final var token = root.tokenAtOffset(5);
        assertThat(token).isNotNull();
        assertThat(token.text()).isEqualTo("b");
        assertThat(token.parent().ancestors()).extracting(SyntaxNode::kind)
            .containsExactly(SyntaxKind.HEADLINE_TITLE, SyntaxKind.HEADLINE, SyntaxKind.DOCUMENT);
        assertThat(root.ancestors()).isEmpty();
    }

    @Test
    void debugDumpShowsEveryElement() {
        assertThat(Org.parse("* a *b*\n").root().debugDump()).isEqualTo(
            "DOCUMENT@0..8\n"
                + "  HEADLINE@0..8\n"
                + "    HEADLINE_STARS@0..1 \"*\"\n"
                + "    WHITESPACE@1..2 \" \"\n"
                + "    HEADLINE_TITLE@2..7\n"
                + "      TEXT@2..4 \"a \"\n"
                + "      BOLD@4..7\n"
                + "        STAR@4..5 \"*\"\n"
                + "        TEXT@5..6 \"b\"\n"
                + "        STAR@6..7 \"*\"\n"
                + "    NEW_LINE@7..8 \"\\n\"\n"
        );
    }

    @Test
    void replaceWithSharesUntouchedSiblings() {
        final var org = Org.parse("* a\n* b\n* c\n");
        final var root = org.root();
        final var headlines = root.children(SyntaxKind.HEADLINE);
        final var replacement = Org.parse("* B\n").root().firstChild(SyntaxKind.HEADLINE);
        assertThat(replacement).isNotNull();
        final var newRoot = headlines.get(1).replaceWith(replacement.green());
        assertThat(SyntaxNode.root(newRoot).text()).isEqualTo("* a\n* B\n* c\n");
        assertThat(newRoot.children().get(0)).isSameAs(org.green().children().get(0));
        assertThat(newRoot.children().get(2)).isSameAs(org.green().children().get(2));
        assertThat(org.text()).isEqualTo("* a\n* b\n* c\n");
    }

    @Test
    void textRangeRejectsInvertedBounds() {
        assertThatExceptionOfType(IllegalArgumentException.class).isThrownBy(() -> new TextRange(5, 2));
        assertThat(TextRange.at(3, 4)).isEqualTo(new TextRange(3, 7));
        assertThat(new TextRange(3, 7).contains(new TextRange(4, 7))).isTrue();
        assertThat(TextRange.empty(2).isEmpty()).isTrue();
    }

    private static void assertCoverage(final SyntaxNode root) {
        int expected = 0;
        for (final var token : root.leaves()) {
            assertThat(token.textRange().start()).isEqualTo(expected);
            assertThat(token.textRange().isEmpty()).isFalse();
            expected = token.textRange().end();
        }
        assertThat(expected).isEqualTo(root.textRange().end());
        for (final var node : root.descendants()) {
            assertChildrenTile(node);
        }
    }

    private static void assertChildrenTile(final SyntaxNode node) {
        int expected = node.textRange().start();
        for (final var child : node.childrenWithTokens()) {
            assertThat(child.textRange().start()).isEqualTo(expected);
            expected = child.textRange().end();
        }
        assertThat(expected).isEqualTo(node.textRange().end());
    }

    private static void assertHeadlineLevels(final Org org) {
        for (final var headline : org.nodes(Headline.class)) {
            final var text = headline.raw();
            int stars = 0;
            while (stars < text.length() && text.charAt(stars) == '*') {
                stars += 1;
            }
            assertThat(headline.level()).isEqualTo(stars);
        }
    }

    private static final String seededTestDisplayName = "{displayName} [{index}] seed = {0}";
}
