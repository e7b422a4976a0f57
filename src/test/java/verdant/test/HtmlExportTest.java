// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.test;

import java.util.Locale;
import verdant.Org;
import verdant.ast.Headline;
import verdant.ast.Paragraph;
import verdant.config.ParseConfig;
import verdant.export.HtmlContext;
import verdant.export.HtmlExport;
import verdant.export.HtmlRenderer;
import verdant.export.HtmlWriter;
import verdant.syntax.SyntaxKind;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;

final class HtmlExportTest {
    @Test
    void rendersHeadlinesSectionsAndEmphasis() {
        assertThat(Org.parse("* title\n*section*").toHtml())
            .isEqualTo("<main><h1>title</h1><section><p><b>section</b></p></section></main>");
    }

    @Test
    void headingLevelFollowsHeadlineLevel() {
        assertThat(Org.parse("* a\n** b\n******* g\n").toHtml())
            .isEqualTo("<main><h1>a</h1><h2>b</h2><h6>g</h6></main>");
    }

    @Test
    void untitledHeadlinesStillGetHeadings() {
        assertThat(Org.parse("* \n** x\n").toHtml()).isEqualTo("<main><h1></h1><h2>x</h2></main>");
        assertThat(Org.parse("*** \n").toHtml()).isEqualTo("<main><h3></h3></main>");
        assertThat(Org.parse("* TODO :tag:\nbody\n").toHtml())
            .isEqualTo("<main><h1></h1><section><p>body</p></section></main>");
    }

    @Test
    void rendersEntitiesAsCharacterReferences() {
        assertThat(Org.parse("\\alpha < \\nbsp{}\\frac12 \\alphabet\n").toHtml())
            .isEqualTo("<main><section><p>&alpha; &lt; &nbsp;&frac12; \\alphabet</p></section></main>");
    }

    @Test
    void rendersClozeAnswersOnly() {
        final var config = ParseConfig.defaults().withCloze(true);
        assertThat(Org.parse("Q: {{*Paris*}{capital}@q1}?\n", config).toHtml())
            .isEqualTo("<main><section><p>Q: <span class=\"cloze\"><b>Paris</b></span>?</p></section></main>");
        assertThat(Org.parse("Q: {{Paris}{capital}}?\n").toHtml())
            .isEqualTo("<main><section><p>Q: {{Paris}{capital}}?</p></section></main>");
    }

    @Test
    void escapesText() {
        assertThat(Org.parse("a < b & \"c\"\n").toHtml())
            .isEqualTo("<main><section><p>a &lt; b &amp; &quot;c&quot;</p></section></main>");
    }

    @Test
    void rendersInlineMarkup() {
        assertThat(Org.parse("/i/ _u_ +s+ =v= ~c~\n").toHtml())
            .isEqualTo(
                "<main><section><p><i>i</i> <u>u</u> <s>s</s> <code>v</code> <code>c</code></p></section></main>"
            );
    }

    @Test
    void rendersLinks() {
        final var html = Org.parse("[[https://example.com][Example]] [[file:img.png]] [[https://x.org]]\n").toHtml();
        assertThat(html).contains(
            "<a href=\"https://example.com\">Example</a>",
            "<img src=\"img.png\"/>",
            "<a href=\"https://x.org\">https://x.org</a>"
        );
    }

    @Test
    void rendersSourceBlocks() {
        assertThat(Org.parse("#+BEGIN_SRC java\nint x = 1 < 2;\n#+END_SRC\n").toHtml())
            .isEqualTo(
                "<main><section><pre><code class=\"language-java\">int x = 1 &lt; 2;\n</code></pre></section></main>"
            );
    }

    @Test
    void rendersLists() {
        assertThat(Org.parse("- a\n- [X] b\n").toHtml())
            .isEqualTo(
                "<main><section><ul><li><p>a</p></li><li><code>[X]</code> <p>b</p></li></ul></section></main>"
            );
        assertThat(Org.parse("1. a\n2. b\n").toHtml()).contains("<ol><li><p>a</p></li><li><p>b</p></li></ol>");
    }

    @Test
    void rendersTables() {
        assertThat(Org.parse("| a | b |\n|---+---|\n| 1 | 2 |\n").toHtml()).isEqualTo(
            "<main><section><table>"
                + "<thead><tr><th>a</th><th>b</th></tr></thead>"
                + "<tbody><tr><td>1</td><td>2</td></tr></tbody>"
                + "</table></section></main>"
        );
    }

    @Test
    void rendersFootnotes() {
        final var html = Org.parse("See[fn:1].\n\n[fn:1] Note.\n").toHtml();
        assertThat(html).contains(
            "See<sup><a id=\"fnr.1\" class=\"footref\" href=\"#fn.1\">1</a></sup>.",
            "<div class=\"footdef\"><sup><a id=\"fn.1\" class=\"footnum\" href=\"#fnr.1\">1</a></sup>"
                + "<div class=\"footpara\">Note.</div></div>"
        );
    }

    @Test
    void omitsKeywordsDrawersAndCommentedHeadlines() {
        final var org = Org.parse(
            "#+TITLE: T\n* COMMENT hidden\nsecret\n* shown\n:PROPERTIES:\n:ID: 1\n:END:\n:LOGBOOK:\nx\n:END:\n"
        );
        assertThat(org.toHtml()).isEqualTo("<main><section></section><h1>shown</h1><section></section></main>");
    }

    @Test
    void customHeadingAnchors() {
        final var export = HtmlExport.builder()
            .override(SyntaxKind.HEADLINE, HtmlRenderer.typed(
                Headline.class,
                (final Headline headline, final HtmlContext context) -> {
                    final var title = headline.title();
                    final var heading = "h" + headline.level();
                    context.out().startTag(heading, HtmlWriter.Attribute.of("id", slug(headline.titleRaw())));
                    if (title != null) {
                        context.renderAll(title.syntax().childrenWithTokens());
                    }
                    context.out().endTag(heading);
                }
            ))
            .build();
        final var org = Org.parse("* Hello World\n** Second *one*\n");
        assertThat(org.toHtml(export))
            .isEqualTo(
                "<main><h1 id=\"hello-world\">Hello World</h1><h2 id=\"second-one\">Second <b>one</b></h2></main>"
            );
        assertThat(org.toHtml()).isEqualTo("<main><h1>Hello World</h1><h2>Second <b>one</b></h2></main>");
    }

    @Test
    void suppressAndUnwrap() {
        final var export = HtmlExport.builder()
            .suppress(SyntaxKind.BOLD)
            .unwrap(SyntaxKind.DOCUMENT)
            .unwrap(SyntaxKind.SECTION)
            .build();
        assertThat(Org.parse("* t\na *b* c\n").toHtml(export)).isEqualTo("<h1>t</h1><p>a  c</p>");
        assertThat(export.toBuilder().override(SyntaxKind.PARAGRAPH, HtmlRenderer.transparent()).build()
            .render(Org.parse("x *y*\n").root())).isEqualTo("x ");
    }

    @Test
    void rendersSubtrees() {
        final var paragraph = Org.parse("* t\nsome ~code~\n").firstNode(Paragraph.class);
        assertThat(paragraph).isNotNull();
        assertThat(HtmlExport.defaults().render(paragraph)).isEqualTo("<p>some <code>code</code></p>");
    }

    @Test
    void onlyContainersCanBeOverridden() {
        assertThatExceptionOfType(IllegalArgumentException.class)
            .isThrownBy(() -> HtmlExport.builder().override(SyntaxKind.TEXT, HtmlRenderer.suppressed()));
        assertThatExceptionOfType(IllegalArgumentException.class)
            .isThrownBy(() -> HtmlExport.builder().suppress(SyntaxKind.BLOCK_CONTENT));
    }

    @Test
    void exposesRenderers() {
        assertThat(HtmlExport.defaults().renderer(SyntaxKind.PARAGRAPH)).isNotNull();
        assertThat(HtmlExport.defaults().renderer(SyntaxKind.LIST_ITEM_CONTENT)).isNull();
    }

    private static String slug(final String title) {
        return title.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("^-|-$", "");
    }
}
