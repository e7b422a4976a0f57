// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.test;

import verdant.Org;
import verdant.ast.ListItem;
import verdant.config.ParseConfig;
import verdant.export.Event;
import verdant.export.MarkdownExport;
import verdant.export.Traversal;
import verdant.export.TraversalContext;
import verdant.export.Traverser;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

final class MarkdownExportTest {
    @Test
    void rendersHeadingsAndParagraphs() {
        assertThat(Org.parse("* Title\nSome *bold* and /it/ text.\n** Sub\n").toMarkdown())
            .isEqualTo("# Title\n\nSome **bold** and *it* text.\n\n## Sub\n");
    }

    @Test
    void untitledHeadlinesRenderBareMarkers() {
        assertThat(Org.parse("* \n** x\n").toMarkdown()).isEqualTo("#\n\n## x\n");
    }

    @Test
    void entitiesRenderAsUnicode() {
        assertThat(Org.parse("\\alpha\\nbsp{}x \\to \\alphabet\n").toMarkdown())
            .isEqualTo("\u03b1\u00a0x \u2192 \\alphabet\n");
    }

    @Test
    void clozeRendersItsAnswerOnly() {
        final var config = ParseConfig.defaults().withCloze(true);
        assertThat(Org.parse("Q: {{*Paris*}{capital}@q1}? {{$\\frac{a}{b}$}{fractions}}\n", config).toMarkdown())
            .isEqualTo("Q: **Paris**? $\\frac{a}{b}$\n");
    }

    @Test
    void emptyDocumentRendersToNothing() {
        assertThat(Org.parse("").toMarkdown()).isEmpty();
        assertThat(Org.parse("\n\n").toMarkdown()).isEmpty();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
        "=a=                   | `a`",
        "~a`b~                 | ``a`b``",
        "+gone+                | ~~gone~~",
        "_under_               | <u>under</u>",
        "[[https://a.b][A]]    | [A](https://a.b)",
        "[[https://c.d]]       | <https://c.d>",
        "[[file:x.png]]        | ![](x.png)",
        "<2024-01-02 Tue>      | <2024-01-02 Tue>",
    })
    void rendersInlineMarkup(final String org, final String markdown) {
        assertThat(Org.parse(org + "\n").toMarkdown()).isEqualTo(markdown + "\n");
    }

    @Test
    void rendersLists() {
        assertThat(Org.parse("- a\n- [X] b\n- [ ] c\n").toMarkdown()).isEqualTo("- a\n- [x] b\n- [ ] c\n");
        assertThat(Org.parse("1. one\n2. two\n").toMarkdown()).isEqualTo("1. one\n2. two\n");
        assertThat(Org.parse("a) one\nb) two\n").toMarkdown()).isEqualTo("1. one\n2. two\n");
        assertThat(Org.parse("- term :: meaning\n").toMarkdown()).isEqualTo("- **term**: meaning\n");
    }

    @Test
    void indentsNestedListItems() {
        assertThat(Org.parse("- outer\n  - inner\n").toMarkdown()).isEqualTo("- outer\n\n  - inner\n");
    }

    @Test
    void rendersBlocks() {
        assertThat(Org.parse("#+BEGIN_SRC java\nint x;\n#+END_SRC\n").toMarkdown())
            .isEqualTo("```java\nint x;\n```\n");
        assertThat(Org.parse("#+BEGIN_EXAMPLE\nsome example\n#+END_EXAMPLE\n").toMarkdown())
            .isEqualTo("```\nsome example\n```\n");
        assertThat(Org.parse("#+BEGIN_QUOTE\nline one\nline two\n#+END_QUOTE\n").toMarkdown())
            .isEqualTo("> line one\n> line two\n");
        assertThat(Org.parse("#+BEGIN_EXPORT markdown\n<b>raw</b>\n#+END_EXPORT\n").toMarkdown())
            .isEqualTo("<b>raw</b>\n");
        assertThat(Org.parse("#+BEGIN_EXPORT latex\n\\relax\n#+END_EXPORT\n").toMarkdown()).isEmpty();
    }

    @Test
    void rendersTables() {
        assertThat(Org.parse("| a | b |\n|---+---|\n| 1 | 2 |\n").toMarkdown())
            .isEqualTo("| a | b |\n| --- | --- |\n| 1 | 2 |\n");
        assertThat(Org.parse("| 1 | 2 |\n| 3 | 4 |\n").toMarkdown())
            .isEqualTo("| 1 | 2 |\n| --- | --- |\n| 3 | 4 |\n");
    }

    @Test
    void rendersFootnotes() {
        assertThat(Org.parse("Text[fn:1].\n\n[fn:1] Note.\n").toMarkdown()).isEqualTo("Text[^1].\n\n[^1]: Note.\n");
    }

    @Test
    void omitsKeywordsCommentsAndDrawers() {
        final var org = Org.parse("#+TITLE: x\n# comment\ntext\n:NOTES:\nhidden\n:END:\n* COMMENT skipped\nbody\n");
        assertThat(org.toMarkdown()).isEqualTo("text\n");
    }

    @Test
    void finishRejectsUnbalancedWalks() {
        assertThat(new MarkdownExport().finish()).isEmpty();
        final var export = new MarkdownExport();
        Traversal.walk(Org.parse("- item\n").root(), new Traverser() {
            @Override
            public void event(final Event event, final TraversalContext context) {
                export.event(event, context);
                if (event instanceof Event.Enter enter && enter.node() instanceof ListItem) {
                    context.stop();
                }
            }

            @Override
            public boolean tokenLevel() {
                return export.tokenLevel();
            }
        });
        assertThatExceptionOfType(IllegalStateException.class).isThrownBy(export::finish);
    }
}
