// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.test;

import java.util.List;
import java.util.Map;
import verdant.Org;
import verdant.ast.AffiliatedKeyword;
import verdant.ast.AstNodes;
import verdant.ast.BabelCall;
import verdant.ast.Bold;
import verdant.ast.Clock;
import verdant.ast.Cloze;
import verdant.ast.Cookie;
import verdant.ast.Document;
import verdant.ast.DynBlock;
import verdant.ast.Entity;
import verdant.ast.ExportBlock;
import verdant.ast.FnRef;
import verdant.ast.Headline;
import verdant.ast.InlineCall;
import verdant.ast.InlineSrc;
import verdant.ast.Keyword;
import verdant.ast.Link;
import verdant.ast.ListItem;
import verdant.ast.Macros;
import verdant.ast.OrgTable;
import verdant.ast.Paragraph;
import verdant.ast.PlainList;
import verdant.ast.PropertyDrawer;
import verdant.ast.Snippet;
import verdant.ast.SourceBlock;
import verdant.ast.Subscript;
import verdant.ast.Superscript;
import verdant.ast.Target;
import verdant.ast.Timestamp;
import verdant.ast.VerseBlock;
import verdant.config.ParseConfig;
import verdant.config.UseSubSuperscript;
import verdant.syntax.Entities;
import verdant.syntax.SyntaxElement;
import verdant.syntax.SyntaxKind;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;

final class ViewTest {
    @Test
    void castReturnsNullOnKindMismatch() {
        final var root = Org.parse("* a\n").root();
        assertThat(Headline.cast(root)).isNull();
        assertThat(Document.cast(root)).isNotNull();
        assertThat(AstNodes.cast(root)).isInstanceOf(Document.class);
        assertThat(AstNodes.cast(root, Headline.class)).isNull();
        final var headline = root.firstChild(SyntaxKind.HEADLINE);
        assertThat(headline).isNotNull();
        assertThat(AstNodes.cast(headline, Headline.class)).isNotNull();
        assertThatExceptionOfType(IllegalArgumentException.class).isThrownBy(() -> new Headline(root));
    }

    @Test
    void castReturnsNullForNodesWithoutView() {
        final var root = Org.parse("#+BEGIN_QUOTE\nx\n#+END_QUOTE\n").root();
        final var content = root.descendants().stream()
            .filter(node -> node.kind() == SyntaxKind.BLOCK_CONTENT)
            .findFirst()
            .orElseThrow();
        assertThat(AstNodes.cast(content)).isNull();
    }

    @Test
    void headlineAccessors() {
        final var org = Org.parse(
            "** TODO [#B] Write *tests* :work:urgent:\n"
                + "SCHEDULED: <2024-01-02 Tue> DEADLINE: <2024-01-05 Fri>\n"
                + ":PROPERTIES:\n:ID: abc\n:TAGS+: more\n:END:\n"
                + "Body.\n"
        );
        final var headline = org.firstNode(Headline.class);
        assertThat(headline).isNotNull();
        assertThat(headline.level()).isEqualTo(2);
        assertThat(headline.todoKeyword()).isEqualTo("TODO");
        assertThat(headline.isTodo()).isTrue();
        assertThat(headline.isDone()).isFalse();
        assertThat(headline.priority()).isEqualTo("B");
        assertThat(headline.titleRaw()).isEqualTo("Write *tests*");
        assertThat(headline.tags()).containsExactly("work", "urgent");
        assertThat(headline.isArchived()).isFalse();
        assertThat(headline.isCommented()).isFalse();

        final var scheduled = headline.scheduled();
        assertThat(scheduled).isNotNull();
        assertThat(scheduled.dayStart()).isEqualTo(2);
        final var deadline = headline.deadline();
        assertThat(deadline).isNotNull();
        assertThat(deadline.dayStart()).isEqualTo(5);
        assertThat(headline.closed()).isNull();

        final var properties = headline.properties();
        assertThat(properties).isNotNull();
        assertThat(properties.get("id")).isEqualTo("abc");
        assertThat(properties.entries()).containsEntry("ID", "abc");

        final var section = headline.section();
        assertThat(section).isNotNull();
        assertThat(section.elements()).hasSize(1).first().isInstanceOf(Paragraph.class);
    }

    @Test
    void doneAndCommentedHeadlines() {
        final var headlines = Org.parse("* DONE finished\n* COMMENT hidden\n* old :ARCHIVE:\n").document().headlines();
        assertThat(headlines.get(0).isDone()).isTrue();
        assertThat(headlines.get(0).todoKeyword()).isEqualTo("DONE");
        assertThat(headlines.get(1).isCommented()).isTrue();
        assertThat(headlines.get(2).isArchived()).isTrue();
    }

    @Test
    void timestampAccessors() {
        final var timestamps = Org.parse(
            "<2024-01-02 Tue 10:00 +1w> [2024-03-04 Mon] <2024-01-02 Tue 10:00-12:30> "
                + "<2024-01-02 Tue>--<2024-01-05 Fri>\n"
        ).nodes(Timestamp.class);
        assertThat(timestamps).hasSize(4);

        final var repeated = timestamps.get(0);
        assertThat(repeated.isActive()).isTrue();
        assertThat(repeated.yearStart()).isEqualTo(2024);
        assertThat(repeated.monthStart()).isEqualTo(1);
        assertThat(repeated.hourStart()).isEqualTo(10);
        assertThat(repeated.minuteStart()).isEqualTo(0);
        assertThat(repeated.repeater()).isEqualTo("+1w");
        assertThat(repeated.isRange()).isFalse();

        assertThat(timestamps.get(1).isInactive()).isTrue();
        assertThat(timestamps.get(1).monthStart()).isEqualTo(3);
        assertThat(timestamps.get(1).hourStart()).isNull();

        final var timeRange = timestamps.get(2);
        assertThat(timeRange.hourEnd()).isEqualTo(12);
        assertThat(timeRange.minuteEnd()).isEqualTo(30);

        final var dateRange = timestamps.get(3);
        assertThat(dateRange.isRange()).isTrue();
        assertThat(dateRange.dayStart()).isEqualTo(2);
        assertThat(dateRange.dayEnd()).isEqualTo(5);
    }

    @Test
    void listAccessors() {
        final var list = Org.parse("1. [@3] [X] first\n2. second\n").firstNode(PlainList.class);
        assertThat(list).isNotNull();
        assertThat(list.isOrdered()).isTrue();
        assertThat(list.isDescriptive()).isFalse();
        final var items = list.items();
        assertThat(items).extracting(ListItem::bullet).containsExactly("1.", "2.");
        assertThat(items.get(0).counter()).isEqualTo("3");
        assertThat(items.get(0).checkbox()).isEqualTo(ListItem.CheckBox.ON);
        assertThat(items.get(1).checkbox()).isNull();

        final var descriptive = Org.parse("- term :: meaning\n  - nested\n").firstNode(PlainList.class);
        assertThat(descriptive).isNotNull();
        assertThat(descriptive.isDescriptive()).isTrue();
        final var tag = descriptive.items().get(0).tag();
        assertThat(tag).isNotNull();
        assertThat(tag.raw()).isEqualTo("term");
        assertThat(descriptive.items().get(0).content()).hasSize(2);
    }

    @Test
    void sourceBlockAccessors() {
        final var block = Org.parse("#+BEGIN_SRC python -n :results output\n,* x\nprint(1)\n#+END_SRC\n")
            .firstNode(SourceBlock.class);
        assertThat(block).isNotNull();
        assertThat(block.language()).isEqualTo("python");
        assertThat(block.switches()).isEqualTo("-n");
        assertThat(block.parameters()).isEqualTo(":results output");
        assertThat(block.value()).isEqualTo("* x\nprint(1)\n");
    }

    @Test
    void tableAccessors() {
        final var org = Org.parse("| a | b |\n|---+---|\n| 1 | 2 |\n| 3 |\n#+TBLFM: $2=$1\n");
        final var table = org.firstNode(OrgTable.class);
        assertThat(table).isNotNull();
        assertThat(table.hasHeader()).isTrue();
        assertThat(table.rowCount()).isEqualTo(3);
        assertThat(table.columnCount()).isEqualTo(2);
        assertThat(table.ruleRowIndices()).containsExactly(1);
        final var cell = table.cell(1, 0);
        assertThat(cell).isNotNull();
        assertThat(cell.raw().strip()).isEqualTo("1");
        assertThat(table.cell(2, 1)).isNull();
        assertThat(table.formulas()).containsExactly("$2=$1");
    }

    @Test
    void documentKeywords() {
        final var org = Org.parse("#+TITLE: Part one\n#+AUTHOR: someone\n#+title: part two\n* h\n#+TITLE: ignored\n");
        assertThat(org.title()).isEqualTo("Part one part two");
        assertThat(org.keywords()).extracting(keyword -> Map.entry(keyword.key(), keyword.value())).containsExactly(
            Map.entry("TITLE", "Part one"),
            Map.entry("AUTHOR", "someone"),
            Map.entry("title", "part two")
        );
        assertThat(Org.parse("* h\n").title()).isNull();
    }

    @Test
    void footnoteReferences() {
        final var references = Org.parse("a[fn:1] b[fn:note:inline definition] c[fn::anonymous]\n").nodes(FnRef.class);
        assertThat(references).extracting(FnRef::label).containsExactly("1", "note", null);
        assertThat(references).extracting(FnRef::isInline).containsExactly(false, true, true);
    }

    @Test
    void todoKeywordsAreConfigurable() {
        final var config = ParseConfig.defaults().withTodoKeywords(List.of("TASK"), List.of("FINISHED"));
        final var custom = Org.parse("* TASK Title 1\n* FINISHED Title 2\n* TODO Title 3\n", config)
            .document().headlines();
        assertThat(custom).extracting(Headline::todoKeyword).containsExactly("TASK", "FINISHED", null);
        assertThat(custom).extracting(Headline::titleRaw).containsExactly("Title 1", "Title 2", "TODO Title 3");
        assertThat(custom.get(1).isDone()).isTrue();

        final var standard = Org.parse("* TASK Title 1\n").firstNode(Headline.class);
        assertThat(standard).isNotNull();
        assertThat(standard.todoKeyword()).isNull();
        assertThat(standard.titleRaw()).isEqualTo("TASK Title 1");
    }

    @Test
    void configurationIsKeptAcrossEdits() {
        final var config = ParseConfig.defaults().withTodoKeywords(List.of("TASK"), List.of());
        final var org = Org.parse("* a\n", config).replaceRange(2, 2, "TASK ");
        assertThat(org.config()).isEqualTo(config);
        final var headline = org.firstNode(Headline.class);
        assertThat(headline).isNotNull();
        assertThat(headline.todoKeyword()).isEqualTo("TASK");
    }

    @Test
    void subscriptAndSuperscriptRecognitionIsConfigurable() {
        final var text = "a_b c^{d}\n";
        for (final var mode : UseSubSuperscript.values()) {
            final var org = Org.parse(text, ParseConfig.defaults().withUseSubSuperscript(mode));
            final var counts = org.nodes(Subscript.class).size() + "" + org.nodes(Superscript.class).size();
            switch (mode) {
                case NIL -> assertThat(counts).isEqualTo("00");
                case BRACE -> assertThat(counts).isEqualTo("01");
                case TRUE -> assertThat(counts).isEqualTo("11");
                default -> throw new AssertionError(mode);
            }
        }
        assertThat(ParseConfig.defaults().useSubSuperscript()).isEqualTo(UseSubSuperscript.TRUE);
    }

    @Test
    void affiliatedKeywords() {
        final var text = "#+CAPTION[s]: cap *x*\n#+NAME: n\nParagraph.\n";
        final var paragraph = Org.parse(text).firstNode(Paragraph.class);
        assertThat(paragraph).isNotNull();
        assertThat(paragraph.affiliatedKeywords())
            .extracting(keyword -> keyword.key() + "|" + keyword.optional() + "|" + keyword.value())
            .containsExactly("CAPTION|s|cap *x*", "NAME|null|n");
        assertThat(Org.parse(text).nodes(Bold.class)).hasSize(1);

        final var unparsed = Org.parse(text, ParseConfig.defaults().withParsedKeywords(List.of()));
        assertThat(unparsed.nodes(AffiliatedKeyword.class)).hasSize(2);
        assertThat(unparsed.nodes(Bold.class)).isEmpty();

        final var nameOnly = Org.parse(text, ParseConfig.defaults().withAffiliatedKeywords(List.of("name")));
        assertThat(nameOnly.nodes(AffiliatedKeyword.class)).extracting(AffiliatedKeyword::key).containsExactly("NAME");
        assertThat(nameOnly.nodes(Keyword.class)).extracting(Keyword::key).containsExactly("CAPTION");

        final var dual = "#+NAME[o]: n\nParagraph.\n";
        assertThat(Org.parse(dual).nodes(AffiliatedKeyword.class)).isEmpty();
        final var dualName = Org.parse(dual, ParseConfig.defaults().withDualKeywords(List.of("NAME")))
            .firstNode(AffiliatedKeyword.class);
        assertThat(dualName).isNotNull();
        assertThat(dualName.optional()).isEqualTo("o");
        assertThat(dualName.value()).isEqualTo("n");
    }

    @Test
    void propertyDrawerEntries() {
        final var org = Org.parse("* h\n:PROPERTIES:\n:ID: 1\n:A: x\n:A+: y\n:END:\n");
        final var drawer = org.firstNode(PropertyDrawer.class);
        assertThat(drawer).isNotNull();
        assertThat(drawer.entries()).containsExactly(Map.entry("ID", "1"), Map.entry("A", "x y"));
        assertThat(drawer.get("id")).isEqualTo("1");
        assertThat(drawer.get("a")).isEqualTo("x y");
        assertThat(drawer.get("missing")).isNull();
        assertThat(drawer.properties()).hasSize(3);
    }

    @Test
    void inlineObjectAccessors() {
        final var org = Org.parse(
            "{{{m(a, b\\,c)}}} {{{bare}}} call_square[:a 1](4)[:results raw] src_python[:exports code]{print(1)} "
                + "@@html:<b>@@ <<here>> [33%] [1/3]\n"
        );
        assertThat(org.nodes(Macros.class)).extracting(Macros::name).containsExactly("m", "bare");
        final var macro = org.nodes(Macros.class).get(0);
        assertThat(macro.arguments()).isEqualTo("a, b\\,c");
        assertThat(macro.argumentList()).containsExactly("a", "b,c");
        assertThat(org.nodes(Macros.class).get(1).arguments()).isNull();
        assertThat(org.nodes(Macros.class).get(1).argumentList()).isEmpty();

        final var call = org.firstNode(InlineCall.class);
        assertThat(call).isNotNull();
        assertThat(call.name()).isEqualTo("square");
        assertThat(call.arguments()).isEqualTo("4");
        assertThat(call.insideHeader()).isEqualTo(":a 1");
        assertThat(call.endHeader()).isEqualTo(":results raw");

        final var source = org.firstNode(InlineSrc.class);
        assertThat(source).isNotNull();
        assertThat(source.language()).isEqualTo("python");
        assertThat(source.parameters()).isEqualTo(":exports code");
        assertThat(source.body()).isEqualTo("print(1)");

        final var snippet = org.firstNode(Snippet.class);
        assertThat(snippet).isNotNull();
        assertThat(snippet.backend()).isEqualTo("html");
        assertThat(snippet.value()).isEqualTo("<b>");

        final var target = org.firstNode(Target.class);
        assertThat(target).isNotNull();
        assertThat(target.target()).isEqualTo("here");

        assertThat(org.nodes(Cookie.class)).extracting(Cookie::isPercent).containsExactly(true, false);
        assertThat(org.nodes(Cookie.class)).extracting(Cookie::value).containsExactly("33%", "1/3");
    }

    @Test
    void imageLinks() {
        final var links = Org.parse("[[./a.PNG]] [[file:b.svg][b]] [[https://example.com]] [[c.jpeg]]\n")
            .nodes(Link.class);
        assertThat(links).extracting(Link::isImage).containsExactly(true, false, false, true);
        assertThat(links).extracting(Link::hasDescription).containsExactly(false, true, false, false);
    }

    @Test
    void clockAccessors() {
        final var clocks = Org.parse(
            "* h\nCLOCK: [2024-01-02 Tue 10:00]--[2024-01-02 Tue 11:30] =>  1:30\nCLOCK: [2024-01-03 Wed 09:00]\n"
        ).nodes(Clock.class);
        assertThat(clocks).hasSize(2);
        assertThat(clocks.get(0).duration()).isEqualTo("1:30");
        assertThat(clocks.get(0).isRunning()).isFalse();
        assertThat(clocks.get(1).duration()).isNull();
        assertThat(clocks.get(1).isRunning()).isTrue();
        final var running = clocks.get(1).timestamp();
        assertThat(running).isNotNull();
        assertThat(running.dayStart()).isEqualTo(3);
    }

    @Test
    void blockAccessors() {
        final var text = "#+BEGIN: clocktable :scope file\nSome text.\n#+END:\n"
            + "#+CALL: square(x=4)\n"
            + "#+BEGIN_EXPORT html\n,#+x\n<b>\n#+END_EXPORT\n"
            + "#+BEGIN_VERSE\n Roses *are* red\n#+END_VERSE\n";
        final var org = Org.parse(text);

        final var dynamic = org.firstNode(DynBlock.class);
        assertThat(dynamic).isNotNull();
        assertThat(dynamic.name()).isEqualTo("clocktable");
        assertThat(dynamic.parameters()).isEqualTo(":scope file");
        assertThat(dynamic.elements()).hasSize(1).first().isInstanceOf(Paragraph.class);
        assertThat(text.substring(dynamic.contentStart(), dynamic.contentEnd())).isEqualTo("Some text.\n");

        final var call = org.firstNode(BabelCall.class);
        assertThat(call).isNotNull();
        assertThat(call.value()).isEqualTo("square(x=4)");
        assertThat(call.affiliatedKeywords()).isEmpty();

        final var export = org.firstNode(ExportBlock.class);
        assertThat(export).isNotNull();
        assertThat(export.type()).isEqualTo("html");
        assertThat(export.value()).isEqualTo("#+x\n<b>\n");

        final var verse = org.firstNode(VerseBlock.class);
        assertThat(verse).isNotNull();
        assertThat(text.substring(verse.contentStart(), verse.contentEnd())).isEqualTo(" Roses *are* red\n");
        assertThat(org.nodes(Bold.class)).hasSize(1);
    }

    @Test
    void entityAccessors() {
        final var entities = Org.parse("\\alpha \\nbsp{}x \\frac12 \\alpha2 \\alphabet \\unknown\n")
            .nodes(Entity.class);
        assertThat(entities).extracting(Entity::name).containsExactly("alpha", "nbsp", "frac12", "alpha");
        assertThat(entities).extracting(Entity::hasBraces).containsExactly(false, true, false, false);
        final var alpha = entities.get(0);
        assertThat(alpha.latex()).isEqualTo("\\alpha");
        assertThat(alpha.html()).isEqualTo("&alpha;");
        assertThat(alpha.utf8()).isEqualTo("\u03b1");
        assertThat(entities.get(1).definition()).isEqualTo(Entities.lookup("nbsp"));
        assertThat(Entities.lookup("alphabet")).isNull();
    }

    @Test
    void clozeAccessors() {
        final var config = ParseConfig.defaults().withCloze(true);
        final var org = Org.parse(
            "{{text}} {{text}@id} {{text}{hint}} {{*bold*}{hint}@id} {{$\\frac{a}{b}$}{fractions}}\n",
            config
        );
        final var clozes = org.nodes(Cloze.class);
        assertThat(clozes).extracting(Cloze::textRaw)
            .containsExactly("text", "text", "text", "*bold*", "$\\frac{a}{b}$");
        assertThat(clozes).extracting(Cloze::hint).containsExactly(null, null, "hint", "hint", "fractions");
        assertThat(clozes).extracting(Cloze::id).containsExactly(null, "id", null, "id", null);
        assertThat(clozes.get(3).text()).extracting(SyntaxElement::kind).containsExactly(SyntaxKind.BOLD);
        assertThat(org.toOrg()).isEqualTo(org.text());

        for (final var text : List.of("{{}}\n", "{{text}\n", "{{text}{}\n", "{{text}a}\n")) {
            assertThat(Org.parse(text, config).nodes(Cloze.class)).as(text).isEmpty();
        }
        assertThat(Org.parse("{{text}}\n").nodes(Cloze.class)).isEmpty();
    }
}
