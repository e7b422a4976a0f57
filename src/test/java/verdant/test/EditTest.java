// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.test;

import java.util.ArrayList;
import java.util.stream.LongStream;
import verdant.Org;
import verdant.ast.Headline;
import verdant.ast.Paragraph;
import verdant.edit.EditRangeErrorCondition;
import verdant.syntax.TextRange;
import verdant.util.Trace;
import verdant.util.condition.ConditionContext;
import verdant.util.condition.Handler;
import verdant.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

final class EditTest {
    static LongStream provideSeeds() {
        return LongStream.generate(RandomUtils::generateRandomSeed).limit(8);
    }

    @ParameterizedTest(name = seededTestDisplayName)
    @MethodSource("provideSeeds")
    void editedTextIsTheSplicedText(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        var org = Org.parse(RandomUtils.generateDocument(random, 20));
        for (int i = 0; i < 100; i += 1) {
            final var text = org.toOrg();
            final var start = random.nextInt(text.length() + 1);
            final var end = start + random.nextInt(Math.min(text.length() - start, 30) + 1);
            final var replacement = RandomUtils.generateInsertion(random);
            org = org.replaceRange(start, end, replacement);
            assertThat(org.toOrg()).isEqualTo(text.substring(0, start) + replacement + text.substring(end));
        }
    }

    @ParameterizedTest(name = seededTestDisplayName)
    @MethodSource("provideSeeds")
    void editedTreeIsTheTreeOfAFullParse(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        var org = Org.parse(RandomUtils.generateDocument(random, 20));
        for (int i = 0; i < 100; i += 1) {
            final var text = org.toOrg();
            final var start = random.nextInt(text.length() + 1);
            final var end = start + random.nextInt(Math.min(text.length() - start, 30) + 1);
            org = org.replaceRange(start, end, RandomUtils.generateInsertion(random));
            assertThat(org.green()).isEqualTo(Org.parse(org.toOrg()).green());
        }
    }

    @Test
    void editWithinHeadlineKeepsSiblingsShared() {
        final var org = Org.parse("* one\nfirst\n* two\nsecond\n* three\nthird\n");
        final var offset = org.toOrg().indexOf("second");
        final var edited = org.replaceRange(offset, offset + "second".length(), "2nd *bold*");
        assertThat(edited.toOrg()).isEqualTo("* one\nfirst\n* two\n2nd *bold*\n* three\nthird\n");
        assertThat(edited.green().children().get(0)).isSameAs(org.green().children().get(0));
        assertThat(edited.green().children().get(2)).isSameAs(org.green().children().get(2));
        assertThat(edited.green().children().get(1)).isNotSameAs(org.green().children().get(1));
    }

    @Test
    void insertingAHeadlineFallsBackToTheParent() {
        final var org = Org.parse("* one\n** child\ntext\n* two\n");
        final var offset = org.toOrg().indexOf("text");
        final var edited = org.replaceRange(offset, offset, "** inserted\n");
        assertThat(edited.nodes(Headline.class)).extracting(Headline::titleRaw)
            .containsExactly("one", "child", "inserted", "two");
        assertThat(edited.document().headlines().get(0).headlines()).hasSize(2);
        assertThat(edited.green().children().get(edited.green().children().size() - 1))
            .isSameAs(org.green().children().get(org.green().children().size() - 1));
    }

    @Test
    void insertingALowerLevelHeadlineReparsesTheDocument() {
        final var org = Org.parse("* one\n** child\ntext\n");
        final var offset = org.toOrg().indexOf("text");
        final var edited = org.replaceRange(offset, offset, "* top\n");
        assertThat(edited.document().headlines()).extracting(Headline::titleRaw).containsExactly("one", "top");
        assertThat(edited.green()).isEqualTo(Org.parse(edited.toOrg()).green());
    }

    @Test
    void removingTheLastLineBreakIsHandled() {
        final var org = Org.parse("* one\n* two\n");
        final var edited = org.replaceRange(new TextRange(4, 6), "");
        assertThat(edited.toOrg()).isEqualTo("* on* two\n");
        assertThat(edited.nodes(Headline.class)).hasSize(1);
    }

    @Test
    void oldVersionsAreUnaffected() {
        final var original = Org.parse("* title\nsome text\n");
        final var paragraph = original.firstNode(Paragraph.class);
        assertThat(paragraph).isNotNull();
        final var edited = original.replaceRange(paragraph.start(), paragraph.end(), "other words\n");
        assertThat(original.toOrg()).isEqualTo("* title\nsome text\n");
        assertThat(paragraph.raw()).isEqualTo("some text\n");
        assertThat(edited.toOrg()).isEqualTo("* title\nother words\n");
        final var editedParagraph = edited.firstNode(Paragraph.class);
        assertThat(editedParagraph).isNotNull();
        assertThat(editedParagraph.raw()).isEqualTo("other words\n");
        assertThat(editedParagraph.syntax().root()).isEqualTo(edited.root());
    }

    @Test
    void emptyEditOfEmptyDocument() {
        final var edited = Org.parse("").replaceRange(0, 0, "* new\n");
        assertThat(edited.toOrg()).isEqualTo("* new\n");
        assertThat(edited.firstNode(Headline.class)).isNotNull();
    }

    @Test
    void invalidRangeIsAnUnhandledError() {
        final var org = Org.parse("* a\n");
        final var error = catchThrowableOfType(() -> org.replaceRange(2, 10, "x"), UnhandledErrorError.class);
        assertThat(error).isNotNull();
        assertThat(error.condition()).isInstanceOf(EditRangeErrorCondition.class);
        assertThatExceptionOfType(UnhandledErrorError.class).isThrownBy(() -> org.replaceRange(3, 1, "x"));
        assertThatExceptionOfType(UnhandledErrorError.class).isThrownBy(() -> org.replaceRange(-1, 0, "x"));
    }

    @Test
    void invalidRangeConditionCanBeHandled() {
        final var org = Org.parse("* a\n");
        final var traces = new ArrayList<String>();
        final var conditions = new ArrayList<EditRangeErrorCondition>();
        try (final var handler = new Handler(signaled -> {
            if (signaled.condition() instanceof EditRangeErrorCondition condition && signaled.isFatal()) {
                conditions.add(condition);
                traces.addAll(Trace.activeTraces());
                final var restart = ConditionContext.findRestart("keep-old-version");
                assertThat(restart).isNotNull();
                restart.unwindTo();
            }
        })) {
            handler.use();
            final var result = ConditionContext.withRestart(
                "keep-old-version",
                restart -> org.replaceRange(2, 10, "x")
            );
            assertThat(result).isNull();
        }
        assertThat(conditions).hasSize(1);
        final var condition = conditions.get(0);
        assertThat(condition.start()).isEqualTo(2);
        assertThat(condition.end()).isEqualTo(10);
        assertThat(condition.documentLength()).isEqualTo(4);
        assertThat(condition.message()).isEqualTo("Invalid edit range 2..10");
        assertThat(condition.detailedMessage()).isEqualTo("Invalid edit range 2..10 in a document of 4 characters");
        assertThat(traces).contains("Replacing range 2..10");
        assertThat(Trace.activeTraces()).isEmpty();
    }

    private static final String seededTestDisplayName = "{displayName} [{index}] seed = {0}";
}
