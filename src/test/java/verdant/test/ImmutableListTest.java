// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.LongStream;
import verdant.util.collection.ImmutableList;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

final class ImmutableListTest {
    static LongStream provideSeeds() {
        return LongStream.generate(RandomUtils::generateRandomSeed).limit(8);
    }

    @Test
    void toStringWorks() {
        assertThat(ImmutableList.empty()).asString().isEqualTo("[]");
        assertThat(ImmutableList.of(5)).asString().isEqualTo("[5]");
        assertThat(ImmutableList.of("abc", "def", "")).asString().isEqualTo("[abc, def, ]");
    }

    @Test
    void equalsWorks() {
        assertThat(ImmutableList.empty()).isEqualTo(List.of());
        assertThat(ImmutableList.of(5)).isNotSameAs(ImmutableList.of(5));
        assertThat(ImmutableList.of(5)).isEqualTo(ImmutableList.of(5));
        assertThat(ImmutableList.of(5, 10)).isNotEqualTo(ImmutableList.of(10, 5));
        assertThat(ImmutableList.of(1, 2, 3)).isEqualTo(List.of(1, 2, 3));
    }

    @Test
    void isUnmodifiable() {
        final var list = ImmutableList.of(1, 2, 3);
        assertThatExceptionOfType(UnsupportedOperationException.class).isThrownBy(() -> list.add(4));
        assertThatExceptionOfType(UnsupportedOperationException.class).isThrownBy(() -> list.set(0, 4));
        assertThatExceptionOfType(UnsupportedOperationException.class).isThrownBy(() -> list.remove(0));
    }

    @Test
    void copyOfReturnsImmutableListsAsIs() {
        final var list = ImmutableList.of(1, 2, 3);
        assertThat(ImmutableList.copyOf(list)).isSameAs(list);
        final var source = new ArrayList<>(List.of(1, 2, 3));
        final var copy = ImmutableList.copyOf(source);
        source.set(0, 100);
        assertThat(copy).containsExactly(1, 2, 3);
        assertThat(ImmutableList.copyOf(List.of())).isSameAs(ImmutableList.empty());
    }

    @Test
    void withLeavesTheOriginalUntouched() {
        final var list = ImmutableList.of("a", "b", "c");
        final var changed = list.with(1, "B");
        assertThat(changed).containsExactly("a", "B", "c");
        assertThat(list).containsExactly("a", "b", "c");
    }

    @Test
    void mapWorks() {
        assertThat(ImmutableList.map(List.of("a", "bb", "ccc"), String::length)).containsExactly(1, 2, 3);
        assertThat(ImmutableList.map(List.<String>of(), String::length)).isSameAs(ImmutableList.empty());
    }

    @Test
    void spliceRejectsInvalidRanges() {
        final var list = ImmutableList.of(1, 2, 3);
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> list.splice(2, 1, List.of()));
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> list.splice(-1, 1, List.of()));
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> list.splice(0, 4, List.of()));
    }

    @ParameterizedTest(name = seededTestDisplayName)
    @MethodSource("provideSeeds")
    void spliceMatchesArrayList(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        var list = ImmutableList.<Integer>empty();
        final var expected = new ArrayList<Integer>();
        for (int i = 0; i < 200; i += 1) {
            final var from = random.nextInt(expected.size() + 1);
            final var to = from + random.nextInt(expected.size() - from + 1);
            final var replacement = new ArrayList<Integer>();
            final var count = random.nextInt(4);
            for (int j = 0; j < count; j += 1) {
                replacement.add(random.nextInt());
            }
            list = list.splice(from, to, replacement);
            expected.subList(from, to).clear();
            expected.addAll(from, replacement);
            assertThat(list).isEqualTo(expected);
        }
    }

    @Test
    void builderWorks() {
        final var builder = ImmutableList.<Integer>builder();
        assertThat(builder.isEmpty()).isTrue();
        assertThat(builder.freeze()).isSameAs(ImmutableList.empty());
        for (int i = 0; i < 20; i += 1) {
            builder.add(i);
        }
        final var first = builder.freeze();
        builder.addAll(List.of(20, 21));
        assertThat(first).hasSize(20);
        assertThat(builder.size()).isEqualTo(22);
        assertThat(builder.freeze()).hasSize(22).endsWith(20, 21);
    }

    private static final String seededTestDisplayName = "{displayName} [{index}] seed = {0}";
}
