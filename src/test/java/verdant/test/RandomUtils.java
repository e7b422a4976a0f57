// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.test;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.nio.ByteOrder;
import java.security.SecureRandom;
import java.util.List;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

final class RandomUtils {
    private RandomUtils() {
    }

    static RandomGenerator createGenerator(final long seed) {
        return factory.create(seed);
    }

    static long generateRandomSeed() {
        return SeedGenerator.generateSeed();
    }

    /**
     * Generates a document of the given number of lines picked from a fixed set of Org fragments, well-formed or not,
     * optionally leaving the final newline out.
     */
    static String generateDocument(final RandomGenerator random, final int lines) {
        final var builder = new StringBuilder();
        for (int i = 0; i < lines; i += 1) {
            builder.append(fragments.get(random.nextInt(fragments.size())));
        }
        if (builder.length() > 0 && random.nextBoolean()) {
            builder.setLength(builder.length() - 1);
        }
        return builder.toString();
    }

    /**
     * Generates a short piece of text to insert into a document: a fragment, a part of one, or a few characters that
     * tend to start or end constructs.
     */
    static String generateInsertion(final RandomGenerator random) {
        return switch (random.nextInt(3)) {
            case 0 -> fragments.get(random.nextInt(fragments.size()));
            case 1 -> {
                final var fragment = fragments.get(random.nextInt(fragments.size()));
                yield fragment.substring(0, random.nextInt(fragment.length() + 1));
            }
            default -> {
                final var builder = new StringBuilder();
                final var length = random.nextInt(4);
                for (int i = 0; i < length; i += 1) {
                    builder.append(punctuation.charAt(random.nextInt(punctuation.length())));
                }
                yield builder.toString();
            }
        };
    }

    private static final RandomGeneratorFactory<?> factory = RandomGeneratorFactory.of("L32X64MixRandom");

    private static final String punctuation = "*\n :[]<>-+|#/=~_^\\{}";

    private static final List<String> fragments = List.of(
        "* Headline\n",
        "** TODO [#A] Second level :work:home:\n",
        "*** DONE Third\n",
        "****4 not a headline\n",
        "* COMMENT hidden\n",
        "SCHEDULED: <2024-01-02 Tue 10:00> DEADLINE: <2024-01-05 Fri>\n",
        ":PROPERTIES:\n",
        ":ID: 1234\n",
        ":END:\n",
        "Plain paragraph text.\n",
        "Some *bold* and /italic/ with =verbatim= and ~code~.\n",
        "A [[https://example.com][link]] and [[file:image.png]].\n",
        "Footnote[fn:1] and <<target>> with a cookie [1/2].\n",
        "[fn:1] The definition.\n",
        "\n",
        "\n\n",
        "- item one\n",
        "- [X] checked item\n",
        "  continued item text\n",
        "1. ordered\n",
        "- term :: description\n",
        "| a | b |\n",
        "|---+---|\n",
        "| 1 | *2* |\n",
        "#+TBLFM: $2=$1\n",
        "#+TITLE: A title\n",
        "#+CAPTION: Caption\n",
        "#+BEGIN_SRC java :tangle yes\n",
        "int x = 1;\n",
        ",* escaped\n",
        "#+END_SRC\n",
        "#+BEGIN_QUOTE\n",
        "#+END_QUOTE\n",
        "#+BEGIN_EXAMPLE\n",
        "#+END_EXAMPLE\n",
        ": fixed width\n",
        "# a comment\n",
        "-----\n",
        ":LOGBOOK:\n",
        "CLOCK: [2024-01-02 Tue 10:00]--[2024-01-02 Tue 11:00] =>  1:00\n",
        "Text with x^2 and a_i, src_python{1 + 1} and call_f(1).\n",
        "Line break\\\\\n",
        "@@html:<b>@@ snippet {{{macro(a)}}}\n",
        "Entities \\alpha, \\nbsp{}and \\frac12 but not \\alphabet; {{cloze}{hint}@id}\n",
        "\t tabbed line\n"
    );

    private static final class SeedGenerator {
        private static long generateSeed() {
            final var bytes = new byte[Long.BYTES];
            secureRandom.nextBytes(bytes);
            return (long) longView.get(bytes, 0);
        }

        private static final SecureRandom secureRandom = new SecureRandom();
        private static final VarHandle longView =
            MethodHandles.byteArrayViewVarHandle(long[].class, ByteOrder.nativeOrder()).withInvokeExactBehavior();
    }
}
