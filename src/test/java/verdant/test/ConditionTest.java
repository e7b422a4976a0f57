// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.test;

import java.util.ArrayList;
import verdant.util.Trace;
import verdant.util.condition.Condition;
import verdant.util.condition.ConditionContext;
import verdant.util.condition.Handler;
import verdant.util.condition.Restart;
import verdant.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;

final class ConditionTest {
    @Test
    void signalReturnsWhenNoHandlerAccepts() {
        final var seen = new ArrayList<String>();
        try (final var handler = new Handler(signaled -> seen.add(signaled.condition().message()))) {
            handler.use();
            ConditionContext.signal(new TestCondition("first"));
        }
        assertThat(seen).containsExactly("first");
        ConditionContext.signal(new TestCondition("unseen"));
        assertThat(seen).containsExactly("first");
    }

    @Test
    void errorThrowsWhenNoHandlerAccepts() {
        assertThatExceptionOfType(UnhandledErrorError.class)
            .isThrownBy(() -> {
                throw ConditionContext.error(new TestCondition("boom"));
            })
            .withMessageContaining("boom");
    }

    @Test
    void handlersRunNewestFirst() {
        final var order = new ArrayList<String>();
        try (final var outer = new Handler(signaled -> order.add("outer"))) {
            outer.use();
            try (final var inner = new Handler(signaled -> order.add("inner"))) {
                inner.use();
                ConditionContext.signal(new TestCondition("x"));
            }
        }
        assertThat(order).containsExactly("inner", "outer");
    }

    @Test
    void handlersCanUnwindToRestarts() {
        try (final var handler = new Handler(signaled -> {
            final var restart = ConditionContext.findRestart("use-default");
            if (restart != null) {
                restart.unwindTo();
            }
        })) {
            handler.use();
            final var result = ConditionContext.withRestart("use-default", restart -> {
                assertThat(ConditionContext.restarts()).extracting(Restart::name).containsExactly("use-default");
                throw ConditionContext.error(new TestCondition("fail"));
            });
            assertThat(result).isNull();
        }
        assertThat(ConditionContext.restarts()).isEmpty();
        assertThat(ConditionContext.findRestart("use-default")).isNull();
    }

    @Test
    void restartsReturnTheCallbackResult() {
        final Integer result = ConditionContext.withRestart("unused", restart -> 42);
        assertThat(result).isEqualTo(42);
    }

    @Test
    void tracesAreVisibleToHandlers() {
        final var traces = new ArrayList<String>();
        try (final var handler = new Handler(signaled -> traces.addAll(Trace.activeTraces()))) {
            handler.use();
            try (final var outer = new Trace("Parsing document")) {
                outer.use();
                try (final var inner = new Trace(() -> "Parsing headline " + 3)) {
                    inner.use();
                    ConditionContext.signal(new TestCondition("x"));
                }
            }
        }
        assertThat(traces).containsExactly("Parsing headline 3", "Parsing document");
        assertThat(Trace.activeTraces()).isEmpty();
    }

    private static final class TestCondition extends Condition {
        TestCondition(final String message) {
            super(message);
        }
    }
}
