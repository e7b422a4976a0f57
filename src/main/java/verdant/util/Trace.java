// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.util;

import java.util.ArrayList;
import java.util.List;
import verdant.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A user-readable description of the operation currently in progress, intended to be used within try-with-resources.
 * <p>
 * Parsing and editing establish traces such as "Replacing range 3..7 of a 120 character document", so that a
 * condition handler can report <em>what</em> the engine was doing when a condition was signaled, not just which
 * condition it was. Traces are not machine stack traces.
 * <p>
 * A trace must be closed by the thread that created it.
 */
public final class Trace implements AutoCloseable {
    /**
     * Establishes a new trace whose message is computed on first request, at most once.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Establishes a new trace with the given message.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object messageOrSupplier) {
        final var owner = localChain();
        outer = owner.innermost;
        this.messageOrSupplier = messageOrSupplier;
        this.owner = owner;
        owner.innermost = this;
    }

    /**
     * Returns the messages of the calling thread's active traces, innermost first.
     */
    public static List<String> activeTraces() {
        final var result = new ArrayList<String>();
        for (var trace = localChain().innermost; trace != null; trace = trace.outer) {
            result.add(trace.message());
        }
        return result;
    }

    /**
     * Does nothing; silences warnings about unreferenced auto-closeable resources.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Removes this trace from the calling thread's chain of active traces.
     */
    @Override
    public void close() {
        assert owner == localChain() : "Trace closed by a different thread";
        assert owner.innermost == this : "Traces closed out of order";
        owner.innermost = outer;
    }

    /**
     * Returns the message of this trace, evaluating the supplier if that hasn't been done yet.
     */
    public String message() {
        if (messageOrSupplier instanceof String string) {
            return string;
        }
        final var string = ((MessageSupplier) messageOrSupplier).get();
        messageOrSupplier = string;
        return string;
    }

    private static Chain localChain() {
        return chain.get();
    }

    @SuppressWarnings("nullness:type.argument") // Never null, CF doesn't understand withInitial.
    private static final ThreadLocal<Chain> chain = ThreadLocal.withInitial(Chain::new);

    private final @Nullable Trace outer;
    // Either the String message or the MessageSupplier that produces it.
    private Object messageOrSupplier;
    private final Chain owner;

    private static final class Chain {
        private @Nullable Trace innermost = null;
    }
}
