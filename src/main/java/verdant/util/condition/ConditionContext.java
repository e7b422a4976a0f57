// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.util.condition;

import java.util.ArrayList;
import java.util.List;
import verdant.util.SneakyThrow;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The calling thread's registry of installed handlers and active restart points.
 * <p>
 * Every thread has its own context. It is only reachable through the static methods of this class.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition, offering it to the installed handlers from the newest to the oldest.
     * <p>
     * Returns normally if every handler declines. May throw {@link Unwind} if a handler transfers control to a
     * restart point.
     */
    public static void signal(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given condition as fatal.
     * <p>
     * Behaves like {@link #signal(Condition)}, except that if every handler declines, {@link UnhandledErrorError} is
     * thrown. The method never returns normally; it is declared to return the error so that call sites can write
     * {@code throw ConditionContext.error(...)} to help the compiler's control flow analysis.
     */
    public static UnhandledErrorError error(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Executes the given callback with a restart point named {@code restartName} around it.
     *
     * @return The value returned by {@code callback}, or {@code null} if a handler unwound to this restart point.
     */
    public static <T> @Nullable T withRestart(final String restartName, final RestartCallback<? extends T> callback) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the active restart points, ordered from the newest to the oldest.
     */
    public static List<Restart> restarts() {
        final var result = new ArrayList<Restart>();
        for (var restart = localContext().firstRestart; restart != null; restart = restart.next) {
            result.add(restart);
        }
        return result;
    }

    /**
     * Returns the newest active restart point with the given name, or {@code null} if there's none.
     */
    public static @Nullable Restart findRestart(final String restartName) {
        for (var restart = localContext().firstRestart; restart != null; restart = restart.next) {
            if (restart.name().equals(restartName)) {
                return restart;
            }
        }
        return null;
    }

    static ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final SignaledCondition condition) {
        // A condition signaled from within a handler is only offered to the handlers older than that one.
        var handler = (currentHandler == null) ? firstHandler : currentHandler.next;
        for (; handler != null; handler = handler.next) {
            final var currentSave = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } catch (final Unwind unwind) {
                throw SneakyThrow.doThrow(unwind);
            } finally {
                currentHandler = currentSave;
            }
        }
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    @SuppressWarnings("nullness:type.argument") // Never null, CF doesn't understand withInitial.
    private static final ThreadLocal<ConditionContext> localContext = ThreadLocal.withInitial(ConditionContext::new);
}
