// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.util.condition;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when no handler transferred control away from a fatal
 * condition.
 * <p>
 * An unhandled fatal condition is a programming error on the caller's side, so this class extends
 * {@link AssertionError}.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition.detailedMessage());
        this.condition = condition;
    }

    /**
     * Retrieves the condition nobody handled.
     */
    public Condition condition() {
        return condition;
    }

    // Conditions aren't serializable, and neither are these errors in any meaningful way.
    private final transient Condition condition;
}
