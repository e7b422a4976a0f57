// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.util.condition;

/**
 * The base type for all conditions.
 * <p>
 * A condition describes an occurrence that code further up the call stack may want to react to. Handlers run
 * <em>before</em> the stack is unwound, so they can still see the restarts and traces established by the code that
 * signaled the condition.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final String message) {
        this.message = message;
    }

    /**
     * Retrieves the short user-readable message of this condition.
     */
    public final String message() {
        return message;
    }

    /**
     * Retrieves the full user-readable message of this condition. Subclasses with more context than fits into
     * {@link #message()} override this.
     */
    public String detailedMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + message;
    }

    private final String message;
}
