// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.export;

import java.util.function.Consumer;

/**
 * A receiver of traversal events.
 */
@FunctionalInterface
public interface Traverser {
    /**
     * Handles one event. The context can be used to skip the subtree being entered or to stop the walk.
     */
    void event(Event event, TraversalContext context);

    /**
     * Checks whether the traverser wants {@link Event.Token} events for tokens other than plain text.
     */
    default boolean tokenLevel() {
        return false;
    }

    /**
     * Returns a traverser that passes every event to the given consumer and never skips or stops.
     */
    static Traverser of(final Consumer<? super Event> consumer) {
        return (final Event event, final TraversalContext context) -> consumer.accept(event);
    }
}
