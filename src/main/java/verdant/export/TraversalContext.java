// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.export;

/**
 * Lets a {@link Traverser} control the walk it's receiving events from.
 * <p>
 * Requests are consumed after each event: skipping one subtree doesn't affect its siblings.
 */
public final class TraversalContext {
    TraversalContext() {
    }

    /**
     * When called while handling an {@link Event.Enter}, suppresses the events of the container's descendants and its
     * matching {@link Event.Leave}. Has no effect for other events.
     */
    public void skip() {
        skipRequested = true;
    }

    /**
     * Ends the walk. No further events are produced, pending leave events included.
     */
    public void stop() {
        stopRequested = true;
    }

    boolean takeSkip() {
        final var result = skipRequested;
        skipRequested = false;
        return result;
    }

    boolean isStopped() {
        return stopRequested;
    }

    private boolean skipRequested;
    private boolean stopRequested;
}
