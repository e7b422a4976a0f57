// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.util.condition;

/**
 * Throwable used by the restart mechanism to transfer control to a {@link Restart}.
 * <p>
 * Exposed only so that methods can declare it. Never catch or throw it manually.
 * <p>
 * It is neither an {@link Exception} nor an {@link Error}: it signals neither a failure nor a bug, only non-local
 * control flow, for which the JVM offers nothing better than throwables.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    Restart target() {
        return target;
    }

    private final transient Restart target;
}
