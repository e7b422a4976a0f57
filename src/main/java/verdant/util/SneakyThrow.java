// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.util;

/**
 * Facilities for bypassing the checked exception mechanism.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable as an <em>unchecked exception</em>, no matter its static nor dynamic type.
     * <p>
     * Used for {@link verdant.util.condition.Unwind}, which is checked but has to pass through code, such as
     * condition handlers and parser callbacks, that has no business declaring it.
     * <p>
     * Since this method never returns normally, it's declared to return {@link UnreachableCodeReachedError} that can
     * be "thrown" at call sites to help the compiler's control flow analysis.
     */
    public static UnreachableCodeReachedError doThrow(final Throwable throwable) {
        throw doThrowImpl(throwable);
    }

    // E is erased to Throwable, so the cast doesn't exist in bytecode, while type inference picks RuntimeException
    // for E at the call site.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> UnreachableCodeReachedError doThrowImpl(final Throwable throwable) throws E {
        throw (E) throwable;
    }
}
