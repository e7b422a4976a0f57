// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.util.condition;

/**
 * A lazily evaluated message, used by {@link verdant.util.Trace}.
 */
@FunctionalInterface
public interface MessageSupplier {
    String get();
}
