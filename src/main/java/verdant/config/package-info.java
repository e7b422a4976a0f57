// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Immutable parser configuration.
 */
@NonNullByDefault
package verdant.config;

import verdant.util.annotation.NonNullByDefault;
