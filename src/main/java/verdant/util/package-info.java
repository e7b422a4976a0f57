// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small utilities that don't belong anywhere else.
 */
@NonNullByDefault
package verdant.util;

import verdant.util.annotation.NonNullByDefault;
