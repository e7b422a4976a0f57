// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Parsing, querying, editing and exporting Org documents; {@link verdant.Org} is the entry point.
 */
@NonNullByDefault
package verdant;

import verdant.util.annotation.NonNullByDefault;
