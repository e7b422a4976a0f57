// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Incremental editing of syntax trees.
 */
@NonNullByDefault
package verdant.edit;

import verdant.util.annotation.NonNullByDefault;
