// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Typed views over syntax nodes, one per container kind.
 */
@NonNullByDefault
package verdant.ast;

import verdant.util.annotation.NonNullByDefault;
