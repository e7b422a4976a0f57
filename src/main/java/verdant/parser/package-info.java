// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The Org parser: a hand-written recursive descent parser producing lossless green trees.
 */
@NonNullByDefault
package verdant.parser;

import verdant.util.annotation.NonNullByDefault;
