// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The persistent lossless syntax tree: immutable, structurally shared green elements and positioned red handles.
 */
@NonNullByDefault
package verdant.syntax;

import verdant.util.annotation.NonNullByDefault;
