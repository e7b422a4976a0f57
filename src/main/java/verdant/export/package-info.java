// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Depth-first traversal of syntax trees and the HTML and Markdown renderers built on it.
 */
@NonNullByDefault
package verdant.export;

import verdant.util.annotation.NonNullByDefault;
