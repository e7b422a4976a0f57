// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system used to report recoverable errors, such as edits outside of the
 * document, to the caller before the stack is unwound.
 */
@NonNullByDefault
package verdant.util.condition;

import verdant.util.annotation.NonNullByDefault;
