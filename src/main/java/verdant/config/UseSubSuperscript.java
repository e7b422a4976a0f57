// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.config;

/**
 * Controls the recognition of subscripts ({@code a_b}) and superscripts ({@code a^b}).
 */
public enum UseSubSuperscript {
    /** Never recognize subscripts nor superscripts. */
    NIL,
    /** Only recognize the braced forms, {@code a_{b}} and {@code a^{b}}. */
    BRACE,
    /** Recognize both braced and plain forms. */
    TRUE,
}
