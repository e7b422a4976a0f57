// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.List;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An item of a plain list.
 */
public record ListItem(SyntaxNode syntax) implements AstNode {
    public ListItem {
        Views.requireKind(syntax, SyntaxKind.LIST_ITEM);
    }

    public static @Nullable ListItem cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.LIST_ITEM) ? new ListItem(node) : null;
    }

    public String bullet() {
        final var bullet = Views.tokenText(syntax, SyntaxKind.LIST_ITEM_BULLET);
        return (bullet == null) ? "" : bullet;
    }

    public boolean isOrdered() {
        final var bullet = bullet();
        return !bullet.isEmpty() && bullet.charAt(0) != '-' && bullet.charAt(0) != '+' && bullet.charAt(0) != '*';
    }

    /**
     * Returns the counter set with {@code [@N]}, without the {@code @}, or {@code null}.
     */
    public @Nullable String counter() {
        final var counter = syntax.firstChild(SyntaxKind.LIST_ITEM_COUNTER);
        final var text = (counter == null) ? null : Views.textToken(counter, 0);
        return (text == null) ? null : text.substring(1);
    }

    public @Nullable CheckBox checkbox() {
        final var checkBox = syntax.firstChild(SyntaxKind.LIST_ITEM_CHECK_BOX);
        final var text = (checkBox == null) ? null : Views.textToken(checkBox, 0);
        if (text == null) {
            return (checkBox == null) ? null : CheckBox.OFF;
        }
        return switch (text) {
            case "X" -> CheckBox.ON;
            case "-" -> CheckBox.TRANSITIONAL;
            default -> CheckBox.OFF;
        };
    }

    /**
     * Returns the number of whitespace characters before the bullet.
     */
    public int indent() {
        final var first = syntax.childrenWithTokens().get(0);
        return (first.kind() == SyntaxKind.WHITESPACE) ? first.textRange().length() : 0;
    }

    /**
     * Returns the tag of a descriptive item, or {@code null}.
     */
    public @Nullable ListItemTag tag() {
        return Views.firstChild(syntax, SyntaxKind.LIST_ITEM_TAG, ListItemTag::new);
    }

    public List<AstNode> content() {
        return Views.elements(syntax.firstChild(SyntaxKind.LIST_ITEM_CONTENT));
    }

    public String contentRaw() {
        final var content = syntax.firstChild(SyntaxKind.LIST_ITEM_CONTENT);
        return (content == null) ? "" : content.text();
    }

    /**
     * The state of an item's check box.
     */
    public enum CheckBox {
        /** {@code [ ]} */
        OFF,
        /** {@code [X]} */
        ON,
        /** {@code [-]} */
        TRANSITIONAL,
    }
}
