// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@code :PROPERTIES:} drawer of a headline or of the document.
 */
public record PropertyDrawer(SyntaxNode syntax) implements AstNode {
    public PropertyDrawer {
        Views.requireKind(syntax, SyntaxKind.PROPERTY_DRAWER);
    }

    public static @Nullable PropertyDrawer cast(final SyntaxNode node) {
        return (node.kind() == SyntaxKind.PROPERTY_DRAWER) ? new PropertyDrawer(node) : null;
    }

    public List<NodeProperty> properties() {
        return Views.children(syntax, SyntaxKind.NODE_PROPERTY, NodeProperty::new);
    }

    /**
     * Returns the properties as a map from names to values, in order of appearance. A {@code :NAME+:} property
     * appends its value to the preceding value of {@code NAME}, separated by a space.
     */
    public Map<String, String> entries() {
        final var result = new LinkedHashMap<String, String>();
        for (final var property : properties()) {
            final var previous = result.get(property.name());
            if (property.isAppend() && previous != null) {
                result.put(property.name(), previous + " " + property.value());
            } else {
                result.put(property.name(), property.value());
            }
        }
        return result;
    }

    /**
     * Returns the value of the property with the given name, compared case-insensitively, or {@code null}.
     */
    public @Nullable String get(final String name) {
        @Nullable String result = null;
        for (final var property : properties()) {
            if (!property.name().equalsIgnoreCase(name)) {
                continue;
            }
            result = (property.isAppend() && result != null) ? result + " " + property.value() : property.value();
        }
        return result;
    }
}
