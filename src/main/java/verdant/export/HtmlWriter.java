// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.export;

/**
 * An append-only HTML output buffer. Text and attribute values are escaped; raw markup is written as is.
 */
public final class HtmlWriter {
    HtmlWriter() {
    }

    public HtmlWriter startTag(final String name, final Attribute... attributes) {
        builder.append('<').append(name);
        writeAttributes(attributes);
        builder.append('>');
        return this;
    }

    public HtmlWriter endTag(final String name) {
        builder.append("</").append(name).append('>');
        return this;
    }

    /**
     * Writes a self-closed element, such as {@code <br/>}.
     */
    public HtmlWriter emptyTag(final String name, final Attribute... attributes) {
        builder.append('<').append(name);
        writeAttributes(attributes);
        builder.append("/>");
        return this;
    }

    public HtmlWriter text(final String text) {
        HtmlEscape.escapeTo(builder, text);
        return this;
    }

    /**
     * Writes markup without escaping it.
     */
    public HtmlWriter raw(final String html) {
        builder.append(html);
        return this;
    }

    @Override
    public String toString() {
        return builder.toString();
    }

    private void writeAttributes(final Attribute[] attributes) {
        for (final var attribute : attributes) {
            builder.append(' ').append(attribute.name()).append("=\"");
            HtmlEscape.escapeTo(builder, attribute.value());
            builder.append('"');
        }
    }

    private final StringBuilder builder = new StringBuilder();

    /**
     * An attribute with a string value.
     */
    public record Attribute(String name, String value) {
        public static Attribute of(final String name, final String value) {
            return new Attribute(name, value);
        }
    }
}
