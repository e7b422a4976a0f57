// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.ast;

import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import verdant.syntax.TextRange;

/**
 * A typed, read-only view of a container node of the syntax tree.
 * <p>
 * A view holds nothing but its node; every accessor is computed from the node's children when called, so a view can
 * never disagree with the tree it was obtained from. Views of one version of a document stay valid, and keep
 * describing that version, after the document is edited.
 * <p>
 * Views are obtained with {@link AstNodes#cast(SyntaxNode)} or the {@code cast} method of each view type, both of
 * which return {@code null} for a node of a different kind.
 */
public sealed interface AstNode permits
    AffiliatedKeyword, BabelCall, Bold, CenterBlock, Clock, Cloze, Code, Comment, CommentBlock, Cookie, Document,
    Drawer, DynBlock, Entity, ExampleBlock, ExportBlock, FixedWidth, FnDef, FnRef, Headline, HeadlineTitle, InlineCall,
    InlineSrc, Italic, Keyword, LineBreak, Link, ListItem, ListItemTag, Macros, NodeProperty, OrgTable, OrgTableCell,
    OrgTableRow, Paragraph, PlainList, Planning, PropertyDrawer, QuoteBlock, Rule, Section, Snippet, SourceBlock,
    SpecialBlock, Strike, Subscript, Superscript, Target, Timestamp, Underline, Verbatim, VerseBlock {
    /**
     * Returns the underlying node.
     */
    SyntaxNode syntax();

    default SyntaxKind kind() {
        return syntax().kind();
    }

    default TextRange textRange() {
        return syntax().textRange();
    }

    default int start() {
        return textRange().start();
    }

    default int end() {
        return textRange().end();
    }

    /**
     * Returns the exact source text of the node.
     */
    default String raw() {
        return syntax().text();
    }
}
