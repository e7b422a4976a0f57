// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.test;

import java.util.ArrayList;
import verdant.Org;
import verdant.ast.Bold;
import verdant.ast.Headline;
import verdant.ast.Link;
import verdant.ast.Paragraph;
import verdant.ast.Section;
import verdant.export.Event;
import verdant.export.Traversal;
import verdant.export.TraversalContext;
import verdant.export.Traverser;
import verdant.syntax.SyntaxKind;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class TraversalTest {
    @Test
    void countsHeadlines() {
        final var org = Org.parse("* 1\n** 2\n*** 3\n****4");
        final var count = new int[1];
        org.traverse(Traverser.of(event -> {
            if (event instanceof Event.Enter enter && enter.node() instanceof Headline) {
                count[0] += 1;
            }
        }));
        assertThat(count[0]).isEqualTo(3);
        assertThat(org.nodes(Headline.class)).hasSize(3);
    }

    @Test
    void emitsEventsInDocumentOrder() {
        final var events = new ArrayList<String>();
        Org.parse("* title\n*section*").traverse(Traverser.of(event -> events.add(describe(event))));
        assertThat(events).containsExactly(
            "enter DOCUMENT",
            "enter HEADLINE",
            "enter HEADLINE_TITLE",
            "text title",
            "leave HEADLINE_TITLE",
            "enter SECTION",
            "enter PARAGRAPH",
            "enter BOLD",
            "text section",
            "leave BOLD",
            "leave PARAGRAPH",
            "leave SECTION",
            "leave HEADLINE",
            "leave DOCUMENT"
        );
    }

    @Test
    void tokenLevelTraversersSeeEveryToken() {
        final var org = Org.parse("* a *b*\n");
        final var builder = new StringBuilder();
        org.traverse(new Traverser() {
            @Override
            public void event(final Event event, final TraversalContext context) {
                if (event instanceof Event.Text text) {
                    builder.append(text.token().text());
                } else if (event instanceof Event.Token token) {
                    builder.append(token.token().text());
                }
            }

            @Override
            public boolean tokenLevel() {
                return true;
            }
        });
        assertThat(builder).hasToString("* a *b*\n");
    }

    @Test
    void opaqueNodesAreNotDescendedInto() {
        final var texts = new ArrayList<String>();
        Org.parse("* TODO [#A] title :tag:\n").traverse(Traverser.of(event -> {
            if (event instanceof Event.Text text) {
                texts.add(text.token().text());
            }
        }));
        assertThat(texts).containsExactly("title");
    }

    @Test
    void skipLeavesOutTheSubtreeButNotItsSiblings() {
        final var org = Org.parse("* a\n** b\ntext\n* c\n");
        final var entered = new ArrayList<String>();
        org.traverse((final Event event, final TraversalContext context) -> {
            if (event instanceof Event.Enter enter && enter.node() instanceof Headline headline) {
                entered.add(headline.titleRaw());
                if (headline.level() == 1 && headline.titleRaw().equals("a")) {
                    context.skip();
                }
            }
        });
        assertThat(entered).containsExactly("a", "c");
    }

    @Test
    void skippedNodesGetNoLeaveEvent() {
        final var events = new ArrayList<String>();
        Org.parse("some *bold* text\n").traverse((final Event event, final TraversalContext context) -> {
            events.add(describe(event));
            if (event instanceof Event.Enter enter && enter.node() instanceof Bold) {
                context.skip();
            }
        });
        assertThat(events).containsExactly(
            "enter DOCUMENT",
            "enter SECTION",
            "enter PARAGRAPH",
            "text some ",
            "enter BOLD",
            "text  text",
            "leave PARAGRAPH",
            "leave SECTION",
            "leave DOCUMENT"
        );
    }

    @Test
    void stopEndsTheWalkImmediately() {
        final var events = new ArrayList<String>();
        Org.parse("* a\ntext\n* b\n").traverse((final Event event, final TraversalContext context) -> {
            events.add(describe(event));
            if (event instanceof Event.Enter enter && enter.node() instanceof Paragraph) {
                context.stop();
            }
        });
        assertThat(events).last().isEqualTo("enter PARAGRAPH");
        assertThat(events).doesNotContain("leave DOCUMENT");
    }

    @Test
    void walksSubtrees() {
        final var org = Org.parse("* a\nfirst [[https://example.com][link]]\n* b\nsecond\n");
        final var section = org.firstNode(Section.class);
        assertThat(section).isNotNull();
        final var events = new ArrayList<String>();
        Traversal.walk(section.syntax(), Traverser.of(event -> events.add(describe(event))));
        assertThat(events).first().isEqualTo("enter SECTION");
        assertThat(events).last().isEqualTo("leave SECTION");
        assertThat(events).contains("enter LINK", "text link").doesNotContain("text second");
    }

    @Test
    void firstNodeFindsTheFirstInDocumentOrder() {
        final var org = Org.parse("* [[a][first]]\ntext [[b]]\n");
        final var link = org.firstNode(Link.class);
        assertThat(link).isNotNull();
        assertThat(link.path()).isEqualTo("a");
        assertThat(org.nodes(Link.class)).extracting(Link::path).containsExactly("a", "b");
        assertThat(org.firstNode(Bold.class)).isNull();
    }

    @Test
    void nodeAtOffsetFindsTheInnermostNode() {
        final var org = Org.parse("* a\n** b\nsome *bold* text\n");
        final var offset = org.toOrg().indexOf("bold");
        final var headline = org.nodeAtOffset(Headline.class, offset);
        assertThat(headline).isNotNull();
        assertThat(headline.titleRaw()).isEqualTo("b");
        final var bold = org.nodeAtOffset(Bold.class, offset);
        assertThat(bold).isNotNull();
        assertThat(bold.raw()).isEqualTo("*bold*");
        assertThat(org.nodeAtOffset(Bold.class, 0)).isNull();
    }

    @Test
    void walksDeeplyNestedHeadlines() {
        final var builder = new StringBuilder();
        for (int i = 1; i <= 500; i += 1) {
            builder.append("*".repeat(i)).append(" h\n");
        }
        final var org = Org.parse(builder.toString());
        final var depth = new int[2];
        org.traverse(Traverser.of(event -> {
            if (event instanceof Event.Enter enter && enter.node().kind() == SyntaxKind.HEADLINE) {
                depth[0] += 1;
                depth[1] = Math.max(depth[1], depth[0]);
            } else if (event instanceof Event.Leave leave && leave.node().kind() == SyntaxKind.HEADLINE) {
                depth[0] -= 1;
            }
        }));
        assertThat(depth[1]).isEqualTo(500);
    }

    private static String describe(final Event event) {
        if (event instanceof Event.Enter enter) {
            return "enter " + enter.node().kind();
        } else if (event instanceof Event.Leave leave) {
            return "leave " + leave.node().kind();
        } else if (event instanceof Event.Text text) {
            return "text " + text.token().text();
        } else if (event instanceof Event.Token token) {
            return "token " + token.token().kind();
        }
        throw new AssertionError("Unexpected event " + event);
    }
}
