// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.export;

import java.util.ArrayList;
import java.util.List;
import verdant.ast.AstNode;
import verdant.ast.AstNodes;
import verdant.syntax.SyntaxElement;
import verdant.syntax.SyntaxKind;
import verdant.syntax.SyntaxNode;
import verdant.syntax.SyntaxToken;
import verdant.util.UnreachableCodeReachedError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The depth-first, pre-order walk over a syntax tree.
 * <p>
 * How an element is treated depends on the {@linkplain SyntaxKind.Role role} of its kind: containers are surfaced
 * with enter and leave events around their children, transparent nodes are replaced by their children, opaque nodes
 * produce nothing. The walk uses an explicit stack, so arbitrarily deep trees don't overflow the call stack.
 */
public final class Traversal {
    private Traversal() {
    }

    /**
     * Walks the subtree rooted at the given node, passing the events to the traverser.
     * <p>
     * The tree must not be edited during the walk; since trees are persistent, this only means that edits made by the
     * traverser are not visible to the walk.
     */
    public static void walk(final SyntaxNode root, final Traverser traverser) {
        final var context = new TraversalContext();
        final var tokenLevel = traverser.tokenLevel();
        final var stack = new ArrayList<Frame>();
        stack.add(Frame.visit(root));
        while (!stack.isEmpty()) {
            final var frame = stack.remove(stack.size() - 1);
            final var leaving = frame.leaving();
            if (leaving != null) {
                traverser.event(new Event.Leave(leaving), context);
            } else if (frame.element() instanceof SyntaxToken token) {
                if (token.kind() == SyntaxKind.TEXT) {
                    traverser.event(new Event.Text(token), context);
                } else if (tokenLevel) {
                    traverser.event(new Event.Token(token), context);
                }
            } else if (frame.element() instanceof SyntaxNode node) {
                switch (node.kind().role()) {
                    case CONTAINER -> enter(node, traverser, context, stack);
                    case TRANSPARENT -> pushChildren(node, stack);
                    case OPAQUE -> {
                    }
                    case TOKEN -> throw new UnreachableCodeReachedError("Node of token kind " + node.kind());
                }
            }
            if (context.isStopped()) {
                return;
            }
            context.takeSkip();
        }
    }

    private static void enter(
        final SyntaxNode node,
        final Traverser traverser,
        final TraversalContext context,
        final List<Frame> stack
    ) {
        final var view = AstNodes.cast(node);
        if (view == null) {
            throw new UnreachableCodeReachedError("Container kind without a view: " + node.kind());
        }
        traverser.event(new Event.Enter(view), context);
        if (context.isStopped() || context.takeSkip()) {
            return;
        }
        stack.add(Frame.leave(view));
        pushChildren(node, stack);
    }

    private static void pushChildren(final SyntaxNode node, final List<Frame> stack) {
        final var children = node.childrenWithTokens();
        for (int i = children.size() - 1; i >= 0; i -= 1) {
            stack.add(Frame.visit(children.get(i)));
        }
    }

    private record Frame(@Nullable SyntaxElement element, @Nullable AstNode leaving) {
        static Frame visit(final SyntaxElement element) {
            return new Frame(element, null);
        }

        static Frame leave(final AstNode node) {
            return new Frame(null, node);
        }
    }
}
