package org.frugal.ls.frontend.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic pre-order walker for syntax trees.
 * Instead of the Visitor pattern, this walker uses a handler-based system keyed by
 * {@link NodeKind}, so analysis code only registers for the node kinds it cares about.
 */
public class TreeWalker {

    private final Map<NodeKind, Consumer<SyntaxNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from node kinds to their corresponding handlers.
     */
    public TreeWalker(Map<NodeKind, Consumer<SyntaxNode>> handlers) {
        this.handlers = new EnumMap<>(NodeKind.class);
        this.handlers.putAll(handlers);
    }

    /**
     * Creates a walker with a single handler for one node kind.
     * @param kind The node kind to react to.
     * @param handler The handler to run for every node of that kind.
     * @return The new walker.
     */
    public static TreeWalker forKind(NodeKind kind, Consumer<SyntaxNode> handler) {
        return new TreeWalker(Map.of(kind, handler));
    }

    /**
     * Walks a node and its descendants in document order (pre-order).
     * @param root The node to start at; {@code null} is ignored.
     */
    public void walk(SyntaxNode root) {
        preOrder(root, node -> {
            Consumer<SyntaxNode> handler = handlers.get(node.kind());
            if (handler != null) {
                handler.accept(node);
            }
        });
    }

    /**
     * Visits every node below and including {@code root} in document order.
     * The walk is iterative, so deeply nested trees cannot overflow the stack.
     * @param root The node to start at; {@code null} is ignored.
     * @param visitor The callback for each node.
     */
    public static void preOrder(SyntaxNode root, Consumer<SyntaxNode> visitor) {
        if (root == null) {
            return;
        }
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            visitor.accept(node);
            // Push children in reverse so the leftmost child is visited first.
            for (int i = node.childCount() - 1; i >= 0; i--) {
                stack.push(node.child(i));
            }
        }
    }
}
