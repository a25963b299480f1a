package org.frugal.ls.frontend.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * The {@link SyntaxNode} implementation produced by the Frugal {@code Parser}.
 * Children are appended while the parser builds the tree; the parent link is assigned
 * exactly once, when a node is attached to its parent. After parsing the tree is
 * never modified.
 */
public final class TreeNode implements SyntaxNode {

    private final NodeKind kind;
    private final List<TreeNode> children = new ArrayList<>();
    private final boolean missing;
    private boolean fixedStart;
    private TreeNode parent;
    private int startOffset;
    private int endOffset;
    private SourcePoint startPoint;
    private SourcePoint endPoint;

    private TreeNode(NodeKind kind, int startOffset, int endOffset, SourcePoint startPoint, SourcePoint endPoint, boolean missing) {
        this.kind = kind;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.startPoint = startPoint;
        this.endPoint = endPoint;
        this.missing = missing;
    }

    /**
     * Creates a leaf node with a known span.
     * @param kind The node kind.
     * @param startOffset The inclusive start offset.
     * @param endOffset The exclusive end offset.
     * @param startPoint The start point.
     * @param endPoint The end point.
     * @return The new leaf.
     */
    public static TreeNode leaf(NodeKind kind, int startOffset, int endOffset, SourcePoint startPoint, SourcePoint endPoint) {
        return new TreeNode(kind, startOffset, endOffset, startPoint, endPoint, false);
    }

    /**
     * Creates a zero-width node standing in for a token the parser expected but did not find.
     * @param kind The kind of the missing node.
     * @param offset The offset where the token was expected.
     * @param point The point where the token was expected.
     * @return The new node.
     */
    public static TreeNode missing(NodeKind kind, int offset, SourcePoint point) {
        return new TreeNode(kind, offset, offset, point, point, true);
    }

    /**
     * Creates an inner node whose span is derived from the children appended later.
     * Until the first child is added the node is zero-width at the given position.
     * @param kind The node kind.
     * @param offset The offset at which the node starts.
     * @param point The point at which the node starts.
     * @return The new node.
     */
    public static TreeNode branch(NodeKind kind, int offset, SourcePoint point) {
        return new TreeNode(kind, offset, offset, point, point, false);
    }

    /**
     * Creates the root node of a source file. Its start is pinned to offset 0 so that
     * leading whitespace and comments belong to the root.
     * @return The new root.
     */
    public static TreeNode root() {
        TreeNode root = new TreeNode(NodeKind.SOURCE_FILE, 0, 0, new SourcePoint(0, 0), new SourcePoint(0, 0), false);
        root.fixedStart = true;
        return root;
    }

    /**
     * Appends a child and extends this node's span to cover it.
     * @param child The child to attach; it must not have a parent yet.
     * @return This node, for chaining.
     * @throws IllegalStateException if the child is already attached elsewhere.
     */
    public TreeNode add(TreeNode child) {
        if (child.parent != null) {
            throw new IllegalStateException("Node " + child.kind + " is already attached to a parent.");
        }
        child.parent = this;
        if (children.isEmpty() && !fixedStart) {
            startOffset = child.startOffset;
            startPoint = child.startPoint;
        }
        children.add(child);
        if (child.endOffset >= endOffset) {
            endOffset = child.endOffset;
            endPoint = child.endPoint;
        }
        return this;
    }

    /**
     * Extends the span of this node to the given end, e.g. to make the root cover trailing whitespace.
     * @param offset The new exclusive end offset.
     * @param point The new end point.
     */
    public void extendTo(int offset, SourcePoint point) {
        if (offset > endOffset) {
            endOffset = offset;
            endPoint = point;
        }
    }

    @Override
    public NodeKind kind() {
        return kind;
    }

    @Override
    public int startOffset() {
        return startOffset;
    }

    @Override
    public int endOffset() {
        return endOffset;
    }

    @Override
    public SourcePoint startPoint() {
        return startPoint;
    }

    @Override
    public SourcePoint endPoint() {
        return endPoint;
    }

    @Override
    public int childCount() {
        return children.size();
    }

    @Override
    public SyntaxNode child(int index) {
        return children.get(index);
    }

    @Override
    public SyntaxNode parent() {
        return parent;
    }

    @Override
    public boolean isMissing() {
        return missing;
    }

    @Override
    public String toString() {
        return kind.grammarName() + "[" + startOffset + ".." + endOffset + "]";
    }
}
