package org.frugal.ls.frontend.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A node of a concrete syntax tree. This is the only view of the parser's output the
 * analysis code relies on: a kind tag, offsets and points, indexed children and a
 * read-only link to the parent.
 * <p>
 * The parent link is a back-reference for bounded upward searches; it does not own the
 * parent and is never used to modify the tree.
 */
public interface SyntaxNode {

    /**
     * Returns the kind of this node.
     * @return The node kind.
     */
    NodeKind kind();

    /**
     * Returns the offset of the first character covered by this node.
     * @return The inclusive start offset into the source string.
     */
    int startOffset();

    /**
     * Returns the offset just after the last character covered by this node.
     * @return The exclusive end offset into the source string.
     */
    int endOffset();

    /**
     * Returns the row/column of the node start.
     * @return The start point.
     */
    SourcePoint startPoint();

    /**
     * Returns the row/column just after the node end.
     * @return The end point.
     */
    SourcePoint endPoint();

    /**
     * Returns the number of direct children.
     * @return The child count.
     */
    int childCount();

    /**
     * Returns the child at the given index.
     * @param index The zero-based child index.
     * @return The child node.
     * @throws IndexOutOfBoundsException if the index is out of range.
     */
    SyntaxNode child(int index);

    /**
     * Returns the parent of this node.
     * @return The parent, or {@code null} for the root.
     */
    SyntaxNode parent();

    /**
     * Checks whether the parser inserted this node to recover from a missing token.
     * @return {@code true} for zero-width recovery nodes.
     */
    default boolean isMissing() {
        return false;
    }

    /**
     * Returns the direct children as a list.
     * @return An unmodifiable list of the children.
     */
    default List<SyntaxNode> children() {
        List<SyntaxNode> result = new ArrayList<>(childCount());
        for (int i = 0; i < childCount(); i++) {
            result.add(child(i));
        }
        return List.copyOf(result);
    }

    /**
     * Returns the source text covered by this node.
     * @param source The source the tree was parsed from.
     * @return The node text, or an empty string if the offsets do not fit the source.
     */
    default String text(String source) {
        int start = startOffset();
        int end = endOffset();
        if (source == null || start < 0 || end > source.length() || start > end) {
            return "";
        }
        return source.substring(start, end);
    }

    /**
     * Returns the first direct child of the given kind.
     * @param childKind The kind to look for.
     * @return The child, if present.
     */
    default Optional<SyntaxNode> firstChild(NodeKind childKind) {
        for (int i = 0; i < childCount(); i++) {
            SyntaxNode c = child(i);
            if (c.kind() == childKind) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the index of the given node among the direct children of this node.
     * @param node The node to look for (compared by identity).
     * @return The index, or -1 if {@code node} is not a direct child.
     */
    default int indexOfChild(SyntaxNode node) {
        for (int i = 0; i < childCount(); i++) {
            if (child(i) == node) {
                return i;
            }
        }
        return -1;
    }
}
