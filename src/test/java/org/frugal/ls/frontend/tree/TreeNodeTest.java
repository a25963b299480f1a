package org.frugal.ls.frontend.tree;

import org.frugal.ls.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class TreeNodeTest {

    private static TreeNode leaf(NodeKind kind, int start, int end) {
        return TreeNode.leaf(kind, start, end, new SourcePoint(0, start), new SourcePoint(0, end));
    }

    @Test
    void branchSpanFollowsItsChildren() {
        TreeNode branch = TreeNode.branch(NodeKind.FIELD, 4, new SourcePoint(0, 4));
        branch.add(leaf(NodeKind.INTEGER, 4, 5)).add(leaf(NodeKind.IDENTIFIER, 10, 14));

        assertThat(branch.startOffset()).isEqualTo(4);
        assertThat(branch.endOffset()).isEqualTo(14);
        assertThat(branch.endPoint()).isEqualTo(new SourcePoint(0, 14));
        assertThat(branch.child(1).parent()).isSameAs(branch);
        assertThat(branch.indexOfChild(branch.child(1))).isEqualTo(1);
    }

    @Test
    void rootKeepsItsStartAtZero() {
        TreeNode root = TreeNode.root();
        root.add(leaf(NodeKind.KEYWORD, 8, 14));
        root.extendTo(20, new SourcePoint(1, 0));

        assertThat(root.startOffset()).isZero();
        assertThat(root.endOffset()).isEqualTo(20);
    }

    @Test
    void nodeCannotBeAttachedTwice() {
        TreeNode child = leaf(NodeKind.IDENTIFIER, 0, 1);
        TreeNode.branch(NodeKind.FIELD, 0, new SourcePoint(0, 0)).add(child);

        assertThatThrownBy(() -> TreeNode.branch(NodeKind.FIELD, 0, new SourcePoint(0, 0)).add(child))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void textIsEmptyWhenSpanLiesOutsideTheSource() {
        TreeNode node = leaf(NodeKind.IDENTIFIER, 2, 9);

        assertThat(node.text("abc")).isEmpty();
        assertThat(node.text("0123456789")).isEqualTo("2345678");
        assertThat(TreeNode.missing(NodeKind.PUNCTUATION, 3, new SourcePoint(0, 3)).isMissing()).isTrue();
    }

    @Test
    void walkerVisitsInDocumentOrderAndDispatchesByKind() {
        TreeNode root = TreeNode.root();
        TreeNode first = TreeNode.branch(NodeKind.FIELD, 0, new SourcePoint(0, 0));
        first.add(leaf(NodeKind.IDENTIFIER, 0, 1)).add(leaf(NodeKind.IDENTIFIER, 2, 3));
        root.add(first).add(leaf(NodeKind.IDENTIFIER, 4, 5));

        List<Integer> starts = new ArrayList<>();
        TreeWalker.forKind(NodeKind.IDENTIFIER, n -> starts.add(n.startOffset())).walk(root);
        List<NodeKind> order = new ArrayList<>();
        TreeWalker.preOrder(root, n -> order.add(n.kind()));

        assertThat(starts).containsExactly(0, 2, 4);
        assertThat(order).containsExactly(NodeKind.SOURCE_FILE, NodeKind.FIELD,
                NodeKind.IDENTIFIER, NodeKind.IDENTIFIER, NodeKind.IDENTIFIER);
    }

    @Test
    void walkerIgnoresNullRoot() {
        List<SyntaxNode> visited = new ArrayList<>();
        TreeWalker.preOrder(null, visited::add);

        assertThat(visited).isEmpty();
    }
}
