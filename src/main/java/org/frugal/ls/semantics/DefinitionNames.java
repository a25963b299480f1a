package org.frugal.ls.semantics;

import org.frugal.ls.frontend.tree.NodeKind;
import org.frugal.ls.frontend.tree.SyntaxNode;

import java.util.Optional;

/**
 * Locates the name slot of definition nodes.
 * <p>
 * Type expressions are always nested in {@link NodeKind#FIELD_TYPE}, so the first direct
 * {@link NodeKind#IDENTIFIER} child of a definition is its name. Descendants are never
 * consulted; a definition without a direct identifier child has no name.
 */
public final class DefinitionNames {

    private DefinitionNames() {}

    /**
     * Returns the name identifier of a definition node.
     * @param definition The definition node.
     * @return The identifier node, or empty if the definition has none (e.g. while it is being typed).
     */
    public static Optional<SyntaxNode> nameNode(SyntaxNode definition) {
        if (definition == null) {
            return Optional.empty();
        }
        return definition.firstChild(NodeKind.IDENTIFIER);
    }

    /**
     * Checks whether {@code identifier} is the name slot of its parent.
     * @param identifier The identifier node.
     * @return {@code true} if it is the first identifier child of its parent.
     */
    public static boolean isNameSlot(SyntaxNode identifier) {
        SyntaxNode parent = identifier.parent();
        return parent != null && nameNode(parent).filter(n -> n == identifier).isPresent();
    }
}
