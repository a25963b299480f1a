package org.frugal.ls.semantics;

import org.frugal.ls.frontend.tree.NodeKind;
import org.frugal.ls.frontend.tree.SyntaxNode;
import org.frugal.ls.frontend.tree.TreeWalker;
import org.frugal.ls.util.Ranges;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds symbol lists from a syntax tree. Every call walks the tree again; nothing is cached.
 */
public final class SymbolExtractor {

    private SymbolExtractor() {}

    /**
     * Extracts the top-level definitions of a document in pre-order.
     * @param root The root of the tree, may be {@code null}.
     * @param source The source text the tree was parsed from.
     * @return The symbols in order of first appearance.
     */
    public static List<Symbol> extractSymbols(SyntaxNode root, String source) {
        List<Symbol> symbols = new ArrayList<>();
        TreeWalker.preOrder(root, node -> SymbolKind.ofDefinition(node.kind())
                .flatMap(kind -> toSymbol(node, kind, source))
                .ifPresent(symbols::add));
        return symbols;
    }

    /**
     * Extracts the direct members of a definition: methods of a service, events of a scope,
     * fields of a struct or exception, values of an enum, or the parameters and throws
     * entries of a method.
     * @param definition The definition node.
     * @param source The source text.
     * @return The member symbols in source order.
     */
    public static List<Symbol> extractMembers(SyntaxNode definition, String source) {
        List<Symbol> members = new ArrayList<>();
        for (SyntaxNode container : definition.children()) {
            if (isMemberContainer(container.kind())) {
                for (SyntaxNode member : container.children()) {
                    memberKind(member).flatMap(kind -> toSymbol(member, kind, source)).ifPresent(members::add);
                }
            }
        }
        return members;
    }

    /**
     * Extracts every named definition of a document, top-level and nested, in pre-order.
     * @param root The root of the tree, may be {@code null}.
     * @param source The source text.
     * @return All declarations.
     */
    public static List<Symbol> extractDeclarations(SyntaxNode root, String source) {
        List<Symbol> symbols = new ArrayList<>();
        TreeWalker.preOrder(root, node -> SymbolKind.ofDefinition(node.kind())
                .or(() -> memberKind(node))
                .flatMap(kind -> toSymbol(node, kind, source))
                .ifPresent(symbols::add));
        return symbols;
    }

    /**
     * Returns the symbol kind of a nested definition node.
     * @param node The node.
     * @return METHOD, EVENT, ENUM_VALUE, FIELD or PARAMETER; empty for other nodes.
     */
    static Optional<SymbolKind> memberKind(SyntaxNode node) {
        return switch (node.kind()) {
            case FUNCTION_DEFINITION -> Optional.of(SymbolKind.METHOD);
            case SCOPE_OPERATION -> Optional.of(SymbolKind.EVENT);
            case ENUM_FIELD -> Optional.of(SymbolKind.ENUM_VALUE);
            case FIELD -> {
                SyntaxNode parent = node.parent();
                yield Optional.of(parent != null && parent.kind() == NodeKind.FIELD_LIST
                        ? SymbolKind.PARAMETER : SymbolKind.FIELD);
            }
            default -> Optional.empty();
        };
    }

    private static boolean isMemberContainer(NodeKind kind) {
        return kind == NodeKind.SERVICE_BODY || kind == NodeKind.SCOPE_BODY || kind == NodeKind.STRUCT_BODY
                || kind == NodeKind.ENUM_BODY || kind == NodeKind.FIELD_LIST;
    }

    private static Optional<Symbol> toSymbol(SyntaxNode definition, SymbolKind kind, String source) {
        return DefinitionNames.nameNode(definition)
                .filter(name -> !name.text(source).isEmpty())
                .map(name -> new Symbol(name.text(source), kind, Ranges.of(name), Ranges.of(definition), definition));
    }
}
