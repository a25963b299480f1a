package org.frugal.ls.features;

import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.frugal.ls.document.Document;
import org.frugal.ls.frontend.tree.NodeKind;
import org.frugal.ls.frontend.tree.SyntaxNode;
import org.frugal.ls.frontend.tree.TreeWalker;
import org.frugal.ls.semantics.IdentifierClassifier;
import org.frugal.ls.semantics.Symbol;
import org.frugal.ls.semantics.SymbolExtractor;
import org.frugal.ls.util.Ranges;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Name-based reference search. Two identifiers refer to the same symbol if their text is
 * equal; there is no lexical scoping, so same-named fields of unrelated structs are treated
 * as one symbol.
 */
public class ReferencesProvider implements IReferencesProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ReferencesProvider.class);

    @Override
    public Optional<ResolvedSymbol> symbolAt(Document document, Position position) {
        SyntaxNode root = document == null ? null : document.tree();
        if (root == null || position == null) {
            return Optional.empty();
        }
        OptionalInt offset = Ranges.toOffset(document.source(), position);
        if (offset.isEmpty()) {
            return Optional.empty();
        }
        SyntaxNode node = deepestNodeAt(root, offset.getAsInt());
        if (node == null) {
            return Optional.empty();
        }
        String source = document.source();
        return findSymbolNode(node)
                .filter(n -> !n.text(source).isEmpty())
                .map(n -> new ResolvedSymbol(n.text(source), Ranges.of(n), n));
    }

    @Override
    public List<Location> findReferences(Document document, Position position, boolean includeDeclaration,
                                         Map<String, Document> documents) {
        Optional<ResolvedSymbol> resolved = symbolAt(document, position);
        if (resolved.isEmpty()) {
            return new ArrayList<>();
        }
        String name = resolved.get().name();

        Set<Location> found = new LinkedHashSet<>();
        collectOccurrences(document, name, found);
        for (Document other : otherDocuments(documents)) {
            collectOccurrences(other, name, found);
        }

        if (!includeDeclaration) {
            declarationOf(document, resolved.get(), documents).ifPresent(found::remove);
        }
        LOG.debug("Found {} references to '{}' from {}", found.size(), name, document.uri());
        return new ArrayList<>(found);
    }

    /**
     * Finds the deepest node whose span contains the offset.
     * @param root The node to start at.
     * @param offset The char offset.
     * @return The deepest containing node, or {@code null} if {@code root} does not contain the offset.
     */
    static SyntaxNode deepestNodeAt(SyntaxNode root, int offset) {
        if (!contains(root, offset)) {
            return null;
        }
        SyntaxNode node = root;
        boolean descended = true;
        while (descended) {
            descended = false;
            for (int i = 0; i < node.childCount(); i++) {
                SyntaxNode child = node.child(i);
                if (contains(child, offset)) {
                    node = child;
                    descended = true;
                    break;
                }
            }
        }
        return node;
    }

    /**
     * Looks for a symbol node at the node itself, then among its direct children, then at its parent.
     */
    private static Optional<SyntaxNode> findSymbolNode(SyntaxNode node) {
        if (isSymbolNode(node)) {
            return Optional.of(node);
        }
        for (int i = 0; i < node.childCount(); i++) {
            if (isSymbolNode(node.child(i))) {
                return Optional.of(node.child(i));
            }
        }
        SyntaxNode parent = node.parent();
        if (parent != null && isSymbolNode(parent)) {
            return Optional.of(parent);
        }
        return Optional.empty();
    }

    private static boolean isSymbolNode(SyntaxNode node) {
        return node.kind() == NodeKind.IDENTIFIER || node.kind() == NodeKind.BASE_TYPE;
    }

    private static boolean contains(SyntaxNode node, int offset) {
        return node.startOffset() <= offset && offset < node.endOffset();
    }

    private static void collectOccurrences(Document document, String name, Set<Location> into) {
        SyntaxNode root = document.tree();
        if (root == null) {
            return;
        }
        String source = document.source();
        TreeWalker.forKind(NodeKind.IDENTIFIER, node -> {
            if (name.equals(node.text(source))) {
                into.add(new Location(document.uri(), Ranges.of(node)));
            }
        }).walk(root);
    }

    /**
     * Determines the declaration to drop when the caller excludes it: the cursor identifier
     * if it is itself a declaration, otherwise the first declaration with the same name,
     * searched in the origin document before the others.
     */
    private static Optional<Location> declarationOf(Document document, ResolvedSymbol resolved,
                                                    Map<String, Document> documents) {
        if (IdentifierClassifier.classify(resolved.node()).declaration()) {
            return Optional.of(new Location(document.uri(), resolved.range()));
        }
        Optional<Location> local = firstDeclaration(document, resolved.name());
        if (local.isPresent()) {
            return local;
        }
        for (Document other : otherDocuments(documents)) {
            Optional<Location> remote = firstDeclaration(other, resolved.name());
            if (remote.isPresent()) {
                return remote;
            }
        }
        return Optional.empty();
    }

    /**
     * Top-level definitions take precedence; nested ones (enum values, fields, methods,
     * events, parameters) are only considered when no top-level definition matches.
     */
    private static Optional<Location> firstDeclaration(Document document, String name) {
        Optional<Location> topLevel = firstNamed(document, document.symbols(), name);
        if (topLevel.isPresent()) {
            return topLevel;
        }
        return firstNamed(document, SymbolExtractor.extractDeclarations(document.tree(), document.source()), name);
    }

    private static Optional<Location> firstNamed(Document document, List<Symbol> symbols, String name) {
        for (Symbol symbol : symbols) {
            if (symbol.name().equals(name)) {
                return Optional.of(new Location(document.uri(), symbol.declarationRange()));
            }
        }
        return Optional.empty();
    }

    private static List<Document> otherDocuments(Map<String, Document> documents) {
        if (documents == null) {
            return List.of();
        }
        List<Document> result = new ArrayList<>();
        for (Document d : documents.values()) {
            if (d != null && d.tree() != null) {
                result.add(d);
            }
        }
        return result;
    }
}
