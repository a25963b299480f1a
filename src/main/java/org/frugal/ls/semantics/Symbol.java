package org.frugal.ls.semantics;

import org.eclipse.lsp4j.Range;
import org.frugal.ls.frontend.tree.SyntaxNode;

/**
 * Represents a single named definition extracted from a syntax tree.
 *
 * @param name The name of the symbol; never empty.
 * @param kind The kind of the symbol.
 * @param declarationRange The range of the name token.
 * @param fullRange The range of the whole definition, including its body.
 * @param sourceNode The definition node. Only valid while the tree is alive.
 */
public record Symbol(
        String name,
        SymbolKind kind,
        Range declarationRange,
        Range fullRange,
        SyntaxNode sourceNode
) {
}
