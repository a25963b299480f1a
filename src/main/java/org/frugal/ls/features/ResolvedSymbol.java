package org.frugal.ls.features;

import org.eclipse.lsp4j.Range;
import org.frugal.ls.frontend.tree.SyntaxNode;

/**
 * The identifier found under a cursor position.
 *
 * @param name The identifier text.
 * @param range The range of the identifier.
 * @param node The identifier or base type node.
 */
public record ResolvedSymbol(String name, Range range, SyntaxNode node) {
}
