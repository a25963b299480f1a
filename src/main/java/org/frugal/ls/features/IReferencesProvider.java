package org.frugal.ls.features;

import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.frugal.ls.document.Document;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the identifier under a cursor and finds every occurrence of its name.
 */
public interface IReferencesProvider {

    /**
     * Resolves the identifier at a position.
     * @param document The document.
     * @param position The zero-based cursor position.
     * @return The identifier, or empty if the position is out of bounds or not on an identifier.
     */
    Optional<ResolvedSymbol> symbolAt(Document document, Position position);

    /**
     * Finds all occurrences of the name at a position, in the origin document and in every
     * document of the supplied set.
     * @param document The origin document.
     * @param position The cursor position.
     * @param includeDeclaration Whether the declaration itself is part of the result.
     * @param documents The other known documents, keyed by URI; iteration order is respected.
     * @return The deduplicated locations; never {@code null}.
     */
    List<Location> findReferences(Document document, Position position, boolean includeDeclaration,
                                  Map<String, Document> documents);
}
