package org.frugal.ls.features;

import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.SymbolInformation;
import org.frugal.ls.document.Document;

import java.util.List;
import java.util.Map;

/**
 * Document outline and workspace symbol search.
 */
public interface IDocumentSymbolProvider {

    /**
     * Builds the outline of a document.
     * @param document The document.
     * @return The top-level entries with their members as children; never {@code null}.
     */
    List<DocumentSymbol> documentSymbols(Document document);

    /**
     * Searches the top-level symbols of every analyzable document.
     * @param query A case-insensitive substring; blank matches everything.
     * @param documents The documents to search, keyed by URI.
     * @return The matches; never {@code null}.
     */
    List<SymbolInformation> workspaceSymbols(String query, Map<String, Document> documents);
}
