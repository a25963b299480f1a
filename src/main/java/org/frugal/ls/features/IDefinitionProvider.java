package org.frugal.ls.features;

import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.frugal.ls.document.Document;

import java.util.List;
import java.util.Map;

/**
 * Go-to-definition.
 */
public interface IDefinitionProvider {

    /**
     * Finds the declarations of the name under the cursor.
     * @param document The origin document.
     * @param position The cursor position.
     * @param documents The other known documents, keyed by URI.
     * @return The declaration locations, deduplicated; never {@code null}.
     */
    List<Location> findDefinitions(Document document, Position position, Map<String, Document> documents);
}
