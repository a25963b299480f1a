package org.frugal.ls.features;

import org.eclipse.lsp4j.DocumentHighlight;
import org.eclipse.lsp4j.Position;
import org.frugal.ls.document.Document;

import java.util.List;

/**
 * Highlights the occurrences of the symbol under the cursor within one document.
 */
public interface IHighlightProvider {

    /**
     * Computes the highlights for a cursor position.
     * @param document The document.
     * @param position The cursor position.
     * @return The occurrences in this document; never {@code null}.
     */
    List<DocumentHighlight> highlights(Document document, Position position);
}
