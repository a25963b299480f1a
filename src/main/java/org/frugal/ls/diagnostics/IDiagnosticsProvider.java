package org.frugal.ls.diagnostics;

import org.eclipse.lsp4j.Diagnostic;
import org.frugal.ls.document.Document;

import java.util.List;

/**
 * Produces the diagnostics of one document.
 */
public interface IDiagnosticsProvider {

    /**
     * Runs every diagnostics pass over the document.
     * @param document The document to check.
     * @return The diagnostics of all passes in pipeline order; empty for documents that are
     *         not analyzable or were not parsed. Never {@code null}.
     */
    List<Diagnostic> provideDiagnostics(Document document);
}
