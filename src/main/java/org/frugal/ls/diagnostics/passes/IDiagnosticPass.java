package org.frugal.ls.diagnostics.passes;

import org.frugal.ls.diagnostics.DiagnosticsEngine;
import org.frugal.ls.document.Document;

/**
 * One independent check of the diagnostics pipeline.
 * A pass only reads the document and reports into the engine it is given.
 */
public interface IDiagnosticPass {

    /**
     * Returns a short name for log messages.
     * @return The pass name.
     */
    String name();

    /**
     * Analyzes a document that has a syntax tree.
     * @param document The document to check.
     * @param diagnostics The engine for reporting findings.
     */
    void analyze(Document document, DiagnosticsEngine diagnostics);
}
