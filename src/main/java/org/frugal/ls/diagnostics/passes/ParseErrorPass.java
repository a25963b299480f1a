package org.frugal.ls.diagnostics.passes;

import org.frugal.ls.diagnostics.DiagnosticsEngine;
import org.frugal.ls.document.Document;
import org.frugal.ls.frontend.parser.ParseError;
import org.frugal.ls.util.Ranges;

/**
 * Forwards every syntax error as a one-character error diagnostic.
 */
public class ParseErrorPass implements IDiagnosticPass {

    @Override
    public String name() {
        return "parse-errors";
    }

    @Override
    public void analyze(Document document, DiagnosticsEngine diagnostics) {
        for (ParseError error : document.parseResult().errors()) {
            diagnostics.reportError(Ranges.singleCharacter(error.line(), error.column()), error.message());
        }
    }
}
