package org.frugal.ls.diagnostics.passes;

import org.eclipse.lsp4j.DiagnosticRelatedInformation;
import org.eclipse.lsp4j.Location;
import org.frugal.ls.diagnostics.DiagnosticsEngine;
import org.frugal.ls.document.Document;
import org.frugal.ls.semantics.Symbol;
import org.frugal.ls.semantics.SymbolKind;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports every definition whose kind and name repeat an earlier one. Definitions of
 * different kinds may share a name.
 */
public class DuplicateDefinitionPass implements IDiagnosticPass {

    private record Key(SymbolKind kind, String name) {
    }

    @Override
    public String name() {
        return "duplicate-definitions";
    }

    @Override
    public void analyze(Document document, DiagnosticsEngine diagnostics) {
        Map<Key, Symbol> firstByKey = new HashMap<>();
        for (Symbol symbol : document.symbols()) {
            Symbol first = firstByKey.putIfAbsent(new Key(symbol.kind(), symbol.name()), symbol);
            if (first == null) {
                continue;
            }
            diagnostics.reportError(symbol.declarationRange(),
                    String.format("Duplicate %s definition '%s'", symbol.kind().keyword(), symbol.name()),
                    List.of(new DiagnosticRelatedInformation(new Location(document.uri(), first.declarationRange()),
                            String.format("First definition of '%s' here", symbol.name()))));
        }
    }
}
