package org.frugal.ls.features;

import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.SymbolInformation;
import org.frugal.ls.document.Document;
import org.frugal.ls.frontend.tree.NodeKind;
import org.frugal.ls.semantics.Symbol;
import org.frugal.ls.semantics.SymbolExtractor;
import org.frugal.ls.semantics.SymbolKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class DocumentSymbolProvider implements IDocumentSymbolProvider {

    @Override
    public List<DocumentSymbol> documentSymbols(Document document) {
        List<DocumentSymbol> outline = new ArrayList<>();
        if (document == null || document.tree() == null) {
            return outline;
        }
        for (Symbol symbol : document.symbols()) {
            outline.add(toDocumentSymbol(symbol, document.source()));
        }
        return outline;
    }

    @Override
    public List<SymbolInformation> workspaceSymbols(String query, Map<String, Document> documents) {
        List<SymbolInformation> result = new ArrayList<>();
        if (documents == null) {
            return result;
        }
        String needle = query == null ? "" : query.toLowerCase(Locale.ROOT);
        for (Document document : documents.values()) {
            if (document == null || !document.isAnalyzable()) {
                continue;
            }
            for (Symbol symbol : document.symbols()) {
                if (needle.isBlank() || symbol.name().toLowerCase(Locale.ROOT).contains(needle)) {
                    result.add(new SymbolInformation(symbol.name(), symbol.kind().lspKind(),
                            new Location(document.uri(), symbol.declarationRange())));
                }
            }
        }
        return result;
    }

    private static DocumentSymbol toDocumentSymbol(Symbol symbol, String source) {
        List<DocumentSymbol> children = new ArrayList<>();
        // Methods are leaves in the outline; their parameters are not listed.
        if (symbol.sourceNode().kind() != NodeKind.FUNCTION_DEFINITION) {
            for (Symbol member : SymbolExtractor.extractMembers(symbol.sourceNode(), source)) {
                children.add(toDocumentSymbol(member, source));
            }
        }
        return new DocumentSymbol(symbol.name(), symbol.kind().lspKind(),
                symbol.fullRange(), symbol.declarationRange(), detailOf(symbol.kind()), children);
    }

    static String detailOf(SymbolKind kind) {
        return switch (kind) {
            case SERVICE -> "Service";
            case SCOPE -> "Scope (pub/sub)";
            case STRUCT -> "Struct";
            case ENUM -> "Enum";
            case CONST -> "Constant";
            case TYPEDEF -> "Type Alias";
            case EXCEPTION -> "Exception";
            case METHOD -> "Method";
            case EVENT -> "Event";
            case FIELD -> "Field";
            case PARAMETER -> "Parameter";
            case ENUM_VALUE -> "Enum Value";
        };
    }
}
