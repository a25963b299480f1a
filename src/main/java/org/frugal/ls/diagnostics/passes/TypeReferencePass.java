package org.frugal.ls.diagnostics.passes;

import org.frugal.ls.diagnostics.DiagnosticsEngine;
import org.frugal.ls.document.Document;
import org.frugal.ls.frontend.tree.NodeKind;
import org.frugal.ls.frontend.tree.SyntaxNode;
import org.frugal.ls.frontend.tree.TreeWalker;
import org.frugal.ls.semantics.Symbol;
import org.frugal.ls.semantics.SymbolKind;
import org.frugal.ls.util.Ranges;

import java.util.HashSet;
import java.util.Set;

/**
 * Reports type names that are neither builtin nor defined in the same document.
 * A qualified name such as {@code base.User} lives in another document and is not checked,
 * provided its prefix is the base name of an {@code include} of this document
 * ({@code include "base.frugal"}).
 */
public class TypeReferencePass implements IDiagnosticPass {

    /** Type names that are always known. */
    public static final Set<String> BUILTIN_TYPES = Set.of(
            "void", "bool", "byte", "i8", "i16", "i32", "i64", "double", "string", "binary", "uuid",
            "list", "set", "map");

    @Override
    public String name() {
        return "type-references";
    }

    @Override
    public void analyze(Document document, DiagnosticsEngine diagnostics) {
        Set<String> known = new HashSet<>(BUILTIN_TYPES);
        for (Symbol symbol : document.symbols()) {
            if (isTypeDefinition(symbol.kind())) {
                known.add(symbol.name());
            }
        }

        String source = document.source();
        Set<String> includePrefixes = includePrefixes(document.tree(), source);
        TreeWalker.forKind(NodeKind.FIELD_TYPE, fieldType -> {
            if (fieldType.childCount() == 0) {
                return;
            }
            SyntaxNode leading = fieldType.child(0);
            if (leading.kind() != NodeKind.IDENTIFIER && leading.kind() != NodeKind.BASE_TYPE) {
                // containers are checked through their nested field types
                return;
            }
            String typeName = leading.text(source);
            if (typeName.isEmpty() || known.contains(typeName) || isIncluded(typeName, includePrefixes)) {
                return;
            }
            diagnostics.reportError(Ranges.of(fieldType), "Unknown type '" + typeName + "'");
        }).walk(document.tree());
    }

    /**
     * Collects the prefixes introduced by include statements: the file name of the
     * included path without directories and extension.
     */
    static Set<String> includePrefixes(SyntaxNode root, String source) {
        Set<String> prefixes = new HashSet<>();
        TreeWalker.forKind(NodeKind.INCLUDE, include -> include.firstChild(NodeKind.LITERAL_STRING)
                .map(literal -> baseName(literal.text(source)))
                .filter(name -> !name.isEmpty())
                .ifPresent(prefixes::add)).walk(root);
        return prefixes;
    }

    private static String baseName(String literal) {
        String path = literal.replace("\"", "").replace("'", "");
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        int extension = fileName.lastIndexOf('.');
        return extension > 0 ? fileName.substring(0, extension) : fileName;
    }

    private static boolean isIncluded(String typeName, Set<String> includePrefixes) {
        int dot = typeName.lastIndexOf('.');
        return dot > 0 && includePrefixes.contains(typeName.substring(0, dot));
    }

    private static boolean isTypeDefinition(SymbolKind kind) {
        return kind == SymbolKind.STRUCT || kind == SymbolKind.EXCEPTION
                || kind == SymbolKind.ENUM || kind == SymbolKind.TYPEDEF;
    }
}
