package org.frugal.ls.diagnostics.passes;

import org.eclipse.lsp4j.DiagnosticRelatedInformation;
import org.eclipse.lsp4j.Location;
import org.frugal.ls.diagnostics.DiagnosticsEngine;
import org.frugal.ls.document.Document;
import org.frugal.ls.frontend.tree.NodeKind;
import org.frugal.ls.frontend.tree.SyntaxNode;
import org.frugal.ls.frontend.tree.TreeWalker;
import org.frugal.ls.util.Ranges;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Checks field IDs for uniqueness and positivity.
 * <p>
 * Each struct or exception body is one namespace. A function has two: its parameter
 * list and its throws list, so {@code (1: i64 id) throws (1: NotFound e)} is legal.
 * IDs that do not parse as a decimal {@code int} are ignored.
 */
public class FieldIdentifierPass implements IDiagnosticPass {

    @Override
    public String name() {
        return "field-ids";
    }

    @Override
    public void analyze(Document document, DiagnosticsEngine diagnostics) {
        TreeWalker.preOrder(document.tree(), node -> {
            if (node.kind() == NodeKind.STRUCT_DEFINITION || node.kind() == NodeKind.EXCEPTION_DEFINITION) {
                node.firstChild(NodeKind.STRUCT_BODY).ifPresent(body -> checkNamespace(document, body, "", diagnostics));
            } else if (node.kind() == NodeKind.FUNCTION_DEFINITION) {
                for (SyntaxNode child : node.children()) {
                    if (child.kind() == NodeKind.FIELD_LIST) {
                        String suffix = isThrowsList(node, child) ? " in throws list" : " in parameter list";
                        checkNamespace(document, child, suffix, diagnostics);
                    }
                }
            }
        });
    }

    private void checkNamespace(Document document, SyntaxNode container, String suffix, DiagnosticsEngine diagnostics) {
        Map<Integer, SyntaxNode> seen = new HashMap<>();
        for (SyntaxNode field : container.children()) {
            if (field.kind() != NodeKind.FIELD) {
                continue;
            }
            Optional<SyntaxNode> idNode = field.firstChild(NodeKind.FIELD_ID).flatMap(id -> id.firstChild(NodeKind.INTEGER));
            if (idNode.isEmpty()) {
                continue;
            }
            OptionalInt parsed = parseId(idNode.get().text(document.source()));
            if (parsed.isEmpty()) {
                continue;
            }
            int id = parsed.getAsInt();

            SyntaxNode first = seen.putIfAbsent(id, idNode.get());
            if (first != null) {
                diagnostics.reportError(Ranges.of(idNode.get()), "Duplicate field ID " + id + suffix,
                        List.of(new DiagnosticRelatedInformation(new Location(document.uri(), Ranges.of(first)),
                                "Field ID " + id + " first used here")));
            }
            if (id < 1) {
                diagnostics.reportError(Ranges.of(idNode.get()), "Field ID must be positive, got " + id);
            }
        }
    }

    /**
     * A field list is a throws list if a {@code throws} keyword precedes it among its siblings.
     */
    static boolean isThrowsList(SyntaxNode function, SyntaxNode fieldList) {
        int listIndex = function.indexOfChild(fieldList);
        for (int i = 0; i < listIndex; i++) {
            if (function.child(i).kind() == NodeKind.THROWS) {
                return true;
            }
        }
        return false;
    }

    private static OptionalInt parseId(String text) {
        try {
            return OptionalInt.of(Integer.parseInt(text));
        } catch (NumberFormatException e) {
            // hex or out-of-range IDs take no part in the checks
            return OptionalInt.empty();
        }
    }
}
