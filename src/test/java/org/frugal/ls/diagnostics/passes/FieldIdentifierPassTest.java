package org.frugal.ls.diagnostics.passes;

import org.eclipse.lsp4j.Diagnostic;
import org.frugal.ls.diagnostics.DiagnosticsEngine;
import org.frugal.ls.document.Document;
import org.frugal.ls.frontend.tree.NodeKind;
import org.frugal.ls.frontend.tree.SyntaxNode;
import org.frugal.ls.frontend.tree.TreeWalker;
import org.frugal.ls.util.Ranges;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.frugal.ls.test.utils.TestDocuments.frugal;

@Tag("unit")
class FieldIdentifierPassTest {

    private final FieldIdentifierPass pass = new FieldIdentifierPass();

    private List<Diagnostic> analyze(String source) {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        pass.analyze(frugal(source), engine);
        return engine.getDiagnostics();
    }

    @Test
    void reportsDuplicateIdAtTheRepeatedInteger() {
        List<Diagnostic> diagnostics = analyze("struct A {\n  1: i32 a\n  2: i32 b\n  1: i32 c\n}");

        assertThat(diagnostics).singleElement().satisfies(d -> {
            assertThat(d.getMessage()).isEqualTo("Duplicate field ID 1");
            assertThat(d.getRange()).isEqualTo(Ranges.of(3, 2, 3, 3));
            assertThat(d.getRelatedInformation().get(0).getMessage()).isEqualTo("Field ID 1 first used here");
            assertThat(d.getRelatedInformation().get(0).getLocation().getRange()).isEqualTo(Ranges.of(1, 2, 1, 3));
        });
    }

    @Test
    void flagsZeroAndNegativeIdsIndependentlyOfDuplication() {
        List<Diagnostic> diagnostics = analyze("struct A { 0: i32 a, -2: i32 b, -2: i32 c, 1: i32 d }");

        assertThat(diagnostics).extracting(Diagnostic::getMessage).containsExactly(
                "Field ID must be positive, got 0",
                "Field ID must be positive, got -2",
                "Duplicate field ID -2",
                "Field ID must be positive, got -2");
    }

    /**
     * Parameter and throws lists are separate namespaces; a repeat inside one of them is
     * reported once with the list named in the message.
     */
    @Test
    void treatsParameterAndThrowsListsAsSeparateNamespaces() {
        // Act
        List<Diagnostic> independent = analyze("service S { void f(1: i32 a) throws (1: E e) }");
        List<Diagnostic> repeatedParams = analyze("service S { void f(1: i32 a, 1: i32 b) throws (1: E e) }");
        List<Diagnostic> repeatedThrows = analyze("service S { void f(1: i32 a) throws (1: E e, 1: F f) }");

        // Assert
        assertThat(independent).isEmpty();
        assertThat(repeatedParams).extracting(Diagnostic::getMessage).containsExactly("Duplicate field ID 1 in parameter list");
        assertThat(repeatedThrows).extracting(Diagnostic::getMessage).containsExactly("Duplicate field ID 1 in throws list");
    }

    @Test
    void eachStructIsItsOwnNamespace() {
        assertThat(analyze("struct A { 1: i32 a }\nexception B { 1: string m }")).isEmpty();
    }

    @Test
    void ignoresIdsThatDoNotParseAsDecimal() {
        assertThat(analyze("struct A { 0x1: i32 a, 0x1: i32 b, 99999999999: i32 c }")).isEmpty();
    }

    @Test
    void detectsThrowsListBySiblingOrder() {
        Document document = frugal("service S { void f(1: i32 a) throws (1: E e) }");
        List<SyntaxNode> functions = new ArrayList<>();
        TreeWalker.forKind(NodeKind.FUNCTION_DEFINITION, functions::add).walk(document.tree());
        SyntaxNode function = functions.get(0);
        List<SyntaxNode> lists = function.children().stream().filter(c -> c.kind() == NodeKind.FIELD_LIST).toList();

        assertThat(FieldIdentifierPass.isThrowsList(function, lists.get(0))).isFalse();
        assertThat(FieldIdentifierPass.isThrowsList(function, lists.get(1))).isTrue();
    }
}
