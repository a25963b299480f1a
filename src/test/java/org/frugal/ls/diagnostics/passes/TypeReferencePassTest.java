package org.frugal.ls.diagnostics.passes;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.frugal.ls.diagnostics.DiagnosticsEngine;
import org.frugal.ls.util.Ranges;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.frugal.ls.test.utils.TestDocuments.frugal;

@Tag("unit")
class TypeReferencePassTest {

    private List<Diagnostic> analyze(String source) {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        new TypeReferencePass().analyze(frugal(source), engine);
        return engine.getDiagnostics();
    }

    @Test
    void acceptsBuiltinsAndLocalTypes() {
        assertThat(analyze("""
                typedef i64 UserId
                enum Role { ADMIN }
                exception Failed {}
                struct User { 1: UserId id, 2: Role role, 3: uuid key, 4: binary blob }
                service S { void save(1: User u) throws (1: Failed f) }
                """)).isEmpty();
    }

    @Test
    void reportsUnknownTypeAtTheFieldType() {
        List<Diagnostic> diagnostics = analyze("struct User { 1: Account owner }");

        assertThat(diagnostics).singleElement().satisfies(d -> {
            assertThat(d.getMessage()).isEqualTo("Unknown type 'Account'");
            assertThat(d.getRange()).isEqualTo(Ranges.of(0, 17, 0, 24));
            assertThat(d.getSeverity()).isEqualTo(DiagnosticSeverity.Error);
        });
    }

    @Test
    void checksTypesNestedInContainers() {
        List<Diagnostic> diagnostics = analyze("struct S { 1: map<string, list<Widget>> index }");

        assertThat(diagnostics).extracting(Diagnostic::getMessage).containsExactly("Unknown type 'Widget'");
    }

    @Test
    void checksReturnTypesScopeEventsAndConstants() {
        List<Diagnostic> diagnostics = analyze("""
                service S { Reply call() }
                scope E { Changed: Event }
                const Limit MAX = 1
                """);

        assertThat(diagnostics).extracting(Diagnostic::getMessage).containsExactly(
                "Unknown type 'Reply'", "Unknown type 'Event'", "Unknown type 'Limit'");
    }

    @Test
    void skipsNamesQualifiedWithAnInclude() {
        assertThat(analyze("include \"base.frugal\"\nstruct S { 1: base.User user }")).isEmpty();
        assertThat(analyze("include \"../shared/common.frugal\"\nstruct S { 1: common.Id id }")).isEmpty();
    }

    @Test
    void reportsQualifiedNamesWithoutMatchingInclude() {
        List<Diagnostic> diagnostics = analyze("include \"base.frugal\"\nstruct S { 1: nosuch.Thing x }");

        assertThat(diagnostics).extracting(Diagnostic::getMessage).containsExactly("Unknown type 'nosuch.Thing'");
        assertThat(analyze("struct S { 1: base.User user }"))
                .extracting(Diagnostic::getMessage).containsExactly("Unknown type 'base.User'");
    }

    @Test
    void derivesIncludePrefixesFromFileNames() {
        String source = "include \"base.frugal\"\ninclude \"dir/events.frugal\"\nstruct S {}";

        assertThat(TypeReferencePass.includePrefixes(frugal(source).tree(), source))
                .containsExactlyInAnyOrder("base", "events");
    }

    @Test
    void servicesAndScopesAreNotTypes() {
        assertThat(analyze("service Api {}\nstruct S { 1: Api api }"))
                .extracting(Diagnostic::getMessage).containsExactly("Unknown type 'Api'");
    }
}
