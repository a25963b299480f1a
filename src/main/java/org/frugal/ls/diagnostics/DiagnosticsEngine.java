package org.frugal.ls.diagnostics;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticRelatedInformation;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Range;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages in the order they are reported.
 * <p>
 * This decouples error reporting from the individual analysis passes.
 */
public class DiagnosticsEngine {

    /** The source name stamped on every diagnostic produced here. */
    public static final String SOURCE = "frugal-ls";

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param range   The range of the error.
     * @param message The error message.
     */
    public void reportError(Range range, String message) {
        reportError(range, message, List.of());
    }

    /**
     * Reports an error that points at further locations.
     *
     * @param range   The range of the error.
     * @param message The error message.
     * @param related The related locations.
     */
    public void reportError(Range range, String message, List<DiagnosticRelatedInformation> related) {
        Diagnostic diagnostic = new Diagnostic(range, message, DiagnosticSeverity.Error, SOURCE);
        if (!related.isEmpty()) {
            diagnostic.setRelatedInformation(new ArrayList<>(related));
        }
        diagnostics.add(diagnostic);
    }

    /**
     * Reports a warning.
     *
     * @param range   The range of the warning.
     * @param message The warning message.
     */
    public void reportWarning(Range range, String message) {
        diagnostics.add(new Diagnostic(range, message, DiagnosticSeverity.Warning, SOURCE));
    }

    /**
     * Appends diagnostics collected elsewhere, keeping their order.
     *
     * @param collected The diagnostics to append.
     */
    public void addAll(Collection<Diagnostic> collected) {
        diagnostics.addAll(collected);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.getSeverity() == DiagnosticSeverity.Error);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(DiagnosticsEngine::format)
                .collect(Collectors.joining("\n"));
    }

    /**
     * Formats a diagnostic as {@code [Error] line:column: message} with 1-based coordinates.
     *
     * @param diagnostic The diagnostic to format.
     * @return The formatted line.
     */
    public static String format(Diagnostic diagnostic) {
        return String.format("[%s] %d:%d: %s", diagnostic.getSeverity(),
                diagnostic.getRange().getStart().getLine() + 1,
                diagnostic.getRange().getStart().getCharacter() + 1,
                diagnostic.getMessage());
    }
}
