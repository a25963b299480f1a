package org.frugal.ls.diagnostics;

import org.eclipse.lsp4j.Diagnostic;
import org.frugal.ls.config.AnalysisOptions;
import org.frugal.ls.diagnostics.passes.DuplicateDefinitionPass;
import org.frugal.ls.diagnostics.passes.FieldIdentifierPass;
import org.frugal.ls.diagnostics.passes.IDiagnosticPass;
import org.frugal.ls.diagnostics.passes.NamingConventionPass;
import org.frugal.ls.diagnostics.passes.ParseErrorPass;
import org.frugal.ls.diagnostics.passes.TypeReferencePass;
import org.frugal.ls.document.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a fixed pipeline of independent diagnostics passes over one document.
 * <p>
 * Each pass reports into its own {@link DiagnosticsEngine}; its findings are appended to
 * the result only if it completes. A pass that throws is logged and skipped, and the
 * remaining passes still run.
 */
public class DiagnosticsProvider implements IDiagnosticsProvider {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsProvider.class);

    private final List<IDiagnosticPass> passes = new ArrayList<>();

    /**
     * Constructs a provider with every pass enabled.
     */
    public DiagnosticsProvider() {
        this(AnalysisOptions.defaults());
    }

    /**
     * Constructs a provider whose optional passes follow the given options.
     * @param options The analysis options.
     */
    public DiagnosticsProvider(AnalysisOptions options) {
        registerDefaultPasses(options);
    }

    /**
     * Constructs a provider with an explicit pass list.
     * @param passes The passes, in the order they run.
     */
    public DiagnosticsProvider(List<IDiagnosticPass> passes) {
        this.passes.addAll(passes);
    }

    private void registerDefaultPasses(AnalysisOptions options) {
        passes.add(new ParseErrorPass());
        passes.add(new DuplicateDefinitionPass());
        passes.add(new FieldIdentifierPass());
        if (options.namingConventions()) {
            passes.add(new NamingConventionPass());
        }
        if (options.typeReferences()) {
            passes.add(new TypeReferencePass());
        }
    }

    @Override
    public List<Diagnostic> provideDiagnostics(Document document) {
        if (document == null || !document.isAnalyzable() || document.parseResult() == null) {
            return new ArrayList<>();
        }
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        for (IDiagnosticPass pass : passes) {
            if (document.tree() == null && !(pass instanceof ParseErrorPass)) {
                continue;
            }
            DiagnosticsEngine passDiagnostics = new DiagnosticsEngine();
            try {
                pass.analyze(document, passDiagnostics);
            } catch (RuntimeException e) {
                LOG.error("Diagnostics pass '{}' failed on {}", pass.name(), document.uri(), e);
                continue;
            }
            diagnostics.addAll(passDiagnostics.getDiagnostics());
        }
        LOG.debug("{}: {} diagnostics", document.uri(), diagnostics.getDiagnostics().size());
        return new ArrayList<>(diagnostics.getDiagnostics());
    }
}
