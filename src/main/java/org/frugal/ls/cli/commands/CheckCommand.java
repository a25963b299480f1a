package org.frugal.ls.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.frugal.ls.cli.CommandLineInterface;
import org.frugal.ls.diagnostics.DiagnosticsProvider;
import org.frugal.ls.diagnostics.IDiagnosticsProvider;
import org.frugal.ls.document.Document;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "check",
    description = "Report syntax errors and semantic problems. Exit code 1 if any error is found."
)
public class CheckCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Frugal files to check")
    private List<File> files = new ArrayList<>();

    @Option(
        names = {"-f", "--format"},
        description = "Output format: text, json (default: text)"
    )
    private String format = "text";

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        if (!"text".equalsIgnoreCase(format) && !"json".equalsIgnoreCase(format)) {
            spec.commandLine().getErr().println("Unknown format '" + format + "'. Use text or json.");
            return 2;
        }
        PrintWriter out = spec.commandLine().getOut();
        IDiagnosticsProvider provider = new DiagnosticsProvider(parent.getOptions());
        Map<String, List<Diagnostic>> results = new LinkedHashMap<>();
        boolean errors = false;

        for (File file : files) {
            Document document;
            try {
                document = parent.readDocument(file);
            } catch (IOException e) {
                spec.commandLine().getErr().println("Error reading " + file + ": " + e.getMessage());
                return 2;
            }
            if (!document.isAnalyzable()) {
                spec.commandLine().getErr().println("Skipping " + file + ": not a Frugal file");
                continue;
            }
            List<Diagnostic> diagnostics = provider.provideDiagnostics(document);
            errors |= diagnostics.stream().anyMatch(d -> d.getSeverity() == DiagnosticSeverity.Error);
            results.put(file.getPath(), diagnostics);
        }

        if ("json".equalsIgnoreCase(format)) {
            Gson gson = new GsonBuilder().setPrettyPrinting().create();
            out.println(gson.toJson(results));
        } else {
            results.forEach((path, diagnostics) -> diagnostics.forEach(d ->
                    out.printf("%s:%d:%d: %s: %s%n", path,
                            d.getRange().getStart().getLine() + 1, d.getRange().getStart().getCharacter() + 1,
                            d.getSeverity().name().toLowerCase(Locale.ROOT), d.getMessage())));
            long count = results.values().stream().mapToLong(List::size).sum();
            out.println(count + " problem(s) in " + results.size() + " file(s)");
        }
        out.flush();
        return errors ? 1 : 0;
    }
}
