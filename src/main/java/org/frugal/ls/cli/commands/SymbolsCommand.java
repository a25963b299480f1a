package org.frugal.ls.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.eclipse.lsp4j.DocumentSymbol;
import org.frugal.ls.cli.CommandLineInterface;
import org.frugal.ls.document.Document;
import org.frugal.ls.features.DocumentSymbolProvider;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "symbols",
    description = "Print the outline of a Frugal file"
)
public class SymbolsCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "FILE", description = "The Frugal file")
    private File file;

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
        Document document;
        try {
            document = parent.readDocument(file);
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error reading " + file + ": " + e.getMessage());
            return 2;
        }
        List<DocumentSymbol> outline = new DocumentSymbolProvider().documentSymbols(document);
        PrintWriter out = spec.commandLine().getOut();
        if ("json".equalsIgnoreCase(format)) {
            Gson gson = new GsonBuilder().setPrettyPrinting().create();
            out.println(gson.toJson(outline));
        } else {
            print(out, outline, "");
        }
        out.flush();
        return 0;
    }

    private void print(PrintWriter out, List<DocumentSymbol> symbols, String indent) {
        for (DocumentSymbol symbol : symbols) {
            out.printf("%s%s %s (line %d)%n", indent, symbol.getDetail(), symbol.getName(),
                    symbol.getSelectionRange().getStart().getLine() + 1);
            if (symbol.getChildren() != null) {
                print(out, symbol.getChildren(), indent + "  ");
            }
        }
    }
}
