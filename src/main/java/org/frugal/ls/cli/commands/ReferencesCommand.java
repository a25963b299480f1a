package org.frugal.ls.cli.commands;

import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.frugal.ls.cli.CommandLineInterface;
import org.frugal.ls.document.Document;
import org.frugal.ls.features.ReferencesProvider;
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
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "references",
    description = "List every occurrence of the name at a position (line and column are 1-based)"
)
public class ReferencesCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "FILE", description = "The Frugal file containing the cursor")
    private File file;

    @Option(names = {"-l", "--line"}, required = true, description = "Line of the cursor (1-based)")
    private int line;

    @Option(names = {"-C", "--column"}, required = true, description = "Column of the cursor (1-based)")
    private int column;

    @Option(names = "--exclude-declaration", description = "Leave the declaration out of the result")
    private boolean excludeDeclaration;

    @Option(names = {"-w", "--workspace"}, paramLabel = "FILE", description = "Further files to search")
    private List<File> workspace = new ArrayList<>();

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Document document;
        Map<String, Document> documents;
        try {
            document = parent.readDocument(file);
            documents = parent.readWorkspace(workspace);
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error reading input: " + e.getMessage());
            return 2;
        }

        List<Location> locations = new ReferencesProvider().findReferences(document,
                new Position(line - 1, column - 1), !excludeDeclaration, documents);
        PrintWriter out = spec.commandLine().getOut();
        for (Location location : locations) {
            out.printf("%s:%d:%d%n", location.getUri(),
                    location.getRange().getStart().getLine() + 1, location.getRange().getStart().getCharacter() + 1);
        }
        out.flush();
        return locations.isEmpty() ? 1 : 0;
    }
}
