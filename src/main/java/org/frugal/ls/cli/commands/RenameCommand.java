package org.frugal.ls.cli.commands;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.frugal.ls.api.RenameException;
import org.frugal.ls.cli.CommandLineInterface;
import org.frugal.ls.document.Document;
import org.frugal.ls.features.RenameProvider;
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
    name = "rename",
    description = "Preview the edits that rename the symbol at a position (line and column are 1-based)"
)
public class RenameCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "FILE", description = "The Frugal file containing the cursor")
    private File file;

    @Option(names = {"-l", "--line"}, required = true, description = "Line of the cursor (1-based)")
    private int line;

    @Option(names = {"-C", "--column"}, required = true, description = "Column of the cursor (1-based)")
    private int column;

    @Option(names = {"-n", "--new-name"}, required = true, description = "The new name")
    private String newName;

    @Option(names = {"-w", "--workspace"}, paramLabel = "FILE", description = "Further files to rename in")
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

        WorkspaceEdit edit;
        try {
            edit = new RenameProvider().rename(document, new Position(line - 1, column - 1), newName, documents);
        } catch (RenameException e) {
            spec.commandLine().getErr().println("Cannot rename: " + e.getMessage());
            return 1;
        }

        PrintWriter out = spec.commandLine().getOut();
        int editCount = 0;
        for (Map.Entry<String, List<TextEdit>> entry : edit.getChanges().entrySet()) {
            out.println(entry.getKey());
            for (TextEdit textEdit : entry.getValue()) {
                Range range = textEdit.getRange();
                out.printf("  %d:%d-%d:%d -> %s%n",
                        range.getStart().getLine() + 1, range.getStart().getCharacter() + 1,
                        range.getEnd().getLine() + 1, range.getEnd().getCharacter() + 1,
                        textEdit.getNewText());
                editCount++;
            }
        }
        out.println(editCount + " edit(s) in " + edit.getChanges().size() + " file(s)");
        out.flush();
        return 0;
    }
}
