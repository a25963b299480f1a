package org.frugal.ls.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.frugal.ls.cli.commands.CheckCommand;
import org.frugal.ls.cli.commands.ReferencesCommand;
import org.frugal.ls.cli.commands.RenameCommand;
import org.frugal.ls.cli.commands.SymbolsCommand;
import org.frugal.ls.config.AnalysisOptions;
import org.frugal.ls.config.ConfigLoader;
import org.frugal.ls.config.LoggingConfigurator;
import org.frugal.ls.document.Document;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "frugal-ls",
    mixinStandardHelpOptions = true,
    version = "frugal-ls 1.0",
    description = "Symbol resolution and semantic diagnostics for Frugal IDL files",
    subcommands = {
        CheckCommand.class,
        SymbolsCommand.class,
        ReferencesCommand.class,
        RenameCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
    )
    private File configFile;

    private Config config;
    private AnalysisOptions options;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("frugal-ls");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Returns the merged configuration, loading it and applying the logging settings on first use.
     * @return The resolved configuration.
     * @throws ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    /**
     * Returns the typed analysis options.
     * @return The options read from {@link #getConfig()}.
     */
    public AnalysisOptions getOptions() {
        if (options == null) {
            options = AnalysisOptions.fromConfig(getConfig());
        }
        return options;
    }

    /**
     * Reads and parses one file.
     * @param file The file to read.
     * @return The document; its URI is the file's absolute {@code file:} URI.
     * @throws IOException if the file cannot be read.
     */
    public Document readDocument(File file) throws IOException {
        String source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        return Document.parse(file.toPath().toAbsolutePath().toUri().toString(), source, getOptions().fileExtensions());
    }

    /**
     * Reads several files into a URI-keyed map, keeping the given order.
     * @param files The files to read.
     * @return The documents by URI.
     * @throws IOException if a file cannot be read.
     */
    public Map<String, Document> readWorkspace(List<File> files) throws IOException {
        Map<String, Document> documents = new LinkedHashMap<>();
        for (File file : files) {
            Document document = readDocument(file);
            documents.put(document.uri(), document);
        }
        return documents;
    }
}
