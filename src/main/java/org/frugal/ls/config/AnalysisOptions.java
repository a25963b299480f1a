package org.frugal.ls.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.util.List;

/**
 * Typed view of the {@code frugal-ls} configuration block.
 *
 * <pre>
 * frugal-ls {
 *   analysis {
 *     file-extensions = [".frugal"]
 *   }
 *   diagnostics {
 *     naming-conventions = true
 *     type-references = true
 *   }
 * }
 * </pre>
 *
 * @param fileExtensions URI suffixes of documents that are analyzed.
 * @param namingConventions Whether the naming-convention warnings are produced.
 * @param typeReferences Whether unknown type names are reported.
 */
public record AnalysisOptions(
        List<String> fileExtensions,
        boolean namingConventions,
        boolean typeReferences
) {
    /** The root path of this project's settings. */
    public static final String ROOT_PATH = "frugal-ls";

    public AnalysisOptions {
        fileExtensions = List.copyOf(fileExtensions);
        if (fileExtensions.isEmpty()) {
            throw new IllegalArgumentException("At least one file extension must be configured.");
        }
    }

    /**
     * Returns the built-in defaults, equal to those in {@code reference.conf}.
     * @return The default options.
     */
    public static AnalysisOptions defaults() {
        return new AnalysisOptions(List.of(".frugal"), true, true);
    }

    /**
     * Reads the options from a resolved configuration.
     * @param config The configuration; must contain the {@code frugal-ls} block.
     * @return The options.
     * @throws ConfigException if a setting is missing or has the wrong type.
     */
    public static AnalysisOptions fromConfig(Config config) {
        Config root = config.getConfig(ROOT_PATH);
        return new AnalysisOptions(
                root.getStringList("analysis.file-extensions"),
                root.getBoolean("diagnostics.naming-conventions"),
                root.getBoolean("diagnostics.type-references"));
    }
}
