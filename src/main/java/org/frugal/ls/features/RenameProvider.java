package org.frugal.ls.features;

import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.frugal.ls.api.RenameException;
import org.frugal.ls.document.Document;
import org.frugal.ls.frontend.tree.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rename support on top of the name-based {@link IReferencesProvider}. The only conflict
 * detected is renaming a symbol to its current name.
 */
public class RenameProvider implements IRenameProvider {

    private static final Logger LOG = LoggerFactory.getLogger(RenameProvider.class);

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    /** Words that can never name a user symbol. */
    static final Set<String> RESERVED_WORDS = Set.of(
            "include", "namespace", "service", "scope", "struct", "enum", "exception", "const",
            "typedef", "throws", "extends", "oneway", "required", "optional", "prefix", "void");

    /** Builtin type names. */
    static final Set<String> BUILTIN_TYPES = Set.of(
            "bool", "byte", "i8", "i16", "i32", "i64", "double", "string", "binary", "uuid",
            "list", "set", "map");

    private final IReferencesProvider references;

    public RenameProvider() {
        this(new ReferencesProvider());
    }

    /**
     * Creates a rename provider that collects occurrences through the given provider.
     * @param references The reference finder.
     */
    public RenameProvider(IReferencesProvider references) {
        this.references = references;
    }

    @Override
    public void validateNewName(String newName) throws RenameException {
        if (newName == null || newName.isBlank()) {
            throw new RenameException("new name cannot be empty");
        }
        if (!IDENTIFIER.matcher(newName).matches()) {
            throw new RenameException("'" + newName + "' is not a valid identifier");
        }
        if (RESERVED_WORDS.contains(newName) || BUILTIN_TYPES.contains(newName)) {
            throw new RenameException("'" + newName + "' is a reserved keyword and cannot be used as an identifier");
        }
    }

    @Override
    public boolean isRenameable(ResolvedSymbol symbol) {
        if (symbol == null || symbol.node().kind() == NodeKind.BASE_TYPE) {
            return false;
        }
        return !BUILTIN_TYPES.contains(symbol.name()) && !RESERVED_WORDS.contains(symbol.name());
    }

    @Override
    public Optional<Range> prepareRename(Document document, Position position) throws RenameException {
        if (document == null || document.tree() == null) {
            return Optional.empty();
        }
        ResolvedSymbol symbol = resolveRenameable(document, position);
        return Optional.of(symbol.range());
    }

    @Override
    public WorkspaceEdit rename(Document document, Position position, String newName,
                                Map<String, Document> documents) throws RenameException {
        ResolvedSymbol symbol = resolveRenameable(document, position);
        validateNewName(newName);
        if (newName.equals(symbol.name())) {
            throw new RenameException("new name '" + newName + "' is the same as current name");
        }

        List<Location> locations = references.findReferences(document, position, true, documents);
        Map<String, List<TextEdit>> changes = new LinkedHashMap<>();
        for (Location location : locations) {
            changes.computeIfAbsent(location.getUri(), uri -> new ArrayList<>())
                    .add(new TextEdit(location.getRange(), newName));
        }
        WorkspaceEdit edit = new WorkspaceEdit(changes);
        LOG.debug("Rename '{}' -> '{}': {} edits in {} documents",
                symbol.name(), newName, locations.size(), changes.size());
        return edit;
    }

    private ResolvedSymbol resolveRenameable(Document document, Position position) throws RenameException {
        ResolvedSymbol symbol = references.symbolAt(document, position)
                .orElseThrow(() -> new RenameException("no renameable symbol found at position"));
        if (!isRenameable(symbol)) {
            throw new RenameException("symbol " + symbol.name() + " cannot be renamed");
        }
        return symbol;
    }
}
