package org.frugal.ls.features;

import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.frugal.ls.document.Document;
import org.frugal.ls.semantics.Symbol;
import org.frugal.ls.semantics.SymbolExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves a name to its declarations. The origin document wins: top-level definitions
 * first, then nested ones (methods, fields, enum values, events, parameters). Other
 * documents are only searched when the origin document declares nothing by that name.
 */
public class DefinitionProvider implements IDefinitionProvider {

    private static final Logger LOG = LoggerFactory.getLogger(DefinitionProvider.class);

    private final IReferencesProvider references;

    public DefinitionProvider() {
        this(new ReferencesProvider());
    }

    public DefinitionProvider(IReferencesProvider references) {
        this.references = references;
    }

    @Override
    public List<Location> findDefinitions(Document document, Position position, Map<String, Document> documents) {
        Optional<ResolvedSymbol> resolved = references.symbolAt(document, position);
        if (resolved.isEmpty()) {
            return new ArrayList<>();
        }
        String name = resolved.get().name();

        Set<Location> found = new LinkedHashSet<>(definitionsIn(document, name));
        if (found.isEmpty() && documents != null) {
            for (Document other : documents.values()) {
                if (other == null || other.uri().equals(document.uri()) || !other.isAnalyzable()) {
                    continue;
                }
                found.addAll(definitionsIn(other, name));
            }
        }
        LOG.debug("Found {} definitions of '{}'", found.size(), name);
        return new ArrayList<>(found);
    }

    private static List<Location> definitionsIn(Document document, String name) {
        List<Location> locations = new ArrayList<>();
        for (Symbol symbol : document.symbols()) {
            if (symbol.name().equals(name)) {
                locations.add(new Location(document.uri(), symbol.declarationRange()));
            }
        }
        if (locations.isEmpty()) {
            for (Symbol symbol : SymbolExtractor.extractDeclarations(document.tree(), document.source())) {
                if (symbol.name().equals(name)) {
                    locations.add(new Location(document.uri(), symbol.declarationRange()));
                }
            }
        }
        return locations;
    }
}
