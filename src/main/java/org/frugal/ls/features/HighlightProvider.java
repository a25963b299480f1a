package org.frugal.ls.features;

import org.eclipse.lsp4j.DocumentHighlight;
import org.eclipse.lsp4j.DocumentHighlightKind;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.frugal.ls.document.Document;
import org.frugal.ls.frontend.tree.NodeKind;
import org.frugal.ls.frontend.tree.SyntaxNode;
import org.frugal.ls.frontend.tree.TreeWalker;
import org.frugal.ls.semantics.IdentifierClassification;
import org.frugal.ls.semantics.IdentifierClassifier;
import org.frugal.ls.util.Ranges;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Document highlights: declarations are {@link DocumentHighlightKind#Write}, type
 * references (including {@code extends} targets) are {@link DocumentHighlightKind#Read},
 * and every other occurrence is {@link DocumentHighlightKind#Text}.
 */
public class HighlightProvider implements IHighlightProvider {

    private final IReferencesProvider references;

    public HighlightProvider() {
        this(new ReferencesProvider());
    }

    public HighlightProvider(IReferencesProvider references) {
        this.references = references;
    }

    @Override
    public List<DocumentHighlight> highlights(Document document, Position position) {
        List<DocumentHighlight> result = new ArrayList<>();
        if (document == null || document.tree() == null) {
            return result;
        }
        List<Location> locations = references.findReferences(document, position, true, Map.of());
        if (locations.isEmpty()) {
            return result;
        }

        Map<Range, SyntaxNode> identifiers = new HashMap<>();
        TreeWalker.forKind(NodeKind.IDENTIFIER, node -> identifiers.putIfAbsent(Ranges.of(node), node))
                .walk(document.tree());

        for (Location location : locations) {
            if (!location.getUri().equals(document.uri())) {
                continue;
            }
            SyntaxNode node = identifiers.get(location.getRange());
            result.add(new DocumentHighlight(location.getRange(), kindOf(node)));
        }
        return result;
    }

    private static DocumentHighlightKind kindOf(SyntaxNode node) {
        if (node == null) {
            return DocumentHighlightKind.Text;
        }
        IdentifierClassification classification = IdentifierClassifier.classify(node);
        if (classification.declaration()) {
            return DocumentHighlightKind.Write;
        }
        return classification.isTypeReference() ? DocumentHighlightKind.Read : DocumentHighlightKind.Text;
    }
}
