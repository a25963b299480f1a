package org.frugal.ls.features;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.frugal.ls.api.RenameException;
import org.frugal.ls.document.Document;

import java.util.Map;
import java.util.Optional;

/**
 * Validates and builds symbol renames.
 */
public interface IRenameProvider {

    /**
     * Checks a proposed identifier.
     * @param newName The proposed name.
     * @throws RenameException if the name is blank, not an identifier, or reserved.
     */
    void validateNewName(String newName) throws RenameException;

    /**
     * Checks whether a resolved symbol may be renamed at all.
     * @param symbol The resolved symbol.
     * @return {@code false} for builtin type names and keywords.
     */
    boolean isRenameable(ResolvedSymbol symbol);

    /**
     * Returns the range a rename at this position would replace.
     * @param document The document.
     * @param position The cursor position.
     * @return The identifier range, or empty if the document has no tree.
     * @throws RenameException if there is no symbol or it cannot be renamed.
     */
    Optional<Range> prepareRename(Document document, Position position) throws RenameException;

    /**
     * Renames the symbol at a position in the origin document and in every supplied document.
     * @param document The origin document.
     * @param position The cursor position.
     * @param newName The new name.
     * @param documents The other known documents, keyed by URI.
     * @return One edit per occurrence, grouped by URI in discovery order.
     * @throws RenameException if the symbol cannot be renamed to {@code newName}.
     */
    WorkspaceEdit rename(Document document, Position position, String newName,
                         Map<String, Document> documents) throws RenameException;
}
