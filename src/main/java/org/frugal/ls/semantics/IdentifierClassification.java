package org.frugal.ls.semantics;

/**
 * The result of classifying one identifier occurrence.
 *
 * @param declaration {@code true} if the identifier introduces a name.
 * @param kind The semantic kind of the occurrence.
 */
public record IdentifierClassification(boolean declaration, SemanticKind kind) {

    static IdentifierClassification declarationOf(SemanticKind kind) {
        return new IdentifierClassification(true, kind);
    }

    static IdentifierClassification referenceOf(SemanticKind kind) {
        return new IdentifierClassification(false, kind);
    }

    /**
     * Checks whether the occurrence refers to a type.
     * @return {@code true} for {@link SemanticKind#TYPE_REFERENCE}.
     */
    public boolean isTypeReference() {
        return !declaration && kind == SemanticKind.TYPE_REFERENCE;
    }
}
