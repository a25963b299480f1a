package org.frugal.ls.semantics;

/**
 * The meaning of one identifier occurrence, as decided by the {@link IdentifierClassifier}.
 */
public enum SemanticKind {
    STRUCT,
    SERVICE,
    ENUM,
    EXCEPTION,
    SCOPE,
    CONSTANT,
    TYPEDEF,
    METHOD,
    FIELD,
    PARAMETER,
    ENUM_VALUE,
    EVENT,
    /** A name used where a type is expected. */
    TYPE_REFERENCE,
    /** Any other identifier occurrence. */
    IDENTIFIER
}
