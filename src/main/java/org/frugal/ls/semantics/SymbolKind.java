package org.frugal.ls.semantics;

import org.frugal.ls.frontend.tree.NodeKind;

import java.util.Optional;

/**
 * The kind of a named construct of a Frugal document.
 */
public enum SymbolKind {
    /** A service definition. */
    SERVICE("service", org.eclipse.lsp4j.SymbolKind.Class),
    /** A pub/sub scope definition. */
    SCOPE("scope", org.eclipse.lsp4j.SymbolKind.Class),
    /** A struct definition. */
    STRUCT("struct", org.eclipse.lsp4j.SymbolKind.Struct),
    /** An enum definition. */
    ENUM("enum", org.eclipse.lsp4j.SymbolKind.Enum),
    /** A constant definition. */
    CONST("const", org.eclipse.lsp4j.SymbolKind.Constant),
    /** A type alias. */
    TYPEDEF("typedef", org.eclipse.lsp4j.SymbolKind.TypeParameter),
    /** An exception definition. */
    EXCEPTION("exception", org.eclipse.lsp4j.SymbolKind.Class),
    /** A struct or exception field. */
    FIELD("field", org.eclipse.lsp4j.SymbolKind.Field),
    /** A function parameter or throws entry. */
    PARAMETER("parameter", org.eclipse.lsp4j.SymbolKind.Variable),
    /** An enum value. */
    ENUM_VALUE("enum value", org.eclipse.lsp4j.SymbolKind.EnumMember),
    /** A service method. */
    METHOD("method", org.eclipse.lsp4j.SymbolKind.Method),
    /** A scope operation (published event). */
    EVENT("event", org.eclipse.lsp4j.SymbolKind.Event);

    private final String keyword;
    private final org.eclipse.lsp4j.SymbolKind lspKind;

    SymbolKind(String keyword, org.eclipse.lsp4j.SymbolKind lspKind) {
        this.keyword = keyword;
        this.lspKind = lspKind;
    }

    /**
     * Returns the lower-case name used in messages, e.g. {@code "struct"}.
     * @return The display keyword.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Returns the protocol kind shown by editors. Services, scopes and exceptions are
     * presented as classes, typedefs as type parameters.
     * @return The protocol symbol kind.
     */
    public org.eclipse.lsp4j.SymbolKind lspKind() {
        return lspKind;
    }

    /**
     * Maps a top-level definition node kind to its symbol kind.
     * @param kind The node kind.
     * @return The symbol kind, or empty if the node is not a top-level definition.
     */
    public static Optional<SymbolKind> ofDefinition(NodeKind kind) {
        return switch (kind) {
            case SERVICE_DEFINITION -> Optional.of(SERVICE);
            case SCOPE_DEFINITION -> Optional.of(SCOPE);
            case STRUCT_DEFINITION -> Optional.of(STRUCT);
            case ENUM_DEFINITION -> Optional.of(ENUM);
            case CONST_DEFINITION -> Optional.of(CONST);
            case TYPEDEF_DEFINITION -> Optional.of(TYPEDEF);
            case EXCEPTION_DEFINITION -> Optional.of(EXCEPTION);
            default -> Optional.empty();
        };
    }
}
