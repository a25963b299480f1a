package org.frugal.ls.frontend.tree;

/**
 * The kind tag of a {@link SyntaxNode}. The grammar names mirror the node types of the
 * Frugal tree-sitter grammar so that trees from either source look alike.
 */
public enum NodeKind {
    SOURCE_FILE("source_file"),
    INCLUDE("include"),
    NAMESPACE_DECLARATION("namespace_declaration"),

    SERVICE_DEFINITION("service_definition"),
    SERVICE_BODY("service_body"),
    FUNCTION_DEFINITION("function_definition"),
    FUNCTION_TYPE("function_type"),
    FIELD_LIST("field_list"),
    THROWS("throws"),

    SCOPE_DEFINITION("scope_definition"),
    SCOPE_BODY("scope_body"),
    SCOPE_OPERATION("scope_operation"),

    STRUCT_DEFINITION("struct_definition"),
    EXCEPTION_DEFINITION("exception_definition"),
    STRUCT_BODY("struct_body"),
    FIELD("field"),
    FIELD_ID("field_id"),
    FIELD_REQUIREDNESS("field_requiredness"),
    FIELD_TYPE("field_type"),
    BASE_TYPE("base_type"),
    CONTAINER_TYPE("container_type"),

    ENUM_DEFINITION("enum_definition"),
    ENUM_BODY("enum_body"),
    ENUM_FIELD("enum_field"),

    CONST_DEFINITION("const_definition"),
    CONST_VALUE("const_value"),
    CONST_LIST("const_list"),
    CONST_MAP("const_map"),

    TYPEDEF_DEFINITION("typedef_definition"),

    ANNOTATIONS("annotations"),
    ANNOTATION("annotation"),

    IDENTIFIER("identifier"),
    INTEGER("integer"),
    DOUBLE("double"),
    LITERAL_STRING("literal_string"),
    KEYWORD("keyword"),
    PUNCTUATION("punctuation"),
    ERROR("ERROR");

    private final String grammarName;

    NodeKind(String grammarName) {
        this.grammarName = grammarName;
    }

    /**
     * Returns the node type name as used by the grammar.
     * @return The grammar name.
     */
    public String grammarName() {
        return grammarName;
    }

    /**
     * Checks whether nodes of this kind introduce a named top-level construct.
     * @return {@code true} for service, scope, struct, enum, const, typedef and exception definitions.
     */
    public boolean isTopLevelDefinition() {
        return switch (this) {
            case SERVICE_DEFINITION, SCOPE_DEFINITION, STRUCT_DEFINITION, ENUM_DEFINITION,
                 CONST_DEFINITION, TYPEDEF_DEFINITION, EXCEPTION_DEFINITION -> true;
            default -> false;
        };
    }
}
