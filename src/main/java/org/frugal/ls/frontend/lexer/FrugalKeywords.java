package org.frugal.ls.frontend.lexer;

import java.util.Set;

/**
 * The reserved words of the Frugal IDL.
 */
public final class FrugalKeywords {

    /** Words the lexer reports as {@link TokenType#KEYWORD}. */
    public static final Set<String> KEYWORDS = Set.of(
            "include", "namespace", "service", "scope", "struct", "enum", "exception",
            "const", "typedef", "throws", "extends", "oneway", "required", "optional",
            "prefix", "void", "list", "set", "map");

    /** Words the lexer reports as {@link TokenType#BASE_TYPE}. */
    public static final Set<String> BASE_TYPES = Set.of(
            "bool", "byte", "i8", "i16", "i32", "i64", "double", "string", "binary", "uuid");

    /** Parameterized container type names. */
    public static final Set<String> CONTAINER_TYPES = Set.of("list", "set", "map");

    /** Keywords that start a top-level header or definition. */
    public static final Set<String> TOP_LEVEL = Set.of(
            "include", "namespace", "service", "scope", "struct", "enum", "exception",
            "const", "typedef");

    private FrugalKeywords() {}
}
