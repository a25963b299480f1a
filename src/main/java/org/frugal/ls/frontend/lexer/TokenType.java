package org.frugal.ls.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The '{' character, opening a definition body or a const map. */
    LEFT_BRACE,
    /** The '}' character. */
    RIGHT_BRACE,
    /** The '(' character, opening a parameter list or annotations. */
    LEFT_PAREN,
    /** The ')' character. */
    RIGHT_PAREN,
    /** The '[' character, opening a const list. */
    LEFT_BRACKET,
    /** The ']' character. */
    RIGHT_BRACKET,
    /** The '<' character, opening container type arguments. */
    LESS,
    /** The '>' character. */
    GREATER,
    /** The ':' character, used after field IDs and in scope operations. */
    COLON,
    /** The ',' character, a list separator. */
    COMMA,
    /** The ';' character, a list separator. */
    SEMICOLON,
    /** The '=' character, used in consts, enum values and defaults. */
    EQUALS,
    /** The '*' character, the wildcard namespace scope. */
    STAR,

    // Literals.
    /** An identifier; may contain dots, e.g. {@code base.User}. */
    IDENTIFIER,
    /** An integer literal, decimal or hexadecimal, optionally negative. */
    INTEGER,
    /** A floating-point literal. */
    DOUBLE,
    /** A single- or double-quoted string literal. */
    STRING,

    // Keywords.
    /** A reserved word such as {@code struct} or {@code throws}. */
    KEYWORD,
    /** A builtin scalar type name such as {@code i32} or {@code string}. */
    BASE_TYPE,

    // Miscellaneous.
    /** Represents the end of the source file. */
    END_OF_FILE
}
