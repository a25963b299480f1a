package org.frugal.ls.frontend.parser;

/**
 * A syntax error found while lexing or parsing.
 *
 * @param message The error message, e.g. {@code "Syntax error"} or {@code "Missing '}'"}.
 * @param line The zero-based line of the error.
 * @param column The zero-based column of the error.
 * @param offset The char offset of the error.
 */
public record ParseError(String message, int line, int column, int offset) {

    @Override
    public String toString() {
        return String.format("%d:%d: %s", line + 1, column + 1, message);
    }
}
