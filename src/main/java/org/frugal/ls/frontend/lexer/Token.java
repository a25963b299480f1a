package org.frugal.ls.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 * Tokens never span lines.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code.
 * @param line The zero-based line number where the token was found.
 * @param column The zero-based column (UTF-16 code units) where the token begins.
 * @param offset The char offset of the token's first character.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column,
        int offset
) {

    /**
     * Returns the offset just after the token.
     * @return The exclusive end offset.
     */
    public int endOffset() {
        return offset + text.length();
    }

    /**
     * Returns the column just after the token.
     * @return The exclusive end column.
     */
    public int endColumn() {
        return column + text.length();
    }

    /**
     * Checks whether this token is the given keyword or base type word.
     * @param word The word to compare against.
     * @return {@code true} if the token is a keyword or base type with exactly this text.
     */
    public boolean is(String word) {
        return (type == TokenType.KEYWORD || type == TokenType.BASE_TYPE) && text.equals(word);
    }
}
