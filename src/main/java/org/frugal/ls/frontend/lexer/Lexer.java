package org.frugal.ls.frontend.lexer;

import org.frugal.ls.frontend.parser.ParseError;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * Frugal source text into a sequence of tokens.
 * <p>
 * Positions are zero-based; columns count UTF-16 code units, so they can be used
 * directly as char offsets into a line.
 */
public class Lexer {

    private final String source;
    private final List<ParseError> errors;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 0;
    private int lineStart = 0;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param errors The sink for lexical errors.
     */
    public Lexer(String source, List<ParseError> errors) {
        this.source = source;
        this.errors = errors;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        start = current;
        tokens.add(new Token(TokenType.END_OF_FILE, "", line, current - lineStart, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case '<': addToken(TokenType.LESS); break;
            case '>': addToken(TokenType.GREATER); break;
            case ':': addToken(TokenType.COLON); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '=': addToken(TokenType.EQUALS); break;
            case '*': addToken(TokenType.STAR); break;
            case '"', '\'': string(c); break;
            case '#':
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case '/':
                if (peek() == '/') {
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (peek() == '*') {
                    advance();
                    blockComment();
                } else {
                    unexpected();
                }
                break;
            case '-':
                // If a minus is followed by a digit, it's a negative number.
                if (isDigit(peek())) {
                    advance();
                    number();
                } else {
                    unexpected();
                }
                break;
            // Ignore whitespace
            case ' ', '\r', '\t':
                break;
            case '\n':
                newLine();
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    unexpected();
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = TokenType.IDENTIFIER;
        if (FrugalKeywords.KEYWORDS.contains(text)) {
            type = TokenType.KEYWORD;
        } else if (FrugalKeywords.BASE_TYPES.contains(text)) {
            type = TokenType.BASE_TYPE;
        }
        addToken(type);
    }

    private void number() {
        // Hex literals: 0x followed by hex digits.
        if (previous() == '0' && (peek() == 'x' || peek() == 'X') && isHexDigit(peekNext())) {
            advance();
            while (isHexDigit(peek())) advance();
            addToken(TokenType.INTEGER);
            return;
        }

        TokenType type = TokenType.INTEGER;
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            type = TokenType.DOUBLE;
            advance(); // consume the '.'
            while (isDigit(peek())) advance();
        }
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '-' || peekNext() == '+') && isDigit(peekAt(2))))) {
            type = TokenType.DOUBLE;
            advance();
            if (peek() == '-' || peek() == '+') advance();
            while (isDigit(peek())) advance();
        }
        addToken(type);
    }

    private void string(char quote) {
        while (peek() != quote && peek() != '\n' && !isAtEnd()) {
            if (peek() == '\\' && peekNext() != '\n' && current + 1 < source.length()) {
                advance();
            }
            advance();
        }

        if (peek() != quote) {
            error("Unterminated string", start);
            addToken(TokenType.STRING);
            return;
        }

        // The closing quote
        advance();
        addToken(TokenType.STRING);
    }

    private void blockComment() {
        int startLine = line;
        int startColumn = start - lineStart;
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (advance() == '\n') {
                newLine();
            }
        }
        errors.add(new ParseError("Unterminated comment", startLine, startColumn, start));
    }

    private void unexpected() {
        error("Syntax error", start);
    }

    private void error(String message, int offset) {
        errors.add(new ParseError(message, line, offset - lineStart, offset));
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), line, start - lineStart, start));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int distance) {
        if (current + distance >= source.length()) return '\0';
        return source.charAt(current + distance);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c) || c == '.';
    }
}
