package org.frugal.ls.frontend.parser;

import org.frugal.ls.frontend.lexer.Lexer;
import org.frugal.ls.frontend.lexer.Token;
import org.frugal.ls.frontend.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Entry point that runs the lexer and parser over a source text.
 */
public final class FrugalParser {

    private static final Logger LOG = LoggerFactory.getLogger(FrugalParser.class);

    private FrugalParser() {}

    /**
     * Parses a Frugal source text.
     * @param source The source text.
     * @return The tree and all syntax errors, sorted by offset.
     */
    public static ParseResult parse(String source) {
        String text = source == null ? "" : source;
        List<ParseError> errors = new ArrayList<>();
        List<Token> tokens = new Lexer(text, errors).scanTokens();
        SyntaxNode root = new Parser(tokens, errors).parse();
        errors.sort(Comparator.comparingInt(ParseError::offset));
        LOG.debug("Parsed {} tokens, {} syntax errors", tokens.size(), errors.size());
        return new ParseResult(root, errors);
    }
}
