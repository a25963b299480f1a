package org.frugal.ls.frontend.parser;

import org.frugal.ls.frontend.tree.SyntaxNode;

import java.util.List;

/**
 * The outcome of parsing one source text.
 *
 * @param root The root of the syntax tree; {@code null} only when no tree could be produced.
 * @param errors The syntax errors in source order.
 */
public record ParseResult(SyntaxNode root, List<ParseError> errors) {

    public ParseResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Checks whether any syntax error was found.
     * @return {@code true} if the error list is non-empty.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
