package org.frugal.ls.diagnostics.passes;

import org.frugal.ls.diagnostics.DiagnosticsEngine;
import org.frugal.ls.document.Document;
import org.frugal.ls.semantics.Symbol;

/**
 * Warns about type names that are not PascalCase and constant names that are not
 * UPPER_SNAKE_CASE. Typedefs are not checked.
 */
public class NamingConventionPass implements IDiagnosticPass {

    @Override
    public String name() {
        return "naming-conventions";
    }

    @Override
    public void analyze(Document document, DiagnosticsEngine diagnostics) {
        for (Symbol symbol : document.symbols()) {
            String expected = switch (symbol.kind()) {
                case SERVICE, STRUCT, EXCEPTION, ENUM, SCOPE -> isPascalCase(symbol.name()) ? null : "PascalCase";
                case CONST -> isUpperSnakeCase(symbol.name()) ? null : "UPPER_SNAKE_CASE";
                default -> null;
            };
            if (expected != null) {
                diagnostics.reportWarning(symbol.declarationRange(), String.format("%s '%s' should follow %s naming convention",
                        capitalize(symbol.kind().keyword()), symbol.name(), expected));
            }
        }
    }

    /**
     * Checks for PascalCase: an upper-case first letter, no underscores or spaces, and at
     * least one lower-case letter.
     * @param name The name to check.
     * @return {@code true} if the name is PascalCase.
     */
    static boolean isPascalCase(String name) {
        if (name.isEmpty()) {
            return false;
        }
        char first = name.charAt(0);
        if (first < 'A' || first > 'Z') {
            return false;
        }
        if (name.indexOf('_') >= 0 || name.indexOf(' ') >= 0) {
            return false;
        }
        return name.chars().anyMatch(c -> c >= 'a' && c <= 'z');
    }

    /**
     * Checks for UPPER_SNAKE_CASE: only upper-case letters, digits and single underscores
     * that are neither leading nor trailing.
     * @param name The name to check.
     * @return {@code true} if the name is UPPER_SNAKE_CASE.
     */
    static boolean isUpperSnakeCase(String name) {
        if (name.isEmpty()) {
            return false;
        }
        boolean previousUnderscore = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if ((c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
                previousUnderscore = false;
            } else if (c == '_') {
                if (i == 0 || i == name.length() - 1 || previousUnderscore) {
                    return false;
                }
                previousUnderscore = true;
            } else {
                return false;
            }
        }
        return true;
    }

    private static String capitalize(String word) {
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }
}
