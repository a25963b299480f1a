package org.frugal.ls.util;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.frugal.ls.frontend.tree.SyntaxNode;

import java.util.OptionalInt;

/**
 * Conversions between char offsets, positions and node spans.
 * Lines are separated by {@code '\n'}; a preceding {@code '\r'} counts as part of the line.
 */
public final class Ranges {

    private Ranges() {}

    /**
     * Returns the range covered by a node, taken from its start and end points.
     * @param node The node.
     * @return The node's range.
     */
    public static Range of(SyntaxNode node) {
        return of(node.startPoint().row(), node.startPoint().column(),
                node.endPoint().row(), node.endPoint().column());
    }

    /**
     * Creates a range from raw line/column values.
     * @param startLine The start line.
     * @param startCharacter The start column.
     * @param endLine The end line.
     * @param endCharacter The exclusive end column.
     * @return The new range.
     */
    public static Range of(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new Range(new Position(startLine, startCharacter), new Position(endLine, endCharacter));
    }

    /**
     * Converts a position to a char offset.
     * @param source The document text.
     * @param position The zero-based position.
     * @return The offset, or empty if the line does not exist or the character is at or
     *         beyond the end of the line.
     */
    public static OptionalInt toOffset(String source, Position position) {
        if (source == null || position.getLine() < 0 || position.getCharacter() < 0) {
            return OptionalInt.empty();
        }
        int lineStart = 0;
        for (int line = 0; line < position.getLine(); line++) {
            int newline = source.indexOf('\n', lineStart);
            if (newline < 0) {
                return OptionalInt.empty();
            }
            lineStart = newline + 1;
        }
        int lineEnd = source.indexOf('\n', lineStart);
        if (lineEnd < 0) {
            lineEnd = source.length();
        }
        if (position.getCharacter() >= lineEnd - lineStart) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(lineStart + position.getCharacter());
    }

    /**
     * Converts a char offset to a position. Offsets past the end clamp to the end of the text.
     * @param source The document text.
     * @param offset The char offset.
     * @return The zero-based position.
     */
    public static Position toPosition(String source, int offset) {
        int limit = Math.max(0, Math.min(offset, source.length()));
        int line = 0;
        int lineStart = 0;
        for (int i = 0; i < limit; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new Position(line, limit - lineStart);
    }

    /**
     * Returns the one-character range starting at the given point.
     * @param line The zero-based line.
     * @param column The zero-based column.
     * @return The range {@code [line:column, line:column+1)}.
     */
    public static Range singleCharacter(int line, int column) {
        return of(line, column, line, column + 1);
    }
}
