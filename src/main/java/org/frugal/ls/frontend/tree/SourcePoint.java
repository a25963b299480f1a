package org.frugal.ls.frontend.tree;

/**
 * A zero-based row/column point in the source, as reported by the parser.
 *
 * @param row    The zero-based row.
 * @param column The zero-based column in UTF-16 code units.
 */
public record SourcePoint(int row, int column) {
}
