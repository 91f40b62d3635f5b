package org.pragmatica.pascal.tree;

/**
 * A position in source text. Line and column are 1-based, offset is 0-based.
 */
public record SourceLocation(int line, int column, int offset) {

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    @Override
    public String toString() {
        return line + ":" + column + " (offset " + offset + ")";
    }
}
