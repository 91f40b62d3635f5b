package org.pragmatica.pascal.tree;

/**
 * A range of source text, start inclusive and end exclusive.
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    @Override
    public String toString() {
        return start.line() + ":" + start.column() + "-" + end.line() + ":" + end.column();
    }
}
