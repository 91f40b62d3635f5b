package org.pragmatica.pascal.parser;

import org.pragmatica.pascal.lexer.Lexer;

/**
 * Parser configuration options.
 *
 * @param maxNestingDepth deepest allowed nesting of compounds, parentheses and sign chains
 * @param maxInputSize    largest accepted source, in characters
 */
public record ParserConfig(
    int maxNestingDepth,
    int maxInputSize
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        256,
        Lexer.MAX_INPUT_SIZE
    );

    public ParserConfig {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        if (maxInputSize < 0) {
            throw new IllegalArgumentException("maxInputSize must not be negative: " + maxInputSize);
        }
    }
}
