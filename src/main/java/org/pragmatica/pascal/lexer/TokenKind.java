package org.pragmatica.pascal.lexer;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Token kinds produced by the {@link Lexer}.
 */
public enum TokenKind {
    // Keywords
    PROGRAM("Program", "'program'"),
    VAR("Var", "'var'"),
    BEGIN("Begin", "'begin'"),
    END("End", "'end'"),
    INTEGER("Integer", "'integer'"),
    REAL("Real", "'real'"),
    INTEGER_DIV("IntegerDiv", "'div'"),

    // Carry a lexeme
    IDENTIFIER("Identifier", "identifier"),
    INTEGER_CONSTANT("IntegerConstant", "integer constant"),
    REAL_CONSTANT("RealConstant", "real constant"),

    // Separators
    DOT("Dot", "'.'"),
    ASSIGN("Assign", "':='"),
    SEMICOLON("Semicolon", "';'"),
    COLON("Colon", "':'"),
    COMMA("Comma", "','"),
    LEFT_PAREN("LeftParen", "'('"),
    RIGHT_PAREN("RightParen", "')'"),

    // Operators
    PLUS("Plus", "'+'"),
    MINUS("Minus", "'-'"),
    MUL("Mul", "'*'"),
    FLOAT_DIV("FloatDiv", "'/'"),

    END_OF_FILE("EndOfFile", "end of input");

    private static final Map<String, TokenKind> KEYWORDS = Map.of(
        "program", PROGRAM,
        "var", VAR,
        "begin", BEGIN,
        "end", END,
        "integer", INTEGER,
        "real", REAL,
        "div", INTEGER_DIV);

    private final String debugName;
    private final String display;

    TokenKind(String debugName, String display) {
        this.debugName = debugName;
        this.display = display;
    }

    /**
     * Name used by the token debug printer, e.g. {@code IntegerConstant}.
     */
    public String debugName() {
        return debugName;
    }

    /**
     * Human-readable form for error messages, e.g. {@code ':='}.
     */
    public String display() {
        return display;
    }

    public boolean carriesLexeme() {
        return this == IDENTIFIER || this == INTEGER_CONSTANT || this == REAL_CONSTANT;
    }

    /**
     * Reserved word lookup, ignoring case.
     */
    public static Optional<TokenKind> keyword(String word) {
        return Optional.ofNullable(KEYWORDS.get(word.toLowerCase(Locale.ROOT)));
    }
}
