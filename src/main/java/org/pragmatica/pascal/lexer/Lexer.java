package org.pragmatica.pascal.lexer;

import org.pragmatica.pascal.error.PascalError;
import org.pragmatica.pascal.tree.SourceLocation;
import org.pragmatica.pascal.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Pull-based lexer for the Pascal subset. Each {@link #advance()} returns the next token;
 * past the end of input it keeps returning {@link TokenKind#END_OF_FILE}.
 */
public final class Lexer {
    public static final int MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 16;

    private final String input;
    private int pos;
    private int line;
    private int column;

    public Lexer(String input) {
        this(input, MAX_INPUT_SIZE);
    }

    public Lexer(String input, int maxInputSize) {
        if (input.length() > maxInputSize) {
            throw new IllegalArgumentException(
            "Source input exceeds maximum size of " + maxInputSize + " characters");
        }
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    /**
     * Read the whole input into a list ending with the end-of-file token.
     */
    public static List<Token> tokenize(String input) {
        return tokenize(input, MAX_INPUT_SIZE);
    }

    public static List<Token> tokenize(String input, int maxInputSize) {
        var lexer = new Lexer(input, maxInputSize);
        var tokens = new ArrayList<Token>();
        while (true) {
            var token = lexer.advance();
            tokens.add(token);
            if (token.is(TokenKind.END_OF_FILE)) {
                return tokens;
            }
        }
    }

    public Token advance() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                skipWhitespace();
                continue;
            }
            if (c == '{') {
                skipComment();
                continue;
            }
            var start = currentLocation();
            if (isDigit(c)) {
                return scanNumber(start);
            }
            if (isIdentifierStart(c)) {
                return scanKeywordOrIdentifier(start);
            }
            return scanSymbol(start);
        }
        return Token.of(TokenKind.END_OF_FILE, SourceSpan.at(currentLocation()));
    }

    private Token scanNumber(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        scanDigits(sb);
        // "1." followed by no digit leaves the dot for the DOT token
        if (!isAtEnd() && peek() == '.' && isDigitAt(pos + 1)) {
            sb.append(advanceChar());
            scanDigits(sb);
            return Token.of(TokenKind.REAL_CONSTANT, sb.toString(), span(start));
        }
        return Token.of(TokenKind.INTEGER_CONSTANT, sb.toString(), span(start));
    }

    private void scanDigits(StringBuilder sb) {
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advanceChar());
        }
    }

    private Token scanKeywordOrIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advanceChar());
        }
        var word = sb.toString();
        return TokenKind.keyword(word)
                        .map(kind -> Token.of(kind, span(start)))
                        .orElseGet(() -> Token.of(TokenKind.IDENTIFIER, word, span(start)));
    }

    private Token scanSymbol(SourceLocation start) {
        char c = peek();
        TokenKind kind;
        switch (c) {
            case '+' -> kind = TokenKind.PLUS;
            case '-' -> kind = TokenKind.MINUS;
            case '*' -> kind = TokenKind.MUL;
            case '/' -> kind = TokenKind.FLOAT_DIV;
            case '(' -> kind = TokenKind.LEFT_PAREN;
            case ')' -> kind = TokenKind.RIGHT_PAREN;
            case ';' -> kind = TokenKind.SEMICOLON;
            case '.' -> kind = TokenKind.DOT;
            case ',' -> kind = TokenKind.COMMA;
            case ':' -> kind = isCharAt(pos + 1, '=')
                               ? TokenKind.ASSIGN
                               : TokenKind.COLON;
            default -> throw new PascalError.LexicalError(c, start);
        }
        advanceChar();
        if (kind == TokenKind.ASSIGN) {
            advanceChar();
        }
        return Token.of(kind, span(start));
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advanceChar();
        }
    }

    // Comments do not nest; an unterminated one runs to end of input
    private void skipComment() {
        while (!isAtEnd() && peek() != '}') {
            advanceChar();
        }
        if (!isAtEnd()) {
            advanceChar();
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advanceChar() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean isCharAt(int index, char expected) {
        return index < input.length() && input.charAt(index) == expected;
    }

    private boolean isDigitAt(int index) {
        return index < input.length() && isDigit(input.charAt(index));
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
