package org.pragmatica.pascal.lexer;

import org.pragmatica.pascal.tree.SourceSpan;

import java.util.Objects;
import java.util.Optional;

/**
 * A single lexeme. {@code text} is present only for identifiers and numeric constants.
 */
public record Token(TokenKind kind, String text, SourceSpan span) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(span, "span");
        if (kind.carriesLexeme() && text == null) {
            throw new IllegalArgumentException(kind.debugName() + " token requires a lexeme");
        }
        if (!kind.carriesLexeme()) {
            text = null;
        }
    }

    public static Token of(TokenKind kind, SourceSpan span) {
        return new Token(kind, null, span);
    }

    public static Token of(TokenKind kind, String text, SourceSpan span) {
        return new Token(kind, text, span);
    }

    public Optional<String> value() {
        return Optional.ofNullable(text);
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    /**
     * Description used in syntax errors, e.g. {@code identifier 'x'}.
     */
    public String describe() {
        return text == null
               ? kind.display()
               : kind.display() + " '" + text + "'";
    }

    @Override
    public String toString() {
        return text == null
               ? "Token(" + kind.debugName() + ")"
               : "Token(" + kind.debugName() + ", " + text + ")";
    }
}
