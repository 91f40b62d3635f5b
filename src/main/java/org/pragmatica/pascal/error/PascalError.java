package org.pragmatica.pascal.error;

import org.pragmatica.pascal.tree.SourceLocation;

import java.util.Optional;

/**
 * Failures raised while lexing, parsing, evaluating or translating.
 * None of them is recovered from inside the core; they surface to the caller.
 */
public abstract sealed class PascalError extends RuntimeException {

    protected PascalError(String message) {
        super(message);
    }

    /**
     * Where in the source the error was detected, if it is tied to a position.
     */
    public Optional<SourceLocation> location() {
        return Optional.empty();
    }

    /**
     * Unrecognised character in the input.
     */
    public static final class LexicalError extends PascalError {
        private final char character;
        private final SourceLocation location;

        public LexicalError(char character, SourceLocation location) {
            super("Unexpected character '" + character + "' at offset " + location.offset()
                  + " (line " + location.line() + ", column " + location.column() + ")");
            this.character = character;
            this.location = location;
        }

        public char character() {
            return character;
        }

        @Override
        public Optional<SourceLocation> location() {
            return Optional.of(location);
        }
    }

    /**
     * Current token does not fit the grammar at this point.
     */
    public static final class SyntaxError extends PascalError {
        private final String expected;
        private final String found;
        private final SourceLocation location;

        public SyntaxError(String expected, String found, SourceLocation location) {
            super("Unexpected " + found + " at " + location + ", expected " + expected);
            this.expected = expected;
            this.found = found;
            this.location = location;
        }

        public SyntaxError(String reason, SourceLocation location) {
            super(reason + " at " + location);
            this.expected = "";
            this.found = "";
            this.location = location;
        }

        public String expected() {
            return expected;
        }

        public String found() {
            return found;
        }

        @Override
        public Optional<SourceLocation> location() {
            return Optional.of(location);
        }
    }

    /**
     * Variable read before any assignment to it.
     */
    public static final class UnboundVariableError extends PascalError {
        private final String name;

        public UnboundVariableError(String name) {
            super("Variable '" + name + "' is not defined");
            this.name = name;
        }

        public String name() {
            return name;
        }
    }

    /**
     * Construct that has no representation in the target notation.
     */
    public static final class UnsupportedTranslationError extends PascalError {
        private final String construct;
        private final String notation;

        public UnsupportedTranslationError(String construct, String notation) {
            super("Can't translate " + construct + " to " + notation);
            this.construct = construct;
            this.notation = notation;
        }

        public String construct() {
            return construct;
        }

        public String notation() {
            return notation;
        }
    }

    /**
     * Division by zero or integer overflow.
     */
    public static final class ArithmeticError extends PascalError {
        public ArithmeticError(String reason) {
            super(reason);
        }
    }

    /**
     * Operator tag outside the known set. Unreachable for trees built by the parser.
     */
    public static final class UndefinedOperatorError extends PascalError {
        public UndefinedOperatorError(String nodeKind, Object operator) {
            super("Undefined " + nodeKind + " operator: " + operator);
        }
    }
}
