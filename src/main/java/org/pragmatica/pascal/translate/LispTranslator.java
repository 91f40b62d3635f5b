package org.pragmatica.pascal.translate;

/**
 * Fully parenthesized prefix notation: {@code 2 + 3 * 4} becomes {@code (+ 2 (* 3 4))}.
 */
public final class LispTranslator extends ExpressionTranslator {

    @Override
    protected String notation() {
        return "lisp";
    }

    @Override
    protected String combine(String operator, String left, String right) {
        return "(" + operator + " " + left + " " + right + ")";
    }
}
