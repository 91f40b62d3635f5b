package org.pragmatica.pascal.translate;

/**
 * Reverse Polish notation: {@code 2 + 3 * 4} becomes {@code 2 3 4 * +}.
 */
public final class PostfixTranslator extends ExpressionTranslator {

    @Override
    protected String notation() {
        return "postfix";
    }

    @Override
    protected String combine(String operator, String left, String right) {
        return left + " " + right + " " + operator;
    }
}
