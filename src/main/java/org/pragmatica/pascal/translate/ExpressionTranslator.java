package org.pragmatica.pascal.translate;

import org.pragmatica.pascal.ast.BinaryOperator;
import org.pragmatica.pascal.ast.Node;
import org.pragmatica.pascal.ast.NodeVisitor;
import org.pragmatica.pascal.error.PascalError;

/**
 * Base for translators that render a pure expression tree as a single string.
 * Unary operators and statement nodes have no form in the target notations and are rejected.
 */
public abstract class ExpressionTranslator implements NodeVisitor<String> {

    /**
     * Name of the target notation, used in error messages.
     */
    protected abstract String notation();

    /**
     * Render a binary operation from its already translated operands.
     */
    protected abstract String combine(String operator, String left, String right);

    public String translate(Node node) {
        return node.accept(this);
    }

    @Override
    public String visitBinaryOp(Node.BinaryOp node) {
        var operator = symbol(node.operator());
        return combine(operator, translate(node.left()), translate(node.right()));
    }

    @Override
    public String visitNumberLiteral(Node.NumberLiteral node) {
        return node.value()
                   .render();
    }

    @Override
    public String visitVariableRef(Node.VariableRef node) {
        return node.name();
    }

    @Override
    public String visitUnaryOp(Node.UnaryOp node) {
        throw unsupported("unary operator");
    }

    @Override
    public String visitNoOp(Node.NoOp node) {
        throw unsupported("empty statement");
    }

    @Override
    public String visitAssignment(Node.Assignment node) {
        throw unsupported("assignment");
    }

    @Override
    public String visitStatementList(Node.StatementList node) {
        throw unsupported("compound statement");
    }

    @Override
    public String visitVarDecl(Node.VarDecl node) {
        throw unsupported("variable declaration");
    }

    @Override
    public String visitBlock(Node.Block node) {
        throw unsupported("block");
    }

    @Override
    public String visitProgram(Node.Program node) {
        throw unsupported("program");
    }

    private String symbol(BinaryOperator operator) {
        if (operator == null) {
            throw new PascalError.UndefinedOperatorError("binary", null);
        }
        return operator.symbol();
    }

    private PascalError.UnsupportedTranslationError unsupported(String construct) {
        return new PascalError.UnsupportedTranslationError(construct, notation());
    }
}
