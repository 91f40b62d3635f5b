package org.pragmatica.pascal.eval;

import org.pragmatica.pascal.ast.Node;
import org.pragmatica.pascal.ast.NodeVisitor;
import org.pragmatica.pascal.error.PascalError;
import org.pragmatica.pascal.value.Numeric;

/**
 * Tree-walking evaluator. Expression nodes store their value in the accumulator;
 * statement nodes return the accumulator unchanged. Assignments fill the {@link Environment}.
 *
 * <p>The walk recurses on the Java call stack. Parsed trees are no deeper than
 * {@link org.pragmatica.pascal.parser.ParserConfig#maxNestingDepth()}, which counts compounds,
 * parentheses, signs and binary operators. Trees built by hand are bounded only by the stack.
 * Instances are single-use and not thread-safe.
 */
public final class Evaluator implements NodeVisitor<Numeric> {
    private final Environment environment = new Environment();
    private Numeric accumulator = Numeric.ZERO;

    /**
     * Evaluate a tree and return the last computed value.
     */
    public Numeric evaluate(Node node) {
        return node.accept(this);
    }

    /**
     * Variables assigned so far. Callers outside this package can read it but not assign.
     */
    public Environment environment() {
        return environment;
    }

    public Numeric accumulator() {
        return accumulator;
    }

    @Override
    public Numeric visitNumberLiteral(Node.NumberLiteral node) {
        accumulator = node.value();
        return accumulator;
    }

    @Override
    public Numeric visitBinaryOp(Node.BinaryOp node) {
        if (node.operator() == null) {
            throw new PascalError.UndefinedOperatorError("binary", null);
        }
        var left = evaluate(node.left());
        var right = evaluate(node.right());
        switch (node.operator()) {
            case PLUS -> accumulator = left.add(right);
            case MINUS -> accumulator = left.subtract(right);
            case MUL -> accumulator = left.multiply(right);
            case INTEGER_DIV -> accumulator = left.integerDivide(right);
            case FLOAT_DIV -> accumulator = left.floatDivide(right);
            default -> throw new PascalError.UndefinedOperatorError("binary", node.operator());
        }
        return accumulator;
    }

    @Override
    public Numeric visitUnaryOp(Node.UnaryOp node) {
        if (node.operator() == null) {
            throw new PascalError.UndefinedOperatorError("unary", null);
        }
        var operand = evaluate(node.operand());
        switch (node.operator()) {
            case PLUS -> accumulator = operand;
            case MINUS -> accumulator = operand.negate();
            default -> throw new PascalError.UndefinedOperatorError("unary", node.operator());
        }
        return accumulator;
    }

    @Override
    public Numeric visitVariableRef(Node.VariableRef node) {
        accumulator = environment.lookup(node.name())
                                 .orElseThrow(() -> new PascalError.UnboundVariableError(node.name()));
        return accumulator;
    }

    @Override
    public Numeric visitNoOp(Node.NoOp node) {
        return accumulator;
    }

    @Override
    public Numeric visitAssignment(Node.Assignment node) {
        environment.assign(node.target(), evaluate(node.value()));
        return accumulator;
    }

    @Override
    public Numeric visitStatementList(Node.StatementList node) {
        for (var child : node.children()) {
            child.accept(this);
        }
        return accumulator;
    }

    @Override
    public Numeric visitVarDecl(Node.VarDecl node) {
        // Declarations have no runtime effect
        return accumulator;
    }

    @Override
    public Numeric visitBlock(Node.Block node) {
        for (var declaration : node.declarations()) {
            declaration.accept(this);
        }
        return node.body()
                   .accept(this);
    }

    @Override
    public Numeric visitProgram(Node.Program node) {
        return node.block()
                   .accept(this);
    }
}
