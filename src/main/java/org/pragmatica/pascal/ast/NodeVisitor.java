package org.pragmatica.pascal.ast;

/**
 * One operation per {@link Node} variant. A node calls the method matching its own
 * type from {@link Node#accept(NodeVisitor)}, so an algorithm never inspects node types.
 *
 * <p>New algorithms need no change to the nodes. A new node type must be added here,
 * which breaks every implementation until it handles the new type.
 *
 * @param <R> result of visiting a node
 */
public interface NodeVisitor<R> {

    R visitBinaryOp(Node.BinaryOp node);

    R visitUnaryOp(Node.UnaryOp node);

    R visitNumberLiteral(Node.NumberLiteral node);

    R visitVariableRef(Node.VariableRef node);

    R visitNoOp(Node.NoOp node);

    R visitAssignment(Node.Assignment node);

    R visitStatementList(Node.StatementList node);

    R visitVarDecl(Node.VarDecl node);

    R visitBlock(Node.Block node);

    R visitProgram(Node.Program node);
}
