package org.pragmatica.pascal.ast;

import org.pragmatica.pascal.value.Numeric;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * AST node types. The set is closed; algorithms over the tree are written as
 * {@link NodeVisitor} implementations and reached through {@link #accept(NodeVisitor)}.
 *
 * <p>Every node owns its children. Nodes keep no reference to their parent or siblings.
 */
public sealed interface Node {

    <R> R accept(NodeVisitor<R> visitor);

    // === Expressions ===

    /**
     * Binary arithmetic: left op right
     */
    record BinaryOp(Node left, Node right, BinaryOperator operator) implements Node {
        public BinaryOp {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }
    }

    /**
     * Prefix sign: +operand, -operand
     */
    record UnaryOp(Node operand, UnaryOperator operator) implements Node {
        public UnaryOp {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    /**
     * Integer or real constant
     */
    record NumberLiteral(Numeric value) implements Node {
        public NumberLiteral {
            Objects.requireNonNull(value, "value");
        }

        public static NumberLiteral of(long value) {
            return new NumberLiteral(Numeric.of(value));
        }

        public static NumberLiteral of(double value) {
            return new NumberLiteral(Numeric.of(value));
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitNumberLiteral(this);
        }
    }

    /**
     * Variable read. The name keeps its source spelling.
     */
    record VariableRef(String name) implements Node {
        public VariableRef {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitVariableRef(this);
        }
    }

    // === Statements ===

    /**
     * Empty statement
     */
    record NoOp() implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitNoOp(this);
        }
    }

    /**
     * target := value
     */
    record Assignment(String target, Node value) implements Node {
        public Assignment {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAssignment(this);
        }
    }

    /**
     * Statements of a begin ... end block, in execution order
     */
    record StatementList(List<Node> children) implements Node {
        public StatementList {
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitStatementList(this);
        }
    }

    // === Program structure ===

    /**
     * var a, b : integer
     */
    record VarDecl(List<String> names, TypeSpec type) implements Node {
        public VarDecl {
            names = List.copyOf(names);
            Objects.requireNonNull(type, "type");
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitVarDecl(this);
        }
    }

    /**
     * Declarations followed by the compound statement
     */
    record Block(List<VarDecl> declarations, StatementList body) implements Node {
        public Block {
            declarations = List.copyOf(declarations);
            Objects.requireNonNull(body, "body");
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitBlock(this);
        }
    }

    /**
     * Root node. The name is absent when the source has no program header.
     */
    record Program(Optional<String> name, Block block) implements Node {
        public Program {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(block, "block");
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitProgram(this);
        }
    }
}
