package org.pragmatica.pascal.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.pascal.ast.BinaryOperator;
import org.pragmatica.pascal.ast.Node;
import org.pragmatica.pascal.ast.TypeSpec;
import org.pragmatica.pascal.ast.UnaryOperator;
import org.pragmatica.pascal.error.PascalError;
import org.pragmatica.pascal.value.Numeric;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    private static Node expression(String source) {
        return Parser.forSource(source, ParserConfig.DEFAULT)
                     .parseExpression();
    }

    private static Node.StatementList compound(String source) {
        return Parser.forSource(source, ParserConfig.DEFAULT)
                     .parseCompound();
    }

    private static Node.Program program(String source) {
        return Parser.forSource(source, ParserConfig.DEFAULT)
                     .parseProgram();
    }

    private static Node num(long value) {
        return Node.NumberLiteral.of(value);
    }

    // === Expressions ===

    @Test
    void parseExpression_mulBindsTighterThanPlus() {
        var expected = new Node.BinaryOp(num(2),
                                         new Node.BinaryOp(num(3), num(4), BinaryOperator.MUL),
                                         BinaryOperator.PLUS);

        assertEquals(expected, expression("2 + 3 * 4"));
    }

    @Test
    void parseExpression_minusIsLeftAssociative() {
        var expected = new Node.BinaryOp(new Node.BinaryOp(num(8), num(3), BinaryOperator.MINUS),
                                         num(2),
                                         BinaryOperator.MINUS);

        assertEquals(expected, expression("8 - 3 - 2"));
    }

    @Test
    void parseExpression_divisionOperators_areLeftAssociativeTerms() {
        var expected = new Node.BinaryOp(new Node.BinaryOp(num(10), num(4), BinaryOperator.INTEGER_DIV),
                                         num(2),
                                         BinaryOperator.FLOAT_DIV);

        assertEquals(expected, expression("10 div 4 / 2"));
    }

    @Test
    void parseExpression_parenthesesResetPrecedence() {
        var expected = new Node.BinaryOp(new Node.BinaryOp(num(2), num(3), BinaryOperator.PLUS),
                                         num(4),
                                         BinaryOperator.MUL);

        assertEquals(expected, expression("(2 + 3) * 4"));
    }

    @Test
    void parseExpression_doubleMinus_nestsUnaryNodes() {
        var expected = new Node.UnaryOp(new Node.UnaryOp(new Node.VariableRef("b"), UnaryOperator.MINUS),
                                        UnaryOperator.MINUS);

        assertEquals(expected, expression("- - b"));
    }

    @Test
    void parseExpression_minusMinus_isBinaryOverUnary() {
        var expected = new Node.BinaryOp(new Node.VariableRef("a"),
                                         new Node.UnaryOp(new Node.VariableRef("b"), UnaryOperator.MINUS),
                                         BinaryOperator.MINUS);

        assertEquals(expected, expression("a - - b"));
    }

    @Test
    void parseExpression_unaryPlus_isKept() {
        var expected = new Node.UnaryOp(num(5), UnaryOperator.PLUS);

        assertEquals(expected, expression("+5"));
    }

    @Test
    void parseExpression_realConstant_becomesRealLiteral() {
        var node = (Node.NumberLiteral) expression("2.5");

        assertEquals(Numeric.of(2.5), node.value());
        assertFalse(node.value().isInteger());
    }

    @Test
    void parseExpression_integerOutOfRange_fails() {
        assertThrows(PascalError.SyntaxError.class, () -> expression("99999999999999999999"));
    }

    @Test
    void parseExpression_danglingOperator_failsWithExpectedExpression() {
        var error = assertThrows(PascalError.SyntaxError.class, () -> expression("1 +"));

        assertEquals("expression", error.expected());
        assertEquals("end of input", error.found());
    }

    @Test
    void parseExpression_unclosedParen_failsExpectingRightParen() {
        var error = assertThrows(PascalError.SyntaxError.class, () -> expression("(1 + 2"));

        assertEquals("')'", error.expected());
    }

    // === Statements ===

    @Test
    void parseCompound_nestedCompound_isFirstChild() {
        var list = compound("begin begin x := 1 end; y := 2 end");

        assertThat(list.children()).hasSize(2);
        assertInstanceOf(Node.StatementList.class, list.children().get(0));
        assertEquals(new Node.Assignment("y", num(2)), list.children().get(1));

        var inner = (Node.StatementList) list.children().get(0);
        assertEquals(List.of(new Node.Assignment("x", num(1))), inner.children());
    }

    @Test
    void parseCompound_doubleSemicolon_yieldsNoOp() {
        var list = compound("begin a := 1;; b := 2 end");

        assertThat(list.children()).hasSize(3);
        assertInstanceOf(Node.Assignment.class, list.children().get(0));
        assertInstanceOf(Node.NoOp.class, list.children().get(1));
        assertInstanceOf(Node.Assignment.class, list.children().get(2));
    }

    @Test
    void parseCompound_trailingSemicolon_endsWithNoOp() {
        var list = compound("begin a := 1; end");

        assertThat(list.children()).hasSize(2);
        assertInstanceOf(Node.NoOp.class, list.children().get(1));
    }

    @Test
    void parseCompound_emptyBody_containsSingleNoOp() {
        assertEquals(List.of(new Node.NoOp()), compound("begin end").children());
    }

    @Test
    void parseCompound_missingAssign_failsNamingExpectedKind() {
        var error = assertThrows(PascalError.SyntaxError.class, () -> compound("begin a 1 end"));

        assertEquals("':='", error.expected());
        assertEquals("integer constant '1'", error.found());
        assertTrue(error.getMessage().contains("expected ':='"));
    }

    @Test
    void parseCompound_missingEnd_fails() {
        var error = assertThrows(PascalError.SyntaxError.class, () -> compound("begin a := 1"));

        assertEquals("'end'", error.expected());
    }

    // === Programs ===

    @Test
    void parseProgram_bareCompound_hasNoNameOrDeclarations() {
        var node = program("begin x := 1 end.");

        assertTrue(node.name().isEmpty());
        assertThat(node.block().declarations()).isEmpty();
        assertEquals(List.of(new Node.Assignment("x", num(1))), node.block().body().children());
    }

    @Test
    void parseProgram_headerAndDeclarations_areParsed() {
        var node = program("""
            program Main;
            var a, b : integer;
                y    : REAL;
            begin
              a := 2
            end.
            """);

        assertEquals("Main", node.name().orElseThrow());
        assertEquals(List.of(new Node.VarDecl(List.of("a", "b"), TypeSpec.INTEGER),
                             new Node.VarDecl(List.of("y"), TypeSpec.REAL)),
                     node.block().declarations());
    }

    @Test
    void parseProgram_missingDot_failsAtEndOfInput() {
        var error = assertThrows(PascalError.SyntaxError.class, () -> program("begin end"));

        assertEquals("'.'", error.expected());
        assertEquals("end of input", error.found());
    }

    @Test
    void parseProgram_textAfterDot_fails() {
        var error = assertThrows(PascalError.SyntaxError.class, () -> program("begin end. x"));

        assertEquals("end of input", error.expected());
    }

    @Test
    void parseProgram_badType_fails() {
        var error = assertThrows(PascalError.SyntaxError.class,
                                 () -> program("var a : boolean; begin end."));

        assertEquals("type 'integer' or 'real'", error.expected());
    }

    @Test
    void parseProgram_varWithoutDeclaration_fails() {
        assertThrows(PascalError.SyntaxError.class, () -> program("var begin end."));
    }

    @Test
    void parseProgram_sameText_yieldsEqualTrees() {
        var source = "begin a := 1; begin b := a * (2 + 3) end; c := - - b end.";

        assertEquals(program(source), program(source));
    }

    @Test
    void parseProgram_syntaxError_reportsLocation() {
        var error = assertThrows(PascalError.SyntaxError.class, () -> program("begin\n  a := end."));
        var location = error.location().orElseThrow();

        assertEquals(2, location.line());
        assertEquals(8, location.column());
    }

    // === Nesting limit ===

    @Test
    void nestingDeeperThanLimit_failsWithSyntaxError() {
        var config = new ParserConfig(3, ParserConfig.DEFAULT.maxInputSize());
        var parser = Parser.forSource("((((1))))", config);

        var error = assertThrows(PascalError.SyntaxError.class, parser::parseExpression);

        assertTrue(error.getMessage().contains("Nesting too deep"));
    }

    @Test
    void nestingWithinLimit_parses() {
        var config = new ParserConfig(4, ParserConfig.DEFAULT.maxInputSize());

        assertEquals(num(1), Parser.forSource("((((1))))", config).parseExpression());
    }

    @Test
    void deeplyNestedCompounds_overDefaultLimit_failWithoutStackOverflow() {
        var depth = ParserConfig.DEFAULT.maxNestingDepth() + 1;
        var source = "begin ".repeat(depth) + "end ".repeat(depth);

        assertThrows(PascalError.SyntaxError.class, () -> compound(source));
    }

    @Test
    void binaryChainWithinLimit_parses() {
        var config = new ParserConfig(3, ParserConfig.DEFAULT.maxInputSize());

        assertInstanceOf(Node.BinaryOp.class, Parser.forSource("1 + 2 - 3 * 4", config).parseExpression());
    }

    @Test
    void binaryChainLongerThanLimit_failsWithSyntaxError() {
        var config = new ParserConfig(3, ParserConfig.DEFAULT.maxInputSize());

        var additive = assertThrows(PascalError.SyntaxError.class,
                                    () -> Parser.forSource("1 + 2 + 3 + 4 + 5", config).parseExpression());
        var multiplicative = assertThrows(PascalError.SyntaxError.class,
                                          () -> Parser.forSource("1 * 2 div 3 / 4 * 5", config).parseExpression());

        assertTrue(additive.getMessage().contains("Nesting too deep"));
        assertTrue(multiplicative.getMessage().contains("Nesting too deep"));
    }

    @Test
    void longFlatBinaryChain_overDefaultLimit_failsWithoutStackOverflow() {
        var source = "begin x := 1" + "+1".repeat(100_000) + " end";

        var error = assertThrows(PascalError.SyntaxError.class, () -> compound(source));

        assertTrue(error.getMessage().contains("Nesting too deep"));
    }

    @Test
    void config_nonPositiveDepth_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ParserConfig(0, 10));
    }
}
