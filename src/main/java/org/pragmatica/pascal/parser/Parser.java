package org.pragmatica.pascal.parser;

import org.pragmatica.pascal.ast.BinaryOperator;
import org.pragmatica.pascal.ast.Node;
import org.pragmatica.pascal.ast.TypeSpec;
import org.pragmatica.pascal.ast.UnaryOperator;
import org.pragmatica.pascal.error.PascalError;
import org.pragmatica.pascal.lexer.Lexer;
import org.pragmatica.pascal.lexer.Token;
import org.pragmatica.pascal.lexer.TokenKind;
import org.pragmatica.pascal.value.Numeric;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser with one token of lookahead.
 *
 * <pre>
 * program      := [ 'program' IDENT ';' ] block '.' EOF
 * block        := declarations compound
 * declarations := ( 'var' (varDecl ';')+ )?
 * varDecl      := IDENT (',' IDENT)* ':' typeSpec
 * typeSpec     := 'integer' | 'real'
 * compound     := 'begin' statementList 'end'
 * statementList:= statement (';' statement)*
 * statement    := compound | assignment | empty
 * assignment   := IDENT ':=' expr
 * expr         := term (('+' | '-') term)*
 * term         := factor (('*' | 'div' | '/') factor)*
 * factor       := ('+' | '-') factor | INT | REAL | '(' expr ')' | IDENT
 * </pre>
 *
 * Operator precedence comes from the nesting of expr, term and factor. The parser
 * stops at the first error. Compounds, parentheses, signs and every binary operator of a
 * left-deep chain count against {@link ParserConfig#maxNestingDepth()}. A parser instance reads its lexer once, so use it for one parse.
 */
public final class Parser {
    private final Lexer lexer;
    private final ParserConfig config;
    private Token currentToken;
    private int depth;

    public Parser(Lexer lexer) {
        this(lexer, ParserConfig.DEFAULT);
    }

    public Parser(Lexer lexer, ParserConfig config) {
        this.lexer = lexer;
        this.config = config;
        this.currentToken = lexer.advance();
        this.depth = 0;
    }

    public static Parser forSource(String source, ParserConfig config) {
        return new Parser(new Lexer(source, config.maxInputSize()), config);
    }

    /**
     * Parse a complete program terminated by '.' and end of input.
     */
    public Node.Program parseProgram() {
        Optional<String> name = Optional.empty();
        if (currentToken.is(TokenKind.PROGRAM)) {
            eatAndAdvance(TokenKind.PROGRAM);
            name = Optional.of(identifier());
            eatAndAdvance(TokenKind.SEMICOLON);
        }
        var block = block();
        eatAndAdvance(TokenKind.DOT);
        eatAndAdvance(TokenKind.END_OF_FILE);
        return new Node.Program(name, block);
    }

    /**
     * Parse a single begin ... end compound followed by end of input.
     */
    public Node.StatementList parseCompound() {
        var node = compound();
        eatAndAdvance(TokenKind.END_OF_FILE);
        return node;
    }

    /**
     * Parse a single expression followed by end of input.
     */
    public Node parseExpression() {
        var node = expr();
        eatAndAdvance(TokenKind.END_OF_FILE);
        return node;
    }

    private Node.Block block() {
        var declarations = declarations();
        return new Node.Block(declarations, compound());
    }

    private List<Node.VarDecl> declarations() {
        var declarations = new ArrayList<Node.VarDecl>();
        if (!currentToken.is(TokenKind.VAR)) {
            return declarations;
        }
        eatAndAdvance(TokenKind.VAR);
        do {
            declarations.add(varDecl());
            eatAndAdvance(TokenKind.SEMICOLON);
        } while (currentToken.is(TokenKind.IDENTIFIER));
        return declarations;
    }

    private Node.VarDecl varDecl() {
        var names = new ArrayList<String>();
        names.add(identifier());
        while (currentToken.is(TokenKind.COMMA)) {
            eatAndAdvance(TokenKind.COMMA);
            names.add(identifier());
        }
        eatAndAdvance(TokenKind.COLON);
        return new Node.VarDecl(names, typeSpec());
    }

    private TypeSpec typeSpec() {
        if (currentToken.is(TokenKind.INTEGER)) {
            eatAndAdvance(TokenKind.INTEGER);
            return TypeSpec.INTEGER;
        }
        if (currentToken.is(TokenKind.REAL)) {
            eatAndAdvance(TokenKind.REAL);
            return TypeSpec.REAL;
        }
        throw unexpected("type 'integer' or 'real'");
    }

    private Node.StatementList compound() {
        enter();
        eatAndAdvance(TokenKind.BEGIN);
        var node = statementList();
        eatAndAdvance(TokenKind.END);
        leave();
        return node;
    }

    private Node.StatementList statementList() {
        var children = new ArrayList<Node>();
        children.add(statement());
        while (currentToken.is(TokenKind.SEMICOLON)) {
            eatAndAdvance(TokenKind.SEMICOLON);
            children.add(statement());
        }
        return new Node.StatementList(children);
    }

    private Node statement() {
        if (currentToken.is(TokenKind.BEGIN)) {
            return compound();
        }
        if (currentToken.is(TokenKind.IDENTIFIER)) {
            return assignment();
        }
        // Empty statement: nothing consumed
        return new Node.NoOp();
    }

    private Node.Assignment assignment() {
        var target = identifier();
        eatAndAdvance(TokenKind.ASSIGN);
        return new Node.Assignment(target, expr());
    }

    private Node expr() {
        var node = term();
        var operators = 0;
        while (currentToken.is(TokenKind.PLUS) || currentToken.is(TokenKind.MINUS)) {
            var operator = currentToken.is(TokenKind.PLUS)
                           ? BinaryOperator.PLUS
                           : BinaryOperator.MINUS;
            enter();
            operators++;
            eatAndAdvance(currentToken.kind());
            node = new Node.BinaryOp(node, term(), operator);
        }
        leave(operators);
        return node;
    }

    private Node term() {
        var node = factor();
        var operators = 0;
        while (true) {
            BinaryOperator operator;
            if (currentToken.is(TokenKind.MUL)) {
                operator = BinaryOperator.MUL;
            } else if (currentToken.is(TokenKind.INTEGER_DIV)) {
                operator = BinaryOperator.INTEGER_DIV;
            } else if (currentToken.is(TokenKind.FLOAT_DIV)) {
                operator = BinaryOperator.FLOAT_DIV;
            } else {
                leave(operators);
                return node;
            }
            enter();
            operators++;
            eatAndAdvance(currentToken.kind());
            node = new Node.BinaryOp(node, factor(), operator);
        }
    }

    private Node factor() {
        var token = currentToken;
        switch (token.kind()) {
            case PLUS, MINUS -> {
                var operator = token.is(TokenKind.PLUS)
                               ? UnaryOperator.PLUS
                               : UnaryOperator.MINUS;
                enter();
                eatAndAdvance(token.kind());
                var operand = factor();
                leave();
                return new Node.UnaryOp(operand, operator);
            }
            case INTEGER_CONSTANT -> {
                eatAndAdvance(TokenKind.INTEGER_CONSTANT);
                return new Node.NumberLiteral(integerValue(token));
            }
            case REAL_CONSTANT -> {
                eatAndAdvance(TokenKind.REAL_CONSTANT);
                return new Node.NumberLiteral(Numeric.of(Double.parseDouble(token.text())));
            }
            case LEFT_PAREN -> {
                enter();
                eatAndAdvance(TokenKind.LEFT_PAREN);
                var node = expr();
                eatAndAdvance(TokenKind.RIGHT_PAREN);
                leave();
                return node;
            }
            case IDENTIFIER -> {
                return new Node.VariableRef(identifier());
            }
            default -> throw unexpected("expression");
        }
    }

    private String identifier() {
        var token = currentToken;
        eatAndAdvance(TokenKind.IDENTIFIER);
        return token.text();
    }

    private Numeric integerValue(Token token) {
        try {
            return Numeric.of(Long.parseLong(token.text()));
        } catch (NumberFormatException e) {
            throw new PascalError.SyntaxError("Integer constant " + token.text() + " is out of range",
                                              token.span().start());
        }
    }

    /**
     * Consume the current token if it has the expected kind, otherwise fail.
     */
    private void eatAndAdvance(TokenKind expected) {
        if (!currentToken.is(expected)) {
            throw unexpected(expected.display());
        }
        currentToken = lexer.advance();
    }

    private void enter() {
        if (++depth > config.maxNestingDepth()) {
            throw new PascalError.SyntaxError("Nesting too deep (limit " + config.maxNestingDepth() + ")",
                                              currentToken.span().start());
        }
    }

    private void leave() {
        leave(1);
    }

    private void leave(int levels) {
        depth -= levels;
    }

    private PascalError.SyntaxError unexpected(String expected) {
        return new PascalError.SyntaxError(expected, currentToken.describe(), currentToken.span().start());
    }
}
