package org.pragmatica.pascal;

import org.pragmatica.pascal.ast.Node;
import org.pragmatica.pascal.error.Diagnostic;
import org.pragmatica.pascal.error.PascalError;
import org.pragmatica.pascal.eval.Evaluation;
import org.pragmatica.pascal.eval.Evaluator;
import org.pragmatica.pascal.lexer.Lexer;
import org.pragmatica.pascal.lexer.Token;
import org.pragmatica.pascal.parser.Parser;
import org.pragmatica.pascal.parser.ParserConfig;
import org.pragmatica.pascal.translate.LispTranslator;
import org.pragmatica.pascal.translate.PostfixTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point for tokenizing, parsing, evaluating and translating Pascal source.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = PascalInterpreter.evaluate("""
 *     begin
 *       number := 2;
 *       b := 10 * number div 4
 *     end.
 *     """);
 *
 * result.variable("b"); // 5
 * }</pre>
 *
 * All failures are {@link PascalError} subclasses thrown to the caller.
 */
public final class PascalInterpreter {
    private static final Logger log = LoggerFactory.getLogger(PascalInterpreter.class);
    private static final PascalInterpreter DEFAULT = new PascalInterpreter(ParserConfig.DEFAULT);

    private final ParserConfig config;

    private PascalInterpreter(ParserConfig config) {
        this.config = config;
    }

    public static PascalInterpreter withConfig(ParserConfig config) {
        return new PascalInterpreter(config);
    }

    public static List<Token> tokenize(String source) {
        return DEFAULT.tokens(source);
    }

    /**
     * Parse a complete program, with optional header and declarations.
     */
    public static Node.Program parse(String source) {
        return DEFAULT.parseProgram(source);
    }

    /**
     * Parse a bare begin ... end compound without the trailing dot.
     */
    public static Node.StatementList parseCompound(String source) {
        return DEFAULT.parseCompoundStatement(source);
    }

    public static Node parseExpression(String source) {
        return DEFAULT.parseSingleExpression(source);
    }

    /**
     * Parse and evaluate a complete program.
     */
    public static Evaluation evaluate(String source) {
        return DEFAULT.run(source);
    }

    /**
     * Translate an arithmetic expression to reverse Polish notation.
     */
    public static String toPostfix(String expression) {
        return DEFAULT.postfix(expression);
    }

    /**
     * Translate an arithmetic expression to parenthesized prefix notation.
     */
    public static String toLisp(String expression) {
        return DEFAULT.lisp(expression);
    }

    /**
     * Render an error against the source that produced it.
     */
    public static String describe(PascalError error, String source) {
        return Diagnostic.of(error)
                         .format(source, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Token> tokens(String source) {
        var tokens = Lexer.tokenize(source, config.maxInputSize());
        log.debug("Tokenized {} characters into {} tokens", source.length(), tokens.size());
        return List.copyOf(tokens);
    }

    public Node.Program parseProgram(String source) {
        var program = Parser.forSource(source, config)
                            .parseProgram();
        log.debug("Parsed program {} with {} declarations",
                  program.name()
                         .orElse("<unnamed>"),
                  program.block()
                         .declarations()
                         .size());
        return program;
    }

    public Node.StatementList parseCompoundStatement(String source) {
        return Parser.forSource(source, config)
                     .parseCompound();
    }

    public Node parseSingleExpression(String source) {
        return Parser.forSource(source, config)
                     .parseExpression();
    }

    public Evaluation run(String source) {
        var evaluator = new Evaluator();
        evaluator.evaluate(parseProgram(source));
        var evaluation = Evaluation.of(evaluator);
        log.debug("Evaluated program: {}", evaluation.variables());
        return evaluation;
    }

    public String postfix(String expression) {
        return new PostfixTranslator().translate(parseSingleExpression(expression));
    }

    public String lisp(String expression) {
        return new LispTranslator().translate(parseSingleExpression(expression));
    }

    public static final class Builder {
        private int maxNestingDepth = ParserConfig.DEFAULT.maxNestingDepth();
        private int maxInputSize = ParserConfig.DEFAULT.maxInputSize();

        private Builder() {}

        public Builder maxNestingDepth(int depth) {
            this.maxNestingDepth = depth;
            return this;
        }

        public Builder maxInputSize(int size) {
            this.maxInputSize = size;
            return this;
        }

        public PascalInterpreter build() {
            return withConfig(new ParserConfig(maxNestingDepth, maxInputSize));
        }
    }
}
