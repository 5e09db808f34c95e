package com.calc.evaluator;

import com.calc.ast.Node;
import com.calc.ast.NodeType;
import com.calc.ast.impl.BinaryOperation;
import com.calc.ast.impl.NumberLiteral;
import com.calc.ast.impl.UnaryOperation;
import com.calc.exception.EvaluationException;

import java.util.List;

/**
 * Parser for arithmetic expressions.
 * Converts tokens into a syntax tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: unary > ** > * / % > + -):
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := factor (('*' | '/' | '%') factor)*
 * factor     := unary ('**' factor)?
 * unary      := ('-' | '+') unary | atom
 * atom       := NUMBER | '(' expression ')'
 * </pre>
 * No production accepts an identifier, so names and calls can never reach
 * the tree.
 */
public final class ExpressionParser {

    static final int MAX_NESTING = 256;

    private final String input;
    private final List<Token> tokens;
    private int index;
    private int nesting;

    public ExpressionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
        this.nesting = 0;
    }

    /**
     * Parse the token stream into a syntax tree.
     *
     * @return Root node
     * @throws EvaluationException with a SYNTAX_ERROR error
     */
    public Node parse() {
        if (isAtEnd()) {
            throw error("Empty expression");
        }
        Node result = parseExpression();
        if (!isAtEnd()) {
            throw error("Unexpected " + describe(peek()));
        }
        return result;
    }

    private Node parseExpression() {
        Node left = parseTerm();

        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            Node right = parseTerm();
            left = binary(operator, left, right);
        }

        return left;
    }

    private Node parseTerm() {
        Node left = parseFactor();

        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token operator = previous();
            Node right = parseFactor();
            left = binary(operator, left, right);
        }

        return left;
    }

    private Node parseFactor() {
        Node base = parseUnary();

        if (match(TokenType.POWER)) {
            Token operator = previous();
            enter();
            Node exponent = parseFactor();
            exit();
            return binary(operator, base, exponent);
        }

        return base;
    }

    private Node parseUnary() {
        if (match(TokenType.UNARY_MINUS, TokenType.UNARY_PLUS)) {
            Token operator = previous();
            enter();
            Node operand = parseUnary();
            exit();
            NodeType type = operator.type() == TokenType.UNARY_MINUS ? NodeType.NEGATE : NodeType.IDENTITY;
            return new UnaryOperation(type, operand);
        }
        return parseAtom();
    }

    private Node parseAtom() {
        if (match(TokenType.NUMBER)) {
            return new NumberLiteral(previous().literal());
        }

        // Parenthesized expression
        if (match(TokenType.LPAREN)) {
            Token open = previous();
            enter();
            Node expr = parseExpression();
            exit();
            if (!match(TokenType.RPAREN)) {
                throw error("Unmatched '(' at position " + open.position());
            }
            return expr;
        }

        throw error("Expected number or '(' but found " + describe(peek()));
    }

    private Node binary(Token operator, Node left, Node right) {
        NodeType type = switch (operator.type()) {
            case PLUS -> NodeType.ADD;
            case MINUS -> NodeType.SUBTRACT;
            case STAR -> NodeType.MULTIPLY;
            case SLASH -> NodeType.DIVIDE;
            case PERCENT -> NodeType.MODULO;
            case POWER -> NodeType.POWER;
            default -> throw new EvaluationException(
                    EvalError.unsupported("Unsupported operator '" + operator.text() + "'"));
        };
        return new BinaryOperation(type, left, right);
    }

    private void enter() {
        if (++nesting > MAX_NESTING) {
            throw error("Expression nested too deeply");
        }
    }

    private void exit() {
        nesting--;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private String describe(Token token) {
        return switch (token.type()) {
            case EOF -> "end of expression";
            case IDENT -> "identifier '" + token.text() + "'";
            default -> "'" + token.text() + "'";
        };
    }

    private EvaluationException error(String message) {
        int position = peek().position();
        return new EvaluationException(EvalError.syntax(position,
                message + " in '" + input + "'"));
    }
}
