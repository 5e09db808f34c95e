package com.calc.evaluator;

import com.calc.ast.Node;
import com.calc.ast.NodeType;
import com.calc.ast.impl.BinaryOperation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionParser tree shape.
 */
class ExpressionParserTest {

    private Node parse(String input) {
        return new ExpressionParser(input, new ExpressionTokenizer(input).tokenize()).parse();
    }

    @Test
    @DisplayName("Multiplication binds tighter than addition")
    void shouldRespectPrecedence() {
        Node root = parse("1 + 2 * 3");

        assertEquals(NodeType.ADD, root.getType());
        assertEquals(NodeType.MULTIPLY, ((BinaryOperation) root).getRight().getType());
        assertEquals("(1 + (2 * 3))", root.toString());
    }

    @Test
    @DisplayName("Subtraction is left-associative")
    void shouldAssociateSubtractionLeft() {
        assertEquals("((8 - 4) - 2)", parse("8 - 4 - 2").toString());
    }

    @Test
    @DisplayName("Power is right-associative")
    void shouldAssociatePowerRight() {
        assertEquals("(2 ** (3 ** 2))", parse("2**3**2").toString());
    }

    @Test
    @DisplayName("Unary sign applies to the power base")
    void shouldBindUnaryTighterThanPower() {
        assertEquals("(-2 ** 2)", parse("-2**2").toString());
        assertEquals("(2 ** -1)", parse("2**-1").toString());
    }

    @Test
    @DisplayName("Parentheses override precedence")
    void shouldGroupWithParentheses() {
        Node root = parse("(1 + 2) * 3");

        assertEquals(NodeType.MULTIPLY, root.getType());
        assertEquals("((1 + 2) * 3)", root.toString());
    }
}
