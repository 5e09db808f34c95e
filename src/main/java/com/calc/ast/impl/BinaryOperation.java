package com.calc.ast.impl;

import com.calc.ast.Arithmetic;
import com.calc.ast.Node;
import com.calc.ast.NodeType;
import com.calc.evaluator.EvalError;
import com.calc.exception.EvaluationException;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Binary arithmetic operation (+, -, *, /, %, **).
 */
public class BinaryOperation implements Node {

    private final NodeType type;
    private final Node left;
    private final Node right;

    public BinaryOperation(NodeType type, Node left, Node right) {
        if (type == null || !type.isBinary()) {
            throw new EvaluationException(EvalError.unsupported("Not a binary operator: " + type));
        }
        this.type = type;
        this.left = left;
        this.right = right;
    }

    /**
     * Evaluate this operation. A left-associative chain such as {@code 1+2-3+4}
     * forms a left-deep tree; its left spine is walked in a loop so that chain
     * length does not grow the call stack.
     */
    @Override
    public Number evaluate() {
        if (type == NodeType.POWER) {
            return apply(type, left.evaluate(), right.evaluate());
        }

        Deque<BinaryOperation> spine = new ArrayDeque<>();
        Node node = this;
        while (node instanceof BinaryOperation operation && operation.type != NodeType.POWER) {
            spine.push(operation);
            node = operation.left;
        }

        Number value = node.evaluate();
        while (!spine.isEmpty()) {
            BinaryOperation operation = spine.pop();
            value = apply(operation.type, value, operation.right.evaluate());
        }
        return value;
    }

    private static Number apply(NodeType type, Number l, Number r) {
        return switch (type) {
            case ADD -> Arithmetic.add(l, r);
            case SUBTRACT -> Arithmetic.subtract(l, r);
            case MULTIPLY -> Arithmetic.multiply(l, r);
            case DIVIDE -> Arithmetic.divide(l, r);
            case MODULO -> Arithmetic.modulo(l, r);
            case POWER -> Arithmetic.power(l, r);
            default -> throw new EvaluationException(EvalError.unsupported("Not a binary operator: " + type));
        };
    }

    @Override
    public NodeType getType() {
        return type;
    }

    public Node getLeft() {
        return left;
    }

    public Node getRight() {
        return right;
    }

    @Override
    public String toString() {
        return "(" + left + " " + type.getSymbol() + " " + right + ")";
    }
}
