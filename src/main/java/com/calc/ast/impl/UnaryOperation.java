package com.calc.ast.impl;

import com.calc.ast.Arithmetic;
import com.calc.ast.Node;
import com.calc.ast.NodeType;
import com.calc.evaluator.EvalError;
import com.calc.exception.EvaluationException;

/**
 * Unary sign operation.
 */
public class UnaryOperation implements Node {

    private final NodeType type;
    private final Node operand;

    public UnaryOperation(NodeType type, Node operand) {
        if (type == null || !type.isUnary()) {
            throw new EvaluationException(EvalError.unsupported("Not a unary operator: " + type));
        }
        this.type = type;
        this.operand = operand;
    }

    @Override
    public Number evaluate() {
        Number value = operand.evaluate();
        return type == NodeType.NEGATE ? Arithmetic.negate(value) : value;
    }

    @Override
    public NodeType getType() {
        return type;
    }

    public Node getOperand() {
        return operand;
    }

    @Override
    public String toString() {
        return type.getSymbol() + operand;
    }
}
