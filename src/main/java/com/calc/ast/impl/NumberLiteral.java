package com.calc.ast.impl;

import com.calc.ast.Node;
import com.calc.ast.NodeType;

/**
 * Numeric literal leaf.
 */
public class NumberLiteral implements Node {

    private final Number value;

    public NumberLiteral(Number value) {
        this.value = value;
    }

    @Override
    public Number evaluate() {
        return value;
    }

    @Override
    public NodeType getType() {
        return NodeType.NUMBER;
    }

    public Number getValue() {
        return value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
