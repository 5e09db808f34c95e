package com.calc.ast;

/**
 * Node of an arithmetic syntax tree. Each node exclusively owns its children.
 */
public interface Node {

    /**
     * Evaluate this subtree.
     *
     * @return A {@link Long} or {@link java.math.BigInteger} when the result is exact,
     *         a finite {@link Double} otherwise
     * @throws com.calc.exception.EvaluationException on division by zero, domain error or overflow
     */
    Number evaluate();

    /**
     * Get the node type.
     */
    NodeType getType();
}
