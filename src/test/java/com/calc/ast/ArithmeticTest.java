package com.calc.ast;

import com.calc.evaluator.ErrorType;
import com.calc.exception.EvaluationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Arithmetic.
 */
class ArithmeticTest {

    @Test
    @DisplayName("Long operands stay exact")
    void shouldKeepLongsExact() {
        assertEquals(7L, Arithmetic.add(3L, 4L));
        assertEquals(-1L, Arithmetic.subtract(3L, 4L));
        assertEquals(12L, Arithmetic.multiply(3L, 4L));
        assertEquals(1024L, Arithmetic.power(2L, 10L));
        assertEquals(-27L, Arithmetic.power(-3L, 3L));
        assertTrue(Arithmetic.isExact(Arithmetic.add(3L, 4L)));
    }

    @Test
    @DisplayName("A double operand makes the result a double")
    void shouldPromoteToDouble() {
        assertEquals(7.5, Arithmetic.add(3L, 4.5));
        assertEquals(9.0, Arithmetic.multiply(3.0, 3L));
        assertFalse(Arithmetic.isExact(Arithmetic.multiply(3.0, 3L)));
    }

    @Test
    @DisplayName("Division is always real")
    void shouldDivideReal() {
        assertEquals(2.0, Arithmetic.divide(4L, 2L));
        assertEquals(0.25, Arithmetic.divide(1L, 4L));
    }

    @Test
    @DisplayName("Modulo follows the sign of the divisor")
    void shouldFloorModulo() {
        assertEquals(1L, Arithmetic.modulo(10L, 3L));
        assertEquals(2L, Arithmetic.modulo(-1L, 3L));
        assertEquals(-2L, Arithmetic.modulo(1L, -3L));
        assertEquals(0.5, Arithmetic.modulo(-1.5, 2L));
        assertEquals(0.0, Arithmetic.modulo(4.0, 2L));
    }

    @Test
    @DisplayName("Long overflow promotes to BigInteger")
    void shouldPromoteOnOverflow() {
        BigInteger max = BigInteger.valueOf(Long.MAX_VALUE);

        assertEquals(max.add(BigInteger.ONE), Arithmetic.add(Long.MAX_VALUE, 1L));
        assertEquals(max.multiply(BigInteger.TWO), Arithmetic.multiply(Long.MAX_VALUE, 2L));
        assertEquals(max.add(BigInteger.ONE), Arithmetic.negate(Long.MIN_VALUE));
        assertEquals(BigInteger.valueOf(Long.MIN_VALUE).subtract(BigInteger.ONE),
                Arithmetic.subtract(Long.MIN_VALUE, 1L));
        assertTrue(Arithmetic.isExact(Arithmetic.add(Long.MAX_VALUE, 1L)));
    }

    @Test
    @DisplayName("Exact values that fit a long are narrowed back")
    void shouldNarrowToLong() {
        Number big = Arithmetic.add(Long.MAX_VALUE, 1L);

        assertEquals(Long.MAX_VALUE, Arithmetic.subtract(big, 1L));
        assertEquals(0L, Arithmetic.modulo(big, 2L));
        assertEquals(7L, Arithmetic.exact(BigInteger.valueOf(7)));
    }

    @Test
    @DisplayName("Exact powers beyond a long stay exact up to the size limit")
    void shouldComputeBigPowers() {
        assertEquals(new BigInteger("12157665459056928801"), Arithmetic.power(3L, 40L));
        assertEquals(BigInteger.TWO.pow(Arithmetic.MAX_EXACT_BITS - 1),
                Arithmetic.power(2L, (long) Arithmetic.MAX_EXACT_BITS - 1));
        assertEquals(-1L, Arithmetic.power(-1L, 1_000_000_001L));
        assertEquals(0L, Arithmetic.power(0L, 1_000_000_000_000L));

        assertEquals(ErrorType.OVERFLOW, assertThrows(EvaluationException.class,
                () -> Arithmetic.power(2L, (long) Arithmetic.MAX_EXACT_BITS + 1)).getError().type());
        assertEquals(ErrorType.OVERFLOW, assertThrows(EvaluationException.class,
                () -> Arithmetic.power(-2L, 1_000_000_000L)).getError().type());
        assertEquals(ErrorType.OVERFLOW, assertThrows(EvaluationException.class,
                () -> Arithmetic.exact(BigInteger.ONE.shiftLeft(Arithmetic.MAX_EXACT_BITS))).getError().type());
    }

    @Test
    @DisplayName("Zero divisor is reported as division by zero")
    void shouldRejectZeroDivisor() {
        assertEquals(ErrorType.DIVISION_BY_ZERO,
                assertThrows(EvaluationException.class, () -> Arithmetic.divide(1L, 0L)).getError().type());
        assertEquals(ErrorType.DIVISION_BY_ZERO,
                assertThrows(EvaluationException.class, () -> Arithmetic.modulo(1L, 0.0)).getError().type());
        assertEquals(ErrorType.DIVISION_BY_ZERO,
                assertThrows(EvaluationException.class, () -> Arithmetic.power(0L, -1L)).getError().type());
    }

    @Test
    @DisplayName("Negative base with fractional exponent is a domain error")
    void shouldRejectComplexResults() {
        EvaluationException e = assertThrows(EvaluationException.class,
                () -> Arithmetic.power(-4L, 0.5));

        assertEquals(ErrorType.DOMAIN_ERROR, e.getError().type());
        assertEquals(-1, e.getError().position());
    }

    @Test
    @DisplayName("Non-finite results are reported as overflow")
    void shouldRejectNonFinite() {
        EvaluationException e = assertThrows(EvaluationException.class,
                () -> Arithmetic.multiply(Double.MAX_VALUE, 2L));

        assertEquals(ErrorType.OVERFLOW, e.getError().type());
    }

    @Test
    @DisplayName("Negative base with integral double exponent is allowed")
    void shouldAllowIntegralDoubleExponent() {
        assertEquals(-8.0, Arithmetic.power(-2L, 3.0));
        assertEquals(0.25, Arithmetic.power(2L, -2L));
    }
}
