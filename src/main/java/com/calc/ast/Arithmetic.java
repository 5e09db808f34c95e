package com.calc.ast;

import com.calc.evaluator.EvalError;
import com.calc.exception.EvaluationException;

import java.math.BigInteger;

/**
 * Numeric operations over exact integers ({@link Long}, or {@link BigInteger}
 * once a value no longer fits in a long) and {@link Double} operands.
 * <p>
 * Exact operands give exact results, except for {@code /} and negative
 * exponents. An exact value is a Long whenever it fits in one. Every returned
 * double is finite, and exact values are limited to {@link #MAX_EXACT_BITS} bits.
 */
public final class Arithmetic {

    /**
     * Largest exact integer kept, in bits (about 19,700 decimal digits).
     */
    public static final int MAX_EXACT_BITS = 65_536;

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private Arithmetic() {
    }

    public static Number add(Number left, Number right) {
        if (left instanceof Long l && right instanceof Long r) {
            try {
                return Math.addExact(l, r);
            } catch (ArithmeticException e) {
                return exact(BigInteger.valueOf(l).add(BigInteger.valueOf(r)));
            }
        }
        if (isExact(left) && isExact(right)) {
            return exact(toBigInteger(left).add(toBigInteger(right)));
        }
        return finite(toDouble(left) + toDouble(right));
    }

    public static Number subtract(Number left, Number right) {
        if (left instanceof Long l && right instanceof Long r) {
            try {
                return Math.subtractExact(l, r);
            } catch (ArithmeticException e) {
                return exact(BigInteger.valueOf(l).subtract(BigInteger.valueOf(r)));
            }
        }
        if (isExact(left) && isExact(right)) {
            return exact(toBigInteger(left).subtract(toBigInteger(right)));
        }
        return finite(toDouble(left) - toDouble(right));
    }

    public static Number multiply(Number left, Number right) {
        if (left instanceof Long l && right instanceof Long r) {
            try {
                return Math.multiplyExact(l, r);
            } catch (ArithmeticException e) {
                return exact(BigInteger.valueOf(l).multiply(BigInteger.valueOf(r)));
            }
        }
        if (isExact(left) && isExact(right)) {
            BigInteger l = toBigInteger(left);
            BigInteger r = toBigInteger(right);
            if (l.bitLength() + r.bitLength() > MAX_EXACT_BITS + 1) {
                throw tooLarge();
            }
            return exact(l.multiply(r));
        }
        return finite(toDouble(left) * toDouble(right));
    }

    /**
     * Real division; the result is always a double.
     */
    public static Number divide(Number left, Number right) {
        requireNonZero(right, "Division by zero");
        return finite(toDouble(left) / toDouble(right));
    }

    /**
     * Floored remainder: the result takes the sign of the divisor.
     */
    public static Number modulo(Number left, Number right) {
        requireNonZero(right, "Modulo by zero");
        if (left instanceof Long l && right instanceof Long r) {
            return Math.floorMod(l, r);
        }
        if (isExact(left) && isExact(right)) {
            BigInteger divisor = toBigInteger(right);
            BigInteger remainder = toBigInteger(left).mod(divisor.abs());
            if (divisor.signum() < 0 && remainder.signum() != 0) {
                remainder = remainder.add(divisor);
            }
            return exact(remainder);
        }
        double divisor = toDouble(right);
        double remainder = toDouble(left) % divisor;
        if (remainder != 0 && (remainder < 0) != (divisor < 0)) {
            remainder += divisor;
        }
        return finite(remainder);
    }

    public static Number power(Number base, Number exponent) {
        if (isExact(base) && isExact(exponent)) {
            BigInteger b = toBigInteger(base);
            BigInteger e = toBigInteger(exponent);
            if (b.signum() == 0 && e.signum() < 0) {
                throw new EvaluationException(EvalError.divisionByZero("Zero raised to a negative power"));
            }
            if (e.signum() >= 0) {
                return exactPower(b, e);
            }
        }

        double b = toDouble(base);
        double e = toDouble(exponent);

        if (b == 0 && e < 0) {
            throw new EvaluationException(EvalError.divisionByZero("Zero raised to a negative power"));
        }
        if (b < 0 && e != Math.rint(e)) {
            throw new EvaluationException(EvalError.domain(
                    "Negative base " + base + " with fractional exponent " + exponent));
        }
        return finite(Math.pow(b, e));
    }

    public static Number negate(Number operand) {
        if (operand instanceof Long value) {
            try {
                return Math.negateExact(value);
            } catch (ArithmeticException e) {
                return exact(BigInteger.valueOf(value).negate());
            }
        }
        if (operand instanceof BigInteger value) {
            return exact(value.negate());
        }
        return -operand.doubleValue();
    }

    public static boolean isExact(Number value) {
        return value instanceof Long || value instanceof BigInteger;
    }

    /**
     * Narrow an exact value to a Long when it fits.
     *
     * @throws EvaluationException with an OVERFLOW error beyond {@link #MAX_EXACT_BITS} bits
     */
    public static Number exact(BigInteger value) {
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return value.longValue();
        }
        if (value.bitLength() > MAX_EXACT_BITS) {
            throw tooLarge();
        }
        return value;
    }

    private static Number exactPower(BigInteger base, BigInteger exponent) {
        if (base.abs().compareTo(BigInteger.ONE) <= 0) {
            if (base.signum() == 0) {
                return exponent.signum() == 0 ? 1L : 0L;
            }
            return base.signum() < 0 && exponent.testBit(0) ? -1L : 1L;
        }
        // |base| >= 2: the result has at least (bitLength - 1) * exponent bits
        if (exponent.bitLength() > 31 || (long) (base.abs().bitLength() - 1) * exponent.intValue() > MAX_EXACT_BITS) {
            throw tooLarge();
        }
        return exact(base.pow(exponent.intValue()));
    }

    private static BigInteger toBigInteger(Number value) {
        return value instanceof BigInteger big ? big : BigInteger.valueOf(value.longValue());
    }

    private static double toDouble(Number value) {
        double result = value.doubleValue();
        if (Double.isInfinite(result)) {
            throw tooLarge();
        }
        return result;
    }

    private static void requireNonZero(Number divisor, String message) {
        boolean zero = divisor instanceof BigInteger big ? big.signum() == 0 : divisor.doubleValue() == 0;
        if (zero) {
            throw new EvaluationException(EvalError.divisionByZero(message));
        }
    }

    private static Double finite(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw tooLarge();
        }
        return value;
    }

    private static EvaluationException tooLarge() {
        return new EvaluationException(EvalError.overflow("Result too large"));
    }
}
