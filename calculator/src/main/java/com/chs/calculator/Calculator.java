package com.chs.calculator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Pure arithmetic behind the calculator endpoints.
 *
 * <p>When both operands are integers, addition, subtraction and multiplication are exact and
 * yield an integer. Any floating-point operand switches the operation to {@code double}.
 * Division always yields a {@code double}.
 */
@Slf4j
@Service
public class Calculator {

    public Number calculate(ArithmeticOperation op, Number a, Number b) {
        Number result = switch (op) {
            case ADD -> add(a, b);
            case SUBTRACT -> subtract(a, b);
            case MULTIPLY -> multiply(a, b);
            case DIVIDE -> divide(a, b);
        };
        log.debug("{} {} {} = {}", a, op.getSymbol(), b, result);
        return result;
    }

    public Number add(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return narrow(toBigInteger(a).add(toBigInteger(b)));
        }
        return finite(a.doubleValue() + b.doubleValue());
    }

    public Number subtract(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return narrow(toBigInteger(a).subtract(toBigInteger(b)));
        }
        return finite(a.doubleValue() - b.doubleValue());
    }

    public Number multiply(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return narrow(toBigInteger(a).multiply(toBigInteger(b)));
        }
        return finite(a.doubleValue() * b.doubleValue());
    }

    public double divide(Number a, Number b) {
        if (isZero(b)) {
            throw new DivisionByZeroException();
        }
        if (isBig(a) || isBig(b)) {
            // operands beyond double range still have a representable quotient
            return finite(toBigDecimal(a).divide(toBigDecimal(b), MathContext.DECIMAL64).doubleValue());
        }
        return finite(a.doubleValue() / b.doubleValue());
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short
                || n instanceof Byte || n instanceof BigInteger;
    }

    private static boolean isBig(Number n) {
        return n instanceof BigInteger || n instanceof BigDecimal;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal) {
            return (BigDecimal) n;
        }
        if (n instanceof BigInteger) {
            return new BigDecimal((BigInteger) n);
        }
        return isIntegral(n) ? BigDecimal.valueOf(n.longValue()) : BigDecimal.valueOf(n.doubleValue());
    }

    private static boolean isZero(Number n) {
        if (n instanceof BigInteger) {
            return ((BigInteger) n).signum() == 0;
        }
        if (n instanceof BigDecimal) {
            return ((BigDecimal) n).signum() == 0;
        }
        return n.doubleValue() == 0.0;
    }

    private static BigInteger toBigInteger(Number n) {
        return n instanceof BigInteger ? (BigInteger) n : BigInteger.valueOf(n.longValue());
    }

    private static Number narrow(BigInteger value) {
        return value.bitLength() < Long.SIZE ? (Number) value.longValue() : value;
    }

    // JSON has no representation for infinity or NaN
    private static double finite(double value) {
        if (!Double.isFinite(value)) {
            throw new ArithmeticException("Result is not a finite number: " + value);
        }
        return value;
    }
}
