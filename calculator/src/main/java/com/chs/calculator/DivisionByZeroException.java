package com.chs.calculator;

/**
 * Raised when the divisor of a division is zero. Reported to the caller as a 400.
 */
public class DivisionByZeroException extends RuntimeException {

    public static final String MESSAGE = "Division by zero is not allowed";

    public DivisionByZeroException() {
        super(MESSAGE);
    }
}
