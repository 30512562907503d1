package com.chs.calculator;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The arithmetic operations exposed under {@code /post}.
 */
@Getter
@RequiredArgsConstructor
public enum ArithmeticOperation {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String symbol;
}
