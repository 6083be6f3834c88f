package org.witlang.compiler.types;

/**
 * The binary operators of the language, together with their precedence.
 * All operators are left-associative; a higher precedence binds tighter.
 */
public enum BinaryOperator {
    /** Left shift, {@code <<}. */
    SHIFT_LEFT("<<", 0),
    /** Right shift, {@code >>}. */
    SHIFT_RIGHT(">>", 0),
    /** Addition, {@code +}. */
    ADD("+", 1),
    /** Subtraction, {@code -}. */
    SUBTRACT("-", 1),
    /** Multiplication, {@code *}. */
    MULTIPLY("*", 2),
    /** Division, {@code /}. */
    DIVIDE("/", 2),
    /** Remainder, {@code %}. */
    REMAINDER("%", 2);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    /**
     * @return The operator as written in source code.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * @return The binding strength of the operator.
     */
    public int precedence() {
        return precedence;
    }

    /**
     * Multiplicative operators are bound to the accumulator on x86-64.
     * @return {@code true} for {@code *}, {@code /} and {@code %}.
     */
    public boolean isMultiplicative() {
        return this == MULTIPLY || this == DIVIDE || this == REMAINDER;
    }

    /**
     * @return {@code true} for {@code <<} and {@code >>}.
     */
    public boolean isShift() {
        return this == SHIFT_LEFT || this == SHIFT_RIGHT;
    }
}
