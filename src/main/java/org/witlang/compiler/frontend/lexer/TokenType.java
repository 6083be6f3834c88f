package org.witlang.compiler.frontend.lexer;

import org.witlang.compiler.types.BinaryOperator;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Punctuation.
    COLON,
    COMMA,
    /** The assignment operator {@code :=}. */
    ASSIGN,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    /** The address-of operator {@code &}. */
    AMPERSAND,

    // Operators.
    PLUS(BinaryOperator.ADD),
    MINUS(BinaryOperator.SUBTRACT),
    STAR(BinaryOperator.MULTIPLY),
    SLASH(BinaryOperator.DIVIDE),
    PERCENT(BinaryOperator.REMAINDER),
    SHIFT_LEFT(BinaryOperator.SHIFT_LEFT),
    SHIFT_RIGHT(BinaryOperator.SHIFT_RIGHT),

    // Literals.
    /** An identifier, such as a variable, type or procedure name. */
    IDENTIFIER,
    /** An integer literal, optionally suffixed with {@code l} for the 8-byte kind. */
    INTEGER,
    /** A character literal such as {@code 'a'}. */
    CHARACTER,

    // Keywords.
    VAR,
    BEGIN,
    END,
    EXPORT,
    AS,

    /** Represents the end of the source file. */
    END_OF_FILE;

    private final BinaryOperator binaryOperator;

    TokenType() {
        this(null);
    }

    TokenType(BinaryOperator binaryOperator) {
        this.binaryOperator = binaryOperator;
    }

    /**
     * @return {@code true} if the token can stand between two operands.
     */
    public boolean isBinaryOperator() {
        return binaryOperator != null;
    }

    /**
     * @return The operator this token denotes, or {@code null} if it is not a binary operator.
     */
    public BinaryOperator binaryOperator() {
        return binaryOperator;
    }

    /**
     * @return {@code true} for the prefix operators {@code &} and {@code -}.
     */
    public boolean isUnaryOperator() {
        return this == AMPERSAND || this == MINUS;
    }
}
