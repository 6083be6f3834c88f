package org.witlang.compiler.types;

/**
 * A type of the language. The set of variants is closed: builtin integer kinds,
 * pointers and fixed-size arrays. Equality is structural.
 */
public sealed interface Type permits BuiltinType, DerivedType {

    /** Size of a pointer in bytes on the target machine. */
    int POINTER_SIZE = 8;

    /**
     * @return The size of a value of this type in bytes.
     */
    int size();

    /**
     * @return The type as it would be written in source, for diagnostics.
     */
    String displayName();

    /**
     * @return {@code true} if values of this type can be indexed.
     */
    boolean indexes();

    /**
     * @param index The type of the prospective index expression.
     * @return {@code true} if values of this type can be indexed with a value of the given type.
     */
    boolean indexesWith(Type index);

    /**
     * @return {@code true} if values of this type can be used to index a pointer or array.
     */
    boolean isIndex();

    /**
     * @param op The binary operator.
     * @return {@code true} if this type may appear as the left operand of {@code op}.
     */
    boolean supports(BinaryOperator op);

    /**
     * @param op The binary operator.
     * @param other The type of the right operand.
     * @return {@code true} if {@code op} is legal between this type and {@code other}.
     */
    boolean supportsWith(BinaryOperator op, Type other);
}
