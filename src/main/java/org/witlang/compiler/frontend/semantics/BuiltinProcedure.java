package org.witlang.compiler.frontend.semantics;

import org.witlang.compiler.types.BuiltinType;
import org.witlang.compiler.types.Type;

import java.util.List;
import java.util.Optional;

/**
 * A procedure implemented directly by the code generator.
 *
 * @param name The name in the global scope.
 * @param builtin Which builtin this is.
 * @param returnType The result type, if any.
 * @param parameterTypes The parameter types.
 */
public record BuiltinProcedure(String name, Builtin builtin, Optional<Type> returnType, List<Type> parameterTypes)
        implements Procedure {

    /**
     * The fixed set of builtins.
     */
    public enum Builtin {
        /** Writes a newline to standard output. */
        WRITE_ELN,
        /** Converts a decimal digit character to its value. */
        DIGIT_TO_INT
    }

    /** {@code write_eln} */
    public static final BuiltinProcedure WRITE_ELN =
            new BuiltinProcedure("write_eln", Builtin.WRITE_ELN, Optional.empty(), List.of());

    /** {@code d2i(Char): Byte} */
    public static final BuiltinProcedure DIGIT_TO_INT =
            new BuiltinProcedure("d2i", Builtin.DIGIT_TO_INT, Optional.of(BuiltinType.BYTE), List.of(BuiltinType.CHAR));
}
