package org.witlang.compiler.frontend.semantics;

import org.witlang.compiler.types.Type;

import java.util.List;
import java.util.Optional;

/**
 * A callable entity.
 */
public sealed interface Procedure extends Symbol permits BuiltinProcedure {

    /**
     * @return The result type, or empty for procedures without a result.
     */
    Optional<Type> returnType();

    /**
     * @return The parameter types in declaration order.
     */
    List<Type> parameterTypes();
}
