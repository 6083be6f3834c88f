package org.witlang.compiler.frontend.semantics;

/**
 * An entity a name in scope can resolve to: a variable, a type or a procedure.
 */
public sealed interface Symbol permits Variable, TypeSymbol, Procedure {

    /**
     * @return The name under which the symbol is declared.
     */
    String name();
}
