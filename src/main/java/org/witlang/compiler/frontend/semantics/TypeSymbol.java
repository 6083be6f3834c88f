package org.witlang.compiler.frontend.semantics;

import org.witlang.compiler.types.Type;

/**
 * A named type.
 *
 * @param name The type name.
 * @param type The type it denotes.
 */
public record TypeSymbol(String name, Type type) implements Symbol {}
