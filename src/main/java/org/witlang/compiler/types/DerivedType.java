package org.witlang.compiler.types;

/**
 * A type built on top of another type.
 */
public sealed interface DerivedType extends Type permits PointerType, ArrayType {

    /**
     * @return The type this type is derived from, i.e. the element or pointee type.
     */
    Type base();
}
