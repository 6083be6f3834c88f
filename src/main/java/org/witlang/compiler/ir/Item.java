package org.witlang.compiler.ir;

import org.witlang.compiler.types.Type;

/**
 * The compile-time representation of an expression result. The set of variants is closed:
 * a constant, a value held in a register, a memory operand, or no value at all.
 */
public sealed interface Item permits ConstItem, RegItem, MemItem, VoidItem {

    /**
     * @return The type of the value.
     */
    Type type();

    /**
     * @return {@code true} if the address of the value can be taken. Only memory operands are addressable.
     */
    boolean isAddressable();

    /**
     * Reinterprets the value as another type without touching its storage.
     *
     * @param type The new type.
     * @return A copy of this item with the given type.
     */
    Item retype(Type type);
}
