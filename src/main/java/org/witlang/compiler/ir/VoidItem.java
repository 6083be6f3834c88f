package org.witlang.compiler.ir;

import org.witlang.compiler.diagnostics.InternalCompilerError;
import org.witlang.compiler.types.Type;

/**
 * The absence of a value, produced by procedures without a result.
 */
public record VoidItem() implements Item {

    public static final VoidItem INSTANCE = new VoidItem();

    @Override
    public Type type() {
        throw new InternalCompilerError("Void item has no type");
    }

    @Override
    public boolean isAddressable() {
        return false;
    }

    @Override
    public Item retype(Type type) {
        throw new InternalCompilerError("Called retype on void item");
    }
}
