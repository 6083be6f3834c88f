package org.witlang.compiler.ir;

import org.witlang.compiler.types.Type;

/**
 * A value known at compile time.
 *
 * @param type The type of the constant.
 * @param value The numeric value.
 */
public record ConstItem(Type type, long value) implements Item {

    @Override
    public boolean isAddressable() {
        return false;
    }

    /**
     * Narrowing keeps only the low bytes of the value, as a runtime cast would.
     */
    @Override
    public ConstItem retype(Type type) {
        int width = type.size();
        if (width < this.type.size() && width < Long.BYTES) {
            return new ConstItem(type, value & ((1L << (width * Byte.SIZE)) - 1));
        }
        return new ConstItem(type, value);
    }

    /**
     * @return {@code true} if the value can be encoded as a sign-extended 32-bit immediate.
     */
    public boolean fitsImmediate() {
        return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }
}
