package org.witlang.compiler.types;

/**
 * A fixed-size array. The element count is a compile-time constant.
 *
 * @param base The element type.
 * @param count The number of elements, always positive.
 */
public record ArrayType(Type base, int count) implements DerivedType {

    public ArrayType {
        if (count <= 0) {
            throw new IllegalArgumentException("Array count must be positive, got " + count);
        }
    }

    /**
     * @throws ArithmeticException if the total size does not fit in an {@code int}.
     */
    @Override
    public int size() {
        return Math.multiplyExact(count, base.size());
    }

    /**
     * @return The innermost non-array element type.
     */
    public Type innermost() {
        Type type = base;
        while (type instanceof ArrayType nested) {
            type = nested.base();
        }
        return type;
    }

    @Override
    public String displayName() {
        return base.displayName() + "[" + count + "]";
    }

    @Override
    public boolean indexes() {
        return true;
    }

    @Override
    public boolean indexesWith(Type index) {
        return index.isIndex();
    }

    @Override
    public boolean isIndex() {
        return false;
    }

    @Override
    public boolean supports(BinaryOperator op) {
        return false;
    }

    @Override
    public boolean supportsWith(BinaryOperator op, Type other) {
        return false;
    }

    @Override
    public String toString() {
        return displayName();
    }
}
