package org.witlang.compiler.types;

/**
 * A pointer to a value of the base type. Always {@link Type#POINTER_SIZE} bytes wide.
 *
 * @param base The pointee type.
 */
public record PointerType(Type base) implements DerivedType {

    @Override
    public int size() {
        return POINTER_SIZE;
    }

    @Override
    public String displayName() {
        return base.displayName() + "*";
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
        return true;
    }

    /**
     * Pointer arithmetic works against any builtin and against pointers to the same base.
     */
    @Override
    public boolean supportsWith(BinaryOperator op, Type other) {
        if (other instanceof PointerType pointer) {
            return base.equals(pointer.base());
        }
        return other instanceof BuiltinType;
    }

    @Override
    public String toString() {
        return displayName();
    }
}
