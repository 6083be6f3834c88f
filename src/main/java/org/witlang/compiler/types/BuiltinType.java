package org.witlang.compiler.types;

/**
 * One of the primitive integer kinds of the language.
 *
 * @param kind The builtin kind.
 */
public record BuiltinType(Kind kind) implements Type {

    /** The 1-byte integer type. */
    public static final BuiltinType BYTE = new BuiltinType(Kind.BYTE);
    /** The 1-byte character type. */
    public static final BuiltinType CHAR = new BuiltinType(Kind.CHAR);
    /** The 4-byte integer type. */
    public static final BuiltinType INT = new BuiltinType(Kind.INT);
    /** The 8-byte integer type. */
    public static final BuiltinType LONG = new BuiltinType(Kind.LONG);

    /**
     * The catalogue of builtin kinds and their sizes.
     */
    public enum Kind {
        BYTE("Byte", 1),
        CHAR("Char", 1),
        INT("Int", 4),
        LONG("Long", 8);

        private final String sourceName;
        private final int size;

        Kind(String sourceName, int size) {
            this.sourceName = sourceName;
            this.size = size;
        }

        public String sourceName() {
            return sourceName;
        }

        public int size() {
            return size;
        }
    }

    @Override
    public int size() {
        return kind.size();
    }

    @Override
    public String displayName() {
        return kind.sourceName();
    }

    @Override
    public boolean indexes() {
        return false;
    }

    @Override
    public boolean indexesWith(Type index) {
        return false;
    }

    @Override
    public boolean isIndex() {
        return true;
    }

    @Override
    public boolean supports(BinaryOperator op) {
        return true;
    }

    /**
     * Builtin kinds combine with each other; the narrower operand is widened.
     */
    @Override
    public boolean supportsWith(BinaryOperator op, Type other) {
        return other instanceof BuiltinType;
    }

    @Override
    public String toString() {
        return displayName();
    }
}
