package org.witlang.compiler.ir;

import org.witlang.compiler.isa.Register;
import org.witlang.compiler.types.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * A value in memory at {@code [label + base + index*scale + offset]}. Any of label, base and
 * index may be absent.
 *
 * @param type The type of the value stored at the address.
 * @param label A data label, or {@code null}.
 * @param base The base register, or {@code null}.
 * @param index The index register, or {@code null}.
 * @param scale The multiplier applied to the index register (1, 2, 4 or 8).
 * @param offset The constant displacement in bytes.
 */
public record MemItem(Type type, String label, Register base, Register index, int scale, long offset) implements Item {

    /**
     * @param label The label of a global variable.
     * @param type The variable type.
     * @return A memory operand addressing the label.
     */
    public static MemItem global(String label, Type type) {
        return new MemItem(type, label, null, null, 1, 0);
    }

    /**
     * @param base The register holding the base address.
     * @param offset The displacement relative to the base.
     * @param type The type of the addressed value.
     * @return A memory operand relative to a register.
     */
    public static MemItem relative(Register base, long offset, Type type) {
        return new MemItem(type, null, base, null, 1, offset);
    }

    @Override
    public boolean isAddressable() {
        return true;
    }

    @Override
    public MemItem retype(Type type) {
        return new MemItem(type, label, base, index, scale, offset);
    }

    /**
     * @return The registers this operand depends on.
     */
    public List<Register> registers() {
        List<Register> registers = new ArrayList<>(2);
        if (base != null) registers.add(base);
        if (index != null) registers.add(index);
        return registers;
    }

    /**
     * Renders the effective address in NASM syntax, without a size keyword.
     * @return e.g. {@code [wit$global$x]}, {@code [rbp-8]} or {@code [r8+r9*4]}.
     */
    public String address() {
        StringBuilder sb = new StringBuilder("[");
        if (label != null) {
            sb.append(label);
        }
        if (base != null) {
            if (sb.length() > 1) sb.append('+');
            sb.append(base.name(Type.POINTER_SIZE));
        }
        if (index != null) {
            if (sb.length() > 1) sb.append('+');
            sb.append(index.name(Type.POINTER_SIZE));
            if (scale != 1) sb.append('*').append(scale);
        }
        if (offset != 0 || sb.length() == 1) {
            if (offset >= 0 && sb.length() > 1) sb.append('+');
            sb.append(offset);
        }
        return sb.append(']').toString();
    }
}
